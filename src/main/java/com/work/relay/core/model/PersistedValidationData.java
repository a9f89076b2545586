package com.work.relay.core.model;

/**
 * 平行链 ParachainSystem.ValidationData：区块被 backed 时的中继链上下文。
 */
public class PersistedValidationData {

    private final byte[] parentHead;
    private final long relayParentNumber;
    private final String relayParentStorageRoot;
    private final long maxPovSize;

    public PersistedValidationData(byte[] parentHead, long relayParentNumber, String relayParentStorageRoot, long maxPovSize) {
        this.parentHead = parentHead == null ? new byte[0] : parentHead.clone();
        this.relayParentNumber = relayParentNumber;
        this.relayParentStorageRoot = relayParentStorageRoot;
        this.maxPovSize = maxPovSize;
    }

    public byte[] getParentHead() {
        return parentHead.clone();
    }

    public long getRelayParentNumber() {
        return relayParentNumber;
    }

    public String getRelayParentStorageRoot() {
        return relayParentStorageRoot;
    }

    public long getMaxPovSize() {
        return maxPovSize;
    }
}
