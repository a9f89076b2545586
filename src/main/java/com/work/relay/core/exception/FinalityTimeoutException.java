package com.work.relay.core.exception;

/**
 * 在 finalizationTimeout 个中继链区块内没有观察到平行链区块被包含。
 */
public class FinalityTimeoutException extends RelayException {

    private final long channelId;
    private final long paraBlockNumber;
    private final long relayParentNumber;

    public FinalityTimeoutException(long channelId, long paraBlockNumber, long relayParentNumber, int finalizationTimeout) {
        super("scan terminated: parachain block not included within finality window. channelId=" + channelId
                + " paraBlockNumber=" + paraBlockNumber + " relayParentNumber=" + relayParentNumber
                + " finalizationTimeout=" + finalizationTimeout);
        this.channelId = channelId;
        this.paraBlockNumber = paraBlockNumber;
        this.relayParentNumber = relayParentNumber;
    }

    public long getChannelId() {
        return channelId;
    }

    public long getParaBlockNumber() {
        return paraBlockNumber;
    }

    public long getRelayParentNumber() {
        return relayParentNumber;
    }
}
