package com.work.relay.core.model;

import java.util.Arrays;

/**
 * 区块头 digest 中的一项（只保留扫描需要的字段）。
 */
public class DigestItem {

    public enum Kind {
        OTHER,
        CONSENSUS,
        SEAL,
        PRE_RUNTIME,
        RUNTIME_ENVIRONMENT_UPDATED
    }

    private final Kind kind;
    private final byte[] engineId;
    private final byte[] data;

    public DigestItem(Kind kind, byte[] engineId, byte[] data) {
        this.kind = kind;
        this.engineId = engineId == null ? new byte[0] : engineId.clone();
        this.data = data == null ? new byte[0] : data.clone();
    }

    public static DigestItem other(byte[] data) {
        return new DigestItem(Kind.OTHER, null, data);
    }

    public Kind getKind() {
        return kind;
    }

    public byte[] getEngineId() {
        return engineId.clone();
    }

    public byte[] getData() {
        return data.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DigestItem)) return false;
        DigestItem that = (DigestItem) o;
        return kind == that.kind && Arrays.equals(engineId, that.engineId) && Arrays.equals(data, that.data);
    }

    @Override
    public int hashCode() {
        int result = kind.hashCode();
        result = 31 * result + Arrays.hashCode(engineId);
        return 31 * result + Arrays.hashCode(data);
    }
}
