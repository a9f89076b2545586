package com.work.relay.core.model;

import java.util.Arrays;

/**
 * 中继链 Paras.Heads 表中的一项：paraId -> HeadData（SCALE 编码的平行链区块头）。
 */
public class ParaHead {

    private final long paraId;
    private final byte[] headData;

    public ParaHead(long paraId, byte[] headData) {
        this.paraId = paraId;
        this.headData = headData == null ? new byte[0] : headData.clone();
    }

    public long getParaId() {
        return paraId;
    }

    public byte[] getHeadData() {
        return headData.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ParaHead)) return false;
        ParaHead that = (ParaHead) o;
        return paraId == that.paraId && Arrays.equals(headData, that.headData);
    }

    @Override
    public int hashCode() {
        return 31 * Long.hashCode(paraId) + Arrays.hashCode(headData);
    }
}
