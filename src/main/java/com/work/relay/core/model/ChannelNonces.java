package com.work.relay.core.model;

/**
 * 目标链 gateway 上某个 channel 的 nonce 视图。inbound 为已投递到目标链的最新 nonce。
 */
public class ChannelNonces {

    private final long inbound;
    private final long outbound;

    public ChannelNonces(long inbound, long outbound) {
        this.inbound = inbound;
        this.outbound = outbound;
    }

    public long getInbound() {
        return inbound;
    }

    public long getOutbound() {
        return outbound;
    }
}
