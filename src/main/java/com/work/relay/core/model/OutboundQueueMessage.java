package com.work.relay.core.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * 源链 outbound queue 中已提交的一条消息。
 *
 * <p>origin 即 channelId；command + params 构成消息负载。一旦被区块 commitment 覆盖即不可变。</p>
 */
public class OutboundQueueMessage {

    private final long channelId;
    private final long nonce;
    private final int command;
    private final byte[] params;

    public OutboundQueueMessage(long channelId, long nonce, int command, byte[] params) {
        this.channelId = channelId;
        this.nonce = nonce;
        this.command = command;
        this.params = params == null ? new byte[0] : params.clone();
    }

    public long getChannelId() {
        return channelId;
    }

    public long getNonce() {
        return nonce;
    }

    public int getCommand() {
        return command;
    }

    public byte[] getParams() {
        return params.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OutboundQueueMessage)) return false;
        OutboundQueueMessage that = (OutboundQueueMessage) o;
        return channelId == that.channelId
                && nonce == that.nonce
                && command == that.command
                && Arrays.equals(params, that.params);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(channelId, nonce, command);
        return 31 * result + Arrays.hashCode(params);
    }

    @Override
    public String toString() {
        return "OutboundQueueMessage{channelId=" + channelId + ", nonce=" + nonce + ", command=" + command + "}";
    }
}
