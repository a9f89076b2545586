package com.work.relay.core.scan;

import com.work.relay.core.model.OutboundQueueMessage;

/**
 * 被选中待证明的消息，index 为其在区块完整消息列表（未按 channel 过滤）中的下标。
 */
public class SelectedMessage {

    private final long index;
    private final OutboundQueueMessage message;

    public SelectedMessage(long index, OutboundQueueMessage message) {
        this.index = index;
        this.message = message;
    }

    public long getIndex() {
        return index;
    }

    public OutboundQueueMessage getMessage() {
        return message;
    }
}
