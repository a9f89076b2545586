package com.work.relay.core.scan;

import com.work.relay.core.exception.ScanCancelledException;
import com.work.relay.core.support.ValidationUtils;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 单次扫描的上下文：channel 标识 + 协作式取消。
 *
 * <p>每次链查询前调用 {@link #checkCancelled(String)}；线程被中断同样视为取消。
 * 一个 ScanContext 只属于一次扫描，不在扫描之间复用。</p>
 */
public class ScanContext {

    private final long channelId;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public ScanContext(long channelId) {
        this.channelId = ValidationUtils.requireValidChannelId(channelId);
    }

    public long getChannelId() {
        return channelId;
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get() || Thread.currentThread().isInterrupted();
    }

    public void checkCancelled(String stage) {
        if (isCancelled()) {
            throw new ScanCancelledException("scan cancelled. channelId=" + channelId + " stage=" + stage);
        }
    }
}
