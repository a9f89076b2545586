package com.work.relay.core.exception;

/**
 * 预期存在的链上状态缺失（proof 不存在、ValidationData 缺失、平行链未注册等）。
 *
 * <p>本次扫描失败；链状态推进后可重新发起一次全新的扫描。</p>
 */
public class MissingStateException extends RelayException {

    public MissingStateException(String message) {
        super(message);
    }

    public MissingStateException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public MissingStateException withContext(String context) {
        return new MissingStateException(context + ": " + getMessage(), this);
    }
}
