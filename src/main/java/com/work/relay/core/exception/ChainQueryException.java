package com.work.relay.core.exception;

/**
 * 链查询失败（网络/RPC 错误）。重试策略由调用方决定，组件内不重试。
 */
public class ChainQueryException extends RelayException {

    public ChainQueryException(String message) {
        super(message);
    }

    public ChainQueryException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ChainQueryException withContext(String context) {
        return new ChainQueryException(context + ": " + getMessage(), this);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
