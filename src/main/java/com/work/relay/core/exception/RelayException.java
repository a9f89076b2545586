package com.work.relay.core.exception;

/**
 * 扫描组件内部的统一异常类型，便于宿主侧捕获或转换为 HTTP 错误码。
 *
 * <p>所有子类的 message 都携带定位信息（channelId / blockNumber / blockHash / nonce），
 * 组件内部不做吞异常或仅打印日志的处理。</p>
 */
public class RelayException extends RuntimeException {

    public RelayException(String message) {
        super(message);
    }

    public RelayException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * 在本异常前追加调用位置的上下文，返回同一子类型的新异常，原异常作为 cause。
     * 未覆盖此方法的子类型由扫描组件自身抛出，已带上下文，原样返回。
     */
    public RelayException withContext(String context) {
        return this;
    }

    /**
     * 标识该异常是否可通过“从头重新扫描一次”解决。
     * 默认不可重试。
     */
    public boolean isRetryable() {
        return false;
    }
}
