package com.work.relay.core.exception;

/**
 * 链上返回的字节无法按预期结构解码。
 */
public class DecodeException extends RelayException {

    public DecodeException(String message) {
        super(message);
    }

    public DecodeException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public DecodeException withContext(String context) {
        return new DecodeException(context + ": " + getMessage(), this);
    }
}
