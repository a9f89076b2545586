package com.work.relay.core.exception;

/**
 * 完整性校验失败：proof 重算出的 merkle root 与区块头 digest 中的 commitment 不一致，
 * 或收集到的 nonce 不连续。
 *
 * <p>说明源链视图不一致或被篡改，本次扫描必须中止，结果不得转发到目标链。</p>
 */
public class IntegrityException extends RelayException {

    public IntegrityException(String message) {
        super(message);
    }

    public IntegrityException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public IntegrityException withContext(String context) {
        return new IntegrityException(context + ": " + getMessage(), this);
    }
}
