package com.work.relay.core.exception;

/**
 * 扫描在两次链查询之间被取消，不返回任何部分结果。
 */
public class ScanCancelledException extends RelayException {

    public ScanCancelledException(String message) {
        super(message);
    }
}
