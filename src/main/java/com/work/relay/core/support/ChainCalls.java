package com.work.relay.core.support;

import com.work.relay.core.exception.RelayException;

import java.util.function.Supplier;

/**
 * 链客户端调用包装：客户端抛出的异常只知道 RPC 细节，这里补上 channelId / 区块等扫描上下文。
 */
public final class ChainCalls {

    private ChainCalls() {
        throw new AssertionError("工具类不允许实例化");
    }

    /**
     * @param context 形如 "fetch header. channelId=5 blockNumber=103 blockHash=0x.."
     */
    public static <T> T call(String context, Supplier<T> call) {
        try {
            return call.get();
        } catch (RelayException e) {
            throw e.withContext(context);
        }
    }
}
