package com.work.relay.core.metrics;

/**
 * 可观测性端口（不强依赖 Micrometer/Prometheus）。
 *
 * 核心路径只调用接口，业务/平台可通过自定义 Bean 接入具体实现。
 */
public interface ScanMetrics {

    default void nonceCheck(long channelId, String result) {
    }

    default void blocksWalked(long channelId, long count) {
    }

    default void proofFetched(long channelId) {
    }

    default void tasksEmitted(long channelId, int count) {
    }

    default void scanFailed(long channelId, String reason) {
    }
}
