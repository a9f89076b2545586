package com.work.relay.core.config;

import com.work.relay.core.support.ValidationUtils;

/**
 * 纯组件侧的扫描配置，不依赖任意框架。宿主应用（如 Spring Boot）只需在装配时
 * 将自身读取到的配置参数注入即可。
 */
public class ScannerConfig {

    /**
     * 平行链区块被 backed 后，最多在多少个中继链区块内被包含（超时即放弃）。
     */
    public static final int DEFAULT_FINALIZATION_TIMEOUT = 4;

    private final long paraId;
    private final int finalizationTimeout;
    private final long maxLookbackBlocks;
    private final int proofFetchParallelism;

    /**
     * @param maxLookbackBlocks     向后扫描的最大区块数，0 表示不限制
     * @param proofFetchParallelism 同一区块内 proof 并发拉取数，1 表示串行
     */
    public ScannerConfig(long paraId, int finalizationTimeout, long maxLookbackBlocks, int proofFetchParallelism) {
        this.paraId = ValidationUtils.requireNonNegative(paraId, "paraId");
        this.finalizationTimeout = ValidationUtils.requirePositive(finalizationTimeout, "finalizationTimeout");
        this.maxLookbackBlocks = ValidationUtils.requireNonNegative(maxLookbackBlocks, "maxLookbackBlocks");
        this.proofFetchParallelism = ValidationUtils.requirePositive(proofFetchParallelism, "proofFetchParallelism");
    }

    public static ScannerConfig defaultConfig(long paraId) {
        return new ScannerConfig(paraId, DEFAULT_FINALIZATION_TIMEOUT, 0L, 1);
    }

    public long getParaId() {
        return paraId;
    }

    public int getFinalizationTimeout() {
        return finalizationTimeout;
    }

    public long getMaxLookbackBlocks() {
        return maxLookbackBlocks;
    }

    public int getProofFetchParallelism() {
        return proofFetchParallelism;
    }
}
