package com.work.relay.host.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import javax.validation.constraints.Min;
import javax.validation.constraints.NotEmpty;
import java.util.ArrayList;
import java.util.List;

/**
 * 宿主侧的扫描配置，从 application.yml 读取，
 * 再由配置类转换为 core 包所需的 {@link com.work.relay.core.config.ScannerConfig}。
 */
@Validated
@ConfigurationProperties(prefix = "relayer")
public class RelayerProperties {

    /**
     * 源平行链 paraId
     */
    @Min(value = 0, message = "paraId 不能为负数")
    private long paraId = 1000;

    /**
     * 需要扫描的 channel 列表
     */
    @NotEmpty(message = "channelIds 不能为空")
    private List<Long> channelIds = new ArrayList<>();

    @Min(value = 1, message = "finalizationTimeout 必须大于0")
    private int finalizationTimeout = 4;

    /**
     * 向后扫描的最大区块数，0 表示不限制
     */
    @Min(value = 0, message = "maxLookbackBlocks 不能为负数")
    private long maxLookbackBlocks = 0;

    /**
     * 同一区块内 proof 并发拉取数，1 表示串行
     */
    @Min(value = 1, message = "proofFetchParallelism 必须大于0")
    private int proofFetchParallelism = 1;

    private boolean scanEnabled = true;

    private long scanIntervalMs = 30_000;

    /**
     * 定时扫描时并发处理的 channel 数
     */
    @Min(value = 1, message = "scanWorkers 必须大于0")
    private int scanWorkers = 1;

    public long getParaId() {
        return paraId;
    }

    public void setParaId(long paraId) {
        this.paraId = paraId;
    }

    public List<Long> getChannelIds() {
        return channelIds;
    }

    public void setChannelIds(List<Long> channelIds) {
        this.channelIds = channelIds;
    }

    public int getFinalizationTimeout() {
        return finalizationTimeout;
    }

    public void setFinalizationTimeout(int finalizationTimeout) {
        this.finalizationTimeout = finalizationTimeout;
    }

    public long getMaxLookbackBlocks() {
        return maxLookbackBlocks;
    }

    public void setMaxLookbackBlocks(long maxLookbackBlocks) {
        this.maxLookbackBlocks = maxLookbackBlocks;
    }

    public int getProofFetchParallelism() {
        return proofFetchParallelism;
    }

    public void setProofFetchParallelism(int proofFetchParallelism) {
        this.proofFetchParallelism = proofFetchParallelism;
    }

    public boolean isScanEnabled() {
        return scanEnabled;
    }

    public void setScanEnabled(boolean scanEnabled) {
        this.scanEnabled = scanEnabled;
    }

    public long getScanIntervalMs() {
        return scanIntervalMs;
    }

    public void setScanIntervalMs(long scanIntervalMs) {
        this.scanIntervalMs = scanIntervalMs;
    }

    public int getScanWorkers() {
        return scanWorkers;
    }

    public void setScanWorkers(int scanWorkers) {
        this.scanWorkers = scanWorkers;
    }
}
