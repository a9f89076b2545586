package com.work.relay.host.config;

import com.work.relay.core.chain.GatewayClient;
import com.work.relay.core.chain.ParachainClient;
import com.work.relay.core.chain.RelayChainClient;
import com.work.relay.core.config.ScannerConfig;
import com.work.relay.core.metrics.NoopScanMetrics;
import com.work.relay.core.metrics.ScanMetrics;
import com.work.relay.core.scan.ParachainScanner;
import com.work.relay.host.worker.LoggingTaskSink;
import com.work.relay.host.worker.TaskSink;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;

/**
 * 将核心扫描组件装配为 Spring Bean。三条链的客户端由 {@link MockChainConfiguration}
 * 或 {@link RpcChainConfiguration} 按 chain.mode 提供。
 */
@Configuration
@EnableConfigurationProperties({RelayerProperties.class, ChainProperties.class})
public class RelayerConfiguration {

    @Bean
    public ScannerConfig scannerConfig(RelayerProperties properties) {
        return new ScannerConfig(
                properties.getParaId(),
                properties.getFinalizationTimeout(),
                properties.getMaxLookbackBlocks(),
                properties.getProofFetchParallelism()
        );
    }

    /**
     * 业务/平台可注册自己的 ScanMetrics Bean 接入监控
     */
    @Bean
    @ConditionalOnMissingBean(ScanMetrics.class)
    public ScanMetrics scanMetrics() {
        return new NoopScanMetrics();
    }

    /**
     * 默认只打印任务；接入提交端时替换为自己的实现
     */
    @Bean
    @ConditionalOnMissingBean(TaskSink.class)
    public TaskSink taskSink() {
        return new LoggingTaskSink();
    }

    @Bean(name = "proofExecutor", destroyMethod = "shutdownNow")
    @ConditionalOnExpression("${relayer.proof-fetch-parallelism:1} > 1")
    public ExecutorService proofExecutor(RelayerProperties properties) {
        ThreadFactory tf = r -> {
            Thread t = new Thread(r);
            t.setName("proof-fetcher-" + t.getId());
            t.setDaemon(true);
            return t;
        };
        return Executors.newFixedThreadPool(properties.getProofFetchParallelism(), tf);
    }

    @Bean
    public ParachainScanner parachainScanner(GatewayClient gatewayClient,
                                             ParachainClient parachainClient,
                                             RelayChainClient relayChainClient,
                                             ScannerConfig scannerConfig,
                                             @Qualifier("proofExecutor") ObjectProvider<ExecutorService> proofExecutor,
                                             ScanMetrics scanMetrics) {
        // 未配置并发时 executor 为空，proof 串行拉取
        return new ParachainScanner(gatewayClient, parachainClient, relayChainClient, scannerConfig,
                proofExecutor.getIfAvailable(), scanMetrics);
    }
}
