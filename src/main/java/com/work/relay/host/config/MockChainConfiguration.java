package com.work.relay.host.config;

import com.work.relay.core.chain.CheckpointSource;
import com.work.relay.core.chain.GatewayClient;
import com.work.relay.core.chain.ParachainClient;
import com.work.relay.core.chain.RelayChainClient;
import com.work.relay.core.model.OutboundQueueMessage;
import com.work.relay.host.chain.mock.MockBridgeChain;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 内存链装配：chain.mode=mock（默认）时启用。
 *
 * <p>每个配置的 channel 预置 3 条消息（nonce 1..3），目标链已投递到 nonce 1，
 * 启动后定时扫描即可产出任务。</p>
 */
@Configuration
@ConditionalOnProperty(prefix = "chain", name = "mode", havingValue = "mock", matchIfMissing = true)
public class MockChainConfiguration {

    private static final Logger log = LoggerFactory.getLogger(MockChainConfiguration.class);

    @Bean
    public MockBridgeChain mockBridgeChain(RelayerProperties properties) {
        MockBridgeChain chain = new MockBridgeChain(properties.getParaId());
        List<OutboundQueueMessage> first = new ArrayList<>();
        List<OutboundQueueMessage> second = new ArrayList<>();
        for (Long channelId : properties.getChannelIds()) {
            first.add(demoMessage(channelId, 1));
            first.add(demoMessage(channelId, 2));
            second.add(demoMessage(channelId, 3));
            chain.setDeliveredNonce(channelId, 1);
        }
        chain.addParachainBlock(10, 100, first);
        chain.addParachainBlock(11, 102, Collections.<OutboundQueueMessage>emptyList());
        chain.addParachainBlock(12, 104, second);
        chain.includeParachainBlock(99, 9);
        chain.includeParachainBlock(102, 10);
        chain.includeParachainBlock(104, 11);
        chain.includeParachainBlock(106, 12);
        chain.setCheckpoint(110);
        log.info("In-memory bridge chains seeded. paraId={} channelIds={}", properties.getParaId(), properties.getChannelIds());
        return chain;
    }

    @Bean
    public GatewayClient gatewayClient(MockBridgeChain chain) {
        return chain.gateway();
    }

    @Bean
    public ParachainClient parachainClient(MockBridgeChain chain) {
        return chain.parachain();
    }

    @Bean
    public RelayChainClient relayChainClient(MockBridgeChain chain) {
        return chain.relayChain();
    }

    @Bean
    public CheckpointSource checkpointSource(MockBridgeChain chain) {
        return chain.checkpoints();
    }

    private static OutboundQueueMessage demoMessage(long channelId, long nonce) {
        byte[] params = ("demo:" + channelId + ":" + nonce).getBytes(StandardCharsets.UTF_8);
        return new OutboundQueueMessage(channelId, nonce, 0, params);
    }
}
