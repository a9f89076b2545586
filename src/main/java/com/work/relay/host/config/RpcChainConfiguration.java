package com.work.relay.host.config;

import com.work.relay.core.chain.CheckpointSource;
import com.work.relay.core.chain.GatewayClient;
import com.work.relay.core.chain.ParachainClient;
import com.work.relay.core.chain.RelayChainClient;
import com.work.relay.core.support.ValidationUtils;
import com.work.relay.host.chain.ethereum.Web3jBeefyCheckpointSource;
import com.work.relay.host.chain.ethereum.Web3jGatewayClient;
import com.work.relay.host.chain.substrate.SubstrateParachainClient;
import com.work.relay.host.chain.substrate.SubstrateRelayChainClient;
import com.work.relay.host.chain.substrate.SubstrateRpc;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.http.HttpService;

/**
 * 真实链装配：chain.mode=rpc 时启用。
 *
 * <p>以太坊使用 web3j 客户端；平行链与中继链的 JSON-RPC 复用 web3j 的 HttpService 传输层。</p>
 */
@Configuration
@ConditionalOnProperty(prefix = "chain", name = "mode", havingValue = "rpc")
public class RpcChainConfiguration {

    @Bean(destroyMethod = "shutdown")
    public Web3j web3j(ChainProperties properties) {
        return Web3j.build(new HttpService(properties.getEthereum().getRpcUrl()));
    }

    @Bean
    public GatewayClient gatewayClient(Web3j web3j, ChainProperties properties) {
        String address = ValidationUtils.requireNonEmpty(properties.getEthereum().getGatewayAddress(),
                "chain.ethereum.gateway-address");
        return new Web3jGatewayClient(web3j, address);
    }

    @Bean
    public CheckpointSource checkpointSource(Web3j web3j, ChainProperties properties) {
        String address = ValidationUtils.requireNonEmpty(properties.getEthereum().getBeefyClientAddress(),
                "chain.ethereum.beefy-client-address");
        return new Web3jBeefyCheckpointSource(web3j, address);
    }

    @Bean
    public ParachainClient parachainClient(ChainProperties properties) {
        SubstrateRpc rpc = new SubstrateRpc("parachain", new HttpService(properties.getParachain().getRpcUrl()));
        return new SubstrateParachainClient(rpc, properties.getParachain().getOutboundQueuePallet());
    }

    @Bean
    public RelayChainClient relayChainClient(ChainProperties properties) {
        SubstrateRpc rpc = new SubstrateRpc("relaychain", new HttpService(properties.getRelaychain().getRpcUrl()));
        return new SubstrateRelayChainClient(rpc);
    }
}
