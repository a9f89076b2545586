package com.work.relay.host.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 三条链的连接配置。
 *
 * mode=mock: 使用内存链 MockBridgeChain
 * mode=rpc: 以太坊走 web3j，平行链与中继链走 Substrate JSON-RPC
 */
@ConfigurationProperties(prefix = "chain")
public class ChainProperties {

    /**
     * mock 或 rpc
     */
    private String mode = "mock";

    private final Ethereum ethereum = new Ethereum();
    private final Parachain parachain = new Parachain();
    private final Relaychain relaychain = new Relaychain();

    public String getMode() {
        return mode;
    }

    public void setMode(String mode) {
        this.mode = mode;
    }

    public Ethereum getEthereum() {
        return ethereum;
    }

    public Parachain getParachain() {
        return parachain;
    }

    public Relaychain getRelaychain() {
        return relaychain;
    }

    public static class Ethereum {

        private String rpcUrl = "http://localhost:8545";

        /**
         * Gateway 合约地址，提供 channelNoncesOf
         */
        private String gatewayAddress;

        /**
         * BEEFY light client 合约地址，提供 latestBeefyBlock
         */
        private String beefyClientAddress;

        public String getRpcUrl() {
            return rpcUrl;
        }

        public void setRpcUrl(String rpcUrl) {
            this.rpcUrl = rpcUrl;
        }

        public String getGatewayAddress() {
            return gatewayAddress;
        }

        public void setGatewayAddress(String gatewayAddress) {
            this.gatewayAddress = gatewayAddress;
        }

        public String getBeefyClientAddress() {
            return beefyClientAddress;
        }

        public void setBeefyClientAddress(String beefyClientAddress) {
            this.beefyClientAddress = beefyClientAddress;
        }
    }

    public static class Parachain {

        private String rpcUrl = "http://localhost:9944";

        private String outboundQueuePallet = "EthereumOutboundQueue";

        public String getRpcUrl() {
            return rpcUrl;
        }

        public void setRpcUrl(String rpcUrl) {
            this.rpcUrl = rpcUrl;
        }

        public String getOutboundQueuePallet() {
            return outboundQueuePallet;
        }

        public void setOutboundQueuePallet(String outboundQueuePallet) {
            this.outboundQueuePallet = outboundQueuePallet;
        }
    }

    public static class Relaychain {

        private String rpcUrl = "http://localhost:9945";

        public String getRpcUrl() {
            return rpcUrl;
        }

        public void setRpcUrl(String rpcUrl) {
            this.rpcUrl = rpcUrl;
        }
    }
}
