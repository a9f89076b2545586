package com.work.relay.core.scan;

import com.work.relay.core.chain.GatewayClient;
import com.work.relay.core.chain.ParachainClient;
import com.work.relay.core.metrics.ScanMetrics;
import com.work.relay.core.model.ChannelNonces;
import com.work.relay.core.support.ChainCalls;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.OptionalLong;

/**
 * 比较目标链已投递 nonce 与源链已提交 nonce。
 *
 * <p>每次调用都重新读取两侧的权威值，不做本地缓存；查询异常原样抛出，由调用方决定是否重试。</p>
 */
public class NonceReconciler {

    private static final Logger log = LoggerFactory.getLogger(NonceReconciler.class);

    private final GatewayClient gateway;
    private final ParachainClient parachain;
    private final ScanMetrics metrics;

    public NonceReconciler(GatewayClient gateway, ParachainClient parachain, ScanMetrics metrics) {
        this.gateway = gateway;
        this.parachain = parachain;
        this.metrics = metrics;
    }

    /**
     * @param paraBlockHash 已最终确定的平行链区块，源链 nonce 在该区块处读取
     * @return empty 表示两侧已同步，无事可做；否则返回待投递区间，起点为 destNonce + 1
     */
    public Optional<NonceRange> reconcile(long channelId, String paraBlockHash) {
        ChannelNonces nonces = ChainCalls.call("fetch gateway nonces. channelId=" + channelId,
                () -> gateway.channelNonces(channelId));
        long destNonce = nonces.getInbound();
        log.info("Checked latest nonce delivered to gateway. channelId={} nonce={}", channelId, destNonce);

        OptionalLong committed = ChainCalls.call("fetch outbound nonce. channelId=" + channelId + " blockHash=" + paraBlockHash,
                () -> parachain.getOutboundNonce(channelId, paraBlockHash));
        long sourceNonce;
        if (committed.isPresent()) {
            sourceNonce = committed.getAsLong();
        } else {
            log.info("Fetched empty nonce from outbound queue. channelId={} blockHash={}", channelId, paraBlockHash);
            sourceNonce = 0L;
        }
        log.info("Checked latest nonce generated by outbound queue. channelId={} nonce={}", channelId, sourceNonce);

        if (sourceNonce <= destNonce) {
            metrics.nonceCheck(channelId, "in_sync");
            return Optional.empty();
        }
        metrics.nonceCheck(channelId, "behind");
        return Optional.of(new NonceRange(destNonce + 1, sourceNonce));
    }

    /**
     * 仅返回扫描下界的简化形式。
     */
    public OptionalLong startingNonce(long channelId, String paraBlockHash) {
        Optional<NonceRange> range = reconcile(channelId, paraBlockHash);
        return range.isPresent() ? OptionalLong.of(range.get().getStartingNonce()) : OptionalLong.empty();
    }
}
