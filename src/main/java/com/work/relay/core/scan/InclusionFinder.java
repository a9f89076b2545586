package com.work.relay.core.scan;

import com.work.relay.core.chain.ParachainClient;
import com.work.relay.core.chain.RelayChainClient;
import com.work.relay.core.config.ScannerConfig;
import com.work.relay.core.exception.FinalityTimeoutException;
import com.work.relay.core.exception.MissingStateException;
import com.work.relay.core.exception.RelayException;
import com.work.relay.core.model.ParaHead;
import com.work.relay.core.model.ParachainHeader;
import com.work.relay.core.model.PersistedValidationData;
import com.work.relay.core.model.ProofInput;
import com.work.relay.core.support.ChainCalls;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * 查找平行链区块在中继链上被包含（最终确定）的区块，并采集该处的平行链 head 表。
 *
 * <p>平行链区块在 relayParentNumber 处被 backed，通常 2~3 个中继链区块后被包含；
 * 这里向前线性探测 finalizationTimeout 个区块，第一个匹配即返回，探测窗口耗尽视为失败。</p>
 */
public class InclusionFinder {

    private static final Logger log = LoggerFactory.getLogger(InclusionFinder.class);

    private final ParachainClient parachain;
    private final RelayChainClient relayChain;
    private final ScannerConfig config;

    public InclusionFinder(ParachainClient parachain, RelayChainClient relayChain, ScannerConfig config) {
        this.parachain = parachain;
        this.relayChain = relayChain;
        this.config = config;
    }

    public long findInclusionBlock(ScanContext ctx, long paraBlockNumber) {
        long channelId = ctx.getChannelId();
        String paraBlockHash = ChainCalls.call("fetch block hash. channelId=" + channelId + " paraBlockNumber=" + paraBlockNumber,
                () -> parachain.getBlockHash(paraBlockNumber));
        String paraContext = "channelId=" + channelId + " paraBlockNumber=" + paraBlockNumber + " blockHash=" + paraBlockHash;
        PersistedValidationData validationData = ChainCalls.call("fetch validation data. " + paraContext,
                () -> parachain.getValidationData(paraBlockHash))
                .orElseThrow(() -> new MissingStateException("PersistedValidationData not found. " + paraContext));

        long relayParentNumber = validationData.getRelayParentNumber();
        int timeout = config.getFinalizationTimeout();
        long paraId = config.getParaId();

        for (long relayBlockNumber = relayParentNumber + 1; relayBlockNumber <= relayParentNumber + timeout; relayBlockNumber++) {
            ctx.checkCancelled("inclusion probe");
            final long probed = relayBlockNumber;
            String relayBlockHash = ChainCalls.call("fetch relay block hash. " + paraContext + " relayBlockNumber=" + probed,
                    () -> relayChain.getBlockHash(probed));
            String relayContext = paraContext + " paraId=" + paraId + " relayBlockNumber=" + probed
                    + " relayBlockHash=" + relayBlockHash;
            ParachainHeader paraHead = ChainCalls.call("fetch parachain head. " + relayContext,
                    () -> relayChain.getParachainHead(paraId, relayBlockHash))
                    .orElseThrow(() -> new MissingStateException("parachain is not registered. " + relayContext));
            if (paraHead.getNumber() == paraBlockNumber) {
                log.debug("Found inclusion block for parachain header. paraBlockNumber={} relayBlockNumber={}",
                        paraBlockNumber, relayBlockNumber);
                return relayBlockNumber;
            }
        }
        throw new FinalityTimeoutException(channelId, paraBlockNumber, relayParentNumber, timeout);
    }

    public ProofInput buildProofInput(long relayBlockNumber) {
        String relayBlockHash = ChainCalls.call("fetch relay block hash. relayBlockNumber=" + relayBlockNumber,
                () -> relayChain.getBlockHash(relayBlockNumber));
        List<ParaHead> heads = ChainCalls.call("fetch parachain heads. relayBlockNumber=" + relayBlockNumber
                + " relayBlockHash=" + relayBlockHash, () -> relayChain.getParachainHeads(relayBlockHash));
        return new ProofInput(config.getParaId(), relayBlockNumber, heads);
    }

    /**
     * 为每个任务找到包含区块并填入 proofInput。任一任务失败即整体失败。
     */
    public void gatherProofInputs(ScanContext ctx, List<PendingTask> tasks) {
        for (PendingTask task : tasks) {
            long paraBlockNumber = task.getHeader().getNumber();
            log.debug("Gathering proof inputs for parachain header. paraBlockNumber={}", paraBlockNumber);
            long relayBlockNumber = findInclusionBlock(ctx, paraBlockNumber);
            ctx.checkCancelled("proof input");
            try {
                task.setProofInput(buildProofInput(relayBlockNumber));
            } catch (RelayException e) {
                throw e.withContext("gather proof input. channelId=" + ctx.getChannelId() + " paraBlockNumber=" + paraBlockNumber);
            }
        }
    }
}
