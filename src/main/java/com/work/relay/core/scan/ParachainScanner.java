package com.work.relay.core.scan;

import com.work.relay.core.chain.GatewayClient;
import com.work.relay.core.chain.ParachainClient;
import com.work.relay.core.chain.RelayChainClient;
import com.work.relay.core.config.ScannerConfig;
import com.work.relay.core.exception.IntegrityException;
import com.work.relay.core.exception.MissingStateException;
import com.work.relay.core.exception.RelayException;
import com.work.relay.core.metrics.ScanMetrics;
import com.work.relay.core.model.ParachainHeader;
import com.work.relay.core.model.Task;
import com.work.relay.core.support.ChainCalls;
import com.work.relay.core.support.ValidationUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executor;

/**
 * 门面（Facade）层：扫描某个 channel 上所有需要中继、且能用给定中继链检查点证明的消息。
 *
 * 流程：
 * 1. 读取检查点前一个中继链区块记录的平行链 head（检查点之前已最终确定的平行链区块）
 * 2. 比较两侧 nonce，一致则直接返回空列表
 * 3. 从该平行链区块向后回扫，确定需要中继的 commitment 与消息证明
 * 4. 为每个涉及的平行链区块找到其在中继链上的包含区块，采集 head 表
 *
 * <p>扫描之间不保留任何状态，每次都从当前链状态重新计算，因此失败后可以整体重试。
 * 结果要么是完整的任务列表，要么抛出异常，不会返回部分结果。</p>
 *
 * <p>实例本身无可变状态，可被多个 channel 的扫描并发调用。</p>
 */
public class ParachainScanner {

    private static final Logger log = LoggerFactory.getLogger(ParachainScanner.class);

    private final RelayChainClient relayChain;
    private final ParachainClient parachain;
    private final ScannerConfig config;
    private final NonceReconciler nonceReconciler;
    private final CommitmentScanner commitmentScanner;
    private final InclusionFinder inclusionFinder;
    private final TaskBuilder taskBuilder;
    private final ScanMetrics metrics;

    public ParachainScanner(GatewayClient gateway,
                            ParachainClient parachain,
                            RelayChainClient relayChain,
                            ScannerConfig config,
                            Executor proofExecutor,
                            ScanMetrics metrics) {
        ValidationUtils.requireNonNull(gateway, "gateway");
        this.relayChain = ValidationUtils.requireNonNull(relayChain, "relayChain");
        this.parachain = ValidationUtils.requireNonNull(parachain, "parachain");
        this.config = ValidationUtils.requireNonNull(config, "config");
        this.metrics = ValidationUtils.requireNonNull(metrics, "metrics");
        this.nonceReconciler = new NonceReconciler(gateway, parachain, metrics);
        ProofAssembler proofAssembler = new ProofAssembler(parachain, proofExecutor, metrics);
        this.commitmentScanner = new CommitmentScanner(parachain, proofAssembler, config, metrics);
        this.inclusionFinder = new InclusionFinder(parachain, relayChain, config);
        this.taskBuilder = new TaskBuilder();
    }

    public List<Task> scan(long channelId, long relayCheckpointBlock) {
        return scan(new ScanContext(channelId), relayCheckpointBlock);
    }

    public List<Task> scan(ScanContext ctx, long relayCheckpointBlock) {
        if (relayCheckpointBlock < 1) {
            throw new IllegalArgumentException("relayCheckpointBlock 必须大于0");
        }
        long channelId = ctx.getChannelId();
        try {
            return doScan(ctx, channelId, relayCheckpointBlock);
        } catch (RelayException e) {
            metrics.scanFailed(channelId, e.getClass().getSimpleName());
            throw e;
        }
    }

    private List<Task> doScan(ScanContext ctx, long channelId, long relayCheckpointBlock) {
        ctx.checkCancelled("checkpoint");
        ParachainHeader paraHead = finalizedParachainHead(channelId, relayCheckpointBlock);
        long paraBlockNumber = paraHead.getNumber();
        String paraBlockHash = ChainCalls.call("fetch block hash. channelId=" + channelId + " paraBlockNumber=" + paraBlockNumber,
                () -> parachain.getBlockHash(paraBlockNumber));

        ctx.checkCancelled("nonce check");
        Optional<NonceRange> range = nonceReconciler.reconcile(channelId, paraBlockHash);
        if (!range.isPresent()) {
            return Collections.emptyList();
        }
        NonceRange outstanding = range.get();
        log.info("Nonces are mismatched, scanning for commitments that need to be relayed. channelId={} nonces={} paraBlockNumber={}",
                channelId, outstanding, paraBlockNumber);

        List<PendingTask> pending = commitmentScanner.scan(ctx, paraBlockNumber, channelId, outstanding.getStartingNonce());
        requireComplete(pending, channelId, outstanding);

        inclusionFinder.gatherProofInputs(ctx, pending);
        ctx.checkCancelled("build tasks");
        List<Task> tasks = taskBuilder.build(pending);

        metrics.tasksEmitted(channelId, tasks.size());
        log.info("Scan completed. channelId={} relayCheckpoint={} tasks={} nonces={}",
                channelId, relayCheckpointBlock, tasks.size(), outstanding);
        return tasks;
    }

    /**
     * 检查点前一个中继链区块所记录的平行链 head，即检查点之前已最终确定的最新平行链区块。
     */
    private ParachainHeader finalizedParachainHead(long channelId, long relayCheckpointBlock) {
        long relayBlockNumber = relayCheckpointBlock - 1;
        String relayBlockHash = ChainCalls.call("fetch relay block hash. channelId=" + channelId
                + " relayBlockNumber=" + relayBlockNumber, () -> relayChain.getBlockHash(relayBlockNumber));
        String context = "channelId=" + channelId + " paraId=" + config.getParaId()
                + " relayBlockNumber=" + relayBlockNumber + " relayBlockHash=" + relayBlockHash;
        return ChainCalls.call("fetch finalized parachain head. " + context,
                () -> relayChain.getParachainHead(config.getParaId(), relayBlockHash))
                .orElseThrow(() -> new MissingStateException("parachain is not registered. " + context));
    }

    /**
     * (destNonce, sourceNonce] 内的每条消息恰好出现一次。回扫已保证从 startingNonce 起连续，这里核对上界。
     */
    private static void requireComplete(List<PendingTask> pending, long channelId, NonceRange range) {
        long collected = 0;
        for (PendingTask p : pending) {
            collected += p.getMessageProofs().size();
        }
        if (collected != range.size()) {
            throw new IntegrityException("collected messages don't cover outstanding nonces. channelId=" + channelId
                    + " nonces=" + range + " collected=" + collected);
        }
    }
}
