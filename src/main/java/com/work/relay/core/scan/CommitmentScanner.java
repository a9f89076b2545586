package com.work.relay.core.scan;

import com.work.relay.core.chain.ParachainClient;
import com.work.relay.core.config.ScannerConfig;
import com.work.relay.core.exception.IntegrityException;
import com.work.relay.core.exception.LookbackExceededException;
import com.work.relay.core.exception.MissingStateException;
import com.work.relay.core.metrics.ScanMetrics;
import com.work.relay.core.model.MessageProof;
import com.work.relay.core.model.OutboundQueueMessage;
import com.work.relay.core.model.ParachainHeader;
import com.work.relay.core.support.ChainCalls;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * 从已知区块开始向创世块方向逐块回扫，找出 channel 上所有尚未投递的 commitment。
 *
 * <p>区块内的消息按 commitment 顺序（nonce 升序）存储，这里从后往前遍历（nonce 降序），
 * 这样不需要事先知道消息数量就能区分以下情况：</p>
 * <ol>
 *   <li>区块内没有该 channel 的消息：继续向前</li>
 *   <li>遇到的第一条消息 nonce 已小于 startingNonce：该区块及更早区块均已投递，整体结束</li>
 *   <li>nonce &gt;= startingNonce：收集，继续在本区块内往下找</li>
 *   <li>nonce == startingNonce：收集后下界已满足，整体结束（可能出现在更早的区块里）</li>
 * </ol>
 *
 * <p>终止条件只有 nonce 边界（以及可选的最大回看区块数），不按固定区块数截断。
 * 收集顺序为“区块降序 + nonce 降序”，返回前反转为区块升序、nonce 升序。</p>
 */
public class CommitmentScanner {

    private static final Logger log = LoggerFactory.getLogger(CommitmentScanner.class);

    private final ParachainClient parachain;
    private final ProofAssembler proofAssembler;
    private final ScannerConfig config;
    private final ScanMetrics metrics;

    public CommitmentScanner(ParachainClient parachain,
                             ProofAssembler proofAssembler,
                             ScannerConfig config,
                             ScanMetrics metrics) {
        this.parachain = parachain;
        this.proofAssembler = proofAssembler;
        this.config = config;
        this.metrics = metrics;
    }

    public List<PendingTask> scan(ScanContext ctx, long startBlockNumber, long channelId, long startingNonce) {
        log.debug("Searching backwards from latest block on parachain to find block with nonce. channelId={} nonce={} latestBlockNumber={}",
                channelId, startingNonce, startBlockNumber);

        List<PendingTask> tasks = new ArrayList<>();
        long maxLookback = config.getMaxLookbackBlocks();
        long walked = 0;
        boolean scanDone = false;

        for (long blockNumber = startBlockNumber; blockNumber > 0 && !scanDone; blockNumber--) {
            ctx.checkCancelled("backward scan");
            if (maxLookback > 0 && walked >= maxLookback) {
                metrics.blocksWalked(channelId, walked);
                throw new LookbackExceededException(channelId, startBlockNumber, maxLookback, startingNonce);
            }
            walked++;

            log.debug("Checking header. blockNumber={}", blockNumber);
            final long currentBlock = blockNumber;
            String blockHash = ChainCalls.call("fetch block hash. channelId=" + channelId + " blockNumber=" + currentBlock,
                    () -> parachain.getBlockHash(currentBlock));
            String blockContext = "channelId=" + channelId + " blockNumber=" + currentBlock + " blockHash=" + blockHash;
            ParachainHeader header = ChainCalls.call("fetch header. " + blockContext, () -> parachain.getHeader(blockHash));
            if (header.getHash() == null) {
                header = header.withHash(blockHash);
            }

            Optional<String> commitment = CommitmentDigests.extract(header);
            if (!commitment.isPresent()) {
                continue;
            }

            List<OutboundQueueMessage> messages = ChainCalls.call("fetch committed messages. " + blockContext,
                    () -> parachain.getCommittedMessages(blockHash))
                    .orElseThrow(() -> new MissingStateException("committed messages not found. " + blockContext));

            BlockSelection selection = selectOutstanding(messages, channelId, startingNonce);
            scanDone = selection.scanDone;

            if (!selection.selected.isEmpty()) {
                List<MessageProof> proofs = proofAssembler.proveAll(ctx, blockNumber, blockHash, commitment.get(), selection.selected);
                tasks.add(new PendingTask(header, proofs));
                log.debug("Collected outstanding messages. channelId={} blockNumber={} count={}",
                        channelId, blockNumber, proofs.size());
            }
        }
        metrics.blocksWalked(channelId, walked);

        if (!scanDone) {
            throw new MissingStateException("reached genesis without crossing delivered nonce boundary. channelId="
                    + channelId + " startBlockNumber=" + startBlockNumber + " startingNonce=" + startingNonce);
        }

        // 反转：区块号升序
        Collections.reverse(tasks);
        requireContiguous(tasks, channelId, startingNonce);
        return tasks;
    }

    /**
     * 在单个区块的完整消息列表上按 nonce 降序筛选，index 保留消息在完整列表中的位置。
     */
    static BlockSelection selectOutstanding(List<OutboundQueueMessage> messages, long channelId, long startingNonce) {
        List<SelectedMessage> selected = new ArrayList<>();
        boolean scanDone = false;
        for (int i = messages.size() - 1; i >= 0; i--) {
            OutboundQueueMessage message = messages.get(i);
            if (message.getChannelId() != channelId) {
                continue;
            }
            if (message.getNonce() < startingNonce) {
                log.debug("Halting scan, messages already delivered. channelId={} nonce={}", channelId, message.getNonce());
                scanDone = true;
                break;
            }
            selected.add(new SelectedMessage(i, message));
            if (message.getNonce() == startingNonce) {
                scanDone = true;
            }
        }
        return new BlockSelection(selected, scanDone);
    }

    private static void requireContiguous(List<PendingTask> tasks, long channelId, long startingNonce) {
        long expected = startingNonce;
        for (PendingTask task : tasks) {
            for (MessageProof proof : task.getMessageProofs()) {
                long nonce = proof.getMessage().getNonce();
                if (nonce != expected) {
                    throw new IntegrityException("nonce gap in collected messages. channelId=" + channelId
                            + " blockNumber=" + task.getHeader().getNumber()
                            + " expectedNonce=" + expected + " actualNonce=" + nonce);
                }
                expected++;
            }
        }
    }

    static final class BlockSelection {
        final List<SelectedMessage> selected;
        final boolean scanDone;

        BlockSelection(List<SelectedMessage> selected, boolean scanDone) {
            this.selected = selected;
            this.scanDone = scanDone;
        }
    }
}
