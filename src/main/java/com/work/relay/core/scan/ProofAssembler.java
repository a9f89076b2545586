package com.work.relay.core.scan;

import com.work.relay.core.chain.ParachainClient;
import com.work.relay.core.exception.IntegrityException;
import com.work.relay.core.exception.MissingStateException;
import com.work.relay.core.merkle.MerkleTree;
import com.work.relay.core.metrics.ScanMetrics;
import com.work.relay.core.model.MerkleProof;
import com.work.relay.core.model.MessageProof;
import com.work.relay.core.model.OutboundQueueMessage;
import com.work.relay.core.support.ChainCalls;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * 为待投递消息拉取 merkle 证明，并与区块头中的 commitment 核对。
 *
 * <p>证明按位置生成：index 必须是消息在区块完整消息列表中的下标，而不是过滤后的下标。</p>
 *
 * <p>executor 为空时串行拉取；否则同一区块内的证明并发拉取，结果最终按 nonce 升序返回。</p>
 */
public class ProofAssembler {

    private static final Logger log = LoggerFactory.getLogger(ProofAssembler.class);

    private final ParachainClient parachain;
    private final Executor executor;
    private final ScanMetrics metrics;

    public ProofAssembler(ParachainClient parachain, Executor executor, ScanMetrics metrics) {
        this.parachain = parachain;
        this.executor = executor;
        this.metrics = metrics;
    }

    public MessageProof proveMessage(String blockHash, long index, OutboundQueueMessage message) {
        String context = "channelId=" + message.getChannelId() + " blockHash=" + blockHash
                + " leafIndex=" + index + " nonce=" + message.getNonce();
        Optional<MerkleProof> proof = ChainCalls.call("fetch message proof. " + context,
                () -> parachain.proveMessage(blockHash, index));
        if (!proof.isPresent()) {
            throw new MissingStateException("message proof not found. " + context);
        }
        metrics.proofFetched(message.getChannelId());
        return new MessageProof(message, proof.get());
    }

    /**
     * 校验证明属于该 commitment：上报的 root、叶子下标、由叶子与路径重算的 root 三者都必须一致。
     */
    public void verify(MessageProof messageProof, String commitment, long blockNumber, long index) {
        MerkleProof proof = messageProof.getProof();
        OutboundQueueMessage message = messageProof.getMessage();
        String context = " channelId=" + message.getChannelId() + " blockNumber=" + blockNumber
                + " nonce=" + message.getNonce() + " commitment=" + commitment;

        if (!commitment.equalsIgnoreCase(proof.getRoot())) {
            throw new IntegrityException("outbound queue proof root doesn't match digest commitment. proofRoot="
                    + proof.getRoot() + context);
        }
        if (proof.getLeafIndex() != index) {
            throw new IntegrityException("outbound queue proof leaf index mismatch. expected=" + index
                    + " actual=" + proof.getLeafIndex() + context);
        }
        String computed = MerkleTree.computeRoot(proof.getLeaf(), proof.getProofItems());
        if (!commitment.equalsIgnoreCase(computed)) {
            throw new IntegrityException("recomputed merkle root doesn't match digest commitment. computedRoot="
                    + computed + context);
        }
    }

    public List<MessageProof> proveAll(ScanContext ctx,
                                       long blockNumber,
                                       String blockHash,
                                       String commitment,
                                       List<SelectedMessage> selected) {
        List<MessageProof> proofs;
        if (executor == null || selected.size() <= 1) {
            proofs = new ArrayList<>(selected.size());
            for (SelectedMessage s : selected) {
                ctx.checkCancelled("prove message");
                proofs.add(proveAndVerify(blockNumber, blockHash, commitment, s));
            }
        } else {
            proofs = proveConcurrently(ctx, blockNumber, blockHash, commitment, selected);
        }
        proofs.sort(Comparator.comparingLong(p -> p.getMessage().getNonce()));
        return proofs;
    }

    private List<MessageProof> proveConcurrently(ScanContext ctx,
                                                 long blockNumber,
                                                 String blockHash,
                                                 String commitment,
                                                 List<SelectedMessage> selected) {
        ctx.checkCancelled("prove message");
        List<CompletableFuture<MessageProof>> futures = new ArrayList<>(selected.size());
        for (SelectedMessage s : selected) {
            futures.add(CompletableFuture.supplyAsync(() -> {
                ctx.checkCancelled("prove message");
                return proveAndVerify(blockNumber, blockHash, commitment, s);
            }, executor));
        }
        List<MessageProof> proofs = new ArrayList<>(futures.size());
        try {
            for (CompletableFuture<MessageProof> f : futures) {
                proofs.add(f.join());
            }
        } catch (CompletionException e) {
            futures.forEach(f -> f.cancel(true));
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw e;
        }
        log.debug("Fetched message proofs concurrently. blockNumber={} count={}", blockNumber, proofs.size());
        return proofs;
    }

    private MessageProof proveAndVerify(long blockNumber, String blockHash, String commitment, SelectedMessage s) {
        MessageProof proof = proveMessage(blockHash, s.getIndex(), s.getMessage());
        verify(proof, commitment, blockNumber, s.getIndex());
        return proof;
    }
}
