package com.work.relay.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 交给下游提交方的完整中继任务：一个源链区块的待投递消息 + 包含证明 + 最终性证明输入。
 *
 * <p>只由 TaskBuilder 在所有字段齐备后创建，创建后不可变。</p>
 */
public class Task {

    private final ParachainHeader header;
    private final List<MessageProof> messageProofs;
    private final ProofInput proofInput;

    public Task(ParachainHeader header, List<MessageProof> messageProofs, ProofInput proofInput) {
        this.header = Objects.requireNonNull(header, "header");
        this.messageProofs = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(messageProofs, "messageProofs")));
        this.proofInput = Objects.requireNonNull(proofInput, "proofInput");
    }

    public ParachainHeader getHeader() {
        return header;
    }

    public List<MessageProof> getMessageProofs() {
        return messageProofs;
    }

    public ProofInput getProofInput() {
        return proofInput;
    }

    public long getMinNonce() {
        return messageProofs.get(0).getMessage().getNonce();
    }

    public long getMaxNonce() {
        return messageProofs.get(messageProofs.size() - 1).getMessage().getNonce();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Task)) return false;
        Task task = (Task) o;
        return header.equals(task.header) && messageProofs.equals(task.messageProofs) && proofInput.equals(task.proofInput);
    }

    @Override
    public int hashCode() {
        return Objects.hash(header, messageProofs, proofInput);
    }

    @Override
    public String toString() {
        return "Task{paraBlockNumber=" + header.getNumber()
                + ", nonces=" + getMinNonce() + ".." + getMaxNonce()
                + ", relayBlockNumber=" + proofInput.getRelayBlockNumber() + "}";
    }
}
