package com.work.relay.core.scan;

import com.work.relay.core.model.MessageProof;
import com.work.relay.core.model.ParachainHeader;
import com.work.relay.core.model.ProofInput;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 构建中的任务，只在扫描组件内部流转：
 * CommitmentScanner 创建并填入 proofs，InclusionFinder 填入 proofInput，最后由 TaskBuilder 转为不可变的 Task。
 */
public class PendingTask {

    private final ParachainHeader header;
    private final List<MessageProof> messageProofs;
    private ProofInput proofInput;

    PendingTask(ParachainHeader header, List<MessageProof> messageProofs) {
        this.header = header;
        this.messageProofs = Collections.unmodifiableList(new ArrayList<>(messageProofs));
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

    void setProofInput(ProofInput proofInput) {
        this.proofInput = proofInput;
    }
}
