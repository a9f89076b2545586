package com.work.relay.core.model;

import java.util.Objects;

public class MessageProof {

    private final OutboundQueueMessage message;
    private final MerkleProof proof;

    public MessageProof(OutboundQueueMessage message, MerkleProof proof) {
        this.message = Objects.requireNonNull(message, "message");
        this.proof = Objects.requireNonNull(proof, "proof");
    }

    public OutboundQueueMessage getMessage() {
        return message;
    }

    public MerkleProof getProof() {
        return proof;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MessageProof)) return false;
        MessageProof that = (MessageProof) o;
        return message.equals(that.message) && proof.equals(that.proof);
    }

    @Override
    public int hashCode() {
        return Objects.hash(message, proof);
    }
}
