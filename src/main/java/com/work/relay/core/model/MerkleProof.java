package com.work.relay.core.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 源链 OutboundQueueApi_prove_message 返回的位置证明（按叶子下标，而不是按内容寻址）。
 * leaf 为叶子哈希（keccak256 后的 H256）。
 */
public class MerkleProof {

    private final String root;
    private final List<String> proofItems;
    private final long numberOfLeaves;
    private final long leafIndex;
    private final byte[] leaf;

    public MerkleProof(String root, List<String> proofItems, long numberOfLeaves, long leafIndex, byte[] leaf) {
        this.root = root;
        this.proofItems = proofItems == null ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(proofItems));
        this.numberOfLeaves = numberOfLeaves;
        this.leafIndex = leafIndex;
        this.leaf = leaf == null ? new byte[0] : leaf.clone();
    }

    public String getRoot() {
        return root;
    }

    public List<String> getProofItems() {
        return proofItems;
    }

    public long getNumberOfLeaves() {
        return numberOfLeaves;
    }

    public long getLeafIndex() {
        return leafIndex;
    }

    public byte[] getLeaf() {
        return leaf.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MerkleProof)) return false;
        MerkleProof that = (MerkleProof) o;
        return numberOfLeaves == that.numberOfLeaves
                && leafIndex == that.leafIndex
                && Objects.equals(root, that.root)
                && proofItems.equals(that.proofItems)
                && Arrays.equals(leaf, that.leaf);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(root, proofItems, numberOfLeaves, leafIndex);
        return 31 * result + Arrays.hashCode(leaf);
    }
}
