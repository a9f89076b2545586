package com.work.relay.core.merkle;

import com.work.relay.core.model.MerkleProof;
import org.junit.jupiter.api.Test;
import org.web3j.crypto.Hash;
import org.web3j.utils.Numeric;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class MerkleTreeTest {

    @Test
    public void leaf_hash_is_keccak256() {
        assertEquals("0xc5d2460186f7233c927e7db2dcc703c0e500b653ca82273b7bfad8045d85a470",
                Numeric.toHexString(MerkleTree.hashLeaf(new byte[0])));
    }

    @Test
    public void pair_hash_is_order_independent() {
        byte[] a = MerkleTree.hashLeaf(bytes("a"));
        byte[] b = MerkleTree.hashLeaf(bytes("b"));

        assertArrayEquals(MerkleTree.hashPair(a, b), MerkleTree.hashPair(b, a));
    }

    @Test
    public void pair_ordering_compares_unsigned_bytes() {
        byte[] low = new byte[32];
        low[0] = 0x7f;
        byte[] high = new byte[32];
        high[0] = (byte) 0x80;

        byte[] expected = new byte[64];
        System.arraycopy(low, 0, expected, 0, 32);
        System.arraycopy(high, 0, expected, 32, 32);
        assertArrayEquals(Hash.sha3(expected), MerkleTree.hashPair(high, low));
    }

    @Test
    public void single_leaf_root_is_leaf_hash() {
        byte[] leaf = bytes("only");

        assertEquals(Numeric.toHexString(MerkleTree.hashLeaf(leaf)), MerkleTree.root(Collections.singletonList(leaf)));
        MerkleProof proof = MerkleTree.prove(Collections.singletonList(leaf), 0);
        assertTrue(proof.getProofItems().isEmpty());
    }

    @Test
    public void odd_node_is_promoted_without_hashing() {
        List<byte[]> leaves = Arrays.asList(bytes("a"), bytes("b"), bytes("c"));
        byte[] ab = MerkleTree.hashPair(MerkleTree.hashLeaf(bytes("a")), MerkleTree.hashLeaf(bytes("b")));
        byte[] expected = MerkleTree.hashPair(ab, MerkleTree.hashLeaf(bytes("c")));

        assertEquals(Numeric.toHexString(expected), MerkleTree.root(leaves));

        MerkleProof proof = MerkleTree.prove(leaves, 2);
        assertEquals(Collections.singletonList(Numeric.toHexString(ab)), proof.getProofItems());
    }

    @Test
    public void every_proof_recomputes_root() {
        List<byte[]> leaves = new ArrayList<>();
        for (int i = 0; i < 7; i++) {
            leaves.add(bytes("message-" + i));
        }
        String root = MerkleTree.root(leaves);
        for (int i = 0; i < leaves.size(); i++) {
            MerkleProof proof = MerkleTree.prove(leaves, i);
            assertEquals(root, proof.getRoot());
            assertEquals(i, proof.getLeafIndex());
            assertEquals(7L, proof.getNumberOfLeaves());
            assertEquals(root, MerkleTree.computeRoot(proof.getLeaf(), proof.getProofItems()));
        }
    }

    @Test
    public void proof_leaf_is_leaf_hash_and_is_not_hashed_again() {
        List<byte[]> leaves = Arrays.asList(bytes("a"), bytes("b"));
        MerkleProof proof = MerkleTree.prove(leaves, 0);

        assertArrayEquals(MerkleTree.hashLeaf(bytes("a")), proof.getLeaf());
        String expected = Numeric.toHexString(MerkleTree.hashPair(MerkleTree.hashLeaf(bytes("a")), MerkleTree.hashLeaf(bytes("b"))));
        assertEquals(expected, MerkleTree.computeRoot(proof.getLeaf(), proof.getProofItems()));
        assertNotEquals(expected, MerkleTree.computeRoot(MerkleTree.hashLeaf(proof.getLeaf()), proof.getProofItems()));
    }

    @Test
    public void empty_tree_is_rejected() {
        assertThrows(IllegalArgumentException.class, () -> MerkleTree.root(Collections.<byte[]>emptyList()));
        assertThrows(IllegalArgumentException.class, () -> MerkleTree.prove(Collections.singletonList(bytes("a")), 1));
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }
}
