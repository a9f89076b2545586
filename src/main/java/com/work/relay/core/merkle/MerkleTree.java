package com.work.relay.core.merkle;

import com.work.relay.core.model.MerkleProof;
import org.web3j.crypto.Hash;
import org.web3j.utils.Numeric;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * 与源链 outbound queue 一致的二叉 merkle 树：
 * <ul>
 *   <li>叶子哈希 = keccak256(编码后的消息)，树与证明都建立在叶子哈希之上</li>
 *   <li>父节点 = keccak256(min(a,b) ++ max(a,b))，按无符号字节序排序</li>
 *   <li>奇数行的最后一个节点直接提升到上一层，不参与哈希</li>
 * </ul>
 */
public final class MerkleTree {

    private MerkleTree() {
        throw new AssertionError("工具类不允许实例化");
    }

    public static byte[] hashLeaf(byte[] leaf) {
        return Hash.sha3(leaf);
    }

    public static byte[] hashPair(byte[] a, byte[] b) {
        byte[] combined = new byte[a.length + b.length];
        if (Arrays.compareUnsigned(a, b) < 0) {
            System.arraycopy(a, 0, combined, 0, a.length);
            System.arraycopy(b, 0, combined, a.length, b.length);
        } else {
            System.arraycopy(b, 0, combined, 0, b.length);
            System.arraycopy(a, 0, combined, b.length, a.length);
        }
        return Hash.sha3(combined);
    }

    public static String root(List<byte[]> leaves) {
        if (leaves.isEmpty()) {
            throw new IllegalArgumentException("leaves 不能为空");
        }
        List<byte[]> row = new ArrayList<>(leaves.size());
        for (byte[] leaf : leaves) {
            row.add(hashLeaf(leaf));
        }
        while (row.size() > 1) {
            row = nextRow(row);
        }
        return Numeric.toHexString(row.get(0));
    }

    /**
     * 为第 leafIndex 个叶子生成证明。
     */
    public static MerkleProof prove(List<byte[]> leaves, int leafIndex) {
        if (leafIndex < 0 || leafIndex >= leaves.size()) {
            throw new IllegalArgumentException("leafIndex 越界: " + leafIndex);
        }
        List<byte[]> row = new ArrayList<>(leaves.size());
        for (byte[] leaf : leaves) {
            row.add(hashLeaf(leaf));
        }
        List<String> items = new ArrayList<>();
        int position = leafIndex;
        while (row.size() > 1) {
            int sibling = (position % 2 == 0) ? position + 1 : position - 1;
            if (sibling < row.size()) {
                items.add(Numeric.toHexString(row.get(sibling)));
            }
            row = nextRow(row);
            position /= 2;
        }
        return new MerkleProof(Numeric.toHexString(row.get(0)), items, leaves.size(), leafIndex, hashLeaf(leaves.get(leafIndex)));
    }

    /**
     * 由叶子哈希（H256，不再二次哈希）与证明路径重新计算 root。
     */
    public static String computeRoot(byte[] leafHash, List<String> proofItems) {
        byte[] computed = leafHash;
        for (String item : proofItems) {
            computed = hashPair(computed, Numeric.hexStringToByteArray(item));
        }
        return Numeric.toHexString(computed);
    }

    private static List<byte[]> nextRow(List<byte[]> row) {
        List<byte[]> next = new ArrayList<>((row.size() + 1) / 2);
        for (int i = 0; i < row.size(); i += 2) {
            if (i + 1 < row.size()) {
                next.add(hashPair(row.get(i), row.get(i + 1)));
            } else {
                next.add(row.get(i));
            }
        }
        return next;
    }
}
