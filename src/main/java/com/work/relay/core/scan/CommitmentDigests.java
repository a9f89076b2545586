package com.work.relay.core.scan;

import com.work.relay.core.model.DigestItem;
import com.work.relay.core.model.ParachainHeader;
import org.web3j.utils.Numeric;

import java.util.Arrays;
import java.util.Optional;

/**
 * 从区块头 digest 中提取 outbound queue commitment。
 *
 * <p>commitment 以 {@code DigestItem::Other} 形式写入，负载为 {@code 0x00 ++ H256}。</p>
 */
public final class CommitmentDigests {

    static final byte COMMITMENT_KIND = 0x00;
    private static final int HASH_LENGTH = 32;

    private CommitmentDigests() {
        throw new AssertionError("工具类不允许实例化");
    }

    public static Optional<String> extract(ParachainHeader header) {
        for (DigestItem item : header.getDigest()) {
            if (item.getKind() != DigestItem.Kind.OTHER) {
                continue;
            }
            byte[] data = item.getData();
            if (data.length == HASH_LENGTH + 1 && data[0] == COMMITMENT_KIND) {
                return Optional.of(Numeric.toHexString(Arrays.copyOfRange(data, 1, data.length)));
            }
        }
        return Optional.empty();
    }

    /**
     * 构造 commitment digest 项（内存链与测试使用）。
     */
    public static DigestItem toDigestItem(String commitment) {
        byte[] hash = Numeric.hexStringToByteArray(commitment);
        byte[] data = new byte[hash.length + 1];
        data[0] = COMMITMENT_KIND;
        System.arraycopy(hash, 0, data, 1, hash.length);
        return DigestItem.other(data);
    }
}
