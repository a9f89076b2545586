package com.work.relay.host.chain.substrate;

import net.openhft.hashing.LongHashFunction;
import org.web3j.utils.Numeric;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;

/**
 * Substrate 存储键：twox128(pallet) ++ twox128(item) [++ hasher(key)]。
 */
public final class StorageKeys {

    private static final LongHashFunction XX_SEED_0 = LongHashFunction.xx(0);
    private static final LongHashFunction XX_SEED_1 = LongHashFunction.xx(1);

    private StorageKeys() {
        throw new AssertionError("工具类不允许实例化");
    }

    public static byte[] twox64(byte[] data) {
        return ByteBuffer.allocate(8).order(ByteOrder.LITTLE_ENDIAN).putLong(XX_SEED_0.hashBytes(data)).array();
    }

    public static byte[] twox128(byte[] data) {
        return ByteBuffer.allocate(16).order(ByteOrder.LITTLE_ENDIAN)
                .putLong(XX_SEED_0.hashBytes(data))
                .putLong(XX_SEED_1.hashBytes(data))
                .array();
    }

    public static byte[] twox64Concat(byte[] key) {
        byte[] hash = twox64(key);
        byte[] out = new byte[hash.length + key.length];
        System.arraycopy(hash, 0, out, 0, hash.length);
        System.arraycopy(key, 0, out, hash.length, key.length);
        return out;
    }

    public static byte[] u32(long value) {
        return ByteBuffer.allocate(4).order(ByteOrder.LITTLE_ENDIAN).putInt((int) value).array();
    }

    public static byte[] u64(long value) {
        return ByteBuffer.allocate(8).order(ByteOrder.LITTLE_ENDIAN).putLong(value).array();
    }

    /**
     * StorageValue 的键，也是 StorageMap 的前缀。
     */
    public static String plain(String pallet, String item) {
        return Numeric.toHexString(prefix(pallet, item));
    }

    /**
     * 以 u32 为键、Twox64Concat 为 hasher 的 StorageMap 条目。
     */
    public static String twox64ConcatU32(String pallet, String item, long key) {
        byte[] prefix = prefix(pallet, item);
        byte[] hashed = twox64Concat(u32(key));
        byte[] out = new byte[prefix.length + hashed.length];
        System.arraycopy(prefix, 0, out, 0, prefix.length);
        System.arraycopy(hashed, 0, out, prefix.length, hashed.length);
        return Numeric.toHexString(out);
    }

    /**
     * 从 Twox64Concat(u32) 的完整键中取回原始 u32 键。
     */
    public static long u32FromTwox64ConcatKey(String fullKey) {
        byte[] bytes = Numeric.hexStringToByteArray(fullKey);
        if (bytes.length < 32 + 8 + 4) {
            throw new IllegalArgumentException("storage key too short: " + fullKey);
        }
        return ByteBuffer.wrap(bytes, bytes.length - 4, 4).order(ByteOrder.LITTLE_ENDIAN).getInt() & 0xffffffffL;
    }

    private static byte[] prefix(String pallet, String item) {
        byte[] p = twox128(pallet.getBytes(StandardCharsets.UTF_8));
        byte[] i = twox128(item.getBytes(StandardCharsets.UTF_8));
        byte[] out = new byte[p.length + i.length];
        System.arraycopy(p, 0, out, 0, p.length);
        System.arraycopy(i, 0, out, p.length, i.length);
        return out;
    }
}
