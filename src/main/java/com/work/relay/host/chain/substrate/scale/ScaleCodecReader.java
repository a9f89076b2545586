package com.work.relay.host.chain.substrate.scale;

import com.work.relay.core.exception.DecodeException;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.util.Arrays;

/**
 * 最小的 SCALE 解码器，只覆盖扫描需要的基本类型（小端定长整数、compact 整数、Vec&lt;u8&gt;、Option 标记）。
 *
 * <p>数据不足或格式非法一律抛出 {@link DecodeException}。</p>
 */
public class ScaleCodecReader {

    private final byte[] source;
    private int pos;

    public ScaleCodecReader(byte[] source) {
        this.source = source == null ? new byte[0] : source;
    }

    public static ScaleCodecReader ofHex(String hex) {
        return new ScaleCodecReader(Numeric.hexStringToByteArray(hex));
    }

    public boolean hasNext() {
        return pos < source.length;
    }

    public int remaining() {
        return source.length - pos;
    }

    public int readUByte() {
        require(1);
        return source[pos++] & 0xff;
    }

    public byte[] readFixed(int length) {
        require(length);
        byte[] out = Arrays.copyOfRange(source, pos, pos + length);
        pos += length;
        return out;
    }

    public long readUint32() {
        byte[] b = readFixed(4);
        return (b[0] & 0xffL)
                | (b[1] & 0xffL) << 8
                | (b[2] & 0xffL) << 16
                | (b[3] & 0xffL) << 24;
    }

    public long readUint64() {
        byte[] b = readFixed(8);
        long value = 0;
        for (int i = 7; i >= 0; i--) {
            value = (value << 8) | (b[i] & 0xffL);
        }
        if (value < 0) {
            throw new DecodeException("u64 value exceeds supported range at offset " + (pos - 8));
        }
        return value;
    }

    public long readCompact() {
        int b0 = readUByte();
        switch (b0 & 0x03) {
            case 0:
                return b0 >>> 2;
            case 1: {
                int b1 = readUByte();
                return ((b1 << 8) | b0) >>> 2;
            }
            case 2: {
                long rest = (long) readUByte() | (long) readUByte() << 8 | (long) readUByte() << 16;
                return ((rest << 8) | b0) >>> 2;
            }
            default: {
                int length = (b0 >>> 2) + 4;
                byte[] le = readFixed(length);
                byte[] be = new byte[length];
                for (int i = 0; i < length; i++) {
                    be[i] = le[length - 1 - i];
                }
                BigInteger value = new BigInteger(1, be);
                if (value.bitLength() > 63) {
                    throw new DecodeException("compact integer exceeds supported range: " + value);
                }
                return value.longValue();
            }
        }
    }

    public int readCompactLength() {
        long length = readCompact();
        if (length > remaining()) {
            throw new DecodeException("declared length " + length + " exceeds remaining " + remaining() + " bytes");
        }
        return (int) length;
    }

    public byte[] readByteArray() {
        return readFixed(readCompactLength());
    }

    public String readHash256() {
        return Numeric.toHexString(readFixed(32));
    }

    public boolean readOptionFlag() {
        int flag = readUByte();
        if (flag > 1) {
            throw new DecodeException("invalid Option flag " + flag + " at offset " + (pos - 1));
        }
        return flag == 1;
    }

    public void requireFullyConsumed(String what) {
        if (hasNext()) {
            throw new DecodeException(what + " has " + remaining() + " trailing bytes");
        }
    }

    private void require(int length) {
        if (length < 0 || pos + length > source.length) {
            throw new DecodeException("unexpected end of SCALE input: need " + length + " bytes at offset " + pos
                    + ", have " + remaining());
        }
    }
}
