package com.work.relay.host.chain.substrate.scale;

import com.work.relay.core.exception.DecodeException;
import com.work.relay.core.model.DigestItem;
import com.work.relay.core.model.MerkleProof;
import com.work.relay.core.model.OutboundQueueMessage;
import com.work.relay.core.model.ParachainHeader;
import com.work.relay.core.model.PersistedValidationData;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 源链/中继链存储值与 runtime API 返回值的 SCALE 结构定义。
 */
public final class SubstrateDecoders {

    private static final int ENGINE_ID_LENGTH = 4;
    private static final int HASH_LENGTH = 32;

    private SubstrateDecoders() {
        throw new AssertionError("工具类不允许实例化");
    }

    /**
     * parentHash, number(compact), stateRoot, extrinsicsRoot, digest
     */
    public static ParachainHeader decodeHeader(byte[] bytes) {
        ScaleCodecReader reader = new ScaleCodecReader(bytes);
        String parentHash = reader.readHash256();
        long number = reader.readCompact();
        String stateRoot = reader.readHash256();
        String extrinsicsRoot = reader.readHash256();
        int count = reader.readCompactLength();
        List<DigestItem> digest = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            digest.add(readDigestItem(reader));
        }
        return new ParachainHeader(null, parentHash, number, stateRoot, extrinsicsRoot, digest);
    }

    /**
     * HeadData 是 Vec&lt;u8&gt; 包裹的 SCALE 区块头。
     */
    public static ParachainHeader decodeHeadData(byte[] bytes) {
        ScaleCodecReader reader = new ScaleCodecReader(bytes);
        return decodeHeader(reader.readByteArray());
    }

    public static DigestItem decodeDigestItem(byte[] bytes) {
        ScaleCodecReader reader = new ScaleCodecReader(bytes);
        DigestItem item = readDigestItem(reader);
        reader.requireFullyConsumed("digest item");
        return item;
    }

    public static List<OutboundQueueMessage> decodeMessages(byte[] bytes) {
        ScaleCodecReader reader = new ScaleCodecReader(bytes);
        int count = reader.readCompactLength();
        List<OutboundQueueMessage> messages = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            long origin = reader.readUint32();
            long nonce = reader.readUint64();
            int command = reader.readUByte();
            byte[] params = reader.readByteArray();
            messages.add(new OutboundQueueMessage(origin, nonce, command, params));
        }
        reader.requireFullyConsumed("outbound queue messages");
        return messages;
    }

    /**
     * Option&lt;MerkleProof&gt;：root, proof(Vec&lt;H256&gt;), numberOfLeaves(u64), leafIndex(u64), leaf(H256)
     */
    public static Optional<MerkleProof> decodeOptionalMerkleProof(byte[] bytes) {
        ScaleCodecReader reader = new ScaleCodecReader(bytes);
        if (!reader.readOptionFlag()) {
            return Optional.empty();
        }
        String root = reader.readHash256();
        int count = reader.readCompactLength();
        List<String> items = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            items.add(reader.readHash256());
        }
        long numberOfLeaves = reader.readUint64();
        long leafIndex = reader.readUint64();
        byte[] leaf = reader.readFixed(HASH_LENGTH);
        reader.requireFullyConsumed("merkle proof");
        return Optional.of(new MerkleProof(root, items, numberOfLeaves, leafIndex, leaf));
    }

    public static PersistedValidationData decodeValidationData(byte[] bytes) {
        ScaleCodecReader reader = new ScaleCodecReader(bytes);
        byte[] parentHead = reader.readByteArray();
        long relayParentNumber = reader.readUint32();
        String relayParentStorageRoot = reader.readHash256();
        long maxPovSize = reader.readUint32();
        return new PersistedValidationData(parentHead, relayParentNumber, relayParentStorageRoot, maxPovSize);
    }

    public static long decodeUint64(byte[] bytes) {
        ScaleCodecReader reader = new ScaleCodecReader(bytes);
        long value = reader.readUint64();
        reader.requireFullyConsumed("u64");
        return value;
    }

    private static DigestItem readDigestItem(ScaleCodecReader reader) {
        int variant = reader.readUByte();
        switch (variant) {
            case 0:
                return DigestItem.other(reader.readByteArray());
            case 4:
                return new DigestItem(DigestItem.Kind.CONSENSUS, reader.readFixed(ENGINE_ID_LENGTH), reader.readByteArray());
            case 5:
                return new DigestItem(DigestItem.Kind.SEAL, reader.readFixed(ENGINE_ID_LENGTH), reader.readByteArray());
            case 6:
                return new DigestItem(DigestItem.Kind.PRE_RUNTIME, reader.readFixed(ENGINE_ID_LENGTH), reader.readByteArray());
            case 8:
                return new DigestItem(DigestItem.Kind.RUNTIME_ENVIRONMENT_UPDATED, null, null);
            default:
                throw new DecodeException("unknown digest item variant " + variant);
        }
    }
}
