package com.work.relay.host.chain.mock;

import com.work.relay.core.chain.CheckpointSource;
import com.work.relay.core.chain.GatewayClient;
import com.work.relay.core.chain.ParachainClient;
import com.work.relay.core.chain.RelayChainClient;
import com.work.relay.core.merkle.MerkleTree;
import com.work.relay.core.model.ChannelNonces;
import com.work.relay.core.model.DigestItem;
import com.work.relay.core.model.MerkleProof;
import com.work.relay.core.model.OutboundQueueMessage;
import com.work.relay.core.model.ParaHead;
import com.work.relay.core.model.ParachainHeader;
import com.work.relay.core.model.PersistedValidationData;
import com.work.relay.core.scan.CommitmentDigests;
import com.work.relay.core.exception.MissingStateException;
import org.web3j.crypto.Hash;
import org.web3j.utils.Numeric;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;
import java.util.TreeMap;

/**
 * 内存版的三条链（目标链 gateway、源平行链、中继链），仅用于 demo 与测试，真实部署请使用 rpc 模式。
 *
 * <ul>
 *   <li>平行链区块按需补齐：head 以内未显式写入的区块视为没有消息的空区块</li>
 *   <li>有消息的区块会写入真实的 merkle commitment，证明由 {@link MerkleTree} 生成</li>
 *   <li>中继链区块记录的平行链 head 沿用最近一次设置的值</li>
 * </ul>
 *
 * <p>由于平行链与中继链的查询方法同名，按链分别通过 {@link #parachain()}、{@link #relayChain()} 等视图暴露。
 * 所有访问都在同一把锁下进行，可被多个扫描并发读取。</p>
 */
public class MockBridgeChain {

    private final long paraId;

    private final NavigableMap<Long, ParaBlock> paraBlocks = new TreeMap<>();
    private final Map<String, Long> paraNumberByHash = new HashMap<>();
    private long paraHeadNumber;

    private final NavigableMap<Long, Long> includedParaHeads = new TreeMap<>();
    private final Map<Long, byte[]> otherParaHeads = new TreeMap<>();
    private long relayHeadNumber;

    private final Map<Long, Long> deliveredNonces = new HashMap<>();
    private final Set<Long> prunedProofs = new HashSet<>();
    private final Set<Long> tamperedProofs = new HashSet<>();
    private final Set<Long> missingValidationData = new HashSet<>();
    private Long checkpointOverride;

    public MockBridgeChain(long paraId) {
        this.paraId = paraId;
    }

    // ---------------------------------------------------------------- 构造链状态

    /**
     * 写入一个平行链区块，backed 于 relayParentNumber。messages 为整个区块的消息（可包含多个 channel）。
     */
    public synchronized void addParachainBlock(long number, long relayParentNumber, List<OutboundQueueMessage> messages) {
        if (number <= 0) {
            throw new IllegalArgumentException("number 必须大于0");
        }
        String hash = blockHash("para", number);
        ParaBlock block = new ParaBlock(number, hash, relayParentNumber, new ArrayList<>(messages));
        paraBlocks.put(number, block);
        paraNumberByHash.put(hash, number);
        paraHeadNumber = Math.max(paraHeadNumber, number);
    }

    /**
     * 中继链在 relayBlockNumber 处记录平行链 head = paraBlockNumber，之后的中继链区块沿用该值。
     */
    public synchronized void includeParachainBlock(long relayBlockNumber, long paraBlockNumber) {
        includedParaHeads.put(relayBlockNumber, paraBlockNumber);
        relayHeadNumber = Math.max(relayHeadNumber, relayBlockNumber);
    }

    public synchronized void registerOtherParachain(long otherParaId, byte[] headData) {
        otherParaHeads.put(otherParaId, headData.clone());
    }

    public synchronized void setDeliveredNonce(long channelId, long nonce) {
        deliveredNonces.put(channelId, nonce);
    }

    public synchronized void setCheckpoint(long relayBlockNumber) {
        this.checkpointOverride = relayBlockNumber;
        relayHeadNumber = Math.max(relayHeadNumber, relayBlockNumber);
    }

    /**
     * 故障注入：该区块的 prove_message 返回空。
     */
    public synchronized void pruneProofs(long paraBlockNumber) {
        prunedProofs.add(paraBlockNumber);
    }

    /**
     * 故障注入：该区块的证明 root 与 commitment 不一致。
     */
    public synchronized void tamperProofs(long paraBlockNumber) {
        tamperedProofs.add(paraBlockNumber);
    }

    public synchronized void dropValidationData(long paraBlockNumber) {
        missingValidationData.add(paraBlockNumber);
    }

    public long getParaId() {
        return paraId;
    }

    public GatewayClient gateway() {
        return gateway;
    }

    public ParachainClient parachain() {
        return parachain;
    }

    public RelayChainClient relayChain() {
        return relayChain;
    }

    public CheckpointSource checkpoints() {
        return checkpoints;
    }

    private final GatewayClient gateway = new GatewayClient() {
        @Override
        public ChannelNonces channelNonces(long channelId) {
            synchronized (MockBridgeChain.this) {
                return new ChannelNonces(deliveredNonces.getOrDefault(channelId, 0L), 0L);
            }
        }
    };

    private final CheckpointSource checkpoints = new CheckpointSource() {
        @Override
        public long latestCheckpoint() {
            synchronized (MockBridgeChain.this) {
                return checkpointOverride != null ? checkpointOverride : relayHeadNumber;
            }
        }
    };

    private final ParachainClient parachain = new ParachainClient() {
        @Override
        public String getBlockHash(long blockNumber) {
            synchronized (MockBridgeChain.this) {
                return paraBlock(blockNumber).hash;
            }
        }

        @Override
        public ParachainHeader getHeader(String blockHash) {
            synchronized (MockBridgeChain.this) {
                return header(paraBlockByHash(blockHash));
            }
        }

        @Override
        public OptionalLong getOutboundNonce(long channelId, String blockHash) {
            synchronized (MockBridgeChain.this) {
                ParaBlock at = paraBlockByHash(blockHash);
                long max = -1;
                for (ParaBlock block : paraBlocks.headMap(at.number, true).values()) {
                    for (OutboundQueueMessage m : block.messages) {
                        if (m.getChannelId() == channelId) {
                            max = Math.max(max, m.getNonce());
                        }
                    }
                }
                return max < 0 ? OptionalLong.empty() : OptionalLong.of(max);
            }
        }

        @Override
        public Optional<List<OutboundQueueMessage>> getCommittedMessages(String blockHash) {
            synchronized (MockBridgeChain.this) {
                ParaBlock block = paraBlockByHash(blockHash);
                if (block.messages.isEmpty()) {
                    return Optional.empty();
                }
                return Optional.of(Collections.unmodifiableList(block.messages));
            }
        }

        @Override
        public Optional<MerkleProof> proveMessage(String blockHash, long leafIndex) {
            synchronized (MockBridgeChain.this) {
                ParaBlock block = paraBlockByHash(blockHash);
                if (prunedProofs.contains(block.number) || leafIndex < 0 || leafIndex >= block.messages.size()) {
                    return Optional.empty();
                }
                MerkleProof proof = MerkleTree.prove(leaves(block.messages), (int) leafIndex);
                if (tamperedProofs.contains(block.number)) {
                    proof = new MerkleProof(blockHash("tampered", block.number), proof.getProofItems(),
                            proof.getNumberOfLeaves(), proof.getLeafIndex(), proof.getLeaf());
                }
                return Optional.of(proof);
            }
        }

        @Override
        public Optional<PersistedValidationData> getValidationData(String blockHash) {
            synchronized (MockBridgeChain.this) {
                ParaBlock block = paraBlockByHash(blockHash);
                if (missingValidationData.contains(block.number)) {
                    return Optional.empty();
                }
                return Optional.of(new PersistedValidationData(new byte[0], block.relayParentNumber,
                        blockHash("relay-storage", block.relayParentNumber), 5 * 1024 * 1024));
            }
        }
    };

    private final RelayChainClient relayChain = new RelayChainClient() {
        @Override
        public String getBlockHash(long blockNumber) {
            synchronized (MockBridgeChain.this) {
                if (blockNumber < 0 || blockNumber > relayHeadNumber) {
                    throw new MissingStateException("relaychain block not found. blockNumber=" + blockNumber);
                }
                return relayBlockHashOf(blockNumber);
            }
        }

        @Override
        public Optional<ParachainHeader> getParachainHead(long queriedParaId, String relayBlockHash) {
            synchronized (MockBridgeChain.this) {
                return paraHeadAt(queriedParaId, relayBlockHash);
            }
        }

        @Override
        public List<ParaHead> getParachainHeads(String relayBlockHash) {
            synchronized (MockBridgeChain.this) {
                List<ParaHead> heads = new ArrayList<>();
                for (Map.Entry<Long, byte[]> e : otherParaHeads.entrySet()) {
                    heads.add(new ParaHead(e.getKey(), e.getValue()));
                }
                // 内存链不做 SCALE 编码，head data 用区块 hash 代替
                paraHeadAt(paraId, relayBlockHash).ifPresent(h ->
                        heads.add(new ParaHead(paraId, Numeric.hexStringToByteArray(blockHash("para", h.getNumber())))));
                return heads;
            }
        }
    };

    // ---------------------------------------------------------------- internals

    private ParaBlock paraBlock(long number) {
        if (number <= 0 || number > paraHeadNumber) {
            throw new MissingStateException("parachain block not found. blockNumber=" + number);
        }
        ParaBlock block = paraBlocks.get(number);
        if (block == null) {
            // 空区块：backed 于前一个已知区块的 relay parent
            Map.Entry<Long, ParaBlock> prev = paraBlocks.lowerEntry(number);
            long relayParent = prev == null ? 0L : prev.getValue().relayParentNumber;
            block = new ParaBlock(number, blockHash("para", number), relayParent, Collections.emptyList());
            paraBlocks.put(number, block);
            paraNumberByHash.put(block.hash, number);
        }
        return block;
    }

    private Optional<ParachainHeader> paraHeadAt(long queriedParaId, String relayBlockHash) {
        if (queriedParaId != paraId) {
            return Optional.empty();
        }
        Map.Entry<Long, Long> included = includedParaHeads.floorEntry(relayNumber(relayBlockHash));
        if (included == null) {
            return Optional.empty();
        }
        return Optional.of(header(paraBlock(included.getValue())).withHash(null));
    }

    private ParaBlock paraBlockByHash(String blockHash) {
        Long number = paraNumberByHash.get(blockHash);
        if (number == null) {
            throw new MissingStateException("parachain block not found. blockHash=" + blockHash);
        }
        return paraBlock(number);
    }

    private long relayNumber(String relayBlockHash) {
        // 中继链 hash 直接编码区块号
        byte[] bytes = Numeric.hexStringToByteArray(relayBlockHash);
        return ByteBuffer.wrap(bytes, bytes.length - 8, 8).getLong();
    }

    /**
     * 中继链 hash：高 24 字节为标签哈希，低 8 字节为区块号，便于反查。
     */
    public static String relayBlockHashOf(long number) {
        byte[] tag = Hash.sha3(("relay:" + number).getBytes(StandardCharsets.UTF_8));
        ByteBuffer buf = ByteBuffer.allocate(32);
        buf.put(tag, 0, 24);
        buf.putLong(number);
        return Numeric.toHexString(buf.array());
    }

    @Override
    public String toString() {
        return "MockBridgeChain{paraId=" + paraId + "}";
    }

    private ParachainHeader header(ParaBlock block) {
        List<DigestItem> digest = new ArrayList<>();
        digest.add(new DigestItem(DigestItem.Kind.PRE_RUNTIME, "aura".getBytes(StandardCharsets.US_ASCII),
                ByteBuffer.allocate(8).putLong(block.number).array()));
        if (!block.messages.isEmpty()) {
            digest.add(CommitmentDigests.toDigestItem(MerkleTree.root(leaves(block.messages))));
        }
        String parentHash = block.number == 1 ? Numeric.toHexString(new byte[32]) : blockHash("para", block.number - 1);
        return new ParachainHeader(block.hash, parentHash, block.number,
                blockHash("state", block.number), blockHash("extrinsics", block.number), digest);
    }

    /**
     * 内存链的叶子编码：channelId(4) ++ nonce(8) ++ command(1) ++ params，仅需在本实现内自洽。
     */
    static List<byte[]> leaves(List<OutboundQueueMessage> messages) {
        List<byte[]> leaves = new ArrayList<>(messages.size());
        for (OutboundQueueMessage m : messages) {
            byte[] params = m.getParams();
            leaves.add(ByteBuffer.allocate(13 + params.length)
                    .putInt((int) m.getChannelId())
                    .putLong(m.getNonce())
                    .put((byte) m.getCommand())
                    .put(params)
                    .array());
        }
        return leaves;
    }

    private String blockHash(String tag, long number) {
        return Numeric.toHexString(Hash.sha3((tag + ":" + paraId + ":" + number).getBytes(StandardCharsets.UTF_8)));
    }

    private static final class ParaBlock {
        final long number;
        final String hash;
        final long relayParentNumber;
        final List<OutboundQueueMessage> messages;

        ParaBlock(long number, String hash, long relayParentNumber, List<OutboundQueueMessage> messages) {
            this.number = number;
            this.hash = hash;
            this.relayParentNumber = relayParentNumber;
            this.messages = messages;
        }
    }
}
