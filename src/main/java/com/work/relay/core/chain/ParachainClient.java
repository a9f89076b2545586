package com.work.relay.core.chain;

import com.work.relay.core.model.MerkleProof;
import com.work.relay.core.model.OutboundQueueMessage;
import com.work.relay.core.model.ParachainHeader;
import com.work.relay.core.model.PersistedValidationData;

import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * 源链（平行链）的只读查询端口。
 *
 * <p>每种查询对应一个类型化的请求/响应；实现方负责超时与重试，扫描组件不做重试。</p>
 *
 * <ul>
 *   <li>网络/RPC 失败抛出 ChainQueryException</li>
 *   <li>返回字节无法解码抛出 DecodeException</li>
 *   <li>存储不存在时返回 empty，由调用方决定语义</li>
 * </ul>
 *
 * <p>实现必须是线程安全的：多个 channel 的扫描会共享同一个实例。</p>
 */
public interface ParachainClient {

    String getBlockHash(long blockNumber);

    ParachainHeader getHeader(String blockHash);

    /**
     * outbound queue 上 channel 已生成的最新 nonce。
     */
    OptionalLong getOutboundNonce(long channelId, String blockHash);

    /**
     * 该区块提交的全部消息（不按 channel 过滤，顺序即 commitment 中的叶子顺序）。
     */
    Optional<List<OutboundQueueMessage>> getCommittedMessages(String blockHash);

    /**
     * 按消息在完整列表中的下标生成 merkle 证明。
     */
    Optional<MerkleProof> proveMessage(String blockHash, long leafIndex);

    Optional<PersistedValidationData> getValidationData(String blockHash);
}
