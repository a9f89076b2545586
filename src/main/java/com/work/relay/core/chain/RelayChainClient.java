package com.work.relay.core.chain;

import com.work.relay.core.model.ParaHead;
import com.work.relay.core.model.ParachainHeader;

import java.util.List;
import java.util.Optional;

/**
 * 中继链的只读查询端口，语义与 {@link ParachainClient} 一致。
 */
public interface RelayChainClient {

    String getBlockHash(long blockNumber);

    /**
     * 中继链在该区块处记录的平行链 head。平行链未注册时返回 empty。
     */
    Optional<ParachainHeader> getParachainHead(long paraId, String relayBlockHash);

    /**
     * 中继链在该区块处记录的全部平行链 head。
     */
    List<ParaHead> getParachainHeads(String relayBlockHash);
}
