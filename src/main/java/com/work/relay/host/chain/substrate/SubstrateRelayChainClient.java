package com.work.relay.host.chain.substrate;

import com.work.relay.core.chain.RelayChainClient;
import com.work.relay.core.exception.MissingStateException;
import com.work.relay.core.model.ParaHead;
import com.work.relay.core.model.ParachainHeader;
import com.work.relay.host.chain.substrate.scale.ScaleCodecReader;
import com.work.relay.host.chain.substrate.scale.SubstrateDecoders;
import org.web3j.utils.Numeric;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * 基于 Substrate JSON-RPC 的中继链客户端，读取 Paras.Heads。
 */
public class SubstrateRelayChainClient implements RelayChainClient {

    private static final int KEYS_PAGE_SIZE = 256;

    private final SubstrateRpc rpc;
    private final String headsPrefix;

    public SubstrateRelayChainClient(SubstrateRpc rpc) {
        this.rpc = rpc;
        this.headsPrefix = StorageKeys.plain("Paras", "Heads");
    }

    @Override
    public String getBlockHash(long blockNumber) {
        String hash = rpc.getBlockHash(blockNumber);
        if (hash == null) {
            throw new MissingStateException("relaychain block hash not found. blockNumber=" + blockNumber);
        }
        return hash;
    }

    @Override
    public Optional<ParachainHeader> getParachainHead(long paraId, String relayBlockHash) {
        String key = StorageKeys.twox64ConcatU32("Paras", "Heads", paraId);
        String value = rpc.getStorage(key, relayBlockHash);
        if (value == null) {
            return Optional.empty();
        }
        return Optional.of(SubstrateDecoders.decodeHeadData(Numeric.hexStringToByteArray(value)));
    }

    @Override
    public List<ParaHead> getParachainHeads(String relayBlockHash) {
        List<String> keys = new ArrayList<>();
        String startKey = null;
        while (true) {
            List<String> page = rpc.getKeysPaged(headsPrefix, KEYS_PAGE_SIZE, startKey, relayBlockHash);
            if (page == null || page.isEmpty()) {
                break;
            }
            keys.addAll(page);
            if (page.size() < KEYS_PAGE_SIZE) {
                break;
            }
            startKey = page.get(page.size() - 1);
        }

        List<ParaHead> heads = new ArrayList<>(keys.size());
        if (keys.isEmpty()) {
            return heads;
        }
        List<SubstrateRpc.StorageChangeSet> changeSets = rpc.queryStorageAt(keys, relayBlockHash);
        if (changeSets == null) {
            return heads;
        }
        for (SubstrateRpc.StorageChangeSet set : changeSets) {
            if (set.getChanges() == null) {
                continue;
            }
            for (List<String> change : set.getChanges()) {
                if (change.size() < 2 || change.get(1) == null) {
                    continue;
                }
                long paraId = StorageKeys.u32FromTwox64ConcatKey(change.get(0));
                byte[] headData = new ScaleCodecReader(Numeric.hexStringToByteArray(change.get(1))).readByteArray();
                heads.add(new ParaHead(paraId, headData));
            }
        }
        heads.sort(Comparator.comparingLong(ParaHead::getParaId));
        return heads;
    }
}
