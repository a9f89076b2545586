package com.work.relay.host.chain.substrate;

import com.work.relay.core.chain.ParachainClient;
import com.work.relay.core.exception.MissingStateException;
import com.work.relay.core.model.MerkleProof;
import com.work.relay.core.model.OutboundQueueMessage;
import com.work.relay.core.model.ParachainHeader;
import com.work.relay.core.model.PersistedValidationData;
import com.work.relay.host.chain.substrate.scale.SubstrateDecoders;
import org.web3j.utils.Numeric;

import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * 基于 Substrate JSON-RPC 的源链客户端：
 * - chain_getBlockHash / chain_getHeader
 * - state_getStorage：outbound queue 的 Nonce、Messages，ParachainSystem.ValidationData
 * - state_call：OutboundQueueApi_prove_message(leafIndex)
 */
public class SubstrateParachainClient implements ParachainClient {

    static final String PROVE_MESSAGE_API = "OutboundQueueApi_prove_message";

    private final SubstrateRpc rpc;
    private final String outboundQueuePallet;
    private final String messagesKey;
    private final String validationDataKey;

    public SubstrateParachainClient(SubstrateRpc rpc, String outboundQueuePallet) {
        this.rpc = rpc;
        this.outboundQueuePallet = outboundQueuePallet;
        this.messagesKey = StorageKeys.plain(outboundQueuePallet, "Messages");
        this.validationDataKey = StorageKeys.plain("ParachainSystem", "ValidationData");
    }

    @Override
    public String getBlockHash(long blockNumber) {
        String hash = rpc.getBlockHash(blockNumber);
        if (hash == null) {
            throw new MissingStateException("parachain block hash not found. blockNumber=" + blockNumber);
        }
        return hash;
    }

    @Override
    public ParachainHeader getHeader(String blockHash) {
        SubstrateRpc.HeaderJson json = rpc.getHeader(blockHash);
        if (json == null) {
            throw new MissingStateException("parachain header not found. blockHash=" + blockHash);
        }
        return SubstrateHeaders.fromJson(blockHash, json);
    }

    @Override
    public OptionalLong getOutboundNonce(long channelId, String blockHash) {
        String key = StorageKeys.twox64ConcatU32(outboundQueuePallet, "Nonce", channelId);
        String value = rpc.getStorage(key, blockHash);
        if (value == null) {
            return OptionalLong.empty();
        }
        return OptionalLong.of(SubstrateDecoders.decodeUint64(Numeric.hexStringToByteArray(value)));
    }

    @Override
    public Optional<List<OutboundQueueMessage>> getCommittedMessages(String blockHash) {
        String value = rpc.getStorage(messagesKey, blockHash);
        if (value == null) {
            return Optional.empty();
        }
        return Optional.of(SubstrateDecoders.decodeMessages(Numeric.hexStringToByteArray(value)));
    }

    @Override
    public Optional<MerkleProof> proveMessage(String blockHash, long leafIndex) {
        String params = Numeric.toHexString(StorageKeys.u64(leafIndex));
        String result = rpc.stateCall(PROVE_MESSAGE_API, params, blockHash);
        if (result == null) {
            return Optional.empty();
        }
        return SubstrateDecoders.decodeOptionalMerkleProof(Numeric.hexStringToByteArray(result));
    }

    @Override
    public Optional<PersistedValidationData> getValidationData(String blockHash) {
        String value = rpc.getStorage(validationDataKey, blockHash);
        if (value == null) {
            return Optional.empty();
        }
        return Optional.of(SubstrateDecoders.decodeValidationData(Numeric.hexStringToByteArray(value)));
    }
}
