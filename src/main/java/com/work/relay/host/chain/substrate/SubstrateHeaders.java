package com.work.relay.host.chain.substrate;

import com.work.relay.core.exception.DecodeException;
import com.work.relay.core.model.DigestItem;
import com.work.relay.core.model.ParachainHeader;
import com.work.relay.host.chain.substrate.scale.SubstrateDecoders;
import org.web3j.utils.Numeric;

import java.util.ArrayList;
import java.util.List;

/**
 * chain_getHeader 的 JSON 结果 -> ParachainHeader。digest.logs 中每项是 SCALE 编码的 DigestItem。
 */
final class SubstrateHeaders {

    private SubstrateHeaders() {
        throw new AssertionError("工具类不允许实例化");
    }

    static ParachainHeader fromJson(String blockHash, SubstrateRpc.HeaderJson json) {
        if (json.getNumber() == null) {
            throw new DecodeException("header without number. blockHash=" + blockHash);
        }
        long number;
        try {
            number = Numeric.decodeQuantity(json.getNumber()).longValueExact();
        } catch (RuntimeException e) {
            throw new DecodeException("invalid header number " + json.getNumber() + ". blockHash=" + blockHash, e);
        }
        List<DigestItem> digest = new ArrayList<>();
        if (json.getDigest() != null && json.getDigest().getLogs() != null) {
            for (String log : json.getDigest().getLogs()) {
                digest.add(SubstrateDecoders.decodeDigestItem(Numeric.hexStringToByteArray(log)));
            }
        }
        return new ParachainHeader(blockHash, json.getParentHash(), number, json.getStateRoot(), json.getExtrinsicsRoot(), digest);
    }
}
