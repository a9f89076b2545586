package com.work.relay.host.chain.ethereum;

import com.work.relay.core.chain.CheckpointSource;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Uint64;
import org.web3j.protocol.Web3j;

import java.util.Collections;
import java.util.List;

/**
 * 以目标链 BEEFY 轻客户端的 latestBeefyBlock() 作为扫描检查点。
 */
public class Web3jBeefyCheckpointSource implements CheckpointSource {

    private final ContractReader reader;

    public Web3jBeefyCheckpointSource(Web3j web3j, String beefyClientAddress) {
        this.reader = new ContractReader(web3j, beefyClientAddress);
    }

    @Override
    public long latestCheckpoint() {
        Function function = new Function(
                "latestBeefyBlock",
                Collections.emptyList(),
                Collections.singletonList(new TypeReference<Uint64>() {
                }));
        List<Type> out = reader.call(function, 1);
        return reader.toLong(function, out.get(0));
    }
}
