package com.work.relay.host.chain.ethereum;

import com.work.relay.core.chain.GatewayClient;
import com.work.relay.core.model.ChannelNonces;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.abi.datatypes.generated.Uint64;
import org.web3j.protocol.Web3j;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 基于 Web3j 的 gateway 查询：channelNoncesOf(uint256) returns (uint64 inbound, uint64 outbound)。
 */
public class Web3jGatewayClient implements GatewayClient {

    private final ContractReader reader;

    public Web3jGatewayClient(Web3j web3j, String gatewayAddress) {
        this.reader = new ContractReader(web3j, gatewayAddress);
    }

    @Override
    public ChannelNonces channelNonces(long channelId) {
        Function function = new Function(
                "channelNoncesOf",
                Collections.singletonList(new Uint256(BigInteger.valueOf(channelId))),
                Arrays.asList(new TypeReference<Uint64>() {
                }, new TypeReference<Uint64>() {
                }));
        List<Type> out = reader.call(function, 2);
        return new ChannelNonces(reader.toLong(function, out.get(0)), reader.toLong(function, out.get(1)));
    }
}
