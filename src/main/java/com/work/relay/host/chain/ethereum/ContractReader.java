package com.work.relay.host.chain.ethereum;

import com.work.relay.core.exception.ChainQueryException;
import com.work.relay.core.exception.DecodeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Uint64;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.DefaultBlockParameterName;
import org.web3j.protocol.core.methods.request.Transaction;
import org.web3j.protocol.core.methods.response.EthCall;

import java.io.IOException;
import java.math.BigInteger;
import java.util.List;

/**
 * 只读合约调用（eth_call），按 pending 视图读取，与 gateway 当前接受的状态保持一致。
 */
class ContractReader {

    private static final Logger log = LoggerFactory.getLogger(ContractReader.class);

    private final Web3j web3j;
    private final String contractAddress;

    ContractReader(Web3j web3j, String contractAddress) {
        this.web3j = web3j;
        this.contractAddress = contractAddress;
    }

    List<Type> call(Function function, int expectedOutputs) {
        String data = FunctionEncoder.encode(function);
        EthCall resp;
        try {
            resp = web3j.ethCall(Transaction.createEthCallTransaction(null, contractAddress, data),
                    DefaultBlockParameterName.PENDING).send();
        } catch (IOException e) {
            log.warn("Web3j eth_call failed. contract={} function={} err={}", contractAddress, function.getName(), e.getMessage());
            throw new ChainQueryException("eth_call " + function.getName() + " on " + contractAddress + " failed", e);
        }
        if (resp.hasError()) {
            throw new ChainQueryException("eth_call " + function.getName() + " on " + contractAddress
                    + " returned error: " + resp.getError().getMessage());
        }
        List<Type> outputs = FunctionReturnDecoder.decode(resp.getValue(), function.getOutputParameters());
        if (outputs.size() != expectedOutputs) {
            throw new DecodeException("unexpected return of " + function.getName() + " on " + contractAddress
                    + ": expected " + expectedOutputs + " values, got " + outputs.size());
        }
        return outputs;
    }

    /**
     * uint64 返回值转为 long；超出 long 范围视为解码失败。
     */
    long toLong(Function function, Type output) {
        if (!(output instanceof Uint64)) {
            throw new DecodeException("unexpected return type of " + function.getName() + " on " + contractAddress
                    + ": " + output.getTypeAsString());
        }
        Uint64 number = (Uint64) output;
        BigInteger value = number.getValue();
        try {
            return value.longValueExact();
        } catch (ArithmeticException e) {
            throw new DecodeException("return of " + function.getName() + " on " + contractAddress
                    + " exceeds long range: " + value, e);
        }
    }
}
