package com.work.relay.host.chain.substrate;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.work.relay.core.exception.ChainQueryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.web3j.protocol.Web3jService;
import org.web3j.protocol.core.Request;
import org.web3j.protocol.core.Response;

import java.io.IOException;
import java.util.Arrays;
import java.util.List;

/**
 * 复用 web3j 的 JSON-RPC 传输层调用 Substrate 节点方法（chain_* / state_*）。
 *
 * <p>每个方法对应一个类型化的 Response；传输失败或节点返回 error 都转为 {@link ChainQueryException}，
 * 超时与重试由底层 HTTP 客户端与调用方负责。</p>
 */
public class SubstrateRpc {

    private static final Logger log = LoggerFactory.getLogger(SubstrateRpc.class);

    private final String name;
    private final Web3jService service;

    public SubstrateRpc(String name, Web3jService service) {
        this.name = name;
        this.service = service;
    }

    public String getBlockHash(long blockNumber) {
        return call("chain_getBlockHash", params(blockNumber), HexResponse.class);
    }

    public HeaderJson getHeader(String blockHash) {
        return call("chain_getHeader", params(blockHash), HeaderResponse.class);
    }

    public String getStorage(String key, String blockHash) {
        return call("state_getStorage", params(key, blockHash), HexResponse.class);
    }

    public String stateCall(String method, String encodedParams, String blockHash) {
        return call("state_call", params(method, encodedParams, blockHash), HexResponse.class);
    }

    public List<String> getKeysPaged(String prefix, int count, String startKey, String blockHash) {
        return call("state_getKeysPaged", params(prefix, count, startKey, blockHash), KeysResponse.class);
    }

    public List<StorageChangeSet> queryStorageAt(List<String> keys, String blockHash) {
        return call("state_queryStorageAt", params(keys, blockHash), StorageChangeSetsResponse.class);
    }

    <T, R extends Response<T>> T call(String method, List<Object> params, Class<R> type) {
        R response;
        try {
            response = new Request<>(method, params, service, type).send();
        } catch (IOException e) {
            log.warn("Substrate RPC failed. chain={} method={} params={} err={}", name, method, params, e.getMessage());
            throw new ChainQueryException("call " + name + " RPC " + method + params + " failed", e);
        }
        if (response.hasError()) {
            throw new ChainQueryException("call " + name + " RPC " + method + params + " returned error: "
                    + response.getError().getCode() + " " + response.getError().getMessage());
        }
        return response.getResult();
    }

    private static List<Object> params(Object... values) {
        return Arrays.asList(values);
    }

    public static class HexResponse extends Response<String> {
    }

    public static class HeaderResponse extends Response<HeaderJson> {
    }

    public static class KeysResponse extends Response<List<String>> {
    }

    public static class StorageChangeSetsResponse extends Response<List<StorageChangeSet>> {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class HeaderJson {
        private String parentHash;
        private String number;
        private String stateRoot;
        private String extrinsicsRoot;
        private Digest digest;

        public String getParentHash() {
            return parentHash;
        }

        public void setParentHash(String parentHash) {
            this.parentHash = parentHash;
        }

        public String getNumber() {
            return number;
        }

        public void setNumber(String number) {
            this.number = number;
        }

        public String getStateRoot() {
            return stateRoot;
        }

        public void setStateRoot(String stateRoot) {
            this.stateRoot = stateRoot;
        }

        public String getExtrinsicsRoot() {
            return extrinsicsRoot;
        }

        public void setExtrinsicsRoot(String extrinsicsRoot) {
            this.extrinsicsRoot = extrinsicsRoot;
        }

        public Digest getDigest() {
            return digest;
        }

        public void setDigest(Digest digest) {
            this.digest = digest;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Digest {
        private List<String> logs;

        public List<String> getLogs() {
            return logs;
        }

        public void setLogs(List<String> logs) {
            this.logs = logs;
        }
    }

    /**
     * changes 中每项为 [key, value]，value 可能为 null。
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class StorageChangeSet {
        private String block;
        private List<List<String>> changes;

        public String getBlock() {
            return block;
        }

        public void setBlock(String block) {
            this.block = block;
        }

        public List<List<String>> getChanges() {
            return changes;
        }

        public void setChanges(List<List<String>> changes) {
            this.changes = changes;
        }
    }
}
