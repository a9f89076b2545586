package com.work.relay.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 平行链区块头。
 *
 * <p>hash 来自 chain_getBlockHash；从中继链 Paras.Heads 解码出的区块头没有 hash，此时为 null。</p>
 */
public class ParachainHeader {

    private final String hash;
    private final String parentHash;
    private final long number;
    private final String stateRoot;
    private final String extrinsicsRoot;
    private final List<DigestItem> digest;

    public ParachainHeader(String hash,
                           String parentHash,
                           long number,
                           String stateRoot,
                           String extrinsicsRoot,
                           List<DigestItem> digest) {
        this.hash = hash;
        this.parentHash = parentHash;
        this.number = number;
        this.stateRoot = stateRoot;
        this.extrinsicsRoot = extrinsicsRoot;
        this.digest = digest == null ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(digest));
    }

    public ParachainHeader withHash(String blockHash) {
        return new ParachainHeader(blockHash, parentHash, number, stateRoot, extrinsicsRoot, digest);
    }

    public String getHash() {
        return hash;
    }

    public String getParentHash() {
        return parentHash;
    }

    public long getNumber() {
        return number;
    }

    public String getStateRoot() {
        return stateRoot;
    }

    public String getExtrinsicsRoot() {
        return extrinsicsRoot;
    }

    public List<DigestItem> getDigest() {
        return digest;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ParachainHeader)) return false;
        ParachainHeader that = (ParachainHeader) o;
        return number == that.number
                && Objects.equals(hash, that.hash)
                && Objects.equals(parentHash, that.parentHash)
                && Objects.equals(stateRoot, that.stateRoot)
                && Objects.equals(extrinsicsRoot, that.extrinsicsRoot)
                && digest.equals(that.digest);
    }

    @Override
    public int hashCode() {
        return Objects.hash(hash, parentHash, number, stateRoot, extrinsicsRoot, digest);
    }

    @Override
    public String toString() {
        return "ParachainHeader{number=" + number + ", hash=" + hash + "}";
    }
}
