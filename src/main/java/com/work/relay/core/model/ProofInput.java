package com.work.relay.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * 平行链区块已被最终确定的证据输入：目标链的轻客户端验证的是中继链最终性，
 * 因此需要中继链在包含区块处看到的全部平行链 head。
 *
 * <p>paraHeads 按 paraId 升序保存。</p>
 */
public class ProofInput {

    private final long paraId;
    private final long relayBlockNumber;
    private final List<ParaHead> paraHeads;

    public ProofInput(long paraId, long relayBlockNumber, List<ParaHead> paraHeads) {
        this.paraId = paraId;
        this.relayBlockNumber = relayBlockNumber;
        List<ParaHead> sorted = new ArrayList<>(Objects.requireNonNull(paraHeads, "paraHeads"));
        sorted.sort(Comparator.comparingLong(ParaHead::getParaId));
        this.paraHeads = Collections.unmodifiableList(sorted);
    }

    public long getParaId() {
        return paraId;
    }

    public long getRelayBlockNumber() {
        return relayBlockNumber;
    }

    public List<ParaHead> getParaHeads() {
        return paraHeads;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ProofInput)) return false;
        ProofInput that = (ProofInput) o;
        return paraId == that.paraId && relayBlockNumber == that.relayBlockNumber && paraHeads.equals(that.paraHeads);
    }

    @Override
    public int hashCode() {
        return Objects.hash(paraId, relayBlockNumber, paraHeads);
    }
}
