package com.work.relay.core.scan;

/**
 * 待投递的 nonce 区间 [startingNonce, sourceNonce]。
 */
public class NonceRange {

    private final long startingNonce;
    private final long sourceNonce;

    public NonceRange(long startingNonce, long sourceNonce) {
        if (startingNonce > sourceNonce) {
            throw new IllegalArgumentException("startingNonce 不能大于 sourceNonce");
        }
        this.startingNonce = startingNonce;
        this.sourceNonce = sourceNonce;
    }

    public long getStartingNonce() {
        return startingNonce;
    }

    public long getSourceNonce() {
        return sourceNonce;
    }

    public long size() {
        return sourceNonce - startingNonce + 1;
    }

    @Override
    public String toString() {
        return "[" + startingNonce + ", " + sourceNonce + "]";
    }
}
