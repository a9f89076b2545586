package com.work.relay.core.exception;

/**
 * 向后扫描超过配置的最大回看区块数仍未遇到 nonce 边界。
 */
public class LookbackExceededException extends RelayException {

    public LookbackExceededException(long channelId, long startBlockNumber, long maxLookbackBlocks, long startingNonce) {
        super("backward scan exceeded maxLookbackBlocks. channelId=" + channelId
                + " startBlockNumber=" + startBlockNumber
                + " maxLookbackBlocks=" + maxLookbackBlocks
                + " startingNonce=" + startingNonce);
    }
}
