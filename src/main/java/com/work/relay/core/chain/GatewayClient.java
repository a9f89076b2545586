package com.work.relay.core.chain;

import com.work.relay.core.model.ChannelNonces;

/**
 * 目标链 gateway 的只读查询端口，由宿主应用实现。
 */
public interface GatewayClient {

    /**
     * 查询 channel 两侧 nonce。查询失败抛出 {@link com.work.relay.core.exception.ChainQueryException}。
     */
    ChannelNonces channelNonces(long channelId);
}
