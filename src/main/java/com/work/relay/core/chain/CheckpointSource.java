package com.work.relay.core.chain;

/**
 * 扫描锚点：目标链已知的、已最终确定的中继链区块号（例如 BEEFY 轻客户端的 latestBeefyBlock）。
 */
public interface CheckpointSource {

    long latestCheckpoint();
}
