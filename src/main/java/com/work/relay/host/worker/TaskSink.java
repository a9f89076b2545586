package com.work.relay.host.worker;

import com.work.relay.core.model.Task;

import java.util.List;

/**
 * 扫描结果的去向（提交到目标链、写入队列等）。任务列表已按平行链区块升序排列。
 */
public interface TaskSink {

    void accept(long channelId, List<Task> tasks);
}
