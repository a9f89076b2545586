package com.work.relay.host.worker;

import com.work.relay.core.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * 默认实现：只打印任务摘要。
 */
public class LoggingTaskSink implements TaskSink {

    private static final Logger log = LoggerFactory.getLogger(LoggingTaskSink.class);

    @Override
    public void accept(long channelId, List<Task> tasks) {
        for (Task task : tasks) {
            log.info("Task ready for delivery. channelId={} paraBlockNumber={} nonces=[{}, {}] relayBlockNumber={}",
                    channelId, task.getHeader().getNumber(), task.getMinNonce(), task.getMaxNonce(),
                    task.getProofInput().getRelayBlockNumber());
        }
    }
}
