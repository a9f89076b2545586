package com.work.relay.core.scan;

import com.work.relay.core.model.Task;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 把构建中的任务转为不可变 Task。只要有一个任务缺少证明或 proofInput，整批都不输出。
 */
public class TaskBuilder {

    public List<Task> build(List<PendingTask> pending) {
        List<Task> tasks = new ArrayList<>(pending.size());
        for (PendingTask p : pending) {
            if (p.getMessageProofs().isEmpty()) {
                throw new IllegalStateException("task has no message proofs. paraBlockNumber=" + p.getHeader().getNumber());
            }
            if (p.getProofInput() == null) {
                throw new IllegalStateException("task has no proof input. paraBlockNumber=" + p.getHeader().getNumber());
            }
            tasks.add(new Task(p.getHeader(), p.getMessageProofs(), p.getProofInput()));
        }
        return Collections.unmodifiableList(tasks);
    }
}
