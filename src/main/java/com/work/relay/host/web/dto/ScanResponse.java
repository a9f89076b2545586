package com.work.relay.host.web.dto;

import java.util.List;

public class ScanResponse {

    private long channelId;
    private long relayCheckpoint;
    private List<TaskView> tasks;

    public long getChannelId() {
        return channelId;
    }

    public void setChannelId(long channelId) {
        this.channelId = channelId;
    }

    public long getRelayCheckpoint() {
        return relayCheckpoint;
    }

    public void setRelayCheckpoint(long relayCheckpoint) {
        this.relayCheckpoint = relayCheckpoint;
    }

    public List<TaskView> getTasks() {
        return tasks;
    }

    public void setTasks(List<TaskView> tasks) {
        this.tasks = tasks;
    }
}
