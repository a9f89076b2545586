package com.work.relay.host.web.dto;

import java.util.List;

public class TaskView {

    private long paraBlockNumber;
    private String paraBlockHash;
    private long relayBlockNumber;
    private int paraHeadCount;
    private List<MessageProofView> messages;

    public long getParaBlockNumber() {
        return paraBlockNumber;
    }

    public void setParaBlockNumber(long paraBlockNumber) {
        this.paraBlockNumber = paraBlockNumber;
    }

    public String getParaBlockHash() {
        return paraBlockHash;
    }

    public void setParaBlockHash(String paraBlockHash) {
        this.paraBlockHash = paraBlockHash;
    }

    public long getRelayBlockNumber() {
        return relayBlockNumber;
    }

    public void setRelayBlockNumber(long relayBlockNumber) {
        this.relayBlockNumber = relayBlockNumber;
    }

    public int getParaHeadCount() {
        return paraHeadCount;
    }

    public void setParaHeadCount(int paraHeadCount) {
        this.paraHeadCount = paraHeadCount;
    }

    public List<MessageProofView> getMessages() {
        return messages;
    }

    public void setMessages(List<MessageProofView> messages) {
        this.messages = messages;
    }
}
