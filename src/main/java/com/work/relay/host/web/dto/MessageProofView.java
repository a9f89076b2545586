package com.work.relay.host.web.dto;

import java.util.List;

public class MessageProofView {

    private long nonce;
    private int command;
    private String params;
    private String root;
    private long leafIndex;
    private long numberOfLeaves;
    private List<String> proofItems;

    public long getNonce() {
        return nonce;
    }

    public void setNonce(long nonce) {
        this.nonce = nonce;
    }

    public int getCommand() {
        return command;
    }

    public void setCommand(int command) {
        this.command = command;
    }

    public String getParams() {
        return params;
    }

    public void setParams(String params) {
        this.params = params;
    }

    public String getRoot() {
        return root;
    }

    public void setRoot(String root) {
        this.root = root;
    }

    public long getLeafIndex() {
        return leafIndex;
    }

    public void setLeafIndex(long leafIndex) {
        this.leafIndex = leafIndex;
    }

    public long getNumberOfLeaves() {
        return numberOfLeaves;
    }

    public void setNumberOfLeaves(long numberOfLeaves) {
        this.numberOfLeaves = numberOfLeaves;
    }

    public List<String> getProofItems() {
        return proofItems;
    }

    public void setProofItems(List<String> proofItems) {
        this.proofItems = proofItems;
    }
}
