package com.work.relay.host.web;

import com.work.relay.core.chain.CheckpointSource;
import com.work.relay.core.exception.RelayException;
import com.work.relay.core.model.MessageProof;
import com.work.relay.core.model.Task;
import com.work.relay.core.scan.ParachainScanner;
import com.work.relay.core.support.ValidationUtils;
import com.work.relay.host.web.dto.MessageProofView;
import com.work.relay.host.web.dto.ScanResponse;
import com.work.relay.host.web.dto.TaskView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.web3j.utils.Numeric;

import java.util.ArrayList;
import java.util.List;

/**
 * 手动触发一次扫描并返回任务，便于排查某个 channel 的积压。
 *
 * 链查询类错误（可重试）返回 502，状态缺失/数据不一致返回 409。
 */
@RestController
@RequestMapping("/api/v1/scan")
public class ScanController {

    private static final Logger log = LoggerFactory.getLogger(ScanController.class);

    private final ParachainScanner scanner;
    private final CheckpointSource checkpointSource;

    public ScanController(ParachainScanner scanner, CheckpointSource checkpointSource) {
        this.scanner = scanner;
        this.checkpointSource = checkpointSource;
    }

    @PostMapping("/{channelId}")
    public ResponseEntity<ScanResponse> scan(@PathVariable long channelId,
                                             @RequestParam(value = "checkpoint", required = false) Long checkpoint) {
        ValidationUtils.requireValidChannelId(channelId);
        long relayCheckpoint = checkpoint != null ? checkpoint : checkpointSource.latestCheckpoint();
        List<Task> tasks = scanner.scan(channelId, relayCheckpoint);

        ScanResponse response = new ScanResponse();
        response.setChannelId(channelId);
        response.setRelayCheckpoint(relayCheckpoint);
        List<TaskView> views = new ArrayList<>(tasks.size());
        for (Task task : tasks) {
            views.add(toView(task));
        }
        response.setTasks(views);
        return ResponseEntity.ok(response);
    }

    @ExceptionHandler(RelayException.class)
    public ResponseEntity<String> handleRelay(RelayException e) {
        log.warn("Manual scan failed. retryable={} type={} err={}", e.isRetryable(), e.getClass().getSimpleName(), e.getMessage());
        HttpStatus status = e.isRetryable() ? HttpStatus.BAD_GATEWAY : HttpStatus.CONFLICT;
        return ResponseEntity.status(status).body(e.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<String> handleBadRequest(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(e.getMessage());
    }

    private TaskView toView(Task task) {
        TaskView v = new TaskView();
        v.setParaBlockNumber(task.getHeader().getNumber());
        v.setParaBlockHash(task.getHeader().getHash());
        v.setRelayBlockNumber(task.getProofInput().getRelayBlockNumber());
        v.setParaHeadCount(task.getProofInput().getParaHeads().size());
        List<MessageProofView> proofs = new ArrayList<>(task.getMessageProofs().size());
        for (MessageProof mp : task.getMessageProofs()) {
            MessageProofView pv = new MessageProofView();
            pv.setNonce(mp.getMessage().getNonce());
            pv.setCommand(mp.getMessage().getCommand());
            pv.setParams(Numeric.toHexString(mp.getMessage().getParams()));
            pv.setRoot(mp.getProof().getRoot());
            pv.setLeafIndex(mp.getProof().getLeafIndex());
            pv.setNumberOfLeaves(mp.getProof().getNumberOfLeaves());
            pv.setProofItems(mp.getProof().getProofItems());
            proofs.add(pv);
        }
        v.setMessages(proofs);
        return v;
    }
}
