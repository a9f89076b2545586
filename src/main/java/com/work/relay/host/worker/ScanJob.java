package com.work.relay.host.worker;

import com.work.relay.core.chain.CheckpointSource;
import com.work.relay.core.exception.RelayException;
import com.work.relay.core.model.Task;
import com.work.relay.core.scan.ParachainScanner;
import com.work.relay.core.scan.ScanContext;
import com.work.relay.host.config.RelayerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import javax.annotation.PostConstruct;
import javax.annotation.PreDestroy;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 定时扫描所有配置的 channel，把产出的任务交给 {@link TaskSink}。
 *
 * <p>每轮都从当前检查点重新扫描，扫描失败不做任何补偿，下一轮自然重试。
 * 上一轮未结束时跳过本轮。</p>
 */
@Component
@ConditionalOnProperty(prefix = "relayer", name = "scan-enabled", havingValue = "true", matchIfMissing = true)
public class ScanJob {

    private static final Logger log = LoggerFactory.getLogger(ScanJob.class);

    private final RelayerProperties properties;
    private final ParachainScanner scanner;
    private final CheckpointSource checkpointSource;
    private final TaskSink taskSink;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Set<ScanContext> inFlight = ConcurrentHashMap.newKeySet();
    private ExecutorService executor;

    public ScanJob(RelayerProperties properties,
                   ParachainScanner scanner,
                   CheckpointSource checkpointSource,
                   TaskSink taskSink) {
        this.properties = properties;
        this.scanner = scanner;
        this.checkpointSource = checkpointSource;
        this.taskSink = taskSink;
    }

    @PostConstruct
    public void init() {
        int workers = Math.max(1, properties.getScanWorkers());
        ThreadFactory tf = r -> {
            Thread t = new Thread(r);
            t.setName("scan-worker-" + t.getId());
            t.setDaemon(true);
            return t;
        };
        this.executor = Executors.newFixedThreadPool(workers, tf);
    }

    @PreDestroy
    public void destroy() {
        inFlight.forEach(ScanContext::cancel);
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    @Scheduled(fixedDelayString = "${relayer.scan-interval-ms:30000}")
    public void runOnce() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        try {
            long checkpoint;
            try {
                checkpoint = checkpointSource.latestCheckpoint();
            } catch (RelayException e) {
                log.warn("Checkpoint query failed. retryable={} err={}", e.isRetryable(), e.getMessage());
                return;
            }

            List<Future<?>> futures = new ArrayList<>();
            for (Long channelId : properties.getChannelIds()) {
                futures.add(executor.submit(() -> scanChannel(channelId, checkpoint)));
            }
            for (Future<?> f : futures) {
                try {
                    f.get();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    inFlight.forEach(ScanContext::cancel);
                    return;
                } catch (ExecutionException e) {
                    log.warn("Channel scan task crashed. err={}", e.getCause() == null ? e.getMessage() : e.getCause().getMessage());
                }
            }
        } finally {
            running.set(false);
        }
    }

    void scanChannel(long channelId, long checkpoint) {
        ScanContext ctx = new ScanContext(channelId);
        inFlight.add(ctx);
        try {
            List<Task> tasks = scanner.scan(ctx, checkpoint);
            if (tasks.isEmpty()) {
                log.debug("Nothing to relay. channelId={} relayCheckpoint={}", channelId, checkpoint);
                return;
            }
            taskSink.accept(channelId, tasks);
        } catch (RelayException e) {
            log.warn("Channel scan failed. channelId={} relayCheckpoint={} retryable={} type={} err={}",
                    channelId, checkpoint, e.isRetryable(), e.getClass().getSimpleName(), e.getMessage());
        } finally {
            inFlight.remove(ctx);
        }
    }
}
