package com.work.relay.host.worker;

import com.work.relay.core.chain.CheckpointSource;
import com.work.relay.core.exception.ChainQueryException;
import com.work.relay.core.exception.IntegrityException;
import com.work.relay.core.model.Task;
import com.work.relay.core.scan.ParachainScanner;
import com.work.relay.core.scan.ScanContext;
import com.work.relay.host.config.RelayerProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

public class ScanJobTest {

    private ScanJob job;

    @AfterEach
    public void tearDown() {
        if (job != null) {
            job.destroy();
        }
    }

    @Test
    public void scans_every_channel_at_latest_checkpoint() {
        ParachainScanner scanner = mock(ParachainScanner.class);
        CheckpointSource checkpoints = mock(CheckpointSource.class);
        TaskSink sink = mock(TaskSink.class);
        when(checkpoints.latestCheckpoint()).thenReturn(520L);
        List<Task> tasks = Collections.singletonList(mock(Task.class));
        when(scanner.scan(argThat((ScanContext ctx) -> ctx != null && ctx.getChannelId() == 0L), eq(520L))).thenReturn(tasks);
        when(scanner.scan(argThat((ScanContext ctx) -> ctx != null && ctx.getChannelId() == 1L), eq(520L)))
                .thenReturn(Collections.<Task>emptyList());

        job = newJob(scanner, checkpoints, sink, 0L, 1L);
        job.runOnce();

        verify(scanner, times(2)).scan(any(ScanContext.class), eq(520L));
        verify(sink, times(1)).accept(eq(0L), eq(tasks));
        verify(sink, never()).accept(eq(1L), anyList());
    }

    @Test
    public void failed_channel_does_not_block_others() {
        ParachainScanner scanner = mock(ParachainScanner.class);
        CheckpointSource checkpoints = mock(CheckpointSource.class);
        TaskSink sink = mock(TaskSink.class);
        when(checkpoints.latestCheckpoint()).thenReturn(520L);
        List<Task> tasks = Collections.singletonList(mock(Task.class));
        when(scanner.scan(argThat((ScanContext ctx) -> ctx != null && ctx.getChannelId() == 0L), anyLong()))
                .thenThrow(new IntegrityException("nonce gap"));
        when(scanner.scan(argThat((ScanContext ctx) -> ctx != null && ctx.getChannelId() == 1L), anyLong())).thenReturn(tasks);

        job = newJob(scanner, checkpoints, sink, 0L, 1L);
        job.runOnce();

        verify(sink, times(1)).accept(eq(1L), eq(tasks));
        verify(sink, never()).accept(eq(0L), anyList());
    }

    @Test
    public void checkpoint_failure_skips_round() {
        ParachainScanner scanner = mock(ParachainScanner.class);
        CheckpointSource checkpoints = mock(CheckpointSource.class);
        when(checkpoints.latestCheckpoint()).thenThrow(new ChainQueryException("eth_call failed"));

        job = newJob(scanner, checkpoints, mock(TaskSink.class), 0L);
        job.runOnce();

        verify(scanner, never()).scan(any(ScanContext.class), anyLong());
    }

    private static ScanJob newJob(ParachainScanner scanner, CheckpointSource checkpoints, TaskSink sink, Long... channelIds) {
        RelayerProperties props = new RelayerProperties();
        props.setChannelIds(Arrays.asList(channelIds));
        props.setScanWorkers(2);
        ScanJob job = new ScanJob(props, scanner, checkpoints, sink);
        job.init();
        return job;
    }
}
