package com.work.relay.host.web;

import com.work.relay.core.chain.CheckpointSource;
import com.work.relay.core.config.ScannerConfig;
import com.work.relay.core.exception.ChainQueryException;
import com.work.relay.core.exception.FinalityTimeoutException;
import com.work.relay.core.metrics.NoopScanMetrics;
import com.work.relay.core.model.OutboundQueueMessage;
import com.work.relay.core.model.Task;
import com.work.relay.core.scan.ParachainScanner;
import com.work.relay.host.chain.mock.MockBridgeChain;
import com.work.relay.host.web.dto.ScanResponse;
import com.work.relay.host.web.dto.TaskView;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

public class ScanControllerTest {

    @Test
    public void scans_at_latest_checkpoint_when_not_given() {
        MockBridgeChain chain = new MockBridgeChain(1000);
        chain.addParachainBlock(10, 100, Arrays.asList(msg(1), msg(2)));
        chain.includeParachainBlock(99, 9);
        chain.includeParachainBlock(102, 10);
        chain.setCheckpoint(110);
        ParachainScanner scanner = new ParachainScanner(chain.gateway(), chain.parachain(), chain.relayChain(),
                ScannerConfig.defaultConfig(1000), null, new NoopScanMetrics());
        ScanController controller = new ScanController(scanner, chain.checkpoints());

        ResponseEntity<ScanResponse> response = controller.scan(5, null);

        assertEquals(HttpStatus.OK, response.getStatusCode());
        ScanResponse body = response.getBody();
        assertNotNull(body);
        assertEquals(110L, body.getRelayCheckpoint());
        assertEquals(1, body.getTasks().size());
        TaskView task = body.getTasks().get(0);
        assertEquals(10L, task.getParaBlockNumber());
        assertEquals(102L, task.getRelayBlockNumber());
        assertEquals(2, task.getMessages().size());
        assertEquals(1L, task.getMessages().get(0).getNonce());
        assertEquals(2L, task.getMessages().get(1).getNumberOfLeaves());
    }

    @Test
    public void explicit_checkpoint_is_used() {
        ParachainScanner scanner = mock(ParachainScanner.class);
        CheckpointSource checkpoints = mock(CheckpointSource.class);
        when(scanner.scan(5L, 77L)).thenReturn(Collections.<Task>emptyList());

        ResponseEntity<ScanResponse> response = new ScanController(scanner, checkpoints).scan(5, 77L);

        assertTrue(response.getBody().getTasks().isEmpty());
        verify(checkpoints, never()).latestCheckpoint();
    }

    @Test
    public void retryable_errors_map_to_bad_gateway() {
        ScanController controller = new ScanController(mock(ParachainScanner.class), mock(CheckpointSource.class));

        assertEquals(HttpStatus.BAD_GATEWAY, controller.handleRelay(new ChainQueryException("timeout")).getStatusCode());
        assertEquals(HttpStatus.CONFLICT, controller.handleRelay(new FinalityTimeoutException(5, 10, 100, 4)).getStatusCode());
    }

    @Test
    public void invalid_channel_is_rejected() {
        ScanController controller = new ScanController(mock(ParachainScanner.class), mock(CheckpointSource.class));

        assertThrows(IllegalArgumentException.class, () -> controller.scan(-1, 10L));
        assertEquals(HttpStatus.BAD_REQUEST, controller.handleBadRequest(new IllegalArgumentException("bad")).getStatusCode());
    }

    private static OutboundQueueMessage msg(long nonce) {
        return new OutboundQueueMessage(5, nonce, 0, new byte[]{(byte) nonce});
    }
}
