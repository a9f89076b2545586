package com.work.relay.core.scan;

import com.work.relay.core.chain.ParachainClient;
import com.work.relay.core.config.ScannerConfig;
import com.work.relay.core.exception.IntegrityException;
import com.work.relay.core.exception.LookbackExceededException;
import com.work.relay.core.exception.MissingStateException;
import com.work.relay.core.exception.ScanCancelledException;
import com.work.relay.core.metrics.NoopScanMetrics;
import com.work.relay.core.metrics.ScanMetrics;
import com.work.relay.core.model.MessageProof;
import com.work.relay.core.model.OutboundQueueMessage;
import com.work.relay.host.chain.mock.MockBridgeChain;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.AdditionalAnswers.delegatesTo;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

public class CommitmentScannerTest {

    private static final long PARA_ID = 1000;

    @Test
    public void collects_outstanding_commitments_across_blocks_in_ascending_order() {
        MockBridgeChain chain = chainWithBacklog();
        CommitmentScanner scanner = scanner(chain, ScannerConfig.defaultConfig(PARA_ID), new NoopScanMetrics());

        List<PendingTask> tasks = scanner.scan(new ScanContext(5), 104, 5, 11);

        assertEquals(2, tasks.size());
        assertEquals(100L, tasks.get(0).getHeader().getNumber());
        assertEquals(104L, tasks.get(1).getHeader().getNumber());

        List<MessageProof> first = tasks.get(0).getMessageProofs();
        assertEquals(1, first.size());
        assertEquals(11L, first.get(0).getMessage().getNonce());
        assertEquals(0L, first.get(0).getProof().getLeafIndex());

        List<MessageProof> second = tasks.get(1).getMessageProofs();
        assertEquals(2, second.size());
        assertEquals(12L, second.get(0).getMessage().getNonce());
        assertEquals(13L, second.get(1).getMessage().getNonce());
        // 下标是消息在区块完整列表中的位置（包含其它 channel 的消息）
        assertEquals(1L, second.get(0).getProof().getLeafIndex());
        assertEquals(2L, second.get(1).getProof().getLeafIndex());
        assertEquals(3L, second.get(0).getProof().getNumberOfLeaves());
    }

    @Test
    public void header_hash_is_filled_from_block_hash() {
        MockBridgeChain chain = chainWithBacklog();
        CommitmentScanner scanner = scanner(chain, ScannerConfig.defaultConfig(PARA_ID), new NoopScanMetrics());

        List<PendingTask> tasks = scanner.scan(new ScanContext(5), 104, 5, 12);

        assertEquals(1, tasks.size());
        assertEquals(chain.parachain().getBlockHash(104), tasks.get(0).getHeader().getHash());
    }

    @Test
    public void stops_at_block_containing_starting_nonce() {
        MockBridgeChain chain = chainWithBacklog();
        ScanMetrics metrics = mock(ScanMetrics.class);
        CommitmentScanner scanner = scanner(chain, ScannerConfig.defaultConfig(PARA_ID), metrics);

        scanner.scan(new ScanContext(5), 104, 5, 11);

        // 104..100，共 5 个区块
        verify(metrics, times(1)).blocksWalked(eq(5L), eq(5L));
    }

    @Test
    public void single_block_backlog_yields_single_task() {
        MockBridgeChain chain = new MockBridgeChain(PARA_ID);
        chain.addParachainBlock(3, 30, Arrays.asList(msg(5, 1), msg(5, 2)));
        chain.addParachainBlock(6, 60, Collections.singletonList(msg(5, 3)));
        CommitmentScanner scanner = scanner(chain, ScannerConfig.defaultConfig(PARA_ID), new NoopScanMetrics());

        List<PendingTask> tasks = scanner.scan(new ScanContext(5), 6, 5, 3);

        assertEquals(1, tasks.size());
        assertEquals(6L, tasks.get(0).getHeader().getNumber());
    }

    @Test
    public void tampered_proof_root_fails_integrity_check() {
        MockBridgeChain chain = chainWithBacklog();
        chain.tamperProofs(104);
        CommitmentScanner scanner = scanner(chain, ScannerConfig.defaultConfig(PARA_ID), new NoopScanMetrics());

        assertThrows(IntegrityException.class, () -> scanner.scan(new ScanContext(5), 104, 5, 11));
    }

    @Test
    public void pruned_proof_is_missing_state() {
        MockBridgeChain chain = chainWithBacklog();
        chain.pruneProofs(100);
        CommitmentScanner scanner = scanner(chain, ScannerConfig.defaultConfig(PARA_ID), new NoopScanMetrics());

        assertThrows(MissingStateException.class, () -> scanner.scan(new ScanContext(5), 104, 5, 11));
    }

    @Test
    public void nonce_gap_fails_integrity_check() {
        MockBridgeChain chain = new MockBridgeChain(PARA_ID);
        chain.addParachainBlock(10, 100, Collections.singletonList(msg(5, 11)));
        chain.addParachainBlock(12, 120, Collections.singletonList(msg(5, 13)));
        CommitmentScanner scanner = scanner(chain, ScannerConfig.defaultConfig(PARA_ID), new NoopScanMetrics());

        IntegrityException e = assertThrows(IntegrityException.class, () -> scanner.scan(new ScanContext(5), 12, 5, 11));
        assertTrue(e.getMessage().contains("expectedNonce=12"));
    }

    @Test
    public void reaching_genesis_without_boundary_is_missing_state() {
        MockBridgeChain chain = chainWithBacklog();
        CommitmentScanner scanner = scanner(chain, ScannerConfig.defaultConfig(PARA_ID), new NoopScanMetrics());

        assertThrows(MissingStateException.class, () -> scanner.scan(new ScanContext(5), 104, 5, 8));
    }

    @Test
    public void lookback_limit_aborts_long_scans() {
        MockBridgeChain chain = chainWithBacklog();
        ScannerConfig config = new ScannerConfig(PARA_ID, 4, 3, 1);
        CommitmentScanner scanner = scanner(chain, config, new NoopScanMetrics());

        assertThrows(LookbackExceededException.class, () -> scanner.scan(new ScanContext(5), 104, 5, 11));
    }

    @Test
    public void lookback_limit_allows_scans_within_window() {
        MockBridgeChain chain = chainWithBacklog();
        ScannerConfig config = new ScannerConfig(PARA_ID, 4, 5, 1);
        CommitmentScanner scanner = scanner(chain, config, new NoopScanMetrics());

        assertEquals(2, scanner.scan(new ScanContext(5), 104, 5, 11).size());
    }

    @Test
    public void cancelled_scan_stops_before_querying_chain() {
        MockBridgeChain chain = chainWithBacklog();
        CommitmentScanner scanner = scanner(chain, ScannerConfig.defaultConfig(PARA_ID), new NoopScanMetrics());
        ScanContext ctx = new ScanContext(5);
        ctx.cancel();

        assertThrows(ScanCancelledException.class, () -> scanner.scan(ctx, 104, 5, 11));
    }

    @Test
    public void select_keeps_full_list_index_and_walks_nonces_descending() {
        List<OutboundQueueMessage> messages = Arrays.asList(msg(5, 9), msg(7, 3), msg(5, 10), msg(5, 11));

        CommitmentScanner.BlockSelection selection = CommitmentScanner.selectOutstanding(messages, 5, 10);

        assertTrue(selection.scanDone);
        assertEquals(2, selection.selected.size());
        assertEquals(3L, selection.selected.get(0).getIndex());
        assertEquals(11L, selection.selected.get(0).getMessage().getNonce());
        assertEquals(2L, selection.selected.get(1).getIndex());
    }

    @Test
    public void select_without_channel_messages_keeps_scanning() {
        List<OutboundQueueMessage> messages = Arrays.asList(msg(7, 1), msg(7, 2));

        CommitmentScanner.BlockSelection selection = CommitmentScanner.selectOutstanding(messages, 5, 10);

        assertFalse(selection.scanDone);
        assertTrue(selection.selected.isEmpty());
    }

    @Test
    public void select_above_starting_nonce_keeps_scanning() {
        List<OutboundQueueMessage> messages = Arrays.asList(msg(5, 12), msg(5, 13));

        CommitmentScanner.BlockSelection selection = CommitmentScanner.selectOutstanding(messages, 5, 10);

        assertFalse(selection.scanDone);
        assertEquals(2, selection.selected.size());
    }

    @Test
    public void select_below_starting_nonce_halts_without_selecting() {
        List<OutboundQueueMessage> messages = Arrays.asList(msg(5, 8), msg(5, 9));

        CommitmentScanner.BlockSelection selection = CommitmentScanner.selectOutstanding(messages, 5, 10);

        assertTrue(selection.scanDone);
        assertTrue(selection.selected.isEmpty());
    }

    @Test
    public void block_with_commitment_but_no_messages_is_missing_state() {
        MockBridgeChain chain = chainWithBacklog();
        ParachainClient parachain = mock(ParachainClient.class, delegatesTo(chain.parachain()));
        String blockHash = chain.parachain().getBlockHash(104);
        doReturn(Optional.empty()).when(parachain).getCommittedMessages(eq(blockHash));
        CommitmentScanner scanner = new CommitmentScanner(parachain,
                new ProofAssembler(parachain, null, new NoopScanMetrics()), ScannerConfig.defaultConfig(PARA_ID), new NoopScanMetrics());

        assertThrows(MissingStateException.class, () -> scanner.scan(new ScanContext(5), 104, 5, 11));
        verify(parachain, never()).proveMessage(anyString(), anyLong());
    }

    /**
     * channel 5 已投递到 10：nonce 11 在区块 100，12/13 在区块 104，更早的 97 已投递。
     */
    static MockBridgeChain chainWithBacklog() {
        MockBridgeChain chain = new MockBridgeChain(PARA_ID);
        chain.addParachainBlock(97, 490, Arrays.asList(msg(5, 9), msg(5, 10)));
        chain.addParachainBlock(100, 500, Arrays.asList(msg(5, 11), msg(7, 1)));
        chain.addParachainBlock(104, 510, Arrays.asList(msg(7, 2), msg(5, 12), msg(5, 13)));
        chain.setDeliveredNonce(5, 10);
        return chain;
    }

    static OutboundQueueMessage msg(long channelId, long nonce) {
        return new OutboundQueueMessage(channelId, nonce, 0, new byte[]{(byte) channelId, (byte) nonce});
    }

    private static CommitmentScanner scanner(MockBridgeChain chain, ScannerConfig config, ScanMetrics metrics) {
        ProofAssembler assembler = new ProofAssembler(chain.parachain(), null, metrics);
        return new CommitmentScanner(chain.parachain(), assembler, config, metrics);
    }
}
