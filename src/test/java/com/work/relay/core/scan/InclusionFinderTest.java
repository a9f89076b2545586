package com.work.relay.core.scan;

import com.work.relay.core.chain.ParachainClient;
import com.work.relay.core.chain.RelayChainClient;
import com.work.relay.core.config.ScannerConfig;
import com.work.relay.core.exception.FinalityTimeoutException;
import com.work.relay.core.exception.MissingStateException;
import com.work.relay.core.model.ParaHead;
import com.work.relay.core.model.ParachainHeader;
import com.work.relay.core.model.PersistedValidationData;
import com.work.relay.core.model.ProofInput;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

public class InclusionFinderTest {

    private static final long PARA_ID = 1000;
    private static final String PARA_BLOCK = "0xpara200";

    private ParachainClient parachain;
    private RelayChainClient relayChain;

    @BeforeEach
    public void setUp() {
        parachain = mock(ParachainClient.class);
        relayChain = mock(RelayChainClient.class);
        when(parachain.getBlockHash(eq(200L))).thenReturn(PARA_BLOCK);
        when(parachain.getValidationData(eq(PARA_BLOCK)))
                .thenReturn(Optional.of(new PersistedValidationData(new byte[0], 500L, "0x00", 0L)));
        when(relayChain.getBlockHash(anyLong())).thenAnswer(inv -> "0xrelay" + inv.getArgument(0));
    }

    @Test
    public void first_matching_relay_block_is_the_inclusion_block() {
        when(relayChain.getParachainHead(eq(PARA_ID), eq("0xrelay501"))).thenReturn(Optional.of(head(199)));
        when(relayChain.getParachainHead(eq(PARA_ID), eq("0xrelay502"))).thenReturn(Optional.of(head(199)));
        when(relayChain.getParachainHead(eq(PARA_ID), eq("0xrelay503"))).thenReturn(Optional.of(head(200)));

        InclusionFinder finder = new InclusionFinder(parachain, relayChain, ScannerConfig.defaultConfig(PARA_ID));

        assertEquals(503L, finder.findInclusionBlock(new ScanContext(5), 200));
        verify(relayChain, never()).getBlockHash(eq(504L));
    }

    @Test
    public void probe_window_exhausted_is_finality_timeout() {
        when(relayChain.getParachainHead(eq(PARA_ID), anyString())).thenReturn(Optional.of(head(199)));

        InclusionFinder finder = new InclusionFinder(parachain, relayChain, ScannerConfig.defaultConfig(PARA_ID));

        FinalityTimeoutException e = assertThrows(FinalityTimeoutException.class,
                () -> finder.findInclusionBlock(new ScanContext(5), 200));
        assertEquals(5L, e.getChannelId());
        assertEquals(200L, e.getParaBlockNumber());
        assertEquals(500L, e.getRelayParentNumber());
        assertTrue(e.getMessage().contains("channelId=5"));
        verify(relayChain, times(4)).getParachainHead(eq(PARA_ID), anyString());
        verify(relayChain, never()).getBlockHash(eq(505L));
    }

    @Test
    public void finalization_timeout_is_configurable() {
        when(relayChain.getParachainHead(eq(PARA_ID), anyString())).thenReturn(Optional.of(head(199)));
        when(relayChain.getParachainHead(eq(PARA_ID), eq("0xrelay506"))).thenReturn(Optional.of(head(200)));

        InclusionFinder finder = new InclusionFinder(parachain, relayChain, new ScannerConfig(PARA_ID, 6, 0, 1));

        assertEquals(506L, finder.findInclusionBlock(new ScanContext(5), 200));
    }

    @Test
    public void unregistered_parachain_is_missing_state() {
        when(relayChain.getParachainHead(eq(PARA_ID), anyString())).thenReturn(Optional.empty());

        InclusionFinder finder = new InclusionFinder(parachain, relayChain, ScannerConfig.defaultConfig(PARA_ID));

        assertThrows(MissingStateException.class, () -> finder.findInclusionBlock(new ScanContext(5), 200));
    }

    @Test
    public void missing_validation_data_is_missing_state() {
        when(parachain.getValidationData(eq(PARA_BLOCK))).thenReturn(Optional.empty());

        InclusionFinder finder = new InclusionFinder(parachain, relayChain, ScannerConfig.defaultConfig(PARA_ID));

        assertThrows(MissingStateException.class, () -> finder.findInclusionBlock(new ScanContext(5), 200));
        verify(relayChain, never()).getParachainHead(anyLong(), anyString());
    }

    @Test
    public void proof_input_heads_are_sorted_by_para_id() {
        when(relayChain.getParachainHeads(eq("0xrelay503"))).thenReturn(Arrays.asList(
                new ParaHead(2000, new byte[]{2}),
                new ParaHead(1000, new byte[]{1}),
                new ParaHead(900, new byte[]{9})));

        InclusionFinder finder = new InclusionFinder(parachain, relayChain, ScannerConfig.defaultConfig(PARA_ID));
        ProofInput input = finder.buildProofInput(503);

        assertEquals(PARA_ID, input.getParaId());
        assertEquals(503L, input.getRelayBlockNumber());
        assertEquals(900L, input.getParaHeads().get(0).getParaId());
        assertEquals(1000L, input.getParaHeads().get(1).getParaId());
        assertEquals(2000L, input.getParaHeads().get(2).getParaId());
    }

    private static ParachainHeader head(long number) {
        return new ParachainHeader(null, "0x00", number, "0x00", "0x00", null);
    }
}
