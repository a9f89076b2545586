package com.work.relay.core.scan;

import com.work.relay.core.model.DigestItem;
import com.work.relay.core.model.ParachainHeader;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class CommitmentDigestsTest {

    private static final String COMMITMENT = "0x1111111111111111111111111111111111111111111111111111111111111111";

    @Test
    public void extracts_commitment_from_other_digest_item() {
        DigestItem seal = new DigestItem(DigestItem.Kind.SEAL, "aura".getBytes(StandardCharsets.US_ASCII), new byte[]{1, 2});
        ParachainHeader header = header(Arrays.asList(seal, CommitmentDigests.toDigestItem(COMMITMENT)));

        assertEquals(Optional.of(COMMITMENT), CommitmentDigests.extract(header));
    }

    @Test
    public void header_without_commitment_yields_empty() {
        assertFalse(CommitmentDigests.extract(header(Collections.<DigestItem>emptyList())).isPresent());
    }

    @Test
    public void other_item_with_foreign_prefix_is_ignored() {
        byte[] data = new byte[33];
        data[0] = 0x01;
        ParachainHeader header = header(Collections.singletonList(DigestItem.other(data)));

        assertFalse(CommitmentDigests.extract(header).isPresent());
    }

    @Test
    public void other_item_with_wrong_length_is_ignored() {
        ParachainHeader header = header(Collections.singletonList(DigestItem.other(new byte[]{0x00, 0x01})));

        assertFalse(CommitmentDigests.extract(header).isPresent());
    }

    private static ParachainHeader header(List<DigestItem> digest) {
        return new ParachainHeader("0x01", "0x00", 1, "0x00", "0x00", digest);
    }
}
