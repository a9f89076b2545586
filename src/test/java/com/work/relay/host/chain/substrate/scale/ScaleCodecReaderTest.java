package com.work.relay.host.chain.substrate.scale;

import com.work.relay.core.exception.DecodeException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ScaleCodecReaderTest {

    @Test
    public void compact_single_byte_mode() {
        assertEquals(0L, ScaleCodecReader.ofHex("0x00").readCompact());
        assertEquals(1L, ScaleCodecReader.ofHex("0x04").readCompact());
        assertEquals(63L, ScaleCodecReader.ofHex("0xfc").readCompact());
    }

    @Test
    public void compact_two_and_four_byte_modes() {
        assertEquals(64L, ScaleCodecReader.ofHex("0x0101").readCompact());
        assertEquals(69L, ScaleCodecReader.ofHex("0x1501").readCompact());
        assertEquals(16384L, ScaleCodecReader.ofHex("0x02000100").readCompact());
    }

    @Test
    public void compact_big_integer_mode() {
        assertEquals(1073741824L, ScaleCodecReader.ofHex("0x0300000040").readCompact());
    }

    @Test
    public void fixed_width_integers_are_little_endian() {
        ScaleCodecReader reader = ScaleCodecReader.ofHex("0xf4010000" + "0b00000000000000");

        assertEquals(500L, reader.readUint32());
        assertEquals(11L, reader.readUint64());
        assertFalse(reader.hasNext());
    }

    @Test
    public void byte_array_reads_compact_length_prefix() {
        ScaleCodecReader reader = ScaleCodecReader.ofHex("0x08aabb");

        assertArrayEquals(new byte[]{(byte) 0xaa, (byte) 0xbb}, reader.readByteArray());
    }

    @Test
    public void truncated_input_is_decode_error() {
        assertThrows(DecodeException.class, () -> ScaleCodecReader.ofHex("0x010000").readUint32());
        assertThrows(DecodeException.class, () -> ScaleCodecReader.ofHex("0x0caabb").readByteArray());
    }

    @Test
    public void invalid_option_flag_is_decode_error() {
        assertThrows(DecodeException.class, () -> ScaleCodecReader.ofHex("0x02").readOptionFlag());
    }

    @Test
    public void trailing_bytes_are_reported() {
        ScaleCodecReader reader = ScaleCodecReader.ofHex("0x0001");
        reader.readUByte();

        assertThrows(DecodeException.class, () -> reader.requireFullyConsumed("value"));
    }
}
