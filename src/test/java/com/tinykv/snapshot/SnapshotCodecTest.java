package com.tinykv.snapshot;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.channels.Channels;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.zip.CRC32;

import static org.assertj.core.api.Assertions.*;

class SnapshotCodecTest {

    @TempDir
    Path tempDir;

    private static Snapshot sample() {
        return new Snapshot(42, 1_700_000_000_000L, List.of(
                new Snapshot.Record("alpha", "one".getBytes(StandardCharsets.UTF_8), 0),
                new Snapshot.Record("béta", new byte[]{0, '\r', '\n', (byte) 0xff}, 1_800_000_000_000L),
                new Snapshot.Record("empty", new byte[0], 0)));
    }

    private static byte[] encode(Snapshot snapshot) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        SnapshotCodec.write(snapshot, Channels.newChannel(out));
        return out.toByteArray();
    }

    private static Snapshot decode(byte[] bytes) throws IOException {
        return SnapshotCodec.read(Channels.newChannel(new ByteArrayInputStream(bytes)));
    }

    @Test
    void writeThenRead_preservesEverything() throws IOException {
        Path file = tempDir.resolve("dump.tkvs");
        Snapshot original = sample();

        SnapshotCodec.write(original, file);
        Snapshot restored = SnapshotCodec.read(file);

        assertThat(restored.getSequence()).isEqualTo(42);
        assertThat(restored.getCapturedAt()).isEqualTo(1_700_000_000_000L);
        assertThat(restored.getRecords()).containsExactlyElementsOf(original.getRecords());
    }

    @Test
    void write_layoutMatchesFormat() throws IOException {
        Snapshot snapshot = new Snapshot(7, 99, List.of(
                new Snapshot.Record("k", "vv".getBytes(StandardCharsets.UTF_8), 5)));

        byte[] bytes = encode(snapshot);

        assertThat(bytes).hasSize(SnapshotCodec.HEADER_SIZE + SnapshotCodec.RECORD_HEADER_SIZE + 3
                + SnapshotCodec.TRAILER_SIZE);
        assertThat(Arrays.copyOfRange(bytes, 0, 4)).isEqualTo("TKVS".getBytes(StandardCharsets.US_ASCII));
        assertThat(Arrays.copyOfRange(bytes, 4, 10)).containsExactly(0, 1, 0, 0, 0, 1);
    }

    @Test
    void write_replacesExistingFileContent() throws IOException {
        Path file = tempDir.resolve("dump.tkvs");
        SnapshotCodec.write(sample(), file);

        SnapshotCodec.write(new Snapshot(1, 2, List.of()), file);

        assertThat(SnapshotCodec.read(file).size()).isZero();
    }

    @Test
    void read_emptySnapshot() throws IOException {
        Snapshot restored = decode(encode(new Snapshot(0, 5, List.of())));

        assertThat(restored.size()).isZero();
        assertThat(restored.getCapturedAt()).isEqualTo(5);
    }

    @Test
    void read_flippedPayloadByte_failsChecksum() throws IOException {
        byte[] bytes = encode(sample());
        bytes[SnapshotCodec.HEADER_SIZE + SnapshotCodec.RECORD_HEADER_SIZE] ^= 0x01;

        assertThatThrownBy(() -> decode(bytes))
                .isInstanceOf(SnapshotException.class)
                .hasMessage("Snapshot checksum mismatch");
    }

    @Test
    void read_flippedTrailerByte_failsChecksum() throws IOException {
        byte[] bytes = encode(sample());
        bytes[bytes.length - SnapshotCodec.TRAILER_SIZE] ^= 0x01;

        assertThatThrownBy(() -> decode(bytes))
                .isInstanceOf(SnapshotException.class)
                .hasMessage("Snapshot checksum mismatch");
    }

    @Test
    void read_badMagic_isRejected() throws IOException {
        byte[] bytes = encode(sample());
        bytes[0] = 'X';

        assertThatThrownBy(() -> decode(bytes))
                .isInstanceOf(SnapshotException.class)
                .hasMessageContaining("magic");
    }

    @Test
    void read_unknownVersion_isRejected() throws IOException {
        byte[] bytes = encode(sample());
        bytes[5] = 9;

        assertThatThrownBy(() -> decode(bytes))
                .isInstanceOf(SnapshotException.class)
                .hasMessageContaining("version 9");
    }

    @Test
    void read_emptyFile_isTruncated() {
        assertThatThrownBy(() -> decode(new byte[0]))
                .isInstanceOf(SnapshotException.class)
                .hasMessage("Truncated snapshot (header)");
    }

    @Test
    void read_everyTruncation_isRejected() throws IOException {
        byte[] bytes = encode(sample());

        for (int length = 0; length < bytes.length; length++) {
            byte[] truncated = Arrays.copyOf(bytes, length);
            assertThatThrownBy(() -> decode(truncated))
                    .as("truncated to %d bytes", length)
                    .isInstanceOf(SnapshotException.class);
        }
    }

    @Test
    void read_trailingData_isRejected() throws IOException {
        byte[] bytes = encode(sample());
        byte[] extended = Arrays.copyOf(bytes, bytes.length + 1);

        assertThatThrownBy(() -> decode(extended))
                .isInstanceOf(SnapshotException.class)
                .hasMessage("Unexpected data after snapshot trailer");
    }

    @Test
    void read_hugeKeyLength_isRejectedBeforeAllocation() throws IOException {
        byte[] bytes = encode(sample());
        int keyLenOffset = SnapshotCodec.HEADER_SIZE;
        bytes[keyLenOffset] = 0x7f;

        assertThatThrownBy(() -> decode(bytes))
                .isInstanceOf(SnapshotException.class)
                .hasMessageContaining("Invalid key length");
    }

    @Test
    void write_oversizedKey_isRejected() {
        char[] chars = new char[SnapshotCodec.MAX_KEY_LENGTH + 1];
        Arrays.fill(chars, 'k');
        Snapshot snapshot = new Snapshot(1, 1, List.of(new Snapshot.Record(new String(chars), new byte[0], 0)));

        assertThatThrownBy(() -> encode(snapshot))
                .isInstanceOf(SnapshotException.class);
    }

    @Test
    void read_malformedUtf8Key_isRejected() throws IOException {
        byte[] bytes = encode(new Snapshot(1, 1, List.of(new Snapshot.Record("k", new byte[]{1}, 0))));
        bytes[SnapshotCodec.HEADER_SIZE + SnapshotCodec.RECORD_HEADER_SIZE] = (byte) 0xff;
        // Re-seal the file so only the key encoding is wrong
        CRC32 crc = new CRC32();
        crc.update(bytes, 0, bytes.length - 4);
        int checksum = (int) crc.getValue();
        bytes[bytes.length - 4] = (byte) (checksum >>> 24);
        bytes[bytes.length - 3] = (byte) (checksum >>> 16);
        bytes[bytes.length - 2] = (byte) (checksum >>> 8);
        bytes[bytes.length - 1] = (byte) checksum;

        assertThatThrownBy(() -> decode(bytes))
                .isInstanceOf(SnapshotException.class)
                .hasMessage("Invalid key encoding in record 0");
    }

    @Test
    void write_unencodableKey_isRejected() {
        Snapshot snapshot = new Snapshot(1, 1, List.of(new Snapshot.Record("bad\uD800", new byte[0], 0)));

        assertThatThrownBy(() -> encode(snapshot))
                .isInstanceOf(SnapshotException.class)
                .hasMessage("Key cannot be encoded as UTF-8");
    }

    @Test
    void read_missingFile_throwsIOException() {
        assertThatThrownBy(() -> SnapshotCodec.read(tempDir.resolve("nope.tkvs")))
                .isInstanceOf(IOException.class);
        assertThat(Files.exists(tempDir.resolve("nope.tkvs"))).isFalse();
    }
}
