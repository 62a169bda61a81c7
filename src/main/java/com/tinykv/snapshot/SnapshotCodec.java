package com.tinykv.snapshot;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.ReadableByteChannel;
import java.nio.channels.WritableByteChannel;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.zip.CRC32;

/**
 * Binary snapshot format.
 *
 * <pre>
 * Header  (10 bytes): magic "TKVS" (4) | version (2) | record count (4)
 * Record  (16 bytes + payload): keyLen (4) | valueLen (4) | expiresAt (8) | key | value
 * Trailer (20 bytes): sequence (8) | capturedAt (8) | CRC32 (4)
 * </pre>
 *
 * All integers are big-endian. The CRC32 covers every byte before it.
 */
public final class SnapshotCodec {

    public static final int MAGIC = 0x544B5653; // "TKVS"
    public static final short VERSION = 1;

    static final int HEADER_SIZE = 4 + 2 + 4;
    static final int RECORD_HEADER_SIZE = 4 + 4 + 8;
    static final int TRAILER_SIZE = 8 + 8 + 4;

    public static final int MAX_KEY_LENGTH = 64 * 1024;          // 64KB
    public static final int MAX_VALUE_LENGTH = 16 * 1024 * 1024; // 16MB

    private SnapshotCodec() {
        // Utility class
    }

    /**
     * Write a snapshot to a file, replacing its content. Does not force the
     * data to disk.
     */
    public static void write(Snapshot snapshot, Path path) throws IOException {
        try (FileChannel channel = FileChannel.open(path,
                StandardOpenOption.CREATE,
                StandardOpenOption.TRUNCATE_EXISTING,
                StandardOpenOption.WRITE)) {
            write(snapshot, channel);
        }
    }

    /**
     * Serialize a snapshot to a channel.
     *
     * @param snapshot the snapshot to write
     * @param channel  destination channel
     * @throws IOException if writing fails
     */
    public static void write(Snapshot snapshot, WritableByteChannel channel) throws IOException {
        CRC32 crc = new CRC32();

        ByteBuffer header = ByteBuffer.allocate(HEADER_SIZE);
        header.putInt(MAGIC);
        header.putShort(VERSION);
        header.putInt(snapshot.size());
        writeChecked(channel, header, crc);

        for (Snapshot.Record record : snapshot.getRecords()) {
            byte[] keyBytes = record.getKeyBytes();
            byte[] value = record.getValueUnsafe();
            if (keyBytes.length == 0 || keyBytes.length > MAX_KEY_LENGTH) {
                throw new SnapshotException("Invalid key length " + keyBytes.length + " for snapshot record");
            }
            if (value.length > MAX_VALUE_LENGTH) {
                throw new SnapshotException("Value for key " + record.getKey() + " exceeds "
                        + MAX_VALUE_LENGTH + " bytes");
            }
            ByteBuffer buffer = ByteBuffer.allocate(RECORD_HEADER_SIZE + keyBytes.length + value.length);
            buffer.putInt(keyBytes.length);
            buffer.putInt(value.length);
            buffer.putLong(record.getExpiresAt());
            buffer.put(keyBytes);
            buffer.put(value);
            writeChecked(channel, buffer, crc);
        }

        ByteBuffer trailer = ByteBuffer.allocate(TRAILER_SIZE);
        trailer.putLong(snapshot.getSequence());
        trailer.putLong(snapshot.getCapturedAt());
        crc.update(trailer.array(), 0, trailer.position());
        trailer.putInt((int) crc.getValue());
        trailer.flip();
        writeFully(channel, trailer);
    }

    /**
     * Read and validate a snapshot file.
     *
     * @throws SnapshotException if the content is malformed or fails the checksum
     * @throws IOException       if reading fails
     */
    public static Snapshot read(Path path) throws IOException {
        try (FileChannel channel = FileChannel.open(path, StandardOpenOption.READ)) {
            return read(channel);
        }
    }

    /**
     * Deserialize a snapshot from a channel. The channel must hold exactly one
     * snapshot.
     *
     * @throws SnapshotException if the content is malformed or fails the checksum
     * @throws IOException       if reading fails
     */
    public static Snapshot read(ReadableByteChannel channel) throws IOException {
        CRC32 crc = new CRC32();

        ByteBuffer header = readChecked(channel, HEADER_SIZE, crc, "header");
        int magic = header.getInt();
        short version = header.getShort();
        int count = header.getInt();
        if (magic != MAGIC) {
            throw new SnapshotException(String.format("Invalid snapshot magic 0x%08X", magic));
        }
        if (version != VERSION) {
            throw new SnapshotException("Unsupported snapshot version " + version);
        }
        if (count < 0) {
            throw new SnapshotException("Invalid snapshot record count " + count);
        }

        List<byte[]> keys = new ArrayList<>(Math.min(count, 1024));
        List<byte[]> values = new ArrayList<>(Math.min(count, 1024));
        List<Long> expirations = new ArrayList<>(Math.min(count, 1024));
        for (int i = 0; i < count; i++) {
            ByteBuffer recordHeader = readChecked(channel, RECORD_HEADER_SIZE, crc, "record header");
            int keyLen = recordHeader.getInt();
            int valueLen = recordHeader.getInt();
            long expiresAt = recordHeader.getLong();
            if (keyLen <= 0 || keyLen > MAX_KEY_LENGTH) {
                throw new SnapshotException("Invalid key length " + keyLen + " in record " + i);
            }
            if (valueLen < 0 || valueLen > MAX_VALUE_LENGTH) {
                throw new SnapshotException("Invalid value length " + valueLen + " in record " + i);
            }
            if (expiresAt < 0) {
                throw new SnapshotException("Invalid expiration " + expiresAt + " in record " + i);
            }

            ByteBuffer payload = readChecked(channel, keyLen + valueLen, crc, "record payload");
            byte[] keyBytes = new byte[keyLen];
            payload.get(keyBytes);
            byte[] value = new byte[valueLen];
            payload.get(value);
            keys.add(keyBytes);
            values.add(value);
            expirations.add(expiresAt);
        }

        ByteBuffer trailer = ByteBuffer.allocate(TRAILER_SIZE);
        if (readFully(channel, trailer) < TRAILER_SIZE) {
            throw new SnapshotException("Truncated snapshot (trailer)");
        }
        trailer.flip();
        long sequence = trailer.getLong();
        long capturedAt = trailer.getLong();
        crc.update(trailer.array(), 0, 16);
        int checksum = trailer.getInt();
        if ((int) crc.getValue() != checksum) {
            throw new SnapshotException("Snapshot checksum mismatch");
        }

        if (readFully(channel, ByteBuffer.allocate(1)) != -1) {
            throw new SnapshotException("Unexpected data after snapshot trailer");
        }

        // Keys are decoded only once the checksum has vouched for the bytes
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        List<Snapshot.Record> records = new ArrayList<>(keys.size());
        for (int i = 0; i < keys.size(); i++) {
            String key;
            try {
                key = decoder.decode(ByteBuffer.wrap(keys.get(i))).toString();
            } catch (CharacterCodingException e) {
                throw new SnapshotException("Invalid key encoding in record " + i, e);
            }
            records.add(new Snapshot.Record(key, values.get(i), expirations.get(i)));
        }

        return new Snapshot(sequence, capturedAt, records);
    }

    private static void writeChecked(WritableByteChannel channel, ByteBuffer buffer, CRC32 crc)
            throws IOException {
        crc.update(buffer.array(), 0, buffer.position());
        buffer.flip();
        writeFully(channel, buffer);
    }

    private static void writeFully(WritableByteChannel channel, ByteBuffer buffer) throws IOException {
        while (buffer.hasRemaining()) {
            channel.write(buffer);
        }
    }

    private static ByteBuffer readChecked(ReadableByteChannel channel, int size, CRC32 crc, String what)
            throws IOException {
        ByteBuffer buffer = ByteBuffer.allocate(size);
        int read = readFully(channel, buffer);
        if (read < size) {
            throw new SnapshotException("Truncated snapshot (" + what + ")");
        }
        crc.update(buffer.array(), 0, size);
        buffer.flip();
        return buffer;
    }

    private static int readFully(ReadableByteChannel channel, ByteBuffer buffer) throws IOException {
        int total = 0;
        while (buffer.hasRemaining()) {
            int read = channel.read(buffer);
            if (read == -1) {
                return total == 0 ? -1 : total;
            }
            total += read;
        }
        return total;
    }
}
