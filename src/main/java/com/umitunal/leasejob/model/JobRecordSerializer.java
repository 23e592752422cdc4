package com.umitunal.leasejob.model;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Binary layout of a stored job document.
 *
 * Format:
 * - format version (1 byte)
 * - id length (4 bytes) + id bytes (UTF-8)
 * - name length (4 bytes) + name bytes (UTF-8)
 * - payload length (4 bytes) + payload bytes
 * - runAt (8 bytes)
 * - lockedUntil presence (1 byte) + lockedUntil (8 bytes)
 * - lockedBy length (4 bytes, -1 for null) + lockedBy bytes (UTF-8)
 * - lastRunAt presence (1 byte) + lastRunAt (8 bytes)
 * - createdAt (8 bytes)
 * - updatedAt (8 bytes)
 */
final class JobRecordSerializer {
    static final byte FORMAT_VERSION = 1;

    private JobRecordSerializer() {
    }

    static byte[] serialize(JobRecord record) {
        byte[] idBytes = record.getId().getBytes(UTF_8);
        byte[] nameBytes = record.getName().getBytes(UTF_8);
        byte[] payloadBytes = record.getPayload();
        byte[] ownerBytes = record.getLockedBy() != null
            ? record.getLockedBy().getBytes(UTF_8)
            : null;

        int totalSize = 1 +
                       4 + idBytes.length +
                       4 + nameBytes.length +
                       4 + payloadBytes.length +
                       8 +                                          // runAt
                       1 + 8 +                                      // lockedUntil
                       4 + (ownerBytes != null ? ownerBytes.length : 0) +
                       1 + 8 +                                      // lastRunAt
                       8 +                                          // createdAt
                       8;                                           // updatedAt

        ByteBuffer buffer = ByteBuffer.allocate(totalSize);
        buffer.put(FORMAT_VERSION);

        putBytes(buffer, idBytes);
        putBytes(buffer, nameBytes);
        putBytes(buffer, payloadBytes);

        buffer.putLong(record.getRunAt());
        putNullableLong(buffer, record.getLockedUntil());

        if (ownerBytes == null) {
            buffer.putInt(-1);
        } else {
            putBytes(buffer, ownerBytes);
        }

        putNullableLong(buffer, record.getLastRunAt());
        buffer.putLong(record.getCreatedAt());
        buffer.putLong(record.getUpdatedAt());

        return buffer.array();
    }

    /**
     * @throws IllegalArgumentException if the bytes are not a complete record in a known format
     */
    static JobRecord deserialize(byte[] bytes) {
        try {
            return read(ByteBuffer.wrap(bytes));
        } catch (BufferUnderflowException | NegativeArraySizeException e) {
            throw new IllegalArgumentException("Truncated job record (" + bytes.length + " bytes)", e);
        }
    }

    private static JobRecord read(ByteBuffer buffer) {
        byte version = buffer.get();
        if (version != FORMAT_VERSION) {
            throw new IllegalArgumentException("Unsupported job record format: " + version);
        }

        String id = new String(getBytes(buffer), UTF_8);
        String name = new String(getBytes(buffer), UTF_8);
        byte[] payload = getBytes(buffer);
        long runAt = buffer.getLong();
        Long lockedUntil = getNullableLong(buffer);

        String lockedBy = null;
        int ownerLength = buffer.getInt();
        if (ownerLength >= 0) {
            byte[] ownerBytes = new byte[ownerLength];
            buffer.get(ownerBytes);
            lockedBy = new String(ownerBytes, UTF_8);
        }

        Long lastRunAt = getNullableLong(buffer);
        long createdAt = buffer.getLong();
        long updatedAt = buffer.getLong();

        JobRecord record = new JobRecord(id, name, payload, runAt, createdAt);
        record.setLockedUntil(lockedUntil);
        record.setLockedBy(lockedBy);
        record.setLastRunAt(lastRunAt);
        record.setUpdatedAt(updatedAt);
        return record;
    }

    private static void putBytes(ByteBuffer buffer, byte[] bytes) {
        buffer.putInt(bytes.length);
        buffer.put(bytes);
    }

    private static byte[] getBytes(ByteBuffer buffer) {
        byte[] bytes = new byte[buffer.getInt()];
        buffer.get(bytes);
        return bytes;
    }

    private static void putNullableLong(ByteBuffer buffer, Long value) {
        buffer.put((byte) (value != null ? 1 : 0));
        buffer.putLong(value != null ? value : 0L);
    }

    private static Long getNullableLong(ByteBuffer buffer) {
        boolean present = buffer.get() == 1;
        long value = buffer.getLong();
        return present ? value : null;
    }
}
