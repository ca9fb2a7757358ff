package com.umitunal.qworker.model;

import com.umitunal.qworker.core.Job;
import com.umitunal.qworker.serialization.PayloadCodec;

import java.nio.ByteBuffer;
import java.util.LinkedHashMap;
import java.util.Map;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Binary record layout for jobs kept in durable storage.
 *
 * Binary format:
 * - failedTries (4 bytes)
 * - id length (4 bytes, -1 when absent) + id bytes (UTF-8)
 * - payload length (4 bytes) + payload bytes (codec-specific)
 */
public class WorkUnitSerializer {

    private final PayloadCodec<Map<String, Object>> payloadCodec;

    public WorkUnitSerializer(PayloadCodec<Map<String, Object>> payloadCodec) {
        this.payloadCodec = payloadCodec;
    }

    public byte[] serialize(Job job) {
        byte[] idBytes = job.getId() != null ? job.getId().getBytes(UTF_8) : null;
        // Codecs get a plain mutable map, never the read-only view
        byte[] payloadBytes = payloadCodec.encode(new LinkedHashMap<>(job.getPayload()));

        int totalSize = 4 +                                              // failedTries
                        4 + (idBytes != null ? idBytes.length : 0) +     // id
                        4 + payloadBytes.length;                         // payload

        ByteBuffer buffer = ByteBuffer.allocate(totalSize);
        buffer.putInt(job.getFailedTries());

        if (idBytes != null) {
            buffer.putInt(idBytes.length);
            buffer.put(idBytes);
        } else {
            buffer.putInt(-1);
        }

        buffer.putInt(payloadBytes.length);
        buffer.put(payloadBytes);

        return buffer.array();
    }

    public WorkUnit deserialize(byte[] bytes) {
        ByteBuffer buffer = ByteBuffer.wrap(bytes);

        int failedTries = buffer.getInt();

        String id = null;
        int idLength = buffer.getInt();
        if (idLength >= 0) {
            byte[] idBytes = new byte[idLength];
            buffer.get(idBytes);
            id = new String(idBytes, UTF_8);
        }

        int payloadLength = buffer.getInt();
        byte[] payloadBytes = new byte[payloadLength];
        buffer.get(payloadBytes);

        return new WorkUnit(id, payloadCodec.decode(payloadBytes), failedTries);
    }
}
