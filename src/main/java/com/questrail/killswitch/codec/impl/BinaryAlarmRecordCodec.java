package com.questrail.killswitch.codec.impl;

import com.questrail.killswitch.api.AlarmRecord;
import com.questrail.killswitch.codec.AlarmDecodeException;
import com.questrail.killswitch.codec.AlarmRecordCodec;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * BinaryAlarmRecordCodec
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link AlarmRecordCodec}.
 *
 * <p>Layout (big-endian):</p>
 * <pre>
 *   'K' 'A'                  magic
 *   u8    version            (1)
 *   i64   sequence
 *   u8    raised             (0 / 1)
 *   u8    severity
 *   i64   observedAt         epoch milliseconds
 *   str   name
 *   str   raisedBy
 *   u8    hasProblem         (0 / 1), followed by str when 1
 *   u16   parameterCount,    followed by (str key, str value) pairs
 *   u16   CRC-16/ARC         over every preceding byte
 *
 *   str = u16 byte length + UTF-8 bytes
 * </pre>
 *
 * <p>{@code observedAt} is carried at millisecond precision.</p>
 */
public final class BinaryAlarmRecordCodec implements AlarmRecordCodec
{
    static final byte MAGIC_0 = 'K';
    static final byte MAGIC_1 = 'A';
    static final byte VERSION = 1;

    private static final int MAX_STRING_BYTES = 0xFFFF;
    private static final int MAX_PARAMETERS = 0xFFFF;

    @Override
    public byte[] encode(AlarmRecord record)
    {
        Objects.requireNonNull(record, "record");

        byte[] name = utf8(record.name());
        byte[] raisedBy = utf8(record.raisedBy());
        byte[] problem = record.problemDescription() == null ? null : utf8(record.problemDescription());

        if (record.parameters().size() > MAX_PARAMETERS) {
            throw new IllegalArgumentException("too many parameters: " + record.parameters().size());
        }

        int size = 2 + 1 + 8 + 1 + 1 + 8
                + 2 + name.length
                + 2 + raisedBy.length
                + 1 + (problem == null ? 0 : 2 + problem.length)
                + 2;

        List<byte[]> params = new ArrayList<>();
        for (Map.Entry<String, String> e : record.parameters().entrySet()) {
            byte[] k = utf8(e.getKey());
            byte[] v = utf8(e.getValue());
            params.add(k);
            params.add(v);
            size += 2 + k.length + 2 + v.length;
        }

        ByteBuffer buf = ByteBuffer.allocate(size);
        buf.put(MAGIC_0).put(MAGIC_1).put(VERSION);
        buf.putLong(record.sequence());
        buf.put((byte) (record.raised() ? 1 : 0));
        buf.put((byte) record.severity());
        buf.putLong(record.observedAt().toEpochMilli());
        putString(buf, name);
        putString(buf, raisedBy);
        if (problem == null) {
            buf.put((byte) 0);
        } else {
            buf.put((byte) 1);
            putString(buf, problem);
        }
        // Keys and values alternate.
        buf.putShort((short) (params.size() / 2));
        for (byte[] bytes : params) {
            putString(buf, bytes);
        }

        return AlarmCrc.appendCrc(buf.array());
    }

    @Override
    public AlarmRecord decode(byte[] payload)
    {
        Objects.requireNonNull(payload, "payload");

        AlarmCrc.validate(payload);
        ByteBuffer buf = ByteBuffer.wrap(AlarmCrc.stripCrc(payload));

        try {
            if (buf.get() != MAGIC_0 || buf.get() != MAGIC_1) {
                throw new AlarmDecodeException("bad magic");
            }
            byte version = buf.get();
            if (version != VERSION) {
                throw new AlarmDecodeException("unsupported version: " + version);
            }

            long sequence = buf.getLong();
            boolean raised = flag(buf.get(), "raised");
            int severity = buf.get() & 0xFF;
            Instant observedAt = Instant.ofEpochMilli(buf.getLong());
            String name = getString(buf);
            String raisedBy = getString(buf);
            String problem = flag(buf.get(), "hasProblem") ? getString(buf) : null;

            int count = buf.getShort() & 0xFFFF;
            Map<String, String> parameters = new LinkedHashMap<>();
            for (int i = 0; i < count; i++) {
                String key = getString(buf);
                String value = getString(buf);
                if (parameters.put(key, value) != null) {
                    throw new AlarmDecodeException("duplicate parameter: " + key);
                }
            }

            if (buf.hasRemaining()) {
                throw new AlarmDecodeException(buf.remaining() + " trailing bytes");
            }

            return new AlarmRecord(name, raised, problem, parameters, raisedBy, severity, sequence, observedAt);
        }
        catch (BufferUnderflowException e) {
            throw new AlarmDecodeException("truncated alarm record", e);
        }
        catch (IllegalArgumentException e) {
            throw new AlarmDecodeException("invalid alarm record: " + e.getMessage(), e);
        }
    }

    private static boolean flag(byte b, String field)
    {
        return switch (b) {
            case 0 -> false;
            case 1 -> true;
            default -> throw new AlarmDecodeException("invalid " + field + " flag: " + b);
        };
    }

    private static byte[] utf8(String s)
    {
        byte[] bytes = s.getBytes(StandardCharsets.UTF_8);
        if (bytes.length > MAX_STRING_BYTES) {
            throw new IllegalArgumentException("string exceeds " + MAX_STRING_BYTES + " bytes");
        }
        return bytes;
    }

    private static void putString(ByteBuffer buf, byte[] bytes)
    {
        buf.putShort((short) bytes.length);
        buf.put(bytes);
    }

    private static String getString(ByteBuffer buf)
    {
        int len = buf.getShort() & 0xFFFF;
        byte[] bytes = new byte[len];
        buf.get(bytes);
        return new String(bytes, StandardCharsets.UTF_8);
    }
}
