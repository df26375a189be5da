package com.questrail.killswitch.codec.impl;

import com.questrail.killswitch.codec.AlarmDecodeException;

import java.util.Arrays;

/**
 * AlarmCrc
 * -----------------------------------------------------------------------------
 * CRC-16/ARC trailer for encoded alarm records.
 */
final class AlarmCrc
{
    /*
     * CRC-16/ARC (reflected algorithm)
     * -------------------------------------------------------------------------
     *   • Width: 16
     *   • Polynomial (normal): 0x8005
     *   • Reflected polynomial: 0xA001
     *   • Initial value (INIT): 0x0000
     *   • Input reflected: true
     *   • Output reflected: true
     *   • XOROUT: 0x0000
     */
    private static final int REFLECTED_POLY = 0xA001;
    private static final int INIT = 0x0000;

    static final int LENGTH = 2;

    private AlarmCrc() {}

    /**
     * Validates the two trailing CRC bytes against the rest of the payload.
     *
     * @throws AlarmDecodeException if the payload is too short or the CRC does not match
     */
    static void validate(byte[] payload)
    {
        if (payload == null || payload.length <= LENGTH) {
            throw new AlarmDecodeException("CRC expected but payload too short");
        }

        final int len = payload.length;
        final int transmitted = ((payload[len - 2] & 0xFF) << 8)
                |  (payload[len - 1] & 0xFF);

        final int computed = compute(payload, 0, len - LENGTH);

        if (transmitted != computed) {
            throw new AlarmDecodeException(String.format(
                    "CRC mismatch: transmitted=0x%04X computed=0x%04X",
                    transmitted, computed));
        }
    }

    static byte[] stripCrc(byte[] payload)
    {
        return Arrays.copyOf(payload, payload.length - LENGTH);
    }

    /**
     * Appends the CRC of {@code body} as two big-endian bytes.
     */
    static byte[] appendCrc(byte[] body)
    {
        final int crc = compute(body, 0, body.length);
        final byte[] out = Arrays.copyOf(body, body.length + LENGTH);
        out[out.length - 2] = (byte) ((crc >>> 8) & 0xFF);
        out[out.length - 1] = (byte) (crc & 0xFF);
        return out;
    }

    static int compute(byte[] data, int off, int len)
    {
        int crc = INIT & 0xFFFF;

        for (int i = off; i < off + len; i++) {
            crc ^= (data[i] & 0xFF);
            for (int b = 0; b < 8; b++) {
                if ((crc & 0x0001) != 0) {
                    crc = (crc >>> 1) ^ REFLECTED_POLY;
                } else {
                    crc = (crc >>> 1);
                }
            }
            crc &= 0xFFFF;
        }
        return crc & 0xFFFF;
    }
}
