package com.questrail.killswitch.codec;

import com.questrail.killswitch.api.AlarmRecord;

/**
 * AlarmRecordCodec
 * -----------------------------------------------------------------------------
 * Byte-level encoding of {@link AlarmRecord}s for out-of-process consumers.
 *
 * <p>The codec carries every record field, including {@code sequence} and
 * {@code observedAt}, so a remote consumer can order records and discard stale
 * ones exactly as an in-process listener would.</p>
 */
public interface AlarmRecordCodec
{
    /**
     * Encode a record into a self-contained datagram payload.
     */
    byte[] encode(AlarmRecord record);

    /**
     * Decode a datagram payload.
     *
     * @throws AlarmDecodeException if the payload is malformed
     */
    AlarmRecord decode(byte[] payload);
}
