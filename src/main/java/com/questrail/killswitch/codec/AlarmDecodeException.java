package com.questrail.killswitch.codec;

/**
 * Indicates that received bytes could not be translated into an
 * {@code AlarmRecord}.
 *
 * This typically reflects:
 * <ul>
 *   <li>Wrong magic or unsupported version</li>
 *   <li>CRC mismatch</li>
 *   <li>Truncated or over-long fields</li>
 *   <li>Field values an {@code AlarmRecord} rejects</li>
 * </ul>
 */
public final class AlarmDecodeException extends RuntimeException
{
    public AlarmDecodeException(String message) {
        super(message);
    }

    public AlarmDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
