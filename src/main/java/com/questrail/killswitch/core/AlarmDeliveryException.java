package com.questrail.killswitch.core;

/**
 * Describes why a listener stopped receiving alarm records.
 *
 * <p>Either its callback threw, or its delivery queue stayed full longer than
 * the configured delivery timeout. Either way the listener can no longer claim
 * to have seen every transition, so it is terminated.</p>
 */
public final class AlarmDeliveryException extends RuntimeException
{
    public AlarmDeliveryException(String message) {
        super(message);
    }

    public AlarmDeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
