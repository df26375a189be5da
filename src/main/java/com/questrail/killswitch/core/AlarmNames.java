package com.questrail.killswitch.core;

/**
 * Well-known alarm names and broadcaster identities.
 */
public final class AlarmNames
{
    /** Aggregate alarm that cuts actuation. */
    public static final String KILL = "kill";

    /** Raised by the physical kill switch driver. */
    public static final String HW_KILL = "hw-kill";

    /** Raised when the shore heartbeat stops arriving. */
    public static final String NETWORK_LOSS = "network-loss";

    /** {@code raisedBy} identity of the administrative force-clear. */
    public static final String MANUAL_OVERRIDE = "manual-override";

    /** {@code raisedBy} identity of the {@link KillAggregator}. */
    public static final String KILL_AGGREGATOR = "kill-aggregator";

    private AlarmNames() {}
}
