package com.questrail.killswitch.api;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * AlarmRecord
 * -----------------------------------------------------------------------------
 * Immutable snapshot of one alarm's state at one sequence number.
 *
 * <h2>Immutability</h2>
 * Every broadcast constructs a new record. Consumers may cache the last record
 * they saw and compare it with later deliveries without copying.
 *
 * <h2>Sequence</h2>
 * {@link #sequence()} strictly increases for a given {@link #name()} on every
 * broadcast, including repeats of the same {@link #raised()} value. A consumer
 * can therefore distinguish "still raised" from a stale cached record.
 *
 * @param name               alarm name, never blank
 * @param raised             whether the fault condition is active
 * @param problemDescription human-readable description, may be {@code null}
 * @param parameters         auxiliary key/value data, copied into an unmodifiable map
 * @param raisedBy           identity of the broadcaster ({@code ""} for the default record)
 * @param severity           0..5, carried verbatim
 * @param sequence           per-name broadcast counter, {@code 0} for the default record
 * @param observedAt         wall-clock time at which the record was constructed
 */
public record AlarmRecord(
        String name,
        boolean raised,
        String problemDescription,
        Map<String, String> parameters,
        String raisedBy,
        int severity,
        long sequence,
        Instant observedAt
) {
    public static final int MAX_SEVERITY = 5;

    public AlarmRecord {
        Objects.requireNonNull(name, "name");
        if (name.isBlank()) {
            throw new IllegalArgumentException("alarm name must be non-blank");
        }
        parameters = Map.copyOf(Objects.requireNonNull(parameters, "parameters"));
        Objects.requireNonNull(raisedBy, "raisedBy");
        Objects.requireNonNull(observedAt, "observedAt");
        if (severity < 0 || severity > MAX_SEVERITY) {
            throw new IllegalArgumentException("severity must be 0.." + MAX_SEVERITY + ": " + severity);
        }
        if (sequence < 0) {
            throw new IllegalArgumentException("sequence must be >= 0");
        }
    }

    /**
     * The record every alarm starts with before its first broadcast.
     */
    public static AlarmRecord initial(String name, Instant observedAt) {
        return new AlarmRecord(name, false, null, Map.of(), "", 0, 0L, observedAt);
    }

    public Optional<String> problem() {
        return Optional.ofNullable(problemDescription);
    }

    public boolean isInitial() {
        return sequence == 0L;
    }
}
