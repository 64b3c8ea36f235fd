package io.conductor.core.provider;

import java.time.Duration;
import java.time.Instant;

public record FailureRecord(String providerName, Instant failedAt) {

    /**
     * A record is live while it is younger than the backoff window; stale records are ignored.
     */
    public boolean isLive(Instant now, Duration backoff) {
        return failedAt.plus(backoff).isAfter(now);
    }

    public Duration age(Instant now) {
        return Duration.between(failedAt, now);
    }
}
