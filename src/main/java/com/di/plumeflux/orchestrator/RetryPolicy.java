package com.di.plumeflux.orchestrator;

import com.di.plumeflux.config.StationConfig;
import lombok.Value;

import java.time.Duration;

/** Capped exponential backoff: {@code initial * multiplier^(attempt-1)}, never above {@code max}. */
@Value
public class RetryPolicy {

    int maxAttempts;
    Duration initialBackoff;
    Duration maxBackoff;
    double multiplier;

    public static RetryPolicy from(StationConfig.RetrySettings settings) {
        return new RetryPolicy(settings.getMaxAttempts(), settings.getInitialBackoff(),
                settings.getMaxBackoff(), settings.getMultiplier());
    }

    /** True when another attempt is allowed after {@code attemptsMade} attempts. */
    public boolean canRetry(int attemptsMade) {
        return attemptsMade < maxAttempts;
    }

    /** Delay before the attempt following attempt number {@code attemptsMade}. */
    public Duration backoff(int attemptsMade) {
        double millis = initialBackoff.toMillis() * Math.pow(multiplier, Math.max(0, attemptsMade - 1));
        if (Double.isInfinite(millis) || millis >= maxBackoff.toMillis()) {
            return maxBackoff;
        }
        return Duration.ofMillis((long) millis);
    }
}
