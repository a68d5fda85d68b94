package dk.cloudcreate.toggles.eventsourced.aggregates.retry;

import java.time.Duration;

import static dk.cloudcreate.essentials.shared.FailFast.*;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Defines how many times {@link OptimisticConcurrencyRetry} attempts a command and how long it waits between attempts
 */
public class ConcurrencyRetryPolicy {
    public final int      maximumNumberOfAttempts;
    public final Duration delayBetweenAttempts;

    public ConcurrencyRetryPolicy(int maximumNumberOfAttempts, Duration delayBetweenAttempts) {
        requireTrue(maximumNumberOfAttempts >= 1, msg("maximumNumberOfAttempts must be 1 or larger, but was {}", maximumNumberOfAttempts));
        this.maximumNumberOfAttempts = maximumNumberOfAttempts;
        this.delayBetweenAttempts = requireNonNull(delayBetweenAttempts, "No delayBetweenAttempts provided");
        requireTrue(!delayBetweenAttempts.isNegative(), "delayBetweenAttempts must not be negative");
    }

    public static ConcurrencyRetryPolicy fixedDelay(Duration delayBetweenAttempts, int maximumNumberOfAttempts) {
        return new ConcurrencyRetryPolicy(maximumNumberOfAttempts, delayBetweenAttempts);
    }

    /**
     * A single attempt
     */
    public static ConcurrencyRetryPolicy noRetries() {
        return new ConcurrencyRetryPolicy(1, Duration.ZERO);
    }

    public static ConcurrencyRetryPolicy defaultPolicy() {
        return fixedDelay(Duration.ofMillis(25), 5);
    }

    @Override
    public String toString() {
        return "ConcurrencyRetryPolicy{" +
                "maximumNumberOfAttempts=" + maximumNumberOfAttempts +
                ", delayBetweenAttempts=" + delayBetweenAttempts +
                '}';
    }
}
