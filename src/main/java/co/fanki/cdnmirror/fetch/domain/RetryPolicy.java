package co.fanki.cdnmirror.fetch.domain;

import co.fanki.cdnmirror.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Bounded retry with exponential backoff for remote requests.
 *
 * <p>Retries only {@link FetchException}s that are retryable; every other
 * failure propagates immediately. The wait before attempt {@code n + 1}
 * is {@code initialBackoff * 2^(n - 1)}. Retries block only the calling
 * thread.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class RetryPolicy {

    private static final Logger LOG = LoggerFactory.getLogger(
            RetryPolicy.class);

    /** Blocks the calling thread between attempts. */
    @FunctionalInterface
    public interface Sleeper {

        /**
         * Waits for the given duration.
         *
         * @param duration the wait
         * @throws InterruptedException if interrupted while waiting
         */
        void sleep(Duration duration) throws InterruptedException;
    }

    private final int maxAttempts;

    private final Duration initialBackoff;

    private final Sleeper sleeper;

    /**
     * Creates a policy that sleeps on the calling thread.
     *
     * @param theMaxAttempts the total number of attempts, at least 1
     * @param theInitialBackoff the wait after the first failure
     */
    public RetryPolicy(final int theMaxAttempts,
            final Duration theInitialBackoff) {
        this(theMaxAttempts, theInitialBackoff,
                duration -> Thread.sleep(duration.toMillis()));
    }

    /**
     * Creates a policy with a custom sleeper.
     *
     * @param theMaxAttempts the total number of attempts, at least 1
     * @param theInitialBackoff the wait after the first failure
     * @param theSleeper the sleeper
     */
    public RetryPolicy(final int theMaxAttempts,
            final Duration theInitialBackoff, final Sleeper theSleeper) {
        this.maxAttempts = Preconditions.requirePositive(theMaxAttempts,
                "Max attempts must be at least 1");
        this.initialBackoff = Preconditions.requireNonNull(theInitialBackoff,
                "Initial backoff is required");
        Preconditions.requireNonNegative(theInitialBackoff.toMillis(),
                "Initial backoff cannot be negative");
        this.sleeper = Preconditions.requireNonNull(theSleeper,
                "Sleeper is required");
    }

    /**
     * Runs an action, retrying transient fetch failures.
     *
     * @param operation a label for log lines
     * @param action the action
     * @param <T> the result type
     * @return the action result
     * @throws FetchException the last failure once attempts are exhausted,
     *         or the first non-retryable one
     */
    public <T> T execute(final String operation, final Supplier<T> action) {
        FetchException lastFailure = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return action.get();
            } catch (final FetchException e) {
                if (!e.isRetryable()) {
                    throw e;
                }
                lastFailure = e;
                if (attempt < maxAttempts) {
                    final Duration backoff = backoffBefore(attempt + 1);
                    LOG.warn("Attempt {}/{} failed for {}, retrying in {}ms:"
                            + " {}", attempt, maxAttempts, operation,
                            backoff.toMillis(), e.getMessage());
                    pause(backoff, e);
                }
            }
        }
        throw lastFailure;
    }

    /**
     * Returns the wait that precedes a given attempt.
     *
     * @param attempt the attempt number, 2 or higher
     * @return the backoff
     */
    public Duration backoffBefore(final int attempt) {
        Preconditions.require(attempt >= 2, "The first attempt has no backoff");
        return initialBackoff.multipliedBy(1L << Math.min(attempt - 2, 30));
    }

    /** @return the total number of attempts */
    public int getMaxAttempts() {
        return maxAttempts;
    }

    private void pause(final Duration backoff, final FetchException cause) {
        try {
            sleeper.sleep(backoff);
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FetchException(FetchException.Kind.TRANSIENT,
                    cause.getUrl(), "Interrupted while waiting to retry", e);
        }
    }

}
