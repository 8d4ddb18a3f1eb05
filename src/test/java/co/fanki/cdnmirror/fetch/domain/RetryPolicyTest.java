package co.fanki.cdnmirror.fetch.domain;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for RetryPolicy.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class RetryPolicyTest {

    private final List<Duration> waits = new ArrayList<>();

    private final RetryPolicy policy = new RetryPolicy(3,
            Duration.ofMillis(100), waits::add);

    @Test
    void whenExecuting_givenTransientFailures_shouldRetryWithBackoff() {
        final AtomicInteger calls = new AtomicInteger();

        final String result = policy.execute("op", () -> {
            if (calls.incrementAndGet() < 3) {
                throw transientFailure();
            }
            return "ok";
        });

        assertEquals("ok", result);
        assertEquals(3, calls.get());
        assertEquals(List.of(Duration.ofMillis(100), Duration.ofMillis(200)),
                waits);
    }

    @Test
    void whenExecuting_givenPersistentFailure_shouldRethrowLastOne() {
        final AtomicInteger calls = new AtomicInteger();

        final FetchException e = assertThrows(FetchException.class,
                () -> policy.execute("op", () -> {
                    calls.incrementAndGet();
                    throw transientFailure();
                }));

        assertEquals(3, calls.get());
        assertTrue(e.isRetryable());
        assertEquals(2, waits.size());
    }

    @Test
    void whenExecuting_givenNotFound_shouldFailWithoutRetry() {
        final AtomicInteger calls = new AtomicInteger();
        final FetchException notFound = new FetchException(
                FetchException.Kind.NOT_FOUND, "https://esm.sh/x", "Not found",
                null);

        final FetchException e = assertThrows(FetchException.class,
                () -> policy.execute("op", () -> {
                    calls.incrementAndGet();
                    throw notFound;
                }));

        assertSame(notFound, e);
        assertEquals(1, calls.get());
        assertTrue(waits.isEmpty());
    }

    @Test
    void whenExecuting_givenOtherException_shouldPropagateImmediately() {
        assertThrows(IllegalStateException.class,
                () -> policy.execute("op", () -> {
                    throw new IllegalStateException("boom");
                }));
        assertTrue(waits.isEmpty());
    }

    @Test
    void whenComputingBackoff_givenAttempts_shouldDouble() {
        assertEquals(Duration.ofMillis(100), policy.backoffBefore(2));
        assertEquals(Duration.ofMillis(400), policy.backoffBefore(4));
        assertThrows(IllegalArgumentException.class,
                () -> policy.backoffBefore(1));
    }

    @Test
    void whenCreating_givenZeroAttempts_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> new RetryPolicy(0, Duration.ZERO));
    }

    private static FetchException transientFailure() {
        return new FetchException(FetchException.Kind.TRANSIENT,
                "https://esm.sh/x", "Server error 503", null);
    }

}
