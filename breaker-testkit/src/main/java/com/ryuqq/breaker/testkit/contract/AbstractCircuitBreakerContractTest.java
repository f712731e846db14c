package com.ryuqq.breaker.testkit.contract;

import com.ryuqq.breaker.core.config.CircuitBreakerConfig;
import com.ryuqq.breaker.core.protection.CircuitBreaker;
import com.ryuqq.breaker.core.protection.CircuitOpenException;
import com.ryuqq.breaker.core.state.CircuitState;
import com.ryuqq.breaker.core.state.StateChangeRecord;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.DoubleSupplier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract every adaptive {@link CircuitBreaker} implementation must satisfy.
 *
 * <p>Subclasses only supply a factory. Time is driven by a {@link MutableClock} and
 * randomness by a fixed supplier returning {@code 0.5}, which maps to a jitter factor
 * of exactly 1.0 so that cooldowns are deterministic.</p>
 *
 * <p><strong>Covered behaviour:</strong></p>
 * <ul>
 *   <li>Opening on consecutive failures once minimum throughput is reached</li>
 *   <li>Rejection without invoking the operation while OPEN</li>
 *   <li>Lazy OPEN → HALF_OPEN on the first admission after the cooldown</li>
 *   <li>HALF_OPEN → CLOSED after successThreshold successes</li>
 *   <li>Exponential backoff across consecutive OPEN episodes</li>
 *   <li>reset(), forceOpen() and cleanup() semantics</li>
 * </ul>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * class MyBreakerContractTest extends AbstractCircuitBreakerContractTest {
 *     {@literal @}Override
 *     protected CircuitBreaker newBreaker(String name, CircuitBreakerConfig config,
 *                                         Clock clock, DoubleSupplier random) {
 *         return new MyBreaker(name, config, clock, random);
 *     }
 * }
 * </pre>
 *
 * @author Breaker Team
 * @since 1.0.0
 */
public abstract class AbstractCircuitBreakerContractTest {

    /** Start of every test's timeline. */
    protected static final Instant START = Instant.parse("2026-01-01T00:00:00Z");

    /** Random value that yields a jitter factor of 1.0. */
    protected static final double NEUTRAL_RANDOM = 0.5;

    protected MutableClock clock;
    protected AtomicInteger invocations;

    private final List<CircuitBreaker> created = new ArrayList<>();

    /**
     * Creates the implementation under test.
     *
     * @param name breaker name
     * @param config configuration
     * @param clock time source
     * @param random uniform [0, 1) source used for jitter and canary admission
     * @return a fresh breaker in CLOSED state
     */
    protected abstract CircuitBreaker newBreaker(String name, CircuitBreakerConfig config,
                                                 Clock clock, DoubleSupplier random);

    @BeforeEach
    void setUpClock() {
        clock = new MutableClock(START);
        invocations = new AtomicInteger();
    }

    @AfterEach
    void cleanupBreakers() {
        for (CircuitBreaker breaker : created) {
            breaker.cleanup();
        }
        created.clear();
    }

    // ===================================================================
    // CONTRACT
    // ===================================================================

    @Test
    void testClosed_ReturnsResultAndCountsRequest() throws Exception {
        // Given
        CircuitBreaker cb = breaker("closed", thresholdConfig());

        // When
        String result = cb.call(() -> "payload");

        // Then
        assertEquals("payload", result);
        assertEquals(CircuitState.CLOSED, cb.getCurrentState());
        assertEquals(1, cb.getState().metrics().totalRequests());
        assertEquals(1, cb.getState().metrics().successfulRequests());
    }

    @Test
    void testFailure_IsRethrownUnchanged() {
        // Given
        CircuitBreaker cb = breaker("rethrow", thresholdConfig());
        IOException error = new IOException("connection refused");

        // When
        IOException thrown = assertThrows(IOException.class, () -> cb.call(() -> {
            throw error;
        }));

        // Then
        assertSame(error, thrown);
        assertEquals(1, cb.getState().metrics().failedRequests());
    }

    @Test
    void testBelowMinimumThroughput_StaysClosed() {
        // Given
        CircuitBreaker cb = breaker("throughput", thresholdConfig().withMinimumThroughput(10));

        // When: 5 failures, consecutive threshold is 3 but throughput is 10
        failTimes(cb, 5);

        // Then
        assertEquals(CircuitState.CLOSED, cb.getCurrentState());
    }

    @Test
    void testConsecutiveFailures_OpenAndRejectWithoutInvoking() {
        // Given
        CircuitBreaker cb = breaker("open", thresholdConfig());

        // When
        failTimes(cb, 3);

        // Then
        assertEquals(CircuitState.OPEN, cb.getCurrentState());
        int before = invocations.get();
        CircuitOpenException rejected = assertThrows(CircuitOpenException.class, () -> succeed(cb));
        assertEquals(before, invocations.get(), "Operation must not run while OPEN");
        assertEquals("open", rejected.getBreakerName());
        assertEquals(CircuitState.OPEN, rejected.getState());
        assertEquals(Duration.ofSeconds(10), rejected.getRetryAfter());
    }

    @Test
    void testNextAttemptIn_DecreasesToZero() {
        // Given
        CircuitBreaker cb = breaker("countdown", thresholdConfig());
        failTimes(cb, 3);

        // When & Then
        assertEquals(10_000, cb.getState().nextAttemptInMs());
        clock.advance(Duration.ofSeconds(4));
        assertEquals(6_000, cb.getState().nextAttemptInMs());
        clock.advance(Duration.ofSeconds(7));
        assertEquals(0, cb.getState().nextAttemptInMs());
        assertEquals(CircuitState.OPEN, cb.getCurrentState(), "Transition happens on admission, not on read");
    }

    @Test
    void testRecoveryCycle_OpenHalfOpenClosed() throws Exception {
        // Given
        CircuitBreaker cb = breaker("recovery-cycle", thresholdConfig());

        // When: 3 failures
        failTimes(cb, 3);
        assertEquals(CircuitState.OPEN, cb.getCurrentState());

        // Then: rejected before 10s
        clock.advance(Duration.ofSeconds(9));
        assertThrows(CircuitOpenException.class, () -> succeed(cb));

        // When: cooldown elapsed, one call admitted
        clock.advance(Duration.ofSeconds(1));
        succeed(cb);
        assertEquals(CircuitState.HALF_OPEN, cb.getCurrentState());

        // Then: second success closes
        succeed(cb);
        assertEquals(CircuitState.CLOSED, cb.getCurrentState());
        assertEquals(1.0, cb.getState().recovery().backoffMultiplier());

        List<CircuitState> targets = new ArrayList<>();
        for (StateChangeRecord record : cb.getStateHistory()) {
            targets.add(record.toState());
        }
        assertEquals(List.of(CircuitState.OPEN, CircuitState.HALF_OPEN, CircuitState.CLOSED), targets);
    }

    @Test
    void testTrialFailure_ReopensWithDoubledBackoff() {
        // Given: first OPEN episode
        CircuitBreaker cb = breaker("trial-failure", thresholdConfig());
        failTimes(cb, 3);
        assertEquals(2.0, cb.getState().recovery().backoffMultiplier());

        // When: trial call after cooldown fails
        clock.advance(Duration.ofSeconds(10));
        assertThrows(IOException.class, () -> failOnce(cb));

        // Then: second episode waits 20s
        assertEquals(CircuitState.OPEN, cb.getCurrentState());
        assertEquals(20_000, cb.getState().nextAttemptInMs());
        assertEquals(4.0, cb.getState().recovery().backoffMultiplier());
    }

    @Test
    void testHalfOpenAdmission_HappensExactlyOnce() {
        // Given
        CircuitBreaker cb = breaker("once", thresholdConfig());
        failTimes(cb, 3);
        clock.advance(Duration.ofSeconds(10));

        // When
        assertTrue(cb.tryAcquire());
        assertTrue(cb.tryAcquire());

        // Then
        long halfOpenTransitions = cb.getStateHistory().stream()
            .filter(record -> record.toState() == CircuitState.HALF_OPEN)
            .count();
        assertEquals(1, halfOpenTransitions);
    }

    @Test
    void testReset_KeepsTotalsAndClearsConsecutive() {
        // Given
        CircuitBreaker cb = breaker("reset", thresholdConfig());
        failTimes(cb, 3);

        // When
        cb.reset();

        // Then
        assertEquals(CircuitState.CLOSED, cb.getCurrentState());
        assertEquals(3, cb.getState().metrics().totalRequests());
        assertEquals(0, cb.getState().metrics().consecutiveFailures());
        assertEquals(0, cb.getState().metrics().consecutiveSuccesses());
        assertEquals(1.0, cb.getState().recovery().backoffMultiplier());
        assertEquals(0, cb.getState().nextAttemptInMs());
        assertTrue(cb.tryAcquire());
    }

    @Test
    void testForceOpen_RejectsAndIsIdempotent() {
        // Given
        CircuitBreaker cb = breaker("force", thresholdConfig());

        // When
        cb.forceOpen("maintenance window");
        cb.forceOpen("second call");

        // Then
        assertEquals(CircuitState.OPEN, cb.getCurrentState());
        assertFalse(cb.tryAcquire());
        assertEquals(1, cb.getStateHistory().size());
        assertEquals("maintenance window", cb.getStateHistory().get(0).reason());
    }

    @Test
    void testCleanup_IsIdempotent() {
        // Given
        CircuitBreaker cb = breaker("cleanup", thresholdConfig());
        failTimes(cb, 3);

        // When & Then
        assertDoesNotThrow(cb::cleanup);
        assertDoesNotThrow(cb::cleanup);
    }

    // ===================================================================
    // HELPERS
    // ===================================================================

    /**
     * Shared configuration: failureThreshold=3, minimumThroughput=3,
     * timeout=10s, successThreshold=2.
     */
    protected CircuitBreakerConfig thresholdConfig() {
        return new CircuitBreakerConfig()
            .withFailureThreshold(3)
            .withMinimumThroughput(3)
            .withTimeoutMs(10_000)
            .withSuccessThreshold(2);
    }

    /**
     * Creates a breaker with the shared clock and a neutral random source, cleaned up after the test.
     */
    protected CircuitBreaker breaker(String name, CircuitBreakerConfig config) {
        return breaker(name, config, () -> NEUTRAL_RANDOM);
    }

    /**
     * Creates a breaker with the shared clock and the given random source, cleaned up after the test.
     */
    protected CircuitBreaker breaker(String name, CircuitBreakerConfig config, DoubleSupplier random) {
        CircuitBreaker breaker = newBreaker(name, config, clock, random);
        created.add(breaker);
        return breaker;
    }

    /**
     * Runs a successful operation through the breaker.
     */
    protected String succeed(CircuitBreaker cb) throws Exception {
        return cb.call(() -> {
            invocations.incrementAndGet();
            return "ok";
        });
    }

    /**
     * Runs an operation that fails with a connection error.
     */
    protected void failOnce(CircuitBreaker cb) throws Exception {
        cb.call(() -> {
            invocations.incrementAndGet();
            throw new IOException("connection refused");
        });
    }

    /**
     * Runs {@code times} failing operations, asserting each one propagates its own exception.
     */
    protected void failTimes(CircuitBreaker cb, int times) {
        for (int i = 0; i < times; i++) {
            assertThrows(IOException.class, () -> failOnce(cb));
        }
    }
}
