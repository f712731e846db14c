package com.ryuqq.breaker.adapter.runtime;

import com.ryuqq.breaker.core.config.CircuitBreakerConfig;
import com.ryuqq.breaker.core.protection.CircuitBreakerListener;
import com.ryuqq.breaker.core.protection.CircuitOpenException;
import com.ryuqq.breaker.core.report.BreakerStateReport;
import com.ryuqq.breaker.core.state.CircuitState;
import com.ryuqq.breaker.core.state.StateChangeRecord;
import com.ryuqq.breaker.testkit.contract.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * AdaptiveCircuitBreaker 멀티스레드 안전성 테스트.
 *
 * <p>락으로 보호되는 상태 갱신을 검증합니다:</p>
 * <ul>
 *   <li>동시 call 호출 시 누적 카운터 정확성</li>
 *   <li>동시 실패 시 OPEN 전이는 한 번만 발생</li>
 *   <li>대기 시간 경과 후 동시 허용 시 HALF_OPEN 전이는 한 번만 발생</li>
 * </ul>
 *
 * @author Breaker Team
 * @since 1.0.0
 */
class AdaptiveCircuitBreakerConcurrentTest {

    private static final int THREAD_COUNT = 16;

    private MutableClock clock;
    private AdaptiveCircuitBreaker breaker;
    private ExecutorService executorService;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        executorService = Executors.newFixedThreadPool(THREAD_COUNT);
    }

    @AfterEach
    void tearDown() {
        executorService.shutdownNow();
        if (breaker != null) {
            breaker.cleanup();
        }
    }

    @RepeatedTest(3)  // Race condition 검증을 위해 3회 반복
    void call_16개_스레드_동시_호출_시_카운터가_정확함() throws InterruptedException {
        // given: 실패율이 100%에 도달하지 않도록 성공을 먼저 기록
        breaker = new AdaptiveCircuitBreaker("counter", new CircuitBreakerConfig()
            .withFailureThreshold(Integer.MAX_VALUE)
            .withFailureRateThreshold(100.0), clock, () -> 0.5);
        int warmUp = 10;
        for (int i = 0; i < warmUp; i++) {
            breaker.recordSuccess(Duration.ZERO);
        }
        int callsPerThread = 500;
        AtomicInteger successes = new AtomicInteger();
        AtomicInteger failures = new AtomicInteger();
        AtomicInteger rejections = new AtomicInteger();
        AtomicInteger unexpected = new AtomicInteger();
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch completionLatch = new CountDownLatch(THREAD_COUNT);

        // when - 짝수 호출은 성공, 홀수 호출은 실패
        for (int t = 0; t < THREAD_COUNT; t++) {
            executorService.submit(() -> {
                try {
                    startLatch.await();
                    for (int i = 0; i < callsPerThread; i++) {
                        boolean fail = i % 2 == 1;
                        try {
                            breaker.call(() -> {
                                if (fail) {
                                    throw new IOException("connection refused");
                                }
                                return "ok";
                            });
                            successes.incrementAndGet();
                        } catch (CircuitOpenException e) {
                            rejections.incrementAndGet();
                        } catch (IOException e) {
                            failures.incrementAndGet();
                        }
                    }
                } catch (Exception e) {
                    unexpected.incrementAndGet();
                } finally {
                    completionLatch.countDown();
                }
            });
        }
        startLatch.countDown();

        // then
        assertThat(completionLatch.await(10, TimeUnit.SECONDS)).isTrue();
        BreakerStateReport.MetricsReport metrics = breaker.getState().metrics();
        int expectedCalls = THREAD_COUNT * callsPerThread;

        assertThat(rejections.get()).isZero();
        assertThat(unexpected.get()).isZero();
        assertThat(successes.get() + failures.get()).isEqualTo(expectedCalls);
        assertThat(metrics.totalRequests()).isEqualTo(expectedCalls + warmUp);
        assertThat(metrics.successfulRequests()).isEqualTo(successes.get() + warmUp);
        assertThat(metrics.failedRequests()).isEqualTo(failures.get());
        assertThat(metrics.totalRequests())
            .isEqualTo(metrics.successfulRequests() + metrics.failedRequests());
        assertThat(breaker.getCurrentState()).isEqualTo(CircuitState.CLOSED);
    }

    @Test
    void recordFailure_동시_실패_시_OPEN_전이는_한_번만_발생() throws InterruptedException {
        // given
        breaker = new AdaptiveCircuitBreaker("open-once", thresholdConfig(), clock, () -> 0.5);
        AtomicInteger openTransitions = new AtomicInteger();
        breaker.addListener(new CircuitBreakerListener() {
            @Override
            public void onStateChange(String name, CircuitState from, CircuitState to, String reason) {
                if (to == CircuitState.OPEN) {
                    openTransitions.incrementAndGet();
                }
            }
        });
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch completionLatch = new CountDownLatch(THREAD_COUNT);

        // when
        for (int t = 0; t < THREAD_COUNT; t++) {
            executorService.submit(() -> {
                try {
                    startLatch.await();
                    for (int i = 0; i < 100; i++) {
                        breaker.recordFailure(new IOException("connection refused"), Duration.ofMillis(5));
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    completionLatch.countDown();
                }
            });
        }
        startLatch.countDown();

        // then
        assertThat(completionLatch.await(10, TimeUnit.SECONDS)).isTrue();
        assertThat(breaker.getCurrentState()).isEqualTo(CircuitState.OPEN);
        assertThat(openTransitions.get()).isEqualTo(1);
        assertThat(breaker.getStateHistory()).hasSize(1);
        assertThat(breaker.getState().metrics().failedRequests()).isEqualTo(THREAD_COUNT * 100L);
        assertThat(breaker.getState().recovery().backoffMultiplier()).isEqualTo(2.0);
    }

    @RepeatedTest(3)
    void tryAcquire_대기_시간_경과_후_동시_허용_시_HALF_OPEN_전이는_한_번만_발생() throws InterruptedException {
        // given
        breaker = new AdaptiveCircuitBreaker("half-open-once", thresholdConfig(), clock, () -> 0.5);
        for (int i = 0; i < 3; i++) {
            breaker.recordFailure(new IOException("connection refused"), Duration.ofMillis(5));
        }
        assertThat(breaker.getCurrentState()).isEqualTo(CircuitState.OPEN);
        clock.advanceMillis(10_000);

        AtomicInteger admitted = new AtomicInteger();
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch completionLatch = new CountDownLatch(THREAD_COUNT);

        // when
        for (int t = 0; t < THREAD_COUNT; t++) {
            executorService.submit(() -> {
                try {
                    startLatch.await();
                    if (breaker.tryAcquire()) {
                        admitted.incrementAndGet();
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    completionLatch.countDown();
                }
            });
        }
        startLatch.countDown();

        // then
        assertThat(completionLatch.await(10, TimeUnit.SECONDS)).isTrue();
        assertThat(breaker.getCurrentState()).isEqualTo(CircuitState.HALF_OPEN);
        assertThat(admitted.get()).isEqualTo(THREAD_COUNT);
        assertThat(breaker.getStateHistory())
            .extracting(StateChangeRecord::toState)
            .containsExactly(CircuitState.OPEN, CircuitState.HALF_OPEN);
    }

    private static CircuitBreakerConfig thresholdConfig() {
        return new CircuitBreakerConfig()
            .withFailureThreshold(3)
            .withMinimumThroughput(3)
            .withTimeoutMs(10_000)
            .withSuccessThreshold(2);
    }
}
