package com.ryuqq.breaker.adapter.runtime;

import com.ryuqq.breaker.core.config.CircuitBreakerConfig;
import com.ryuqq.breaker.core.failure.FailureClassifier;
import com.ryuqq.breaker.core.failure.FailureRecord;
import com.ryuqq.breaker.core.metrics.HealthMetrics;
import com.ryuqq.breaker.core.protection.CircuitBreaker;
import com.ryuqq.breaker.core.protection.CircuitBreakerListener;
import com.ryuqq.breaker.core.protection.CircuitOpenException;
import com.ryuqq.breaker.core.report.BreakerStateReport;
import com.ryuqq.breaker.core.report.BreakerStateReport.MetricsReport;
import com.ryuqq.breaker.core.report.BreakerStateReport.RecoveryReport;
import com.ryuqq.breaker.core.report.FailureAnalysis;
import com.ryuqq.breaker.core.report.PerformanceAnalysis;
import com.ryuqq.breaker.core.state.CircuitState;
import com.ryuqq.breaker.core.state.StateChangeRecord;
import com.ryuqq.breaker.core.state.StateChangeRecord.MetricsSnapshot;
import com.ryuqq.breaker.core.state.StateTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * 적응형 Circuit Breaker 구현.
 *
 * <p>실패 횟수, 실패율, 느린 호출 비율로 OPEN 여부를 판단하고, OPEN 구간은
 * 지수 백오프와 Jitter로 늘려 가며, 트래픽이 많았던 서비스는 HALF_OPEN에서
 * 일부 요청만 통과시키는 점진적 복구(canary)를 수행합니다.</p>
 *
 * <p><strong>상태 전이:</strong></p>
 * <pre>
 * CLOSED ──(임계값 초과)──→ OPEN ──(nextAttemptAt 경과 후 첫 요청)──→ HALF_OPEN
 *   ↑                                                                   │
 *   └──────────────(연속 성공 ≥ successThreshold)──────────────────────┤
 *                                      OPEN ←──(실패 평가)──────────────┘
 * </pre>
 *
 * <p><strong>OPEN 판단 (totalRequests ≥ minimumThroughput일 때만):</strong></p>
 * <ul>
 *   <li>연속 실패 ≥ failureThreshold</li>
 *   <li>실패율 ≥ failureRateThreshold</li>
 *   <li>느린 호출 비율 ≥ slowCallRateThreshold (응답 시간 링 버퍼 기준, 우선 적용되는 사유)</li>
 * </ul>
 *
 * <p><strong>동시성:</strong></p>
 * <ul>
 *   <li>상태와 지표는 Circuit Breaker별 락으로 보호하며, 보호 대상 작업은 락 밖에서 실행합니다.</li>
 *   <li>onStateChange 리스너는 락 안에서, onSuccess/onFailure 리스너는 락 밖에서 호출합니다.</li>
 *   <li>{@link #getCurrentState()}는 락 없이 읽을 수 있습니다.</li>
 * </ul>
 *
 * <p><strong>스케줄러 소유권:</strong> 스케줄러를 주입받지 않으면 첫 OPEN 전이 시 전용 daemon 스케줄러를
 * 만들고 {@link #cleanup()}에서 종료합니다. 주입받은 스케줄러는 종료하지 않습니다.</p>
 *
 * @author Breaker Team
 * @since 1.0.0
 */
public final class AdaptiveCircuitBreaker implements CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(AdaptiveCircuitBreaker.class);

    static final int MAX_STATE_HISTORY = 100;

    private static final String REASON_TESTING_RECOVERY = "Testing recovery";
    private static final String REASON_RECOVERY_COMPLETED = "Recovery completed";
    private static final String REASON_TRIAL_FAILED = "trial call failed";
    private static final String REASON_MANUAL_RESET = "Manual reset";
    private static final String REASON_MANUAL_OVERRIDE = "Manual override";

    private final String name;
    private final CircuitBreakerConfig config;
    private final FailureClassifier classifier;
    private final Clock clock;
    private final DoubleSupplier random;
    private final BackoffCalculator backoffCalculator;
    private final ListenerNotifier notifier;
    private final boolean ownsScheduler;

    private final Object lock = new Object();

    // lock으로 보호
    private final HealthMetrics metrics;
    private final Deque<StateChangeRecord> stateHistory = new ArrayDeque<>();
    private volatile CircuitState state = CircuitState.CLOSED;
    private Instant stateChangedAt;
    private Instant nextAttemptAt;
    private double backoffMultiplier = 1.0;
    private boolean recoveryMode;
    private double gradualRecoveryRate = 1.0;
    private ScheduledExecutorService scheduler;
    private HealthCheckTask healthCheckTask;
    private boolean cleanedUp;

    /**
     * 기본 분류기, 시스템 시계로 생성 (전용 스케줄러 사용).
     *
     * @param name 이름
     * @param config 설정
     */
    public AdaptiveCircuitBreaker(String name, CircuitBreakerConfig config) {
        this(name, config, Clock.systemUTC(), defaultRandom());
    }

    /**
     * 시계와 난수 공급자를 지정하여 생성 (전용 스케줄러 사용).
     *
     * @param name 이름
     * @param config 설정
     * @param clock 시간 공급자
     * @param random [0, 1) 균등 분포 난수 공급자
     */
    public AdaptiveCircuitBreaker(String name, CircuitBreakerConfig config, Clock clock, DoubleSupplier random) {
        this(name, config, FailureClassifier.defaults(), clock, random, null, true);
    }

    /**
     * 공유 스케줄러로 생성.
     *
     * <p>주입받은 스케줄러는 {@link #cleanup()}에서 종료하지 않습니다.</p>
     *
     * @param name 이름
     * @param config 설정
     * @param classifier 실패 분류기
     * @param clock 시간 공급자
     * @param random [0, 1) 균등 분포 난수 공급자
     * @param scheduler 헬스 체크 스케줄러
     * @throws IllegalArgumentException 파라미터가 null이거나 이름이 비어 있는 경우
     */
    public AdaptiveCircuitBreaker(String name, CircuitBreakerConfig config, FailureClassifier classifier,
                                  Clock clock, DoubleSupplier random, ScheduledExecutorService scheduler) {
        this(name, config, classifier, clock, random, requireScheduler(scheduler), false);
    }

    private AdaptiveCircuitBreaker(String name, CircuitBreakerConfig config, FailureClassifier classifier,
                                   Clock clock, DoubleSupplier random, ScheduledExecutorService scheduler,
                                   boolean ownsScheduler) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (classifier == null) {
            throw new IllegalArgumentException("classifier cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (random == null) {
            throw new IllegalArgumentException("random cannot be null");
        }
        this.name = name;
        this.config = config;
        this.classifier = classifier;
        this.clock = clock;
        this.random = random;
        this.scheduler = scheduler;
        this.ownsScheduler = ownsScheduler;
        this.backoffCalculator = new BackoffCalculator(config, random);
        this.notifier = new ListenerNotifier(name);
        this.metrics = new HealthMetrics(config.slidingWindowSize());
        this.stateChangedAt = clock.instant();

        log.info("Circuit breaker '{}' initialized", name);
    }

    @Override
    public String getName() {
        return name;
    }

    // ============================================================
    // 보호 실행
    // ============================================================

    @Override
    public <T> T call(Callable<T> operation) throws Exception {
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        if (!tryAcquire()) {
            throw rejection();
        }

        Instant start = clock.instant();
        T result;
        try {
            result = operation.call();
        } catch (Exception e) {
            recordFailure(e, Duration.between(start, clock.instant()));
            throw e;
        }
        recordSuccess(Duration.between(start, clock.instant()));
        return result;
    }

    @Override
    public boolean tryAcquire() {
        synchronized (lock) {
            return switch (state) {
                case CLOSED -> true;
                case OPEN -> {
                    if (clock.instant().isBefore(nextAttemptAt)) {
                        yield false;
                    }
                    transitionToHalfOpen();
                    yield true;
                }
                case HALF_OPEN -> !recoveryMode || random.getAsDouble() < gradualRecoveryRate;
            };
        }
    }

    @Override
    public void recordSuccess(Duration responseTime) {
        double responseTimeMs = toMillis(responseTime);
        boolean slowCall = responseTimeMs > config.slowCallThresholdMs();

        synchronized (lock) {
            metrics.recordSuccess(responseTimeMs, clock.instant());

            if (state == CircuitState.HALF_OPEN) {
                if (metrics.getConsecutiveSuccesses() >= config.successThreshold()) {
                    transitionToClosed();
                } else if (recoveryMode) {
                    gradualRecoveryRate = Math.min(1.0, gradualRecoveryRate * config.recoveryStepUp());
                }
            } else if (state == CircuitState.CLOSED && slowCall) {
                String reason = slowCallOpenReason();
                if (reason != null) {
                    transitionToOpen(reason);
                }
            }
        }

        if (slowCall) {
            log.warn("Slow call detected for circuit breaker '{}': {} ms (threshold: {} ms)",
                name, String.format(Locale.ROOT, "%.1f", responseTimeMs), config.slowCallThresholdMs());
        }
        log.debug("Success recorded for circuit breaker '{}' ({} ms)", name, responseTimeMs);
        notifier.notifySuccess(responseTimeMs, slowCall);
    }

    @Override
    public void recordFailure(Throwable throwable, Duration responseTime) {
        if (throwable == null) {
            throw new IllegalArgumentException("throwable cannot be null");
        }
        double responseTimeMs = toMillis(responseTime);
        FailureRecord failure;

        synchronized (lock) {
            failure = classifier.toRecord(throwable, clock.instant(), responseTimeMs);
            metrics.recordFailure(failure);

            if (state == CircuitState.HALF_OPEN && recoveryMode) {
                gradualRecoveryRate = Math.max(0.0, gradualRecoveryRate * config.recoveryStepDown());
            }
            evaluateAfterFailure();
        }

        log.warn("Failure recorded for circuit breaker '{}': {} - {}",
            name, failure.failureType().getValue(), failure.errorMessage());
        notifier.notifyFailure(failure);
    }

    // ============================================================
    // 관리 API
    // ============================================================

    @Override
    public void reset() {
        synchronized (lock) {
            log.info("Resetting circuit breaker '{}'", name);

            CircuitState from = state;
            Instant now = clock.instant();
            cancelHealthCheck();
            state = CircuitState.CLOSED;
            stateChangedAt = now;
            nextAttemptAt = null;
            backoffMultiplier = 1.0;
            recoveryMode = false;
            gradualRecoveryRate = 1.0;
            metrics.resetConsecutive();

            recordStateChange(from, CircuitState.CLOSED, REASON_MANUAL_RESET, now);
        }
    }

    @Override
    public void forceOpen(String reason) {
        String effectiveReason = (reason == null || reason.isBlank()) ? REASON_MANUAL_OVERRIDE : reason;
        synchronized (lock) {
            if (state == CircuitState.OPEN) {
                log.debug("Force open ignored for circuit breaker '{}': already OPEN", name);
                return;
            }
            log.warn("Force opening circuit breaker '{}': {}", name, effectiveReason);
            transitionToOpen(effectiveReason);
        }
    }

    @Override
    public void cleanup() {
        ScheduledExecutorService toShutdown = null;
        synchronized (lock) {
            if (cleanedUp) {
                return;
            }
            cleanedUp = true;
            cancelHealthCheck();
            if (ownsScheduler && scheduler != null) {
                toShutdown = scheduler;
                scheduler = null;
            }
        }
        if (toShutdown != null) {
            toShutdown.shutdownNow();
        }
        log.info("Circuit breaker '{}' cleaned up", name);
    }

    @Override
    public void addListener(CircuitBreakerListener listener) {
        notifier.add(listener);
    }

    @Override
    public void removeListener(CircuitBreakerListener listener) {
        notifier.remove(listener);
    }

    // ============================================================
    // 관측 API
    // ============================================================

    @Override
    public CircuitState getCurrentState() {
        return state;
    }

    @Override
    public BreakerStateReport getState() {
        synchronized (lock) {
            Instant now = clock.instant();
            return new BreakerStateReport(
                name,
                state,
                nonNegativeMillis(Duration.between(stateChangedAt, now)),
                remainingCooldown(now).toMillis(),
                MetricsReport.from(metrics, now),
                config,
                new RecoveryReport(recoveryMode, gradualRecoveryRate, backoffMultiplier)
            );
        }
    }

    @Override
    public FailureAnalysis getFailureAnalysis() {
        synchronized (lock) {
            return FailureAnalysis.from(metrics, clock.instant());
        }
    }

    @Override
    public PerformanceAnalysis getPerformanceAnalysis() {
        synchronized (lock) {
            return PerformanceAnalysis.from(metrics, config.slowCallThresholdMs());
        }
    }

    @Override
    public List<StateChangeRecord> getStateHistory() {
        synchronized (lock) {
            return List.copyOf(stateHistory);
        }
    }

    public CircuitBreakerConfig getConfig() {
        return config;
    }

    /**
     * 현재 OPEN 구간의 헬스 체크가 실행 중인지 확인.
     */
    boolean isHealthCheckActive() {
        synchronized (lock) {
            return healthCheckTask != null && !healthCheckTask.isCancelled();
        }
    }

    // ============================================================
    // 상태 전이 (lock 보유 상태에서만 호출)
    // ============================================================

    private void evaluateAfterFailure() {
        if (state == CircuitState.OPEN) {
            return;
        }
        String reason = openReason();
        if (reason == null && state == CircuitState.HALF_OPEN && !recoveryMode) {
            reason = REASON_TRIAL_FAILED;
        }
        if (reason != null) {
            transitionToOpen(reason);
        }
    }

    private String openReason() {
        if (metrics.getTotalRequests() < config.minimumThroughput()) {
            return null;
        }

        String reason = null;
        if (metrics.getConsecutiveFailures() >= config.failureThreshold()) {
            reason = "consecutive failures (" + metrics.getConsecutiveFailures() + ")";
        } else if (metrics.getFailureRate() >= config.failureRateThreshold()) {
            reason = String.format(Locale.ROOT, "high failure rate (%.1f%%)", metrics.getFailureRate());
        }

        String slowReason = slowCallRateReason();
        return slowReason != null ? slowReason : reason;
    }

    private String slowCallOpenReason() {
        if (metrics.getTotalRequests() < config.minimumThroughput()) {
            return null;
        }
        return slowCallRateReason();
    }

    private String slowCallRateReason() {
        double slowCallRate = metrics.getSlowCallRate(config.slowCallThresholdMs());
        if (slowCallRate >= config.slowCallRateThreshold()) {
            return String.format(Locale.ROOT, "high slow call rate (%.1f%%)", slowCallRate);
        }
        return null;
    }

    private void transitionToOpen(String reason) {
        CircuitState from = state;
        StateTransition.validate(from, CircuitState.OPEN);

        Instant now = clock.instant();
        long openDurationMs = backoffCalculator.calculateOpenDurationMs(backoffMultiplier);
        backoffMultiplier = backoffCalculator.nextMultiplier(backoffMultiplier);

        state = CircuitState.OPEN;
        stateChangedAt = now;
        nextAttemptAt = now.plusMillis(openDurationMs);
        startHealthCheck();

        log.warn("Circuit breaker '{}' OPEN: {} (next attempt in {} ms)", name, reason, openDurationMs);
        recordStateChange(from, CircuitState.OPEN, reason, now);
    }

    private void transitionToHalfOpen() {
        CircuitState from = state;
        StateTransition.validate(from, CircuitState.HALF_OPEN);

        Instant now = clock.instant();
        cancelHealthCheck();
        state = CircuitState.HALF_OPEN;
        stateChangedAt = now;
        nextAttemptAt = null;
        metrics.resetConsecutive();

        if (metrics.getTotalRequests() > config.gradualRecoveryMinRequests()) {
            recoveryMode = true;
            gradualRecoveryRate = config.recoveryFactor();
        } else {
            recoveryMode = false;
            gradualRecoveryRate = 1.0;
        }

        log.info("Circuit breaker '{}' HALF_OPEN (recovery mode: {})", name, recoveryMode);
        recordStateChange(from, CircuitState.HALF_OPEN, REASON_TESTING_RECOVERY, now);
    }

    private void transitionToClosed() {
        CircuitState from = state;
        StateTransition.validate(from, CircuitState.CLOSED);

        Instant now = clock.instant();
        state = CircuitState.CLOSED;
        stateChangedAt = now;
        nextAttemptAt = null;
        backoffMultiplier = 1.0;
        recoveryMode = false;
        gradualRecoveryRate = 1.0;

        log.info("Circuit breaker '{}' CLOSED", name);
        recordStateChange(from, CircuitState.CLOSED, REASON_RECOVERY_COMPLETED, now);
    }

    private void recordStateChange(CircuitState from, CircuitState to, String reason, Instant now) {
        MetricsSnapshot snapshot = new MetricsSnapshot(
            metrics.getTotalRequests(),
            metrics.getSuccessRate(),
            metrics.getFailureRate(),
            metrics.getAvgResponseTimeMs(),
            metrics.getConsecutiveFailures()
        );
        if (stateHistory.size() == MAX_STATE_HISTORY) {
            stateHistory.removeFirst();
        }
        stateHistory.addLast(new StateChangeRecord(now, from, to, reason, snapshot));
        notifier.notifyStateChange(from, to, reason);
    }

    private void startHealthCheck() {
        cancelHealthCheck();
        if (cleanedUp) {
            log.debug("Health check skipped for circuit breaker '{}': already cleaned up", name);
            return;
        }
        HealthCheckTask task = new HealthCheckTask(name, clock, nextAttemptAt,
            () -> state == CircuitState.OPEN);
        task.start(scheduler(), config.healthCheckIntervalMs());
        healthCheckTask = task;
    }

    private void cancelHealthCheck() {
        if (healthCheckTask != null) {
            healthCheckTask.cancel();
            healthCheckTask = null;
        }
    }

    private ScheduledExecutorService scheduler() {
        if (scheduler == null) {
            scheduler = newDaemonScheduler("circuit-breaker-health-" + name);
        }
        return scheduler;
    }

    private CircuitOpenException rejection() {
        synchronized (lock) {
            return new CircuitOpenException(name, state, remainingCooldown(clock.instant()));
        }
    }

    private Duration remainingCooldown(Instant now) {
        if (state != CircuitState.OPEN || nextAttemptAt == null) {
            return Duration.ZERO;
        }
        Duration remaining = Duration.between(now, nextAttemptAt);
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    // ============================================================
    // 유틸리티
    // ============================================================

    static ScheduledExecutorService newDaemonScheduler(String threadName) {
        ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(1, runnable -> {
            Thread thread = new Thread(runnable, threadName);
            thread.setDaemon(true);
            return thread;
        });
        executor.setRemoveOnCancelPolicy(true);
        return executor;
    }

    static DoubleSupplier defaultRandom() {
        return () -> ThreadLocalRandom.current().nextDouble();
    }

    private static ScheduledExecutorService requireScheduler(ScheduledExecutorService scheduler) {
        if (scheduler == null) {
            throw new IllegalArgumentException("scheduler cannot be null");
        }
        return scheduler;
    }

    private static double toMillis(Duration responseTime) {
        if (responseTime == null) {
            throw new IllegalArgumentException("responseTime cannot be null");
        }
        if (responseTime.isNegative()) {
            return 0.0;
        }
        return responseTime.toNanos() / 1_000_000.0;
    }

    private static long nonNegativeMillis(Duration duration) {
        return duration.isNegative() ? 0 : duration.toMillis();
    }
}
