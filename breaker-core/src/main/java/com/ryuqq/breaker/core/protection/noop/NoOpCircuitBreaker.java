package com.ryuqq.breaker.core.protection.noop;

import com.ryuqq.breaker.core.config.CircuitBreakerConfig;
import com.ryuqq.breaker.core.protection.CircuitBreaker;
import com.ryuqq.breaker.core.protection.CircuitBreakerListener;
import com.ryuqq.breaker.core.report.BreakerStateReport;
import com.ryuqq.breaker.core.report.BreakerStateReport.MetricsReport;
import com.ryuqq.breaker.core.report.BreakerStateReport.RecoveryReport;
import com.ryuqq.breaker.core.report.FailureAnalysis;
import com.ryuqq.breaker.core.report.PerformanceAnalysis;
import com.ryuqq.breaker.core.state.CircuitState;
import com.ryuqq.breaker.core.state.StateChangeRecord;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Circuit Breaker NoOp 구현.
 *
 * <p>모든 요청을 항상 허용하며, 상태 추적을 하지 않습니다.
 * 개발 및 테스트 환경에서 사용하거나, 보호 없이 실행하고자 할 때 사용합니다.</p>
 *
 * <p><strong>동작 방식:</strong></p>
 * <ul>
 *   <li>call(): 작업을 그대로 실행</li>
 *   <li>tryAcquire(): 항상 true 반환</li>
 *   <li>recordSuccess() / recordFailure(): 아무 동작 안 함</li>
 *   <li>getCurrentState(): 항상 CLOSED 반환</li>
 *   <li>분석 조회: 항상 빈 보고서 반환</li>
 * </ul>
 *
 * @author Breaker Team
 * @since 1.0.0
 */
public final class NoOpCircuitBreaker implements CircuitBreaker {

    private static final MetricsReport EMPTY_METRICS =
        new MetricsReport(0, 0, 0, 100.0, 0.0, 0.0, 0.0, 0, 0, null, null, 0.0);
    private static final RecoveryReport NO_RECOVERY = new RecoveryReport(false, 1.0, 1.0);

    private final String name;

    public NoOpCircuitBreaker() {
        this("noop");
    }

    public NoOpCircuitBreaker(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        this.name = name;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public <T> T call(Callable<T> operation) throws Exception {
        return operation.call();
    }

    @Override
    public boolean tryAcquire() {
        return true;
    }

    @Override
    public void recordSuccess(Duration responseTime) {
        // NoOp
    }

    @Override
    public void recordFailure(Throwable throwable, Duration responseTime) {
        // NoOp
    }

    @Override
    public CircuitState getCurrentState() {
        return CircuitState.CLOSED;
    }

    @Override
    public BreakerStateReport getState() {
        return new BreakerStateReport(name, CircuitState.CLOSED, 0, 0,
            EMPTY_METRICS, CircuitBreakerConfig.defaults(), NO_RECOVERY);
    }

    @Override
    public FailureAnalysis getFailureAnalysis() {
        return new FailureAnalysis(Map.of(), 0, List.of(), null);
    }

    @Override
    public PerformanceAnalysis getPerformanceAnalysis() {
        return PerformanceAnalysis.empty();
    }

    @Override
    public List<StateChangeRecord> getStateHistory() {
        return List.of();
    }

    @Override
    public void reset() {
        // NoOp
    }

    @Override
    public void forceOpen(String reason) {
        // NoOp
    }

    @Override
    public void cleanup() {
        // NoOp
    }

    @Override
    public void addListener(CircuitBreakerListener listener) {
        // NoOp
    }

    @Override
    public void removeListener(CircuitBreakerListener listener) {
        // NoOp
    }
}
