package com.ryuqq.breaker.core.report;

import com.ryuqq.breaker.core.config.CircuitBreakerConfig;
import com.ryuqq.breaker.core.metrics.HealthMetrics;
import com.ryuqq.breaker.core.state.CircuitState;

import java.time.Instant;

/**
 * Circuit Breaker 상태 스냅샷.
 *
 * <p>관측 계층(대시보드, 상태 API)이 주기적으로 조회하는 읽기 전용 보고서입니다.</p>
 *
 * @param name Circuit Breaker 이름
 * @param state 현재 상태
 * @param stateDurationMs 현재 상태 유지 시간 (밀리초)
 * @param nextAttemptInMs 다음 시도까지 남은 시간 (OPEN이 아니면 0)
 * @param metrics 지표 스냅샷
 * @param config 적용 중인 설정
 * @param recovery 복구 상태
 * @author Breaker Team
 * @since 1.0.0
 */
public record BreakerStateReport(
    String name,
    CircuitState state,
    long stateDurationMs,
    long nextAttemptInMs,
    MetricsReport metrics,
    CircuitBreakerConfig config,
    RecoveryReport recovery
) {

    /**
     * 지표 스냅샷.
     *
     * @param totalRequests 전체 요청 수
     * @param successfulRequests 성공 요청 수
     * @param failedRequests 실패 요청 수
     * @param successRate 성공률 (%)
     * @param failureRate 실패율 (%)
     * @param avgResponseTimeMs 평균 응답 시간 (EMA)
     * @param p95ResponseTimeMs 95 백분위 응답 시간
     * @param consecutiveFailures 연속 실패 수
     * @param consecutiveSuccesses 연속 성공 수
     * @param lastSuccessTime 마지막 성공 시각 (null 가능)
     * @param lastFailureTime 마지막 실패 시각 (null 가능)
     * @param recentFailureRate 최근 5분 실패율 (%)
     */
    public record MetricsReport(
        long totalRequests,
        long successfulRequests,
        long failedRequests,
        double successRate,
        double failureRate,
        double avgResponseTimeMs,
        double p95ResponseTimeMs,
        int consecutiveFailures,
        int consecutiveSuccesses,
        Instant lastSuccessTime,
        Instant lastFailureTime,
        double recentFailureRate
    ) {

        /**
         * HealthMetrics로부터 스냅샷 생성.
         *
         * @param metrics 지표 (호출자가 락을 보유해야 함)
         * @param now 기준 시각
         * @return 스냅샷
         */
        public static MetricsReport from(HealthMetrics metrics, Instant now) {
            return new MetricsReport(
                metrics.getTotalRequests(),
                metrics.getSuccessfulRequests(),
                metrics.getFailedRequests(),
                metrics.getSuccessRate(),
                metrics.getFailureRate(),
                metrics.getAvgResponseTimeMs(),
                metrics.getP95ResponseTimeMs(),
                metrics.getConsecutiveFailures(),
                metrics.getConsecutiveSuccesses(),
                metrics.getLastSuccessTime(),
                metrics.getLastFailureTime(),
                metrics.getRecentFailureRate(now)
            );
        }
    }

    /**
     * 복구 상태.
     *
     * @param recoveryMode 점진적 복구 모드 여부
     * @param gradualRecoveryRate 현재 통과 비율 (0.0 ~ 1.0)
     * @param backoffMultiplier 다음 OPEN 시 적용할 백오프 배수
     */
    public record RecoveryReport(
        boolean recoveryMode,
        double gradualRecoveryRate,
        double backoffMultiplier
    ) {
    }
}
