package com.ryuqq.breaker.core.state;

import java.time.Instant;

/**
 * 상태 전이 이력 항목.
 *
 * <p>장애 분석(postmortem)을 위해 전이 시점의 지표 스냅샷을 함께 보관합니다.
 * Circuit Breaker는 최근 100건만 유지합니다.</p>
 *
 * @param timestamp 전이 시각
 * @param fromState 이전 상태
 * @param toState 새 상태
 * @param reason 전이 사유 (예: "consecutive failures (5)")
 * @param metricsSnapshot 전이 시점 지표
 * @author Breaker Team
 * @since 1.0.0
 */
public record StateChangeRecord(
    Instant timestamp,
    CircuitState fromState,
    CircuitState toState,
    String reason,
    MetricsSnapshot metricsSnapshot
) {

    /**
     * Compact constructor with validation.
     *
     * @throws IllegalArgumentException 필수 값이 null인 경우
     */
    public StateChangeRecord {
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp cannot be null");
        }
        if (fromState == null || toState == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + fromState + ", to: " + toState + ")");
        }
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("reason cannot be null or blank");
        }
        if (metricsSnapshot == null) {
            throw new IllegalArgumentException("metricsSnapshot cannot be null");
        }
    }

    /**
     * 전이 시점의 지표 스냅샷.
     *
     * @param totalRequests 누적 요청 수
     * @param successRate 성공률 (%)
     * @param failureRate 실패율 (%)
     * @param avgResponseTimeMs 평균 응답 시간 (EMA, 밀리초)
     * @param consecutiveFailures 연속 실패 수
     */
    public record MetricsSnapshot(
        long totalRequests,
        double successRate,
        double failureRate,
        double avgResponseTimeMs,
        int consecutiveFailures
    ) {
    }
}
