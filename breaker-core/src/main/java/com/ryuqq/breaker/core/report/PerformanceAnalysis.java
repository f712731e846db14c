package com.ryuqq.breaker.core.report;

import com.ryuqq.breaker.core.metrics.HealthMetrics;
import com.ryuqq.breaker.core.metrics.PerformanceTrend;

import java.util.List;

/**
 * 성능 분석 보고서.
 *
 * <p>응답 시간 샘플이 없으면 {@link #empty()}를 반환하며,
 * 이 경우 responseTimeStats와 slowCalls는 null입니다.</p>
 *
 * @param responseTimeStats 응답 시간 통계 (null 가능)
 * @param slowCalls 느린 호출 통계 (null 가능)
 * @param trend 응답 시간 추세
 * @author Breaker Team
 * @since 1.0.0
 */
public record PerformanceAnalysis(
    ResponseTimeStats responseTimeStats,
    SlowCallStats slowCalls,
    PerformanceTrend trend
) {

    private static final PerformanceAnalysis EMPTY =
        new PerformanceAnalysis(null, null, PerformanceTrend.INSUFFICIENT_DATA);

    /**
     * 샘플이 없을 때의 보고서.
     */
    public static PerformanceAnalysis empty() {
        return EMPTY;
    }

    /**
     * 분석할 샘플이 있는지 확인.
     *
     * @return 샘플이 있으면 true
     */
    public boolean hasData() {
        return responseTimeStats != null;
    }

    /**
     * HealthMetrics 응답 시간 링 버퍼로 보고서 생성.
     *
     * @param metrics 지표 (호출자가 락을 보유해야 함)
     * @param slowCallThresholdMs 느린 호출 기준
     * @return 성능 분석
     */
    public static PerformanceAnalysis from(HealthMetrics metrics, long slowCallThresholdMs) {
        List<Double> sorted = metrics.getSortedResponseTimesMs();
        if (sorted.isEmpty()) {
            return empty();
        }

        int n = sorted.size();
        double sum = 0.0;
        for (double value : sorted) {
            sum += value;
        }
        double median = (n % 2 == 1)
            ? sorted.get(n / 2)
            : (sorted.get(n / 2 - 1) + sorted.get(n / 2)) / 2.0;
        double p99 = n > 10 ? sorted.get((int) (n * 0.99)) : sorted.get(n - 1);

        ResponseTimeStats stats = new ResponseTimeStats(
            sorted.get(0),
            sorted.get(n - 1),
            sum / n,
            median,
            metrics.getP95ResponseTimeMs(),
            p99
        );
        SlowCallStats slowCalls = new SlowCallStats(
            slowCallThresholdMs,
            metrics.getSlowCallCount(slowCallThresholdMs),
            metrics.getSlowCallRate(slowCallThresholdMs)
        );
        return new PerformanceAnalysis(stats, slowCalls, metrics.getPerformanceTrend());
    }

    /**
     * 응답 시간 통계 (밀리초).
     */
    public record ResponseTimeStats(
        double min,
        double max,
        double avg,
        double median,
        double p95,
        double p99
    ) {
    }

    /**
     * 느린 호출 통계.
     *
     * @param thresholdMs 느린 호출 기준 (밀리초)
     * @param count 느린 호출 수
     * @param rate 느린 호출 비율 (%)
     */
    public record SlowCallStats(
        long thresholdMs,
        long count,
        double rate
    ) {
    }
}
