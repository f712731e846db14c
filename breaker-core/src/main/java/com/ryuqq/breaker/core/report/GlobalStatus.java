package com.ryuqq.breaker.core.report;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 전체 Circuit Breaker 상태 보고서.
 *
 * @param globalStats 상태별 집계
 * @param breakers 이름별 상태 스냅샷 (등록 순서)
 * @param healthSummary 건강도 요약
 * @author Breaker Team
 * @since 1.0.0
 */
public record GlobalStatus(
    GlobalStats globalStats,
    Map<String, BreakerStateReport> breakers,
    HealthSummary healthSummary
) {

    public GlobalStatus {
        breakers = Collections.unmodifiableMap(new LinkedHashMap<>(breakers));
    }

    /**
     * 집계로부터 보고서 생성.
     *
     * @param stats 상태별 집계
     * @param breakers 이름별 상태 스냅샷
     * @return 보고서
     */
    public static GlobalStatus of(GlobalStats stats, Map<String, BreakerStateReport> breakers) {
        return new GlobalStatus(stats, breakers, HealthSummary.from(stats));
    }

    /**
     * 상태별 Circuit Breaker 수.
     */
    public record GlobalStats(
        int totalBreakers,
        int openBreakers,
        int halfOpenBreakers,
        int closedBreakers
    ) {

        /** 비어 있는 집계. */
        public static final GlobalStats EMPTY = new GlobalStats(0, 0, 0, 0);
    }

    /**
     * 건강도 요약.
     *
     * @param healthyPercentage CLOSED 비율 (%) = closed / max(1, total) * 100
     * @param degradedCount HALF_OPEN 수
     * @param failedCount OPEN 수
     */
    public record HealthSummary(
        double healthyPercentage,
        int degradedCount,
        int failedCount
    ) {

        static HealthSummary from(GlobalStats stats) {
            double healthy = (stats.closedBreakers() * 100.0) / Math.max(1, stats.totalBreakers());
            return new HealthSummary(healthy, stats.halfOpenBreakers(), stats.openBreakers());
        }
    }
}
