package com.ryuqq.breaker.core.report;

import com.ryuqq.breaker.core.failure.FailureRecord;
import com.ryuqq.breaker.core.failure.FailureType;
import com.ryuqq.breaker.core.metrics.HealthMetrics;
import com.ryuqq.breaker.core.metrics.PerformanceTrend;
import com.ryuqq.breaker.core.report.GlobalStatus.GlobalStats;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 보고서 생성 테스트.
 *
 * @author Breaker Team
 * @since 1.0.0
 */
@DisplayName("보고서 생성 테스트")
class ReportTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    @Nested
    @DisplayName("FailureAnalysis")
    class FailureAnalysisTest {

        @Test
        @DisplayName("실패가 없으면 mostCommonFailure는 null")
        void 실패_없음() {
            // when
            FailureAnalysis analysis = FailureAnalysis.from(new HealthMetrics(100), T0);

            // then
            assertThat(analysis.totalFailures()).isZero();
            assertThat(analysis.failureTypes()).isEmpty();
            assertThat(analysis.recentFailures()).isEmpty();
            assertThat(analysis.mostCommonFailure()).isNull();
        }

        @Test
        @DisplayName("유형별 집계와 가장 빈번한 유형")
        void 유형별_집계() {
            // given
            HealthMetrics metrics = new HealthMetrics(100);
            metrics.recordFailure(record(T0, FailureType.TIMEOUT, "t1"));
            metrics.recordFailure(record(T0, FailureType.RATE_LIMIT, "r1"));
            metrics.recordFailure(record(T0, FailureType.RATE_LIMIT, "r2"));

            // when
            FailureAnalysis analysis = FailureAnalysis.from(metrics, T0);

            // then
            assertThat(analysis.failureTypes())
                .containsEntry(FailureType.TIMEOUT, 1)
                .containsEntry(FailureType.RATE_LIMIT, 2);
            assertThat(analysis.totalFailures()).isEqualTo(3);
            assertThat(analysis.mostCommonFailure()).isEqualTo(FailureType.RATE_LIMIT);
        }

        @Test
        @DisplayName("최근 실패는 10분 미만, 마지막 10건, 메시지 100자로 제한")
        void 최근_실패_제한() {
            // given
            HealthMetrics metrics = new HealthMetrics(100);
            metrics.recordFailure(record(T0, FailureType.TIMEOUT, "old"));
            String longMessage = "x".repeat(150);
            for (int i = 0; i < 12; i++) {
                metrics.recordFailure(record(T0.plus(Duration.ofMinutes(5)).plusSeconds(i),
                    FailureType.CONNECTION_ERROR, i == 11 ? longMessage : "c" + i));
            }
            Instant now = T0.plus(Duration.ofMinutes(11));

            // when
            FailureAnalysis analysis = FailureAnalysis.from(metrics, now);

            // then
            assertThat(analysis.totalFailures()).isEqualTo(13);
            assertThat(analysis.recentFailures()).hasSize(10);
            assertThat(analysis.recentFailures().get(0).message()).isEqualTo("c2");
            assertThat(analysis.recentFailures().get(9).message()).hasSize(100);
            assertThat(analysis.recentFailures().get(9).ageMs()).isEqualTo(Duration.ofMinutes(6).minusSeconds(11).toMillis());
        }
    }

    @Nested
    @DisplayName("PerformanceAnalysis")
    class PerformanceAnalysisTest {

        @Test
        @DisplayName("샘플이 없으면 empty")
        void 샘플_없음() {
            // when
            PerformanceAnalysis analysis = PerformanceAnalysis.from(new HealthMetrics(100), 1000);

            // then
            assertThat(analysis.hasData()).isFalse();
            assertThat(analysis).isSameAs(PerformanceAnalysis.empty());
            assertThat(analysis.trend()).isEqualTo(PerformanceTrend.INSUFFICIENT_DATA);
        }

        @Test
        @DisplayName("min, max, median, p99와 느린 호출 통계")
        void 통계_계산() {
            // given
            HealthMetrics metrics = new HealthMetrics(100);
            for (int i = 1; i <= 4; i++) {
                metrics.recordSuccess(i * 100.0, T0);
            }

            // when
            PerformanceAnalysis analysis = PerformanceAnalysis.from(metrics, 250);

            // then
            assertThat(analysis.hasData()).isTrue();
            assertThat(analysis.responseTimeStats().min()).isEqualTo(100.0);
            assertThat(analysis.responseTimeStats().max()).isEqualTo(400.0);
            assertThat(analysis.responseTimeStats().avg()).isEqualTo(250.0);
            assertThat(analysis.responseTimeStats().median()).isEqualTo(250.0);
            assertThat(analysis.responseTimeStats().p99()).isEqualTo(400.0);
            assertThat(analysis.slowCalls().count()).isEqualTo(2);
            assertThat(analysis.slowCalls().rate()).isEqualTo(50.0);
            assertThat(analysis.slowCalls().thresholdMs()).isEqualTo(250);
        }
    }

    @Nested
    @DisplayName("GlobalStatus")
    class GlobalStatusTest {

        @Test
        @DisplayName("healthyPercentage = closed / max(1, total) * 100")
        void 건강도_요약() {
            // when
            GlobalStatus status = GlobalStatus.of(new GlobalStats(4, 1, 1, 2), Map.of());

            // then
            assertThat(status.healthSummary().healthyPercentage()).isEqualTo(50.0);
            assertThat(status.healthSummary().degradedCount()).isEqualTo(1);
            assertThat(status.healthSummary().failedCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("등록된 Circuit Breaker가 없으면 healthyPercentage는 0")
        void 빈_레지스트리() {
            // when
            GlobalStatus status = GlobalStatus.of(GlobalStats.EMPTY, Map.of());

            // then
            assertThat(status.healthSummary().healthyPercentage()).isEqualTo(0.0);
            assertThat(status.breakers()).isEmpty();
        }
    }

    private static FailureRecord record(Instant at, FailureType type, String message) {
        return new FailureRecord(at, type, message, null, null);
    }
}
