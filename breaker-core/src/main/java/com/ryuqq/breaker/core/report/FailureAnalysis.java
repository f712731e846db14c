package com.ryuqq.breaker.core.report;

import com.ryuqq.breaker.core.failure.FailureRecord;
import com.ryuqq.breaker.core.failure.FailureType;
import com.ryuqq.breaker.core.metrics.HealthMetrics;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 실패 분석 보고서.
 *
 * @param failureTypes 유형별 실패 수 (실패 이력 링 버퍼 기준)
 * @param totalFailures 실패 이력 링 버퍼 크기
 * @param recentFailures 최근 10분 이내 실패 중 마지막 10건 (오래된 순)
 * @param mostCommonFailure 가장 빈번한 유형 (실패가 없으면 null)
 * @author Breaker Team
 * @since 1.0.0
 */
public record FailureAnalysis(
    Map<FailureType, Integer> failureTypes,
    int totalFailures,
    List<RecentFailure> recentFailures,
    FailureType mostCommonFailure
) {

    /** recentFailures에 포함할 최대 경과 시간. */
    public static final Duration RECENT_WINDOW = Duration.ofMinutes(10);

    private static final int MAX_RECENT_FAILURES = 10;
    private static final int MAX_MESSAGE_LENGTH = 100;

    public FailureAnalysis {
        failureTypes = Collections.unmodifiableMap(new EnumMap<>(failureTypes));
        recentFailures = List.copyOf(recentFailures);
    }

    /**
     * HealthMetrics 실패 이력으로 보고서 생성.
     *
     * @param metrics 지표 (호출자가 락을 보유해야 함)
     * @param now 기준 시각
     * @return 실패 분석
     */
    public static FailureAnalysis from(HealthMetrics metrics, Instant now) {
        Map<FailureType, Integer> counts = new EnumMap<>(FailureType.class);
        List<RecentFailure> recent = new ArrayList<>();
        List<FailureRecord> history = metrics.getFailureHistory();

        for (FailureRecord failure : history) {
            counts.merge(failure.failureType(), 1, Integer::sum);

            Duration age = failure.age(now);
            if (age.compareTo(RECENT_WINDOW) < 0) {
                recent.add(RecentFailure.of(failure, age));
            }
        }

        if (recent.size() > MAX_RECENT_FAILURES) {
            recent = recent.subList(recent.size() - MAX_RECENT_FAILURES, recent.size());
        }

        // 동률이면 enum 선언 순서가 앞선 유형
        FailureType mostCommon = null;
        int maxCount = 0;
        for (Map.Entry<FailureType, Integer> entry : counts.entrySet()) {
            if (entry.getValue() > maxCount) {
                maxCount = entry.getValue();
                mostCommon = entry.getKey();
            }
        }

        return new FailureAnalysis(counts, history.size(), recent, mostCommon);
    }

    /**
     * 최근 실패 항목.
     *
     * @param timestamp 실패 시각
     * @param type 실패 유형
     * @param message 메시지 (최대 100자)
     * @param ageMs 조회 시점 기준 경과 시간 (밀리초)
     * @param responseTimeMs 실패까지 걸린 시간 (null 가능)
     * @param httpStatus HTTP 상태 코드 (null 가능)
     */
    public record RecentFailure(
        Instant timestamp,
        FailureType type,
        String message,
        long ageMs,
        Double responseTimeMs,
        Integer httpStatus
    ) {

        static RecentFailure of(FailureRecord failure, Duration age) {
            String message = failure.errorMessage();
            if (message.length() > MAX_MESSAGE_LENGTH) {
                message = message.substring(0, MAX_MESSAGE_LENGTH);
            }
            return new RecentFailure(
                failure.timestamp(),
                failure.failureType(),
                message,
                age.toMillis(),
                failure.responseTimeMs(),
                failure.httpStatus()
            );
        }
    }
}
