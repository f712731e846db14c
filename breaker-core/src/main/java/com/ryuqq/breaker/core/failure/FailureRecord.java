package com.ryuqq.breaker.core.failure;

import java.time.Duration;
import java.time.Instant;

/**
 * 실패 기록.
 *
 * <p>HealthMetrics의 failure history 링 버퍼에 보관됩니다.
 * 경과 시간(age)은 저장하지 않고 조회 시점에 계산합니다.</p>
 *
 * @param timestamp 실패 발생 시각
 * @param failureType 분류된 실패 유형
 * @param errorMessage 예외 메시지 (메시지가 없으면 예외 클래스명)
 * @param responseTimeMs 실패까지 걸린 시간 (밀리초, null 가능)
 * @param httpStatus HTTP 상태 코드 (null 가능)
 * @author Breaker Team
 * @since 1.0.0
 */
public record FailureRecord(
    Instant timestamp,
    FailureType failureType,
    String errorMessage,
    Double responseTimeMs,
    Integer httpStatus
) {

    /**
     * Compact constructor with validation.
     *
     * @throws IllegalArgumentException timestamp, failureType, errorMessage가 null인 경우
     */
    public FailureRecord {
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp cannot be null");
        }
        if (failureType == null) {
            throw new IllegalArgumentException("failureType cannot be null");
        }
        if (errorMessage == null) {
            throw new IllegalArgumentException("errorMessage cannot be null");
        }
        // responseTimeMs, httpStatus는 null 허용
    }

    /**
     * 기준 시각 대비 경과 시간 계산.
     *
     * @param now 기준 시각
     * @return 경과 시간 (음수가 되지 않음)
     */
    public Duration age(Instant now) {
        Duration age = Duration.between(timestamp, now);
        return age.isNegative() ? Duration.ZERO : age;
    }
}
