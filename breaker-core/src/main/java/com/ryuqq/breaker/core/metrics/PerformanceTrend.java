package com.ryuqq.breaker.core.metrics;

/**
 * 응답 시간 추세.
 *
 * <p>최근 10개 샘플 평균을 그 직전 (최대) 10개 샘플 평균과 비교하며,
 * ±10% 이내의 변화는 STABLE로 간주합니다.</p>
 *
 * @author Breaker Team
 * @since 1.0.0
 */
public enum PerformanceTrend {

    /** 최근 평균이 직전 평균보다 10% 이상 빠름. */
    IMPROVING("improving"),

    /** 최근 평균이 직전 평균보다 10% 이상 느림. */
    DEGRADING("degrading"),

    /** ±10% 이내. */
    STABLE("stable"),

    /** 비교할 샘플이 부족함 (10개 이하). */
    INSUFFICIENT_DATA("insufficient_data");

    private final String value;

    PerformanceTrend(String value) {
        this.value = value;
    }

    /**
     * 외부 노출용 값 조회.
     *
     * @return 소문자 추세 값
     */
    public String getValue() {
        return value;
    }
}
