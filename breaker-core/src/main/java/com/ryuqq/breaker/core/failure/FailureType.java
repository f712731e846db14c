package com.ryuqq.breaker.core.failure;

/**
 * 실패 유형.
 *
 * <p>실패 유형은 관측(observability) 목적으로만 사용되며,
 * 상태 전이 판단에는 영향을 주지 않습니다.</p>
 *
 * @author Breaker Team
 * @since 1.0.0
 */
public enum FailureType {

    /** 응답 시간 초과. */
    TIMEOUT("timeout"),

    /** 연결 실패 (연결 거부, DNS 실패 등). */
    CONNECTION_ERROR("connection_error"),

    /** HTTP 4xx/5xx 응답 (다른 규칙에 해당하지 않는 경우). */
    HTTP_ERROR("http_error"),

    /** 인증/인가 실패. */
    AUTHENTICATION_ERROR("auth_error"),

    /** 요청 한도 초과 (429). */
    RATE_LIMIT("rate_limit"),

    /** 서비스 이용 불가 (503). */
    SERVICE_UNAVAILABLE("service_unavailable"),

    /** 분류 불가. */
    UNKNOWN_ERROR("unknown_error");

    private final String value;

    FailureType(String value) {
        this.value = value;
    }

    /**
     * 외부 노출용 값 조회.
     *
     * @return 소문자 유형 값 (예: "auth_error")
     */
    public String getValue() {
        return value;
    }
}
