package com.ryuqq.breaker.core.protection;

import com.ryuqq.breaker.core.state.CircuitState;

import java.time.Duration;

/**
 * Circuit Breaker가 요청을 차단했을 때 던지는 예외.
 *
 * <p>장애가 아니라 제어 흐름 신호입니다. 호출자는 {@link #getRetryAfter()} 이후 재시도할 수 있습니다.</p>
 *
 * @author Breaker Team
 * @since 1.0.0
 */
public class CircuitOpenException extends RuntimeException {

    private final String breakerName;
    private final CircuitState state;
    private final Duration retryAfter;

    /**
     * 생성자.
     *
     * @param breakerName Circuit Breaker 이름
     * @param state 차단 시점 상태
     * @param retryAfter 다음 시도까지 남은 시간 (음수면 0으로 보정)
     */
    public CircuitOpenException(String breakerName, CircuitState state, Duration retryAfter) {
        super(String.format("Circuit breaker '%s' is %s (retry after %d ms)",
            breakerName, state, normalize(retryAfter).toMillis()));
        this.breakerName = breakerName;
        this.state = state;
        this.retryAfter = normalize(retryAfter);
    }

    public String getBreakerName() {
        return breakerName;
    }

    public CircuitState getState() {
        return state;
    }

    public Duration getRetryAfter() {
        return retryAfter;
    }

    /**
     * 다음 시도까지 남은 시간 (초).
     */
    public double getRetryAfterSeconds() {
        return retryAfter.toMillis() / 1000.0;
    }

    private static Duration normalize(Duration retryAfter) {
        if (retryAfter == null || retryAfter.isNegative()) {
            return Duration.ZERO;
        }
        return retryAfter;
    }
}
