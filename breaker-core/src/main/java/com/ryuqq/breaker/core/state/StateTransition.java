package com.ryuqq.breaker.core.state;

/**
 * Circuit 상태 전이 검증.
 *
 * <p>이 클래스는 Circuit Breaker의 상태 전이가 허용된 규칙을 따르는지
 * 검증합니다.</p>
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>CLOSED → OPEN</li>
 *   <li>OPEN → HALF_OPEN</li>
 *   <li>HALF_OPEN → CLOSED</li>
 *   <li>HALF_OPEN → OPEN</li>
 * </ul>
 *
 * <p>수동 {@code reset()}은 관리자 동작이므로 이 검증을 거치지 않습니다.</p>
 *
 * @author Breaker Team
 * @since 1.0.0
 */
public final class StateTransition {

    // Utility class - prevent instantiation
    private StateTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이가 허용되는지 확인.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @return 허용된 전이이면 true
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     */
    public static boolean isAllowed(CircuitState from, CircuitState to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }

        return switch (from) {
            case CLOSED -> to == CircuitState.OPEN;
            case OPEN -> to == CircuitState.HALF_OPEN;
            case HALF_OPEN -> to == CircuitState.CLOSED || to == CircuitState.OPEN;
        };
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * <p>허용되지 않은 전이를 시도하면 {@link IllegalStateException}을 발생시킵니다.</p>
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(CircuitState from, CircuitState to) {
        if (!isAllowed(from, to)) {
            throw new IllegalStateException(
                String.format("Invalid circuit state transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     * @throws IllegalArgumentException current 또는 next가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static CircuitState transition(CircuitState current, CircuitState next) {
        validate(current, next);
        return next;
    }
}
