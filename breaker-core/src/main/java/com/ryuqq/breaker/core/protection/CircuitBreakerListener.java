package com.ryuqq.breaker.core.protection;

import com.ryuqq.breaker.core.failure.FailureRecord;
import com.ryuqq.breaker.core.state.CircuitState;

/**
 * Circuit Breaker 이벤트 리스너.
 *
 * <p>모든 메서드는 기본 구현이 비어 있으므로 필요한 이벤트만 재정의합니다.
 * 리스너가 던진 {@link Exception}은 Circuit Breaker가 로그로 남기고 무시합니다.
 * {@link Error}는 호출자에게 전파되지만, 상태 전이와 이력 기록은 리스너 호출 전에 완료됩니다.
 * 리스너는 {@link Error}를 던지지 않아야 합니다.</p>
 *
 * <p><strong>호출 시점:</strong></p>
 * <ul>
 *   <li>onStateChange: Circuit Breaker 락을 보유한 상태에서 호출 (전이 순서 보장)</li>
 *   <li>onSuccess / onFailure: 락 해제 후 호출</li>
 * </ul>
 *
 * <p>onStateChange에서 같은 Circuit Breaker를 다시 호출하지 마십시오.</p>
 *
 * @author Breaker Team
 * @since 1.0.0
 */
public interface CircuitBreakerListener {

    /**
     * 성공 기록 후 호출.
     *
     * @param breakerName Circuit Breaker 이름
     * @param responseTimeMs 응답 시간 (밀리초)
     * @param slowCall 느린 호출 여부
     */
    default void onSuccess(String breakerName, double responseTimeMs, boolean slowCall) {
    }

    /**
     * 실패 기록 후 호출.
     *
     * @param breakerName Circuit Breaker 이름
     * @param failure 분류된 실패 기록
     */
    default void onFailure(String breakerName, FailureRecord failure) {
    }

    /**
     * 상태 전이 후 호출.
     *
     * @param breakerName Circuit Breaker 이름
     * @param from 이전 상태
     * @param to 새 상태
     * @param reason 전이 사유
     */
    default void onStateChange(String breakerName, CircuitState from, CircuitState to, String reason) {
    }
}
