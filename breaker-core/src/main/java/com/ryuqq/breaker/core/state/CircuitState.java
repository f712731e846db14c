package com.ryuqq.breaker.core.state;

/**
 * Circuit Breaker 상태.
 *
 * <p>Circuit Breaker는 외부 SIEM/Threat-Intel API 호출의 실패율을 추적하고,
 * 임계값 초과 시 요청을 차단하여 장애 전파를 방지합니다.</p>
 *
 * <p><strong>상태 전이:</strong></p>
 * <pre>
 * CLOSED (정상)
 *   │
 *   ▼ (연속 실패 / 실패율 / 느린 호출 비율 임계값 초과)
 * OPEN (차단)
 *   │
 *   ▼ (nextAttemptAt 경과 후 첫 요청)
 * HALF_OPEN (반개방)
 *   │
 *   ├─► 연속 성공 → CLOSED
 *   └─► 임계값 재초과 → OPEN
 * </pre>
 *
 * @author Breaker Team
 * @since 1.0.0
 */
public enum CircuitState {

    /**
     * 정상 상태 (요청 통과).
     *
     * <p>모든 요청이 정상적으로 처리되며, 실패율과 응답 시간을 추적합니다.</p>
     */
    CLOSED("closed"),

    /**
     * 차단 상태 (요청 즉시 거부).
     *
     * <p>nextAttemptAt 이전의 모든 요청을 거부합니다.
     * 대기 시간이 경과한 뒤 첫 요청이 들어오면 HALF_OPEN 상태로 전이합니다.</p>
     */
    OPEN("open"),

    /**
     * 반개방 상태 (복구 테스트).
     *
     * <p>요청을 통과시켜 외부 API의 복구 여부를 확인합니다.
     * 점진적 복구 모드에서는 gradualRecoveryRate 비율만큼만 통과시킵니다.</p>
     */
    HALF_OPEN("half_open");

    private final String value;

    CircuitState(String value) {
        this.value = value;
    }

    /**
     * 외부 노출용 상태 값 조회.
     *
     * @return 소문자 상태 값 (예: "half_open")
     */
    public String getValue() {
        return value;
    }
}
