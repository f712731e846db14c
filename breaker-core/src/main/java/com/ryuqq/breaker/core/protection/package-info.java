/**
 * Protection SPI (Service Provider Interface) 패키지.
 *
 * <p>외부 서비스 호출 시 발생할 수 있는 장애를 격리하기 위한 Circuit Breaker 확장점을 정의합니다.</p>
 *
 * <h2>구성 요소</h2>
 * <ul>
 *   <li>{@link com.ryuqq.breaker.core.protection.CircuitBreaker}: 호출 보호 및 관측 API</li>
 *   <li>{@link com.ryuqq.breaker.core.protection.CircuitBreakerRegistry}: 이름 기반 생성/조회/일괄 관리</li>
 *   <li>{@link com.ryuqq.breaker.core.protection.CircuitBreakerListener}: 성공/실패/상태 전이 이벤트</li>
 *   <li>{@link com.ryuqq.breaker.core.protection.CircuitOpenException}: 요청 차단 신호</li>
 * </ul>
 *
 * <h2>NoOp 구현</h2>
 *
 * <p>{@code noop} 하위 패키지의 {@link com.ryuqq.breaker.core.protection.noop.NoOpCircuitBreaker}는
 * 모든 요청을 허용하고 아무것도 기록하지 않습니다. 보호 없이 실행해야 하는 환경에서 사용합니다.</p>
 *
 * <h2>사용 예시</h2>
 *
 * <h3>개발/테스트 환경 (NoOp 사용)</h3>
 * <pre>{@code
 * CircuitBreaker cb = new NoOpCircuitBreaker("wazuh");
 * }</pre>
 *
 * <h3>프로덕션 환경 (실제 구현 사용)</h3>
 * <pre>{@code
 * // adapter-runtime 모듈
 * try (CircuitBreakerManager manager = new CircuitBreakerManager()) {
 *     CircuitBreaker cb = manager.createWazuhBreaker();
 *     Alerts alerts = cb.call(() -> wazuh.fetchAlerts(query));
 * }
 * }</pre>
 *
 * @author Breaker Team
 * @since 1.0.0
 * @see com.ryuqq.breaker.core.protection.noop
 */
package com.ryuqq.breaker.core.protection;
