/**
 * Runtime Adapter Layer - Circuit Breaker 구현체.
 *
 * <p>이 패키지는 core의 Protection SPI에 대한 구체적인 구현체들을 포함합니다.</p>
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.breaker.adapter.runtime.AdaptiveCircuitBreaker} - 적응형 상태 머신</li>
 *   <li>{@link com.ryuqq.breaker.adapter.runtime.CircuitBreakerManager} - 이름 기반 레지스트리 및 집계</li>
 *   <li>{@link com.ryuqq.breaker.adapter.runtime.BackoffCalculator} - OPEN 유지 시간 계산</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runtime (AdaptiveCircuitBreaker, CircuitBreakerManager)
 *   ↓ implements
 * core/protection (CircuitBreaker, CircuitBreakerRegistry)
 *   ↓ depends on
 * core (CircuitState, HealthMetrics, FailureClassifier, CircuitBreakerConfig, report)
 * </pre>
 *
 * @author Breaker Team
 * @since 1.0.0
 */
package com.ryuqq.breaker.adapter.runtime;
