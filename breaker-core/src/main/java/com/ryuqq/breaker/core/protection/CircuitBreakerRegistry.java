package com.ryuqq.breaker.core.protection;

import com.ryuqq.breaker.core.config.CircuitBreakerConfig;
import com.ryuqq.breaker.core.report.GlobalStatus;

import java.util.Optional;
import java.util.Set;

/**
 * 이름으로 Circuit Breaker를 관리하는 레지스트리.
 *
 * @author Breaker Team
 * @since 1.0.0
 */
public interface CircuitBreakerRegistry {

    /**
     * 기본 설정으로 Circuit Breaker 생성.
     *
     * @param name 이름
     * @return 새로 생성되었거나 이미 등록된 인스턴스
     */
    CircuitBreaker createBreaker(String name);

    /**
     * Circuit Breaker 생성.
     *
     * <p>같은 이름이 이미 있으면 기존 인스턴스를 반환하며 config는 무시됩니다.</p>
     *
     * @param name 이름
     * @param config 설정
     * @return 새로 생성되었거나 이미 등록된 인스턴스
     */
    CircuitBreaker createBreaker(String name, CircuitBreakerConfig config);

    /**
     * 이름으로 조회.
     *
     * @param name 이름
     * @return 등록되어 있지 않으면 empty
     */
    Optional<CircuitBreaker> getBreaker(String name);

    /**
     * 등록된 이름 목록 (등록 순서).
     */
    Set<String> getBreakerNames();

    /**
     * 전체 상태 보고서.
     */
    GlobalStatus getGlobalStatus();

    /**
     * 모든 Circuit Breaker 리셋.
     */
    void resetAll();

    /**
     * 모든 Circuit Breaker 정리 후 레지스트리 비우기.
     */
    void cleanupAll();
}
