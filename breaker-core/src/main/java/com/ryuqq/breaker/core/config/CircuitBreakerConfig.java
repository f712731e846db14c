package com.ryuqq.breaker.core.config;

/**
 * Circuit Breaker 설정 (불변 record).
 *
 * <p>이 record는 Circuit Breaker의 임계값, 백오프, 점진적 복구 동작을 제어하는 설정값을 담고 있습니다.</p>
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>failureThreshold: OPEN 전이까지의 연속 실패 수 (기본 5)</li>
 *   <li>successThreshold: HALF_OPEN → CLOSED 전이에 필요한 연속 성공 수 (기본 3)</li>
 *   <li>timeoutMs: OPEN 유지 기본 시간 (기본 60000ms = 1분)</li>
 *   <li>maxTimeoutMs: 백오프 상한 (기본 300000ms = 5분)</li>
 *   <li>failureRateThreshold: OPEN 전이 실패율 (기본 50%)</li>
 *   <li>slowCallThresholdMs: 느린 호출 기준 (기본 10000ms)</li>
 *   <li>slowCallRateThreshold: OPEN 전이 느린 호출 비율 (기본 50%)</li>
 *   <li>minimumThroughput: 상태 평가 전 최소 요청 수 (기본 10)</li>
 *   <li>slidingWindowSize: 응답 시간/실패 이력 링 버퍼 크기 (기본 100)</li>
 *   <li>exponentialBackoff: OPEN 반복 시 대기 시간 2배 증가 (기본 true)</li>
 *   <li>jitter: 대기 시간에 ±20% 무작위 보정 (기본 true)</li>
 *   <li>healthCheckIntervalMs: OPEN 상태 헬스 체크 주기 (기본 30000ms)</li>
 *   <li>recoveryFactor: 점진적 복구 시작 통과 비율 (기본 0.1)</li>
 *   <li>recoveryStepUp: 복구 중 성공 시 통과 비율 배수 (기본 1.1)</li>
 *   <li>recoveryStepDown: 복구 중 실패 시 통과 비율 배수 (기본 0.5)</li>
 *   <li>gradualRecoveryMinRequests: 점진적 복구를 적용할 누적 요청 수 (기본 1000 초과)</li>
 * </ul>
 *
 * <p><strong>튜닝 가이드:</strong></p>
 * <ul>
 *   <li>민감한 차단: failureThreshold 감소 (5 → 3), failureRateThreshold 감소 (50 → 30)</li>
 *   <li>빠른 복구 시도: timeoutMs 감소 (60000 → 30000)</li>
 *   <li>고트래픽 서비스: recoveryFactor 감소 (0.1 → 0.05)로 복구 직후 부하 완화</li>
 * </ul>
 *
 * @author Breaker Team
 * @since 1.0.0
 * @param failureThreshold 연속 실패 임계값 (1 이상)
 * @param successThreshold 연속 성공 임계값 (1 이상)
 * @param timeoutMs OPEN 기본 대기 시간 (밀리초, 양수)
 * @param maxTimeoutMs 최대 대기 시간 (밀리초, timeoutMs 이상)
 * @param failureRateThreshold 실패율 임계값 (%, 0 초과 100 이하)
 * @param slowCallThresholdMs 느린 호출 기준 (밀리초, 양수)
 * @param slowCallRateThreshold 느린 호출 비율 임계값 (%, 0 초과 100 이하)
 * @param minimumThroughput 최소 요청 수 (1 이상)
 * @param slidingWindowSize 링 버퍼 크기 (1 이상)
 * @param exponentialBackoff 지수 백오프 사용 여부
 * @param jitter jitter 사용 여부
 * @param healthCheckIntervalMs 헬스 체크 주기 (밀리초, 양수)
 * @param recoveryFactor 점진적 복구 시작 비율 (0 초과 1 이하)
 * @param recoveryStepUp 성공 시 비율 배수 (1 이상)
 * @param recoveryStepDown 실패 시 비율 배수 (0 초과 1 미만)
 * @param gradualRecoveryMinRequests 점진적 복구 적용 누적 요청 수 (0 이상)
 */
public record CircuitBreakerConfig(
    int failureThreshold,
    int successThreshold,
    long timeoutMs,
    long maxTimeoutMs,
    double failureRateThreshold,
    long slowCallThresholdMs,
    double slowCallRateThreshold,
    int minimumThroughput,
    int slidingWindowSize,
    boolean exponentialBackoff,
    boolean jitter,
    long healthCheckIntervalMs,
    double recoveryFactor,
    double recoveryStepUp,
    double recoveryStepDown,
    long gradualRecoveryMinRequests
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: failureThreshold=5, successThreshold=3, timeoutMs=60000ms, maxTimeoutMs=300000ms,
     * failureRateThreshold=50%, slowCallThresholdMs=10000ms, slowCallRateThreshold=50%,
     * minimumThroughput=10, slidingWindowSize=100, exponentialBackoff=true, jitter=true,
     * healthCheckIntervalMs=30000ms, recoveryFactor=0.1, recoveryStepUp=1.1, recoveryStepDown=0.5,
     * gradualRecoveryMinRequests=1000</p>
     */
    public CircuitBreakerConfig() {
        this(5, 3, 60000, 300000, 50.0, 10000, 50.0, 10, 100,
            true, true, 30000, 0.1, 1.1, 0.5, 1000);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public CircuitBreakerConfig {
        if (failureThreshold <= 0) {
            throw new IllegalArgumentException(
                "failureThreshold must be positive (current: " + failureThreshold + ")"
            );
        }
        if (successThreshold <= 0) {
            throw new IllegalArgumentException(
                "successThreshold must be positive (current: " + successThreshold + ")"
            );
        }
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException(
                "timeoutMs must be positive (current: " + timeoutMs + ")"
            );
        }
        if (maxTimeoutMs < timeoutMs) {
            throw new IllegalArgumentException(
                "maxTimeoutMs must be >= timeoutMs (timeout: " + timeoutMs + ", max: " + maxTimeoutMs + ")"
            );
        }
        if (failureRateThreshold <= 0.0 || failureRateThreshold > 100.0) {
            throw new IllegalArgumentException(
                "failureRateThreshold must be between 0 (exclusive) and 100 (current: " + failureRateThreshold + ")"
            );
        }
        if (slowCallThresholdMs <= 0) {
            throw new IllegalArgumentException(
                "slowCallThresholdMs must be positive (current: " + slowCallThresholdMs + ")"
            );
        }
        if (slowCallRateThreshold <= 0.0 || slowCallRateThreshold > 100.0) {
            throw new IllegalArgumentException(
                "slowCallRateThreshold must be between 0 (exclusive) and 100 (current: " + slowCallRateThreshold + ")"
            );
        }
        if (minimumThroughput <= 0) {
            throw new IllegalArgumentException(
                "minimumThroughput must be positive (current: " + minimumThroughput + ")"
            );
        }
        if (slidingWindowSize <= 0) {
            throw new IllegalArgumentException(
                "slidingWindowSize must be positive (current: " + slidingWindowSize + ")"
            );
        }
        if (healthCheckIntervalMs <= 0) {
            throw new IllegalArgumentException(
                "healthCheckIntervalMs must be positive (current: " + healthCheckIntervalMs + ")"
            );
        }
        if (recoveryFactor <= 0.0 || recoveryFactor > 1.0) {
            throw new IllegalArgumentException(
                "recoveryFactor must be between 0 (exclusive) and 1.0 (current: " + recoveryFactor + ")"
            );
        }
        if (recoveryStepUp < 1.0) {
            throw new IllegalArgumentException(
                "recoveryStepUp must be >= 1.0 (current: " + recoveryStepUp + ")"
            );
        }
        if (recoveryStepDown <= 0.0 || recoveryStepDown >= 1.0) {
            throw new IllegalArgumentException(
                "recoveryStepDown must be between 0.0 and 1.0 (both exclusive) (current: " + recoveryStepDown + ")"
            );
        }
        if (gradualRecoveryMinRequests < 0) {
            throw new IllegalArgumentException(
                "gradualRecoveryMinRequests cannot be negative (current: " + gradualRecoveryMinRequests + ")"
            );
        }
    }

    /**
     * 기본 설정.
     *
     * @return 기본값 설정
     */
    public static CircuitBreakerConfig defaults() {
        return new CircuitBreakerConfig();
    }

    /**
     * Elasticsearch 전용 설정.
     *
     * <p>failureThreshold=3, successThreshold=2, timeoutMs=30000ms, failureRateThreshold=30%,
     * slowCallThresholdMs=5000ms, minimumThroughput=5</p>
     *
     * @return Elasticsearch 설정
     */
    public static CircuitBreakerConfig forElasticsearch() {
        return new CircuitBreakerConfig()
            .withFailureThreshold(3)
            .withSuccessThreshold(2)
            .withTimeoutMs(30000)
            .withFailureRateThreshold(30.0)
            .withSlowCallThresholdMs(5000)
            .withMinimumThroughput(5);
    }

    /**
     * Wazuh 전용 설정.
     *
     * <p>failureThreshold=5, successThreshold=3, timeoutMs=60000ms, failureRateThreshold=40%,
     * slowCallThresholdMs=10000ms, minimumThroughput=5</p>
     *
     * @return Wazuh 설정
     */
    public static CircuitBreakerConfig forWazuh() {
        return new CircuitBreakerConfig()
            .withFailureRateThreshold(40.0)
            .withMinimumThroughput(5);
    }

    /**
     * Splunk 전용 설정.
     *
     * <p>failureThreshold=4, successThreshold=3, timeoutMs=45000ms, failureRateThreshold=35%,
     * slowCallThresholdMs=8000ms, minimumThroughput=5</p>
     *
     * @return Splunk 설정
     */
    public static CircuitBreakerConfig forSplunk() {
        return new CircuitBreakerConfig()
            .withFailureThreshold(4)
            .withTimeoutMs(45000)
            .withFailureRateThreshold(35.0)
            .withSlowCallThresholdMs(8000)
            .withMinimumThroughput(5);
    }

    /**
     * failureThreshold만 변경한 새 인스턴스 생성.
     */
    public CircuitBreakerConfig withFailureThreshold(int failureThreshold) {
        return new CircuitBreakerConfig(failureThreshold, successThreshold, timeoutMs, maxTimeoutMs,
            failureRateThreshold, slowCallThresholdMs, slowCallRateThreshold, minimumThroughput,
            slidingWindowSize, exponentialBackoff, jitter, healthCheckIntervalMs, recoveryFactor,
            recoveryStepUp, recoveryStepDown, gradualRecoveryMinRequests);
    }

    /**
     * successThreshold만 변경한 새 인스턴스 생성.
     */
    public CircuitBreakerConfig withSuccessThreshold(int successThreshold) {
        return new CircuitBreakerConfig(failureThreshold, successThreshold, timeoutMs, maxTimeoutMs,
            failureRateThreshold, slowCallThresholdMs, slowCallRateThreshold, minimumThroughput,
            slidingWindowSize, exponentialBackoff, jitter, healthCheckIntervalMs, recoveryFactor,
            recoveryStepUp, recoveryStepDown, gradualRecoveryMinRequests);
    }

    /**
     * timeoutMs만 변경한 새 인스턴스 생성.
     *
     * <p>maxTimeoutMs보다 크면 maxTimeoutMs도 같은 값으로 올립니다.</p>
     */
    public CircuitBreakerConfig withTimeoutMs(long timeoutMs) {
        return new CircuitBreakerConfig(failureThreshold, successThreshold, timeoutMs,
            Math.max(maxTimeoutMs, timeoutMs),
            failureRateThreshold, slowCallThresholdMs, slowCallRateThreshold, minimumThroughput,
            slidingWindowSize, exponentialBackoff, jitter, healthCheckIntervalMs, recoveryFactor,
            recoveryStepUp, recoveryStepDown, gradualRecoveryMinRequests);
    }

    /**
     * maxTimeoutMs만 변경한 새 인스턴스 생성.
     */
    public CircuitBreakerConfig withMaxTimeoutMs(long maxTimeoutMs) {
        return new CircuitBreakerConfig(failureThreshold, successThreshold, timeoutMs, maxTimeoutMs,
            failureRateThreshold, slowCallThresholdMs, slowCallRateThreshold, minimumThroughput,
            slidingWindowSize, exponentialBackoff, jitter, healthCheckIntervalMs, recoveryFactor,
            recoveryStepUp, recoveryStepDown, gradualRecoveryMinRequests);
    }

    /**
     * failureRateThreshold만 변경한 새 인스턴스 생성.
     */
    public CircuitBreakerConfig withFailureRateThreshold(double failureRateThreshold) {
        return new CircuitBreakerConfig(failureThreshold, successThreshold, timeoutMs, maxTimeoutMs,
            failureRateThreshold, slowCallThresholdMs, slowCallRateThreshold, minimumThroughput,
            slidingWindowSize, exponentialBackoff, jitter, healthCheckIntervalMs, recoveryFactor,
            recoveryStepUp, recoveryStepDown, gradualRecoveryMinRequests);
    }

    /**
     * slowCallThresholdMs만 변경한 새 인스턴스 생성.
     */
    public CircuitBreakerConfig withSlowCallThresholdMs(long slowCallThresholdMs) {
        return new CircuitBreakerConfig(failureThreshold, successThreshold, timeoutMs, maxTimeoutMs,
            failureRateThreshold, slowCallThresholdMs, slowCallRateThreshold, minimumThroughput,
            slidingWindowSize, exponentialBackoff, jitter, healthCheckIntervalMs, recoveryFactor,
            recoveryStepUp, recoveryStepDown, gradualRecoveryMinRequests);
    }

    /**
     * slowCallRateThreshold만 변경한 새 인스턴스 생성.
     */
    public CircuitBreakerConfig withSlowCallRateThreshold(double slowCallRateThreshold) {
        return new CircuitBreakerConfig(failureThreshold, successThreshold, timeoutMs, maxTimeoutMs,
            failureRateThreshold, slowCallThresholdMs, slowCallRateThreshold, minimumThroughput,
            slidingWindowSize, exponentialBackoff, jitter, healthCheckIntervalMs, recoveryFactor,
            recoveryStepUp, recoveryStepDown, gradualRecoveryMinRequests);
    }

    /**
     * minimumThroughput만 변경한 새 인스턴스 생성.
     */
    public CircuitBreakerConfig withMinimumThroughput(int minimumThroughput) {
        return new CircuitBreakerConfig(failureThreshold, successThreshold, timeoutMs, maxTimeoutMs,
            failureRateThreshold, slowCallThresholdMs, slowCallRateThreshold, minimumThroughput,
            slidingWindowSize, exponentialBackoff, jitter, healthCheckIntervalMs, recoveryFactor,
            recoveryStepUp, recoveryStepDown, gradualRecoveryMinRequests);
    }

    /**
     * slidingWindowSize만 변경한 새 인스턴스 생성.
     */
    public CircuitBreakerConfig withSlidingWindowSize(int slidingWindowSize) {
        return new CircuitBreakerConfig(failureThreshold, successThreshold, timeoutMs, maxTimeoutMs,
            failureRateThreshold, slowCallThresholdMs, slowCallRateThreshold, minimumThroughput,
            slidingWindowSize, exponentialBackoff, jitter, healthCheckIntervalMs, recoveryFactor,
            recoveryStepUp, recoveryStepDown, gradualRecoveryMinRequests);
    }

    /**
     * exponentialBackoff만 변경한 새 인스턴스 생성.
     */
    public CircuitBreakerConfig withExponentialBackoff(boolean exponentialBackoff) {
        return new CircuitBreakerConfig(failureThreshold, successThreshold, timeoutMs, maxTimeoutMs,
            failureRateThreshold, slowCallThresholdMs, slowCallRateThreshold, minimumThroughput,
            slidingWindowSize, exponentialBackoff, jitter, healthCheckIntervalMs, recoveryFactor,
            recoveryStepUp, recoveryStepDown, gradualRecoveryMinRequests);
    }

    /**
     * jitter만 변경한 새 인스턴스 생성.
     */
    public CircuitBreakerConfig withJitter(boolean jitter) {
        return new CircuitBreakerConfig(failureThreshold, successThreshold, timeoutMs, maxTimeoutMs,
            failureRateThreshold, slowCallThresholdMs, slowCallRateThreshold, minimumThroughput,
            slidingWindowSize, exponentialBackoff, jitter, healthCheckIntervalMs, recoveryFactor,
            recoveryStepUp, recoveryStepDown, gradualRecoveryMinRequests);
    }

    /**
     * healthCheckIntervalMs만 변경한 새 인스턴스 생성.
     */
    public CircuitBreakerConfig withHealthCheckIntervalMs(long healthCheckIntervalMs) {
        return new CircuitBreakerConfig(failureThreshold, successThreshold, timeoutMs, maxTimeoutMs,
            failureRateThreshold, slowCallThresholdMs, slowCallRateThreshold, minimumThroughput,
            slidingWindowSize, exponentialBackoff, jitter, healthCheckIntervalMs, recoveryFactor,
            recoveryStepUp, recoveryStepDown, gradualRecoveryMinRequests);
    }

    /**
     * recoveryFactor만 변경한 새 인스턴스 생성.
     */
    public CircuitBreakerConfig withRecoveryFactor(double recoveryFactor) {
        return new CircuitBreakerConfig(failureThreshold, successThreshold, timeoutMs, maxTimeoutMs,
            failureRateThreshold, slowCallThresholdMs, slowCallRateThreshold, minimumThroughput,
            slidingWindowSize, exponentialBackoff, jitter, healthCheckIntervalMs, recoveryFactor,
            recoveryStepUp, recoveryStepDown, gradualRecoveryMinRequests);
    }

    /**
     * recoveryStepUp, recoveryStepDown만 변경한 새 인스턴스 생성.
     */
    public CircuitBreakerConfig withRecoverySteps(double recoveryStepUp, double recoveryStepDown) {
        return new CircuitBreakerConfig(failureThreshold, successThreshold, timeoutMs, maxTimeoutMs,
            failureRateThreshold, slowCallThresholdMs, slowCallRateThreshold, minimumThroughput,
            slidingWindowSize, exponentialBackoff, jitter, healthCheckIntervalMs, recoveryFactor,
            recoveryStepUp, recoveryStepDown, gradualRecoveryMinRequests);
    }

    /**
     * gradualRecoveryMinRequests만 변경한 새 인스턴스 생성.
     */
    public CircuitBreakerConfig withGradualRecoveryMinRequests(long gradualRecoveryMinRequests) {
        return new CircuitBreakerConfig(failureThreshold, successThreshold, timeoutMs, maxTimeoutMs,
            failureRateThreshold, slowCallThresholdMs, slowCallRateThreshold, minimumThroughput,
            slidingWindowSize, exponentialBackoff, jitter, healthCheckIntervalMs, recoveryFactor,
            recoveryStepUp, recoveryStepDown, gradualRecoveryMinRequests);
    }
}
