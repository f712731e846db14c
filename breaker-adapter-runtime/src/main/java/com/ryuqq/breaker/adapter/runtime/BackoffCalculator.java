package com.ryuqq.breaker.adapter.runtime;

import com.ryuqq.breaker.core.config.CircuitBreakerConfig;

import java.util.function.DoubleSupplier;

/**
 * OPEN 유지 시간 계산기 (Exponential Backoff with Jitter).
 *
 * <p>OPEN 전이마다 대기 시간을 지수적으로 늘리되, Jitter를 곱해
 * 여러 Circuit Breaker가 동시에 재시도하는 Thundering Herd를 방지합니다.</p>
 *
 * <p><strong>알고리즘:</strong></p>
 * <pre>
 * openDuration = min(timeout * multiplier, maxTimeout) * jitterFactor
 * jitterFactor = 0.8 + 0.4 * random   (jitter=false이면 1.0)
 * nextMultiplier = multiplier * 2      (exponentialBackoff=false이면 그대로)
 * </pre>
 *
 * <p><strong>예시 (timeout=10s, maxTimeout=300s):</strong></p>
 * <ul>
 *   <li>1번째 OPEN: multiplier=1 → 10s (jitter 적용 시 8-12s)</li>
 *   <li>2번째 OPEN: multiplier=2 → 20s (16-24s)</li>
 *   <li>3번째 OPEN: multiplier=4 → 40s (32-48s)</li>
 *   <li>6번째 OPEN: multiplier=32 → 300s (maxTimeout으로 제한 후 jitter)</li>
 * </ul>
 *
 * @author Breaker Team
 * @since 1.0.0
 */
public class BackoffCalculator {

    private static final double JITTER_MIN = 0.8;
    private static final double JITTER_RANGE = 0.4;
    private static final double BACKOFF_GROWTH = 2.0;

    private final long timeoutMs;
    private final long maxTimeoutMs;
    private final boolean exponentialBackoff;
    private final boolean jitter;
    private final DoubleSupplier random;

    /**
     * Circuit Breaker 설정으로 생성.
     *
     * @param config 설정
     * @param random [0, 1) 균등 분포 난수 공급자
     * @throws IllegalArgumentException 파라미터가 null인 경우
     */
    public BackoffCalculator(CircuitBreakerConfig config, DoubleSupplier random) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (random == null) {
            throw new IllegalArgumentException("random cannot be null");
        }
        this.timeoutMs = config.timeoutMs();
        this.maxTimeoutMs = config.maxTimeoutMs();
        this.exponentialBackoff = config.exponentialBackoff();
        this.jitter = config.jitter();
        this.random = random;
    }

    /**
     * OPEN 유지 시간 계산.
     *
     * @param multiplier 현재 백오프 배수 (1.0 이상)
     * @return OPEN 유지 시간 (밀리초)
     * @throws IllegalArgumentException multiplier가 1.0 미만인 경우
     */
    public long calculateOpenDurationMs(double multiplier) {
        if (multiplier < 1.0) {
            throw new IllegalArgumentException(
                "multiplier must be >= 1.0 (current: " + multiplier + ")"
            );
        }

        // 1. 지수적 백오프 (maxTimeout으로 제한)
        double backoff = Math.min(timeoutMs * multiplier, maxTimeoutMs);

        // 2. Jitter 적용 (±20%)
        if (jitter) {
            backoff *= JITTER_MIN + JITTER_RANGE * random.getAsDouble();
        }

        return Math.round(backoff);
    }

    /**
     * 다음 OPEN에 사용할 백오프 배수.
     *
     * @param multiplier 현재 배수
     * @return exponentialBackoff이면 2배, 아니면 그대로
     */
    public double nextMultiplier(double multiplier) {
        if (!exponentialBackoff) {
            return multiplier;
        }
        return multiplier * BACKOFF_GROWTH;
    }
}
