package com.ryuqq.breaker.adapter.runtime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

/**
 * OPEN 구간 백그라운드 헬스 체크.
 *
 * <p>OPEN 전이마다 하나씩 생성되어 healthCheckInterval 간격으로 실행됩니다.
 * 외부 호출은 하지 않으며, 대기 상태를 진단 로그로 남기다가
 * 다음 시도 시각에 도달하거나 상태가 OPEN이 아니게 되면 스스로 취소합니다.</p>
 *
 * <p><strong>종료 조건:</strong></p>
 * <ul>
 *   <li>now ≥ nextAttemptAt</li>
 *   <li>Circuit Breaker가 더 이상 OPEN이 아님</li>
 *   <li>{@link #cancel()} 호출 (상태 전이, reset, cleanup)</li>
 * </ul>
 *
 * @author Breaker Team
 * @since 1.0.0
 */
final class HealthCheckTask implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckTask.class);

    private final String breakerName;
    private final Clock clock;
    private final Instant nextAttemptAt;
    private final BooleanSupplier stillOpen;

    private volatile ScheduledFuture<?> future;
    private volatile boolean cancelled;

    /**
     * 생성자.
     *
     * @param breakerName Circuit Breaker 이름 (로그용)
     * @param clock 시간 공급자
     * @param nextAttemptAt 이번 OPEN 구간의 다음 시도 시각
     * @param stillOpen Circuit Breaker가 아직 OPEN인지 확인
     */
    HealthCheckTask(String breakerName, Clock clock, Instant nextAttemptAt, BooleanSupplier stillOpen) {
        this.breakerName = breakerName;
        this.clock = clock;
        this.nextAttemptAt = nextAttemptAt;
        this.stillOpen = stillOpen;
    }

    /**
     * 스케줄러에 등록.
     *
     * @param scheduler 스케줄러
     * @param intervalMs 실행 간격 (밀리초)
     */
    void start(ScheduledExecutorService scheduler, long intervalMs) {
        ScheduledFuture<?> scheduled = scheduler.scheduleWithFixedDelay(this, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        future = scheduled;
        // future 대입 전에 cancel()이 실행된 경우
        if (cancelled && scheduled != null) {
            scheduled.cancel(false);
        }
        log.debug("Health check started for circuit breaker '{}' (interval: {} ms)", breakerName, intervalMs);
    }

    @Override
    public void run() {
        if (cancelled) {
            return;
        }
        if (!stillOpen.getAsBoolean()) {
            log.debug("Health check stopped for circuit breaker '{}': no longer OPEN", breakerName);
            cancel();
            return;
        }
        Instant now = clock.instant();
        if (!now.isBefore(nextAttemptAt)) {
            log.debug("Health check ready for circuit breaker '{}': next attempt allowed", breakerName);
            cancel();
            return;
        }
        log.debug("Health check tick for circuit breaker '{}': waiting until {}", breakerName, nextAttemptAt);
    }

    /**
     * 취소. 여러 번 호출해도 안전합니다.
     */
    void cancel() {
        if (cancelled) {
            return;
        }
        cancelled = true;
        ScheduledFuture<?> current = future;
        if (current != null) {
            current.cancel(false);
        }
        log.debug("Health check cancelled for circuit breaker '{}'", breakerName);
    }

    boolean isCancelled() {
        return cancelled;
    }

    Instant getNextAttemptAt() {
        return nextAttemptAt;
    }
}
