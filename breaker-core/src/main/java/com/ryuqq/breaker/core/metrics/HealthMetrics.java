package com.ryuqq.breaker.core.metrics;

import com.ryuqq.breaker.core.failure.FailureRecord;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * Circuit Breaker 하나의 상태 지표 (rolling window).
 *
 * <p><strong>보관 데이터:</strong></p>
 * <ul>
 *   <li>누적 카운터: 전체/성공/실패 요청 수</li>
 *   <li>응답 시간 링 버퍼: 성공 호출의 최근 windowSize개 응답 시간</li>
 *   <li>실패 이력 링 버퍼: 최근 windowSize개 {@link FailureRecord}</li>
 *   <li>연속 성공/실패 카운터: 하나가 증가하면 다른 하나는 0으로 초기화</li>
 *   <li>평균 응답 시간: 지수 이동 평균 (α = 0.1), 갱신 O(1)</li>
 * </ul>
 *
 * <p><strong>동시성:</strong> 이 클래스는 thread-safe하지 않습니다.
 * 소유자인 Circuit Breaker가 자신의 락 안에서만 갱신/조회해야 합니다.</p>
 *
 * @author Breaker Team
 * @since 1.0.0
 */
public final class HealthMetrics {

    /** 최근 실패율 계산 구간. */
    public static final Duration RECENT_FAILURE_WINDOW = Duration.ofMinutes(5);

    private static final int RECENT_REQUEST_SAMPLE = 50;
    private static final int MIN_PERCENTILE_SAMPLES = 5;
    private static final int TREND_SAMPLE_SIZE = 10;
    private static final double EMA_ALPHA = 0.1;

    private final int windowSize;
    private final Deque<Double> responseTimesMs;
    private final Deque<FailureRecord> failureHistory;

    private long totalRequests;
    private long successfulRequests;
    private long failedRequests;
    private double avgResponseTimeMs;
    private Instant lastSuccessTime;
    private Instant lastFailureTime;
    private int consecutiveSuccesses;
    private int consecutiveFailures;

    /**
     * 생성자.
     *
     * @param windowSize 링 버퍼 크기 (1 이상)
     * @throws IllegalArgumentException windowSize가 양수가 아닌 경우
     */
    public HealthMetrics(int windowSize) {
        if (windowSize <= 0) {
            throw new IllegalArgumentException("windowSize must be positive (current: " + windowSize + ")");
        }
        this.windowSize = windowSize;
        this.responseTimesMs = new ArrayDeque<>(windowSize);
        this.failureHistory = new ArrayDeque<>(windowSize);
    }

    /**
     * 성공 기록.
     *
     * @param responseTimeMs 응답 시간 (밀리초)
     * @param now 기록 시각
     */
    public void recordSuccess(double responseTimeMs, Instant now) {
        totalRequests++;
        successfulRequests++;
        consecutiveSuccesses++;
        consecutiveFailures = 0;
        lastSuccessTime = now;

        append(responseTimesMs, responseTimeMs);
        updateAverage(responseTimeMs);
    }

    /**
     * 실패 기록.
     *
     * @param failure 실패 기록
     * @throws IllegalArgumentException failure가 null인 경우
     */
    public void recordFailure(FailureRecord failure) {
        if (failure == null) {
            throw new IllegalArgumentException("failure cannot be null");
        }
        totalRequests++;
        failedRequests++;
        consecutiveFailures++;
        consecutiveSuccesses = 0;
        lastFailureTime = failure.timestamp();

        append(failureHistory, failure);
    }

    /**
     * 연속 성공/실패 카운터 초기화.
     *
     * <p>HALF_OPEN 전이와 수동 reset 시 사용합니다. 누적 카운터는 유지합니다.</p>
     */
    public void resetConsecutive() {
        consecutiveSuccesses = 0;
        consecutiveFailures = 0;
    }

    /**
     * 성공률 (%). 요청이 없으면 100.
     */
    public double getSuccessRate() {
        if (totalRequests == 0) {
            return 100.0;
        }
        return (successfulRequests * 100.0) / totalRequests;
    }

    /**
     * 실패율 (%) = 100 - 성공률.
     */
    public double getFailureRate() {
        return 100.0 - getSuccessRate();
    }

    /**
     * 최근 실패율 (%).
     *
     * <p>최근 5분 이내 실패 수를 min(50, 전체 요청 수)로 나눈 값입니다.</p>
     *
     * @param now 기준 시각
     * @return 최근 실패율 (요청이 없으면 0)
     */
    public double getRecentFailureRate(Instant now) {
        long recentTotal = Math.min(RECENT_REQUEST_SAMPLE, totalRequests);
        if (recentTotal == 0) {
            return 0.0;
        }
        long recentFailures = failureHistory.stream()
            .filter(failure -> failure.age(now).compareTo(RECENT_FAILURE_WINDOW) < 0)
            .count();
        return (recentFailures * 100.0) / recentTotal;
    }

    /**
     * 95 백분위 응답 시간.
     *
     * <p>샘플이 5개 미만이면 평균(EMA)을 반환합니다.</p>
     */
    public double getP95ResponseTimeMs() {
        if (responseTimesMs.size() < MIN_PERCENTILE_SAMPLES) {
            return avgResponseTimeMs;
        }
        List<Double> sorted = getSortedResponseTimesMs();
        return sorted.get((int) (sorted.size() * 0.95));
    }

    /**
     * 느린 호출 수 (응답 시간 링 버퍼 기준).
     *
     * @param slowCallThresholdMs 느린 호출 기준 (밀리초)
     * @return thresholdMs를 초과한 샘플 수
     */
    public long getSlowCallCount(long slowCallThresholdMs) {
        return responseTimesMs.stream()
            .filter(rt -> rt > slowCallThresholdMs)
            .count();
    }

    /**
     * 느린 호출 비율 (%).
     *
     * @param slowCallThresholdMs 느린 호출 기준 (밀리초)
     * @return 응답 시간 링 버퍼 대비 느린 호출 비율 (샘플이 없으면 0)
     */
    public double getSlowCallRate(long slowCallThresholdMs) {
        if (responseTimesMs.isEmpty()) {
            return 0.0;
        }
        return (getSlowCallCount(slowCallThresholdMs) * 100.0) / responseTimesMs.size();
    }

    /**
     * 응답 시간 추세 계산.
     *
     * @return 최근 10개와 직전 (최대) 10개 샘플 평균 비교 결과
     */
    public PerformanceTrend getPerformanceTrend() {
        if (responseTimesMs.size() <= TREND_SAMPLE_SIZE) {
            return PerformanceTrend.INSUFFICIENT_DATA;
        }

        List<Double> samples = new ArrayList<>(responseTimesMs);
        int recentStart = samples.size() - TREND_SAMPLE_SIZE;
        int olderStart = Math.max(0, recentStart - TREND_SAMPLE_SIZE);

        double recentAvg = average(samples.subList(recentStart, samples.size()));
        double olderAvg = average(samples.subList(olderStart, recentStart));

        if (recentAvg < olderAvg * 0.9) {
            return PerformanceTrend.IMPROVING;
        }
        if (recentAvg > olderAvg * 1.1) {
            return PerformanceTrend.DEGRADING;
        }
        return PerformanceTrend.STABLE;
    }

    /**
     * 응답 시간 스냅샷 (기록 순서).
     *
     * @return 복사본
     */
    public List<Double> getResponseTimesMs() {
        return List.copyOf(responseTimesMs);
    }

    /**
     * 정렬된 응답 시간 스냅샷.
     *
     * @return 오름차순 정렬된 복사본
     */
    public List<Double> getSortedResponseTimesMs() {
        List<Double> sorted = new ArrayList<>(responseTimesMs);
        Collections.sort(sorted);
        return sorted;
    }

    /**
     * 실패 이력 스냅샷 (오래된 순).
     *
     * @return 복사본
     */
    public List<FailureRecord> getFailureHistory() {
        return List.copyOf(failureHistory);
    }

    public long getTotalRequests() {
        return totalRequests;
    }

    public long getSuccessfulRequests() {
        return successfulRequests;
    }

    public long getFailedRequests() {
        return failedRequests;
    }

    public double getAvgResponseTimeMs() {
        return avgResponseTimeMs;
    }

    /**
     * 마지막 성공 시각 (없으면 null).
     */
    public Instant getLastSuccessTime() {
        return lastSuccessTime;
    }

    /**
     * 마지막 실패 시각 (없으면 null).
     */
    public Instant getLastFailureTime() {
        return lastFailureTime;
    }

    public int getConsecutiveSuccesses() {
        return consecutiveSuccesses;
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures;
    }

    private void updateAverage(double responseTimeMs) {
        if (avgResponseTimeMs == 0.0) {
            avgResponseTimeMs = responseTimeMs;
        } else {
            avgResponseTimeMs = (1 - EMA_ALPHA) * avgResponseTimeMs + EMA_ALPHA * responseTimeMs;
        }
    }

    private <T> void append(Deque<T> ring, T value) {
        if (ring.size() == windowSize) {
            ring.removeFirst();
        }
        ring.addLast(value);
    }

    private static double average(List<Double> values) {
        double sum = 0.0;
        for (double value : values) {
            sum += value;
        }
        return sum / values.size();
    }
}
