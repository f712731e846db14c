package com.ryuqq.breaker.adapter.runtime;

import com.ryuqq.breaker.core.config.CircuitBreakerConfig;
import com.ryuqq.breaker.core.failure.FailureClassifier;
import com.ryuqq.breaker.core.protection.CircuitBreaker;
import com.ryuqq.breaker.core.protection.CircuitBreakerListener;
import com.ryuqq.breaker.core.protection.CircuitBreakerRegistry;
import com.ryuqq.breaker.core.report.BreakerStateReport;
import com.ryuqq.breaker.core.report.GlobalStatus;
import com.ryuqq.breaker.core.report.GlobalStatus.GlobalStats;
import com.ryuqq.breaker.core.state.CircuitState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.DoubleSupplier;

/**
 * Circuit Breaker 레지스트리 및 팩토리.
 *
 * <p>애플리케이션의 구성 루트(composition root)에서 생성하여 필요한 협력 객체에 전달합니다.
 * 모든 Circuit Breaker는 매니저가 소유한 하나의 daemon 스케줄러를 헬스 체크에 공유합니다.</p>
 *
 * <p><strong>책임:</strong></p>
 * <ul>
 *   <li>이름 기반 생성/조회 (같은 이름이면 기존 인스턴스 반환)</li>
 *   <li>상태 전이 리스너로 상태별 집계 유지</li>
 *   <li>전체 상태 보고서, 일괄 reset/cleanup</li>
 * </ul>
 *
 * <p><strong>락 순서:</strong> Circuit Breaker 락 → 매니저 락.
 * 매니저는 자신의 락을 보유한 채로 Circuit Breaker를 호출하지 않습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * try (CircuitBreakerManager manager = new CircuitBreakerManager()) {
 *     CircuitBreaker es = manager.createElasticsearchBreaker();
 *     SearchResult result = es.call(() -> client.search(query));
 *
 *     GlobalStatus status = manager.getGlobalStatus();
 * }
 * }</pre>
 *
 * @author Breaker Team
 * @since 1.0.0
 */
public final class CircuitBreakerManager implements CircuitBreakerRegistry, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreakerManager.class);

    static final String ELASTICSEARCH = "elasticsearch";
    static final String WAZUH = "wazuh";
    static final String SPLUNK = "splunk";

    private final FailureClassifier classifier;
    private final Clock clock;
    private final DoubleSupplier random;
    private final ScheduledExecutorService healthCheckScheduler;

    private final Object lock = new Object();

    // lock으로 보호
    private final Map<String, AdaptiveCircuitBreaker> breakers = new LinkedHashMap<>();
    private int openBreakers;
    private int halfOpenBreakers;
    private int closedBreakers;
    private boolean closed;

    /**
     * 기본 분류기, 시스템 시계로 생성.
     */
    public CircuitBreakerManager() {
        this(FailureClassifier.defaults(), Clock.systemUTC(), AdaptiveCircuitBreaker.defaultRandom());
    }

    /**
     * 생성자.
     *
     * @param classifier 생성되는 모든 Circuit Breaker가 사용할 실패 분류기
     * @param clock 시간 공급자
     * @param random [0, 1) 균등 분포 난수 공급자
     * @throws IllegalArgumentException 파라미터가 null인 경우
     */
    public CircuitBreakerManager(FailureClassifier classifier, Clock clock, DoubleSupplier random) {
        this(classifier, clock, random, AdaptiveCircuitBreaker.newDaemonScheduler("circuit-breaker-health"));
    }

    CircuitBreakerManager(FailureClassifier classifier, Clock clock, DoubleSupplier random,
                          ScheduledExecutorService healthCheckScheduler) {
        if (classifier == null) {
            throw new IllegalArgumentException("classifier cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (random == null) {
            throw new IllegalArgumentException("random cannot be null");
        }
        if (healthCheckScheduler == null) {
            throw new IllegalArgumentException("healthCheckScheduler cannot be null");
        }
        this.classifier = classifier;
        this.clock = clock;
        this.random = random;
        this.healthCheckScheduler = healthCheckScheduler;

        log.info("Circuit breaker manager initialized");
    }

    // ============================================================
    // 생성 / 조회
    // ============================================================

    @Override
    public AdaptiveCircuitBreaker createBreaker(String name) {
        return createBreaker(name, CircuitBreakerConfig.defaults());
    }

    @Override
    public AdaptiveCircuitBreaker createBreaker(String name, CircuitBreakerConfig config) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }

        AdaptiveCircuitBreaker breaker;
        synchronized (lock) {
            if (closed) {
                throw new IllegalStateException("Circuit breaker manager is closed");
            }
            AdaptiveCircuitBreaker existing = breakers.get(name);
            if (existing != null) {
                log.warn("Circuit breaker already exists: {}", name);
                return existing;
            }

            breaker = new AdaptiveCircuitBreaker(name, config, classifier, clock, random, healthCheckScheduler);
            breaker.addListener(new AggregateListener(breaker));
            breakers.put(name, breaker);
            closedBreakers++;
        }

        log.info("Circuit breaker created: {}", name);
        return breaker;
    }

    /**
     * Elasticsearch 프리셋으로 생성.
     */
    public AdaptiveCircuitBreaker createElasticsearchBreaker() {
        return createBreaker(ELASTICSEARCH, CircuitBreakerConfig.forElasticsearch());
    }

    /**
     * Wazuh 프리셋으로 생성.
     */
    public AdaptiveCircuitBreaker createWazuhBreaker() {
        return createBreaker(WAZUH, CircuitBreakerConfig.forWazuh());
    }

    /**
     * Splunk 프리셋으로 생성.
     */
    public AdaptiveCircuitBreaker createSplunkBreaker() {
        return createBreaker(SPLUNK, CircuitBreakerConfig.forSplunk());
    }

    @Override
    public Optional<CircuitBreaker> getBreaker(String name) {
        synchronized (lock) {
            return Optional.ofNullable(breakers.get(name));
        }
    }

    @Override
    public Set<String> getBreakerNames() {
        synchronized (lock) {
            return Collections.unmodifiableSet(new LinkedHashSet<>(breakers.keySet()));
        }
    }

    // ============================================================
    // 전체 상태
    // ============================================================

    @Override
    public GlobalStatus getGlobalStatus() {
        Map<String, AdaptiveCircuitBreaker> snapshot;
        GlobalStats stats;
        synchronized (lock) {
            snapshot = new LinkedHashMap<>(breakers);
            stats = currentStats();
        }

        Map<String, BreakerStateReport> reports = new LinkedHashMap<>();
        for (Map.Entry<String, AdaptiveCircuitBreaker> entry : snapshot.entrySet()) {
            reports.put(entry.getKey(), entry.getValue().getState());
        }
        return GlobalStatus.of(stats, reports);
    }

    /**
     * 상태별 집계만 조회.
     */
    public GlobalStats getGlobalStats() {
        synchronized (lock) {
            return currentStats();
        }
    }

    @Override
    public void resetAll() {
        log.info("Resetting all circuit breakers");
        for (AdaptiveCircuitBreaker breaker : snapshotBreakers()) {
            breaker.reset();
        }
    }

    @Override
    public void cleanupAll() {
        log.info("Cleaning up all circuit breakers");
        List<AdaptiveCircuitBreaker> removed;
        synchronized (lock) {
            removed = new ArrayList<>(breakers.values());
            breakers.clear();
            openBreakers = 0;
            halfOpenBreakers = 0;
            closedBreakers = 0;
        }
        for (AdaptiveCircuitBreaker breaker : removed) {
            breaker.cleanup();
        }
    }

    /**
     * 모든 Circuit Breaker 정리 후 공유 스케줄러 종료. 여러 번 호출해도 안전합니다.
     */
    @Override
    public void close() {
        synchronized (lock) {
            if (closed) {
                return;
            }
            closed = true;
        }
        cleanupAll();
        healthCheckScheduler.shutdownNow();
        log.info("Circuit breaker manager closed");
    }

    private List<AdaptiveCircuitBreaker> snapshotBreakers() {
        synchronized (lock) {
            return new ArrayList<>(breakers.values());
        }
    }

    private GlobalStats currentStats() {
        return new GlobalStats(breakers.size(), openBreakers, halfOpenBreakers, closedBreakers);
    }

    private void adjust(CircuitState state, int delta) {
        switch (state) {
            case OPEN -> openBreakers += delta;
            case HALF_OPEN -> halfOpenBreakers += delta;
            case CLOSED -> closedBreakers += delta;
        }
    }

    /**
     * Circuit Breaker 락 안에서 호출되어 집계를 갱신합니다.
     * 레지스트리에서 제거된 인스턴스의 이벤트는 무시합니다.
     */
    private final class AggregateListener implements CircuitBreakerListener {

        private final AdaptiveCircuitBreaker breaker;

        AggregateListener(AdaptiveCircuitBreaker breaker) {
            this.breaker = breaker;
        }

        @Override
        public void onStateChange(String breakerName, CircuitState from, CircuitState to, String reason) {
            if (from == to) {
                return;
            }
            synchronized (lock) {
                if (breakers.get(breakerName) != breaker) {
                    return;
                }
                adjust(from, -1);
                adjust(to, 1);
            }
        }
    }
}
