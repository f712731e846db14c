package com.ryuqq.breaker.core.protection;

import com.ryuqq.breaker.core.report.BreakerStateReport;
import com.ryuqq.breaker.core.report.FailureAnalysis;
import com.ryuqq.breaker.core.report.PerformanceAnalysis;
import com.ryuqq.breaker.core.state.CircuitState;
import com.ryuqq.breaker.core.state.StateChangeRecord;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Circuit Breaker SPI.
 *
 * <p>외부 서비스 호출의 실패율과 응답 시간을 추적하고, 임계값 초과 시 빠르게 실패(Fail-Fast)하여
 * 장애가 전체 시스템으로 전파되는 것을 방지합니다.</p>
 *
 * <p><strong>Circuit Breaker 패턴:</strong></p>
 * <ul>
 *   <li>CLOSED: 정상 동작, 실패율 추적</li>
 *   <li>OPEN: 요청 차단, 빠른 실패</li>
 *   <li>HALF_OPEN: 제한된 요청으로 복구 테스트</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * CircuitBreaker cb = manager.createBreaker("elasticsearch");
 *
 * try {
 *     SearchResult result = cb.call(() -> client.search(query));
 * } catch (CircuitOpenException e) {
 *     // OPEN 상태: e.getRetryAfterSeconds() 이후 재시도
 * }
 * }</pre>
 *
 * <p>{@code Callable}로 감쌀 수 없는 흐름은 {@link #tryAcquire()},
 * {@link #recordSuccess(Duration)}, {@link #recordFailure(Throwable, Duration)}를 직접 호출합니다.</p>
 *
 * @author Breaker Team
 * @since 1.0.0
 */
public interface CircuitBreaker {

    /**
     * Circuit Breaker 이름.
     *
     * @return 이름
     */
    String getName();

    /**
     * 작업을 Circuit Breaker로 보호하여 실행.
     *
     * <p>허용되지 않으면 작업을 호출하지 않고 {@link CircuitOpenException}을 던집니다.
     * 작업이 던진 예외는 분류/기록된 뒤 그대로 다시 던져집니다.</p>
     *
     * @param operation 보호할 작업
     * @param <T> 결과 타입
     * @return 작업 결과
     * @throws CircuitOpenException 요청이 차단된 경우
     * @throws Exception 작업이 던진 예외
     */
    <T> T call(Callable<T> operation) throws Exception;

    /**
     * Circuit Breaker 통과 허용 여부 확인.
     *
     * <ul>
     *   <li>CLOSED: 항상 true</li>
     *   <li>OPEN: 다음 시도 시각이 지났으면 HALF_OPEN으로 전이 후 true, 아니면 false</li>
     *   <li>HALF_OPEN: 점진적 복구 모드면 복구 비율만큼 확률적으로 true</li>
     * </ul>
     *
     * @return true: 요청 통과 허용, false: 요청 차단
     */
    boolean tryAcquire();

    /**
     * 실행 성공 기록.
     *
     * @param responseTime 응답 시간
     */
    void recordSuccess(Duration responseTime);

    /**
     * 실행 실패 기록.
     *
     * @param throwable 발생한 예외
     * @param responseTime 실패까지 걸린 시간
     */
    void recordFailure(Throwable throwable, Duration responseTime);

    /**
     * 현재 상태 조회.
     *
     * @return CLOSED, OPEN, HALF_OPEN 중 하나
     */
    CircuitState getCurrentState();

    /**
     * 상태 보고서 조회.
     *
     * @return 상태, 지표, 설정, 복구 정보 스냅샷
     */
    BreakerStateReport getState();

    /**
     * 실패 분석 조회.
     */
    FailureAnalysis getFailureAnalysis();

    /**
     * 성능 분석 조회.
     *
     * @return 샘플이 없으면 {@link PerformanceAnalysis#empty()}
     */
    PerformanceAnalysis getPerformanceAnalysis();

    /**
     * 상태 전이 이력 조회 (오래된 순).
     */
    List<StateChangeRecord> getStateHistory();

    /**
     * CLOSED 상태로 강제 리셋.
     *
     * <p>연속 카운터만 초기화하며 누적 지표는 유지합니다.</p>
     */
    void reset();

    /**
     * 관리자 권한으로 OPEN 상태로 강제 전이.
     *
     * <p>이미 OPEN이면 아무 동작도 하지 않습니다.</p>
     *
     * @param reason 사유
     */
    void forceOpen(String reason);

    /**
     * 백그라운드 작업 정리. 여러 번 호출해도 안전합니다.
     */
    void cleanup();

    /**
     * 리스너 등록.
     *
     * @param listener 리스너
     */
    void addListener(CircuitBreakerListener listener);

    /**
     * 리스너 제거.
     *
     * @param listener 리스너
     */
    void removeListener(CircuitBreakerListener listener);
}
