package com.ryuqq.breaker.adapter.runtime;

import com.ryuqq.breaker.core.failure.FailureRecord;
import com.ryuqq.breaker.core.protection.CircuitBreakerListener;
import com.ryuqq.breaker.core.state.CircuitState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 리스너 호출기.
 *
 * <p>리스너가 던진 {@link Exception}은 ERROR로 로그를 남기고 무시합니다.
 * 하나의 리스너가 실패해도 나머지 리스너와 Circuit Breaker 상태 갱신은 계속됩니다.
 * {@link Error}는 잡지 않으며, 호출 시점에는 상태 갱신이 이미 끝나 있습니다.</p>
 *
 * @author Breaker Team
 * @since 1.0.0
 */
final class ListenerNotifier {

    private static final Logger log = LoggerFactory.getLogger(ListenerNotifier.class);

    private final String breakerName;
    private final List<CircuitBreakerListener> listeners = new CopyOnWriteArrayList<>();

    ListenerNotifier(String breakerName) {
        this.breakerName = breakerName;
    }

    void add(CircuitBreakerListener listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        listeners.add(listener);
    }

    void remove(CircuitBreakerListener listener) {
        listeners.remove(listener);
    }

    void notifySuccess(double responseTimeMs, boolean slowCall) {
        for (CircuitBreakerListener listener : listeners) {
            try {
                listener.onSuccess(breakerName, responseTimeMs, slowCall);
            } catch (Exception e) {
                log.error("Listener failed on success event for circuit breaker '{}'", breakerName, e);
            }
        }
    }

    void notifyFailure(FailureRecord failure) {
        for (CircuitBreakerListener listener : listeners) {
            try {
                listener.onFailure(breakerName, failure);
            } catch (Exception e) {
                log.error("Listener failed on failure event for circuit breaker '{}'", breakerName, e);
            }
        }
    }

    void notifyStateChange(CircuitState from, CircuitState to, String reason) {
        for (CircuitBreakerListener listener : listeners) {
            try {
                listener.onStateChange(breakerName, from, to, reason);
            } catch (Exception e) {
                log.error("Listener failed on state change {} -> {} for circuit breaker '{}'",
                    from, to, breakerName, e);
            }
        }
    }
}
