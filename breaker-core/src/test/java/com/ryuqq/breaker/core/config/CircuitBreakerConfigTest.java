package com.ryuqq.breaker.core.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * CircuitBreakerConfig 유닛 테스트.
 *
 * @author Breaker Team
 * @since 1.0.0
 */
@DisplayName("CircuitBreakerConfig 테스트")
class CircuitBreakerConfigTest {

    @Test
    @DisplayName("기본 생성자는 문서화된 기본값을 사용한다")
    void 기본값() {
        // when
        CircuitBreakerConfig config = new CircuitBreakerConfig();

        // then
        assertThat(config.failureThreshold()).isEqualTo(5);
        assertThat(config.successThreshold()).isEqualTo(3);
        assertThat(config.timeoutMs()).isEqualTo(60000);
        assertThat(config.maxTimeoutMs()).isEqualTo(300000);
        assertThat(config.failureRateThreshold()).isEqualTo(50.0);
        assertThat(config.slowCallThresholdMs()).isEqualTo(10000);
        assertThat(config.slowCallRateThreshold()).isEqualTo(50.0);
        assertThat(config.minimumThroughput()).isEqualTo(10);
        assertThat(config.slidingWindowSize()).isEqualTo(100);
        assertThat(config.exponentialBackoff()).isTrue();
        assertThat(config.jitter()).isTrue();
        assertThat(config.healthCheckIntervalMs()).isEqualTo(30000);
        assertThat(config.recoveryFactor()).isEqualTo(0.1);
        assertThat(config.recoveryStepUp()).isEqualTo(1.1);
        assertThat(config.recoveryStepDown()).isEqualTo(0.5);
        assertThat(config.gradualRecoveryMinRequests()).isEqualTo(1000);
        assertThat(CircuitBreakerConfig.defaults()).isEqualTo(config);
    }

    @Test
    @DisplayName("서비스별 프리셋")
    void 서비스별_프리셋() {
        // when
        CircuitBreakerConfig es = CircuitBreakerConfig.forElasticsearch();
        CircuitBreakerConfig wazuh = CircuitBreakerConfig.forWazuh();
        CircuitBreakerConfig splunk = CircuitBreakerConfig.forSplunk();

        // then
        assertThat(es.failureThreshold()).isEqualTo(3);
        assertThat(es.successThreshold()).isEqualTo(2);
        assertThat(es.timeoutMs()).isEqualTo(30000);
        assertThat(es.failureRateThreshold()).isEqualTo(30.0);
        assertThat(es.slowCallThresholdMs()).isEqualTo(5000);
        assertThat(es.minimumThroughput()).isEqualTo(5);

        assertThat(wazuh.failureThreshold()).isEqualTo(5);
        assertThat(wazuh.successThreshold()).isEqualTo(3);
        assertThat(wazuh.timeoutMs()).isEqualTo(60000);
        assertThat(wazuh.failureRateThreshold()).isEqualTo(40.0);
        assertThat(wazuh.slowCallThresholdMs()).isEqualTo(10000);

        assertThat(splunk.failureThreshold()).isEqualTo(4);
        assertThat(splunk.successThreshold()).isEqualTo(3);
        assertThat(splunk.timeoutMs()).isEqualTo(45000);
        assertThat(splunk.failureRateThreshold()).isEqualTo(35.0);
        assertThat(splunk.slowCallThresholdMs()).isEqualTo(8000);
    }

    @Test
    @DisplayName("withX는 해당 필드만 변경한 새 인스턴스를 만든다")
    void withX_복사() {
        // given
        CircuitBreakerConfig base = new CircuitBreakerConfig();

        // when
        CircuitBreakerConfig changed = base.withFailureThreshold(7).withJitter(false);

        // then
        assertThat(changed.failureThreshold()).isEqualTo(7);
        assertThat(changed.jitter()).isFalse();
        assertThat(changed.successThreshold()).isEqualTo(base.successThreshold());
        assertThat(base.failureThreshold()).isEqualTo(5);
    }

    @Test
    @DisplayName("withTimeoutMs는 maxTimeoutMs보다 크면 maxTimeoutMs도 함께 올린다")
    void withTimeoutMs_max_보정() {
        // when
        CircuitBreakerConfig config = new CircuitBreakerConfig().withTimeoutMs(600000);

        // then
        assertThat(config.maxTimeoutMs()).isEqualTo(600000);
    }

    @Test
    @DisplayName("잘못된 값은 IllegalArgumentException")
    void 유효성_검증() {
        CircuitBreakerConfig base = new CircuitBreakerConfig();

        assertThatThrownBy(() -> base.withFailureThreshold(0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("failureThreshold must be positive (current: 0)");
        assertThatThrownBy(() -> base.withMaxTimeoutMs(1000))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("maxTimeoutMs must be >= timeoutMs");
        assertThatThrownBy(() -> base.withFailureRateThreshold(120.0))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> base.withRecoveryFactor(0.0))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> base.withRecoverySteps(0.9, 0.5))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> base.withRecoverySteps(1.1, 0.0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("recoveryStepDown must be between 0.0 and 1.0");
        assertThatThrownBy(() -> base.withRecoverySteps(1.1, 1.0))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> base.withSlidingWindowSize(-1))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
