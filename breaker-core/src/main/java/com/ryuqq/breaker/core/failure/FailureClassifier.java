package com.ryuqq.breaker.core.failure;

import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.UnknownHostException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 예외 → {@link FailureType} 분류기.
 *
 * <p>순서가 있는 {@link ClassificationRule} 목록을 평가하여 처음 일치한 유형을 반환합니다.
 * 예외 자체에 일치하는 규칙이 없으면 cause 체인을 따라 내려가며 다시 평가하고,
 * 끝까지 일치하지 않으면 {@link FailureType#UNKNOWN_ERROR}를 반환합니다.</p>
 *
 * <p><strong>기본 규칙 (순서대로):</strong></p>
 * <ol>
 *   <li>"timeout" (메시지 또는 클래스명) → TIMEOUT</li>
 *   <li>"connection" (메시지 또는 클래스명) → CONNECTION_ERROR</li>
 *   <li>ConnectException, UnknownHostException, NoRouteToHostException → CONNECTION_ERROR</li>
 *   <li>"auth", "unauthorized" → AUTHENTICATION_ERROR</li>
 *   <li>"rate limit", "too many requests" → RATE_LIMIT</li>
 *   <li>"service unavailable", "503" → SERVICE_UNAVAILABLE</li>
 *   <li>{@link HttpStatusAware} 상태 코드 400~599 → HTTP_ERROR</li>
 * </ol>
 *
 * <p>문자열 기반 휴리스틱이므로 best-effort 분류입니다. 분류 결과는 관측 용도로만 쓰이며
 * 상태 전이 로직과 독립적이므로, 규칙을 추가해도 Circuit Breaker 동작은 바뀌지 않습니다.</p>
 *
 * <p>불변 객체이며 thread-safe합니다.</p>
 *
 * @author Breaker Team
 * @since 1.0.0
 */
public final class FailureClassifier {

    private static final int MAX_CAUSE_DEPTH = 10;

    private static final FailureClassifier DEFAULTS = new FailureClassifier(List.of(
        ClassificationRule.messageOrTypeContains("timeout", FailureType.TIMEOUT, "timeout"),
        ClassificationRule.messageOrTypeContains("connection", FailureType.CONNECTION_ERROR, "connection"),
        ClassificationRule.instanceOf("socket-connect", FailureType.CONNECTION_ERROR,
            ConnectException.class, UnknownHostException.class, NoRouteToHostException.class),
        ClassificationRule.messageContains("auth", FailureType.AUTHENTICATION_ERROR, "auth", "unauthorized"),
        ClassificationRule.messageContains("rate-limit", FailureType.RATE_LIMIT, "rate limit", "too many requests"),
        ClassificationRule.messageContains("service-unavailable", FailureType.SERVICE_UNAVAILABLE,
            "service unavailable", "503"),
        new ClassificationRule("http-status", FailureClassifier::hasErrorStatus, FailureType.HTTP_ERROR)
    ));

    private final List<ClassificationRule> rules;

    private FailureClassifier(List<ClassificationRule> rules) {
        this.rules = List.copyOf(rules);
    }

    /**
     * 기본 규칙 분류기.
     *
     * @return 기본 분류기
     */
    public static FailureClassifier defaults() {
        return DEFAULTS;
    }

    /**
     * 지정한 규칙만 사용하는 분류기 생성.
     *
     * @param rules 평가 순서대로 정렬된 규칙
     * @return 분류기
     * @throws IllegalArgumentException rules가 null이거나 null 원소를 포함하는 경우
     */
    public static FailureClassifier of(List<ClassificationRule> rules) {
        if (rules == null || rules.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException("rules cannot be null or contain null");
        }
        return new FailureClassifier(rules);
    }

    /**
     * 규칙을 가장 앞에 추가한 새 분류기 생성.
     *
     * <p>기본 규칙보다 우선해야 하는 커넥터 전용 규칙에 사용합니다.</p>
     *
     * @param rule 추가할 규칙
     * @return 새 분류기
     */
    public FailureClassifier withRuleFirst(ClassificationRule rule) {
        if (rule == null) {
            throw new IllegalArgumentException("rule cannot be null");
        }
        List<ClassificationRule> extended = new ArrayList<>(rules.size() + 1);
        extended.add(rule);
        extended.addAll(rules);
        return new FailureClassifier(extended);
    }

    /**
     * 규칙을 가장 뒤에 추가한 새 분류기 생성.
     *
     * @param rule 추가할 규칙
     * @return 새 분류기
     */
    public FailureClassifier withRule(ClassificationRule rule) {
        if (rule == null) {
            throw new IllegalArgumentException("rule cannot be null");
        }
        List<ClassificationRule> extended = new ArrayList<>(rules);
        extended.add(rule);
        return new FailureClassifier(extended);
    }

    /**
     * 등록된 규칙 조회.
     *
     * @return 읽기 전용 규칙 목록
     */
    public List<ClassificationRule> getRules() {
        return Collections.unmodifiableList(rules);
    }

    /**
     * 예외 분류.
     *
     * @param throwable 분류할 예외
     * @return 실패 유형 (일치하는 규칙이 없으면 UNKNOWN_ERROR)
     * @throws IllegalArgumentException throwable이 null인 경우
     */
    public FailureType classify(Throwable throwable) {
        if (throwable == null) {
            throw new IllegalArgumentException("throwable cannot be null");
        }

        Throwable current = throwable;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            for (ClassificationRule rule : rules) {
                if (rule.matches(current)) {
                    return rule.failureType();
                }
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return FailureType.UNKNOWN_ERROR;
    }

    /**
     * 예외를 분류하여 {@link FailureRecord} 생성.
     *
     * @param throwable 실패 원인 예외
     * @param timestamp 실패 시각
     * @param responseTimeMs 실패까지 걸린 시간 (밀리초, null 가능)
     * @return 실패 기록
     */
    public FailureRecord toRecord(Throwable throwable, Instant timestamp, Double responseTimeMs) {
        return new FailureRecord(
            timestamp,
            classify(throwable),
            describe(throwable),
            responseTimeMs,
            httpStatusOf(throwable)
        );
    }

    /**
     * 예외의 HTTP 상태 코드 조회.
     *
     * @param throwable 예외
     * @return HTTP 상태 코드 ({@link HttpStatusAware}가 아니면 null)
     */
    public static Integer httpStatusOf(Throwable throwable) {
        if (throwable instanceof HttpStatusAware aware) {
            return aware.getStatusCode();
        }
        return null;
    }

    private static String describe(Throwable throwable) {
        String message = throwable.getMessage();
        if (message == null || message.isBlank()) {
            return throwable.getClass().getSimpleName();
        }
        return message;
    }

    private static boolean hasErrorStatus(Throwable throwable) {
        Integer status = httpStatusOf(throwable);
        return status != null && status >= 400 && status < 600;
    }
}
