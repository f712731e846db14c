package com.ryuqq.breaker.core.failure;

import java.util.Locale;
import java.util.function.Predicate;

/**
 * 실패 분류 규칙 (predicate → FailureType).
 *
 * <p>{@link FailureClassifier}는 규칙을 등록 순서대로 평가하고
 * 처음 일치한 규칙의 유형을 사용합니다.</p>
 *
 * @param name 규칙 이름 (로그/디버깅용)
 * @param predicate 예외 일치 조건
 * @param failureType 일치 시 분류 결과
 * @author Breaker Team
 * @since 1.0.0
 */
public record ClassificationRule(
    String name,
    Predicate<Throwable> predicate,
    FailureType failureType
) {

    /**
     * Compact constructor with validation.
     *
     * @throws IllegalArgumentException 인자가 null이거나 name이 빈 문자열인 경우
     */
    public ClassificationRule {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (predicate == null) {
            throw new IllegalArgumentException("predicate cannot be null");
        }
        if (failureType == null) {
            throw new IllegalArgumentException("failureType cannot be null");
        }
    }

    /**
     * 규칙 일치 여부 확인.
     *
     * @param throwable 검사할 예외
     * @return 일치하면 true
     */
    public boolean matches(Throwable throwable) {
        return predicate.test(throwable);
    }

    /**
     * 예외 메시지에 키워드 중 하나가 포함되면 일치하는 규칙 생성 (대소문자 무시).
     *
     * @param name 규칙 이름
     * @param failureType 분류 결과
     * @param keywords 소문자 키워드
     * @return 규칙
     */
    public static ClassificationRule messageContains(String name, FailureType failureType, String... keywords) {
        return new ClassificationRule(name, t -> containsAny(messageOf(t), keywords), failureType);
    }

    /**
     * 예외 메시지 또는 예외 클래스명에 키워드가 포함되면 일치하는 규칙 생성 (대소문자 무시).
     *
     * @param name 규칙 이름
     * @param failureType 분류 결과
     * @param keyword 소문자 키워드
     * @return 규칙
     */
    public static ClassificationRule messageOrTypeContains(String name, FailureType failureType, String keyword) {
        return new ClassificationRule(
            name,
            t -> messageOf(t).contains(keyword)
                || t.getClass().getSimpleName().toLowerCase(Locale.ROOT).contains(keyword),
            failureType
        );
    }

    /**
     * 예외가 주어진 타입 중 하나의 인스턴스이면 일치하는 규칙 생성.
     *
     * @param name 규칙 이름
     * @param failureType 분류 결과
     * @param types 예외 타입
     * @return 규칙
     */
    @SafeVarargs
    public static ClassificationRule instanceOf(String name, FailureType failureType,
                                                Class<? extends Throwable>... types) {
        return new ClassificationRule(name, t -> {
            for (Class<? extends Throwable> type : types) {
                if (type.isInstance(t)) {
                    return true;
                }
            }
            return false;
        }, failureType);
    }

    static String messageOf(Throwable throwable) {
        String message = throwable.getMessage();
        return message == null ? "" : message.toLowerCase(Locale.ROOT);
    }

    private static boolean containsAny(String text, String... keywords) {
        for (String keyword : keywords) {
            if (text.contains(keyword)) {
                return true;
            }
        }
        return false;
    }
}
