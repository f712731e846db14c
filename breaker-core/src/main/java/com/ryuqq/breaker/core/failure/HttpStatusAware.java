package com.ryuqq.breaker.core.failure;

/**
 * HTTP 상태 코드를 제공하는 예외.
 *
 * <p>SIEM 커넥터가 던지는 HTTP 예외가 이 인터페이스를 구현하면
 * {@link FailureClassifier}가 상태 코드를 {@link FailureRecord}에 기록하고
 * HTTP_ERROR 분류에 사용합니다.</p>
 *
 * <pre>{@code
 * public class ElasticsearchHttpException extends RuntimeException implements HttpStatusAware {
 *     private final int statusCode;
 *     ...
 *     public int getStatusCode() { return statusCode; }
 * }
 * }</pre>
 *
 * @author Breaker Team
 * @since 1.0.0
 */
public interface HttpStatusAware {

    /**
     * HTTP 상태 코드 조회.
     *
     * @return HTTP 상태 코드 (예: 502)
     */
    int getStatusCode();
}
