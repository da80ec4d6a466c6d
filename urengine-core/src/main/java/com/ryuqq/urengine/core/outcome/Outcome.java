package com.ryuqq.urengine.core.outcome;

/**
 * 하나의 실행 단위(Exec) 결과.
 *
 * <p>Outcome은 세 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Ok}: 성공 (status 0)</li>
 *   <li>{@link Retry}: 일시적 실패, 재시도 가능</li>
 *   <li>{@link Fail}: 영구적 실패, 재시도 불가</li>
 * </ul>
 *
 * <p>Sealed interface로 정의되어 모든 케이스를 컴파일 타임에 검증합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * if (outcome instanceof Retry retry) {
 *     log.warn("retrying: {}", retry.reason());
 * }
 * </pre>
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
public sealed interface Outcome permits Ok, Retry, Fail {

    /**
     * Exec에 기록할 status 값.
     *
     * @return 0이면 성공, 그 외 실패 분류
     */
    int status();

    default boolean isOk() {
        return this instanceof Ok;
    }

    default boolean isRetry() {
        return this instanceof Retry;
    }

    default boolean isFail() {
        return this instanceof Fail;
    }
}
