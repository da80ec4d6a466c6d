package com.ryuqq.urengine.core.exception;

/**
 * 저장소가 원자적 compare-and-insert/update를 보장하지 못해 경합을 해소할 수 없는 경우.
 *
 * <p>해소 가능한 경합은 내부에서 직렬화되며 절대 노출되지 않습니다.</p>
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
public class ConcurrencyConflictException extends ResourceEngineException {

    /**
     * 생성자.
     *
     * @param message 경합 설명
     */
    public ConcurrencyConflictException(String message) {
        super(message);
    }
}
