package com.ryuqq.urengine.core.exception;

/**
 * 저장소 접근 불가 또는 무결성 손상 (프로세스 단위 치명적 오류).
 *
 * <p>현재 세션을 중단시키며 반드시 보고되어야 합니다. 레코드 단위 오류처럼 흡수하면 안 됩니다.</p>
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
public class StoreUnavailableException extends ResourceEngineException {

    /**
     * 생성자.
     *
     * @param message 상세 메시지
     */
    public StoreUnavailableException(String message) {
        super(message);
    }

    /**
     * 원인 포함 생성자.
     *
     * @param message 상세 메시지
     * @param cause 원인
     */
    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
