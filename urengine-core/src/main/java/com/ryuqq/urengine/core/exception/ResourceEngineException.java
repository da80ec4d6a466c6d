package com.ryuqq.urengine.core.exception;

/**
 * 엔진 예외의 최상위 타입.
 *
 * <p>레코드 단위 오류(검증, 참조 무결성, 종료된 세션 등)와 프로세스 단위 치명적 오류
 * ({@link StoreUnavailableException})를 모두 포함합니다.
 * 중복 수집(duplicate admission)은 오류가 아니라 {@code isNewRecord=false} 결과로 표현됩니다.</p>
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
public class ResourceEngineException extends RuntimeException {

    /**
     * 메시지로 생성.
     *
     * @param message 오류 메시지
     */
    public ResourceEngineException(String message) {
        super(message);
    }

    /**
     * 메시지와 원인으로 생성.
     *
     * @param message 오류 메시지
     * @param cause 원인
     */
    public ResourceEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
