package com.ryuqq.urengine.core.exception;

/**
 * 구조화 payload 형식 오류 또는 제약 위반.
 *
 * <p>쓰기 전에 거부되며 호출자에게 그대로 전달됩니다. 자동 재시도 대상이 아닙니다.</p>
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
public class ValidationException extends ResourceEngineException {

    private final String field;

    /**
     * 검증 실패 예외 생성.
     *
     * @param field 검증에 실패한 필드명
     * @param message 실패 사유
     */
    public ValidationException(String field, String message) {
        super(field + ": " + message);
        this.field = field;
    }

    /**
     * 원인 포함 검증 실패 예외 생성.
     *
     * @param field 검증에 실패한 필드명
     * @param message 실패 사유
     * @param cause 파서 예외 등 원인
     */
    public ValidationException(String field, String message, Throwable cause) {
        super(field + ": " + message, cause);
        this.field = field;
    }

    /**
     * 검증에 실패한 필드명.
     *
     * @return 필드명
     */
    public String getField() {
        return field;
    }
}
