package com.ryuqq.urengine.core.exception;

/**
 * Source Adapter(외부 협력자)가 후보 리소스를 만들지 못한 경우.
 *
 * <p>checked 예외로 어댑터 경계에서만 던져집니다. 엔진은 이를 Issue 레코드로 기록하며,
 * 형제 작업을 중단시키지 않습니다.</p>
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
public class AdapterException extends Exception {

    private final String unitId;

    /**
     * 생성자.
     *
     * @param unitId 처리하지 못한 경로 또는 동등 단위 식별자
     * @param message 실패 사유
     */
    public AdapterException(String unitId, String message) {
        super(message);
        this.unitId = unitId;
    }

    /**
     * 원인 포함 생성자.
     *
     * @param unitId 처리하지 못한 경로 또는 동등 단위 식별자
     * @param message 실패 사유
     * @param cause 원인 (I/O 오류 등)
     */
    public AdapterException(String unitId, String message, Throwable cause) {
        super(message, cause);
        this.unitId = unitId;
    }

    /**
     * 처리하지 못한 단위 식별자.
     *
     * @return 경로 또는 단위 식별자
     */
    public String getUnitId() {
        return unitId;
    }
}
