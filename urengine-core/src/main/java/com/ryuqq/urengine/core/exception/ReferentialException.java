package com.ryuqq.urengine.core.exception;

/**
 * 소유자(device, session, parent 등)가 존재하지 않음.
 *
 * <p>호출자는 소유 엔티티를 먼저 생성해야 합니다.</p>
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
public class ReferentialException extends ResourceEngineException {

    private final String entityType;
    private final String missingId;

    /**
     * 참조 대상 누락 예외 생성.
     *
     * @param entityType 누락된 엔티티 종류 (예: "Device", "IngestSession")
     * @param missingId 누락된 식별자 값
     */
    public ReferentialException(String entityType, String missingId) {
        this(entityType, missingId, entityType + " not found: " + missingId);
    }

    /**
     * 메시지 지정 참조 오류 생성.
     *
     * @param entityType 엔티티 종류
     * @param missingId 문제의 식별자 값
     * @param message 상세 메시지
     */
    public ReferentialException(String entityType, String missingId, String message) {
        super(message);
        this.entityType = entityType;
        this.missingId = missingId;
    }

    /**
     * 누락된 엔티티 종류.
     *
     * @return 엔티티 종류
     */
    public String getEntityType() {
        return entityType;
    }

    /**
     * 누락된 식별자 값.
     *
     * @return 식별자 값
     */
    public String getMissingId() {
        return missingId;
    }
}
