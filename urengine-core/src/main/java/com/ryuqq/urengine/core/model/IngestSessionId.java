package com.ryuqq.urengine.core.model;

/**
 * Ingest Session(한 번의 수집 실행)의 식별자.
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
public final class IngestSessionId extends Identifier {

    private IngestSessionId(String value) {
        super(value);
    }

    /**
     * IngestSessionId 생성.
     *
     * @param value 식별자 값
     * @return IngestSessionId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static IngestSessionId of(String value) {
        return new IngestSessionId(value);
    }

    /**
     * 새로운 IngestSessionId 발급 (UUID 기반).
     *
     * @return 신규 IngestSessionId
     */
    public static IngestSessionId generate() {
        return new IngestSessionId(newValue());
    }
}
