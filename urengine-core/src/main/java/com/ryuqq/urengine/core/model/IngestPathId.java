package com.ryuqq.urengine.core.model;

/**
 * Ingest Session에 등록된 경로 루트(또는 메일 폴더, 이슈 프로젝트 등 동등한 컨테이너)의 식별자.
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
public final class IngestPathId extends Identifier {

    private IngestPathId(String value) {
        super(value);
    }

    /**
     * IngestPathId 생성.
     *
     * @param value 식별자 값
     * @return IngestPathId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static IngestPathId of(String value) {
        return new IngestPathId(value);
    }

    /**
     * 새로운 IngestPathId 발급 (UUID 기반).
     *
     * @return 신규 IngestPathId
     */
    public static IngestPathId generate() {
        return new IngestPathId(newValue());
    }
}
