package com.ryuqq.urengine.core.model;

/**
 * 경로 루트 아래에서 발견된 개별 파일/단위 처리 기록(Path Entry)의 식별자.
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
public final class PathEntryId extends Identifier {

    private PathEntryId(String value) {
        super(value);
    }

    /**
     * PathEntryId 생성.
     *
     * @param value 식별자 값
     * @return PathEntryId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static PathEntryId of(String value) {
        return new PathEntryId(value);
    }

    /**
     * 새로운 PathEntryId 발급 (UUID 기반).
     *
     * @return 신규 PathEntryId
     */
    public static PathEntryId generate() {
        return new PathEntryId(newValue());
    }
}
