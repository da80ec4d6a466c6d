package com.ryuqq.urengine.core.model;

/**
 * 경로가 아닌 단위(메일 메시지, 이슈, 캡처된 실행 결과 등) 처리 기록의 식별자.
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
public final class IngestTaskId extends Identifier {

    private IngestTaskId(String value) {
        super(value);
    }

    /**
     * IngestTaskId 생성.
     *
     * @param value 식별자 값
     * @return IngestTaskId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static IngestTaskId of(String value) {
        return new IngestTaskId(value);
    }

    /**
     * 새로운 IngestTaskId 발급 (UUID 기반).
     *
     * @return 신규 IngestTaskId
     */
    public static IngestTaskId generate() {
        return new IngestTaskId(newValue());
    }
}
