package com.ryuqq.urengine.core.model;

/**
 * Orchestration Session(파이프라인 한 번의 실행)의 식별자.
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
public final class OrchestrationSessionId extends Identifier {

    private OrchestrationSessionId(String value) {
        super(value);
    }

    /**
     * OrchestrationSessionId 생성.
     *
     * @param value 식별자 값
     * @return OrchestrationSessionId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static OrchestrationSessionId of(String value) {
        return new OrchestrationSessionId(value);
    }

    /**
     * 새로운 OrchestrationSessionId 발급 (UUID 기반).
     *
     * @return 신규 OrchestrationSessionId
     */
    public static OrchestrationSessionId generate() {
        return new OrchestrationSessionId(newValue());
    }
}
