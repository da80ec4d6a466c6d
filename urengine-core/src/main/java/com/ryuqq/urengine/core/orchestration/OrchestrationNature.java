package com.ryuqq.urengine.core.orchestration;

import com.ryuqq.urengine.core.model.Housekeeping;
import com.ryuqq.urengine.core.model.SoftDeletable;

/**
 * 파이프라인 종류 분류.
 *
 * <p>{@code (natureId, nature)}로 유일하며 세션을 시작할 때 필요하면 자동 등록됩니다.</p>
 *
 * @param natureId 분류 식별자
 * @param nature 표시 이름
 * @param elaboration 부가 정보 (JSON, null 가능)
 * @param housekeeping housekeeping envelope
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
public record OrchestrationNature(
    String natureId,
    String nature,
    String elaboration,
    Housekeeping housekeeping
) implements SoftDeletable {

    public OrchestrationNature {
        if (natureId == null || natureId.isBlank()) {
            throw new IllegalArgumentException("natureId cannot be null or blank");
        }
        if (nature == null || nature.isBlank()) {
            throw new IllegalArgumentException("nature cannot be null or blank");
        }
        if (housekeeping == null) {
            throw new IllegalArgumentException("housekeeping cannot be null");
        }
    }
}
