package com.ryuqq.urengine.core.graph;

import com.ryuqq.urengine.core.model.Housekeeping;
import com.ryuqq.urengine.core.model.SoftDeletable;

/**
 * 이름으로 식별되는 Lineage Graph.
 *
 * @param name 그래프 이름
 * @param elaboration 부가 정보 (JSON, null 가능)
 * @param housekeeping housekeeping envelope
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
public record LineageGraphDefinition(
    String name,
    String elaboration,
    Housekeeping housekeeping
) implements SoftDeletable {

    public LineageGraphDefinition {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (housekeeping == null) {
            throw new IllegalArgumentException("housekeeping cannot be null");
        }
    }
}
