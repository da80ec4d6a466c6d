package com.ryuqq.urengine.core.model;

/**
 * housekeeping envelope를 가진 엔티티.
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
public interface SoftDeletable {

    /**
     * housekeeping envelope 조회.
     *
     * @return envelope (non-null)
     */
    Housekeeping housekeeping();

    /**
     * live 여부.
     *
     * @return 삭제 표시가 없으면 true
     */
    default boolean isLive() {
        return housekeeping().isLive();
    }
}
