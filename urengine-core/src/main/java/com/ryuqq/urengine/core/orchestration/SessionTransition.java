package com.ryuqq.urengine.core.orchestration;

import com.ryuqq.urengine.core.model.Identifier;

import java.time.Instant;

/**
 * 상태 전이 기록.
 *
 * <p>현재값 테이블에서는 {@code (owner, fromState, toState)}당 한 행만 유지되며 마지막 기록이 이깁니다.
 * 이력 테이블에는 모든 기록이 {@code sequence} 순으로 누적됩니다.</p>
 *
 * @param owner 소유자 (Orchestration Session, Session Entry, Ingest Session)
 * @param fromState 이전 상태
 * @param toState 다음 상태
 * @param result 전이 결과 (JSON, null 가능)
 * @param reason 전이 사유 (null 가능)
 * @param transitionedAt 기록 시각
 * @param sequence 저장소 전역 기록 순번 (1부터)
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
public record SessionTransition(
    Identifier owner,
    String fromState,
    String toState,
    String result,
    String reason,
    Instant transitionedAt,
    long sequence
) {

    public SessionTransition {
        if (owner == null || transitionedAt == null) {
            throw new IllegalArgumentException("owner and transitionedAt cannot be null");
        }
        if (fromState == null || fromState.isBlank() || toState == null || toState.isBlank()) {
            throw new IllegalArgumentException("fromState and toState cannot be null or blank");
        }
    }

    public Key key() {
        return new Key(owner, fromState, toState);
    }

    /**
     * 현재값 테이블 키.
     *
     * @param owner 소유자
     * @param fromState 이전 상태
     * @param toState 다음 상태
     */
    public record Key(Identifier owner, String fromState, String toState) {
    }
}
