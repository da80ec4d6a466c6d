package com.ryuqq.urengine.core.model;

import java.time.Instant;

/**
 * 모든 저장 엔티티에 공통으로 붙는 housekeeping envelope.
 *
 * <p>생성/수정/삭제 시각과 행위자, 그리고 자유 형식 activity log를 담습니다.
 * 삭제는 물리적 제거가 아니라 {@code deletedAt}/{@code deletedBy} 표시(soft-delete)이며,
 * "live" 조회는 반드시 {@code deletedAt == null}인 행만 봐야 합니다.</p>
 *
 * <p><strong>불변성:</strong> 모든 변경은 새 인스턴스를 반환합니다.</p>
 *
 * @param createdAt 생성 시각 (필수)
 * @param createdBy 생성 행위자 (null이면 {@value #UNKNOWN_ACTOR})
 * @param updatedAt 마지막 수정 시각 (null 가능)
 * @param updatedBy 마지막 수정 행위자 (null 가능)
 * @param deletedAt soft-delete 시각 (null이면 live)
 * @param deletedBy soft-delete 행위자 (null 가능)
 * @param activityLog 자유 형식 activity log (null 가능)
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
public record Housekeeping(
    Instant createdAt,
    String createdBy,
    Instant updatedAt,
    String updatedBy,
    Instant deletedAt,
    String deletedBy,
    String activityLog
) {

    /**
     * 행위자를 알 수 없을 때의 기본값.
     */
    public static final String UNKNOWN_ACTOR = "UNKNOWN";

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException createdAt이 null인 경우
     */
    public Housekeeping {
        if (createdAt == null) {
            throw new IllegalArgumentException("createdAt cannot be null");
        }
        if (createdBy == null || createdBy.isBlank()) {
            createdBy = UNKNOWN_ACTOR;
        }
    }

    /**
     * 신규 엔티티용 envelope 생성.
     *
     * @param at 생성 시각
     * @param actor 생성 행위자 (null 허용)
     * @return Housekeeping 인스턴스
     */
    public static Housekeeping created(Instant at, String actor) {
        return new Housekeeping(at, actor, null, null, null, null, null);
    }

    /**
     * 수정 표시.
     *
     * @param at 수정 시각
     * @param actor 수정 행위자
     * @return 수정 정보가 갱신된 새 인스턴스
     */
    public Housekeeping touched(Instant at, String actor) {
        return new Housekeeping(createdAt, createdBy, at, actorOrUnknown(actor), deletedAt, deletedBy, activityLog);
    }

    /**
     * soft-delete 표시.
     *
     * <p>이미 삭제된 경우 최초 삭제 정보를 유지합니다.</p>
     *
     * @param at 삭제 시각
     * @param actor 삭제 행위자
     * @return 삭제 표시된 새 인스턴스
     */
    public Housekeeping softDeleted(Instant at, String actor) {
        if (deletedAt != null) {
            return this;
        }
        return new Housekeeping(createdAt, createdBy, at, actorOrUnknown(actor), at, actorOrUnknown(actor), activityLog);
    }

    /**
     * soft-delete 해제.
     *
     * @param at 복원 시각
     * @param actor 복원 행위자
     * @return 삭제 표시가 제거된 새 인스턴스
     */
    public Housekeeping restored(Instant at, String actor) {
        return new Housekeeping(createdAt, createdBy, at, actorOrUnknown(actor), null, null, activityLog);
    }

    /**
     * activity log에 한 줄 추가.
     *
     * @param line 추가할 내용
     * @return activity log가 확장된 새 인스턴스
     */
    public Housekeeping withActivity(String line) {
        if (line == null || line.isBlank()) {
            return this;
        }
        String log = activityLog == null ? line : activityLog + '\n' + line;
        return new Housekeeping(createdAt, createdBy, updatedAt, updatedBy, deletedAt, deletedBy, log);
    }

    /**
     * live(삭제되지 않은) 상태인지 확인.
     *
     * @return deletedAt이 null이면 true
     */
    public boolean isLive() {
        return deletedAt == null;
    }

    private static String actorOrUnknown(String actor) {
        return actor == null || actor.isBlank() ? UNKNOWN_ACTOR : actor;
    }
}
