package com.ryuqq.urengine.core.resource;

import com.ryuqq.urengine.core.model.Identifier;

/**
 * 수집(admit) 결과.
 *
 * <p>중복은 오류가 아니라 {@code newRecord=false}로 표현됩니다. 이 경우 {@code id}는
 * 기존 행의 식별자이며 저장소에는 아무 것도 쓰이지 않습니다.</p>
 *
 * @param <I> 식별자 타입 (ResourceId 또는 TransformId)
 * @param id 신규 또는 기존 행 식별자
 * @param newRecord 이번 호출로 행이 생성되었는지 여부
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
public record Admission<I extends Identifier>(I id, boolean newRecord) {

    public Admission {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
    }

    public static <I extends Identifier> Admission<I> created(I id) {
        return new Admission<>(id, true);
    }

    public static <I extends Identifier> Admission<I> existing(I id) {
        return new Admission<>(id, false);
    }

    public boolean isNewRecord() {
        return newRecord;
    }
}
