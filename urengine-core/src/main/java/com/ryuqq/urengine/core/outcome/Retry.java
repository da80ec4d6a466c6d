package com.ryuqq.urengine.core.outcome;

/**
 * 재시도 가능한 일시적 실패.
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>원격 저장소 일시 장애</li>
 *   <li>잠긴 파일</li>
 *   <li>Rate Limit 초과</li>
 * </ul>
 *
 * @param status 실패 분류 (0 불가)
 * @param reason 재시도 사유
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
public record Retry(
    int status,
    String reason
) implements Outcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException status가 0이거나 reason이 비어 있는 경우
     */
    public Retry {
        if (status == 0) {
            throw new IllegalArgumentException("status of a retry cannot be 0");
        }
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("reason cannot be null or blank");
        }
    }
}
