package com.ryuqq.urengine.core.outcome;

/**
 * 영구적 실패.
 *
 * @param status 실패 분류 (0 불가)
 * @param errorCode 오류 코드
 * @param message 오류 메시지
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
public record Fail(
    int status,
    String errorCode,
    String message
) implements Outcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public Fail {
        if (status == 0) {
            throw new IllegalArgumentException("status of a failure cannot be 0");
        }
        if (errorCode == null || errorCode.isBlank()) {
            throw new IllegalArgumentException("errorCode cannot be null or blank");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
    }

    public static Fail of(int status, String errorCode, String message) {
        return new Fail(status, errorCode, message);
    }
}
