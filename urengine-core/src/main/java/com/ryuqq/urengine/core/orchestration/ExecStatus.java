package com.ryuqq.urengine.core.orchestration;

/**
 * Exec status 값.
 *
 * <p>0은 성공이며, 그 외 값은 호출자가 정의하는 실패 분류입니다. 엔진이 직접 부여하는 값은 음수입니다.</p>
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
public final class ExecStatus {

    /**
     * 성공.
     */
    public static final int SUCCESS = 0;

    /**
     * 엔진 오류 (검증/참조 무결성).
     */
    public static final int ENGINE_FAILURE = -1;

    /**
     * Source Adapter 오류.
     */
    public static final int ADAPTER_FAILURE = -2;

    /**
     * 처리되지 않은 예외.
     */
    public static final int UNHANDLED_FAILURE = -3;

    // Utility class - prevent instantiation
    private ExecStatus() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static boolean isSuccess(int status) {
        return status == SUCCESS;
    }
}
