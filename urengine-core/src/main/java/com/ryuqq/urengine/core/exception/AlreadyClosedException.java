package com.ryuqq.urengine.core.exception;

/**
 * 이미 종료된 세션을 다시 종료하거나, 종료된 세션에 새 최상위 작업을 열려고 한 경우.
 *
 * <p>close는 멱등하지 않습니다. 이중 close를 프로그래밍 오류로 드러내기 위함입니다.</p>
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
public class AlreadyClosedException extends ResourceEngineException {

    /**
     * 생성자.
     *
     * @param sessionKind 세션 종류 (예: "IngestSession", "OrchestrationSession")
     * @param sessionId 세션 식별자 값
     */
    public AlreadyClosedException(String sessionKind, String sessionId) {
        super(sessionKind + " already closed: " + sessionId);
    }
}
