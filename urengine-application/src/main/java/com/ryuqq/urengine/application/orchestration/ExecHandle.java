package com.ryuqq.urengine.application.orchestration;

import com.ryuqq.urengine.core.model.ExecId;
import com.ryuqq.urengine.core.model.LogId;
import com.ryuqq.urengine.core.model.OrchestrationSessionId;
import com.ryuqq.urengine.core.model.SessionEntryId;
import com.ryuqq.urengine.core.orchestration.ExecNode;
import com.ryuqq.urengine.core.orchestration.ExecStatus;
import com.ryuqq.urengine.core.outcome.Outcome;

/**
 * 실행 중인 Exec 노드에 대한 handle.
 *
 * <p>try-with-resources로 사용하면 {@link #close()}가 아직 실행 중인 노드를 status 0으로 종료합니다.
 * 자식 중 하나라도 실패했다면 부모는 첫 번째 실패 자식의 status로 기록되고, 아직 실행 중인 자식은
 * {@link ExecStatus#UNHANDLED_FAILURE}로 간주됩니다.</p>
 *
 * <pre>
 * try (ExecHandle stage = executor.exec(sessionId, entryId, null, "stage", "load", null)) {
 *     try (ExecHandle step = stage.child("step", "parse", input)) {
 *         ...
 *     }
 * }
 * </pre>
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
public final class ExecHandle implements AutoCloseable {

    private final OrchestrationExecutor executor;
    private final ExecId execId;
    private final OrchestrationSessionId sessionId;
    private final SessionEntryId entryId;
    private final int siblingOrder;

    ExecHandle(OrchestrationExecutor executor, ExecNode node) {
        if (executor == null) {
            throw new IllegalArgumentException("executor cannot be null");
        }
        if (node == null) {
            throw new IllegalArgumentException("node cannot be null");
        }
        this.executor = executor;
        this.execId = node.id();
        this.sessionId = node.sessionId();
        this.entryId = node.entryId();
        this.siblingOrder = node.siblingOrder();
    }

    /**
     * 자식 Exec 시작.
     *
     * @param nature 실행 종류
     * @param code 실행 코드
     * @param input 입력 (null 가능)
     * @return 자식 handle
     */
    public ExecHandle child(String nature, String code, String input) {
        return executor.exec(sessionId, entryId, execId, nature, code, input);
    }

    /**
     * 자식 작업 실행.
     *
     * @param nature 실행 종류
     * @param code 실행 코드
     * @param input 입력 (null 가능)
     * @param body 작업
     * @return 실행 결과
     */
    public Outcome run(String nature, String code, String input, ExecBody body) {
        return executor.run(this, nature, code, input, body);
    }

    /**
     * 이 Exec에 연결된 루트 로그 기록.
     *
     * @param category 분류
     * @param content 내용
     * @return 로그 ID
     */
    public LogId log(String category, String content) {
        return executor.log(sessionId, null, execId, category, content, null);
    }

    /**
     * 종료.
     *
     * @param status 0은 성공, 그 외 실패 분류
     * @param output 출력 (null 가능)
     * @param error 오류 (null 가능)
     * @return 기록된 노드
     */
    public ExecNode finish(int status, String output, String error) {
        return executor.finish(execId, status, output, error);
    }

    /**
     * 실패로 종료.
     *
     * @param status 실패 분류 (0 불가)
     * @param error 오류 텍스트
     * @return 기록된 노드
     */
    public ExecNode fail(int status, String error) {
        if (status == ExecStatus.SUCCESS) {
            throw new IllegalArgumentException("failure status cannot be 0");
        }
        return executor.finish(execId, status, null, error);
    }

    /**
     * 자식 실패를 무시하고 주어진 status로 종료.
     *
     * @param status status
     * @param output 출력 (null 가능)
     * @param error 오류 (null 가능)
     * @return 기록된 노드
     */
    public ExecNode finishOverriding(int status, String output, String error) {
        return executor.finishOverriding(execId, status, output, error);
    }

    public boolean isFinished() {
        return executor.findExec(execId).map(node -> !node.isRunning()).orElse(false);
    }

    /**
     * 아직 실행 중이면 status 0으로 종료. 실행 중이거나 실패한 자식이 남아 있으면 실패로 기록됩니다.
     */
    @Override
    public void close() {
        executor.finishIfRunning(execId);
    }

    public ExecId getExecId() {
        return execId;
    }

    public OrchestrationSessionId getSessionId() {
        return sessionId;
    }

    public SessionEntryId getEntryId() {
        return entryId;
    }

    public int getSiblingOrder() {
        return siblingOrder;
    }

    @Override
    public String toString() {
        return "ExecHandle{execId=" + execId + ", sessionId=" + sessionId + ", order=" + siblingOrder + "}";
    }
}
