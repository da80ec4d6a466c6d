package com.ryuqq.urengine.adapter.runner;

import com.ryuqq.urengine.application.orchestration.ExecBody;
import com.ryuqq.urengine.application.orchestration.ExecHandle;
import com.ryuqq.urengine.application.orchestration.OrchestrationExecutor;
import com.ryuqq.urengine.core.model.LogId;
import com.ryuqq.urengine.core.model.OrchestrationSessionId;
import com.ryuqq.urengine.core.model.SessionEntryId;
import com.ryuqq.urengine.core.outcome.Outcome;
import com.ryuqq.urengine.core.spi.IngestionObserver;

/**
 * 단계 시도 하나의 실행 컨텍스트.
 *
 * <p>시도마다 새 Exec가 만들어지고, 단계가 시작하는 하위 작업은 그 Exec의 자식이 됩니다.</p>
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
public final class StageContext {

    private final OrchestrationExecutor executor;
    private final ExecHandle attemptExec;
    private final int attempt;

    StageContext(OrchestrationExecutor executor, ExecHandle attemptExec, int attempt) {
        this.executor = executor;
        this.attemptExec = attemptExec;
        this.attempt = attempt;
    }

    /**
     * 현재 시도 Exec 아래에서 하위 작업 실행.
     *
     * @param nature 실행 종류
     * @param code 실행 코드
     * @param input 입력 (null 가능)
     * @param body 작업
     * @return 결과
     */
    public Outcome run(String nature, String code, String input, ExecBody body) {
        return attemptExec.run(nature, code, input, body);
    }

    public LogId log(String category, String content) {
        return attemptExec.log(category, content);
    }

    /**
     * 이 단계에서 수집 세션을 열 때 넘길 관찰자.
     *
     * <p>수집 세션의 상태 전이와 어댑터 issue가 이 단계의 엔트리에 기록됩니다.</p>
     *
     * @return observer
     */
    public IngestionObserver ingestionObserver() {
        return executor.observerFor(getSessionId(), getEntryId());
    }

    public ExecHandle getExec() {
        return attemptExec;
    }

    /**
     * @return 1부터 시작하는 시도 번호
     */
    public int getAttempt() {
        return attempt;
    }

    public OrchestrationSessionId getSessionId() {
        return attemptExec.getSessionId();
    }

    public SessionEntryId getEntryId() {
        return attemptExec.getEntryId();
    }
}
