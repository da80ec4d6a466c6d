package com.ryuqq.urengine.application.orchestration;

import com.ryuqq.urengine.core.outcome.Outcome;

/**
 * {@link OrchestrationExecutor#run}으로 실행되는 작업 단위.
 *
 * <p>주어진 handle로 자식 Exec과 로그를 기록할 수 있습니다. handle의 종료는 실행기가 담당합니다.</p>
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ExecBody {

    /**
     * 작업 실행.
     *
     * @param exec 이 작업의 Exec handle
     * @return 실행 결과
     * @throws Exception 처리되지 않은 오류 (Exec 실패로 기록됨)
     */
    Outcome execute(ExecHandle exec) throws Exception;
}
