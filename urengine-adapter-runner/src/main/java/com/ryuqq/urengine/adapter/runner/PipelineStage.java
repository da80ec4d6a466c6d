package com.ryuqq.urengine.adapter.runner;

import com.ryuqq.urengine.core.outcome.Outcome;

/**
 * 파이프라인의 한 단계.
 *
 * <p>{@link Outcome} 반환 규칙:</p>
 * <ul>
 *   <li>Ok: 단계 성공</li>
 *   <li>Retry: 백오프 후 다시 시도 (maxAttempts까지)</li>
 *   <li>Fail: 재시도 없이 단계 실패</li>
 * </ul>
 *
 * <p>던진 예외는 Fail로 기록됩니다.</p>
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
public interface PipelineStage {

    /**
     * 단계 이름. Session Entry의 ingestSrc로 기록됩니다.
     *
     * @return 이름
     */
    String name();

    /**
     * 단계 실행.
     *
     * @param context 시도 단위 컨텍스트
     * @return 실행 결과
     * @throws Exception 실행 실패
     */
    Outcome execute(StageContext context) throws Exception;
}
