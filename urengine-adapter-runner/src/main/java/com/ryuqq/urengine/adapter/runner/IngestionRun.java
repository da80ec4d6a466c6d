package com.ryuqq.urengine.adapter.runner;

import com.ryuqq.urengine.core.ingest.IngestionSummary;
import com.ryuqq.urengine.core.model.IngestPathId;
import com.ryuqq.urengine.core.model.IngestSessionId;

/**
 * 디렉토리 수집 한 번의 결과.
 *
 * @param sessionId 수집 세션
 * @param pathId 등록된 루트 경로
 * @param summary 종료 시점 요약
 * @author Resource Engine Team
 * @since 1.0.0
 */
public record IngestionRun(
    IngestSessionId sessionId,
    IngestPathId pathId,
    IngestionSummary summary
) {
}
