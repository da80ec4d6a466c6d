package com.ryuqq.urengine.core.ingest;

import com.ryuqq.urengine.core.model.Housekeeping;
import com.ryuqq.urengine.core.model.IngestPathId;
import com.ryuqq.urengine.core.model.IngestSessionId;
import com.ryuqq.urengine.core.model.SoftDeletable;

import java.util.List;

/**
 * 세션 안에서 탐색하는 루트 경로 또는 동등한 컨테이너 위치.
 *
 * <p>메일함 폴더, 이슈 프로젝트, 텔레메트리 노드 등도 rootPath로 표현합니다.
 * {@code (sessionId, rootPath, createdAt)}로 유일합니다.</p>
 *
 * @param id 경로 ID
 * @param sessionId 소유 세션
 * @param rootPath 루트 위치
 * @param includeGlobs 포함 glob (비어 있으면 전부 포함)
 * @param excludeGlobs 제외 glob
 * @param elaboration 부가 정보 (JSON, null 가능)
 * @param housekeeping housekeeping envelope
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
public record IngestPath(
    IngestPathId id,
    IngestSessionId sessionId,
    String rootPath,
    List<String> includeGlobs,
    List<String> excludeGlobs,
    String elaboration,
    Housekeeping housekeeping
) implements SoftDeletable {

    public IngestPath {
        if (id == null || sessionId == null || housekeeping == null) {
            throw new IllegalArgumentException("id, sessionId and housekeeping cannot be null");
        }
        if (rootPath == null || rootPath.isBlank()) {
            throw new IllegalArgumentException("rootPath cannot be null or blank");
        }
        includeGlobs = includeGlobs == null ? List.of() : List.copyOf(includeGlobs);
        excludeGlobs = excludeGlobs == null ? List.of() : List.copyOf(excludeGlobs);
    }
}
