package com.ryuqq.urengine.core.ingest;

import com.ryuqq.urengine.core.model.Housekeeping;
import com.ryuqq.urengine.core.model.IngestPathId;
import com.ryuqq.urengine.core.model.IngestSessionId;
import com.ryuqq.urengine.core.model.PathEntryId;
import com.ryuqq.urengine.core.model.ResourceId;
import com.ryuqq.urengine.core.model.SoftDeletable;
import com.ryuqq.urengine.core.statemachine.PathEntryState;

/**
 * 세션 안에서 발견된 하나의 경로와 그 처리 결과.
 *
 * <p>{@code (sessionId, pathId, absPath)}로 유일합니다. 처리가 끝난 시점의 결과만 저장되며
 * {@code state}는 항상 종료 상태입니다.</p>
 *
 * @param id 엔트리 ID
 * @param sessionId 소유 세션
 * @param pathId 루트 경로
 * @param absPath 절대 경로
 * @param relPath 루트 기준 상대 경로
 * @param relParent 상대 경로의 부모 ("" 가능)
 * @param basename 파일명
 * @param extension 확장자 (없으면 null)
 * @param capturedExecutable 실행 결과 캡처 (JSON, null 가능)
 * @param state 종료 상태
 * @param status 처리 결과
 * @param diagnostics 진단 정보 (JSON, null 가능)
 * @param transformations 적용된 변환/규칙 (JSON, null 가능)
 * @param resourceId 해석된 리소스 (ADMITTED/DUPLICATE일 때)
 * @param housekeeping housekeeping envelope
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
public record PathEntry(
    PathEntryId id,
    IngestSessionId sessionId,
    IngestPathId pathId,
    String absPath,
    String relPath,
    String relParent,
    String basename,
    String extension,
    String capturedExecutable,
    PathEntryState state,
    PathEntryStatus status,
    String diagnostics,
    String transformations,
    ResourceId resourceId,
    Housekeeping housekeeping
) implements SoftDeletable {

    public PathEntry {
        if (id == null || sessionId == null || pathId == null || housekeeping == null) {
            throw new IllegalArgumentException("id, sessionId, pathId and housekeeping cannot be null");
        }
        if (absPath == null || absPath.isBlank()) {
            throw new IllegalArgumentException("absPath cannot be null or blank");
        }
        if (status == null || state == null) {
            throw new IllegalArgumentException("status and state cannot be null");
        }
        if (relPath == null) {
            relPath = absPath;
        }
    }

    /**
     * 유일 키.
     *
     * @return (sessionId, pathId, absPath)
     */
    public Key key() {
        return new Key(sessionId, pathId, absPath);
    }

    /**
     * 상대 경로에서 부모 디렉터리 부분 추출.
     *
     * @param relPath 상대 경로 ('/' 또는 '\' 구분)
     * @return 부모 경로 (없으면 "")
     */
    public static String parentOf(String relPath) {
        String normalized = relPath.replace('\\', '/');
        int slash = normalized.lastIndexOf('/');
        return slash < 0 ? "" : normalized.substring(0, slash);
    }

    /**
     * 상대 경로에서 파일명 추출.
     *
     * @param relPath 상대 경로
     * @return 파일명
     */
    public static String basenameOf(String relPath) {
        String normalized = relPath.replace('\\', '/');
        return normalized.substring(normalized.lastIndexOf('/') + 1);
    }

    /**
     * 파일명에서 확장자 추출.
     *
     * @param basename 파일명
     * @return 확장자 (점 제외), 없거나 숨김 파일이면 null
     */
    public static String extensionOf(String basename) {
        int dot = basename.lastIndexOf('.');
        return dot <= 0 || dot == basename.length() - 1 ? null : basename.substring(dot + 1);
    }

    /**
     * Path Entry 유일 키.
     *
     * @param sessionId 세션
     * @param pathId 루트 경로
     * @param absPath 절대 경로
     */
    public record Key(IngestSessionId sessionId, IngestPathId pathId, String absPath) {
    }
}
