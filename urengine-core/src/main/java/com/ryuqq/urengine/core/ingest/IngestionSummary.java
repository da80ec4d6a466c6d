package com.ryuqq.urengine.core.ingest;

/**
 * 수집 세션 결과 집계.
 *
 * @param admitted 신규 수집 수
 * @param duplicate 기존 리소스로 해석된 수
 * @param rejected glob/규칙으로 거부된 수
 * @param errored 오류 수
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
public record IngestionSummary(
    long admitted,
    long duplicate,
    long rejected,
    long errored
) {

    public IngestionSummary {
        if (admitted < 0 || duplicate < 0 || rejected < 0 || errored < 0) {
            throw new IllegalArgumentException("counts must be non-negative");
        }
    }

    public static IngestionSummary empty() {
        return new IngestionSummary(0, 0, 0, 0);
    }

    /**
     * 기록된 전체 엔트리 수.
     *
     * @return 합계
     */
    public long total() {
        return admitted + duplicate + rejected + errored;
    }
}
