package com.ryuqq.urengine.core.ingest;

/**
 * Source Adapter 종류.
 *
 * <p>Behavior 설정의 SourceKind로 세션이 사용할 어댑터가 결정됩니다.</p>
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
public enum SourceKind {

    /**
     * 파일 시스템 트리.
     */
    FILESYSTEM,

    /**
     * 메일함 메시지 (IMAP 등).
     */
    MAILBOX,

    /**
     * 이슈 트래커 프로젝트/이슈.
     */
    ISSUE_TRACKER,

    /**
     * 엔드포인트 텔레메트리.
     */
    ENDPOINT_TELEMETRY,

    /**
     * 네트워크 텔레메트리.
     */
    NETWORK_TELEMETRY
}
