package com.ryuqq.urengine.application.ingest;

import com.ryuqq.urengine.core.exception.ReferentialException;
import com.ryuqq.urengine.core.ingest.SourceKind;
import com.ryuqq.urengine.core.spi.SourceAdapter;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * SourceKind별 Source Adapter 등록부.
 *
 * <p>한 SourceKind에는 하나의 어댑터만 등록됩니다. 다시 등록하면 교체됩니다.</p>
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
public final class SourceAdapterRegistry {

    private final Map<SourceKind, SourceAdapter> adapters = new ConcurrentHashMap<>();

    /**
     * 어댑터 등록.
     *
     * @param adapter 어댑터
     * @return 이 registry (chaining)
     */
    public SourceAdapterRegistry register(SourceAdapter adapter) {
        if (adapter == null) {
            throw new IllegalArgumentException("adapter cannot be null");
        }
        if (adapter.kind() == null) {
            throw new IllegalArgumentException("adapter kind cannot be null");
        }
        adapters.put(adapter.kind(), adapter);
        return this;
    }

    public Optional<SourceAdapter> find(SourceKind kind) {
        return Optional.ofNullable(adapters.get(kind));
    }

    /**
     * 어댑터 조회.
     *
     * @param kind SourceKind
     * @return 어댑터
     * @throws ReferentialException 등록된 어댑터가 없는 경우
     */
    public SourceAdapter require(SourceKind kind) {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        SourceAdapter adapter = adapters.get(kind);
        if (adapter == null) {
            throw new ReferentialException("SourceAdapter", kind.name());
        }
        return adapter;
    }
}
