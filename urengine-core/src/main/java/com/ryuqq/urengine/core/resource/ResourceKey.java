package com.ryuqq.urengine.core.resource;

import com.ryuqq.urengine.core.model.ContentDigest;
import com.ryuqq.urengine.core.model.DeviceId;

/**
 * Uniform Resource 중복 제거 키.
 *
 * <p>dedup은 Device 범위입니다. 같은 바이트라도 다른 Device에서 오면 별도 리소스입니다.</p>
 *
 * @param deviceId 소유 Device
 * @param contentDigest 콘텐츠 digest
 * @param uri 정규화된 위치
 * @param sizeBytes 바이트 크기
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
public record ResourceKey(
    DeviceId deviceId,
    ContentDigest contentDigest,
    String uri,
    long sizeBytes
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 값이 null인 경우
     */
    public ResourceKey {
        if (deviceId == null || contentDigest == null || uri == null) {
            throw new IllegalArgumentException("deviceId, contentDigest and uri cannot be null");
        }
    }
}
