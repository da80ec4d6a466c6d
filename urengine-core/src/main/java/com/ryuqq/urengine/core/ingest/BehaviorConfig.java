package com.ryuqq.urengine.core.ingest;

import com.ryuqq.urengine.core.validation.StructuredPayloadValidator;

/**
 * Device별 수집 behavior 설정.
 *
 * <p>{@code (deviceId, name)}로 유일하며, 세션을 열 때 어댑터({@link SourceKind})와
 * 경로 규칙 namespace를 결정합니다.</p>
 *
 * <p><strong>기본값:</strong></p>
 * <ul>
 *   <li>name: {@value #DEFAULT_NAME}</li>
 *   <li>sourceKind: FILESYSTEM</li>
 *   <li>ruleNamespace: {@value #DEFAULT_NAMESPACE}</li>
 *   <li>confJson: null</li>
 * </ul>
 *
 * @param name behavior 이름
 * @param sourceKind 어댑터 종류
 * @param ruleNamespace 경로 규칙 namespace
 * @param confJson behavior 설정 (JSON, null 가능)
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
public record BehaviorConfig(
    String name,
    SourceKind sourceKind,
    String ruleNamespace,
    String confJson
) {

    public static final String DEFAULT_NAME = "default";
    public static final String DEFAULT_NAMESPACE = "default";

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 값이 비어 있는 경우
     * @throws com.ryuqq.urengine.core.exception.ValidationException confJson이 JSON이 아닌 경우
     */
    public BehaviorConfig {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (sourceKind == null) {
            throw new IllegalArgumentException("sourceKind cannot be null");
        }
        if (ruleNamespace == null || ruleNamespace.isBlank()) {
            throw new IllegalArgumentException("ruleNamespace cannot be null or blank");
        }
        StructuredPayloadValidator.requireValid("confJson", confJson);
    }

    /**
     * 기본 설정 생성.
     */
    public BehaviorConfig() {
        this(DEFAULT_NAME, SourceKind.FILESYSTEM, DEFAULT_NAMESPACE, null);
    }

    public BehaviorConfig withName(String newName) {
        return new BehaviorConfig(newName, sourceKind, ruleNamespace, confJson);
    }

    public BehaviorConfig withSourceKind(SourceKind newKind) {
        return new BehaviorConfig(name, newKind, ruleNamespace, confJson);
    }

    public BehaviorConfig withRuleNamespace(String newNamespace) {
        return new BehaviorConfig(name, sourceKind, newNamespace, confJson);
    }

    public BehaviorConfig withConfJson(String newConfJson) {
        return new BehaviorConfig(name, sourceKind, ruleNamespace, newConfJson);
    }
}
