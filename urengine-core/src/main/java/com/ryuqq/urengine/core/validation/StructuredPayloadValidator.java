package com.ryuqq.urengine.core.validation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.urengine.core.exception.ValidationException;

import java.util.Map;

/**
 * 구조화 payload(JSON 텍스트) 필드의 쓰기 시점 검증.
 *
 * <p>모든 구조화 필드는 유효한 JSON이거나 null이어야 합니다. 빈 문자열과
 * 값 뒤에 남는 토큰은 거부됩니다. 저장소는 어떤 쓰기보다도 먼저 이 검증을 수행합니다.</p>
 *
 * <p>진단/변환 기록 등 엔진이 직접 만드는 JSON도 이 클래스의 {@link #toJson(Map)}로 생성합니다.</p>
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
public final class StructuredPayloadValidator {

    private static final JsonMapper MAPPER = JsonMapper.builder()
        .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
        .build();

    // Utility class - prevent instantiation
    private StructuredPayloadValidator() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 필드 값이 JSON인지 검증.
     *
     * @param field 필드명 (오류 메시지용)
     * @param json 검증할 값 (null 허용)
     * @throws ValidationException 파싱할 수 없는 경우
     */
    public static void requireValid(String field, String json) {
        if (json == null) {
            return;
        }
        if (json.isBlank()) {
            throw new ValidationException(field, "structured payload cannot be blank");
        }
        try {
            JsonNode node = MAPPER.readTree(json);
            if (node == null || node.isMissingNode()) {
                throw new ValidationException(field, "structured payload is empty");
            }
        } catch (JsonProcessingException e) {
            throw new ValidationException(field, "malformed structured payload: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * null이 아닌 JSON 필드 검증.
     *
     * @param field 필드명
     * @param json 검증할 값
     * @throws ValidationException null이거나 파싱할 수 없는 경우
     */
    public static void requirePresent(String field, String json) {
        if (json == null) {
            throw new ValidationException(field, "structured payload is required");
        }
        requireValid(field, json);
    }

    /**
     * JSON 유효성 여부 확인 (예외 없이).
     *
     * @param json 검사할 값
     * @return null이거나 유효한 JSON이면 true
     */
    public static boolean isValid(String json) {
        try {
            requireValid("payload", json);
            return true;
        } catch (ValidationException e) {
            return false;
        }
    }

    /**
     * 단순 key/value 맵을 JSON 객체 문자열로 직렬화.
     *
     * <p>null 값은 생략합니다.</p>
     *
     * @param fields 필드 맵 (삽입 순서 유지 권장)
     * @return JSON 객체 문자열
     */
    public static String toJson(Map<String, ?> fields) {
        ObjectNode node = MAPPER.createObjectNode();
        fields.forEach((key, value) -> {
            if (value == null) {
                return;
            }
            if (value instanceof Integer || value instanceof Long) {
                node.put(key, ((Number) value).longValue());
            } else if (value instanceof Number number) {
                node.put(key, number.doubleValue());
            } else if (value instanceof Boolean bool) {
                node.put(key, bool);
            } else {
                node.put(key, value.toString());
            }
        });
        try {
            return MAPPER.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize structured payload", e);
        }
    }
}
