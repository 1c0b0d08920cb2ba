package com.demo.tokenauth.token;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 将 metadata 规整为 JSON 读回后的类型（整数 -> Integer/Long，小数 -> Double，对象 -> Map）。
 * <p>
 * 签发前与校验后的 claims 因此持有相同类型的值，可直接 equals 比较。
 */
final class MetadataValues {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private MetadataValues() {
    }

    static Map<String, Object> normalize(Map<String, Object> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return Map.of();
        }
        try {
            LinkedHashMap<String, Object> json = MAPPER.readValue(MAPPER.writeValueAsBytes(metadata), MAP_TYPE);
            return Collections.unmodifiableMap(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("metadata must be JSON serializable", e);
        } catch (IOException e) {
            throw new IllegalStateException(e);
        }
    }
}
