package com.trippy.server.semantic;

import com.fasterxml.jackson.databind.JsonNode;
import com.trippy.common.properties.VectorProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pinecone 兼容的向量索引 REST 客户端（数据面：/vectors/upsert、/query）。
 */
@Component
@RequiredArgsConstructor
public class VectorIndexClient {

    private final VectorProperties vectorProperties;
    private final VectorHttpClient vectorHttpClient;

    public boolean isConfigured() {
        return StringUtils.hasText(vectorProperties.getIndexHost());
    }

    public void upsert(List<VectorRecord> records) {
        if (records == null || records.isEmpty()) {
            return;
        }
        Map<String, Object> body = new HashMap<>();
        body.put("vectors", records);
        putNamespace(body);
        vectorHttpClient.postJson(url("/vectors/upsert"), headers(), body);
    }

    public List<VectorMatch> query(List<Double> vector, int topK) {
        Map<String, Object> body = new HashMap<>();
        body.put("vector", vector);
        body.put("topK", Math.max(1, topK));
        body.put("includeMetadata", true);
        putNamespace(body);

        JsonNode root = vectorHttpClient.postJson(url("/query"), headers(), body);
        JsonNode matches = root.get("matches");
        if (matches == null || !matches.isArray()) {
            return List.of();
        }
        List<VectorMatch> result = new ArrayList<>(matches.size());
        for (JsonNode m : matches) {
            Map<String, String> metadata = new LinkedHashMap<>();
            JsonNode meta = m.get("metadata");
            if (meta != null && meta.isObject()) {
                meta.fields().forEachRemaining(e -> metadata.put(e.getKey(), e.getValue().asText()));
            }
            result.add(new VectorMatch(m.path("id").asText(null), m.path("score").asDouble(0.0), metadata));
        }
        return result;
    }

    private void putNamespace(Map<String, Object> body) {
        if (StringUtils.hasText(vectorProperties.getNamespace())) {
            body.put("namespace", vectorProperties.getNamespace());
        }
    }

    private String url(String path) {
        String host = vectorProperties.getIndexHost();
        if (!StringUtils.hasText(host)) {
            return null;
        }
        return host.endsWith("/") ? host.substring(0, host.length() - 1) + path : host + path;
    }

    private Map<String, String> headers() {
        Map<String, String> headers = new HashMap<>();
        if (StringUtils.hasText(vectorProperties.getIndexApiKey())) {
            headers.put("Api-Key", vectorProperties.getIndexApiKey());
        }
        return headers;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class VectorRecord {
        private String id;
        private List<Double> values;
        private Map<String, String> metadata;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class VectorMatch {
        private String id;
        private double score;
        private Map<String, String> metadata;
    }
}
