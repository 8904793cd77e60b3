package com.trippy.server.semantic;

import com.fasterxml.jackson.databind.JsonNode;
import com.trippy.common.properties.VectorProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * OpenAI 兼容的 Embedding 客户端。
 * Calls an OpenAI-compatible /embeddings endpoint with a batch of texts.
 */
@Component
@RequiredArgsConstructor
public class EmbeddingClient {

    private final VectorProperties vectorProperties;
    private final VectorHttpClient vectorHttpClient;

    public boolean isConfigured() {
        return StringUtils.hasText(vectorProperties.getEmbeddingUrl())
                && StringUtils.hasText(vectorProperties.getEmbeddingModel());
    }

    /**
     * 批量生成向量，返回顺序与入参一致。
     */
    public List<List<Double>> embed(List<String> texts) {
        if (texts == null || texts.isEmpty()) {
            return List.of();
        }
        Map<String, Object> body = new HashMap<>();
        body.put("model", vectorProperties.getEmbeddingModel());
        body.put("input", texts);

        Map<String, String> headers = new HashMap<>();
        if (StringUtils.hasText(vectorProperties.getEmbeddingApiKey())) {
            headers.put("Authorization", "Bearer " + vectorProperties.getEmbeddingApiKey());
        }

        JsonNode root = vectorHttpClient.postJson(vectorProperties.getEmbeddingUrl(), headers, body);
        JsonNode data = root.get("data");
        if (data == null || !data.isArray() || data.size() != texts.size()) {
            throw new VectorIndexException("bad_response", 0, "embedding count mismatch");
        }

        List<List<Double>> vectors = new ArrayList<>(texts.size());
        for (int i = 0; i < texts.size(); i++) {
            vectors.add(null);
        }
        for (int i = 0; i < data.size(); i++) {
            JsonNode entry = data.get(i);
            int index = entry.has("index") ? entry.get("index").asInt() : i;
            JsonNode embedding = entry.get("embedding");
            if (index < 0 || index >= texts.size() || embedding == null || !embedding.isArray()) {
                throw new VectorIndexException("bad_response", 0, "malformed embedding entry");
            }
            List<Double> values = new ArrayList<>(embedding.size());
            for (JsonNode v : embedding) {
                values.add(v.asDouble());
            }
            vectors.set(index, values);
        }
        if (vectors.contains(null)) {
            throw new VectorIndexException("bad_response", 0, "missing embedding");
        }
        return vectors;
    }

    public List<Double> embed(String text) {
        return embed(List.of(text)).get(0);
    }
}
