package com.trippy.server.semantic;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.trippy.common.properties.VectorProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Map;

/**
 * 语义检索相关外部接口的极简 JSON-over-HTTP 调用器。
 * Minimal JSON POST helper shared by the embedding and vector index clients.
 *
 * - 超时由 VectorProperties 控制；
 * - 仅对 429 / 5xx / 超时 重试，不做退避；
 * - 最终失败抛出 {@link VectorIndexException}，由适配层统一降级。
 */
@Component
@Slf4j
public class VectorHttpClient {

    private final VectorProperties vectorProperties;
    private final ObjectMapper objectMapper;
    private final HttpClient vectorHttpClient;

    public VectorHttpClient(VectorProperties vectorProperties,
                            ObjectMapper objectMapper,
                            @Qualifier("vectorHttpClient") HttpClient vectorHttpClient) {
        this.vectorProperties = vectorProperties;
        this.objectMapper = objectMapper;
        this.vectorHttpClient = vectorHttpClient;
    }

    public JsonNode postJson(String url, Map<String, String> headers, Object body) {
        if (!StringUtils.hasText(url)) {
            throw new VectorIndexException("config_missing", 0, "url is empty");
        }
        String json;
        try {
            json = objectMapper.writeValueAsString(body);
        } catch (Exception e) {
            throw new VectorIndexException("serialize", "序列化请求体失败", e);
        }

        int maxAttempts = 1 + Math.max(0, vectorProperties.getMaxRetries());
        VectorIndexException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return doPost(url, headers, json);
            } catch (VectorIndexException e) {
                last = e;
                if (!isRetriable(e) || attempt == maxAttempts) {
                    break;
                }
                log.debug("向量接口调用失败，准备重试: url={}, attempt={}, errorType={}", url, attempt, e.getErrorType());
            }
        }
        throw last;
    }

    private JsonNode doPost(String url, Map<String, String> headers, String json) {
        try {
            HttpRequest.Builder builder = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .timeout(Duration.ofMillis(Math.max(1, vectorProperties.getRequestTimeoutMs())))
                    .header("Content-Type", "application/json");
            if (headers != null) {
                headers.forEach(builder::header);
            }
            HttpRequest request = builder.POST(HttpRequest.BodyPublishers.ofString(json)).build();

            HttpResponse<String> response = vectorHttpClient.send(request, HttpResponse.BodyHandlers.ofString());
            int code = response.statusCode();
            String respBody = response.body();
            if (code / 100 != 2) {
                throw new VectorIndexException("http_" + code, code, "unexpected status " + code);
            }
            if (!StringUtils.hasText(respBody)) {
                return objectMapper.createObjectNode();
            }
            return objectMapper.readTree(respBody);
        } catch (VectorIndexException e) {
            throw e;
        } catch (HttpTimeoutException e) {
            throw new VectorIndexException("timeout", "请求超时: " + url, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new VectorIndexException("interrupted", "请求被中断: " + url, e);
        } catch (Exception e) {
            throw new VectorIndexException("exception", "请求失败: " + url, e);
        }
    }

    private boolean isRetriable(VectorIndexException e) {
        if ("timeout".equals(e.getErrorType())) {
            return true;
        }
        int status = e.getStatusCode();
        return status == 429 || status / 100 == 5;
    }
}
