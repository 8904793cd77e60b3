package com.trippy.server.config;

import com.trippy.common.properties.VectorProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Duration;

/**
 * 语义检索 HTTP 客户端配置：
 * - 使用 JDK 17 自带 HttpClient，Embedding 与向量索引共用一个连接池；
 * - 超时由 VectorProperties 控制。
 */
@Configuration
@RequiredArgsConstructor
public class VectorHttpClientConfig {

    private final VectorProperties vectorProperties;

    @Bean
    public HttpClient vectorHttpClient() {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(vectorProperties.getConnectTimeoutMs()))
                .version(HttpClient.Version.HTTP_1_1)
                .build();
    }
}
