package com.trippy.common.properties;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 语义向量检索配置：OpenAI 兼容的 Embedding 接口 + Pinecone 兼容的向量索引。
 * Semantic similarity configuration (OpenAI-compatible embeddings + Pinecone-compatible index REST API).
 */
@Data
@ConfigurationProperties(prefix = "trippy.vector")
public class VectorProperties {

    /**
     * 总开关。关闭或配置不完整时，语义信号视为不可用（返回空分数表）。
     */
    private boolean enabled = false;

    /**
     * Embedding 接口地址，例如：https://api.openai.com/v1/embeddings
     */
    private String embeddingUrl;

    private String embeddingApiKey;

    /**
     * Embedding 模型名称，例如：text-embedding-3-small。
     */
    private String embeddingModel;

    /**
     * 向量索引的数据面地址，例如：https://trippy-recommendations-xxxx.svc.pinecone.io
     */
    private String indexHost;

    private String indexApiKey;

    /**
     * 索引命名空间，可为空。
     */
    private String namespace;

    /**
     * 连接超时（毫秒）。
     */
    private int connectTimeoutMs = 1000;

    /**
     * 单次请求超时（毫秒）。语义信号是可选的，超时应偏短，避免拖慢整个排序请求。
     */
    private int requestTimeoutMs = 3000;

    /**
     * 最大重试次数（不含首次请求），仅对 429/5xx/超时生效。
     */
    private int maxRetries = 1;
}
