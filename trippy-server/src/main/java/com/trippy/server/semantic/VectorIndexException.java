package com.trippy.server.semantic;

/**
 * Embedding / 向量索引调用失败。只在语义检索适配层内部流转，由 {@link VectorSemanticSimilarityProvider} 捕获并降级。
 */
public class VectorIndexException extends RuntimeException {

    /**
     * 失败类型，用作指标 tag：timeout / http_503 / bad_response / config_missing / exception ...
     */
    private final String errorType;

    private final int statusCode;

    public VectorIndexException(String errorType, int statusCode, String message) {
        super(message);
        this.errorType = errorType;
        this.statusCode = statusCode;
    }

    public VectorIndexException(String errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
        this.statusCode = 0;
    }

    public String getErrorType() {
        return errorType;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
