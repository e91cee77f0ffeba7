package com.example.research_insights_backend.exception;

/**
 * 查询参数不合法（未知排序字段、排序方向等），映射为 HTTP 400
 */
public class InsightQueryException extends RuntimeException {
    public InsightQueryException(String message) {
        super(message);
    }

    public InsightQueryException(String message, Throwable cause) {
        super(message, cause);
    }
}
