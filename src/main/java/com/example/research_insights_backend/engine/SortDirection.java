package com.example.research_insights_backend.engine;

/**
 * 排序方向
 */
public enum SortDirection {
    ASC,
    DESC;

    /**
     * 解析 asc / desc，空值返回 null 由调用方决定默认值
     */
    public static SortDirection fromToken(String token) {
        if (token == null || token.trim().isEmpty()) {
            return null;
        }
        for (SortDirection direction : values()) {
            if (direction.name().equalsIgnoreCase(token.trim())) {
                return direction;
            }
        }
        throw new IllegalArgumentException("未知的排序方向: " + token);
    }
}
