package com.example.research_insights_backend.model;

import java.util.Locale;

/**
 * 屏蔽规则的作用范围
 */
public enum ExclusionScope {
    GLOBAL("global"),
    PER_AUTHOR("per-author");

    private final String token;

    ExclusionScope(String token) {
        this.token = token;
    }

    public String getToken() {
        return token;
    }

    /**
     * 解析屏蔽名单中的 scope 列，只有字面量 per-author 表示按作者屏蔽，其余一律视为全局。
     */
    public static ExclusionScope fromToken(String raw) {
        if (raw == null) {
            return GLOBAL;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (ExclusionScope scope : values()) {
            if (scope.getToken().equals(normalized)) {
                return scope;
            }
        }
        return GLOBAL;
    }
}
