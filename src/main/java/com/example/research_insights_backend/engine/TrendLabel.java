package com.example.research_insights_backend.engine;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 主题趋势分类结果，共八种且互斥。category 用于首页汇总计数。
 */
public enum TrendLabel {
    EMERGING("Emerging in period B", "emerging"),
    ABSENT("Absent in period B", "declining"),
    STRONG_SURGE("Strong surge in output and impact", "strongSurge"),
    GROWING_PRIORITY("Growing priority with rising impact", "growingPriority"),
    OUTPUT_SOFTENING("Output rising, impact softening", "outputSoftening"),
    DECLINING("Declining emphasis", "declining"),
    IMPACT_LED("Impact rising faster than output", "impactLed"),
    STABLE("Stable focus", "stable");

    private final String text;
    private final String category;

    TrendLabel(String text, String category) {
        this.text = text;
        this.category = category;
    }

    @JsonValue
    public String getText() {
        return text;
    }

    public String getCategory() {
        return category;
    }

    @Override
    public String toString() {
        return text;
    }
}
