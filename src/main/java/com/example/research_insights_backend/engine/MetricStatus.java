package com.example.research_insights_backend.engine;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 单项指标（发文数或被引数）变化幅度的档位
 */
public enum MetricStatus {
    EMERGING("Emerging"),
    ABSENT("Absent"),
    RISING("Rising"),
    UP("Up"),
    STABLE("Stable"),
    SOFTENING("Softening"),
    DECLINING("Declining"),
    NOT_AVAILABLE("N/A");

    private final String text;

    MetricStatus(String text) {
        this.text = text;
    }

    @JsonValue
    public String getText() {
        return text;
    }
}
