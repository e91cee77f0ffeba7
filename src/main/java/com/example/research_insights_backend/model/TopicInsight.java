package com.example.research_insights_backend.model;

import com.example.research_insights_backend.engine.DeltaCalculator;
import com.example.research_insights_backend.engine.MetricStatus;
import com.example.research_insights_backend.engine.TrendLabel;
import lombok.Data;

/**
 * 单个主题的两期对比结果。
 * 单期模式下 pubsDelta / citesDelta / label 均为空。
 */
@Data
public class TopicInsight {
    private String topic;
    private long pubsA;
    private long pubsB;
    private long citesA;
    private long citesB;

    // 可能为正负无穷，序列化为 "Infinity" / "-Infinity"
    private Double pubsDelta;
    private Double citesDelta;

    private TrendLabel label;

    public String getPubsDeltaText() {
        return DeltaCalculator.format(pubsDelta);
    }

    public String getCitesDeltaText() {
        return DeltaCalculator.format(citesDelta);
    }

    public MetricStatus getPubsStatus() {
        return DeltaCalculator.status(pubsDelta);
    }

    public MetricStatus getCitesStatus() {
        return DeltaCalculator.status(citesDelta);
    }

    /**
     * 分类文本，单期模式下为空串
     */
    public String getInsight() {
        return label == null ? "" : label.getText();
    }
}
