package com.example.research_insights_backend.model;

/**
 * 洞察配置快照：分类阈值 + 默认对比区间。整体替换，不做原地修改。
 */
public final class InsightSettings {
    private final InsightThresholds thresholds;
    private final YearRange defaultPeriodA;
    private final YearRange defaultPeriodB;

    public InsightSettings(InsightThresholds thresholds, YearRange defaultPeriodA, YearRange defaultPeriodB) {
        this.thresholds = thresholds == null ? InsightThresholds.defaults() : thresholds;
        this.defaultPeriodA = defaultPeriodA == null ? YearRange.unbounded() : defaultPeriodA;
        this.defaultPeriodB = defaultPeriodB == null ? YearRange.unbounded() : defaultPeriodB;
    }

    public static InsightSettings defaults() {
        return new InsightSettings(InsightThresholds.defaults(), YearRange.unbounded(), YearRange.unbounded());
    }

    public InsightThresholds getThresholds() {
        return thresholds;
    }

    public YearRange getDefaultPeriodA() {
        return defaultPeriodA;
    }

    public YearRange getDefaultPeriodB() {
        return defaultPeriodB;
    }
}
