package com.example.research_insights_backend.engine;

/**
 * 两期之间的相对变化 (B-A)/A 及其展示形式。
 * 返回 null 表示未定义（单期模式下不做对比）。
 */
public final class DeltaCalculator {

    private static final double RISING = 0.5;
    private static final double UP = 0.2;

    private DeltaCalculator() {
    }

    /**
     * A=0,B>0 为正无穷；A=0,B=0 为0；A>0,B=0 为负无穷；否则 (B-A)/A
     */
    public static double delta(long a, long b) {
        if (a <= 0L) {
            return b > 0L ? Double.POSITIVE_INFINITY : 0d;
        }
        if (b <= 0L) {
            return Double.NEGATIVE_INFINITY;
        }
        return (double) (b - a) / a;
    }

    public static MetricStatus status(Double delta) {
        if (delta == null || delta.isNaN()) {
            return MetricStatus.NOT_AVAILABLE;
        }
        if (delta == Double.POSITIVE_INFINITY) {
            return MetricStatus.EMERGING;
        }
        if (delta == Double.NEGATIVE_INFINITY) {
            return MetricStatus.ABSENT;
        }
        if (delta >= RISING) return MetricStatus.RISING;
        if (delta >= UP) return MetricStatus.UP;
        if (delta <= -RISING) return MetricStatus.DECLINING;
        if (delta <= -UP) return MetricStatus.SOFTENING;
        return MetricStatus.STABLE;
    }

    /**
     * 百分比文本：New / Absent / N/A / Stable / +50% / -25%
     */
    public static String format(Double delta) {
        if (delta == null || delta.isNaN()) {
            return "N/A";
        }
        if (delta == Double.POSITIVE_INFINITY) {
            return "New";
        }
        if (delta == Double.NEGATIVE_INFINITY) {
            return "Absent";
        }
        long pct = Math.round(delta * 100);
        if (pct == 0L) {
            return "Stable";
        }
        return (pct > 0 ? "+" : "") + pct + "%";
    }
}
