package com.example.research_insights_backend.engine;

/**
 * 两个时期计数之比（B / A），对零值有明确约定，不会抛异常也不会返回负数。
 */
public final class GrowthCalculator {

    private GrowthCalculator() {
    }

    /**
     * A=0 且 B>0 返回正无穷；A=0 且 B=0 返回0；否则返回 B/A。
     * 负数输入按0处理。
     */
    public static double growth(long a, long b) {
        long base = Math.max(0L, a);
        long next = Math.max(0L, b);
        if (base == 0L) {
            return next > 0L ? Double.POSITIVE_INFINITY : 0d;
        }
        return (double) next / base;
    }
}
