package com.example.research_insights_backend.model;

import java.util.Objects;

/**
 * 闭区间年份范围，from/to 为空表示该端不限。
 */
public class YearRange {
    private final Integer from;
    private final Integer to;

    public YearRange(Integer from, Integer to) {
        this.from = from;
        this.to = to;
    }

    public static YearRange unbounded() {
        return new YearRange(null, null);
    }

    public Integer getFrom() {
        return from;
    }

    public Integer getTo() {
        return to;
    }

    /**
     * 年份是否落在区间内（两端均包含）
     */
    public boolean contains(Integer year) {
        if (year == null) {
            return false;
        }
        if (from != null && year < from) {
            return false;
        }
        return to == null || year <= to;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof YearRange)) return false;
        YearRange that = (YearRange) o;
        return Objects.equals(from, that.from) && Objects.equals(to, that.to);
    }

    @Override
    public int hashCode() {
        return Objects.hash(from, to);
    }

    @Override
    public String toString() {
        return "[" + (from == null ? "" : from) + "," + (to == null ? "" : to) + "]";
    }
}
