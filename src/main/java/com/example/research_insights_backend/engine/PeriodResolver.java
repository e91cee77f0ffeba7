package com.example.research_insights_backend.engine;

import com.example.research_insights_backend.model.Work;
import com.example.research_insights_backend.model.YearRange;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.TreeSet;

/**
 * 对比区间的解析：配置默认值的裁剪、按跨度生成预设区间。
 */
public final class PeriodResolver {

    private PeriodResolver() {
    }

    /**
     * 语料中出现过的年份，升序去重
     */
    public static List<Integer> distinctYears(Collection<Work> works) {
        TreeSet<Integer> years = new TreeSet<>();
        if (works != null) {
            for (Work work : works) {
                if (work != null && work.getYear() != null) {
                    years.add(work.getYear());
                }
            }
        }
        return new ArrayList<>(years);
    }

    /**
     * 把配置的区间裁剪到 [min, max]，缺失端取 min / max；裁剪后起止颠倒的配置视为无效，退回整个 [min, max]
     */
    public static YearRange resolve(YearRange configured, int min, int max) {
        YearRange source = configured == null ? YearRange.unbounded() : configured;
        int from = source.getFrom() == null ? min : clamp(source.getFrom(), min, max);
        int to = source.getTo() == null ? max : clamp(source.getTo(), min, max);
        if (from > to) {
            return new YearRange(min, max);
        }
        return new YearRange(from, to);
    }

    /**
     * 请求中显式给出的端点优先，其余取默认区间
     */
    public static YearRange override(YearRange requested, YearRange fallback) {
        if (requested == null) {
            return fallback;
        }
        Integer from = requested.getFrom() != null ? requested.getFrom() : fallback.getFrom();
        Integer to = requested.getTo() != null ? requested.getTo() : fallback.getTo();
        return new YearRange(from, to);
    }

    /**
     * 按跨度生成两个对比区间：年份不足两个跨度时对半分，否则取最近的两个跨度
     *
     * @return 长度为2的数组，[0] 为 A 期，[1] 为 B 期
     */
    public static YearRange[] preset(int min, int max, int span) {
        int total = max - min + 1;
        if (min >= max) {
            // 只有一个年份时两期相同
            YearRange only = new YearRange(min, min);
            return new YearRange[]{only, only};
        }
        if (total < span * 2) {
            int mid = Math.floorDiv(min + max, 2);
            return new YearRange[]{new YearRange(min, mid), new YearRange(mid + 1, max)};
        }
        return new YearRange[]{
                new YearRange(max - span * 2 + 1, max - span),
                new YearRange(max - span + 1, max)
        };
    }

    private static int clamp(int value, int min, int max) {
        return Math.min(Math.max(value, min), max);
    }
}
