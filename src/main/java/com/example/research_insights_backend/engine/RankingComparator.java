package com.example.research_insights_backend.engine;

import java.util.Comparator;
import java.util.List;
import java.util.function.Function;

/**
 * 对可能为有限值、正负无穷或未定义（null）的数值建立全序，默认升序：
 * 未定义 &lt; 负无穷 &lt; 有限值 &lt; 正无穷。
 * 降序通过整体反转比较器实现，不单独处理哨兵值。
 */
public final class RankingComparator implements Comparator<Double> {

    public static final RankingComparator ASCENDING = new RankingComparator();

    private static final int UNDEFINED = 0;
    private static final int NEGATIVE_INFINITY = 1;
    private static final int FINITE = 2;
    private static final int POSITIVE_INFINITY = 3;

    private RankingComparator() {
    }

    /**
     * 排序键的类别部分，NaN 视同未定义
     */
    static int category(Double value) {
        if (value == null || value.isNaN()) {
            return UNDEFINED;
        }
        if (value == Double.NEGATIVE_INFINITY) {
            return NEGATIVE_INFINITY;
        }
        if (value == Double.POSITIVE_INFINITY) {
            return POSITIVE_INFINITY;
        }
        return FINITE;
    }

    @Override
    public int compare(Double x, Double y) {
        int cx = category(x);
        int cy = category(y);
        if (cx != cy) {
            return Integer.compare(cx, cy);
        }
        if (cx != FINITE) {
            return 0;
        }
        // -0.0 与 0.0 视为相等
        return Double.compare(x + 0.0d, y + 0.0d);
    }

    public static Comparator<Double> of(SortDirection direction) {
        return direction == SortDirection.DESC ? ASCENDING.reversed() : ASCENDING;
    }

    /**
     * 按数值键构造比较器，方向整体应用
     */
    public static <T> Comparator<T> comparing(Function<? super T, Double> key, SortDirection direction) {
        return Comparator.comparing(key, of(direction));
    }

    /**
     * 稳定排序（List.sort 为归并排序），相等元素保持原有相对顺序
     */
    public static <T> void sort(List<T> items, Function<? super T, Double> key, SortDirection direction) {
        items.sort(comparing(key, direction));
    }
}
