package com.example.research_insights_backend.engine;

import com.example.research_insights_backend.model.TopicInsight;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 洞察结果排序，所有分支共用同一套比较规则，排序稳定。
 */
public final class InsightSorter {

    private InsightSorter() {
    }

    /**
     * 单期模式下只允许 topic / pubsA / citesA，其它字段退回 pubsA
     */
    public static InsightSortKey resolve(InsightSortKey requested, boolean compareMode) {
        InsightSortKey key = requested == null ? InsightSortKey.PUBS_B : requested;
        if (!compareMode && !key.isSinglePeriod()) {
            return InsightSortKey.PUBS_A;
        }
        return key;
    }

    public static List<TopicInsight> sort(List<TopicInsight> rows, InsightSortKey key, SortDirection direction) {
        List<TopicInsight> sorted = new ArrayList<>(rows);
        sorted.sort(comparator(key, direction == null ? SortDirection.DESC : direction));
        return sorted;
    }

    static Comparator<TopicInsight> comparator(InsightSortKey key, SortDirection direction) {
        if (key.isNumeric()) {
            return RankingComparator.comparing(key.getNumericKey(), direction);
        }
        Comparator<TopicInsight> text = key == InsightSortKey.TOPIC
                ? Comparator.comparing(TopicInsight::getTopic, String.CASE_INSENSITIVE_ORDER)
                : Comparator.comparing(TopicInsight::getInsight, String.CASE_INSENSITIVE_ORDER);
        return direction == SortDirection.DESC ? text.reversed() : text;
    }
}
