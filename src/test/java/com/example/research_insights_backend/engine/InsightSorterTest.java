package com.example.research_insights_backend.engine;

import com.example.research_insights_backend.model.TopicInsight;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class InsightSorterTest {

    private static TopicInsight row(String topic, long pubsA, long pubsB, Double pubsDelta, TrendLabel label) {
        TopicInsight row = new TopicInsight();
        row.setTopic(topic);
        row.setPubsA(pubsA);
        row.setPubsB(pubsB);
        row.setPubsDelta(pubsDelta);
        row.setLabel(label);
        return row;
    }

    private static List<String> topics(List<TopicInsight> rows) {
        return rows.stream().map(TopicInsight::getTopic).collect(Collectors.toList());
    }

    @Test
    public void testResolveSortKey() {
        assertEquals(InsightSortKey.PUBS_B, InsightSorter.resolve(null, true));
        assertEquals(InsightSortKey.PUBS_A, InsightSorter.resolve(null, false));
        assertEquals(InsightSortKey.PUBS_A, InsightSorter.resolve(InsightSortKey.CITES_DELTA, false));
        assertEquals(InsightSortKey.CITES_A, InsightSorter.resolve(InsightSortKey.CITES_A, false));
        assertEquals(InsightSortKey.TOPIC, InsightSorter.resolve(InsightSortKey.TOPIC, false));
        assertEquals(InsightSortKey.INSIGHT, InsightSorter.resolve(InsightSortKey.INSIGHT, true));
    }

    @Test
    public void testParseTokens() {
        assertEquals(InsightSortKey.CITES_DELTA, InsightSortKey.fromToken(" citesdelta "));
        assertNull(InsightSortKey.fromToken(""));
        assertThrows(IllegalArgumentException.class, () -> InsightSortKey.fromToken("year"));
        assertEquals(SortDirection.ASC, SortDirection.fromToken("ASC"));
        assertNull(SortDirection.fromToken(null));
        assertThrows(IllegalArgumentException.class, () -> SortDirection.fromToken("up"));
    }

    @Test
    public void testNumericKeyUsesSentinelOrder() {
        List<TopicInsight> rows = Arrays.asList(
                row("a", 1, 2, 1.0, TrendLabel.STABLE),
                row("b", 0, 3, Double.POSITIVE_INFINITY, TrendLabel.EMERGING),
                row("c", 2, 0, Double.NEGATIVE_INFINITY, TrendLabel.ABSENT),
                row("d", 4, 4, 0.0, TrendLabel.STABLE));

        assertEquals(Arrays.asList("b", "a", "d", "c"),
                topics(InsightSorter.sort(rows, InsightSortKey.PUBS_DELTA, SortDirection.DESC)));
        assertEquals(Arrays.asList("c", "d", "a", "b"),
                topics(InsightSorter.sort(rows, InsightSortKey.PUBS_DELTA, SortDirection.ASC)));
        // 默认降序，且不修改入参
        assertEquals(Arrays.asList("d", "b", "a", "c"), topics(InsightSorter.sort(rows, InsightSortKey.PUBS_B, null)));
        assertEquals("a", rows.get(0).getTopic());
    }

    @Test
    public void testTextKeysIgnoreCase() {
        List<TopicInsight> rows = Arrays.asList(
                row("beta", 1, 1, null, TrendLabel.STABLE),
                row("Alpha", 1, 1, null, TrendLabel.EMERGING),
                row("gamma", 1, 1, null, TrendLabel.DECLINING));

        assertEquals(Arrays.asList("Alpha", "beta", "gamma"),
                topics(InsightSorter.sort(rows, InsightSortKey.TOPIC, SortDirection.ASC)));
        assertEquals(Arrays.asList("beta", "Alpha", "gamma"),
                topics(InsightSorter.sort(rows, InsightSortKey.INSIGHT, SortDirection.DESC)));
    }
}
