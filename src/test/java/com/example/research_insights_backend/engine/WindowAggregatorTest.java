package com.example.research_insights_backend.engine;

import com.example.research_insights_backend.model.TopicWindow;
import com.example.research_insights_backend.model.Work;
import com.example.research_insights_backend.model.YearRange;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class WindowAggregatorTest {

    private static Work work(Integer year, Integer citations, String... topics) {
        Work work = new Work();
        work.setYear(year);
        work.setCitations(citations);
        work.setTopicsList(Arrays.asList(topics));
        return work;
    }

    @Test
    public void testWindowBoundsAreInclusive() {
        Work w = work(2015, 7, "X");

        assertTrue(WindowAggregator.aggregate(Collections.singletonList(w), 2010, 2015).containsKey("X"));
        assertTrue(WindowAggregator.aggregate(Collections.singletonList(w), 2015, 2020).containsKey("X"));
        assertFalse(WindowAggregator.aggregate(Collections.singletonList(w), 2010, 2014).containsKey("X"));
        assertFalse(WindowAggregator.aggregate(Collections.singletonList(w), 2016, 2020).containsKey("X"));
    }

    @Test
    public void testOpenBoundsAndMissingYear() {
        Map<String, TopicWindow> result = WindowAggregator.aggregate(Arrays.asList(
                work(1999, 1, "X"),
                work(2030, 2, "X"),
                work(null, 100, "X", "Y")), YearRange.unbounded());

        assertEquals(new TopicWindow(2, 3L), result.get("X"));
        // 无年份的文献不计入任何窗口，其主题也不会出现
        assertFalse(result.containsKey("Y"));
    }

    @Test
    public void testDuplicateTopicsCountOncePerWork() {
        Map<String, TopicWindow> result = WindowAggregator.aggregate(Arrays.asList(
                work(2012, 3, "X", "X", "", "Y"),
                work(2013, null, "X")), 2010, 2013);

        assertEquals(new TopicWindow(2, 3L), result.get("X"));
        assertEquals(new TopicWindow(1, 3L), result.get("Y"));
        assertEquals(2, result.size());
    }

    @Test
    public void testNegativeCitationsCountAsZero() {
        Map<String, TopicWindow> result = WindowAggregator.aggregate(
                Collections.singletonList(work(2012, -5, "X")), null, null);

        assertEquals(new TopicWindow(1, 0L), result.get("X"));
    }
}
