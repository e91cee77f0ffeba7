package com.example.research_insights_backend.engine;

import com.example.research_insights_backend.model.TopicWindow;
import com.example.research_insights_backend.model.Work;
import com.example.research_insights_backend.model.YearRange;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * 按时间窗口统计各主题的发文数与被引总数。
 * 输入应是已屏蔽、已去重的语料；无年份的文献不计入任何窗口。
 */
public final class WindowAggregator {

    private WindowAggregator() {
    }

    public static Map<String, TopicWindow> aggregate(Collection<Work> works, YearRange range) {
        YearRange window = range == null ? YearRange.unbounded() : range;
        return aggregate(works, window.getFrom(), window.getTo());
    }

    /**
     * @param works    语料
     * @param fromYear 起始年份（含），为空不限
     * @param toYear   结束年份（含），为空不限
     * @return 主题 -> 统计；窗口内没有文献的主题不会出现
     */
    public static Map<String, TopicWindow> aggregate(Collection<Work> works, Integer fromYear, Integer toYear) {
        Map<String, long[]> totals = new LinkedHashMap<>();
        if (works != null) {
            YearRange window = new YearRange(fromYear, toYear);
            for (Work work : works) {
                if (work == null || !window.contains(work.getYear())) {
                    continue;
                }
                long citations = work.getCitationCount();
                // 同一篇文献重复列出的主题只计一次
                Set<String> topics = new LinkedHashSet<>();
                for (String topic : work.getTopicsList()) {
                    if (topic != null && !topic.isEmpty()) {
                        topics.add(topic);
                    }
                }
                for (String topic : topics) {
                    long[] current = totals.computeIfAbsent(topic, t -> new long[2]);
                    current[0] += 1;
                    current[1] += citations;
                }
            }
        }

        Map<String, TopicWindow> result = new LinkedHashMap<>();
        totals.forEach((topic, counts) -> result.put(topic, new TopicWindow((int) counts[0], counts[1])));
        return result;
    }
}
