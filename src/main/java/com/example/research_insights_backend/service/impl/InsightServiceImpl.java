package com.example.research_insights_backend.service.impl;

import com.example.research_insights_backend.dto.InsightQuery;
import com.example.research_insights_backend.dto.InsightReportResponse;
import com.example.research_insights_backend.dto.InsightSummaryResponse;
import com.example.research_insights_backend.dto.PeriodPresetResponse;
import com.example.research_insights_backend.engine.DeltaCalculator;
import com.example.research_insights_backend.engine.InsightSortKey;
import com.example.research_insights_backend.engine.InsightSorter;
import com.example.research_insights_backend.engine.PeriodResolver;
import com.example.research_insights_backend.engine.SortDirection;
import com.example.research_insights_backend.engine.TrendClassifier;
import com.example.research_insights_backend.engine.TrendLabel;
import com.example.research_insights_backend.engine.WindowAggregator;
import com.example.research_insights_backend.exception.InsightQueryException;
import com.example.research_insights_backend.model.InsightSettings;
import com.example.research_insights_backend.model.InsightThresholds;
import com.example.research_insights_backend.model.TopicInsight;
import com.example.research_insights_backend.model.TopicWindow;
import com.example.research_insights_backend.model.Work;
import com.example.research_insights_backend.model.YearRange;
import com.example.research_insights_backend.service.ExclusionService;
import com.example.research_insights_backend.service.InsightConfigService;
import com.example.research_insights_backend.service.InsightService;
import com.example.research_insights_backend.service.WorkDeduplicator;
import com.example.research_insights_backend.service.WorkService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 主题趋势洞察业务实现类。
 * 流程：原始语料 → 屏蔽过滤 → 去重 → 两期分别聚合 → 分类 → 搜索过滤 → 排序。
 */
@Slf4j
@Service
public class InsightServiceImpl implements InsightService {

    @Autowired
    private WorkService workService;

    @Autowired
    private ExclusionService exclusionService;

    @Autowired
    private InsightConfigService insightConfigService;

    @Autowired
    private WorkDeduplicator workDeduplicator;

    // 首页汇总的分类键，Absent in period B 与 Declining emphasis 合并为 declining
    static final List<String> SUMMARY_CATEGORIES = Arrays.asList(
            "emerging", "declining", "strongSurge", "growingPriority", "impactLed", "outputSoftening", "stable");

    /**
     * 清洗后的语料：屏蔽 → 作者过滤 → 去重
     */
    @Override
    public List<Work> getCleanCorpus(String authorId) {
        String author = trimToNull(authorId);
        List<Work> kept = exclusionService.filterWorks(workService.getAllWorks(), author);
        if (author != null) {
            kept = kept.stream().filter(w -> w.hasAuthor(author)).collect(Collectors.toList());
        }
        return workDeduplicator.dedupe(kept);
    }

    @Override
    public InsightReportResponse query(InsightQuery query) {
        boolean compare = query.isCompareMode();
        InsightSortKey sortKey = InsightSorter.resolve(parseSortKey(query.getSortKey()), compare);
        SortDirection direction = parseDirection(query.getSortDir());

        InsightReportResponse response = new InsightReportResponse();
        response.setCompareMode(compare);
        response.setSortKey(sortKey.getToken());
        response.setSortDir(direction.name().toLowerCase(Locale.ROOT));

        List<Work> corpus = getCleanCorpus(query.getAuthorId());
        List<Integer> years = PeriodResolver.distinctYears(corpus);
        if (years.isEmpty()) {
            log.debug("语料中没有带年份的文献，返回空结果");
            return response;
        }
        int min = years.get(0);
        int max = years.get(years.size() - 1);

        // 一次请求只读一份配置快照，期间与阈值必须来自同一版本
        InsightSettings settings = insightConfigService.getSettings();
        YearRange periodA;
        YearRange periodB = null;
        if (compare) {
            periodA = PeriodResolver.override(query.getPeriodA(),
                    PeriodResolver.resolve(settings.getDefaultPeriodA(), min, max));
            periodB = PeriodResolver.override(query.getPeriodB(),
                    PeriodResolver.resolve(settings.getDefaultPeriodB(), min, max));
        } else {
            periodA = PeriodResolver.override(query.getPeriodA(), new YearRange(min, max));
        }
        response.setPeriodA(periodA);
        response.setPeriodB(periodB);

        List<TopicInsight> rows = buildInsights(corpus, periodA, periodB, settings.getThresholds());
        rows = applySearch(rows, query.getSearch(), compare);
        response.setRows(InsightSorter.sort(rows, sortKey, direction));
        log.debug("主题洞察查询完成: {}", response);
        return response;
    }

    @Override
    public InsightSummaryResponse summarize(String authorId) {
        InsightSummaryResponse summary = new InsightSummaryResponse();
        for (String category : SUMMARY_CATEGORIES) {
            summary.getCounts().put(category, 0);
        }

        List<Work> corpus = getCleanCorpus(authorId);
        List<Integer> years = PeriodResolver.distinctYears(corpus);
        if (years.isEmpty()) {
            return summary;
        }
        int min = years.get(0);
        int max = years.get(years.size() - 1);
        InsightSettings settings = insightConfigService.getSettings();
        YearRange periodA = PeriodResolver.resolve(settings.getDefaultPeriodA(), min, max);
        YearRange periodB = PeriodResolver.resolve(settings.getDefaultPeriodB(), min, max);
        summary.setPeriodA(periodA);
        summary.setPeriodB(periodB);

        int total = 0;
        for (TopicInsight row : buildInsights(corpus, periodA, periodB, settings.getThresholds())) {
            summary.getCounts().merge(row.getLabel().getCategory(), 1, Integer::sum);
            total++;
        }
        summary.setTotal(total);
        return summary;
    }

    @Override
    public PeriodPresetResponse preset(int span, String authorId) {
        if (span < 1) {
            throw new InsightQueryException("span必须为正整数");
        }
        List<Integer> years = PeriodResolver.distinctYears(getCleanCorpus(authorId));
        if (years.isEmpty()) {
            return new PeriodPresetResponse(span, null, null);
        }
        YearRange[] periods = PeriodResolver.preset(years.get(0), years.get(years.size() - 1), span);
        return new PeriodPresetResponse(span, periods[0], periods[1]);
    }

    /**
     * 两期聚合并生成每个主题一行；periodB 为空时为单期模式，不计算变化与分类
     *
     * @param thresholds 与期间取自同一配置快照的分类阈值
     */
    List<TopicInsight> buildInsights(List<Work> corpus, YearRange periodA, YearRange periodB,
                                     InsightThresholds thresholds) {
        Map<String, TopicWindow> aggA = WindowAggregator.aggregate(corpus, periodA);
        Map<String, TopicWindow> aggB = periodB == null
                ? Collections.emptyMap()
                : WindowAggregator.aggregate(corpus, periodB);
        TrendClassifier classifier = periodB == null
                ? null
                : new TrendClassifier(thresholds);

        Set<String> topics = new LinkedHashSet<>(aggA.keySet());
        topics.addAll(aggB.keySet());

        List<TopicInsight> rows = new ArrayList<>();
        for (String topic : topics) {
            TopicWindow a = aggA.getOrDefault(topic, TopicWindow.EMPTY);
            TopicWindow b = aggB.getOrDefault(topic, TopicWindow.EMPTY);
            TopicInsight row = new TopicInsight();
            row.setTopic(topic);
            row.setPubsA(a.getPublicationCount());
            row.setPubsB(b.getPublicationCount());
            row.setCitesA(a.getCitationSum());
            row.setCitesB(b.getCitationSum());
            if (classifier != null) {
                row.setPubsDelta(DeltaCalculator.delta(row.getPubsA(), row.getPubsB()));
                row.setCitesDelta(DeltaCalculator.delta(row.getCitesA(), row.getCitesB()));
                TrendLabel label = classifier.classify(row.getPubsA(), row.getPubsB(), row.getCitesA(), row.getCitesB());
                row.setLabel(label);
            }
            rows.add(row);
        }
        return rows;
    }

    /**
     * 按主题名（对比模式下还包括分类文本）做不区分大小写的包含匹配
     */
    static List<TopicInsight> applySearch(List<TopicInsight> rows, String search, boolean compare) {
        String keyword = trimToNull(search);
        if (keyword == null) {
            return rows;
        }
        String needle = keyword.toLowerCase(Locale.ROOT);
        return rows.stream()
                .filter(row -> row.getTopic().toLowerCase(Locale.ROOT).contains(needle)
                        || (compare && row.getInsight().toLowerCase(Locale.ROOT).contains(needle)))
                .collect(Collectors.toList());
    }

    private static InsightSortKey parseSortKey(String token) {
        try {
            return InsightSortKey.fromToken(token);
        } catch (IllegalArgumentException e) {
            throw new InsightQueryException(e.getMessage(), e);
        }
    }

    private static SortDirection parseDirection(String token) {
        try {
            SortDirection direction = SortDirection.fromToken(token);
            return direction == null ? SortDirection.DESC : direction;
        } catch (IllegalArgumentException e) {
            throw new InsightQueryException(e.getMessage(), e);
        }
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
