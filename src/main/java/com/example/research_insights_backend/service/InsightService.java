package com.example.research_insights_backend.service;

import com.example.research_insights_backend.dto.InsightQuery;
import com.example.research_insights_backend.dto.InsightReportResponse;
import com.example.research_insights_backend.dto.InsightSummaryResponse;
import com.example.research_insights_backend.dto.PeriodPresetResponse;
import com.example.research_insights_backend.model.Work;

import java.util.List;

/**
 * 主题趋势洞察业务接口，定义清洗后语料、两期对比、汇总与预设区间等操作。
 */
public interface InsightService {
    /**
     * 清洗后的语料：去掉屏蔽文献并去重；指定作者时只保留该作者的文献
     * @param authorId 作者标识，可为空
     * @return 文献列表
     */
    List<Work> getCleanCorpus(String authorId);

    /**
     * 按查询条件生成主题对比结果
     * @param query 查询条件
     * @return 结果及实际使用的区间
     */
    InsightReportResponse query(InsightQuery query);

    /**
     * 默认区间下各分类的主题数量
     * @param authorId 作者标识，可为空
     * @return 汇总
     */
    InsightSummaryResponse summarize(String authorId);

    /**
     * 按跨度生成推荐的对比区间
     * @param span 每期年数
     * @param authorId 作者标识，可为空
     * @return 推荐区间
     */
    PeriodPresetResponse preset(int span, String authorId);
}
