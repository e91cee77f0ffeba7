package com.example.research_insights_backend.dto;

import com.example.research_insights_backend.model.YearRange;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 首页汇总：默认区间下各分类的主题数
 */
@Data
public class InsightSummaryResponse {
    private YearRange periodA;
    private YearRange periodB;
    private Map<String, Integer> counts = new LinkedHashMap<>();
    private int total;
}
