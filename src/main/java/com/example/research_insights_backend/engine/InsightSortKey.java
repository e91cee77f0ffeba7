package com.example.research_insights_backend.engine;

import com.example.research_insights_backend.model.TopicInsight;

import java.util.function.Function;

/**
 * 洞察结果的排序字段。数值字段走 {@link RankingComparator}，topic / insight 按文本比较。
 */
public enum InsightSortKey {
    TOPIC("topic", null, true),
    PUBS_A("pubsA", row -> (double) row.getPubsA(), true),
    PUBS_B("pubsB", row -> (double) row.getPubsB(), false),
    PUBS_DELTA("pubsDelta", TopicInsight::getPubsDelta, false),
    CITES_A("citesA", row -> (double) row.getCitesA(), true),
    CITES_B("citesB", row -> (double) row.getCitesB(), false),
    CITES_DELTA("citesDelta", TopicInsight::getCitesDelta, false),
    INSIGHT("insight", null, false);

    private final String token;
    private final Function<TopicInsight, Double> numericKey;
    // 单期模式下是否可用
    private final boolean singlePeriod;

    InsightSortKey(String token, Function<TopicInsight, Double> numericKey, boolean singlePeriod) {
        this.token = token;
        this.numericKey = numericKey;
        this.singlePeriod = singlePeriod;
    }

    public String getToken() {
        return token;
    }

    Function<TopicInsight, Double> getNumericKey() {
        return numericKey;
    }

    public boolean isNumeric() {
        return numericKey != null;
    }

    public boolean isSinglePeriod() {
        return singlePeriod;
    }

    /**
     * 按 token 解析（忽略大小写），空值返回 null
     */
    public static InsightSortKey fromToken(String token) {
        if (token == null || token.trim().isEmpty()) {
            return null;
        }
        for (InsightSortKey key : values()) {
            if (key.token.equalsIgnoreCase(token.trim())) {
                return key;
            }
        }
        throw new IllegalArgumentException("未知的排序字段: " + token);
    }
}
