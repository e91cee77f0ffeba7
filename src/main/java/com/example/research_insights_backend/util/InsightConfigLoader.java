package com.example.research_insights_backend.util;

import com.example.research_insights_backend.model.InsightSettings;
import com.example.research_insights_backend.model.InsightThresholds;
import com.example.research_insights_backend.model.YearRange;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import lombok.extern.slf4j.Slf4j;

/**
 * 读取洞察配置文档（insightsconfig.json）。
 * 每个叶子字段单独回退到默认值，部分覆盖不会清掉其它字段。
 */
@Slf4j
public final class InsightConfigLoader {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private InsightConfigLoader() {
    }

    /**
     * 解析配置文本，空文本或格式错误时返回全部默认值
     */
    public static InsightSettings parse(String json) {
        if (json == null || json.trim().isEmpty()) {
            return InsightSettings.defaults();
        }
        JsonNode root;
        try {
            root = OBJECT_MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            log.warn("洞察配置解析失败，使用默认阈值: {}", e.getOriginalMessage());
            return InsightSettings.defaults();
        }
        if (root == null || !root.isObject()) {
            log.warn("洞察配置不是 JSON 对象，使用默认阈值");
            return InsightSettings.defaults();
        }
        return new InsightSettings(
                readThresholds(root.path("insightThresholds")),
                readRange(root.path("insightsDefaultPeriodA")),
                readRange(root.path("insightsDefaultPeriodB")));
    }

    static InsightThresholds readThresholds(JsonNode node) {
        InsightThresholds.StrongSurge strongDefault = InsightThresholds.StrongSurge.defaults();
        InsightThresholds.GrowingPriority growingDefault = InsightThresholds.GrowingPriority.defaults();
        InsightThresholds.ImpactLed impactDefault = InsightThresholds.ImpactLed.defaults();
        InsightThresholds.OutputSoftening softeningDefault = InsightThresholds.OutputSoftening.defaults();

        JsonNode strong = child(node, "strongSurge");
        JsonNode growing = child(node, "growingPriority");
        JsonNode impact = child(node, "impactLed");
        JsonNode softening = child(node, "outputSoftening");

        return new InsightThresholds(
                new InsightThresholds.StrongSurge(
                        number(strong, "pubs", strongDefault.getPubs()),
                        number(strong, "cites", strongDefault.getCites())),
                new InsightThresholds.GrowingPriority(
                        number(growing, "pubs", growingDefault.getPubs()),
                        number(growing, "cites", growingDefault.getCites())),
                new InsightThresholds.ImpactLed(
                        number(impact, "cites", impactDefault.getCites()),
                        number(impact, "pubsMax", impactDefault.getPubsMax())),
                new InsightThresholds.OutputSoftening(
                        number(softening, "pubs", softeningDefault.getPubs()),
                        number(softening, "citesMax", softeningDefault.getCitesMax())),
                number(node, "declineDrop", InsightThresholds.DEFAULT_DECLINE_DROP));
    }

    static YearRange readRange(JsonNode node) {
        if (node == null || !node.isObject()) {
            return YearRange.unbounded();
        }
        return new YearRange(integer(node, "from"), integer(node, "to"));
    }

    private static JsonNode child(JsonNode node, String field) {
        if (node == null || !node.isObject()) {
            return MissingNode.getInstance();
        }
        return node.path(field);
    }

    private static double number(JsonNode node, String field, double fallback) {
        if (node == null || !node.isObject()) {
            return fallback;
        }
        JsonNode value = node.get(field);
        if (value == null || !value.isNumber()) {
            return fallback;
        }
        double parsed = value.asDouble();
        return Double.isNaN(parsed) ? fallback : parsed;
    }

    private static Integer integer(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isNumber()) {
            return null;
        }
        return value.asInt();
    }
}
