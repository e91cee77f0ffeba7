package com.example.research_insights_backend.engine;

import com.example.research_insights_backend.model.InsightThresholds;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Predicate;

/**
 * 主题趋势分类器。
 * 规则按固定顺序逐条判断，返回第一条命中的结果，顺序本身就是冲突时的优先级。
 */
public final class TrendClassifier {

    private final InsightThresholds thresholds;
    private final List<Rule> rules;

    public TrendClassifier(InsightThresholds thresholds) {
        this.thresholds = thresholds == null ? InsightThresholds.defaults() : thresholds;
        this.rules = Collections.unmodifiableList(buildRules(this.thresholds));
    }

    private static List<Rule> buildRules(InsightThresholds t) {
        InsightThresholds.StrongSurge strongSurge = t.getStrongSurge();
        InsightThresholds.GrowingPriority growingPriority = t.getGrowingPriority();
        InsightThresholds.OutputSoftening outputSoftening = t.getOutputSoftening();
        InsightThresholds.ImpactLed impactLed = t.getImpactLed();
        double declineDrop = t.getDeclineDrop();

        List<Rule> rules = new ArrayList<>();
        rules.add(new Rule(s -> s.pubsA == 0 && s.pubsB > 0, TrendLabel.EMERGING));
        rules.add(new Rule(s -> s.pubsA > 0 && s.pubsB == 0, TrendLabel.ABSENT));
        rules.add(new Rule(s -> s.pubsGrowth >= strongSurge.getPubs()
                && s.citesGrowth >= strongSurge.getCites(), TrendLabel.STRONG_SURGE));
        rules.add(new Rule(s -> s.pubsGrowth >= growingPriority.getPubs()
                && s.citesGrowth >= growingPriority.getCites(), TrendLabel.GROWING_PRIORITY));
        rules.add(new Rule(s -> s.pubsGrowth >= outputSoftening.getPubs()
                && s.citesGrowth < outputSoftening.getCitesMax(), TrendLabel.OUTPUT_SOFTENING));
        rules.add(new Rule(s -> s.pubsGrowth < declineDrop
                && s.citesGrowth < declineDrop, TrendLabel.DECLINING));
        rules.add(new Rule(s -> s.citesGrowth >= impactLed.getCites()
                && s.pubsGrowth <= impactLed.getPubsMax(), TrendLabel.IMPACT_LED));
        return rules;
    }

    /**
     * 对一个主题的两期数据分类，任何非负输入都会得到且只得到一个结果
     */
    public TrendLabel classify(long pubsA, long pubsB, long citesA, long citesB) {
        Signals signals = new Signals(pubsA, pubsB,
                GrowthCalculator.growth(pubsA, pubsB),
                GrowthCalculator.growth(citesA, citesB));
        for (Rule rule : rules) {
            if (rule.condition.test(signals)) {
                return rule.label;
            }
        }
        return TrendLabel.STABLE;
    }

    /**
     * 规则的判断顺序，最后隐含兜底的 STABLE
     */
    public List<TrendLabel> ruleOrder() {
        List<TrendLabel> order = new ArrayList<>();
        for (Rule rule : rules) {
            order.add(rule.label);
        }
        order.add(TrendLabel.STABLE);
        return order;
    }

    public InsightThresholds getThresholds() {
        return thresholds;
    }

    private static final class Signals {
        private final long pubsA;
        private final long pubsB;
        private final double pubsGrowth;
        private final double citesGrowth;

        private Signals(long pubsA, long pubsB, double pubsGrowth, double citesGrowth) {
            this.pubsA = pubsA;
            this.pubsB = pubsB;
            this.pubsGrowth = pubsGrowth;
            this.citesGrowth = citesGrowth;
        }
    }

    private static final class Rule {
        private final Predicate<Signals> condition;
        private final TrendLabel label;

        private Rule(Predicate<Signals> condition, TrendLabel label) {
            this.condition = condition;
            this.label = label;
        }
    }
}
