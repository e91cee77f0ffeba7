package com.example.research_insights_backend.engine;

import com.example.research_insights_backend.model.InsightThresholds;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * 趋势分类测试，重点是规则顺序
 */
public class TrendClassifierTest {

    private final TrendClassifier classifier = new TrendClassifier(InsightThresholds.defaults());

    @Test
    public void testRuleOrderIsFixed() {
        assertEquals(Arrays.asList(
                TrendLabel.EMERGING,
                TrendLabel.ABSENT,
                TrendLabel.STRONG_SURGE,
                TrendLabel.GROWING_PRIORITY,
                TrendLabel.OUTPUT_SOFTENING,
                TrendLabel.DECLINING,
                TrendLabel.IMPACT_LED,
                TrendLabel.STABLE), classifier.ruleOrder());
    }

    @Test
    public void testAbsentTakesPriorityOverDeclining() {
        assertEquals(TrendLabel.ABSENT, classifier.classify(1, 0, 5, 0));
    }

    @Test
    public void testEachLabelIsReachable() {
        assertEquals(TrendLabel.EMERGING, classifier.classify(0, 3, 0, 0));
        assertEquals(TrendLabel.STRONG_SURGE, classifier.classify(1, 2, 3, 6));
        assertEquals(TrendLabel.GROWING_PRIORITY, classifier.classify(2, 3, 10, 12));
        assertEquals(TrendLabel.OUTPUT_SOFTENING, classifier.classify(5, 6, 10, 8));
        assertEquals(TrendLabel.DECLINING, classifier.classify(10, 5, 10, 5));
        assertEquals(TrendLabel.IMPACT_LED, classifier.classify(4, 4, 2, 4));
        assertEquals(TrendLabel.STABLE, classifier.classify(4, 4, 4, 4));
    }

    @Test
    public void testEveryQuadrupleGetsExactlyOneLabel() {
        Set<TrendLabel> seen = EnumSet.noneOf(TrendLabel.class);
        for (int pubsA = 0; pubsA <= 6; pubsA++) {
            for (int pubsB = 0; pubsB <= 6; pubsB++) {
                for (int citesA = 0; citesA <= 8; citesA++) {
                    for (int citesB = 0; citesB <= 8; citesB++) {
                        TrendLabel label = classifier.classify(pubsA, pubsB, citesA, citesB);
                        assertNotNull(label);
                        assertEquals(label, classifier.classify(pubsA, pubsB, citesA, citesB));
                        seen.add(label);
                        if (pubsA == 0 && pubsB > 0) {
                            assertEquals(TrendLabel.EMERGING, label);
                        }
                        if (pubsA > 0 && pubsB == 0) {
                            assertEquals(TrendLabel.ABSENT, label);
                        }
                    }
                }
            }
        }
        assertEquals(EnumSet.allOf(TrendLabel.class), seen);
    }

    @Test
    public void testNoPublicationsInEitherPeriod() {
        // pubsGrowth=0 总满足 impactLed.pubsMax，但会先被 declining 规则拦截（被引同样下降时）
        assertEquals(TrendLabel.DECLINING, classifier.classify(0, 0, 0, 0));
        assertEquals(TrendLabel.DECLINING, classifier.classify(0, 0, 5, 1));
        assertEquals(TrendLabel.IMPACT_LED, classifier.classify(0, 0, 2, 4));
    }

    @Test
    public void testCustomThresholds() {
        InsightThresholds custom = new InsightThresholds(
                new InsightThresholds.StrongSurge(1.5, 1.5),
                InsightThresholds.GrowingPriority.defaults(),
                InsightThresholds.ImpactLed.defaults(),
                InsightThresholds.OutputSoftening.defaults(),
                InsightThresholds.DEFAULT_DECLINE_DROP);

        assertEquals(TrendLabel.GROWING_PRIORITY, classifier.classify(2, 3, 10, 15));
        assertEquals(TrendLabel.STRONG_SURGE, new TrendClassifier(custom).classify(2, 3, 10, 15));
        assertTrue(new TrendClassifier(null).getThresholds().getDeclineDrop() > 0);
    }
}
