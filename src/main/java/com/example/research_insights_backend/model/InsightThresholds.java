package com.example.research_insights_backend.model;

/**
 * 趋势分类阈值，对应配置文件中的 insightThresholds 节点。
 * 加载后不可变，缺失的字段逐项使用内置默认值。
 */
public final class InsightThresholds {

    public static final double DEFAULT_DECLINE_DROP = 0.8;

    private final StrongSurge strongSurge;
    private final GrowingPriority growingPriority;
    private final ImpactLed impactLed;
    private final OutputSoftening outputSoftening;
    private final double declineDrop;

    public InsightThresholds(StrongSurge strongSurge,
                             GrowingPriority growingPriority,
                             ImpactLed impactLed,
                             OutputSoftening outputSoftening,
                             double declineDrop) {
        this.strongSurge = strongSurge;
        this.growingPriority = growingPriority;
        this.impactLed = impactLed;
        this.outputSoftening = outputSoftening;
        this.declineDrop = declineDrop;
    }

    public static InsightThresholds defaults() {
        return new InsightThresholds(
                StrongSurge.defaults(),
                GrowingPriority.defaults(),
                ImpactLed.defaults(),
                OutputSoftening.defaults(),
                DEFAULT_DECLINE_DROP);
    }

    public StrongSurge getStrongSurge() {
        return strongSurge;
    }

    public GrowingPriority getGrowingPriority() {
        return growingPriority;
    }

    public ImpactLed getImpactLed() {
        return impactLed;
    }

    public OutputSoftening getOutputSoftening() {
        return outputSoftening;
    }

    public double getDeclineDrop() {
        return declineDrop;
    }

    @Override
    public String toString() {
        return "InsightThresholds{" +
                "strongSurge=" + strongSurge +
                ", growingPriority=" + growingPriority +
                ", impactLed=" + impactLed +
                ", outputSoftening=" + outputSoftening +
                ", declineDrop=" + declineDrop +
                '}';
    }

    /** 产出与影响力同时大幅增长 */
    public static final class StrongSurge {
        private final double pubs;
        private final double cites;

        public StrongSurge(double pubs, double cites) {
            this.pubs = pubs;
            this.cites = cites;
        }

        public static StrongSurge defaults() {
            return new StrongSurge(2, 2);
        }

        public double getPubs() { return pubs; }
        public double getCites() { return cites; }

        @Override
        public String toString() {
            return "{pubs=" + pubs + ", cites=" + cites + "}";
        }
    }

    /** 产出增长且影响力上升 */
    public static final class GrowingPriority {
        private final double pubs;
        private final double cites;

        public GrowingPriority(double pubs, double cites) {
            this.pubs = pubs;
            this.cites = cites;
        }

        public static GrowingPriority defaults() {
            return new GrowingPriority(1.5, 1.2);
        }

        public double getPubs() { return pubs; }
        public double getCites() { return cites; }

        @Override
        public String toString() {
            return "{pubs=" + pubs + ", cites=" + cites + "}";
        }
    }

    /** 影响力增长快于产出 */
    public static final class ImpactLed {
        private final double cites;
        private final double pubsMax;

        public ImpactLed(double cites, double pubsMax) {
            this.cites = cites;
            this.pubsMax = pubsMax;
        }

        public static ImpactLed defaults() {
            return new ImpactLed(1.5, 1);
        }

        public double getCites() { return cites; }
        public double getPubsMax() { return pubsMax; }

        @Override
        public String toString() {
            return "{cites=" + cites + ", pubsMax=" + pubsMax + "}";
        }
    }

    /** 产出上升但影响力走弱 */
    public static final class OutputSoftening {
        private final double pubs;
        private final double citesMax;

        public OutputSoftening(double pubs, double citesMax) {
            this.pubs = pubs;
            this.citesMax = citesMax;
        }

        public static OutputSoftening defaults() {
            return new OutputSoftening(1.2, 0.9);
        }

        public double getPubs() { return pubs; }
        public double getCitesMax() { return citesMax; }

        @Override
        public String toString() {
            return "{pubs=" + pubs + ", citesMax=" + citesMax + "}";
        }
    }
}
