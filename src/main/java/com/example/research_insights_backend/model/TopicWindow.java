package com.example.research_insights_backend.model;

/**
 * 单个主题在某一时间窗口内的统计结果：发文数与被引总数。
 */
public class TopicWindow {
    public static final TopicWindow EMPTY = new TopicWindow(0, 0L);

    private final int publicationCount;
    private final long citationSum;

    public TopicWindow(int publicationCount, long citationSum) {
        this.publicationCount = publicationCount;
        this.citationSum = citationSum;
    }

    public int getPublicationCount() {
        return publicationCount;
    }

    public long getCitationSum() {
        return citationSum;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TopicWindow)) return false;
        TopicWindow that = (TopicWindow) o;
        return publicationCount == that.publicationCount && citationSum == that.citationSum;
    }

    @Override
    public int hashCode() {
        return 31 * publicationCount + Long.hashCode(citationSum);
    }

    @Override
    public String toString() {
        return "TopicWindow{" +
                "publicationCount=" + publicationCount +
                ", citationSum=" + citationSum +
                '}';
    }
}
