package com.example.research_insights_backend.dto;

import com.example.research_insights_backend.model.TopicInsight;
import com.example.research_insights_backend.model.YearRange;

import java.util.ArrayList;
import java.util.List;

public class InsightReportResponse {
    private boolean compareMode;
    private YearRange periodA;
    private YearRange periodB;
    private String sortKey;
    private String sortDir;
    private List<TopicInsight> rows = new ArrayList<>();

    public boolean isCompareMode() { return compareMode; }
    public void setCompareMode(boolean compareMode) { this.compareMode = compareMode; }
    public YearRange getPeriodA() { return periodA; }
    public void setPeriodA(YearRange periodA) { this.periodA = periodA; }
    public YearRange getPeriodB() { return periodB; }
    public void setPeriodB(YearRange periodB) { this.periodB = periodB; }
    public String getSortKey() { return sortKey; }
    public void setSortKey(String sortKey) { this.sortKey = sortKey; }
    public String getSortDir() { return sortDir; }
    public void setSortDir(String sortDir) { this.sortDir = sortDir; }
    public List<TopicInsight> getRows() { return rows; }
    public void setRows(List<TopicInsight> rows) { this.rows = rows; }
    @Override
    public String toString() {
        return "InsightReportResponse{" +
                "compareMode=" + compareMode +
                ", periodA=" + periodA +
                ", periodB=" + periodB +
                ", sortKey='" + sortKey + '\'' +
                ", sortDir='" + sortDir + '\'' +
                ", rows=" + rows.size() +
                '}';
    }
}
