package com.example.research_insights_backend.dto;

import com.example.research_insights_backend.model.YearRange;
import com.fasterxml.jackson.annotation.JsonIgnore;

import javax.validation.constraints.Min;

/**
 * 主题洞察查询条件。
 * 不传 B 期端点（且未指定 compare=true）或 compare=false 时为单期模式，只统计 A 期且不分类。
 */
public class InsightQuery {
    @Min(value = 0, message = "年份不能为负数")
    private Integer fromA;
    @Min(value = 0, message = "年份不能为负数")
    private Integer toA;
    @Min(value = 0, message = "年份不能为负数")
    private Integer fromB;
    @Min(value = 0, message = "年份不能为负数")
    private Integer toB;
    private Boolean compare;
    private String search;
    private String sortKey;
    private String sortDir;
    private String authorId;

    public Integer getFromA() {
        return fromA;
    }

    public void setFromA(Integer fromA) {
        this.fromA = fromA;
    }

    public Integer getToA() {
        return toA;
    }

    public void setToA(Integer toA) {
        this.toA = toA;
    }

    public Integer getFromB() {
        return fromB;
    }

    public void setFromB(Integer fromB) {
        this.fromB = fromB;
    }

    public Integer getToB() {
        return toB;
    }

    public void setToB(Integer toB) {
        this.toB = toB;
    }

    public Boolean getCompare() {
        return compare;
    }

    public void setCompare(Boolean compare) {
        this.compare = compare;
    }

    public String getSearch() {
        return search;
    }

    public void setSearch(String search) {
        this.search = search;
    }

    public String getSortKey() {
        return sortKey;
    }

    public void setSortKey(String sortKey) {
        this.sortKey = sortKey;
    }

    public String getSortDir() {
        return sortDir;
    }

    public void setSortDir(String sortDir) {
        this.sortDir = sortDir;
    }

    public String getAuthorId() {
        return authorId;
    }

    public void setAuthorId(String authorId) {
        this.authorId = authorId;
    }

    @JsonIgnore
    public YearRange getPeriodA() {
        return new YearRange(fromA, toA);
    }

    @JsonIgnore
    public YearRange getPeriodB() {
        return new YearRange(fromB, toB);
    }

    /**
     * 是否为两期对比：显式指定 compare 时以其为准；未指定时只要给出任一 B 期端点即为对比模式
     */
    @JsonIgnore
    public boolean isCompareMode() {
        if (compare != null) {
            return compare;
        }
        return fromB != null || toB != null;
    }
}
