package com.example.research_insights_backend.service;

import com.example.research_insights_backend.model.Work;

import java.util.List;

/**
 * 文献去重：同一逻辑文献最多保留一条。具体保留哪一条由实现决定。
 */
public interface WorkDeduplicator {
    List<Work> dedupe(List<Work> works);
}
