package com.example.research_insights_backend.service;

import com.example.research_insights_backend.model.Work;

import java.util.List;

/**
 * 文献语料访问接口
 */
public interface WorkService {
    /**
     * 获取全部文献（优先从缓存获取）
     * @return 文献列表
     */
    List<Work> getAllWorks();

    /**
     * 清除语料缓存
     */
    void evictCache();
}
