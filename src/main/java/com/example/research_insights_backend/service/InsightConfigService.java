package com.example.research_insights_backend.service;

import com.example.research_insights_backend.model.InsightSettings;

/**
 * 洞察配置（阈值、默认区间）业务接口
 */
public interface InsightConfigService {
    /**
     * 当前生效的配置快照
     */
    InsightSettings getSettings();

    /**
     * 重新读取配置文件，构建完成后整体替换
     */
    void reload();
}
