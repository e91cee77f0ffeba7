package com.example.research_insights_backend.service;

/**
 * 屏蔽名单、阈值配置与语料缓存的统一刷新
 */
public interface SnapshotReloadService {
    /**
     * 只刷新本节点
     */
    void reloadLocal();

    /**
     * 刷新本节点并通知集群内其它节点
     */
    void reloadCluster();
}
