package com.example.research_insights_backend.service.impl;

import com.example.research_insights_backend.mq.ConfigReloadProducer;
import com.example.research_insights_backend.service.ExclusionService;
import com.example.research_insights_backend.service.InsightConfigService;
import com.example.research_insights_backend.service.SnapshotReloadService;
import com.example.research_insights_backend.service.WorkService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

@Slf4j
@Service
public class SnapshotReloadServiceImpl implements SnapshotReloadService {

    @Autowired
    private ExclusionService exclusionService;

    @Autowired
    private InsightConfigService insightConfigService;

    @Autowired
    private WorkService workService;

    @Autowired
    private ConfigReloadProducer configReloadProducer;

    @Override
    public void reloadLocal() {
        exclusionService.reload();
        insightConfigService.reload();
        workService.evictCache();
        log.info("本节点屏蔽名单、洞察配置与语料缓存已刷新");
    }

    @Override
    public void reloadCluster() {
        reloadLocal();
        configReloadProducer.publishReload();
    }
}
