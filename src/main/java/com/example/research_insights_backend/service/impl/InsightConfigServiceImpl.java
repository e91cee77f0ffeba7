package com.example.research_insights_backend.service.impl;

import com.example.research_insights_backend.model.InsightSettings;
import com.example.research_insights_backend.service.InsightConfigService;
import com.example.research_insights_backend.util.InsightConfigLoader;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;
import org.springframework.util.StreamUtils;

import javax.annotation.PostConstruct;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 洞察配置业务实现类，配置文件缺失或损坏时回退到内置默认值。
 */
@Slf4j
@Service
public class InsightConfigServiceImpl implements InsightConfigService {

    @Autowired
    private ResourceLoader resourceLoader;

    @Value("${insights.config.location:classpath:config/insightsconfig.json}")
    private String configLocation;

    private final AtomicReference<InsightSettings> current = new AtomicReference<>(InsightSettings.defaults());

    @PostConstruct
    public void init() {
        reload();
    }

    @Override
    public InsightSettings getSettings() {
        return current.get();
    }

    @Override
    public void reload() {
        InsightSettings settings = InsightConfigLoader.parse(readConfig());
        current.set(settings);
        log.info("洞察配置加载完成: thresholds={}, periodA={}, periodB={}",
                settings.getThresholds(), settings.getDefaultPeriodA(), settings.getDefaultPeriodB());
    }

    private String readConfig() {
        Resource resource = resourceLoader.getResource(configLocation);
        if (!resource.exists()) {
            log.warn("未找到洞察配置{}，使用默认阈值", configLocation);
            return null;
        }
        try (InputStream is = resource.getInputStream()) {
            return StreamUtils.copyToString(is, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warn("读取洞察配置{}失败，使用默认阈值", configLocation, e);
            return null;
        }
    }
}
