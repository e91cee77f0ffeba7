package com.example.research_insights_backend.service.impl;

import com.example.research_insights_backend.engine.ExclusionEngine;
import com.example.research_insights_backend.model.Work;
import com.example.research_insights_backend.service.ExclusionService;
import com.example.research_insights_backend.util.DenyListCsvParser;
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
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 屏蔽名单业务实现类。
 * 规则快照放在 AtomicReference 中，重新加载时先完整构建新快照再替换，查询过程中不会看到半更新状态。
 */
@Slf4j
@Service
public class ExclusionServiceImpl implements ExclusionService {

    @Autowired
    private ResourceLoader resourceLoader;

    @Value("${insights.deny-list.location:classpath:config/blacklist.csv}")
    private String denyListLocation;

    private final AtomicReference<ExclusionEngine> current = new AtomicReference<>(ExclusionEngine.empty());

    @PostConstruct
    public void init() {
        reload();
    }

    @Override
    public boolean isExcluded(Work work, String authorId) {
        return current.get().isExcluded(work, authorId);
    }

    @Override
    public List<Work> filterWorks(List<Work> works, String authorId) {
        // 整个批次使用同一份快照
        return current.get().filter(works, authorId);
    }

    @Override
    public void reload() {
        String content = readDenyList();
        DenyListCsvParser.Result parsed = DenyListCsvParser.parse(content);
        ExclusionEngine engine = new ExclusionEngine(parsed.getEntries());
        current.set(engine);
        log.info("屏蔽名单加载完成: 生效{}条, 丢弃{}条, 跳过格式错误行{}行, 涉及作者{}位",
                engine.getAcceptedEntries(), engine.getDroppedEntries(),
                parsed.getSkippedRows(), engine.getAuthorBucketCount());
    }

    @Override
    public ExclusionEngine snapshot() {
        return current.get();
    }

    private String readDenyList() {
        Resource resource = resourceLoader.getResource(denyListLocation);
        if (!resource.exists()) {
            log.warn("未找到屏蔽名单{}，不屏蔽任何文献", denyListLocation);
            return "";
        }
        try (InputStream is = resource.getInputStream()) {
            return StreamUtils.copyToString(is, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warn("读取屏蔽名单{}失败，不屏蔽任何文献", denyListLocation, e);
            return "";
        }
    }
}
