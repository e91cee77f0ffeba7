package com.example.research_insights_backend.service.impl;

import com.example.research_insights_backend.mapper.WorkMapper;
import com.example.research_insights_backend.model.Work;
import com.example.research_insights_backend.service.WorkService;
import com.example.research_insights_backend.util.RedisUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * 文献语料业务实现类，全量语料以 JSON 缓存在 Redis 中，缓存不可用时直接查库。
 */
@Slf4j
@Service
public class WorkServiceImpl implements WorkService {

    @Autowired
    private WorkMapper workMapper;

    @Autowired
    private RedisUtil redisUtil;

    // Redis缓存相关常量
    private static final String ALL_WORKS_CACHE_KEY = "works:all";
    private static final long CACHE_EXPIRE_TIME = 24; // 缓存过期时间（小时）

    /**
     * 获取全部文献（优先从缓存获取）
     */
    @Override
    public List<Work> getAllWorks() {
        List<Work> cached = getAllWorksFromCache();
        if (cached != null && !cached.isEmpty()) {
            return cached;
        }
        List<Work> works = workMapper.selectList(null);
        if (works == null) {
            return new ArrayList<>();
        }
        loadWorksToCache(works);
        return works;
    }

    /**
     * 从Redis缓存获取所有文献，缓存异常时返回null
     */
    private List<Work> getAllWorksFromCache() {
        try {
            return redisUtil.getList(ALL_WORKS_CACHE_KEY, Work.class);
        } catch (Exception e) {
            log.warn("读取语料缓存失败，改为查询数据库: {}", e.getMessage());
            return null;
        }
    }

    private void loadWorksToCache(List<Work> works) {
        if (works.isEmpty()) {
            return;
        }
        try {
            redisUtil.setObject(ALL_WORKS_CACHE_KEY, works, CACHE_EXPIRE_TIME, TimeUnit.HOURS);
            log.debug("语料已写入缓存，共{}条", works.size());
        } catch (Exception e) {
            log.warn("写入语料缓存失败: {}", e.getMessage());
        }
    }

    /**
     * 清除语料缓存
     */
    @Override
    public void evictCache() {
        try {
            redisUtil.delete(ALL_WORKS_CACHE_KEY);
            log.info("语料缓存已清除");
        } catch (Exception e) {
            log.warn("清除语料缓存失败: {}", e.getMessage());
        }
    }
}
