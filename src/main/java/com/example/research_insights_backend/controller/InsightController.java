package com.example.research_insights_backend.controller;

import com.example.research_insights_backend.dto.InsightQuery;
import com.example.research_insights_backend.dto.PresetRequest;
import com.example.research_insights_backend.service.InsightConfigService;
import com.example.research_insights_backend.service.InsightService;
import com.example.research_insights_backend.service.SnapshotReloadService;
import com.example.research_insights_backend.util.ResponseUtil;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.*;

import javax.validation.Valid;
import java.util.Map;

/**
 * 主题趋势洞察接口控制器，负责两期对比、首页汇总、推荐区间与配置刷新。
 * 仅做参数接收和响应封装，具体业务由InsightService实现。
 */
@RestController
@RequestMapping("/api/insights")
@CrossOrigin(origins = "*")
public class InsightController {

    @Autowired
    private InsightService insightService;

    @Autowired
    private InsightConfigService insightConfigService;

    @Autowired
    private SnapshotReloadService snapshotReloadService;

    /**
     * 主题对比查询
     * @param query fromA/toA/fromB/toB、compare、search、sortKey、sortDir、authorId
     * @return 每个主题一行，附带实际使用的区间
     */
    @GetMapping
    public Map<String, Object> query(@Valid InsightQuery query) {
        return ResponseUtil.success(insightService.query(query));
    }

    /**
     * 默认区间下各分类的主题数量
     */
    @GetMapping("/summary")
    public Map<String, Object> summary(@RequestParam(required = false) String authorId) {
        return ResponseUtil.success(insightService.summarize(authorId));
    }

    /**
     * 按跨度推荐对比区间
     */
    @GetMapping("/presets")
    public Map<String, Object> presets(@Valid PresetRequest request) {
        return ResponseUtil.success(insightService.preset(request.getSpan(), request.getAuthorId()));
    }

    @GetMapping("/thresholds")
    public Map<String, Object> thresholds() {
        return ResponseUtil.success(insightConfigService.getSettings());
    }

    /**
     * 重新加载屏蔽名单与阈值配置，并通知其它节点
     */
    @PostMapping("/reload")
    public Map<String, Object> reload() {
        snapshotReloadService.reloadCluster();
        return ResponseUtil.successMsg("配置已刷新");
    }
}
