package com.example.research_insights_backend.controller;

import com.example.research_insights_backend.dto.ExclusionCheckRequest;
import com.example.research_insights_backend.dto.ExclusionCheckResponse;
import com.example.research_insights_backend.engine.IdentityCanonicalizer;
import com.example.research_insights_backend.model.Work;
import com.example.research_insights_backend.service.ExclusionService;
import com.example.research_insights_backend.service.InsightService;
import com.example.research_insights_backend.util.ResponseUtil;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * 文献语料接口控制器
 */
@RestController
@RequestMapping("/api/works")
@CrossOrigin(origins = "*")
public class WorkController {

    @Autowired
    private InsightService insightService;

    @Autowired
    private ExclusionService exclusionService;

    /**
     * 清洗后的语料（去掉屏蔽文献并去重）
     * @param authorId 可选，只保留该作者的文献并应用其个人屏蔽名单
     */
    @GetMapping("/clean")
    public Map<String, Object> clean(@RequestParam(required = false) String authorId) {
        return ResponseUtil.success(insightService.getCleanCorpus(authorId));
    }

    /**
     * 检查一条文献是否会被屏蔽
     */
    @GetMapping("/excluded")
    public Map<String, Object> excluded(ExclusionCheckRequest request) {
        Work work = new Work();
        work.setWorkId(request.getWorkId());
        work.setDoi(request.getDoi());
        work.setTitle(request.getTitle());
        work.setYear(request.getYear());

        ExclusionCheckResponse response = new ExclusionCheckResponse();
        response.setExcluded(exclusionService.isExcluded(work, request.getAuthorId()));
        response.setCanonicalWorkId(IdentityCanonicalizer.canonicalWorkId(request.getWorkId()));
        response.setCanonicalDoi(IdentityCanonicalizer.canonicalDoi(request.getDoi()));
        response.setTitleSlug(IdentityCanonicalizer.titleSlug(request.getTitle(), request.getYear()));
        return ResponseUtil.success(response);
    }
}
