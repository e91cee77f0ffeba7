package com.example.research_insights_backend.service.impl;

import com.example.research_insights_backend.engine.IdentityCanonicalizer;
import com.example.research_insights_backend.model.Work;
import com.example.research_insights_backend.service.WorkDeduplicator;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 默认去重实现：按 DOI、外部标识、标题 slug 的优先级取身份键，每个身份只保留最先出现的一条。
 * 三者都为空的文献无法判断身份，全部保留。
 */
@Component
public class FirstRecordWorkDeduplicator implements WorkDeduplicator {

    @Override
    public List<Work> dedupe(List<Work> works) {
        List<Work> unique = new ArrayList<>();
        if (works == null) {
            return unique;
        }
        Set<String> seen = new HashSet<>();
        for (Work work : works) {
            String key = identityKey(work);
            if (key.isEmpty() || seen.add(key)) {
                unique.add(work);
            }
        }
        return unique;
    }

    static String identityKey(Work work) {
        String doi = IdentityCanonicalizer.canonicalDoi(work.getDoi());
        if (!doi.isEmpty()) {
            return "doi:" + doi;
        }
        String id = IdentityCanonicalizer.canonicalWorkId(work.getWorkId());
        if (!id.isEmpty()) {
            return "id:" + id;
        }
        String slug = IdentityCanonicalizer.titleSlug(work.getTitle(), work.getYear());
        return slug.isEmpty() ? "" : "slug:" + slug;
    }
}
