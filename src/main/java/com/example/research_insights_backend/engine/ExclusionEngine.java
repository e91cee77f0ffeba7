package com.example.research_insights_backend.engine;

import com.example.research_insights_backend.model.ExclusionEntry;
import com.example.research_insights_backend.model.ExclusionScope;
import com.example.research_insights_backend.model.Work;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 屏蔽名单匹配引擎。
 * 构造时一次性把规则拆成全局集合（标识 / DOI / slug）和按作者分桶的集合，
 * 之后 {@link #isExcluded(Work, String)} 只做查表，可在多线程下共享。
 */
public final class ExclusionEngine {

    private final Set<String> globalIds = new HashSet<>();
    private final Set<String> globalDois = new HashSet<>();
    private final Set<String> globalSlugs = new HashSet<>();

    private final Map<String, Set<String>> perAuthorIds = new HashMap<>();
    private final Map<String, Set<String>> perAuthorDois = new HashMap<>();
    private final Map<String, Set<String>> perAuthorSlugs = new HashMap<>();

    private final int acceptedEntries;
    private final int droppedEntries;

    public ExclusionEngine(Collection<ExclusionEntry> entries) {
        int accepted = 0;
        int dropped = 0;
        if (entries != null) {
            for (ExclusionEntry entry : entries) {
                if (register(entry)) {
                    accepted++;
                } else {
                    dropped++;
                }
            }
        }
        this.acceptedEntries = accepted;
        this.droppedEntries = dropped;
    }

    public static ExclusionEngine empty() {
        return new ExclusionEngine(Collections.emptyList());
    }

    private boolean register(ExclusionEntry entry) {
        if (entry == null) {
            return false;
        }
        String id = IdentityCanonicalizer.canonicalWorkId(entry.getWorkIdentifier());
        String doi = IdentityCanonicalizer.canonicalDoi(entry.getDoi());
        String slug = IdentityCanonicalizer.slugify(entry.getTitleSlug());
        if (id.isEmpty() && doi.isEmpty() && slug.isEmpty()) {
            // 没有任何可匹配字段的规则不生效
            return false;
        }

        ExclusionScope scope = entry.getScope() == null ? ExclusionScope.GLOBAL : entry.getScope();
        if (scope == ExclusionScope.GLOBAL) {
            addIfPresent(globalIds, id);
            addIfPresent(globalDois, doi);
            addIfPresent(globalSlugs, slug);
            return true;
        }

        String authorKey = IdentityCanonicalizer.normalizeKey(entry.getAuthorId());
        if (authorKey.isEmpty()) {
            // 按作者屏蔽但缺少作者标识，丢弃而不是当作全局规则
            return false;
        }
        addIfPresent(perAuthorIds, authorKey, id);
        addIfPresent(perAuthorDois, authorKey, doi);
        addIfPresent(perAuthorSlugs, authorKey, slug);
        return true;
    }

    public boolean isExcluded(Work work) {
        return isExcluded(work, null);
    }

    /**
     * 判断文献是否被屏蔽。先查全局规则，再按作者上下文查该作者的规则。
     *
     * @param work          文献
     * @param authorContext 当前查看的作者标识，可为空
     * @return 是否屏蔽
     */
    public boolean isExcluded(Work work, String authorContext) {
        if (work == null) {
            return false;
        }
        String id = IdentityCanonicalizer.canonicalWorkId(work.getWorkId());
        String doi = IdentityCanonicalizer.canonicalDoi(work.getDoi());
        String slug = IdentityCanonicalizer.titleSlug(work.getTitle(), work.getYear());

        if (matches(globalIds, id) || matches(globalDois, doi) || matches(globalSlugs, slug)) {
            return true;
        }

        String authorKey = IdentityCanonicalizer.normalizeKey(authorContext);
        if (authorKey.isEmpty()) {
            return false;
        }
        return matches(perAuthorIds.get(authorKey), id)
                || matches(perAuthorDois.get(authorKey), doi)
                || matches(perAuthorSlugs.get(authorKey), slug);
    }

    /**
     * 线性扫描语料，返回未被屏蔽的文献，保持原有顺序
     */
    public List<Work> filter(Collection<Work> works, String authorContext) {
        List<Work> kept = new ArrayList<>();
        if (works == null) {
            return kept;
        }
        for (Work work : works) {
            if (!isExcluded(work, authorContext)) {
                kept.add(work);
            }
        }
        return kept;
    }

    public int getAcceptedEntries() {
        return acceptedEntries;
    }

    public int getDroppedEntries() {
        return droppedEntries;
    }

    public int getAuthorBucketCount() {
        Set<String> authors = new HashSet<>(perAuthorIds.keySet());
        authors.addAll(perAuthorDois.keySet());
        authors.addAll(perAuthorSlugs.keySet());
        return authors.size();
    }

    // 空值永远不参与比较
    private static boolean matches(Set<String> values, String candidate) {
        return values != null && !candidate.isEmpty() && values.contains(candidate);
    }

    private static void addIfPresent(Set<String> target, String value) {
        if (!value.isEmpty()) {
            target.add(value);
        }
    }

    private static void addIfPresent(Map<String, Set<String>> target, String authorKey, String value) {
        if (!value.isEmpty()) {
            target.computeIfAbsent(authorKey, k -> new HashSet<>()).add(value);
        }
    }
}
