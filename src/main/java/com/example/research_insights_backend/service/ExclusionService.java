package com.example.research_insights_backend.service;

import com.example.research_insights_backend.engine.ExclusionEngine;
import com.example.research_insights_backend.model.Work;

import java.util.List;

/**
 * 屏蔽名单业务接口，持有当前生效的屏蔽规则快照。
 */
public interface ExclusionService {
    /**
     * 判断文献是否被屏蔽
     * @param work 文献
     * @param authorId 作者上下文，可为空
     * @return 是否屏蔽
     */
    boolean isExcluded(Work work, String authorId);

    /**
     * 过滤掉被屏蔽的文献
     * @param works 原始语料
     * @param authorId 作者上下文，可为空
     * @return 保留的文献
     */
    List<Work> filterWorks(List<Work> works, String authorId);

    /**
     * 重新加载屏蔽名单，构建完成后整体替换
     */
    void reload();

    /**
     * 当前生效的规则快照
     */
    ExclusionEngine snapshot();
}
