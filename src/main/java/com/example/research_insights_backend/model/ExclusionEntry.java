package com.example.research_insights_backend.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 屏蔽名单中的一行规则。
 * workIdentifier、doi、titleSlug 任一非空字段命中即屏蔽。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ExclusionEntry {
    private ExclusionScope scope;

    // scope 为 PER_AUTHOR 时必填
    private String authorId;

    private String workIdentifier;

    private String doi;

    private String titleSlug;

    public static ExclusionEntry global(String workIdentifier, String doi, String titleSlug) {
        return new ExclusionEntry(ExclusionScope.GLOBAL, null, workIdentifier, doi, titleSlug);
    }

    public static ExclusionEntry perAuthor(String authorId, String workIdentifier, String doi, String titleSlug) {
        return new ExclusionEntry(ExclusionScope.PER_AUTHOR, authorId, workIdentifier, doi, titleSlug);
    }
}
