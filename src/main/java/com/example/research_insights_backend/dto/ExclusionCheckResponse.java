package com.example.research_insights_backend.dto;

import lombok.Data;

/**
 * 屏蔽检查结果，附带规范化后的三种标识便于排查
 */
@Data
public class ExclusionCheckResponse {
    private boolean excluded;
    private String canonicalWorkId;
    private String canonicalDoi;
    private String titleSlug;
}
