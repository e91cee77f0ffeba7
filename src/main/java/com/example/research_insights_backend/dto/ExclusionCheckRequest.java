package com.example.research_insights_backend.dto;

import lombok.Data;

/**
 * 屏蔽检查的入参，字段对应文献的标识信息
 */
@Data
public class ExclusionCheckRequest {
    private String workId;
    private String doi;
    private String title;
    private Integer year;
    private String authorId;
}
