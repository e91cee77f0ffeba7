package com.example.research_insights_backend.dto;

import lombok.Data;

import javax.validation.constraints.Min;
import javax.validation.constraints.NotNull;

@Data
public class PresetRequest {
    @NotNull(message = "span不能为空")
    @Min(value = 1, message = "span必须为正整数")
    private Integer span;

    private String authorId;
}
