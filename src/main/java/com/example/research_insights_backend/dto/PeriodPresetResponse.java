package com.example.research_insights_backend.dto;

import com.example.research_insights_backend.model.YearRange;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PeriodPresetResponse {
    private int span;
    private YearRange periodA;
    private YearRange periodB;
}
