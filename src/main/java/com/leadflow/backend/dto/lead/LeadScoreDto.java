package com.leadflow.backend.dto.lead;

import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class LeadScoreDto {
    private Long leadId;
    private Integer score;
    private Integer previousScore;
    private String priority;
    private Integer companySizeScore;
    private Integer contactScore;
    private Integer dataQualityScore;
    private Integer engagementScore;
    private String explanation;
    private List<String> strengths;
    private List<String> improvements;
}
