package com.leadflow.backend.dto.sequence;

import com.leadflow.backend.models.sequence.SequenceStep;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class StepDto {
    private Long id;
    private Long sequenceId;
    private Integer stepOrder;
    private Integer delayDays;
    private Integer delayHours;
    private String delayDescription;
    private Long templateId;
    private String subject;
    private String body;

    public static StepDto fromEntity(SequenceStep step, Long sequenceId) {
        return StepDto.builder()
                .id(step.getId())
                .sequenceId(sequenceId)
                .stepOrder(step.getStepOrder())
                .delayDays(step.getDelayDays())
                .delayHours(step.getDelayHours())
                .delayDescription(step.getDelayDescription())
                .templateId(step.getTemplateId())
                .subject(step.getSubject())
                .body(step.getBody())
                .build();
    }
}
