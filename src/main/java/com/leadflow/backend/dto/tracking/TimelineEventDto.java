package com.leadflow.backend.dto.tracking;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TimelineEventDto {

    public enum Type {
        EMAIL_SENT, EMAIL_OPENED, LINK_CLICKED, STATUS_CHANGED
    }

    private Type type;
    private OffsetDateTime occurredAt;
    private Long trackedEmailId;
    private String subject;
    private String url;
    private String detail;
}
