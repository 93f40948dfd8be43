package com.leadflow.backend.services.tracking;

import lombok.Builder;
import lombok.Value;

/**
 * A rendered email ready to be tracked and sent.
 */
@Value
@Builder
public class OutboundEmail {
    Long userId;
    Long leadId;
    String recipientEmail;
    Long sequenceId;
    Long sequenceStepId;
    Long enrollmentId;
    Long templateId;
    String subject;
    String body;
}
