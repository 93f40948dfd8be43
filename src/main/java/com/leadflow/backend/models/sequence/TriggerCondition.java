package com.leadflow.backend.models.sequence;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.leadflow.backend.enums.LeadStatus;

/**
 * Typed trigger condition of a sequence, stored as a JSON column and parsed by Hibernate on load.
 * status: for STATUS_CHANGE sequences, the lead status that starts the sequence (null = any change).
 * daysAfterCreation: for TIME_BASED sequences, informational offset from lead creation.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record TriggerCondition(LeadStatus status, Integer daysAfterCreation) {

    public static TriggerCondition onStatus(LeadStatus status) {
        return new TriggerCondition(status, null);
    }

    public boolean matchesStatus(LeadStatus newStatus) {
        return status == null || status == newStatus;
    }
}
