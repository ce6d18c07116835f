package com.xammer.remediation.domain;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Per-event inputs of a remediation cycle.
 */
@Data
@AllArgsConstructor
public class RemediationValues {

    private final String organizationId;

    public String getTargetResource() {
        return "organizations/" + organizationId;
    }
}
