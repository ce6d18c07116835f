package com.xammer.remediation.service;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;
import java.util.Map;

@Data
@AllArgsConstructor
public class RemediationResult {
    private final RemediationOutcome outcome;
    private final String resource;
    /** Role to the members taken off it. Empty unless members were (or would have been) removed. */
    private final Map<String, List<String>> removedMembers;

    public static RemediationResult of(RemediationOutcome outcome, String resource) {
        return new RemediationResult(outcome, resource, Map.of());
    }

    public int getRemovedCount() {
        return removedMembers.values().stream().mapToInt(List::size).sum();
    }
}
