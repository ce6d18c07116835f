package com.xammer.remediation.exception;

import lombok.Getter;

/**
 * Base type of every failure surfaced by a remediation cycle.
 * Carries the stage and the resource it concerns so a single log line is enough to diagnose it.
 */
@Getter
public abstract class RemediationException extends RuntimeException {

    private final RemediationStage stage;
    private final String resource;

    protected RemediationException(RemediationStage stage, String resource, String message, Throwable cause) {
        super(describe(stage, resource, message), cause);
        this.stage = stage;
        this.resource = resource;
    }

    /**
     * Whether redelivering the triggering event may succeed.
     */
    public abstract boolean isRetryable();

    private static String describe(RemediationStage stage, String resource, String message) {
        StringBuilder sb = new StringBuilder("[").append(stage).append("]");
        if (resource != null && !resource.isBlank()) {
            sb.append(" ").append(resource).append(":");
        }
        return sb.append(" ").append(message).toString();
    }
}
