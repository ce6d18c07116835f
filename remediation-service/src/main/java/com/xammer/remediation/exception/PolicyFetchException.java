package com.xammer.remediation.exception;

/**
 * Reading the organization or its access policy failed.
 */
public class PolicyFetchException extends RemediationException {

    public PolicyFetchException(RemediationStage stage, String resource, String message, Throwable cause) {
        super(stage, resource, message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
