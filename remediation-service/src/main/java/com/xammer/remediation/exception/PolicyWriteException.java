package com.xammer.remediation.exception;

public class PolicyWriteException extends RemediationException {

    public PolicyWriteException(String resource, String message, Throwable cause) {
        super(RemediationStage.WRITE_POLICY, resource, message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
