package com.xammer.remediation.exception;

/**
 * The cycle ran out of time before it could commit. Nothing was written.
 */
public class RemediationDeadlineExceededException extends RemediationException {

    public RemediationDeadlineExceededException(RemediationStage stage, String resource, Throwable cause) {
        super(stage, resource, "deadline exceeded, no changes were written", cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
