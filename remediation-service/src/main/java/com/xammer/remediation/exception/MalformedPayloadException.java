package com.xammer.remediation.exception;

public class MalformedPayloadException extends RemediationException {

    public MalformedPayloadException(String message) {
        this(message, null);
    }

    public MalformedPayloadException(String message, Throwable cause) {
        super(RemediationStage.PARSE, null, message, cause);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
