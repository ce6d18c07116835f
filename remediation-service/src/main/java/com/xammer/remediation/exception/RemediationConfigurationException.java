package com.xammer.remediation.exception;

public class RemediationConfigurationException extends RemediationException {

    public RemediationConfigurationException(String message) {
        super(RemediationStage.CONFIGURATION, null, message, null);
    }

    /**
     * For settings read from a resource at runtime, e.g. an organization without a domain.
     */
    public RemediationConfigurationException(RemediationStage stage, String resource, String message) {
        super(stage, resource, message, null);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
