package com.xammer.remediation.exception;

/**
 * Step of a remediation cycle at which a failure happened.
 */
public enum RemediationStage {
    PARSE,
    CONFIGURATION,
    FETCH_ORGANIZATION,
    FETCH_POLICY,
    WRITE_POLICY
}
