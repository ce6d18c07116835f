package com.xammer.remediation.service;

public enum RemediationOutcome {
    /** The corrected policy was written. */
    REMEDIATED,
    /** Every member was already allowed, nothing was written. */
    UNCHANGED,
    /** Members would have been removed but dry run is on. */
    DRY_RUN,
    /** The resource is outside the configured restriction. */
    OUT_OF_SCOPE,
    /** The finding is no longer active. */
    SKIPPED_INACTIVE
}
