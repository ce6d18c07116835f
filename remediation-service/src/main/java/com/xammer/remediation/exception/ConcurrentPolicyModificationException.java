package com.xammer.remediation.exception;

import lombok.Getter;

/**
 * The policy changed between read and conditional write. The caller must re-fetch and recompute
 * instead of repeating the stale write.
 */
@Getter
public class ConcurrentPolicyModificationException extends RemediationException {

    private final String expectedVersion;

    public ConcurrentPolicyModificationException(String resource, String expectedVersion, Throwable cause) {
        super(RemediationStage.WRITE_POLICY, resource,
                "policy was modified concurrently (expected version " + expectedVersion + ")", cause);
        this.expectedVersion = expectedVersion;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
