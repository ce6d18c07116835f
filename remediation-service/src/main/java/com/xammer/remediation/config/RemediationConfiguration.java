package com.xammer.remediation.config;

import com.xammer.remediation.domain.AllowList;
import lombok.Builder;
import lombok.Data;
import lombok.Singular;

import java.time.Duration;
import java.util.Set;

/**
 * Immutable configuration of the non-org member remediation, passed explicitly to each cycle.
 */
@Data
@Builder
public class RemediationConfiguration {

    @Builder.Default
    private final AllowList allowList = AllowList.empty();

    @Singular
    private final Set<String> resources;

    private final boolean dryRun;

    @Builder.Default
    private final Duration timeout = Duration.ofSeconds(30);

    @Builder.Default
    private final int maxAttempts = 3;

    @Builder.Default
    private final Duration retryWait = Duration.ofMillis(200);

    /**
     * True when no resource restriction is configured or {@code resource} is listed.
     */
    public boolean isInScope(String resource) {
        return resources.isEmpty() || resources.contains(resource);
    }
}
