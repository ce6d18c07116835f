package com.xammer.remediation.config;

import com.xammer.remediation.domain.AllowList;
import com.xammer.remediation.exception.RemediationConfigurationException;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "remediation")
public class RemediationProperties {

    private NonOrgMembers nonOrgMembers = new NonOrgMembers();
    private Gcp gcp = new Gcp();

    @Data
    public static class NonOrgMembers {
        /** Domains allowed in addition to the organization's own. */
        private List<String> allowDomains = new ArrayList<>();
        /** Resources this remediation may touch, e.g. "organizations/123". Empty means all. */
        private List<String> resources = new ArrayList<>();
        private boolean dryRun = false;
        private Duration timeout = Duration.ofSeconds(30);
        /** Attempts when the policy changes between read and write. */
        private int maxAttempts = 3;
        private Duration retryWait = Duration.ofMillis(200);
    }

    @Data
    public static class Gcp {
        /** Service account key file. Application Default Credentials are used when unset. */
        private String credentialsLocation;
        private Duration rpcTimeout = Duration.ofSeconds(20);
    }

    /**
     * Validated snapshot handed to the executor for one cycle.
     *
     * @throws RemediationConfigurationException if a value is out of range
     */
    public RemediationConfiguration toConfiguration() {
        NonOrgMembers conf = nonOrgMembers;
        if (conf.getMaxAttempts() < 1) {
            throw new RemediationConfigurationException("max-attempts must be at least 1, got " + conf.getMaxAttempts());
        }
        if (conf.getTimeout() == null || conf.getTimeout().isNegative() || conf.getTimeout().isZero()) {
            throw new RemediationConfigurationException("timeout must be positive, got " + conf.getTimeout());
        }
        if (conf.getRetryWait() == null || conf.getRetryWait().isNegative() || conf.getRetryWait().isZero()) {
            throw new RemediationConfigurationException("retry-wait must be positive, got " + conf.getRetryWait());
        }
        return RemediationConfiguration.builder()
                .allowList(AllowList.of(conf.getAllowDomains()))
                .resources(conf.getResources() == null ? List.of() : conf.getResources())
                .dryRun(conf.isDryRun())
                .timeout(conf.getTimeout())
                .maxAttempts(conf.getMaxAttempts())
                .retryWait(conf.getRetryWait())
                .build();
    }
}
