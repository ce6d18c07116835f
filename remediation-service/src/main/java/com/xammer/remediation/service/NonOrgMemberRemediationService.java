package com.xammer.remediation.service;

import com.xammer.remediation.config.RemediationConfiguration;
import com.xammer.remediation.domain.IamPolicy;
import com.xammer.remediation.domain.Organization;
import com.xammer.remediation.domain.PolicyBinding;
import com.xammer.remediation.domain.RemediationValues;
import com.xammer.remediation.exception.ConcurrentPolicyModificationException;
import com.xammer.remediation.exception.RemediationConfigurationException;
import com.xammer.remediation.exception.RemediationStage;
import com.xammer.remediation.gateway.PolicyGateway;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Removes users outside the organization domain and the allow-list from the organization IAM policy.
 * <p>
 * One cycle reads the organization and its policy, filters every binding and writes the result back
 * only when it differs, conditioned on the etag that was read. If the policy changed in between, the
 * cycle re-reads and recomputes up to {@link RemediationConfiguration#getMaxAttempts()} times.
 */
@Service
@Slf4j
public class NonOrgMemberRemediationService {

    private final PolicyGateway policyGateway;
    private final Clock clock;

    public NonOrgMemberRemediationService(PolicyGateway policyGateway, Clock clock) {
        this.policyGateway = policyGateway;
        this.clock = clock;
    }

    public RemediationResult execute(RemediationValues values, RemediationConfiguration config) {
        String resource = values.getTargetResource();
        if (!config.isInScope(resource)) {
            log.info("Skipping {}: not in the configured resources {}", resource, config.getResources());
            return RemediationResult.of(RemediationOutcome.OUT_OF_SCOPE, resource);
        }
        Instant deadline = clock.instant().plus(config.getTimeout());

        Organization organization = policyGateway.getOrganization(values.getOrganizationId(), deadline);
        if (organization.getDomain() == null || organization.getDomain().isBlank()) {
            throw new RemediationConfigurationException(RemediationStage.FETCH_ORGANIZATION,
                    organization.getName(), "organization has no domain");
        }

        Retry retry = Retry.of("non-org-members:" + resource, RetryConfig.custom()
                .maxAttempts(config.getMaxAttempts())
                .waitDuration(config.getRetryWait())
                // A retry that would start after the deadline is not attempted.
                .retryOnException(e -> e instanceof ConcurrentPolicyModificationException
                        && clock.instant().plus(config.getRetryWait()).isBefore(deadline))
                .build());
        retry.getEventPublisher().onRetry(event -> log.warn(
                "Policy of {} changed while remediating, recomputing (attempt {} of {})",
                resource, event.getNumberOfRetryAttempts() + 1, config.getMaxAttempts()));

        return Retry.decorateSupplier(retry, () -> remediate(resource, organization, config, deadline)).get();
    }

    private RemediationResult remediate(String resource, Organization organization,
                                        RemediationConfiguration config, Instant deadline) {
        IamPolicy current = policyGateway.getPolicy(resource, deadline);
        List<PolicyBinding> filtered = PolicyFilter.filter(
                current.getBindings(), organization.getDomain(), config.getAllowList());

        if (filtered.equals(current.getBindings())) {
            log.info("No non-org members on {}, policy left untouched", resource);
            return RemediationResult.of(RemediationOutcome.UNCHANGED, resource);
        }

        Map<String, List<String>> removed = new LinkedHashMap<>();
        for (int i = 0; i < filtered.size(); i++) {
            List<String> gone = PolicyFilter.removedMembers(current.getBindings().get(i), filtered.get(i));
            if (!gone.isEmpty()) {
                removed.computeIfAbsent(filtered.get(i).getRole(), role -> new ArrayList<>()).addAll(gone);
            }
        }

        if (config.isDryRun()) {
            log.info("Dry run: would remove {} from {}", removed, resource);
            return new RemediationResult(RemediationOutcome.DRY_RUN, resource, removed);
        }

        policyGateway.setPolicy(resource, current.withBindings(filtered), current.getEtag(), deadline);
        log.info("✅ Removed non-org members {} from {}", removed, resource);
        return new RemediationResult(RemediationOutcome.REMEDIATED, resource, removed);
    }
}
