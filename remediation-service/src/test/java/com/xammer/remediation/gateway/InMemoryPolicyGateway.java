package com.xammer.remediation.gateway;

import com.xammer.remediation.domain.IamPolicy;
import com.xammer.remediation.domain.Organization;
import com.xammer.remediation.exception.ConcurrentPolicyModificationException;
import com.xammer.remediation.exception.PolicyFetchException;
import com.xammer.remediation.exception.RemediationStage;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Versioned in-memory policy store. Each write bumps the etag, a write with a stale etag is rejected.
 */
public class InMemoryPolicyGateway implements PolicyGateway {

    private final Map<String, Organization> organizations = new HashMap<>();
    private final Map<String, IamPolicy> policies = new HashMap<>();
    private final List<IamPolicy> writes = new ArrayList<>();
    private int getPolicyCalls;
    private int nextVersion = 1;

    /** Runs before each read returns, to simulate a concurrent writer. */
    private Consumer<String> beforeReadReturns = resource -> { };

    public void putOrganization(Organization organization) {
        organizations.put(organization.getId(), organization);
    }

    public void putPolicy(String resource, IamPolicy policy) {
        policies.put(resource, policy.toBuilder().etag("etag-" + nextVersion++).build());
    }

    public void onRead(Consumer<String> hook) {
        this.beforeReadReturns = hook;
    }

    @Override
    public Organization getOrganization(String organizationId, Instant deadline) {
        Organization organization = organizations.get(organizationId);
        if (organization == null) {
            throw new PolicyFetchException(RemediationStage.FETCH_ORGANIZATION,
                    "organizations/" + organizationId, "not found", null);
        }
        return organization;
    }

    @Override
    public IamPolicy getPolicy(String resource, Instant deadline) {
        getPolicyCalls++;
        IamPolicy policy = policies.get(resource);
        if (policy == null) {
            throw new PolicyFetchException(RemediationStage.FETCH_POLICY, resource, "not found", null);
        }
        beforeReadReturns.accept(resource);
        return policy;
    }

    @Override
    public void setPolicy(String resource, IamPolicy policy, String expectedVersion, Instant deadline) {
        IamPolicy stored = policies.get(resource);
        if (stored == null || !stored.getEtag().equals(expectedVersion)) {
            throw new ConcurrentPolicyModificationException(resource, expectedVersion, null);
        }
        writes.add(policy);
        putPolicy(resource, policy);
    }

    public IamPolicy currentPolicy(String resource) {
        return policies.get(resource);
    }

    public List<IamPolicy> getWrites() {
        return writes;
    }

    public int getPolicyCalls() {
        return getPolicyCalls;
    }
}
