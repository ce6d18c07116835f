package com.xammer.remediation.gateway;

import com.xammer.remediation.domain.IamPolicy;
import com.xammer.remediation.domain.Organization;
import com.xammer.remediation.exception.ConcurrentPolicyModificationException;
import com.xammer.remediation.exception.PolicyFetchException;
import com.xammer.remediation.exception.PolicyWriteException;
import com.xammer.remediation.exception.RemediationDeadlineExceededException;

import java.time.Instant;

/**
 * Read and conditional write access to an organization's access policy.
 * Every call gives up once {@code deadline} has passed.
 */
public interface PolicyGateway {

    /**
     * @throws PolicyFetchException                 on any lookup failure
     * @throws RemediationDeadlineExceededException if the deadline expires
     */
    Organization getOrganization(String organizationId, Instant deadline);

    /**
     * Returns the policy together with its version ({@link IamPolicy#getEtag()}).
     *
     * @throws PolicyFetchException                 on any read failure
     * @throws RemediationDeadlineExceededException if the deadline expires
     */
    IamPolicy getPolicy(String resource, Instant deadline);

    /**
     * Replaces the policy only if its current version is still {@code expectedVersion}.
     *
     * @throws ConcurrentPolicyModificationException if the version no longer matches
     * @throws PolicyWriteException                  on any other write failure
     * @throws RemediationDeadlineExceededException  if the deadline expires
     */
    void setPolicy(String resource, IamPolicy policy, String expectedVersion, Instant deadline);
}
