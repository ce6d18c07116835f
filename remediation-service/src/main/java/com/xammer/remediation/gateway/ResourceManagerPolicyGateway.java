package com.xammer.remediation.gateway;

import com.google.api.gax.grpc.GrpcCallContext;
import com.google.api.gax.rpc.AbortedException;
import com.google.api.gax.rpc.ApiCallContext;
import com.google.api.gax.rpc.ApiException;
import com.google.api.gax.rpc.DeadlineExceededException;
import com.google.cloud.resourcemanager.v3.GetOrganizationRequest;
import com.google.cloud.resourcemanager.v3.OrganizationName;
import com.google.cloud.resourcemanager.v3.OrganizationsClient;
import com.google.iam.v1.Binding;
import com.google.iam.v1.GetIamPolicyRequest;
import com.google.iam.v1.GetPolicyOptions;
import com.google.iam.v1.Policy;
import com.google.iam.v1.SetIamPolicyRequest;
import com.google.protobuf.ByteString;
import com.google.type.Expr;
import com.xammer.remediation.domain.BindingCondition;
import com.xammer.remediation.domain.IamPolicy;
import com.xammer.remediation.domain.Organization;
import com.xammer.remediation.domain.PolicyBinding;
import com.xammer.remediation.exception.ConcurrentPolicyModificationException;
import com.xammer.remediation.exception.PolicyFetchException;
import com.xammer.remediation.exception.PolicyWriteException;
import com.xammer.remediation.exception.RemediationDeadlineExceededException;
import com.xammer.remediation.exception.RemediationStage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.stream.Collectors;

/**
 * {@link PolicyGateway} backed by the Cloud Resource Manager v3 API.
 * The IAM policy etag is the version used for conditional writes; the API answers a stale etag with ABORTED.
 */
@Component
@Slf4j
public class ResourceManagerPolicyGateway implements PolicyGateway {

    // Highest policy schema version, needed to read conditional bindings without losing them.
    private static final int REQUESTED_POLICY_VERSION = 3;

    private final OrganizationsClient organizationsClient;
    private final Clock clock;

    public ResourceManagerPolicyGateway(OrganizationsClient organizationsClient, Clock clock) {
        this.organizationsClient = organizationsClient;
        this.clock = clock;
    }

    @Override
    public Organization getOrganization(String organizationId, Instant deadline) {
        String name = OrganizationName.of(organizationId).toString();
        ApiCallContext context = callContext(RemediationStage.FETCH_ORGANIZATION, name, deadline);
        try {
            com.google.cloud.resourcemanager.v3.Organization org = organizationsClient.getOrganizationCallable()
                    .call(GetOrganizationRequest.newBuilder().setName(name).build(), context);
            // The display name of an organization is its primary domain.
            return new Organization(organizationId, org.getName(), org.getDisplayName());
        } catch (DeadlineExceededException e) {
            throw new RemediationDeadlineExceededException(RemediationStage.FETCH_ORGANIZATION, name, e);
        } catch (ApiException e) {
            throw new PolicyFetchException(RemediationStage.FETCH_ORGANIZATION, name,
                    "failed to get organization (" + e.getStatusCode().getCode() + ")", e);
        }
    }

    @Override
    public IamPolicy getPolicy(String resource, Instant deadline) {
        ApiCallContext context = callContext(RemediationStage.FETCH_POLICY, resource, deadline);
        GetIamPolicyRequest request = GetIamPolicyRequest.newBuilder()
                .setResource(resource)
                .setOptions(GetPolicyOptions.newBuilder().setRequestedPolicyVersion(REQUESTED_POLICY_VERSION))
                .build();
        try {
            Policy policy = organizationsClient.getIamPolicyCallable().call(request, context);
            log.debug("Read policy of {} with {} bindings", resource, policy.getBindingsCount());
            return toDomain(policy);
        } catch (DeadlineExceededException e) {
            throw new RemediationDeadlineExceededException(RemediationStage.FETCH_POLICY, resource, e);
        } catch (ApiException e) {
            throw new PolicyFetchException(RemediationStage.FETCH_POLICY, resource,
                    "failed to get IAM policy (" + e.getStatusCode().getCode() + ")", e);
        }
    }

    @Override
    public void setPolicy(String resource, IamPolicy policy, String expectedVersion, Instant deadline) {
        ApiCallContext context = callContext(RemediationStage.WRITE_POLICY, resource, deadline);
        SetIamPolicyRequest request = SetIamPolicyRequest.newBuilder()
                .setResource(resource)
                .setPolicy(toProto(policy, expectedVersion))
                .build();
        try {
            organizationsClient.setIamPolicyCallable().call(request, context);
        } catch (AbortedException e) {
            throw new ConcurrentPolicyModificationException(resource, expectedVersion, e);
        } catch (DeadlineExceededException e) {
            throw new RemediationDeadlineExceededException(RemediationStage.WRITE_POLICY, resource, e);
        } catch (ApiException e) {
            throw new PolicyWriteException(resource,
                    "failed to set IAM policy (" + e.getStatusCode().getCode() + ")", e);
        }
    }

    private ApiCallContext callContext(RemediationStage stage, String resource, Instant deadline) {
        Duration remaining = Duration.between(clock.instant(), deadline);
        if (remaining.isNegative() || remaining.isZero()) {
            throw new RemediationDeadlineExceededException(stage, resource, null);
        }
        return GrpcCallContext.createDefault()
                .withTimeout(org.threeten.bp.Duration.ofMillis(remaining.toMillis()));
    }

    static IamPolicy toDomain(Policy policy) {
        return IamPolicy.builder()
                .version(policy.getVersion())
                .etag(Base64.getEncoder().encodeToString(policy.getEtag().toByteArray()))
                .bindings(policy.getBindingsList().stream()
                        .map(ResourceManagerPolicyGateway::toDomain)
                        .collect(Collectors.toList()))
                .build();
    }

    private static PolicyBinding toDomain(Binding binding) {
        return PolicyBinding.builder()
                .role(binding.getRole())
                .members(binding.getMembersList())
                .condition(binding.hasCondition()
                        ? new BindingCondition(binding.getCondition().getExpression(),
                                binding.getCondition().getTitle(), binding.getCondition().getDescription())
                        : null)
                .build();
    }

    static Policy toProto(IamPolicy policy, String expectedVersion) {
        Policy.Builder builder = Policy.newBuilder()
                .setVersion(policy.getVersion())
                .setEtag(ByteString.copyFrom(Base64.getDecoder().decode(expectedVersion)));
        for (PolicyBinding binding : policy.getBindings()) {
            Binding.Builder b = Binding.newBuilder()
                    .setRole(binding.getRole())
                    .addAllMembers(binding.getMembers());
            BindingCondition condition = binding.getCondition();
            if (condition != null) {
                Expr.Builder expr = Expr.newBuilder().setExpression(condition.getExpression());
                if (condition.getTitle() != null) {
                    expr.setTitle(condition.getTitle());
                }
                if (condition.getDescription() != null) {
                    expr.setDescription(condition.getDescription());
                }
                b.setCondition(expr);
            }
            builder.addBindings(b);
        }
        return builder.build();
    }
}
