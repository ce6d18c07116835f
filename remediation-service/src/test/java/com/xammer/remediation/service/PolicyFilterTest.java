package com.xammer.remediation.service;

import com.xammer.remediation.domain.AllowList;
import com.xammer.remediation.domain.BindingCondition;
import com.xammer.remediation.domain.PolicyBinding;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PolicyFilterTest {

    private static final String ORG_DOMAIN = "cloudorg.com";

    private final List<PolicyBinding> policy = List.of(
            PolicyBinding.builder()
                    .role("roles/editor")
                    .members(List.of("user:bob@gmail.com", "user:ddgo@cloudorg.com", "group:admins@example.com"))
                    .build(),
            PolicyBinding.builder()
                    .role("roles/viewer")
                    .members(List.of("user:tim@thegmail.com"))
                    .build(),
            PolicyBinding.builder()
                    .role("roles/editor")
                    .members(List.of("user:anyone@google.com", "user:mans@cloudorg.com"))
                    .condition(new BindingCondition("request.time < timestamp(\"2030-01-01T00:00:00Z\")",
                            "expires", null))
                    .build());

    @Test
    void shouldKeepEveryBindingAndRole() {
        List<PolicyBinding> filtered = PolicyFilter.filter(policy, ORG_DOMAIN, AllowList.empty());

        assertThat(filtered).hasSameSizeAs(policy);
        assertThat(filtered).extracting(PolicyBinding::getRole)
                .containsExactly("roles/editor", "roles/viewer", "roles/editor");
        assertThat(filtered.get(1).getMembers()).isEmpty();
    }

    @Test
    void shouldFilterEachBindingIndependentlyAndKeepOrder() {
        List<PolicyBinding> filtered = PolicyFilter.filter(policy, ORG_DOMAIN, AllowList.empty());

        assertThat(filtered.get(0).getMembers())
                .containsExactly("user:ddgo@cloudorg.com", "group:admins@example.com");
        assertThat(filtered.get(2).getMembers()).containsExactly("user:mans@cloudorg.com");
        assertThat(filtered.get(2).getCondition()).isEqualTo(policy.get(2).getCondition());
    }

    @Test
    void shouldBeIdempotent() {
        AllowList allowList = AllowList.of(List.of("google.com"));
        List<PolicyBinding> once = PolicyFilter.filter(policy, ORG_DOMAIN, allowList);
        List<PolicyBinding> twice = PolicyFilter.filter(once, ORG_DOMAIN, allowList);

        assertThat(twice).isEqualTo(once);
    }

    @Test
    void shouldNeverAddMembers() {
        List<PolicyBinding> filtered = PolicyFilter.filter(policy, ORG_DOMAIN, AllowList.of(List.of("gmail.com")));

        for (int i = 0; i < policy.size(); i++) {
            assertThat(policy.get(i).getMembers()).containsAll(filtered.get(i).getMembers());
        }
    }

    @Test
    void shouldReportRemovedMembers() {
        List<PolicyBinding> filtered = PolicyFilter.filter(policy, ORG_DOMAIN, AllowList.empty());

        assertThat(PolicyFilter.removedMembers(policy.get(0), filtered.get(0)))
                .containsExactly("user:bob@gmail.com");
    }
}
