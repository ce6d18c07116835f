package com.xammer.remediation.service;

import com.xammer.remediation.domain.AllowList;
import com.xammer.remediation.domain.PolicyBinding;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Applies {@link PrincipalMatcher} to every binding of a policy. Bindings are never dropped, members are
 * never added and their order is kept, so filtering a filtered policy changes nothing.
 */
public final class PolicyFilter {

    private PolicyFilter() {
    }

    public static List<PolicyBinding> filter(List<PolicyBinding> bindings, String orgDomain, AllowList allowList) {
        return bindings.stream()
                .map(binding -> binding.withMembers(binding.getMembers().stream()
                        .filter(member -> PrincipalMatcher.isAllowed(member, orgDomain, allowList))
                        .collect(Collectors.toList())))
                .collect(Collectors.toList());
    }

    /**
     * Members present in {@code before} but not in {@code after}, per role, in original order.
     */
    public static List<String> removedMembers(PolicyBinding before, PolicyBinding after) {
        return before.getMembers().stream()
                .filter(member -> !after.getMembers().contains(member))
                .collect(Collectors.toList());
    }
}
