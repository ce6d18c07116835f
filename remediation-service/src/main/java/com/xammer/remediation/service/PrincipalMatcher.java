package com.xammer.remediation.service;

import com.xammer.remediation.domain.AllowList;
import com.xammer.remediation.domain.Principal;
import com.xammer.remediation.domain.PrincipalType;

/**
 * Decides whether a binding member may stay on a policy.
 * <p>
 * Only {@code user:} members are judged. Their domain must equal the organization domain or be on the
 * allow-list, compared as whole strings: {@code evilgoogle.com} and {@code google.com.ev} never match
 * {@code google.com}, and a subdomain is allowed only when listed itself.
 */
public final class PrincipalMatcher {

    private PrincipalMatcher() {
    }

    public static boolean isAllowed(String member, String orgDomain, AllowList allowList) {
        Principal principal = Principal.parse(member);
        if (principal.getType() != PrincipalType.USER) {
            return true;
        }
        String domain = principal.getDomain();
        return domain.equals(orgDomain) || allowList.contains(domain);
    }
}
