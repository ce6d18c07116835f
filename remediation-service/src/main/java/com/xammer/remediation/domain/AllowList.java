package com.xammer.remediation.domain;

import com.xammer.remediation.exception.RemediationConfigurationException;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Domains trusted in addition to the organization's own. Matching is exact and case-sensitive.
 */
@EqualsAndHashCode
@ToString
public final class AllowList {

    private static final AllowList EMPTY = new AllowList(Collections.emptySet());

    private final Set<String> domains;

    private AllowList(Set<String> domains) {
        this.domains = domains;
    }

    public static AllowList empty() {
        return EMPTY;
    }

    /**
     * @throws RemediationConfigurationException if an entry is blank or is not a bare domain
     */
    public static AllowList of(Collection<String> domains) {
        if (domains == null || domains.isEmpty()) {
            return EMPTY;
        }
        Set<String> validated = new LinkedHashSet<>();
        for (String domain : domains) {
            if (domain == null || domain.isBlank()) {
                throw new RemediationConfigurationException("allow-list contains a blank domain");
            }
            if (domain.contains("@") || domain.contains(":") || domain.chars().anyMatch(Character::isWhitespace)) {
                throw new RemediationConfigurationException("allow-list entry '" + domain + "' is not a bare domain");
            }
            validated.add(domain);
        }
        return new AllowList(Collections.unmodifiableSet(validated));
    }

    public boolean contains(String domain) {
        return domains.contains(domain);
    }

    public Set<String> getDomains() {
        return domains;
    }
}
