package com.xammer.remediation.domain;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * An organization and its own canonical email domain.
 */
@Data
@AllArgsConstructor
public class Organization {
    private final String id;
    private final String name;   // e.g. "organizations/1050000000008"
    private final String domain; // e.g. "cloudorg.com"
}
