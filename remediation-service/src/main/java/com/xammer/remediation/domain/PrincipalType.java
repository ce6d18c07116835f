package com.xammer.remediation.domain;

import java.util.Arrays;

public enum PrincipalType {
    USER("user"),
    SERVICE_ACCOUNT("serviceAccount"),
    GROUP("group"),
    DOMAIN("domain"),
    OTHER(null);

    private final String prefix;

    PrincipalType(String prefix) {
        this.prefix = prefix;
    }

    public String getPrefix() {
        return prefix;
    }

    public static PrincipalType fromPrefix(String prefix) {
        return Arrays.stream(values())
                .filter(t -> t.prefix != null && t.prefix.equals(prefix))
                .findFirst()
                .orElse(OTHER);
    }
}
