package com.xammer.remediation.domain;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * A binding member such as {@code user:bob@example.com}, split into its type and identifier.
 */
@Data
@AllArgsConstructor
public class Principal {

    private final PrincipalType type;
    private final String identifier;

    /**
     * Splits on the first {@code ':'}. Members without a type prefix ({@code allUsers}) are {@link PrincipalType#OTHER}.
     */
    public static Principal parse(String member) {
        int idx = member.indexOf(':');
        if (idx < 0) {
            return new Principal(PrincipalType.OTHER, member);
        }
        return new Principal(PrincipalType.fromPrefix(member.substring(0, idx)), member.substring(idx + 1));
    }

    /**
     * Text after the last {@code '@'} of the identifier, empty if there is none.
     */
    public String getDomain() {
        int at = identifier.lastIndexOf('@');
        return at < 0 ? "" : identifier.substring(at + 1);
    }
}
