package com.xammer.remediation.domain;

import lombok.Builder;
import lombok.Data;
import lombok.Singular;

import java.util.List;

/**
 * A role and the ordered members granted it.
 */
@Data
@Builder(toBuilder = true)
public class PolicyBinding {

    private final String role;

    @Singular
    private final List<String> members;

    /** Null for unconditional bindings. */
    private final BindingCondition condition;

    public PolicyBinding withMembers(List<String> newMembers) {
        return toBuilder().clearMembers().members(newMembers).build();
    }
}
