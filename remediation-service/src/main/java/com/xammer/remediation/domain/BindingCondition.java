package com.xammer.remediation.domain;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Condition attached to a binding. Carried through remediation untouched.
 */
@Data
@AllArgsConstructor
public class BindingCondition {
    private final String expression;
    private final String title;
    private final String description;
}
