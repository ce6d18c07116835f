package com.xammer.remediation.domain;

import lombok.Builder;
import lombok.Data;
import lombok.Singular;

import java.util.List;

/**
 * Snapshot of an access policy document together with the version it was read at.
 */
@Data
@Builder(toBuilder = true)
public class IamPolicy {

    @Singular
    private final List<PolicyBinding> bindings;

    /**
     * Opaque version token observed on read, sent back on a conditional write.
     */
    private final String etag;

    private final int version;

    public IamPolicy withBindings(List<PolicyBinding> newBindings) {
        return toBuilder().clearBindings().bindings(newBindings).build();
    }
}
