package com.xammer.remediation.exception;

import lombok.Getter;

/**
 * The finding belongs to a category this remediation does not handle.
 */
@Getter
public class UnsupportedFindingCategoryException extends RemediationException {

    private final String category;

    public UnsupportedFindingCategoryException(String category, String expected) {
        super(RemediationStage.PARSE, null,
                String.format("unsupported finding category '%s', expected '%s'", category, expected), null);
        this.category = category;
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
