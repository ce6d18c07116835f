package com.xammer.remediation.domain;

public enum FindingState {
    ACTIVE,
    INACTIVE
}
