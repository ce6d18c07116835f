package com.xammer.remediation.domain;

import com.xammer.remediation.exception.RemediationConfigurationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AllowListTest {

    @Test
    void shouldMatchExactDomainsOnly() {
        AllowList allowList = AllowList.of(List.of("google.com", "prod.google.com"));

        assertTrue(allowList.contains("google.com"));
        assertTrue(allowList.contains("prod.google.com"));
        assertFalse(allowList.contains("dev.google.com"));
        assertFalse(allowList.contains("GOOGLE.COM"));
    }

    @Test
    void shouldTreatMissingListAsEmpty() {
        assertSame(AllowList.empty(), AllowList.of(null));
        assertFalse(AllowList.of(List.of()).contains(""));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", " ", "bob@google.com", "user:google.com", "google .com"})
    void shouldRejectEntriesThatAreNotBareDomains(String entry) {
        assertThrows(RemediationConfigurationException.class, () -> AllowList.of(List.of(entry)));
    }

    @Test
    void shouldRejectNullEntry() {
        assertThrows(RemediationConfigurationException.class, () -> AllowList.of(Arrays.asList("google.com", null)));
    }
}
