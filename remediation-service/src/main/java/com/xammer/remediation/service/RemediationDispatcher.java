package com.xammer.remediation.service;

import com.xammer.remediation.config.RemediationConfiguration;
import com.xammer.remediation.config.RemediationProperties;
import com.xammer.remediation.domain.Finding;
import com.xammer.remediation.domain.RemediationValues;
import com.xammer.remediation.parser.FindingParser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Entry point for a trigger event: decodes it, builds the cycle inputs and runs the remediation.
 * Exceptions are left to the caller, which decides about redelivery.
 */
@Service
@Slf4j
public class RemediationDispatcher {

    private final FindingParser findingParser;
    private final NonOrgMemberRemediationService remediationService;
    private final RemediationProperties properties;

    public RemediationDispatcher(FindingParser findingParser,
                                 NonOrgMemberRemediationService remediationService,
                                 RemediationProperties properties) {
        this.findingParser = findingParser;
        this.remediationService = remediationService;
        this.properties = properties;
    }

    public RemediationResult dispatch(byte[] payload) {
        Finding finding = findingParser.parse(payload);
        RemediationValues values = new RemediationValues(finding.getOrganizationId());

        log.info("Received {} finding {} (severity={}, scanner={})",
                finding.getCategory(), finding.getName(),
                finding.getSourceProperties().getOrDefault("SeverityLevel", "n/a"),
                finding.getSourceProperties().getOrDefault("ScannerName", "n/a"));

        if (!finding.isActive()) {
            log.info("Finding {} is {}, nothing to remediate", finding.getName(), finding.getState());
            return RemediationResult.of(RemediationOutcome.SKIPPED_INACTIVE, values.getTargetResource());
        }

        RemediationConfiguration configuration = properties.toConfiguration();
        return remediationService.execute(values, configuration);
    }
}
