package com.xammer.remediation.parser;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.xammer.remediation.domain.Finding;
import com.xammer.remediation.domain.FindingState;
import com.xammer.remediation.dto.FindingNotification;
import com.xammer.remediation.exception.MalformedPayloadException;
import com.xammer.remediation.exception.UnsupportedFindingCategoryException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Collections;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Decodes a raw notification into a {@link Finding} for the non-org IAM member remediation.
 */
@Component
@Slf4j
public class FindingParser {

    public static final String NON_ORG_IAM_MEMBER = "NON_ORG_IAM_MEMBER";

    // "organizations/123/sources/..." as well as "//cloudresourcemanager.googleapis.com/organizations/123"
    private static final Pattern ORGANIZATION_PATH = Pattern.compile("(?:^|/)organizations/(\\d+)(?:/|$)");

    private final ObjectMapper objectMapper;

    public FindingParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @throws UnsupportedFindingCategoryException if the finding is of another category
     * @throws MalformedPayloadException           if the payload cannot be decoded
     */
    public Finding parse(byte[] raw) {
        if (raw == null || raw.length == 0) {
            throw new MalformedPayloadException("empty notification payload");
        }
        FindingNotification notification;
        try {
            notification = objectMapper.readValue(raw, FindingNotification.class);
        } catch (IOException e) {
            throw new MalformedPayloadException("notification is not valid JSON: " + e.getMessage(), e);
        }
        FindingNotification.FindingPayload payload = notification.getFinding();
        if (payload == null) {
            throw new MalformedPayloadException("notification has no finding");
        }
        if (!NON_ORG_IAM_MEMBER.equals(payload.getCategory())) {
            throw new UnsupportedFindingCategoryException(payload.getCategory(), NON_ORG_IAM_MEMBER);
        }

        String organizationId = Stream.of(payload.getParent(), payload.getName(), payload.getResourceName())
                .map(FindingParser::organizationIdOf)
                .flatMap(Optional::stream)
                .findFirst()
                .orElseThrow(() -> new MalformedPayloadException(String.format(
                        "no organization id in parent '%s' or resource name '%s'",
                        payload.getParent(), payload.getResourceName())));

        Finding finding = Finding.builder()
                .name(payload.getName())
                .parent(payload.getParent())
                .resourceName(payload.getResourceName())
                .organizationId(organizationId)
                .category(payload.getCategory())
                .state(stateOf(payload.getState()))
                .notificationConfigName(notification.getNotificationConfigName())
                .securityMarksName(payload.getSecurityMarks() == null ? null : payload.getSecurityMarks().getName())
                .createTime(timeOf("createTime", payload.getCreateTime()))
                .eventTime(timeOf("eventTime", payload.getEventTime()))
                .sourceProperties(payload.getSourceProperties() == null
                        ? Collections.emptyMap() : payload.getSourceProperties())
                .build();
        log.debug("Parsed finding {} for organization {}", finding.getName(), organizationId);
        return finding;
    }

    static Optional<String> organizationIdOf(String path) {
        if (path == null) {
            return Optional.empty();
        }
        Matcher m = ORGANIZATION_PATH.matcher(path);
        return m.find() ? Optional.of(m.group(1)) : Optional.empty();
    }

    private static FindingState stateOf(String state) {
        if (state == null) {
            throw new MalformedPayloadException("finding has no state");
        }
        try {
            return FindingState.valueOf(state);
        } catch (IllegalArgumentException e) {
            throw new MalformedPayloadException("unknown finding state '" + state + "'", e);
        }
    }

    private static Instant timeOf(String field, String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            throw new MalformedPayloadException(String.format("%s '%s' is not an RFC 3339 timestamp", field, value), e);
        }
    }
}
