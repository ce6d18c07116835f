package com.xammer.remediation.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Wire shape of a Security Command Center notification.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class FindingNotification {
    private String notificationConfigName;
    private FindingPayload finding;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class FindingPayload {
        private String name;
        private String parent;
        private String resourceName;
        private String state;    // "ACTIVE" or "INACTIVE"
        private String category; // e.g. "NON_ORG_IAM_MEMBER"
        private String externalUri;
        private Map<String, Object> sourceProperties;
        private SecurityMarks securityMarks;
        private String eventTime;
        private String createTime;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SecurityMarks {
        private String name;
        private Map<String, String> marks;
    }
}
