package com.xammer.remediation.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Body of a Pub/Sub push delivery.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class PubSubPushRequest {
    private PubSubMessage message;
    private String subscription;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PubSubMessage {
        /** Base64 encoded payload. */
        private String data;
        private String messageId;
        private String publishTime;
        private Map<String, String> attributes;
    }
}
