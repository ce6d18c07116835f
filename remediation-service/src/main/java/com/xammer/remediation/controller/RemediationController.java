package com.xammer.remediation.controller;

import com.xammer.remediation.dto.PubSubPushRequest;
import com.xammer.remediation.exception.MalformedPayloadException;
import com.xammer.remediation.service.RemediationDispatcher;
import com.xammer.remediation.service.RemediationResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Base64;

@RestController
@RequestMapping("/api/remediation")
@Slf4j
public class RemediationController {

    private final RemediationDispatcher remediationDispatcher;

    public RemediationController(RemediationDispatcher remediationDispatcher) {
        this.remediationDispatcher = remediationDispatcher;
    }

    /**
     * Pub/Sub push endpoint for NON_ORG_IAM_MEMBER notifications.
     * A 2xx acknowledges the message; failures are mapped by {@code RemediationExceptionHandler}.
     */
    @PostMapping("/non-org-members")
    public ResponseEntity<Void> removeNonOrgMembers(@RequestBody PubSubPushRequest request) {
        if (request.getMessage() == null || request.getMessage().getData() == null) {
            throw new MalformedPayloadException("push request has no message data");
        }
        byte[] payload;
        try {
            payload = Base64.getDecoder().decode(request.getMessage().getData());
        } catch (IllegalArgumentException e) {
            throw new MalformedPayloadException("message data is not base64", e);
        }
        log.debug("Handling message {} from {}", request.getMessage().getMessageId(), request.getSubscription());

        RemediationResult result = remediationDispatcher.dispatch(payload);
        log.info("Message {} finished with {} ({} members removed)",
                request.getMessage().getMessageId(), result.getOutcome(), result.getRemovedCount());
        return ResponseEntity.noContent().build();
    }
}
