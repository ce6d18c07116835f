package com.xammer.remediation.exception;

import com.xammer.remediation.dto.DiscardedEventDto;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.util.Date;
import java.util.HashMap;
import java.util.Map;

/**
 * Translates remediation failures into push responses. Pub/Sub redelivers on anything but 2xx,
 * so events that can never succeed are acknowledged with 200.
 */
@ControllerAdvice
@Slf4j
public class RemediationExceptionHandler {

    @ExceptionHandler(UnsupportedFindingCategoryException.class)
    public ResponseEntity<DiscardedEventDto> handleUnsupportedCategory(UnsupportedFindingCategoryException ex) {
        log.warn("Discarding event: {}", ex.getMessage());
        return ResponseEntity.ok(new DiscardedEventDto("DISCARDED", "UNSUPPORTED_CATEGORY", ex.getMessage()));
    }

    @ExceptionHandler(MalformedPayloadException.class)
    public ResponseEntity<DiscardedEventDto> handleMalformedPayload(MalformedPayloadException ex) {
        log.warn("Discarding malformed event: {}", ex.getMessage());
        return ResponseEntity.ok(new DiscardedEventDto("DISCARDED", "MALFORMED_PAYLOAD", ex.getMessage()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<DiscardedEventDto> handleUnreadableBody(HttpMessageNotReadableException ex) {
        log.warn("Discarding unreadable push request: {}", ex.getMessage());
        return ResponseEntity.ok(new DiscardedEventDto("DISCARDED", "MALFORMED_PAYLOAD", "push request is not valid JSON"));
    }

    @ExceptionHandler(RemediationException.class)
    public ResponseEntity<Map<String, Object>> handleRemediationFailure(RemediationException ex) {
        HttpStatus status = ex.isRetryable() ? HttpStatus.SERVICE_UNAVAILABLE : HttpStatus.INTERNAL_SERVER_ERROR;
        log.error("Remediation failed at {} for {}: {}", ex.getStage(), ex.getResource(), ex.getMessage(), ex);

        Map<String, Object> body = new HashMap<>();
        body.put("timestamp", new Date());
        body.put("stage", ex.getStage());
        body.put("resource", ex.getResource());
        body.put("retryable", ex.isRetryable());
        body.put("message", ex.getMessage());
        return new ResponseEntity<>(body, status);
    }
}
