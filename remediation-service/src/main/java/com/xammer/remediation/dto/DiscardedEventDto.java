package com.xammer.remediation.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Returned when an event is acknowledged without being remediated.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class DiscardedEventDto {
    private String status;  // "DISCARDED"
    private String reason;
    private String message;
}
