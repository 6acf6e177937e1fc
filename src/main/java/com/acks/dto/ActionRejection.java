package com.acks.dto;

import com.acks.exception.ErrorKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Sent only to the session whose request failed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ActionRejection {
    private String destination;
    private String reason;
    private ErrorKind kind;
    /** Offered to the DM when a request failed only on legality: resend it as a forced action. */
    private boolean forceAvailable;
}
