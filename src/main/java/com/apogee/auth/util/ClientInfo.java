package com.apogee.auth.util;

import lombok.Builder;
import lombok.Value;

/**
 * Caller details used for rate-limit keys and the audit trail.
 */
@Value
@Builder
public class ClientInfo {
    String ipAddress;
    String userAgent;
    String correlationId;

    public static ClientInfo unknown() {
        return ClientInfo.builder().ipAddress("unknown").build();
    }
}
