package com.apogee.auth.service;

import lombok.Builder;
import lombok.Value;

/**
 * Client-facing outcome of a code request.
 */
@Value
@Builder
public class OtpDispatch {
    String message;
    String maskedDestination;
    long expiresInSeconds;
}
