package com.apogee.auth.service;

import com.apogee.auth.enums.MfaMethod;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * A live second-factor challenge handed to the client after a password match.
 */
@Value
@Builder
public class MfaChallenge {
    UUID accountId;
    String challengeToken;
    Instant expiresAt;
    List<MfaMethod> availableMethods;
    MfaMethod preferredMethod;
}
