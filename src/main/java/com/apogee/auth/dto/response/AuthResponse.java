package com.apogee.auth.dto.response;

import com.apogee.auth.enums.MfaMethod;
import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Result of a sign-in step: either a credential pair or an MFA challenge.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Authentication response with tokens or an MFA challenge")
public class AuthResponse {

    @Schema(description = "Account identifier")
    private UUID accountId;

    @Schema(description = "JWT access token")
    private String accessToken;

    @Schema(description = "JWT refresh token")
    private String refreshToken;

    @Schema(description = "Token type, present with credentials", example = "Bearer")
    private String tokenType;

    @Schema(description = "Access token expiration in seconds", example = "900")
    private Long expiresIn;

    @Schema(description = "Refresh token expiry")
    private Instant refreshExpiresAt;

    @Builder.Default
    @Schema(description = "MFA required flag", example = "false")
    private Boolean mfaRequired = false;

    @Schema(description = "MFA session token to present with the second factor")
    private String mfaSessionToken;

    @Schema(description = "MFA session expiry")
    private Instant mfaSessionExpiresAt;

    @Schema(description = "Methods the second factor can be sent over")
    private List<MfaMethod> availableMethods;

    @Schema(description = "Method the account enrolled with")
    private MfaMethod preferredMethod;

    @Schema(description = "Authentication timestamp")
    private Instant authenticatedAt;
}
