package com.apogee.auth.dto.request;

import com.apogee.auth.enums.MfaMethod;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;

import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "MFA verification request")
public class MfaVerificationRequest {

    @NotNull(message = "Account ID is required")
    @Schema(description = "Account from the sign-in response")
    private UUID accountId;

    @NotBlank(message = "MFA session token is required")
    @Schema(description = "MFA session token from the sign-in response")
    private String mfaSessionToken;

    @NotBlank(message = "MFA code is required")
    @Pattern(regexp = "^[0-9]{4,10}$", message = "MFA code must be 4-10 digits")
    @Schema(description = "MFA verification code", example = "123456")
    private String code;

    @NotNull(message = "Method is required")
    @Schema(description = "Method the code was sent over", example = "SMS")
    private MfaMethod method;
}
