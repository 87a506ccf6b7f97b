package com.apogee.auth.dto.request;

import com.apogee.auth.enums.MfaMethod;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Send a sign-in MFA code over the chosen method")
public class MfaSendCodeRequest {

    @NotNull(message = "Account ID is required")
    @Schema(description = "Account from the sign-in response")
    private UUID accountId;

    @NotBlank(message = "MFA session token is required")
    @Schema(description = "MFA session token from the sign-in response")
    private String mfaSessionToken;

    @NotNull(message = "Method is required")
    @Schema(description = "Delivery method", example = "SMS")
    private MfaMethod method;
}
