package com.apogee.auth.dto.request;

import com.apogee.auth.enums.MfaMethod;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Enable MFA: without a code a setup code is sent, with a code the setup is confirmed")
public class MfaSetupRequest {

    @NotNull(message = "Method is required")
    @Schema(description = "MFA method to enable", example = "SMS")
    private MfaMethod method;

    @Pattern(regexp = "^[0-9]{4,10}$", message = "Code must be 4-10 digits")
    @Schema(description = "Setup code, required when confirming", example = "123456")
    private String code;
}
