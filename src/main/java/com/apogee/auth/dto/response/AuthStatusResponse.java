package com.apogee.auth.dto.response;

import com.apogee.auth.enums.LoginMethod;
import com.apogee.auth.enums.MfaMethod;
import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Authentication settings of the signed-in account")
public class AuthStatusResponse {

    private UUID accountId;

    @Schema(example = "jane@example.com")
    private String email;

    @Schema(description = "Masked phone number", example = "+1415***1234")
    private String phoneNumber;

    private boolean phoneVerified;

    private boolean emailVerified;

    private boolean mfaEnabled;

    private MfaMethod mfaMethod;

    private boolean biometricEnabled;

    private LoginMethod preferredLoginMethod;
}
