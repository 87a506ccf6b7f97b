package com.apogee.auth.dto.response;

import com.apogee.auth.enums.OtpPurpose;
import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Outcome of a one-time code request or confirmation")
public class OtpResponse {

    private OtpPurpose purpose;

    @Schema(description = "Destination the code went to, masked", example = "+1415***1234")
    private String destination;

    @Schema(description = "Seconds until the code expires", example = "600")
    private Long expiresInSeconds;

    @Schema(description = "Set when a code was confirmed")
    private Boolean verified;

    @Schema(description = "Credentials, for sign-in and MFA codes")
    private AuthResponse auth;

    @Schema(description = "Single-use reset token, for password reset codes")
    private String resetToken;
}
