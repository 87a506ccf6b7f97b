package com.apogee.auth.dto.request;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import jakarta.validation.constraints.NotBlank;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Request a password reset code")
public class ForgotPasswordRequest {

    @NotBlank(message = "Email is required")
    @Schema(description = "Account email", example = "jane@example.com")
    private String email;
}
