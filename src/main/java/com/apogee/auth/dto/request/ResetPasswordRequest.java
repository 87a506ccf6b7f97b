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
@Schema(description = "Reset password with token request")
public class ResetPasswordRequest {

    @NotBlank(message = "Email is required")
    @Schema(description = "Account email", example = "jane@example.com")
    private String email;

    @NotBlank(message = "Reset token is required")
    @Schema(description = "Reset token returned when the reset code was confirmed")
    private String resetToken;

    @NotBlank(message = "New password is required")
    @Schema(description = "New password")
    private String newPassword;
}
