package com.apogee.auth.dto.request;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import jakarta.validation.constraints.NotBlank;

/**
 * Email and password sign-in request DTO.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Sign-in request with email and password")
public class SignInRequest {

    @NotBlank(message = "Email is required")
    @Schema(description = "Email address", example = "jane@example.com")
    private String email;

    @NotBlank(message = "Password is required")
    @Schema(description = "Account password")
    private String password;
}
