package com.apogee.auth.dto.request;

import com.apogee.auth.enums.LoginMethod;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

/**
 * Account sign-up request DTO.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Account sign-up request")
public class SignUpRequest {

    @NotBlank(message = "Email is required")
    @Email(message = "Invalid email format")
    @Schema(description = "Email address, compared case-insensitively", example = "jane@example.com")
    private String email;

    @NotBlank(message = "Password is required")
    @Schema(description = "Password (min 8 chars with an uppercase letter, a number and a symbol)")
    private String password;

    @NotBlank(message = "Phone number is required")
    @Pattern(regexp = "^\\+[1-9]\\d{6,14}$", message = "Phone number must be in E.164 format")
    @Schema(description = "Phone number in E.164 format", example = "+14155551234")
    private String phoneNumber;

    @Schema(description = "Login method to offer first", example = "EMAIL")
    private LoginMethod preferredLoginMethod;
}
