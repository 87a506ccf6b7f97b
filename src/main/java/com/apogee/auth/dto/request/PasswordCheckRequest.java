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
@Schema(description = "Check a candidate password against the policy")
public class PasswordCheckRequest {

    @NotBlank(message = "Password is required")
    private String password;

    @Schema(description = "Email of the account, if known", example = "jane@example.com")
    private String email;
}
