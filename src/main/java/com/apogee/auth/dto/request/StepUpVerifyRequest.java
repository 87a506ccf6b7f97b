package com.apogee.auth.dto.request;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Second-factor code for a sensitive operation")
public class StepUpVerifyRequest {

    @NotBlank(message = "Code is required")
    @Pattern(regexp = "^[0-9]{4,10}$", message = "Code must be 4-10 digits")
    @Schema(description = "MFA code", example = "123456")
    private String code;
}
