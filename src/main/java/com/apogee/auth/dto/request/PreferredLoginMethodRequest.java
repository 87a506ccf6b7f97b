package com.apogee.auth.dto.request;

import com.apogee.auth.enums.LoginMethod;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import jakarta.validation.constraints.NotNull;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PreferredLoginMethodRequest {

    @NotNull(message = "Method is required")
    @Schema(description = "Login method to offer first", example = "BIOMETRIC")
    private LoginMethod method;
}
