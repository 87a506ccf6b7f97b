package com.apogee.auth.dto.request;

import com.apogee.auth.enums.OtpPurpose;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Request a one-time code")
public class OtpRequest {

    @NotBlank(message = "Destination is required")
    @Schema(description = "Phone number (E.164) or email address", example = "+14155551234")
    private String destination;

    @NotNull(message = "Purpose is required")
    @Schema(description = "Why the code is requested", example = "SIGNUP")
    private OtpPurpose purpose;
}
