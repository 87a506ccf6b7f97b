package com.apogee.auth.dto.request;

import com.apogee.auth.enums.OtpPurpose;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Confirm a one-time code")
public class OtpConfirmRequest {

    @NotBlank(message = "Destination is required")
    @Schema(description = "Phone number (E.164) or email address the code was sent to")
    private String destination;

    @NotNull(message = "Purpose is required")
    @Schema(description = "Purpose the code was requested for", example = "SIGNUP")
    private OtpPurpose purpose;

    @NotBlank(message = "Code is required")
    @Pattern(regexp = "^[0-9]{4,10}$", message = "Code must be 4-10 digits")
    @Schema(description = "Code received by the user", example = "123456")
    private String code;
}
