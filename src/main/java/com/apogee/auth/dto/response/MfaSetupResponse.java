package com.apogee.auth.dto.response;

import com.apogee.auth.enums.MfaMethod;
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
@Schema(description = "MFA setup progress")
public class MfaSetupResponse {

    private MfaMethod method;

    @Schema(description = "Destination the setup code went to, masked")
    private String destination;

    private boolean mfaEnabled;
}
