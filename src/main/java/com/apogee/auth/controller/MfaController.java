package com.apogee.auth.controller;

import com.apogee.auth.dto.request.MfaSendCodeRequest;
import com.apogee.auth.dto.request.MfaSetupRequest;
import com.apogee.auth.dto.request.MfaVerificationRequest;
import com.apogee.auth.dto.request.StepUpVerifyRequest;
import com.apogee.auth.dto.response.ApiResponse;
import com.apogee.auth.dto.response.AuthResponse;
import com.apogee.auth.dto.response.MfaSetupResponse;
import com.apogee.auth.dto.response.OtpResponse;
import com.apogee.auth.enums.ErrorKind;
import com.apogee.auth.enums.OtpPurpose;
import com.apogee.auth.exception.AuthenticationException;
import com.apogee.auth.service.AuthenticationService;
import com.apogee.auth.service.MfaService;
import com.apogee.auth.util.RequestMetadataUtil;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * REST controller for Multi-Factor Authentication.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/mfa")
@RequiredArgsConstructor
@Tag(name = "MFA", description = "Multi-Factor Authentication APIs")
public class MfaController {

    private final AuthenticationService authenticationService;
    private final MfaService mfaService;
    private final RequestMetadataUtil requestMetadata;

    @PostMapping("/send-code")
    @Operation(summary = "Send the second-factor code", description = "Send the code for a pending MFA sign-in over SMS or email")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(
                    responseCode = "200",
                    description = "Code sent",
                    content = @Content(schema = @Schema(implementation = OtpResponse.class))
            ),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(
                    responseCode = "401",
                    description = "MFA session invalid, expired or already used"
            )
    })
    public ResponseEntity<ApiResponse<OtpResponse>> sendCode(
            @Valid @RequestBody MfaSendCodeRequest request,
            HttpServletRequest httpRequest) {

        OtpResponse response = authenticationService.sendMfaCode(request, requestMetadata.describe(httpRequest));
        return ResponseEntity.ok(ApiResponse.success(response, "Verification code sent"));
    }

    @PostMapping("/verify")
    @Operation(summary = "Verify the second factor", description = "Complete an MFA sign-in and receive credentials")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(
                    responseCode = "200",
                    description = "Signed in",
                    content = @Content(schema = @Schema(implementation = AuthResponse.class))
            ),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(
                    responseCode = "400",
                    description = "Code invalid"
            ),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(
                    responseCode = "401",
                    description = "MFA session invalid, expired or already used"
            )
    })
    public ResponseEntity<ApiResponse<AuthResponse>> verify(
            @Valid @RequestBody MfaVerificationRequest request,
            HttpServletRequest httpRequest) {

        AuthResponse authResponse = authenticationService.verifyMfa(request, requestMetadata.describe(httpRequest));
        return ResponseEntity.ok(ApiResponse.success(authResponse, "Sign-in successful"));
    }

    @PostMapping("/setup")
    @Operation(summary = "Start MFA setup", description = "Send a setup code to the chosen channel")
    @SecurityRequirement(name = "bearerAuth")
    public ResponseEntity<ApiResponse<MfaSetupResponse>> setup(
            @AuthenticationPrincipal UUID accountId,
            @Valid @RequestBody MfaSetupRequest request,
            HttpServletRequest httpRequest) {

        MfaSetupRequest sendOnly = MfaSetupRequest.builder().method(request.getMethod()).build();
        MfaSetupResponse response = authenticationService.setupMfa(accountId, sendOnly, requestMetadata.describe(httpRequest));
        return ResponseEntity.ok(ApiResponse.success(response, "Setup code sent"));
    }

    @PostMapping("/setup/confirm")
    @Operation(summary = "Confirm MFA setup", description = "Confirm the setup code and enable MFA")
    @SecurityRequirement(name = "bearerAuth")
    public ResponseEntity<ApiResponse<MfaSetupResponse>> confirmSetup(
            @AuthenticationPrincipal UUID accountId,
            @Valid @RequestBody MfaSetupRequest request,
            HttpServletRequest httpRequest) {

        if (request.getCode() == null) {
            throw new AuthenticationException(ErrorKind.INVALID_REQUEST, "Code is required");
        }
        MfaSetupResponse response = authenticationService.setupMfa(accountId, request, requestMetadata.describe(httpRequest));
        return ResponseEntity.ok(ApiResponse.success(response, "MFA enabled"));
    }

    @PostMapping("/disable")
    @Operation(summary = "Disable MFA", description = "Requires a recent step-up verification")
    @SecurityRequirement(name = "bearerAuth")
    public ResponseEntity<ApiResponse<Void>> disable(
            @AuthenticationPrincipal UUID accountId,
            HttpServletRequest httpRequest) {

        authenticationService.disableMfa(accountId, requestMetadata.describe(httpRequest));
        return ResponseEntity.ok(ApiResponse.success(null, "MFA disabled"));
    }

    @PostMapping("/step-up/send-code")
    @Operation(summary = "Send a step-up code", description = "Send a code before a sensitive account change")
    @SecurityRequirement(name = "bearerAuth")
    public ResponseEntity<ApiResponse<OtpResponse>> sendStepUpCode(
            @AuthenticationPrincipal UUID accountId,
            HttpServletRequest httpRequest) {

        String destination = mfaService.sendStepUpCode(accountId, requestMetadata.describe(httpRequest));
        OtpResponse response = OtpResponse.builder()
                .purpose(OtpPurpose.MFA)
                .destination(destination)
                .build();
        return ResponseEntity.ok(ApiResponse.success(response, "Verification code sent"));
    }

    @PostMapping("/step-up/verify")
    @Operation(summary = "Verify a step-up code")
    @SecurityRequirement(name = "bearerAuth")
    public ResponseEntity<ApiResponse<Void>> verifyStepUpCode(
            @AuthenticationPrincipal UUID accountId,
            @Valid @RequestBody StepUpVerifyRequest request,
            HttpServletRequest httpRequest) {

        mfaService.verifyStepUpCode(accountId, request.getCode(), requestMetadata.describe(httpRequest));
        return ResponseEntity.ok(ApiResponse.success(null, "Verification successful"));
    }
}
