package com.apogee.auth.controller;

import com.apogee.auth.dto.request.OtpConfirmRequest;
import com.apogee.auth.dto.request.OtpRequest;
import com.apogee.auth.dto.response.ApiResponse;
import com.apogee.auth.dto.response.OtpResponse;
import com.apogee.auth.service.AuthenticationService;
import com.apogee.auth.util.RequestMetadataUtil;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * One-time codes for sign-up, sign-in, phone verification and password reset.
 * The caller may be anonymous; a signed-in caller is passed on for phone verification.
 */
@RestController
@RequestMapping("/api/v1/otp")
@RequiredArgsConstructor
@Tag(name = "One-time codes", description = "Send and confirm one-time codes")
public class OtpController {

    private final AuthenticationService authenticationService;
    private final RequestMetadataUtil requestMetadata;

    @PostMapping("/send")
    @Operation(summary = "Send a code", description = "Send a code to a phone number or email for the given purpose")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(
                    responseCode = "200",
                    description = "Code sent",
                    content = @Content(schema = @Schema(implementation = OtpResponse.class))
            ),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Destination not registered"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "409", description = "Destination already registered"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "429", description = "Too many requests"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "503", description = "Verification provider unavailable")
    })
    public ResponseEntity<ApiResponse<OtpResponse>> send(
            @AuthenticationPrincipal UUID accountId,
            @Valid @RequestBody OtpRequest request,
            HttpServletRequest httpRequest) {

        OtpResponse response = authenticationService.requestOtp(request, accountId, requestMetadata.describe(httpRequest));
        return ResponseEntity.ok(ApiResponse.success(response, "Verification code sent"));
    }

    @PostMapping("/verify")
    @Operation(summary = "Confirm a code", description = "Sign-in codes return credentials; reset codes return a reset token")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(
                    responseCode = "200",
                    description = "Code confirmed",
                    content = @Content(schema = @Schema(implementation = OtpResponse.class))
            ),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Code invalid or expired"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "409", description = "Already verified")
    })
    public ResponseEntity<ApiResponse<OtpResponse>> verify(
            @AuthenticationPrincipal UUID accountId,
            @Valid @RequestBody OtpConfirmRequest request,
            HttpServletRequest httpRequest) {

        OtpResponse response = authenticationService.confirmOtp(request, accountId, requestMetadata.describe(httpRequest));
        return ResponseEntity.ok(ApiResponse.success(response, "Code verified"));
    }
}
