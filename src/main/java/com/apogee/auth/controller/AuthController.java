package com.apogee.auth.controller;

import com.apogee.auth.dto.request.BiometricSignInRequest;
import com.apogee.auth.dto.request.PreferredLoginMethodRequest;
import com.apogee.auth.dto.request.RefreshTokenRequest;
import com.apogee.auth.dto.request.SignInRequest;
import com.apogee.auth.dto.request.SignUpRequest;
import com.apogee.auth.dto.response.ApiResponse;
import com.apogee.auth.dto.response.AuthResponse;
import com.apogee.auth.dto.response.AuthStatusResponse;
import com.apogee.auth.dto.response.BiometricEnrollmentResponse;
import com.apogee.auth.dto.response.EmailAvailabilityResponse;
import com.apogee.auth.service.AuthenticationService;
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
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * REST controller for sign-up, sign-in and credential management.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/auth")
@RequiredArgsConstructor
@Tag(name = "Authentication", description = "Sign-in and credential management APIs")
public class AuthController {

    private final AuthenticationService authenticationService;
    private final RequestMetadataUtil requestMetadata;

    @PostMapping("/signup")
    @Operation(summary = "Create an account", description = "Register with email, password and phone number")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(
                    responseCode = "201",
                    description = "Account created and signed in",
                    content = @Content(schema = @Schema(implementation = AuthResponse.class))
            ),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(
                    responseCode = "400",
                    description = "Invalid data or password policy violation"
            ),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(
                    responseCode = "409",
                    description = "Email or phone already registered"
            )
    })
    public ResponseEntity<ApiResponse<AuthResponse>> signUp(
            @Valid @RequestBody SignUpRequest request,
            HttpServletRequest httpRequest) {

        AuthResponse authResponse = authenticationService.signUp(request, requestMetadata.describe(httpRequest));
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(authResponse, "Registration successful"));
    }

    @PostMapping("/signin")
    @Operation(summary = "Sign in", description = "Sign in with email and password")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(
                    responseCode = "200",
                    description = "Signed in, or an MFA challenge was issued",
                    content = @Content(schema = @Schema(implementation = AuthResponse.class))
            ),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(
                    responseCode = "401",
                    description = "Invalid credentials"
            ),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(
                    responseCode = "429",
                    description = "Too many attempts"
            )
    })
    public ResponseEntity<ApiResponse<AuthResponse>> signIn(
            @Valid @RequestBody SignInRequest request,
            HttpServletRequest httpRequest) {

        AuthResponse authResponse = authenticationService.signIn(request, requestMetadata.describe(httpRequest));
        if (Boolean.TRUE.equals(authResponse.getMfaRequired())) {
            return ResponseEntity.ok(ApiResponse.success(authResponse, "MFA verification required"));
        }
        return ResponseEntity.ok(ApiResponse.success(authResponse, "Sign-in successful"));
    }

    @PostMapping("/refresh")
    @Operation(summary = "Refresh credentials", description = "Exchange a refresh token for a new token pair")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(
                    responseCode = "200",
                    description = "Credentials refreshed",
                    content = @Content(schema = @Schema(implementation = AuthResponse.class))
            ),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(
                    responseCode = "401",
                    description = "Refresh token invalid, expired, already used or superseded by another sign-in"
            )
    })
    public ResponseEntity<ApiResponse<AuthResponse>> refresh(
            @Valid @RequestBody RefreshTokenRequest request,
            HttpServletRequest httpRequest) {

        AuthResponse authResponse = authenticationService.refresh(request.getRefreshToken(),
                requestMetadata.describe(httpRequest));
        return ResponseEntity.ok(ApiResponse.success(authResponse, "Token refreshed successfully"));
    }

    @PostMapping("/logout")
    @Operation(summary = "Sign out", description = "Revoke the refresh token and every access token issued so far")
    @SecurityRequirement(name = "bearerAuth")
    public ResponseEntity<ApiResponse<Void>> logout(
            @AuthenticationPrincipal UUID accountId,
            HttpServletRequest httpRequest) {

        authenticationService.logout(accountId, requestMetadata.describe(httpRequest));
        return ResponseEntity.ok(ApiResponse.success(null, "Logged out successfully"));
    }

    @GetMapping("/status")
    @Operation(summary = "Account status", description = "Verification, MFA and biometric flags of the signed-in account")
    @SecurityRequirement(name = "bearerAuth")
    public ResponseEntity<ApiResponse<AuthStatusResponse>> status(@AuthenticationPrincipal UUID accountId) {
        return ResponseEntity.ok(ApiResponse.success(authenticationService.authStatus(accountId)));
    }

    @GetMapping("/check-email")
    @Operation(summary = "Check email availability")
    public ResponseEntity<ApiResponse<EmailAvailabilityResponse>> checkEmail(@RequestParam String email) {
        EmailAvailabilityResponse response = EmailAvailabilityResponse.builder()
                .email(email)
                .available(authenticationService.isEmailAvailable(email))
                .build();
        return ResponseEntity.ok(ApiResponse.success(response));
    }

    @PostMapping("/biometric/enable")
    @Operation(summary = "Enable biometric sign-in", description = "Returns the token the device keeps behind its biometric prompt")
    @SecurityRequirement(name = "bearerAuth")
    public ResponseEntity<ApiResponse<BiometricEnrollmentResponse>> enableBiometric(
            @AuthenticationPrincipal UUID accountId,
            HttpServletRequest httpRequest) {

        BiometricEnrollmentResponse response = authenticationService.enableBiometric(accountId,
                requestMetadata.describe(httpRequest));
        return ResponseEntity.ok(ApiResponse.success(response, "Biometric sign-in enabled"));
    }

    @PostMapping("/biometric/disable")
    @Operation(summary = "Disable biometric sign-in")
    @SecurityRequirement(name = "bearerAuth")
    public ResponseEntity<ApiResponse<Void>> disableBiometric(
            @AuthenticationPrincipal UUID accountId,
            HttpServletRequest httpRequest) {

        authenticationService.disableBiometric(accountId, requestMetadata.describe(httpRequest));
        return ResponseEntity.ok(ApiResponse.success(null, "Biometric sign-in disabled"));
    }

    @PostMapping("/biometric/signin")
    @Operation(summary = "Biometric sign-in", description = "Sign in with the device-held biometric token")
    public ResponseEntity<ApiResponse<AuthResponse>> biometricSignIn(
            @Valid @RequestBody BiometricSignInRequest request,
            HttpServletRequest httpRequest) {

        AuthResponse authResponse = authenticationService.biometricSignIn(request, requestMetadata.describe(httpRequest));
        return ResponseEntity.ok(ApiResponse.success(authResponse, "Sign-in successful"));
    }

    @PutMapping("/preferred-login-method")
    @Operation(summary = "Set preferred login method")
    @SecurityRequirement(name = "bearerAuth")
    public ResponseEntity<ApiResponse<AuthStatusResponse>> updatePreferredLoginMethod(
            @AuthenticationPrincipal UUID accountId,
            @Valid @RequestBody PreferredLoginMethodRequest request) {

        return ResponseEntity.ok(ApiResponse.success(
                authenticationService.updatePreferredLoginMethod(accountId, request.getMethod())));
    }
}
