package com.apogee.auth.controller;

import com.apogee.auth.dto.request.ChangePasswordRequest;
import com.apogee.auth.dto.request.ForgotPasswordRequest;
import com.apogee.auth.dto.request.PasswordCheckRequest;
import com.apogee.auth.dto.request.ResetPasswordRequest;
import com.apogee.auth.dto.response.ApiResponse;
import com.apogee.auth.service.OtpDispatch;
import com.apogee.auth.service.PasswordPolicyService;
import com.apogee.auth.service.PasswordService;
import com.apogee.auth.util.RequestMetadataUtil;
import io.swagger.v3.oas.annotations.Operation;
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
 * REST controller for password management.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/password")
@RequiredArgsConstructor
@Tag(name = "Password", description = "Password management APIs")
public class PasswordController {

    private final PasswordService passwordService;
    private final RequestMetadataUtil requestMetadata;

    @PostMapping("/change")
    @Operation(summary = "Change password", description = "Change the password of the signed-in account")
    @SecurityRequirement(name = "bearerAuth")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Password changed"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Password policy violation"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "401", description = "Current password incorrect"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "403", description = "Step-up verification required")
    })
    public ResponseEntity<ApiResponse<Void>> changePassword(
            @AuthenticationPrincipal UUID accountId,
            @Valid @RequestBody ChangePasswordRequest request,
            HttpServletRequest httpRequest) {

        passwordService.changePassword(accountId, request.getCurrentPassword(), request.getNewPassword(),
                requestMetadata.describe(httpRequest));
        return ResponseEntity.ok(ApiResponse.success(null, "Password changed successfully"));
    }

    @PostMapping("/forgot")
    @Operation(summary = "Request password reset", description = "Send a reset code if the email is registered")
    public ResponseEntity<ApiResponse<Void>> forgotPassword(
            @Valid @RequestBody ForgotPasswordRequest request,
            HttpServletRequest httpRequest) {

        OtpDispatch dispatch = passwordService.forgotPassword(request.getEmail(), requestMetadata.describe(httpRequest));
        return ResponseEntity.ok(ApiResponse.success(null, dispatch.getMessage()));
    }

    @PostMapping("/reset")
    @Operation(summary = "Reset password", description = "Set a new password with the reset token; signs out every device")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Password reset"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Reset token invalid, expired or used")
    })
    public ResponseEntity<ApiResponse<Void>> resetPassword(
            @Valid @RequestBody ResetPasswordRequest request,
            HttpServletRequest httpRequest) {

        passwordService.resetPassword(request.getEmail(), request.getResetToken(), request.getNewPassword(),
                requestMetadata.describe(httpRequest));
        return ResponseEntity.ok(ApiResponse.success(null, "Password reset successfully"));
    }

    @PostMapping("/validate")
    @Operation(summary = "Validate password", description = "Check a password against the policy")
    public ResponseEntity<ApiResponse<PasswordPolicyService.PasswordValidationResult>> validatePassword(
            @Valid @RequestBody PasswordCheckRequest request) {

        PasswordPolicyService.PasswordValidationResult result =
                passwordService.validate(request.getPassword(), request.getEmail());
        return ResponseEntity.ok(ApiResponse.success(result));
    }
}
