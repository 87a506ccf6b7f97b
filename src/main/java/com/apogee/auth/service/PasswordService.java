package com.apogee.auth.service;

import com.apogee.auth.entity.Account;
import com.apogee.auth.enums.AuditEventType;
import com.apogee.auth.enums.ErrorKind;
import com.apogee.auth.enums.OtpPurpose;
import com.apogee.auth.enums.RateLimitScope;
import com.apogee.auth.enums.SensitiveOperation;
import com.apogee.auth.exception.AuthenticationException;
import com.apogee.auth.repository.AccountRepository;
import com.apogee.auth.util.ClientInfo;
import com.apogee.auth.util.ContactNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.UUID;

/**
 * Forgot, reset and change password flows.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PasswordService {

    private final AccountRepository accountRepository;
    private final PasswordEncoder passwordEncoder;
    private final PasswordPolicyService passwordPolicyService;
    private final PasswordResetTokenService passwordResetTokenService;
    private final OtpService otpService;
    private final MfaService mfaService;
    private final RateLimitingService rateLimitingService;
    private final AuditService auditService;
    private final Clock clock;

    /**
     * Send a reset code. The response does not reveal whether the email is registered.
     */
    public OtpDispatch forgotPassword(String email, ClientInfo client) {
        return otpService.requestCode(email, OtpPurpose.PASSWORD_RESET, null, client);
    }

    /**
     * Set a new password with the token obtained by confirming a reset code. Ends every session of the account.
     */
    public void resetPassword(String email, String resetToken, String newPassword, ClientInfo client) {
        rateLimitingService.admitOrThrow(RateLimitScope.PASSWORD_RESET_SUBMIT, client.getIpAddress());
        if (resetToken == null || resetToken.isBlank()) {
            throw new AuthenticationException(ErrorKind.RESET_TOKEN_INVALID_OR_USED, "Reset token is required");
        }

        String normalized = ContactNormalizer.normalizeEmail(email);
        Account account = accountRepository.findByEmail(normalized)
                .orElseThrow(() -> new AuthenticationException(ErrorKind.RESET_TOKEN_INVALID_OR_USED,
                        "Reset token is invalid, expired or already used. Request a new code."));

        passwordPolicyService.enforce(newPassword, normalized);
        passwordResetTokenService.consume(account.getId(), resetToken, passwordEncoder.encode(newPassword));

        rateLimitingService.resetOnSuccess(RateLimitScope.PASSWORD_RESET_SUBMIT, client.getIpAddress());
        auditService.logAuthenticationEvent(account.getId(), AuditEventType.PASSWORD_RESET, true, client);
    }

    /**
     * Change the password of a signed-in account. Needs a recent step-up when MFA is enabled.
     */
    @Transactional
    public void changePassword(UUID accountId, String currentPassword, String newPassword, ClientInfo client) {
        mfaService.requireRecentVerification(accountId, SensitiveOperation.UPDATE_PASSWORD);

        Account account = accountRepository.findById(accountId)
                .orElseThrow(() -> new AuthenticationException(ErrorKind.NOT_REGISTERED, "Account not found"));

        if (!passwordEncoder.matches(currentPassword, account.getPasswordHash())) {
            auditService.logAuthenticationEvent(accountId, AuditEventType.PASSWORD_CHANGE, false, client);
            throw new AuthenticationException(ErrorKind.INVALID_CREDENTIAL, "Current password is incorrect");
        }
        if (passwordEncoder.matches(newPassword, account.getPasswordHash())) {
            throw new AuthenticationException(ErrorKind.PASSWORD_POLICY_VIOLATION,
                    "New password must differ from the current one");
        }
        passwordPolicyService.enforce(newPassword, account.getEmail());

        account.setPasswordHash(passwordEncoder.encode(newPassword));
        account.setPasswordChangedAt(clock.instant());
        accountRepository.save(account);

        log.info("Password changed for account {}", accountId);
        auditService.logAuthenticationEvent(accountId, AuditEventType.PASSWORD_CHANGE, true, client);
    }

    public PasswordPolicyService.PasswordValidationResult validate(String password, String email) {
        return passwordPolicyService.validatePassword(password, email);
    }
}
