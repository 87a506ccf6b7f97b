package com.apogee.auth.service;

import com.apogee.auth.dto.request.BiometricSignInRequest;
import com.apogee.auth.dto.request.MfaSendCodeRequest;
import com.apogee.auth.dto.request.MfaSetupRequest;
import com.apogee.auth.dto.request.MfaVerificationRequest;
import com.apogee.auth.dto.request.OtpConfirmRequest;
import com.apogee.auth.dto.request.OtpRequest;
import com.apogee.auth.dto.request.SignInRequest;
import com.apogee.auth.dto.request.SignUpRequest;
import com.apogee.auth.dto.response.AuthResponse;
import com.apogee.auth.dto.response.AuthStatusResponse;
import com.apogee.auth.dto.response.BiometricEnrollmentResponse;
import com.apogee.auth.dto.response.MfaSetupResponse;
import com.apogee.auth.dto.response.OtpResponse;
import com.apogee.auth.entity.Account;
import com.apogee.auth.enums.AuditEventType;
import com.apogee.auth.enums.ErrorKind;
import com.apogee.auth.enums.LoginMethod;
import com.apogee.auth.enums.OtpPurpose;
import com.apogee.auth.enums.RateLimitScope;
import com.apogee.auth.enums.TokenType;
import com.apogee.auth.exception.AuthenticationException;
import com.apogee.auth.repository.AccountRepository;
import com.apogee.auth.security.jwt.JwtTokenProvider;
import com.apogee.auth.security.jwt.TokenClaims;
import com.apogee.auth.security.jwt.TokenPair;
import com.apogee.auth.util.ClientInfo;
import com.apogee.auth.util.ContactNormalizer;
import com.apogee.auth.util.MaskingUtil;
import com.apogee.auth.util.SecureTokens;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.Map;
import java.util.UUID;

/**
 * Session manager used by the controllers: sign-up, sign-in, refresh, logout, OTP, MFA and biometric flows.
 * <p>
 * Methods are deliberately not wrapped in one transaction: provider calls happen outside the database and
 * each conditional update commits on its own.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuthenticationService {

    private static final String BEARER = "Bearer";

    private final AccountRepository accountRepository;
    private final PasswordEncoder passwordEncoder;
    private final JwtTokenProvider jwtTokenProvider;
    private final CredentialStoreService credentialStoreService;
    private final RateLimitingService rateLimitingService;
    private final MfaService mfaService;
    private final OtpService otpService;
    private final PasswordPolicyService passwordPolicyService;
    private final AuditService auditService;
    private final Clock clock;

    /**
     * Register an account and sign it in.
     */
    public AuthResponse signUp(SignUpRequest request, ClientInfo client) {
        rateLimitingService.admitOrThrow(RateLimitScope.SIGN_UP, client.getIpAddress());

        String email = ContactNormalizer.normalizeEmail(request.getEmail());
        String phone = ContactNormalizer.normalizePhone(request.getPhoneNumber());
        passwordPolicyService.enforce(request.getPassword(), email);

        if (accountRepository.existsByEmail(email)) {
            throw new AuthenticationException(ErrorKind.ALREADY_REGISTERED, "An account with this email already exists");
        }
        if (accountRepository.existsByPhoneNumber(phone)) {
            throw new AuthenticationException(ErrorKind.ALREADY_REGISTERED,
                    "An account with this phone number already exists");
        }

        // only a recent proof counts, an old approval may belong to someone who no longer holds the number
        boolean emailVerified = otpService.isFreshlyVerified(email, OtpPurpose.SIGNUP);
        boolean phoneVerified = otpService.isFreshlyVerified(phone, OtpPurpose.SIGNUP)
                || otpService.isFreshlyVerified(phone, OtpPurpose.PHONE_VERIFY);

        Account account = Account.builder()
                .email(email)
                .phoneNumber(phone)
                .emailVerified(emailVerified)
                .phoneVerified(phoneVerified)
                .passwordHash(passwordEncoder.encode(request.getPassword()))
                .passwordChangedAt(clock.instant())
                .preferredLoginMethod(request.getPreferredLoginMethod() != null
                        ? request.getPreferredLoginMethod() : LoginMethod.EMAIL)
                .build();

        try {
            account = accountRepository.saveAndFlush(account);
        } catch (DataIntegrityViolationException e) {
            // a concurrent sign-up claimed the email or phone
            throw new AuthenticationException(ErrorKind.ALREADY_REGISTERED, "An account with these details already exists", e);
        }

        log.info("Registered account {} (email verified: {}, phone verified: {})", account.getId(), emailVerified, phoneVerified);
        auditService.logAuthenticationEvent(account.getId(), AuditEventType.SIGN_UP, true, client);
        return issueSession(account, client, "signup");
    }

    /**
     * Password sign-in. Returns a credential pair, or an MFA challenge when the account has MFA enabled.
     */
    public AuthResponse signIn(SignInRequest request, ClientInfo client) {
        int remaining = rateLimitingService.admitOrThrow(RateLimitScope.SIGN_IN, client.getIpAddress());
        String email = ContactNormalizer.normalizeEmail(request.getEmail());

        Account account = accountRepository.findByEmail(email).orElse(null);
        if (account == null || !passwordEncoder.matches(request.getPassword(), account.getPasswordHash())) {
            log.warn("Failed sign-in for {} ({} attempts left)", MaskingUtil.maskEmail(email), remaining);
            auditService.logAuthenticationEvent(account != null ? account.getId() : null,
                    AuditEventType.SIGN_IN_FAILED, false, client);
            throw new AuthenticationException(ErrorKind.INVALID_CREDENTIAL, "Invalid email or password");
        }

        rateLimitingService.resetOnSuccess(RateLimitScope.SIGN_IN, client.getIpAddress());

        if (account.isMfaEnabled()) {
            MfaChallenge challenge = mfaService.issueChallenge(account);
            auditService.logAuthenticationEvent(account.getId(), AuditEventType.MFA_CHALLENGE, true, client);
            return AuthResponse.builder()
                    .accountId(account.getId())
                    .mfaRequired(true)
                    .mfaSessionToken(challenge.getChallengeToken())
                    .mfaSessionExpiresAt(challenge.getExpiresAt())
                    .availableMethods(challenge.getAvailableMethods())
                    .preferredMethod(challenge.getPreferredMethod())
                    .build();
        }

        return issueSession(account, client, "password");
    }

    /**
     * Exchange a refresh credential for a new pair. The presented value is single-use.
     */
    public AuthResponse refresh(String refreshToken, ClientInfo client) {
        rateLimitingService.admitOrThrow(RateLimitScope.TOKEN_REFRESH, client.getIpAddress());
        TokenClaims claims = jwtTokenProvider.verify(refreshToken, TokenType.REFRESH);
        TokenPair next = jwtTokenProvider.issuePair(claims.getAccountId());

        try {
            credentialStoreService.rotateRefresh(claims.getAccountId(), refreshToken, claims.getIssuedAt(),
                    next.getRefreshToken(), next.getRefreshExpiresAt());
        } catch (AuthenticationException e) {
            auditService.logAuthenticationEvent(claims.getAccountId(), AuditEventType.TOKEN_REFRESH_REJECTED, false,
                    client, Map.of("reason", e.getKind().name()));
            throw e;
        }

        auditService.logAuthenticationEvent(claims.getAccountId(), AuditEventType.TOKEN_REFRESH, true, client);
        return toAuthResponse(claims.getAccountId(), next);
    }

    public void logout(UUID accountId, ClientInfo client) {
        credentialStoreService.logout(accountId);
        auditService.logAuthenticationEvent(accountId, AuditEventType.LOGOUT, true, client);
    }

    public OtpResponse requestOtp(OtpRequest request, UUID callerAccountId, ClientInfo client) {
        OtpDispatch dispatch = otpService.requestCode(request.getDestination(), request.getPurpose(), callerAccountId, client);
        return OtpResponse.builder()
                .purpose(request.getPurpose())
                .destination(dispatch.getMaskedDestination())
                .expiresInSeconds(dispatch.getExpiresInSeconds())
                .build();
    }

    /**
     * Confirm a code. Sign-in and MFA codes sign the account in; reset codes yield a reset token.
     */
    public OtpResponse confirmOtp(OtpConfirmRequest request, UUID callerAccountId, ClientInfo client) {
        OtpConfirmation confirmation = otpService.confirmCode(request.getDestination(), request.getPurpose(),
                request.getCode(), callerAccountId, client);

        OtpResponse.OtpResponseBuilder response = OtpResponse.builder()
                .purpose(confirmation.getPurpose())
                .verified(confirmation.isVerified())
                .resetToken(confirmation.getResetToken());
        if (confirmation.getPurpose().issuesCredentials()) {
            response.auth(issueSession(confirmation.getAccount(), client, "otp"));
        }
        return response.build();
    }

    public OtpResponse sendMfaCode(MfaSendCodeRequest request, ClientInfo client) {
        String destination = mfaService.sendChallengeCode(request.getAccountId(), request.getMfaSessionToken(),
                request.getMethod(), client);
        return OtpResponse.builder()
                .purpose(OtpPurpose.MFA)
                .destination(destination)
                .build();
    }

    public AuthResponse verifyMfa(MfaVerificationRequest request, ClientInfo client) {
        Account account = mfaService.verify(request.getAccountId(), request.getMfaSessionToken(), request.getCode(),
                request.getMethod(), client);
        return issueSession(account, client, "mfa");
    }

    /**
     * Without a code, send a setup code; with a code, confirm and enable MFA.
     */
    public MfaSetupResponse setupMfa(UUID accountId, MfaSetupRequest request, ClientInfo client) {
        if (request.getCode() == null) {
            String destination = mfaService.setup(accountId, request.getMethod(), client);
            return MfaSetupResponse.builder()
                    .method(request.getMethod())
                    .destination(destination)
                    .mfaEnabled(false)
                    .build();
        }

        Account account = mfaService.confirmSetup(accountId, request.getMethod(), request.getCode(), client);
        return MfaSetupResponse.builder()
                .method(account.getMfaMethod())
                .mfaEnabled(account.isMfaEnabled())
                .build();
    }

    public void disableMfa(UUID accountId, ClientInfo client) {
        mfaService.disable(accountId, client);
    }

    public AuthStatusResponse authStatus(UUID accountId) {
        Account account = loadAccount(accountId);
        return AuthStatusResponse.builder()
                .accountId(account.getId())
                .email(account.getEmail())
                .phoneNumber(MaskingUtil.maskPhone(account.getPhoneNumber()))
                .phoneVerified(account.isPhoneVerified())
                .emailVerified(account.isEmailVerified())
                .mfaEnabled(account.isMfaEnabled())
                .mfaMethod(account.getMfaMethod())
                .biometricEnabled(account.isBiometricEnabled())
                .preferredLoginMethod(account.getPreferredLoginMethod())
                .build();
    }

    public boolean isEmailAvailable(String email) {
        return !accountRepository.existsByEmail(ContactNormalizer.normalizeEmail(email));
    }

    // Biometric

    /**
     * Generate the device-held biometric token. Only its hash is stored.
     */
    @Transactional
    public BiometricEnrollmentResponse enableBiometric(UUID accountId, ClientInfo client) {
        Account account = loadAccount(accountId);
        String token = SecureTokens.generate();
        account.setBiometricTokenHash(passwordEncoder.encode(token));
        account.setBiometricEnabled(true);
        accountRepository.save(account);

        auditService.logAuthenticationEvent(accountId, AuditEventType.BIOMETRIC_CHANGE, true, client,
                Map.of("action", "enabled"));
        log.info("Biometric sign-in enabled for account {}", accountId);
        return BiometricEnrollmentResponse.builder()
                .accountId(accountId)
                .biometricToken(token)
                .build();
    }

    @Transactional
    public void disableBiometric(UUID accountId, ClientInfo client) {
        Account account = loadAccount(accountId);
        account.setBiometricEnabled(false);
        account.setBiometricTokenHash(null);
        if (account.getPreferredLoginMethod() == LoginMethod.BIOMETRIC) {
            account.setPreferredLoginMethod(LoginMethod.EMAIL);
        }
        accountRepository.save(account);

        auditService.logAuthenticationEvent(accountId, AuditEventType.BIOMETRIC_CHANGE, true, client,
                Map.of("action", "disabled"));
        log.info("Biometric sign-in disabled for account {}", accountId);
    }

    public AuthResponse biometricSignIn(BiometricSignInRequest request, ClientInfo client) {
        String key = request.getAccountId().toString();
        rateLimitingService.admitOrThrow(RateLimitScope.BIOMETRIC, key);

        Account account = accountRepository.findById(request.getAccountId()).orElse(null);
        if (account == null || !account.isBiometricEnabled() || account.getBiometricTokenHash() == null
                || !passwordEncoder.matches(request.getBiometricToken(), account.getBiometricTokenHash())) {
            auditService.logAuthenticationEvent(request.getAccountId(), AuditEventType.SIGN_IN_FAILED, false, client,
                    Map.of("method", "biometric"));
            throw new AuthenticationException(ErrorKind.INVALID_CREDENTIAL, "Biometric sign-in failed");
        }

        rateLimitingService.resetOnSuccess(RateLimitScope.BIOMETRIC, key);
        return issueSession(account, client, "biometric");
    }

    @Transactional
    public AuthStatusResponse updatePreferredLoginMethod(UUID accountId, LoginMethod method) {
        Account account = loadAccount(accountId);
        if (method == LoginMethod.BIOMETRIC && !account.isBiometricEnabled()) {
            throw new AuthenticationException(ErrorKind.INVALID_REQUEST, "Enable biometric sign-in first");
        }
        account.setPreferredLoginMethod(method);
        accountRepository.save(account);
        return authStatus(accountId);
    }

    /**
     * Issue a pair and make its refresh value the account's only valid one.
     */
    private AuthResponse issueSession(Account account, ClientInfo client, String method) {
        TokenPair pair = jwtTokenProvider.issuePair(account.getId());
        credentialStoreService.storeRefresh(account.getId(), pair.getRefreshToken(), pair.getIssuedAt(),
                pair.getRefreshExpiresAt());

        auditService.logAuthenticationEvent(account.getId(), AuditEventType.SIGN_IN, true, client,
                Map.of("method", method));
        log.info("Account {} signed in via {}", account.getId(), method);
        return toAuthResponse(account.getId(), pair);
    }

    private AuthResponse toAuthResponse(UUID accountId, TokenPair pair) {
        return AuthResponse.builder()
                .accountId(accountId)
                .accessToken(pair.getAccessToken())
                .refreshToken(pair.getRefreshToken())
                .tokenType(BEARER)
                .expiresIn(pair.getAccessExpiresInSeconds())
                .refreshExpiresAt(pair.getRefreshExpiresAt())
                .authenticatedAt(clock.instant())
                .build();
    }

    private Account loadAccount(UUID accountId) {
        return accountRepository.findById(accountId)
                .orElseThrow(() -> new AuthenticationException(ErrorKind.NOT_REGISTERED, "Account not found"));
    }
}
