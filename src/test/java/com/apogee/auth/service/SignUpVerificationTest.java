package com.apogee.auth.service;

import com.apogee.auth.config.SecurityProperties;
import com.apogee.auth.dto.request.SignUpRequest;
import com.apogee.auth.entity.Account;
import com.apogee.auth.entity.OtpVerification;
import com.apogee.auth.enums.OtpPurpose;
import com.apogee.auth.enums.VerificationStatus;
import com.apogee.auth.integration.VerificationProvider;
import com.apogee.auth.repository.AccountRepository;
import com.apogee.auth.repository.OtpVerificationRepository;
import com.apogee.auth.security.jwt.JwtTokenProvider;
import com.apogee.auth.support.MutableClock;
import com.apogee.auth.support.TestSecurityProperties;
import com.apogee.auth.util.ClientInfo;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

/**
 * Sign-up reads contact verification from the ledger; only approvals inside the freshness window count.
 */
@DataJpaTest
class SignUpVerificationTest {

    @Autowired AccountRepository accountRepository;
    @Autowired OtpVerificationRepository otpVerificationRepository;

    private final MutableClock clock = MutableClock.startingAt("2026-03-01T10:00:00Z");
    private final ClientInfo client = ClientInfo.builder().ipAddress("203.0.113.7").build();
    private AuthenticationService authenticationService;

    @BeforeEach
    void setUp() {
        SecurityProperties properties = TestSecurityProperties.create();
        RateLimitingService rateLimiting = new RateLimitingService(properties, clock);
        AuditService auditService = mock(AuditService.class);
        OtpService otpService = new OtpService(otpVerificationRepository, accountRepository,
                mock(VerificationProvider.class), mock(PasswordResetTokenService.class), rateLimiting, auditService,
                properties, clock);
        authenticationService = new AuthenticationService(accountRepository, new BCryptPasswordEncoder(4),
                new JwtTokenProvider(properties, clock), new CredentialStoreService(accountRepository, clock),
                rateLimiting, mock(MfaService.class), otpService, new PasswordPolicyService(properties), auditService,
                clock);
    }

    @Test
    void staleApprovalDoesNotMarkTheContactVerified() {
        approved("+14155550100", OtpPurpose.SIGNUP, clock.instant().minus(Duration.ofMinutes(31)));
        approved("jane@example.com", OtpPurpose.SIGNUP, clock.instant().minus(Duration.ofMinutes(31)));

        Account account = signUp();

        assertThat(account.isPhoneVerified()).isFalse();
        assertThat(account.isEmailVerified()).isFalse();
    }

    @Test
    void freshApprovalMarksTheContactVerified() {
        approved("+14155550100", OtpPurpose.PHONE_VERIFY, clock.instant().minus(Duration.ofMinutes(5)));
        approved("jane@example.com", OtpPurpose.SIGNUP, clock.instant().minus(Duration.ofMinutes(29)));

        Account account = signUp();

        assertThat(account.isPhoneVerified()).isTrue();
        assertThat(account.isEmailVerified()).isTrue();
    }

    @Test
    void approvalForAnotherPurposeDoesNotCount() {
        approved("+14155550100", OtpPurpose.SIGNIN, clock.instant().minus(Duration.ofMinutes(1)));

        assertThat(signUp().isPhoneVerified()).isFalse();
    }

    private Account signUp() {
        authenticationService.signUp(SignUpRequest.builder()
                .email("jane@example.com")
                .phoneNumber("+14155550100")
                .password("Str0ng!Pass")
                .build(), client);
        return accountRepository.findByEmail("jane@example.com").orElseThrow();
    }

    private void approved(String destination, OtpPurpose purpose, Instant verifiedAt) {
        otpVerificationRepository.saveAndFlush(OtpVerification.builder()
                .destination(destination)
                .channel(destination.contains("@") ? "email" : "sms")
                .purpose(purpose)
                .status(VerificationStatus.APPROVED)
                .attemptCount(1)
                .createdAt(verifiedAt.minus(Duration.ofMinutes(1)))
                .expiresAt(verifiedAt.plus(Duration.ofMinutes(9)))
                .verifiedAt(verifiedAt)
                .build());
    }
}
