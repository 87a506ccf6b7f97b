package com.apogee.auth.service;

import com.apogee.auth.config.SecurityProperties;
import com.apogee.auth.entity.Account;
import com.apogee.auth.entity.OtpVerification;
import com.apogee.auth.enums.AuditEventType;
import com.apogee.auth.enums.ErrorKind;
import com.apogee.auth.enums.MfaMethod;
import com.apogee.auth.enums.MfaState;
import com.apogee.auth.enums.OtpPurpose;
import com.apogee.auth.enums.SensitiveOperation;
import com.apogee.auth.exception.AuthenticationException;
import com.apogee.auth.exception.MfaRequiredException;
import com.apogee.auth.repository.AccountRepository;
import com.apogee.auth.support.MutableClock;
import com.apogee.auth.support.TestAccounts;
import com.apogee.auth.support.TestSecurityProperties;
import com.apogee.auth.util.ClientInfo;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DataJpaTest
@Transactional(propagation = Propagation.NOT_SUPPORTED)
class MfaServiceTest {

    @Autowired AccountRepository accountRepository;

    private final MutableClock clock = MutableClock.startingAt("2026-03-01T10:00:00Z");
    private final OtpService otpService = mock(OtpService.class);
    private final AuditService auditService = mock(AuditService.class);
    private final ClientInfo client = ClientInfo.unknown();
    private MfaService mfaService;

    @BeforeEach
    void setUp() {
        SecurityProperties properties = TestSecurityProperties.create();
        mfaService = new MfaService(accountRepository, otpService, new RateLimitingService(properties, clock),
                auditService, properties, clock);
        when(otpService.checkCode(anyString(), eq(OtpPurpose.MFA), anyString()))
                .thenAnswer(invocation -> OtpVerification.builder()
                        .destination(invocation.getArgument(0))
                        .purpose(OtpPurpose.MFA)
                        .channel("sms")
                        .createdAt(clock.instant())
                        .expiresAt(clock.instant().plusSeconds(600))
                        .build());
        when(otpService.markApproved(any(OtpVerification.class))).thenReturn(true);
    }

    @AfterEach
    void tearDown() {
        accountRepository.deleteAll();
    }

    @Test
    void challengeOffersSmsOnlyWithVerifiedPhone() {
        Account withPhone = accountRepository.saveAndFlush(TestAccounts.withSmsMfa().build());
        Account withoutPhone = accountRepository.saveAndFlush(TestAccounts.verified()
                .phoneVerified(false).mfaEnabled(true).mfaMethod(MfaMethod.EMAIL).build());

        assertThat(mfaService.issueChallenge(withPhone).getAvailableMethods())
                .containsExactly(MfaMethod.SMS, MfaMethod.EMAIL);
        assertThat(mfaService.issueChallenge(withoutPhone).getAvailableMethods())
                .containsExactly(MfaMethod.EMAIL);
    }

    @Test
    void verifiedChallengeCannotBeReused() {
        Account account = accountRepository.saveAndFlush(TestAccounts.withSmsMfa().build());
        MfaChallenge challenge = mfaService.issueChallenge(account);

        Account verified = mfaService.verify(account.getId(), challenge.getChallengeToken(), "123456", MfaMethod.SMS, client);

        assertThat(verified.getMfaState()).isEqualTo(MfaState.VERIFIED);
        assertThatThrownBy(() -> mfaService.verify(account.getId(), challenge.getChallengeToken(), "123456",
                MfaMethod.SMS, client))
                .extracting("kind").isEqualTo(ErrorKind.MFA_SESSION_ALREADY_USED);
    }

    @Test
    void concurrentVerificationsHaveExactlyOneWinner() throws Exception {
        Account account = accountRepository.saveAndFlush(TestAccounts.withSmsMfa().build());
        String token = mfaService.issueChallenge(account).getChallengeToken();

        ExecutorService pool = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<ErrorKind>> results = new ArrayList<>();
        try {
            for (int i = 0; i < 2; i++) {
                results.add(pool.submit(() -> {
                    start.await();
                    try {
                        mfaService.verify(account.getId(), token, "123456", MfaMethod.SMS, client);
                        return null;
                    } catch (AuthenticationException e) {
                        return e.getKind();
                    }
                }));
            }
            start.countDown();

            List<ErrorKind> outcomes = new ArrayList<>();
            for (Future<ErrorKind> result : results) {
                outcomes.add(result.get(10, TimeUnit.SECONDS));
            }

            assertThat(outcomes).filteredOn(Objects::isNull).hasSize(1);
            assertThat(outcomes).contains(ErrorKind.MFA_SESSION_ALREADY_USED);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void expiredChallengeIsRejectedAndMarkedExpired() {
        Account account = accountRepository.saveAndFlush(TestAccounts.withSmsMfa().build());
        String token = mfaService.issueChallenge(account).getChallengeToken();
        clock.advance(Duration.ofMinutes(11));

        assertThatThrownBy(() -> mfaService.verify(account.getId(), token, "123456", MfaMethod.SMS, client))
                .extracting("kind").isEqualTo(ErrorKind.MFA_SESSION_EXPIRED);
        assertThat(accountRepository.findById(account.getId()).orElseThrow().getMfaState())
                .isEqualTo(MfaState.EXPIRED);
        verify(otpService, never()).checkCode(anyString(), any(), anyString());
    }

    @Test
    void newSignInSupersedesOldChallenge() {
        Account account = accountRepository.saveAndFlush(TestAccounts.withSmsMfa().build());
        String first = mfaService.issueChallenge(account).getChallengeToken();
        mfaService.issueChallenge(account);

        assertThatThrownBy(() -> mfaService.verify(account.getId(), first, "123456", MfaMethod.SMS, client))
                .extracting("kind").isEqualTo(ErrorKind.MFA_SESSION_INVALID);
    }

    @Test
    void sendingACodeMovesTheChallengeForward() {
        Account account = accountRepository.saveAndFlush(TestAccounts.withSmsMfa().build());
        String token = mfaService.issueChallenge(account).getChallengeToken();

        String destination = mfaService.sendChallengeCode(account.getId(), token, MfaMethod.SMS, client);

        assertThat(destination).contains("***");
        assertThat(accountRepository.findById(account.getId()).orElseThrow().getMfaState())
                .isEqualTo(MfaState.CODE_SENT);
        verify(otpService).dispatch(account.getId(), account.getPhoneNumber(), OtpPurpose.MFA);
    }

    @Test
    void smsIsRefusedWithoutVerifiedPhone() {
        Account account = accountRepository.saveAndFlush(TestAccounts.verified()
                .phoneVerified(false).mfaEnabled(true).mfaMethod(MfaMethod.EMAIL).build());
        String token = mfaService.issueChallenge(account).getChallengeToken();

        assertThatThrownBy(() -> mfaService.sendChallengeCode(account.getId(), token, MfaMethod.SMS, client))
                .extracting("kind").isEqualTo(ErrorKind.INVALID_REQUEST);
    }

    @Test
    void sensitiveOperationNeedsRecentStepUp() {
        Account account = accountRepository.saveAndFlush(TestAccounts.withSmsMfa().build());
        when(otpService.isAccountFreshlyVerified(eq(account.getId()), eq(OtpPurpose.MFA), any())).thenReturn(false);

        assertThatThrownBy(() -> mfaService.requireRecentVerification(account.getId(), SensitiveOperation.DISABLE_MFA))
                .isInstanceOf(MfaRequiredException.class)
                .extracting("kind").isEqualTo(ErrorKind.MFA_REQUIRED);

        when(otpService.isAccountFreshlyVerified(eq(account.getId()), eq(OtpPurpose.MFA), any())).thenReturn(true);
        mfaService.disable(account.getId(), client);

        Account disabled = accountRepository.findById(account.getId()).orElseThrow();
        assertThat(disabled.isMfaEnabled()).isFalse();
        assertThat(disabled.getMfaMethod()).isNull();
        verify(auditService).logAuthenticationEvent(eq(account.getId()), eq(AuditEventType.MFA_CHANGE), eq(true),
                eq(client), eq(Map.of("action", "disabled", "method", "sms")));
    }

    @Test
    void disablingIsRefusedWhenMfaIsOff() {
        Account account = accountRepository.saveAndFlush(TestAccounts.verified().build());

        assertThatThrownBy(() -> mfaService.disable(account.getId(), client))
                .extracting("kind").isEqualTo(ErrorKind.INVALID_REQUEST);
    }

    @Test
    void smsSetupSendsToThePhoneAndConfirmationEnablesMfa() {
        Account account = accountRepository.saveAndFlush(TestAccounts.verified().phoneVerified(false).build());

        String destination = mfaService.setup(account.getId(), MfaMethod.SMS, client);

        assertThat(destination).contains("***");
        verify(otpService).dispatch(account.getId(), account.getPhoneNumber(), OtpPurpose.MFA);
        assertThat(accountRepository.findById(account.getId()).orElseThrow().isMfaEnabled()).isFalse();

        Account enabled = mfaService.confirmSetup(account.getId(), MfaMethod.SMS, "123456", client);

        assertThat(enabled.isMfaEnabled()).isTrue();
        assertThat(enabled.getMfaMethod()).isEqualTo(MfaMethod.SMS);
        assertThat(enabled.isPhoneVerified()).isTrue();
        Account stored = accountRepository.findById(account.getId()).orElseThrow();
        assertThat(stored.isMfaEnabled()).isTrue();
        assertThat(stored.isPhoneVerified()).isTrue();
    }

    @Test
    void emailSetupDoesNotTouchThePhone() {
        Account account = accountRepository.saveAndFlush(TestAccounts.verified().phoneVerified(false).build());

        Account enabled = mfaService.confirmSetup(account.getId(), MfaMethod.EMAIL, "123456", client);

        assertThat(enabled.getMfaMethod()).isEqualTo(MfaMethod.EMAIL);
        assertThat(enabled.isPhoneVerified()).isFalse();
        verify(otpService).checkCode(account.getEmail(), OtpPurpose.MFA, "123456");
    }

    @Test
    void wrongSetupCodeLeavesMfaOff() {
        Account account = accountRepository.saveAndFlush(TestAccounts.verified().build());
        when(otpService.checkCode(anyString(), eq(OtpPurpose.MFA), eq("000000")))
                .thenThrow(new AuthenticationException(ErrorKind.CODE_INVALID, "Invalid verification code"));

        assertThatThrownBy(() -> mfaService.confirmSetup(account.getId(), MfaMethod.SMS, "000000", client))
                .extracting("kind").isEqualTo(ErrorKind.CODE_INVALID);
        assertThat(accountRepository.findById(account.getId()).orElseThrow().isMfaEnabled()).isFalse();
    }

    @Test
    void smsSetupNeedsAPhoneNumber() {
        Account account = accountRepository.saveAndFlush(TestAccounts.verified()
                .phoneNumber(null).phoneVerified(false).build());

        assertThatThrownBy(() -> mfaService.setup(account.getId(), MfaMethod.SMS, client))
                .extracting("kind").isEqualTo(ErrorKind.INVALID_REQUEST);
        verify(otpService, never()).dispatch(any(), anyString(), any());
    }

    @Test
    void stepUpCodeIsSentOverTheMfaMethodAndApproved() {
        Account account = accountRepository.saveAndFlush(TestAccounts.withSmsMfa().build());

        String destination = mfaService.sendStepUpCode(account.getId(), client);
        mfaService.verifyStepUpCode(account.getId(), "123456", client);

        assertThat(destination).contains("***");
        verify(otpService).dispatch(account.getId(), account.getPhoneNumber(), OtpPurpose.MFA);
        verify(otpService).checkCode(account.getPhoneNumber(), OtpPurpose.MFA, "123456");
        verify(otpService).markApproved(any(OtpVerification.class));
        verify(auditService).logAuthenticationEvent(eq(account.getId()), eq(AuditEventType.MFA_VERIFIED), eq(true),
                eq(client), eq(Map.of("stepUp", true)));
    }

    @Test
    void stepUpCodeLostToAConcurrentApprovalIsRefused() {
        Account account = accountRepository.saveAndFlush(TestAccounts.withSmsMfa().build());
        when(otpService.markApproved(any(OtpVerification.class))).thenReturn(false);

        assertThatThrownBy(() -> mfaService.verifyStepUpCode(account.getId(), "123456", client))
                .extracting("kind").isEqualTo(ErrorKind.ALREADY_VERIFIED);
        verify(auditService, never()).logAuthenticationEvent(any(), eq(AuditEventType.MFA_VERIFIED), eq(true),
                any(), any());
    }

    @Test
    void stepUpNeedsMfaEnabled() {
        Account account = accountRepository.saveAndFlush(TestAccounts.verified().build());

        assertThatThrownBy(() -> mfaService.sendStepUpCode(account.getId(), client))
                .extracting("kind").isEqualTo(ErrorKind.INVALID_REQUEST);
        assertThatThrownBy(() -> mfaService.verifyStepUpCode(account.getId(), "123456", client))
                .extracting("kind").isEqualTo(ErrorKind.INVALID_REQUEST);
    }
}
