package com.apogee.auth.service;

import com.apogee.auth.entity.Account;
import com.apogee.auth.enums.ErrorKind;
import com.apogee.auth.repository.AccountRepository;
import com.apogee.auth.support.MutableClock;
import com.apogee.auth.support.TestAccounts;
import com.apogee.auth.support.TestSecurityProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

import java.time.Duration;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
class PasswordResetTokenServiceTest {

    @Autowired AccountRepository accountRepository;

    private final MutableClock clock = MutableClock.startingAt("2026-03-01T10:00:00Z");
    private PasswordResetTokenService resetTokens;
    private UUID accountId;

    @BeforeEach
    void setUp() {
        resetTokens = new PasswordResetTokenService(accountRepository, TestSecurityProperties.create(), clock);
        accountId = accountRepository.saveAndFlush(TestAccounts.verified().build()).getId();
    }

    @Test
    void tokenWorksExactlyOnce() {
        String token = resetTokens.issue(accountId);

        resetTokens.consume(accountId, token, "hash-1");

        assertThatThrownBy(() -> resetTokens.consume(accountId, token, "hash-2"))
                .extracting("kind").isEqualTo(ErrorKind.RESET_TOKEN_INVALID_OR_USED);
        assertThat(accountRepository.findById(accountId).orElseThrow().getPasswordHash()).isEqualTo("hash-1");
    }

    @Test
    void newerTokenReplacesOlderOne() {
        String first = resetTokens.issue(accountId);
        String second = resetTokens.issue(accountId);

        assertThatThrownBy(() -> resetTokens.consume(accountId, first, "hash"))
                .extracting("kind").isEqualTo(ErrorKind.RESET_TOKEN_INVALID_OR_USED);
        resetTokens.consume(accountId, second, "hash");
    }

    @Test
    void expiredTokenIsRejected() {
        String token = resetTokens.issue(accountId);
        clock.advance(Duration.ofMinutes(10));

        assertThatThrownBy(() -> resetTokens.consume(accountId, token, "hash"))
                .extracting("kind").isEqualTo(ErrorKind.RESET_TOKEN_INVALID_OR_USED);
    }

    @Test
    void resetEndsEverySession() {
        accountRepository.storeRefreshToken(accountId, "r1", clock.instant().plus(Duration.ofDays(7)), clock.instant(),
                clock.instant());
        String token = resetTokens.issue(accountId);
        clock.advance(Duration.ofSeconds(30));

        resetTokens.consume(accountId, token, "hash");

        Account account = accountRepository.findById(accountId).orElseThrow();
        assertThat(account.getRefreshToken()).isNull();
        assertThat(account.getTokenInvalidatedAt()).isEqualTo(clock.instant());
    }

    @Test
    void unknownAccountCannotBeIssuedAToken() {
        assertThatThrownBy(() -> resetTokens.issue(UUID.randomUUID()))
                .extracting("kind").isEqualTo(ErrorKind.NOT_REGISTERED);
    }
}
