package com.apogee.auth.integration;

import com.apogee.auth.config.SecurityProperties;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;

import static org.assertj.core.api.Assertions.assertThat;

class VerificationProviderSelectionTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withUserConfiguration(ProviderConfiguration.class);

    @Test
    void noProviderIsSelectedByDefault() {
        SecurityProperties.Verification defaults = new SecurityProperties().getVerification();

        assertThat(defaults.getProvider()).isNull();
        assertThat(defaults.getDevelopmentCode()).isNull();
    }

    @Test
    void startupFailsWithoutAProvider() {
        contextRunner.run(context -> assertThat(context).hasFailed());
        contextRunner.withPropertyValues("security.verification.provider=")
                .run(context -> assertThat(context).hasFailed());
    }

    @Test
    void unknownProviderIsRejected() {
        contextRunner.withPropertyValues("security.verification.provider=console")
                .run(context -> assertThat(context).hasFailed());
    }

    @Test
    void loggingProviderIsIgnoredOutsideDevelopmentProfiles() {
        contextRunner.withPropertyValues(
                        "security.verification.provider=logging",
                        "security.verification.development-code=123456")
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    assertThat(context).doesNotHaveBean(VerificationProvider.class);
                });
    }

    @Test
    void loggingProviderIsAvailableUnderTheTestProfile() {
        contextRunner.withInitializer(context -> context.getEnvironment().setActiveProfiles("test"))
                .withPropertyValues(
                        "security.verification.provider=logging",
                        "security.verification.development-code=123456")
                .run(context -> {
                    assertThat(context).hasSingleBean(LoggingVerificationProvider.class);
                    VerificationProvider provider = context.getBean(VerificationProvider.class);
                    assertThat(provider.check("+14155550100", "123456").getOutcome())
                            .isEqualTo(ProviderCheckResult.Outcome.APPROVED);
                    assertThat(provider.check("+14155550100", "000000").getOutcome())
                            .isEqualTo(ProviderCheckResult.Outcome.REJECTED);
                });
    }

    @Test
    void loggingProviderWithoutADevelopmentCodeApprovesNothing() {
        contextRunner.withInitializer(context -> context.getEnvironment().setActiveProfiles("dev"))
                .withPropertyValues("security.verification.provider=logging")
                .run(context -> {
                    VerificationProvider provider = context.getBean(VerificationProvider.class);
                    assertThat(provider.check("+14155550100", "").getOutcome())
                            .isEqualTo(ProviderCheckResult.Outcome.REJECTED);
                    assertThat(provider.check("+14155550100", null).getOutcome())
                            .isEqualTo(ProviderCheckResult.Outcome.REJECTED);
                });
    }

    @Test
    void twilioWithoutCredentialsFailsStartup() {
        contextRunner.withPropertyValues(
                        "security.verification.provider=twilio",
                        "security.verification.twilio.account-sid=")
                .run(context -> assertThat(context).hasFailed());
    }

    @Configuration
    @EnableConfigurationProperties(SecurityProperties.class)
    @Import({LoggingVerificationProvider.class, TwilioVerificationProvider.class})
    static class ProviderConfiguration {
    }
}
