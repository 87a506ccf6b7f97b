package com.apogee.auth;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Bean;
import org.springframework.data.jpa.repository.config.EnableJpaAuditing;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.transaction.annotation.EnableTransactionManagement;

import java.time.Clock;

/**
 * Main application class for the Apogee Authentication Service.
 *
 * This service handles:
 * - Sign-up, password, one-time code and biometric sign-in
 * - Access/refresh credential issue, rotation and logout
 * - SMS and email multi-factor authentication
 * - Password reset and rate limiting
 */
@Slf4j
@SpringBootApplication
@EnableJpaAuditing
@EnableAsync
@EnableScheduling
@EnableTransactionManagement
@ConfigurationPropertiesScan("com.apogee.auth.config")
public class AuthServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(AuthServiceApplication.class, args);
        log.info("===========================================");
        log.info("Apogee Authentication Service Started");
        log.info("===========================================");
    }

    /**
     * Time source for credential, code and window expiry. Tests replace it.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
