package com.apogee.auth.service;

import com.apogee.auth.entity.Account;
import com.apogee.auth.enums.OtpPurpose;
import lombok.Builder;
import lombok.Value;

/**
 * Outcome of a successful code confirmation. Which fields are set depends on the purpose.
 */
@Value
@Builder
public class OtpConfirmation {
    OtpPurpose purpose;
    boolean verified;
    // signin and mfa
    Account account;
    // password_reset
    String resetToken;
}
