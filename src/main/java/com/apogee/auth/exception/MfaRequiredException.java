package com.apogee.auth.exception;

import com.apogee.auth.enums.ErrorKind;
import com.apogee.auth.enums.MfaMethod;
import com.apogee.auth.enums.SensitiveOperation;

/**
 * Exception thrown when a sensitive operation needs a recent second-factor verification.
 */
public class MfaRequiredException extends AuthenticationException {

    private final MfaMethod method;
    private final SensitiveOperation operation;

    public MfaRequiredException(MfaMethod method, SensitiveOperation operation) {
        super(ErrorKind.MFA_REQUIRED, "MFA verification required for " + operation.name().toLowerCase());
        this.method = method;
        this.operation = operation;
    }

    public MfaMethod getMethod() {
        return method;
    }

    public SensitiveOperation getOperation() {
        return operation;
    }
}
