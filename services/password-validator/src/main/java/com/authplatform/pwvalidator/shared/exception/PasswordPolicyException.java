package com.authplatform.pwvalidator.shared.exception;

import com.authplatform.pwvalidator.shared.validation.PasswordError;

import java.util.List;

/**
 * Thrown by {@code PasswordValidator.enforce} when a password breaks the configured policy.
 */
public final class PasswordPolicyException extends RuntimeException {

    private final List<PasswordError> errors;

    public PasswordPolicyException(List<PasswordError> errors) {
        super("Password does not meet policy requirements");
        this.errors = List.copyOf(errors);
    }

    public List<PasswordError> getErrors() {
        return errors;
    }

    public String getErrorCode() {
        return "PASSWORD_POLICY_VIOLATION";
    }
}
