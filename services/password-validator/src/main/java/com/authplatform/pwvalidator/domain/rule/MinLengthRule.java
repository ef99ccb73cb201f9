package com.authplatform.pwvalidator.domain.rule;

import com.authplatform.pwvalidator.shared.validation.PasswordError;

import java.util.Optional;

/**
 * Requires at least {@code minLength} Unicode code points.
 */
public class MinLengthRule implements PasswordRule {

    public static final int DEFAULT_MIN_LENGTH = 8;

    private final int minLength;

    public MinLengthRule() {
        this(DEFAULT_MIN_LENGTH);
    }

    public MinLengthRule(int minLength) {
        this.minLength = minLength;
    }

    @Override
    public Optional<PasswordError> validate(String password) {
        if (password.codePointCount(0, password.length()) >= minLength) {
            return Optional.empty();
        }
        return Optional.of(PasswordError.TOO_SHORT);
    }

    public int getMinLength() {
        return minLength;
    }
}
