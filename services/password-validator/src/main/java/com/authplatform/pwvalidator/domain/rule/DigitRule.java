package com.authplatform.pwvalidator.domain.rule;

import com.authplatform.pwvalidator.shared.validation.PasswordError;

import java.util.Optional;

/**
 * Requires at least one decimal digit (Unicode category Nd, not only 0-9).
 */
public class DigitRule implements PasswordRule {

    @Override
    public Optional<PasswordError> validate(String password) {
        if (password.codePoints().anyMatch(Character::isDigit)) {
            return Optional.empty();
        }
        return Optional.of(PasswordError.MISSING_DIGIT);
    }
}
