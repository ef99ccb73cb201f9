package com.authplatform.pwvalidator.domain.rule;

import com.authplatform.pwvalidator.shared.validation.PasswordError;

import java.util.Optional;

/**
 * Requires at least one uppercase letter in any script.
 */
public class UppercaseRule implements PasswordRule {

    @Override
    public Optional<PasswordError> validate(String password) {
        if (password.codePoints().anyMatch(Character::isUpperCase)) {
            return Optional.empty();
        }
        return Optional.of(PasswordError.MISSING_UPPERCASE);
    }
}
