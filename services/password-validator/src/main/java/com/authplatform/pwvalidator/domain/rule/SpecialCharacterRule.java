package com.authplatform.pwvalidator.domain.rule;

import com.authplatform.pwvalidator.shared.validation.PasswordError;

import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Requires at least one character from a configured set. Matching is exact, without case folding.
 */
public class SpecialCharacterRule implements PasswordRule {

    public static final String DEFAULT_SPECIAL_CHARACTERS = "!@#$%^&*(),.?\":{}|<>-_+=[]\\;'`~";

    private final String specialCharacters;
    private final Set<Integer> allowed;

    public SpecialCharacterRule() {
        this(DEFAULT_SPECIAL_CHARACTERS);
    }

    public SpecialCharacterRule(String specialCharacters) {
        this.specialCharacters = Objects.requireNonNull(specialCharacters, "specialCharacters must not be null");
        this.allowed = specialCharacters.codePoints()
                .boxed()
                .collect(Collectors.toUnmodifiableSet());
    }

    @Override
    public Optional<PasswordError> validate(String password) {
        if (password.codePoints().anyMatch(allowed::contains)) {
            return Optional.empty();
        }
        return Optional.of(PasswordError.MISSING_SPECIAL_CHAR);
    }

    public String getSpecialCharacters() {
        return specialCharacters;
    }
}
