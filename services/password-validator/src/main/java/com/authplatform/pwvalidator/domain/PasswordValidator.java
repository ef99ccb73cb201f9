package com.authplatform.pwvalidator.domain;

import com.authplatform.pwvalidator.domain.rule.DigitRule;
import com.authplatform.pwvalidator.domain.rule.MinLengthRule;
import com.authplatform.pwvalidator.domain.rule.PasswordRule;
import com.authplatform.pwvalidator.domain.rule.SpecialCharacterRule;
import com.authplatform.pwvalidator.domain.rule.UppercaseRule;
import com.authplatform.pwvalidator.shared.exception.PasswordPolicyException;
import com.authplatform.pwvalidator.shared.validation.PasswordError;
import com.authplatform.pwvalidator.shared.validation.ValidationResult;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Runs an ordered set of {@link PasswordRule}s against a password and collects every failure.
 * <p>
 * Instances are immutable and can be shared between threads. Create them through
 * {@link #builder()} or {@link #defaultRules()}.
 */
@Slf4j
public final class PasswordValidator {

    private final List<PasswordRule> rules;

    private PasswordValidator(List<PasswordRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Minimum length 8, one uppercase letter, one digit and one default special character.
     */
    public static PasswordValidator defaultRules() {
        return builder()
                .minLength(MinLengthRule.DEFAULT_MIN_LENGTH)
                .requireUppercase()
                .requireDigit()
                .requireSpecialCharacter()
                .build();
    }

    /**
     * Evaluates every rule, in configured order, without stopping at the first failure.
     */
    public ValidationResult validate(String password) {
        Objects.requireNonNull(password, "password must not be null");
        List<PasswordError> errors = new ArrayList<>();

        for (PasswordRule rule : rules) {
            Optional<PasswordError> outcome = rule.validate(password);
            if (outcome == null) {
                log.error("Password rule {} returned null instead of an outcome", rule.getClass().getName());
                throw new IllegalStateException(
                        "Password rule " + rule.getClass().getName() + " returned null");
            }
            outcome.ifPresent(errors::add);
        }

        if (errors.isEmpty()) {
            log.debug("Password accepted by {} rules", rules.size());
            return ValidationResult.success();
        }
        if (log.isDebugEnabled()) {
            log.debug("Password rejected by {} of {} rules: {}", errors.size(), rules.size(),
                    errors.stream().map(PasswordError::code).toList());
        }
        return ValidationResult.failure(errors);
    }

    public boolean isValid(String password) {
        return validate(password).valid();
    }

    /**
     * Validates and throws when the password breaks any rule.
     *
     * @throws PasswordPolicyException carrying the same errors {@link #validate} would report
     */
    public void enforce(String password) {
        ValidationResult result = validate(password);
        if (!result.valid()) {
            throw new PasswordPolicyException(result.errors());
        }
    }

    public List<PasswordRule> getRules() {
        return rules;
    }

    /**
     * Accumulates rules for a {@link PasswordValidator}. Not thread-safe.
     */
    public static final class Builder {

        private final List<PasswordRule> rules = new ArrayList<>();

        private Builder() {
        }

        public Builder minLength(int length) {
            rules.add(new MinLengthRule(length));
            return this;
        }

        public Builder requireUppercase() {
            rules.add(new UppercaseRule());
            return this;
        }

        public Builder requireDigit() {
            rules.add(new DigitRule());
            return this;
        }

        public Builder requireSpecialCharacter() {
            rules.add(new SpecialCharacterRule());
            return this;
        }

        /**
         * @param specialCharacters accepted characters, or {@code null} for the default set
         */
        public Builder requireSpecialCharacter(String specialCharacters) {
            rules.add(specialCharacters != null
                    ? new SpecialCharacterRule(specialCharacters)
                    : new SpecialCharacterRule());
            return this;
        }

        public Builder addRule(PasswordRule rule) {
            rules.add(Objects.requireNonNull(rule, "rule must not be null"));
            return this;
        }

        public PasswordValidator build() {
            log.debug("Building password validator with {} rules", rules.size());
            return new PasswordValidator(rules);
        }
    }
}
