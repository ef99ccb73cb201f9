package com.authplatform.pwvalidator.domain.rule;

import com.authplatform.pwvalidator.shared.validation.PasswordError;

import java.util.Optional;

/**
 * A single password requirement.
 * <p>
 * Implementations are configured at construction and must not keep per-call state,
 * so one instance can be shared by many validators and threads. Extension rules
 * report failures as {@link PasswordError.Custom}.
 */
@FunctionalInterface
public interface PasswordRule {

    /**
     * Checks the password against this rule.
     *
     * @return empty when the password satisfies the rule, otherwise the error to report; never {@code null}
     */
    Optional<PasswordError> validate(String password);
}
