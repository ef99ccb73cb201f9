package com.authplatform.pwvalidator.shared.validation;

import java.util.List;

/**
 * Result of validating one password. {@code valid} is true exactly when {@code errors} is empty.
 */
public record ValidationResult(boolean valid, List<PasswordError> errors) {

    private static final ValidationResult SUCCESS = new ValidationResult(true, List.of());

    public ValidationResult {
        errors = List.copyOf(errors);
        if (valid != errors.isEmpty()) {
            throw new IllegalArgumentException("valid must be true exactly when there are no errors");
        }
    }

    public static ValidationResult success() {
        return SUCCESS;
    }

    public static ValidationResult failure(List<PasswordError> errors) {
        if (errors.isEmpty()) {
            throw new IllegalArgumentException("failure requires at least one error");
        }
        return new ValidationResult(false, errors);
    }

    public static ValidationResult failure(PasswordError error) {
        return failure(List.of(error));
    }

    public PasswordError getFirstError() {
        return errors.isEmpty() ? null : errors.get(0);
    }

    public List<String> descriptions() {
        return errors.stream().map(PasswordError::description).toList();
    }

    public boolean hasError(PasswordError error) {
        return errors.contains(error);
    }
}
