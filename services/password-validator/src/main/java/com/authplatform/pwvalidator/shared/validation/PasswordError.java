package com.authplatform.pwvalidator.shared.validation;

import java.util.Objects;

/**
 * A single reason a password was rejected.
 * Built-in kinds carry no payload; {@link Custom} carries the message of an extension rule.
 */
public sealed interface PasswordError
        permits PasswordError.TooShort, PasswordError.MissingUppercase,
                PasswordError.MissingDigit, PasswordError.MissingSpecialChar,
                PasswordError.Custom {

    TooShort TOO_SHORT = new TooShort();
    MissingUppercase MISSING_UPPERCASE = new MissingUppercase();
    MissingDigit MISSING_DIGIT = new MissingDigit();
    MissingSpecialChar MISSING_SPECIAL_CHAR = new MissingSpecialChar();

    /**
     * Human-readable text for this error.
     */
    String description();

    /**
     * Stable machine-readable identifier, e.g. {@code TOO_SHORT}.
     */
    String code();

    static Custom custom(String message) {
        return new Custom(message);
    }

    // Text is fixed and does not reflect a configured minimum length.
    record TooShort() implements PasswordError {
        @Override
        public String description() {
            return "Password must be at least 8 characters long";
        }

        @Override
        public String code() {
            return "TOO_SHORT";
        }
    }

    record MissingUppercase() implements PasswordError {
        @Override
        public String description() {
            return "Password must include an uppercase letter";
        }

        @Override
        public String code() {
            return "MISSING_UPPERCASE";
        }
    }

    record MissingDigit() implements PasswordError {
        @Override
        public String description() {
            return "Password must include a number";
        }

        @Override
        public String code() {
            return "MISSING_DIGIT";
        }
    }

    record MissingSpecialChar() implements PasswordError {
        @Override
        public String description() {
            return "Password must include a special character";
        }

        @Override
        public String code() {
            return "MISSING_SPECIAL_CHAR";
        }
    }

    record Custom(String message) implements PasswordError {

        public Custom {
            Objects.requireNonNull(message, "message must not be null");
        }

        @Override
        public String description() {
            return message;
        }

        @Override
        public String code() {
            return "CUSTOM";
        }
    }
}
