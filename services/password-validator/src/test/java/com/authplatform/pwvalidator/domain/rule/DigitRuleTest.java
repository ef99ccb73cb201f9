package com.authplatform.pwvalidator.domain.rule;

import com.authplatform.pwvalidator.shared.validation.PasswordError;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class DigitRuleTest {

    private final DigitRule rule = new DigitRule();

    @Test
    void acceptsDigitAnywhere() {
        assertThat(rule.validate("1Password")).isEmpty();
        assertThat(rule.validate("Pass1word")).isEmpty();
        assertThat(rule.validate("Password1")).isEmpty();
        assertThat(rule.validate("0123456789")).isEmpty();
    }

    @Test
    void rejectsPasswordWithoutDigit() {
        assertThat(rule.validate("Password")).contains(PasswordError.MISSING_DIGIT);
        assertThat(rule.validate("Pass!word")).contains(PasswordError.MISSING_DIGIT);
        assertThat(rule.validate("")).contains(PasswordError.MISSING_DIGIT);
    }

    @Test
    void recognisesNonAsciiDecimalDigits() {
        // ARABIC-INDIC DIGIT THREE
        assertThat(rule.validate("password٣")).isEmpty();
        // SUPERSCRIPT TWO is not a decimal digit
        assertThat(rule.validate("password²")).contains(PasswordError.MISSING_DIGIT);
    }
}
