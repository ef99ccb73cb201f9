package com.authplatform.pwvalidator.domain.rule;

import com.authplatform.pwvalidator.shared.validation.PasswordError;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class UppercaseRuleTest {

    private final UppercaseRule rule = new UppercaseRule();

    @Test
    void acceptsUppercaseAnywhere() {
        assertThat(rule.validate("Password")).isEmpty();
        assertThat(rule.validate("passWord123")).isEmpty();
        assertThat(rule.validate("password123A")).isEmpty();
        assertThat(rule.validate("PASSWORD")).isEmpty();
        assertThat(rule.validate("A")).isEmpty();
    }

    @Test
    void rejectsPasswordWithoutUppercase() {
        assertThat(rule.validate("password123")).contains(PasswordError.MISSING_UPPERCASE);
        assertThat(rule.validate("!@#$%^&*()")).contains(PasswordError.MISSING_UPPERCASE);
        assertThat(rule.validate("")).contains(PasswordError.MISSING_UPPERCASE);
    }

    @Test
    void recognisesNonAsciiUppercase() {
        assertThat(rule.validate("passwordÄ123")).isEmpty();
        assertThat(rule.validate("парольЖ")).isEmpty();
        assertThat(rule.validate("passwordß")).contains(PasswordError.MISSING_UPPERCASE);
    }
}
