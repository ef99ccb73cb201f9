package com.authplatform.pwvalidator.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Password policy bound from {@code password.policy.*}.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "password.policy")
public class PasswordPolicyProperties {

    /**
     * Minimum number of characters; zero or less disables the length check.
     */
    private int minLength = 8;

    private boolean requireUppercase = true;

    private boolean requireDigit = true;

    private boolean requireSpecialCharacter = true;

    /**
     * Accepted special characters; the built-in set is used when unset.
     */
    private String specialCharacters;
}
