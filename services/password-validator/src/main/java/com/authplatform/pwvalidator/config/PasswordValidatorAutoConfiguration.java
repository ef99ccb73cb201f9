package com.authplatform.pwvalidator.config;

import com.authplatform.pwvalidator.domain.PasswordValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

@Slf4j
@AutoConfiguration
@EnableConfigurationProperties(PasswordPolicyProperties.class)
public class PasswordValidatorAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public PasswordValidator passwordValidator(PasswordPolicyProperties properties) {
        PasswordValidator.Builder builder = PasswordValidator.builder();

        if (properties.getMinLength() > 0) {
            builder.minLength(properties.getMinLength());
        }
        if (properties.isRequireUppercase()) {
            builder.requireUppercase();
        }
        if (properties.isRequireDigit()) {
            builder.requireDigit();
        }
        if (properties.isRequireSpecialCharacter()) {
            builder.requireSpecialCharacter(properties.getSpecialCharacters());
        }

        log.info("Password policy: minLength={}, uppercase={}, digit={}, specialCharacter={}, specialCharacters={}",
                properties.getMinLength(), properties.isRequireUppercase(),
                properties.isRequireDigit(), properties.isRequireSpecialCharacter(),
                describeSpecialCharacters(properties));
        return builder.build();
    }

    static String describeSpecialCharacters(PasswordPolicyProperties properties) {
        if (!properties.isRequireSpecialCharacter()) {
            return "none";
        }
        String custom = properties.getSpecialCharacters();
        return custom != null ? "custom[" + custom + "]" : "default";
    }
}
