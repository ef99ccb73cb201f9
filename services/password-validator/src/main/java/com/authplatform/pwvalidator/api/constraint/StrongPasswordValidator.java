package com.authplatform.pwvalidator.api.constraint;

import com.authplatform.pwvalidator.domain.PasswordValidator;
import com.authplatform.pwvalidator.shared.validation.PasswordError;
import com.authplatform.pwvalidator.shared.validation.ValidationResult;
import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;

/**
 * Reports one constraint violation per {@link PasswordError}.
 * Spring's constraint factory injects the application's validator when one is defined; otherwise,
 * and with other providers, {@link PasswordValidator#defaultRules()} is used.
 */
public class StrongPasswordValidator implements ConstraintValidator<StrongPassword, String> {

    private final PasswordValidator passwordValidator;

    public StrongPasswordValidator() {
        this(PasswordValidator.defaultRules());
    }

    public StrongPasswordValidator(PasswordValidator passwordValidator) {
        this.passwordValidator = passwordValidator;
    }

    @Autowired
    public StrongPasswordValidator(ObjectProvider<PasswordValidator> passwordValidator) {
        this(passwordValidator.getIfAvailable(PasswordValidator::defaultRules));
    }

    @Override
    public boolean isValid(String password, ConstraintValidatorContext context) {
        if (password == null) {
            return true;
        }

        ValidationResult result = passwordValidator.validate(password);
        if (result.valid()) {
            return true;
        }

        context.disableDefaultConstraintViolation();
        for (PasswordError error : result.errors()) {
            context.buildConstraintViolationWithTemplate(escape(error.description()))
                    .addConstraintViolation();
        }
        return false;
    }

    // Descriptions are literal text, not message templates.
    private static String escape(String description) {
        return description
                .replace("\\", "\\\\")
                .replace("{", "\\{")
                .replace("}", "\\}")
                .replace("$", "\\$");
    }
}
