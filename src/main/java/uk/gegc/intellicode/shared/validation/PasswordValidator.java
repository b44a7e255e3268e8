package uk.gegc.intellicode.shared.validation;

import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;

import java.util.regex.Pattern;

public class PasswordValidator implements ConstraintValidator<ValidPassword, String> {

    // uppercase, lowercase, digit, something that is neither letter nor digit; no whitespace
    private static final Pattern PATTERN =
            Pattern.compile("^(?=\\S+$)(?=.*\\p{Lu})(?=.*\\p{Ll})(?=.*\\d)(?=.*[^\\p{L}\\p{N}]).+$");

    @Override
    public boolean isValid(String password, ConstraintValidatorContext context) {
        if (password == null) {
            return true; // left to @NotBlank
        }
        return PATTERN.matcher(password).matches();
    }
}
