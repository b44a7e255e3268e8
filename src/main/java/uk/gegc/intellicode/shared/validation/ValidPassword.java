package uk.gegc.intellicode.shared.validation;

import jakarta.validation.Constraint;
import jakarta.validation.Payload;

import java.lang.annotation.*;

/**
 * Password composition: upper and lower case letter, digit, special character,
 * no whitespace. Length is left to {@code @Size}.
 */
@Documented
@Constraint(validatedBy = PasswordValidator.class)
@Target({ElementType.FIELD, ElementType.PARAMETER, ElementType.RECORD_COMPONENT, ElementType.TYPE_USE})
@Retention(RetentionPolicy.RUNTIME)
public @interface ValidPassword {
    String message() default "Password must contain an uppercase letter, a lowercase letter, a digit and a special character, without spaces";

    Class<?>[] groups() default {};

    Class<? extends Payload>[] payload() default {};
}
