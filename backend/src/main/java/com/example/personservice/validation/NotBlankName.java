package com.example.personservice.validation;

import jakarta.validation.Constraint;
import jakarta.validation.Payload;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * The annotated name must be non-null and contain at least one character that is not Unicode
 * white space. See {@link NotBlankNameValidator#isBlank(String)}.
 */
@Documented
@Constraint(validatedBy = NotBlankNameValidator.class)
@Target({ElementType.FIELD, ElementType.METHOD, ElementType.PARAMETER})
@Retention(RetentionPolicy.RUNTIME)
public @interface NotBlankName {

    String message() default "name is required";

    Class<?>[] groups() default {};

    Class<? extends Payload>[] payload() default {};
}
