package com.example.personservice.validation;

import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;

public class NotBlankNameValidator implements ConstraintValidator<NotBlankName, String> {

    @Override
    public boolean isValid(String value, ConstraintValidatorContext context) {
        return value != null && !isBlank(value);
    }

    /**
     * True when every character is white space, counting the Unicode space separators
     * (U+00A0, U+2007, U+202F ...) and NEL that {@link String#isBlank()} lets through.
     */
    public static boolean isBlank(String value) {
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (!Character.isWhitespace(c) && !Character.isSpaceChar(c) && c != '\u0085') {
                return false;
            }
        }
        return true;
    }
}
