package com.example.personservice.error;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Input rejected field by field. Rendered with the validation envelope
 * {@code {"message": ..., "errors": {field: reason}}}.
 */
@Getter
public class PersonValidationException extends RuntimeException {

    private final Map<String, String> errors;

    public PersonValidationException(String message, Map<String, String> errors) {
        this(message, errors, null);
    }

    public PersonValidationException(String message, Map<String, String> errors, Throwable cause) {
        super(message, cause);
        this.errors = Collections.unmodifiableMap(new LinkedHashMap<>(errors));
    }

    public static PersonValidationException ofField(String field, String reason) {
        return new PersonValidationException(field + " validation error", Map.of(field, reason));
    }

    public static PersonValidationException invalidJson(Throwable cause) {
        return new PersonValidationException("Invalid json", Map.of("body", "invalid json format"), cause);
    }
}
