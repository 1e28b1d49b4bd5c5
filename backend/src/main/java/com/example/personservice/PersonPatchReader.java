package com.example.personservice;

import com.example.personservice.error.PersonValidationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

/**
 * Decodes the raw body of a partial update. Malformed JSON, an empty body or a non-object
 * document is reported with the validation envelope.
 */
@Component
public class PersonPatchReader {

    private final ObjectMapper objectMapper;

    public PersonPatchReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public PersonPatchRequest read(String body) {
        if (body == null || body.isBlank()) {
            throw PersonValidationException.invalidJson(null);
        }
        PersonPatchRequest patch;
        try {
            patch = objectMapper.readValue(body, PersonPatchRequest.class);
        } catch (JsonProcessingException e) {
            throw PersonValidationException.invalidJson(e);
        }
        // a literal null document carries no changes
        return patch != null ? patch : new PersonPatchRequest();
    }
}
