package com.example.personservice;

import com.example.personservice.error.InvalidIdFormatException;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.net.URI;
import java.util.*;
import java.util.regex.Pattern;

@RestController
@RequestMapping(PersonController.BASE_PATH)
public class PersonController {

    static final String BASE_PATH = "/api/v1/persons";

    private static final Pattern ID_PATTERN = Pattern.compile("[+-]?[0-9]+");

    private final PersonService personService;
    private final PersonPatchReader patchReader;

    public PersonController(PersonService service, PersonPatchReader patchReader) {
        this.personService = service;
        this.patchReader = patchReader;
    }

    @GetMapping
    public List<PersonResponse> getAll() {
        return personService.getAll();
    }

    @PostMapping
    public ResponseEntity<Void> add(@Valid @RequestBody PersonRequest request) {
        long id = personService.add(request);
        return ResponseEntity.created(URI.create(BASE_PATH + "/" + id)).build();
    }

    @GetMapping("/{id}")
    public PersonResponse get(@PathVariable("id") String id) {
        return personService.get(parseId(id));
    }

    // the body is decoded by hand so malformed JSON gets the validation envelope
    @PatchMapping("/{id}")
    public PersonResponse update(@PathVariable("id") String id,
                                 @RequestBody(required = false) String body) {
        long personId = parseId(id);
        return personService.update(personId, patchReader.read(body));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable("id") String id) {
        personService.delete(parseId(id));
        return ResponseEntity.noContent().build();
    }

    // ASCII decimal digits with an optional sign only; no whitespace, hex or '#' prefixes
    private static long parseId(String id) {
        if (!ID_PATTERN.matcher(id).matches()) {
            throw new InvalidIdFormatException(id, null);
        }
        try {
            return Long.parseLong(id);
        } catch (NumberFormatException e) {
            throw new InvalidIdFormatException(id, e);
        }
    }
}
