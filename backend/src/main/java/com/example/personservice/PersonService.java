package com.example.personservice;

import com.example.personservice.error.PersonNotFoundException;
import com.example.personservice.error.PersonValidationException;
import com.example.personservice.validation.NotBlankNameValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.*;

@Slf4j
@Service
public class PersonService {

    private final PersonRepository personRepository;

    public PersonService(PersonRepository repository) {
        this.personRepository = repository;
    }

    public List<PersonResponse> getAll() {
        List<PersonResponse> persons = new ArrayList<>();
        for (Person person : personRepository.findAll()) {
            persons.add(PersonResponse.from(person));
        }
        log.debug("Listed {} persons", persons.size());
        return persons;
    }

    public long add(PersonRequest request) {
        long id = personRepository.insert(request.toPerson());
        log.info("Created person {}", id);
        return id;
    }

    public PersonResponse get(long id) {
        return personRepository.findById(id)
                .map(PersonResponse::from)
                .orElseThrow(() -> new PersonNotFoundException(id));
    }

    /**
     * Read-modify-write merge of {@code patch} into the stored row. The row is locked for the
     * duration of the transaction so concurrent patches on the same id apply one after another.
     */
    @Transactional
    public PersonResponse update(long id, PersonPatchRequest patch) {
        Person current = personRepository.findByIdForUpdate(id)
                .orElseThrow(() -> new PersonNotFoundException(id));

        if (patch.getName() != null && NotBlankNameValidator.isBlank(patch.getName())) {
            throw PersonValidationException.ofField("name", "name must not be blank");
        }

        for (PersonPatchRequest.Field field : PersonPatchRequest.Field.values()) {
            if (patch.isExplicitNull(field)) {
                log.debug("Ignoring explicit null for {} on person {}", field, id);
            }
        }
        Person merged = patch.mergeInto(current);
        personRepository.update(merged);
        log.info("Updated person {}", id);

        return get(id);
    }

    public void delete(long id) {
        if (personRepository.deleteById(id) == 0) {
            throw new PersonNotFoundException(id);
        }
        log.info("Deleted person {}", id);
    }
}
