package com.example.personservice;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record PersonResponse(Long id, String name, Integer age, String address, String work) {

    public static PersonResponse from(Person person) {
        return new PersonResponse(
                person.getId(),
                person.getName(),
                person.getAge(),
                person.getAddress(),
                person.getWork());
    }
}
