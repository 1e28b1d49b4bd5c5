package com.example.personservice;

import com.example.personservice.validation.NotBlankName;

public record PersonRequest(
        @NotBlankName String name,
        Integer age,
        String address,
        String work) {

    public Person toPerson() {
        return Person.builder()
                .name(name)
                .age(age)
                .address(address)
                .work(work)
                .build();
    }
}
