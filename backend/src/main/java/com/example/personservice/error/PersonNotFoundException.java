package com.example.personservice.error;

import lombok.Getter;

@Getter
public class PersonNotFoundException extends BaseException {

    private final long id;

    public PersonNotFoundException(long id) {
        super(ErrorCode.PERSON_NOT_FOUND);
        this.id = id;
    }
}
