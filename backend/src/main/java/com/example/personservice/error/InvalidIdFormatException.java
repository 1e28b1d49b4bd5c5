package com.example.personservice.error;

import lombok.Getter;

@Getter
public class InvalidIdFormatException extends BaseException {

    private final String rawId;

    public InvalidIdFormatException(String rawId, Throwable cause) {
        super(ErrorCode.INVALID_ID_FORMAT, cause);
        this.rawId = rawId;
    }
}
