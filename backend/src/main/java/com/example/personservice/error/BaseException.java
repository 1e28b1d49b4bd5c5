package com.example.personservice.error;

import lombok.Getter;

/**
 * Request-terminating failure rendered as {@code {"message": ...}} with the status of its
 * {@link ErrorCode}.
 */
@Getter
public abstract class BaseException extends RuntimeException {

    private final ErrorCode errorCode;

    protected BaseException(ErrorCode errorCode) {
        super(errorCode.getMessage());
        this.errorCode = errorCode;
    }

    protected BaseException(ErrorCode errorCode, Throwable cause) {
        super(errorCode.getMessage(), cause);
        this.errorCode = errorCode;
    }
}
