package com.example.personservice.error;

import org.springframework.http.ResponseEntity;

public record ErrorResponse(String message) {

    public static ResponseEntity<ErrorResponse> toResponseEntity(ErrorCode errorCode) {
        return ResponseEntity
                .status(errorCode.getStatus())
                .body(new ErrorResponse(errorCode.getMessage()));
    }
}
