package com.vendorhub.marketplace.service.storage;

import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public enum StorageErrorCode {

    SIZE_EXCEEDED(HttpStatus.BAD_REQUEST),
    UNSUPPORTED_TYPE(HttpStatus.BAD_REQUEST),
    INVALID_REFERENCE(HttpStatus.BAD_REQUEST),
    NOT_FOUND(HttpStatus.NOT_FOUND),
    IO_FAILURE(HttpStatus.INTERNAL_SERVER_ERROR),
    TIMEOUT(HttpStatus.INTERNAL_SERVER_ERROR);

    private final HttpStatus status;

    StorageErrorCode(HttpStatus status) {
        this.status = status;
    }
}
