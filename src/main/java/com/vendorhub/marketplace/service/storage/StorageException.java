package com.vendorhub.marketplace.service.storage;

import lombok.Getter;

/**
 * Thrown by every {@link StorageService} operation. The error code tells the
 * caller which failure class occurred.
 */
@Getter
public class StorageException extends RuntimeException {

    private final StorageErrorCode errorCode;

    public StorageException(StorageErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public StorageException(StorageErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
