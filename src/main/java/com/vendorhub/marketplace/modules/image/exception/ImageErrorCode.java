package com.vendorhub.marketplace.modules.image.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public enum ImageErrorCode {

    PRODUCT_NOT_FOUND(HttpStatus.NOT_FOUND),
    IMAGE_NOT_FOUND(HttpStatus.NOT_FOUND),
    FORBIDDEN(HttpStatus.FORBIDDEN),
    INVALID_POSITION(HttpStatus.BAD_REQUEST);

    private final HttpStatus status;

    ImageErrorCode(HttpStatus status) {
        this.status = status;
    }
}
