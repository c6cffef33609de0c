package com.vendorhub.marketplace.modules.image.exception;

import lombok.Getter;

/**
 * Thrown when an image operation is rejected before or instead of touching
 * storage: unknown product or image, foreign owner, negative position.
 */
@Getter
public class ImageOperationException extends RuntimeException {

    private final ImageErrorCode errorCode;

    public ImageOperationException(ImageErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
}
