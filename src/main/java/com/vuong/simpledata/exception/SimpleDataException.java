package com.vuong.simpledata.exception;

import lombok.Getter;

/**
 * Base class of the errors raised by the Simple Data module.
 * Every instance carries the {@link ErrorCode} describing its category.
 */
@Getter
public class SimpleDataException extends RuntimeException {

    private final ErrorCode errorCode;

    public SimpleDataException(ErrorCode errorCode) {
        this(errorCode, errorCode.getDefaultMessage());
    }

    public SimpleDataException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public SimpleDataException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
