package com.example.ResearchGraph.common.convention.exception;

import com.example.ResearchGraph.common.convention.errorcode.IErrorCode;
import lombok.Getter;

import java.util.Optional;

/**
 * Base class of all business exceptions.
 */
@Getter
public abstract class AbstractException extends RuntimeException {

    private final String errorCode;

    private final String errorMessage;

    /**
     * @param message   custom message, falls back to {@code errorCode.message()} when null
     * @param throwable original cause, may be null
     * @param errorCode error code enum
     */
    protected AbstractException(String message, Throwable throwable, IErrorCode errorCode) {
        super(message, throwable);
        this.errorCode = errorCode.code();
        this.errorMessage = Optional.ofNullable(message).orElse(errorCode.message());
    }
}
