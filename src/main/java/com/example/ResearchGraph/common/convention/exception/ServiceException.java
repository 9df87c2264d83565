package com.example.ResearchGraph.common.convention.exception;

import com.example.ResearchGraph.common.convention.errorcode.IErrorCode;

import java.util.Optional;

/**
 * Server-side faults: database errors, failed provider calls. Mapped to 5xx.
 */
public class ServiceException extends AbstractException {

    public ServiceException(String message, IErrorCode errorCode) {
        this(message, null, errorCode);
    }

    public ServiceException(String message, Throwable throwable, IErrorCode errorCode) {
        super(Optional.ofNullable(message).orElse(errorCode.message()), throwable, errorCode);
    }
}
