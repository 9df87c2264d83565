package com.example.ResearchGraph.common.convention.exception;

import com.example.ResearchGraph.common.convention.errorcode.IErrorCode;

import java.util.Optional;

/**
 * Errors caused by the request itself, e.g. an unknown paper or a blank question.
 * Mapped to 4xx.
 */
public class ClientException extends AbstractException {

    public ClientException(IErrorCode errorCode) {
        this(null, null, errorCode);
    }

    public ClientException(String message, IErrorCode errorCode) {
        this(message, null, errorCode);
    }

    public ClientException(String message, Throwable throwable, IErrorCode errorCode) {
        super(Optional.ofNullable(message).orElse(errorCode.message()), throwable, errorCode);
    }
}
