package com.example.ResearchGraph.common.convention.errorcode;

/**
 * Error code contract; every error code enum implements it.
 */
public interface IErrorCode {

    String code();

    String message();
}
