package com.cmakeparser;

/**
 * Base class of all errors raised while scanning, parsing, resolving or evaluating CMake code.
 */
public class CMakeException extends RuntimeException {

    public CMakeException(String message) {
        super(message);
    }

    public CMakeException(String message, Throwable cause) {
        super(message, cause);
    }
}
