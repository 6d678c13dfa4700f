package com.vidnyan.classlint.application.port.out;

/**
 * Raised when the syntax tree of a source file is missing or unreadable.
 */
public class SyntaxTreeUnavailableException extends RuntimeException {

    public SyntaxTreeUnavailableException(String message) {
        super(message);
    }

    public SyntaxTreeUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
