package com.docgen.infrastructure.ai;

public class OutputReliabilityException extends RuntimeException {

    public OutputReliabilityException(String message) {
        super(message);
    }

    public OutputReliabilityException(String message, Throwable cause) {
        super(message, cause);
    }
}
