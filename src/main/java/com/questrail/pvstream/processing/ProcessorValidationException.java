package com.questrail.pvstream.processing;

/**
 * Raised when a processor cannot be admitted to a chain: unknown type, a
 * factory failure, or a failed trial run.
 */
public final class ProcessorValidationException extends RuntimeException {

    public ProcessorValidationException(String message) {
        super(message);
    }

    public ProcessorValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
