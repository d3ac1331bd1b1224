package com.tfve.sync.core.value;

/**
 * Raised when a raw variable value cannot be decoded back into a {@link Value}.
 */
public class ValueCodecException extends RuntimeException {

    public ValueCodecException(String message) {
        super(message);
    }

    public ValueCodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
