package com.tfve.sync.input;

/**
 * Local input cannot be used: missing or malformed file, empty export list, duplicate names,
 * missing credentials, unknown workspace.
 *
 * Always raised before any variable is written.
 */
public class InputException extends RuntimeException {

    public InputException(String message) {
        super(message);
    }

    public InputException(String message, Throwable cause) {
        super(message, cause);
    }
}
