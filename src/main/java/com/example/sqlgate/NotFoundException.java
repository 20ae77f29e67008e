package com.example.sqlgate;

/**
 * Raised when a run id or snapshot id is unknown.
 */
public class NotFoundException extends Exception {

    public NotFoundException(String message) {
        super(message);
    }
}
