package com.example.sqlgate.dryrun;

/**
 * The count rewrite of a statement could not be run against the database.
 */
public class DryRunException extends Exception {

    public DryRunException(String message, Throwable cause) {
        super(message, cause);
    }
}
