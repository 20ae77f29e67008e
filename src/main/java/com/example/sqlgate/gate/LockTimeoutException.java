package com.example.sqlgate.gate;

public class LockTimeoutException extends Exception {

    public LockTimeoutException(String message) {
        super(message);
    }
}
