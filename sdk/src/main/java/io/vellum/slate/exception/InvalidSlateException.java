package io.vellum.slate.exception;

public class InvalidSlateException extends Exception {
    public InvalidSlateException(String message) {
        super(message);
    }

    public InvalidSlateException(String message, Throwable cause) {
        super(message, cause);
    }
}
