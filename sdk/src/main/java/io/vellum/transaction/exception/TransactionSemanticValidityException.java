package io.vellum.transaction.exception;

public class TransactionSemanticValidityException extends Exception {
    public TransactionSemanticValidityException() {
        super();
    }

    public TransactionSemanticValidityException(String message) {
        super(message);
    }

    public TransactionSemanticValidityException(String message, Throwable cause) {
        super(message, cause);
    }

    public TransactionSemanticValidityException(Throwable cause) {
        super(cause);
    }
}
