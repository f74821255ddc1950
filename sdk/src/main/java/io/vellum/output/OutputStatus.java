package io.vellum.output;

public enum OutputStatus {
    // created by a slate, not yet seen on chain
    UNCONFIRMED,
    UNSPENT,
    IMMATURE,
    // reserved as input of an in-flight slate
    LOCKED,
    // input of a finalized transaction, waiting for it to be mined
    SPENT,
    // output of an abandoned slate
    CANCELED;

    public boolean isAvailable() {
        return this != SPENT && this != CANCELED;
    }
}
