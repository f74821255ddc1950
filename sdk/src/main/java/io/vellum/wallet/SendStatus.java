package io.vellum.wallet;

public enum SendStatus {
    PENDING,
    FINALIZED,
    CANCELED
}
