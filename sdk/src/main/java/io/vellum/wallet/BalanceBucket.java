package io.vellum.wallet;

// Mutually exclusive balance categories of an available output.
public enum BalanceBucket {
    AWAITING_CONFIRMATION,
    IMMATURE,
    LOCKED,
    SPENDABLE
}
