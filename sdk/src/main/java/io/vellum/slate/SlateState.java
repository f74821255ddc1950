package io.vellum.slate;

public enum SlateState {
    // sender selected inputs and published its excess and nonce
    CREATED,
    // receiver added its output and partial signature
    RECEIVED,
    // signatures aggregated into a transaction
    FINALIZED
}
