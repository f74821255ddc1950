package io.vellum.wallet;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Balance of a wallet at a given chain height. Derived on demand, never persisted.
 */
public final class WalletSummary {
    private final long lastConfirmedHeight;
    private final int minimumConfirmations;
    private final long awaitingConfirmation;
    private final long immature;
    private final long locked;
    private final long spendable;

    public WalletSummary(long lastConfirmedHeight, int minimumConfirmations, long awaitingConfirmation,
                         long immature, long locked, long spendable) {
        this.lastConfirmedHeight = lastConfirmedHeight;
        this.minimumConfirmations = minimumConfirmations;
        this.awaitingConfirmation = awaitingConfirmation;
        this.immature = immature;
        this.locked = locked;
        this.spendable = spendable;
    }

    @JsonProperty("lastConfirmedHeight")
    public long lastConfirmedHeight() {
        return lastConfirmedHeight;
    }

    @JsonProperty("minimumConfirmations")
    public int minimumConfirmations() {
        return minimumConfirmations;
    }

    @JsonProperty("awaitingConfirmation")
    public long awaitingConfirmation() {
        return awaitingConfirmation;
    }

    @JsonProperty("immature")
    public long immature() {
        return immature;
    }

    @JsonProperty("locked")
    public long locked() {
        return locked;
    }

    @JsonProperty("spendable")
    public long spendable() {
        return spendable;
    }

    @JsonProperty("total")
    public long total() {
        return awaitingConfirmation + immature + locked + spendable;
    }

    public long amount(BalanceBucket bucket) {
        switch (bucket) {
            case AWAITING_CONFIRMATION:
                return awaitingConfirmation;
            case IMMATURE:
                return immature;
            case LOCKED:
                return locked;
            case SPENDABLE:
                return spendable;
            default:
                throw new IllegalArgumentException("Unknown bucket " + bucket);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WalletSummary that = (WalletSummary) o;
        return lastConfirmedHeight == that.lastConfirmedHeight &&
                minimumConfirmations == that.minimumConfirmations &&
                awaitingConfirmation == that.awaitingConfirmation &&
                immature == that.immature &&
                locked == that.locked &&
                spendable == that.spendable;
    }

    @Override
    public int hashCode() {
        return Objects.hash(lastConfirmedHeight, minimumConfirmations, awaitingConfirmation, immature, locked, spendable);
    }

    @Override
    public String toString() {
        return String.format("WalletSummary(height: %d, minConf: %d, awaiting: %d, immature: %d, locked: %d, spendable: %d, total: %d)",
                lastConfirmedHeight, minimumConfirmations, awaitingConfirmation, immature, locked, spendable, total());
    }
}
