package io.vellum.output;

import io.vellum.secret.BlindingFactor;

import java.util.Objects;

/**
 * An owned output together with its re-derived blinding factor. Only lives for the operation that built it.
 */
public final class WalletCoin implements AutoCloseable {
    private final BlindingFactor blindingFactor;
    private final OutputData outputData;

    public WalletCoin(BlindingFactor blindingFactor, OutputData outputData) {
        this.blindingFactor = Objects.requireNonNull(blindingFactor, "blindingFactor must be defined");
        this.outputData = Objects.requireNonNull(outputData, "outputData must be defined");
    }

    public BlindingFactor getBlindingFactor() {
        return blindingFactor;
    }

    public OutputData getOutputData() {
        return outputData;
    }

    public long amount() {
        return outputData.amount();
    }

    @Override
    public void close() {
        blindingFactor.close();
    }

    @Override
    public String toString() {
        return "WalletCoin{" + outputData + "}";
    }
}
