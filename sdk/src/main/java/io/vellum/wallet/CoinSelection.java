package io.vellum.wallet;

import io.vellum.output.OutputData;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

public final class CoinSelection {
    private final List<OutputData> inputs;
    private final long amount;
    private final long fee;

    public CoinSelection(List<OutputData> inputs, long amount, long fee) {
        Objects.requireNonNull(inputs, "inputs must be defined");
        if (inputs.isEmpty())
            throw new IllegalArgumentException("Coin selection without inputs");
        this.inputs = Collections.unmodifiableList(List.copyOf(inputs));
        this.amount = amount;
        this.fee = fee;
        if (change() < 0)
            throw new IllegalArgumentException("Selected inputs don't cover amount and fee");
    }

    public List<OutputData> getInputs() {
        return inputs;
    }

    public long getAmount() {
        return amount;
    }

    public long getFee() {
        return fee;
    }

    public long totalInput() {
        long total = 0;
        for (OutputData input : inputs)
            total = Math.addExact(total, input.amount());
        return total;
    }

    public long change() {
        return totalInput() - amount - fee;
    }

    @Override
    public String toString() {
        return String.format("CoinSelection(inputs: %d, total: %d, amount: %d, fee: %d, change: %d)",
                inputs.size(), totalInput(), amount, fee, change());
    }
}
