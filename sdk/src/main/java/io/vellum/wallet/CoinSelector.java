package io.vellum.wallet;

import io.vellum.output.OutputData;
import io.vellum.transaction.FeeCalculator;
import io.vellum.wallet.exception.InsufficientFundsException;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Picks the inputs of a send. Fees are always estimated for two outputs (receiver and change) and one kernel.
 */
public class CoinSelector {
    static final int OUTPUTS_PER_SEND = 2;
    static final int KERNELS_PER_SEND = 1;

    private static final Comparator<OutputData> ASCENDING =
            Comparator.comparingLong(OutputData::amount).thenComparing(o -> o.keyId().toString());

    private final FeeCalculator feeCalculator;

    public CoinSelector(FeeCalculator feeCalculator) {
        this.feeCalculator = Objects.requireNonNull(feeCalculator, "feeCalculator must be defined");
    }

    public long fee(long feeBase, int numInputs) {
        return feeCalculator.calculateFee(feeBase, numInputs, OUTPUTS_PER_SEND, KERNELS_PER_SEND);
    }

    public CoinSelection select(List<OutputData> spendable, long amount, long feeBase, SelectionStrategy strategy)
            throws InsufficientFundsException {
        Objects.requireNonNull(spendable, "spendable must be defined");
        Objects.requireNonNull(strategy, "strategy must be defined");
        if (amount <= 0)
            throw new IllegalArgumentException("Amount to send must be > 0.");
        if (feeBase < 0)
            throw new IllegalArgumentException("Fee base must be >= 0.");

        long available = total(spendable);
        switch (strategy) {
            case ALL:
                return selectAll(spendable, amount, feeBase, available);
            case SMALLEST:
                return selectSmallest(spendable, amount, feeBase, available);
            case LEAST_LEFTOVER:
                return selectLeastLeftover(spendable, amount, feeBase, available);
            default:
                throw new IllegalArgumentException("Unknown selection strategy " + strategy);
        }
    }

    private CoinSelection selectAll(List<OutputData> spendable, long amount, long feeBase, long available)
            throws InsufficientFundsException {
        long fee = fee(feeBase, Math.max(spendable.size(), 1));
        long needed = Math.addExact(amount, fee);
        if (spendable.isEmpty() || available < needed)
            throw new InsufficientFundsException(needed, available);
        return new CoinSelection(spendable, amount, fee);
    }

    private CoinSelection selectSmallest(List<OutputData> spendable, long amount, long feeBase, long available)
            throws InsufficientFundsException {
        List<OutputData> ascending = new ArrayList<>(spendable);
        ascending.sort(ASCENDING);

        List<OutputData> inputs = new ArrayList<>();
        long sum = 0;
        for (OutputData coin : ascending) {
            inputs.add(coin);
            sum += coin.amount();
            long fee = fee(feeBase, inputs.size());
            if (sum >= Math.addExact(amount, fee))
                return new CoinSelection(inputs, amount, fee);
        }
        throw new InsufficientFundsException(Math.addExact(amount, fee(feeBase, Math.max(ascending.size(), 1))), available);
    }

    private CoinSelection selectLeastLeftover(List<OutputData> spendable, long amount, long feeBase, long available)
            throws InsufficientFundsException {
        List<OutputData> ascending = new ArrayList<>(spendable);
        ascending.sort(ASCENDING);

        // Smallest input count whose largest coins cover the target.
        int count = 0;
        long target = 0;
        long topSum = 0;
        for (int k = 1; k <= ascending.size(); k++) {
            topSum += ascending.get(ascending.size() - k).amount();
            long candidateTarget = Math.addExact(amount, fee(feeBase, k));
            if (topSum >= candidateTarget) {
                count = k;
                target = candidateTarget;
                break;
            }
        }
        if (count == 0)
            throw new InsufficientFundsException(Math.addExact(amount, fee(feeBase, Math.max(ascending.size(), 1))), available);

        // Fill each slot with the smallest coin that still lets the largest remaining coins reach the target.
        List<OutputData> remaining = new ArrayList<>(ascending);
        List<OutputData> inputs = new ArrayList<>();
        long chosen = 0;
        for (int slot = 0; slot < count; slot++) {
            int stillToPick = count - slot - 1;
            for (int i = 0; i < remaining.size(); i++) {
                OutputData candidate = remaining.get(i);
                if (chosen + candidate.amount() + largestExcluding(remaining, i, stillToPick) >= target) {
                    inputs.add(candidate);
                    chosen += candidate.amount();
                    remaining.remove(i);
                    break;
                }
            }
        }
        return new CoinSelection(inputs, amount, fee(feeBase, count));
    }

    // Sum of the n largest coins of an ascending list, skipping the coin at index excluded.
    private static long largestExcluding(List<OutputData> ascending, int excluded, int n) {
        long sum = 0;
        int taken = 0;
        for (int i = ascending.size() - 1; i >= 0 && taken < n; i--) {
            if (i == excluded)
                continue;
            sum += ascending.get(i).amount();
            taken++;
        }
        return sum;
    }

    private static long total(List<OutputData> coins) {
        long total = 0;
        for (OutputData coin : coins)
            total = Math.addExact(total, coin.amount());
        return total;
    }
}
