package io.vellum.wallet;

import io.vellum.output.OutputData;
import io.vellum.output.OutputStatus;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Sorts available outputs into {@link BalanceBucket}s. Spent and canceled outputs are not part of any balance.
 */
public class OutputLedger {
    private final MaturityPolicy maturityPolicy;

    public OutputLedger(MaturityPolicy maturityPolicy) {
        this.maturityPolicy = Objects.requireNonNull(maturityPolicy, "maturityPolicy must be defined");
    }

    public BalanceBucket classify(OutputData output, long chainHeight, int minimumConfirmations) {
        if (!output.status().isAvailable())
            throw new IllegalArgumentException("Output " + output.keyId() + " is " + output.status() + " and has no balance bucket");

        if (output.status() == OutputStatus.LOCKED)
            return BalanceBucket.LOCKED;
        if (output.status() == OutputStatus.IMMATURE || !maturityPolicy.isMature(output, chainHeight))
            return BalanceBucket.IMMATURE;
        if (output.status() == OutputStatus.UNCONFIRMED || output.confirmations(chainHeight) < minimumConfirmations)
            return BalanceBucket.AWAITING_CONFIRMATION;
        return BalanceBucket.SPENDABLE;
    }

    public WalletSummary summarize(Collection<OutputData> outputs, long chainHeight, int minimumConfirmations) {
        Map<BalanceBucket, Long> totals = new EnumMap<>(BalanceBucket.class);
        for (BalanceBucket bucket : BalanceBucket.values())
            totals.put(bucket, 0L);

        for (OutputData output : outputs) {
            if (!output.status().isAvailable())
                continue;
            totals.merge(classify(output, chainHeight, minimumConfirmations), output.amount(), Math::addExact);
        }

        return new WalletSummary(chainHeight, minimumConfirmations,
                totals.get(BalanceBucket.AWAITING_CONFIRMATION),
                totals.get(BalanceBucket.IMMATURE),
                totals.get(BalanceBucket.LOCKED),
                totals.get(BalanceBucket.SPENDABLE));
    }

    public List<OutputData> spendable(Collection<OutputData> outputs, long chainHeight, int minimumConfirmations) {
        List<OutputData> result = new ArrayList<>();
        for (OutputData output : outputs) {
            if (output.status().isAvailable() && classify(output, chainHeight, minimumConfirmations) == BalanceBucket.SPENDABLE)
                result.add(output);
        }
        return result;
    }
}
