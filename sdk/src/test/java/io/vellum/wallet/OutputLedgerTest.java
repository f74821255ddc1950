package io.vellum.wallet;

import io.vellum.fixtures.WalletFixtureClass;
import io.vellum.output.OutputData;
import io.vellum.output.OutputFeatures;
import io.vellum.output.OutputStatus;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class OutputLedgerTest extends WalletFixtureClass {
    private final OutputLedger ledger = new OutputLedger(new CoinbaseMaturityPolicy(50));

    @Test
    public void classification() {
        // chain height 100, 10 confirmations required
        assertEquals(BalanceBucket.SPENDABLE, ledger.classify(getOutput(0, 1), 100, 10));
        assertEquals("91 is exactly 10 confirmations deep.",
                BalanceBucket.SPENDABLE, ledger.classify(getOutput(1, 1, OutputStatus.UNSPENT, OutputFeatures.PLAIN, 91), 100, 10));
        assertEquals(BalanceBucket.AWAITING_CONFIRMATION,
                ledger.classify(getOutput(2, 1, OutputStatus.UNSPENT, OutputFeatures.PLAIN, 92), 100, 10));
        assertEquals(BalanceBucket.AWAITING_CONFIRMATION,
                ledger.classify(getOutput(3, 1, OutputStatus.UNCONFIRMED, OutputFeatures.PLAIN, 0), 100, 10));
        assertEquals(BalanceBucket.LOCKED,
                ledger.classify(getOutput(4, 1, OutputStatus.LOCKED, OutputFeatures.PLAIN, 1), 100, 10));
        assertEquals("Coinbase needs 50 confirmations.",
                BalanceBucket.IMMATURE, ledger.classify(getOutput(5, 1, OutputStatus.UNSPENT, OutputFeatures.COINBASE, 60), 100, 10));
        assertEquals(BalanceBucket.SPENDABLE,
                ledger.classify(getOutput(6, 1, OutputStatus.UNSPENT, OutputFeatures.COINBASE, 51), 100, 10));
        assertEquals(BalanceBucket.IMMATURE,
                ledger.classify(getOutput(7, 1, OutputStatus.IMMATURE, OutputFeatures.PLAIN, 1), 100, 10));
        assertThrows(IllegalArgumentException.class,
                () -> ledger.classify(getOutput(8, 1, OutputStatus.SPENT, OutputFeatures.PLAIN, 1), 100, 10));
    }

    @Test
    public void bucketsPartitionAvailableOutputs() {
        List<OutputData> outputs = List.of(
                getOutput(0, 1, OutputStatus.UNSPENT, OutputFeatures.PLAIN, 1),
                getOutput(1, 2, OutputStatus.UNSPENT, OutputFeatures.PLAIN, 95),
                getOutput(2, 4, OutputStatus.UNCONFIRMED, OutputFeatures.PLAIN, 0),
                getOutput(3, 8, OutputStatus.LOCKED, OutputFeatures.PLAIN, 1),
                getOutput(4, 16, OutputStatus.UNSPENT, OutputFeatures.COINBASE, 90),
                getOutput(5, 32, OutputStatus.IMMATURE, OutputFeatures.COINBASE, 0),
                getOutput(6, 64, OutputStatus.SPENT, OutputFeatures.PLAIN, 1),
                getOutput(7, 128, OutputStatus.CANCELED, OutputFeatures.PLAIN, 0));

        WalletSummary summary = ledger.summarize(outputs, 100, 10);

        assertEquals(1, summary.spendable());
        assertEquals(2 + 4, summary.awaitingConfirmation());
        assertEquals(8, summary.locked());
        assertEquals(16 + 32, summary.immature());
        assertEquals("Spent and canceled outputs carry no balance.", 63, summary.total());
        assertEquals(100, summary.lastConfirmedHeight());
        assertEquals(10, summary.minimumConfirmations());

        long available = outputs.stream().filter(o -> o.status().isAvailable()).mapToLong(OutputData::amount).sum();
        long buckets = 0;
        for (BalanceBucket bucket : BalanceBucket.values())
            buckets += summary.amount(bucket);
        assertEquals("Every available output must be in exactly one bucket.", available, buckets);
    }

    @Test
    public void spendableFollowsThreshold() {
        List<OutputData> outputs = List.of(getOutput(0, 5, OutputStatus.UNSPENT, OutputFeatures.PLAIN, 100),
                getOutput(1, 7, OutputStatus.UNSPENT, OutputFeatures.PLAIN, 50));

        assertEquals(1, ledger.spendable(outputs, 100, 10).size());
        assertEquals("With zero confirmations required every confirmed output is spendable.",
                2, ledger.spendable(outputs, 100, 0).size());
    }

    @Test
    public void confirmations() {
        OutputData output = getOutput(0, 5, OutputStatus.UNSPENT, OutputFeatures.PLAIN, 10);
        assertEquals(1, output.confirmations(10));
        assertEquals(91, output.confirmations(100));
        assertEquals("Unconfirmed output.", 0, getOutput(1, 5, OutputStatus.UNCONFIRMED, OutputFeatures.PLAIN, 0).confirmations(100));
    }
}
