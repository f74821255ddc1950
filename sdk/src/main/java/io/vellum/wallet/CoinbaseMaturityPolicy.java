package io.vellum.wallet;

import io.vellum.output.OutputData;

/**
 * Coinbase outputs mature after a fixed number of confirmations, any other output is always mature.
 */
public class CoinbaseMaturityPolicy implements MaturityPolicy {
    public static final int DEFAULT_COINBASE_MATURITY = 1440;

    private final int coinbaseMaturity;

    public CoinbaseMaturityPolicy() {
        this(DEFAULT_COINBASE_MATURITY);
    }

    public CoinbaseMaturityPolicy(int coinbaseMaturity) {
        if (coinbaseMaturity < 0)
            throw new IllegalArgumentException("Coinbase maturity must be >= 0.");
        this.coinbaseMaturity = coinbaseMaturity;
    }

    public int getCoinbaseMaturity() {
        return coinbaseMaturity;
    }

    @Override
    public boolean isMature(OutputData output, long chainHeight) {
        if (!output.isCoinbase())
            return true;
        return output.blockHeight() > 0 && output.confirmations(chainHeight) >= coinbaseMaturity;
    }
}
