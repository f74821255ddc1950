package io.vellum.fixtures;

import io.vellum.cryptolibprovider.CommitmentFunctions;
import io.vellum.cryptolibprovider.CryptoLibProvider;
import io.vellum.output.OutputData;
import io.vellum.output.OutputFeatures;
import io.vellum.output.OutputStatus;
import io.vellum.secret.EncryptedSeed;
import io.vellum.secret.KeyChain;
import io.vellum.secret.KeyId;
import io.vellum.secret.WalletSeed;
import io.vellum.storage.WalletStorage;
import io.vellum.transaction.FeeCalculator;
import io.vellum.wallet.CoinSelector;
import io.vellum.wallet.CoinbaseMaturityPolicy;
import io.vellum.wallet.OutputLedger;
import io.vellum.wallet.Wallet;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.UUID;

public class WalletFixtureClass {
    public static final long CHAIN_HEIGHT = 100;
    public static final int MIN_CONFIRMATIONS = 10;
    // fee independent of the transaction shape
    public static final FeeCalculator FLAT_FEE = (feeBase, numInputs, numOutputs, numKernels) -> feeBase;

    protected final CommitmentFunctions functions = CryptoLibProvider.commitmentFunctions;
    protected final MutableClock clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));

    public WalletSeed getSeed(int fill) {
        byte[] bytes = new byte[WalletSeed.SEED_LENGTH];
        Arrays.fill(bytes, (byte) fill);
        return new WalletSeed(bytes);
    }

    public EncryptedSeed getDummyEncryptedSeed() {
        return new EncryptedSeed(EncryptedSeed.CURRENT_VERSION, new byte[16], new byte[12], new byte[48], 1024, 8, 1);
    }

    public Wallet getWallet(String username, WalletStorage storage, Duration lockExpiry) {
        storage.createWallet(username, getDummyEncryptedSeed());
        return new Wallet(username, storage, functions, new OutputLedger(new CoinbaseMaturityPolicy()),
                new CoinSelector(FLAT_FEE), lockExpiry, clock);
    }

    // Confirmed plain output, spendable at CHAIN_HEIGHT with MIN_CONFIRMATIONS.
    public OutputData fund(Wallet wallet, WalletSeed seed, long amount) {
        return fund(wallet, seed, amount, OutputFeatures.PLAIN, OutputStatus.UNSPENT, 1);
    }

    public OutputData fund(Wallet wallet, WalletSeed seed, long amount, OutputFeatures features, OutputStatus status, long blockHeight) {
        try (KeyChain keys = KeyChain.fromSeed(seed, functions)) {
            return wallet.createOutput(keys, amount, features, status, blockHeight, null);
        }
    }

    public OutputData getOutput(int index, long amount, OutputStatus status, OutputFeatures features, long blockHeight) {
        try (WalletSeed seed = getSeed(7); KeyChain keys = KeyChain.fromSeed(seed, functions)) {
            KeyId keyId = KeyId.outputKey(index);
            return new OutputData(keyId, keys.commit(keyId, amount), amount, status, features, blockHeight, null, 0);
        }
    }

    public OutputData getOutput(int index, long amount) {
        return getOutput(index, amount, OutputStatus.UNSPENT, OutputFeatures.PLAIN, 1);
    }

    public UUID randomSlateId() {
        return UUID.randomUUID();
    }
}
