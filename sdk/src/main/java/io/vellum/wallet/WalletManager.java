package io.vellum.wallet;

import io.vellum.cryptolibprovider.CommitmentFunctions;
import io.vellum.cryptolibprovider.CryptoLibProvider;
import io.vellum.node.NodeClient;
import io.vellum.secret.Bip39MnemonicCodec;
import io.vellum.secret.EncryptedSeed;
import io.vellum.secret.MnemonicCodec;
import io.vellum.secret.SeedVault;
import io.vellum.secret.WalletSeed;
import io.vellum.secret.exception.AuthenticationException;
import io.vellum.session.SessionRegistry;
import io.vellum.session.SessionToken;
import io.vellum.settings.WalletSettings;
import io.vellum.slate.Slate;
import io.vellum.slate.SlateBuilder;
import io.vellum.slate.exception.InvalidSlateException;
import io.vellum.storage.InMemoryWalletStorage;
import io.vellum.storage.JsonFileWalletStorage;
import io.vellum.storage.WalletStorage;
import io.vellum.transaction.FeeCalculator;
import io.vellum.transaction.Transaction;
import io.vellum.transaction.WeightFeeCalculator;
import io.vellum.utils.BytesUtils;
import io.vellum.utils.Pair;
import io.vellum.wallet.exception.InsufficientFundsException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Paths;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Entry point of the wallet core for a front end. Owns the storage handle and the session registry; closing the
 * manager logs every session out and closes the storage.
 */
public class WalletManager implements AutoCloseable {
    private static final Logger log = LogManager.getLogger(WalletManager.class);

    private final WalletStorage storage;
    private final NodeClient nodeClient;
    private final MnemonicCodec mnemonicCodec;
    private final SeedVault vault;
    private final CommitmentFunctions functions;
    private final OutputLedger ledger;
    private final CoinSelector coinSelector;
    private final Duration lockExpiry;
    private final Clock clock;
    private final SecureRandom random = new SecureRandom();

    private final ConcurrentMap<String, Wallet> wallets = new ConcurrentHashMap<>();
    private final SessionRegistry sessions;
    private final SlateBuilder slateBuilder;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public WalletManager(WalletStorage storage, NodeClient nodeClient, MnemonicCodec mnemonicCodec, SeedVault vault,
                         CommitmentFunctions functions, FeeCalculator feeCalculator, MaturityPolicy maturityPolicy,
                         int minimumConfirmations, Duration lockExpiry, Clock clock) {
        this.storage = Objects.requireNonNull(storage, "storage must be defined");
        this.nodeClient = Objects.requireNonNull(nodeClient, "nodeClient must be defined");
        this.mnemonicCodec = Objects.requireNonNull(mnemonicCodec, "mnemonicCodec must be defined");
        this.vault = Objects.requireNonNull(vault, "vault must be defined");
        this.functions = Objects.requireNonNull(functions, "functions must be defined");
        this.ledger = new OutputLedger(maturityPolicy);
        this.coinSelector = new CoinSelector(feeCalculator);
        this.lockExpiry = Objects.requireNonNull(lockExpiry, "lockExpiry must be defined");
        this.clock = Objects.requireNonNull(clock, "clock must be defined");
        this.sessions = new SessionRegistry(storage, vault, this::wallet, random);
        this.slateBuilder = new SlateBuilder(functions, nodeClient, minimumConfirmations);
    }

    public static WalletManager start(WalletSettings settings, NodeClient nodeClient) {
        WalletStorage storage;
        if (settings.getStorageType() == WalletSettings.StorageType.FILE)
            storage = new JsonFileWalletStorage(Paths.get(settings.getStorageDirectory()));
        else
            storage = new InMemoryWalletStorage();

        return new WalletManager(storage, nodeClient, new Bip39MnemonicCodec(),
                new SeedVault(settings.getScryptN(), settings.getScryptR(), settings.getScryptP()),
                CryptoLibProvider.commitmentFunctions, new WeightFeeCalculator(),
                new CoinbaseMaturityPolicy(settings.getCoinbaseMaturity()), settings.getMinimumConfirmations(),
                settings.getLockExpiry(), Clock.systemUTC());
    }

    /**
     * Creates a wallet with a fresh seed and logs its owner in. Returns the mnemonic backup words and the session
     * token, or empty if the username is taken.
     */
    public Optional<Pair<String, SessionToken>> initializeNewWallet(String username, String passphrase) {
        checkUsername(username);
        try (WalletSeed seed = WalletSeed.generate(random)) {
            byte[] entropy = seed.bytes();
            String mnemonic;
            try {
                mnemonic = mnemonicCodec.createMnemonic(entropy);
            } finally {
                BytesUtils.wipe(entropy);
            }
            Optional<SessionToken> token = createWallet(username, passphrase, seed);
            if (token.isEmpty())
                return Optional.empty();
            return Optional.of(new Pair<>(mnemonic, token.get()));
        }
    }

    // Recreates a wallet from its backup words. Outputs are not recovered from the chain.
    public Optional<SessionToken> restoreFromMnemonic(String username, String passphrase, String mnemonic) {
        checkUsername(username);
        byte[] entropy = mnemonicCodec.toEntropy(mnemonic);
        try (WalletSeed seed = new WalletSeed(entropy)) {
            return createWallet(username, passphrase, seed);
        } finally {
            BytesUtils.wipe(entropy);
        }
    }

    public Optional<SessionToken> login(String username, String passphrase) {
        try {
            return Optional.of(sessions.login(username, passphrase));
        } catch (AuthenticationException e) {
            log.info("Login of user {} failed: {}", username, e.getMessage());
            return Optional.empty();
        }
    }

    public void logout(SessionToken token) {
        sessions.logout(token);
    }

    public WalletSummary getWalletSummary(SessionToken token, int minimumConfirmations) {
        if (minimumConfirmations < 0)
            throw new IllegalArgumentException("Minimum confirmations must be >= 0.");
        Wallet wallet = sessions.getWallet(token);
        try (WalletSeed seed = sessions.getSeed(token)) {
            return wallet.summary(seed, nodeClient.getChainHeight(), minimumConfirmations);
        }
    }

    public Slate send(SessionToken token, long amount, long feeBase, String message, SelectionStrategy strategy)
            throws InsufficientFundsException {
        Wallet wallet = sessions.getWallet(token);
        try (WalletSeed seed = sessions.getSeed(token)) {
            return slateBuilder.buildSendSlate(wallet, seed, amount, feeBase, message, strategy);
        }
    }

    public boolean receive(SessionToken token, Slate slate, String message) throws InvalidSlateException {
        Wallet wallet = sessions.getWallet(token);
        try (WalletSeed seed = sessions.getSeed(token)) {
            return slateBuilder.addReceiverData(wallet, seed, slate, message);
        }
    }

    public Transaction finalize(SessionToken token, Slate slate) throws InvalidSlateException {
        Wallet wallet = sessions.getWallet(token);
        try (WalletSeed seed = sessions.getSeed(token)) {
            return slateBuilder.finalize(wallet, seed, slate);
        }
    }

    public boolean cancel(SessionToken token, UUID slateId) {
        return slateBuilder.cancel(sessions.getWallet(token), slateId);
    }

    public void postTransaction(SessionToken token, Transaction transaction) {
        String username = sessions.getUsername(token);
        nodeClient.postTransaction(transaction);
        log.info("Transaction {} of user {} posted", transaction.id(), username);
    }

    public int refreshOutputs(SessionToken token) {
        return sessions.getWallet(token).refreshOutputs(nodeClient);
    }

    public SessionRegistry getSessionRegistry() {
        return sessions;
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true))
            return;
        try {
            sessions.logoutAll();
        } finally {
            storage.close();
        }
        log.info("Wallet manager closed");
    }

    private Optional<SessionToken> createWallet(String username, String passphrase, WalletSeed seed) {
        EncryptedSeed encrypted = vault.encryptWalletSeed(seed, passphrase);
        if (!storage.createWallet(username, encrypted)) {
            log.info("Wallet for user {} not created: username already taken", username);
            return Optional.empty();
        }
        log.info("Wallet for user {} created", username);
        return Optional.of(sessions.login(username, seed));
    }

    private Wallet wallet(String username) {
        return wallets.computeIfAbsent(username,
                name -> new Wallet(name, storage, functions, ledger, coinSelector, lockExpiry, clock));
    }

    private static void checkUsername(String username) {
        if (username == null || username.isBlank())
            throw new IllegalArgumentException("Username must be defined");
    }
}
