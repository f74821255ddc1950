package io.vellum.wallet;

import io.vellum.crypto.Commitment;
import io.vellum.crypto.PublicKey;
import io.vellum.cryptolibprovider.CommitmentFunctions;
import io.vellum.node.NodeClient;
import io.vellum.output.OutputData;
import io.vellum.output.OutputFeatures;
import io.vellum.output.OutputStatus;
import io.vellum.output.WalletCoin;
import io.vellum.secret.KeyChain;
import io.vellum.secret.KeyId;
import io.vellum.secret.WalletSeed;
import io.vellum.storage.WalletStorage;
import io.vellum.transaction.Transaction;
import io.vellum.wallet.exception.InsufficientFundsException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owned-output set of one user. A single instance is shared by every session of the user; its lock serializes
 * selection, reservation and every other read-modify-write of the persisted outputs.
 */
public class Wallet {
    private static final Logger log = LogManager.getLogger(Wallet.class);

    private final String username;
    private final WalletStorage storage;
    private final CommitmentFunctions functions;
    private final OutputLedger ledger;
    private final CoinSelector coinSelector;
    // Duration.ZERO keeps reservations until finalized or canceled
    private final Duration lockExpiry;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();

    public Wallet(String username, WalletStorage storage, CommitmentFunctions functions, OutputLedger ledger,
                  CoinSelector coinSelector, Duration lockExpiry, Clock clock) {
        this.username = Objects.requireNonNull(username, "username must be defined");
        this.storage = Objects.requireNonNull(storage, "storage must be defined");
        this.functions = Objects.requireNonNull(functions, "functions must be defined");
        this.ledger = Objects.requireNonNull(ledger, "ledger must be defined");
        this.coinSelector = Objects.requireNonNull(coinSelector, "coinSelector must be defined");
        this.lockExpiry = Objects.requireNonNull(lockExpiry, "lockExpiry must be defined");
        this.clock = Objects.requireNonNull(clock, "clock must be defined");
        if (lockExpiry.isNegative())
            throw new IllegalArgumentException("Lock expiry must not be negative.");
    }

    public String getUsername() {
        return username;
    }

    // Available outputs whose commitment re-derives from the seed, paired with their blinding factors.
    public List<WalletCoin> getAllAvailableCoins(WalletSeed seed) {
        try (KeyChain keys = KeyChain.fromSeed(seed, functions)) {
            List<WalletCoin> coins = new ArrayList<>();
            for (OutputData output : ownedOutputs(keys))
                coins.add(new WalletCoin(keys.deriveBlindingFactor(output.keyId()), output));
            return coins;
        }
    }

    public WalletSummary summary(WalletSeed seed, long chainHeight, int minimumConfirmations) {
        releaseExpiredLocks();
        List<OutputData> owned;
        try (KeyChain keys = KeyChain.fromSeed(seed, functions)) {
            owned = ownedOutputs(keys);
        }
        return ledger.summarize(owned, chainHeight, minimumConfirmations);
    }

    public List<OutputData> outputs(Collection<KeyId> keyIds) {
        Map<KeyId, OutputData> byKeyId = new HashMap<>();
        for (OutputData output : storage.loadOutputs(username))
            byKeyId.put(output.keyId(), output);

        List<OutputData> result = new ArrayList<>();
        for (KeyId keyId : keyIds) {
            OutputData output = byKeyId.get(keyId);
            if (output == null)
                throw new IllegalStateException("Output " + keyId + " is not stored in wallet " + username);
            result.add(output);
        }
        return result;
    }

    public Optional<SendContext> sendContext(UUID slateId) {
        return storage.loadSendContext(username, slateId);
    }

    public List<SendContext> sendContexts() {
        return storage.loadSendContexts(username);
    }

    public OutputData createOutput(KeyChain keys, long amount, OutputFeatures features, OutputStatus status,
                                   long blockHeight, UUID slateId) {
        lock.lock();
        try {
            OutputData output = newOutput(keys, amount, features, status, blockHeight, slateId);
            storage.saveOutputs(username, List.of(output));
            log.debug("Wallet {} created output {}", username, output);
            return output;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Selects inputs for a send, marks them {@link OutputStatus#LOCKED}, creates the change output and persists the
     * resulting {@link SendContext}, all under the wallet lock. Expired reservations are released first.
     */
    public SendContext reserveCoins(KeyChain keys, UUID slateId, byte[] offset, long amount, long feeBase,
                                    SelectionStrategy strategy, long chainHeight, int minimumConfirmations)
            throws InsufficientFundsException {
        lock.lock();
        try {
            releaseExpiredLocksLocked();

            List<OutputData> spendable = ledger.spendable(ownedOutputs(keys), chainHeight, minimumConfirmations);
            CoinSelection selection = coinSelector.select(spendable, amount, feeBase, strategy);

            List<OutputData> updated = new ArrayList<>();
            List<KeyId> inputKeyIds = new ArrayList<>();
            for (OutputData input : selection.getInputs()) {
                updated.add(input.withStatus(OutputStatus.LOCKED, slateId));
                inputKeyIds.add(input.keyId());
            }

            KeyId changeKeyId = null;
            if (selection.change() > 0) {
                OutputData change = newOutput(keys, selection.change(), OutputFeatures.PLAIN, OutputStatus.UNCONFIRMED, 0, slateId);
                updated.add(change);
                changeKeyId = change.keyId();
            }

            SendContext context = new SendContext(slateId, inputKeyIds, changeKeyId, amount, selection.getFee(), offset,
                    clock.millis(), SendStatus.PENDING, null);
            storage.saveSendContext(username, context, updated);
            log.info("Wallet {} reserved coins for slate {}: {}", username, slateId, selection);
            return context;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Marks the inputs of a reservation as spent. Returns the transaction stored for the slate, which differs from
     * the given one only if the slate was finalized before, or empty if the reservation was canceled or expired.
     */
    public Optional<Transaction> completeSend(UUID slateId, Transaction transaction) {
        lock.lock();
        try {
            Optional<SendContext> stored = storage.loadSendContext(username, slateId);
            if (stored.isEmpty())
                return Optional.empty();
            SendContext context = stored.get();
            if (context.status() == SendStatus.FINALIZED)
                return context.transaction();
            if (context.status() != SendStatus.PENDING)
                return Optional.empty();

            Set<KeyId> inputs = new HashSet<>(context.inputKeyIds());
            List<OutputData> updated = new ArrayList<>();
            for (OutputData output : storage.loadOutputs(username)) {
                if (inputs.contains(output.keyId()))
                    updated.add(output.withStatus(OutputStatus.SPENT, slateId));
            }
            storage.saveSendContext(username, context.finalized(transaction), updated);
            log.info("Wallet {} finalized slate {} as transaction {}", username, slateId, transaction.id());
            return Optional.of(transaction);
        } finally {
            lock.unlock();
        }
    }

    // Returns false if the slate is unknown or not pending anymore.
    public boolean cancel(UUID slateId) {
        lock.lock();
        try {
            Optional<SendContext> context = storage.loadSendContext(username, slateId);
            if (context.isEmpty() || context.get().status() != SendStatus.PENDING)
                return false;
            cancelLocked(context.get());
            log.info("Wallet {} canceled slate {}", username, slateId);
            return true;
        } finally {
            lock.unlock();
        }
    }

    public void releaseExpiredLocks() {
        lock.lock();
        try {
            releaseExpiredLocksLocked();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Creates the receive output of a slate and records the slate id and the sender nonce it carries, in one storage
     * write. Empty, with nothing stored, if the slate id or the nonce was seen before.
     */
    public Optional<OutputData> receiveOutput(KeyChain keys, UUID slateId, PublicKey senderNonce, long amount) {
        lock.lock();
        try {
            OutputData output = newOutput(keys, amount, OutputFeatures.PLAIN, OutputStatus.UNCONFIRMED, 0, slateId);
            List<UUID> seen = List.of(slateId, UUID.nameUUIDFromBytes(senderNonce.toBytes()));
            if (!storage.saveReceivedOutput(username, seen, output))
                return Optional.empty();
            log.debug("Wallet {} received output {} for slate {}", username, output, slateId);
            return Optional.of(output);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Copies block heights reported by the node into the stored outputs; unconfirmed outputs found on chain become
     * {@link OutputStatus#UNSPENT}. Returns the number of outputs changed.
     */
    public int refreshOutputs(NodeClient nodeClient) {
        lock.lock();
        try {
            List<OutputData> candidates = new ArrayList<>();
            for (OutputData output : storage.loadOutputs(username)) {
                if (output.status().isAvailable() && output.status() != OutputStatus.LOCKED)
                    candidates.add(output);
            }
            if (candidates.isEmpty())
                return 0;

            List<Commitment> commitments = new ArrayList<>();
            for (OutputData output : candidates)
                commitments.add(output.commitment());
            Map<Commitment, Long> heights = nodeClient.getOutputHeights(commitments);

            List<OutputData> updated = new ArrayList<>();
            for (OutputData output : candidates) {
                Long height = heights.get(output.commitment());
                if (height == null || height <= 0)
                    continue;
                OutputStatus status = output.status() == OutputStatus.UNCONFIRMED ? OutputStatus.UNSPENT : output.status();
                if (height != output.blockHeight() || status != output.status())
                    updated.add(output.withBlockHeight(height).withStatus(status));
            }
            storage.saveOutputs(username, updated);
            log.debug("Wallet {} refreshed {} outputs", username, updated.size());
            return updated.size();
        } finally {
            lock.unlock();
        }
    }

    private void releaseExpiredLocksLocked() {
        if (lockExpiry.isZero())
            return;
        long now = clock.millis();
        for (SendContext context : storage.loadSendContexts(username)) {
            if (context.status() == SendStatus.PENDING && now - context.createdAt() >= lockExpiry.toMillis()) {
                cancelLocked(context);
                log.info("Wallet {} released expired reservation of slate {}", username, context.slateId());
            }
        }
    }

    private void cancelLocked(SendContext context) {
        Set<KeyId> inputs = new HashSet<>(context.inputKeyIds());
        Optional<KeyId> change = context.changeKeyId();
        List<OutputData> updated = new ArrayList<>();
        for (OutputData output : storage.loadOutputs(username)) {
            if (inputs.contains(output.keyId()) && output.status() == OutputStatus.LOCKED)
                updated.add(output.withStatus(OutputStatus.UNSPENT, null));
            else if (change.isPresent() && change.get().equals(output.keyId()))
                updated.add(output.withStatus(OutputStatus.CANCELED));
        }
        storage.saveSendContext(username, context.canceled(), updated);
    }

    private OutputData newOutput(KeyChain keys, long amount, OutputFeatures features, OutputStatus status,
                                 long blockHeight, UUID slateId) {
        KeyId keyId = KeyId.outputKey(storage.nextChildIndex(username));
        Commitment commitment = keys.commit(keyId, amount);
        return new OutputData(keyId, commitment, amount, status, features, blockHeight, slateId, clock.millis());
    }

    private List<OutputData> ownedOutputs(KeyChain keys) {
        List<OutputData> owned = new ArrayList<>();
        for (OutputData output : storage.loadOutputs(username)) {
            if (!output.status().isAvailable())
                continue;
            if (keys.commit(output.keyId(), output.amount()).equals(output.commitment()))
                owned.add(output);
            else
                log.warn("Wallet {} skips output {}: commitment doesn't match the seed", username, output.keyId());
        }
        return owned;
    }
}
