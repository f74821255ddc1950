package io.vellum.storage;

import io.vellum.output.OutputData;
import io.vellum.secret.EncryptedSeed;
import io.vellum.storage.exception.StorageException;
import io.vellum.wallet.SendContext;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Volatile storage, for tests and throwaway wallets. Unknown usernames read as empty.
 */
public class InMemoryWalletStorage implements WalletStorage {
    private final Map<String, WalletRecord> wallets = new HashMap<>();
    private boolean closed = false;

    @Override
    public synchronized boolean createWallet(String username, EncryptedSeed encryptedSeed) {
        checkOpen();
        Objects.requireNonNull(encryptedSeed, "encryptedSeed must be defined");
        if (wallets.containsKey(username))
            return false;
        wallets.put(username, new WalletRecord(encryptedSeed));
        return true;
    }

    @Override
    public synchronized Optional<EncryptedSeed> loadEncryptedSeed(String username) {
        checkOpen();
        return Optional.ofNullable(wallets.get(username)).map(WalletRecord::encryptedSeed);
    }

    @Override
    public synchronized List<OutputData> loadOutputs(String username) {
        checkOpen();
        WalletRecord record = wallets.get(username);
        return record == null ? Collections.emptyList() : record.outputs();
    }

    @Override
    public synchronized void saveOutputs(String username, Collection<OutputData> outputs) {
        record(username).upsertOutputs(outputs);
    }

    @Override
    public synchronized int nextChildIndex(String username) {
        return record(username).allocateChildIndex();
    }

    @Override
    public synchronized Optional<SendContext> loadSendContext(String username, UUID slateId) {
        checkOpen();
        WalletRecord record = wallets.get(username);
        return record == null ? Optional.empty() : record.sendContext(slateId);
    }

    @Override
    public synchronized List<SendContext> loadSendContexts(String username) {
        checkOpen();
        WalletRecord record = wallets.get(username);
        return record == null ? Collections.emptyList() : record.sendContexts();
    }

    @Override
    public synchronized void saveSendContext(String username, SendContext context, Collection<OutputData> outputs) {
        WalletRecord record = record(username);
        record.upsertOutputs(outputs);
        record.upsertSendContext(context);
    }

    @Override
    public synchronized boolean saveReceivedOutput(String username, Collection<UUID> slateIds, OutputData output) {
        return record(username).receiveOutput(slateIds, output);
    }

    @Override
    public synchronized void close() {
        closed = true;
    }

    private WalletRecord record(String username) {
        checkOpen();
        WalletRecord record = wallets.get(username);
        if (record == null)
            throw new StorageException("No wallet stored for user " + username);
        return record;
    }

    private void checkOpen() {
        if (closed)
            throw new StorageException("Storage is closed");
    }
}
