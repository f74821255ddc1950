package io.vellum.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.vellum.output.OutputData;
import io.vellum.secret.EncryptedSeed;
import io.vellum.serialization.ApplicationJsonSerializer;
import io.vellum.storage.exception.StorageException;
import io.vellum.wallet.SendContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Stores every wallet as one JSON document, {@code <directory>/<username>.json}. Each mutation rewrites the
 * document through a temporary file, so a crash leaves either the old or the new version on disk.
 */
public class JsonFileWalletStorage implements WalletStorage {
    private static final Logger log = LogManager.getLogger(JsonFileWalletStorage.class);
    private static final Pattern USERNAME = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]{0,63}");

    private final Path directory;
    private final ObjectMapper mapper;
    private boolean closed = false;

    public JsonFileWalletStorage(Path directory) {
        this.directory = Objects.requireNonNull(directory, "directory must be defined");
        this.mapper = ApplicationJsonSerializer.getInstance().getObjectMapper();
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new StorageException("Can't create wallet directory " + directory, e);
        }
        log.info("Wallet storage opened at {}", directory.toAbsolutePath());
    }

    @Override
    public synchronized boolean createWallet(String username, EncryptedSeed encryptedSeed) {
        Objects.requireNonNull(encryptedSeed, "encryptedSeed must be defined");
        if (read(username).isPresent())
            return false;
        write(username, new WalletRecord(encryptedSeed));
        return true;
    }

    @Override
    public synchronized Optional<EncryptedSeed> loadEncryptedSeed(String username) {
        return read(username).map(WalletRecord::encryptedSeed);
    }

    @Override
    public synchronized List<OutputData> loadOutputs(String username) {
        return read(username).map(WalletRecord::outputs).orElse(Collections.emptyList());
    }

    @Override
    public synchronized void saveOutputs(String username, Collection<OutputData> outputs) {
        update(username, record -> {
            record.upsertOutputs(outputs);
            return null;
        });
    }

    @Override
    public synchronized int nextChildIndex(String username) {
        return update(username, WalletRecord::allocateChildIndex);
    }

    @Override
    public synchronized Optional<SendContext> loadSendContext(String username, UUID slateId) {
        return read(username).flatMap(record -> record.sendContext(slateId));
    }

    @Override
    public synchronized List<SendContext> loadSendContexts(String username) {
        return read(username).map(WalletRecord::sendContexts).orElse(Collections.emptyList());
    }

    @Override
    public synchronized void saveSendContext(String username, SendContext context, Collection<OutputData> outputs) {
        update(username, record -> {
            record.upsertOutputs(outputs);
            record.upsertSendContext(context);
            return null;
        });
    }

    @Override
    public synchronized boolean saveReceivedOutput(String username, Collection<UUID> slateIds, OutputData output) {
        return update(username, record -> record.receiveOutput(slateIds, output));
    }

    @Override
    public synchronized void close() {
        if (!closed) {
            closed = true;
            log.info("Wallet storage at {} closed", directory.toAbsolutePath());
        }
    }

    private <T> T update(String username, Function<WalletRecord, T> change) {
        WalletRecord record = read(username)
                .orElseThrow(() -> new StorageException("No wallet stored for user " + username));
        T result = change.apply(record);
        write(username, record);
        return result;
    }

    // Names that can't be stored can't have a wallet either.
    private Optional<WalletRecord> read(String username) {
        if (username == null || !USERNAME.matcher(username).matches()) {
            checkOpen();
            return Optional.empty();
        }
        Path file = walletFile(username);
        if (!Files.exists(file))
            return Optional.empty();
        try {
            return Optional.of(mapper.readValue(file.toFile(), WalletRecord.class));
        } catch (IOException e) {
            throw new StorageException("Can't read wallet file " + file, e);
        }
    }

    private void write(String username, WalletRecord record) {
        Path file = walletFile(username);
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            mapper.writeValue(tmp.toFile(), record);
            try {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new StorageException("Can't write wallet file " + file, e);
        }
    }

    private Path walletFile(String username) {
        checkOpen();
        if (username == null || !USERNAME.matcher(username).matches())
            throw new StorageException("Username can't be used as a file name: " + username);
        return directory.resolve(username + ".json");
    }

    private void checkOpen() {
        if (closed)
            throw new StorageException("Storage is closed");
    }
}
