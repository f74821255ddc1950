package io.vellum.storage;

import io.vellum.output.OutputData;
import io.vellum.secret.EncryptedSeed;
import io.vellum.wallet.SendContext;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Persistent wallet records, keyed by username. Implementations must be thread safe and report failures as
 * {@link io.vellum.storage.exception.StorageException}.
 */
public interface WalletStorage extends AutoCloseable {

    // false if the username is already taken
    boolean createWallet(String username, EncryptedSeed encryptedSeed);

    Optional<EncryptedSeed> loadEncryptedSeed(String username);

    List<OutputData> loadOutputs(String username);

    // Insert or replace outputs, matched by key id.
    void saveOutputs(String username, Collection<OutputData> outputs);

    // Next unused child index for output keys. Never returns the same value twice for a user.
    int nextChildIndex(String username);

    Optional<SendContext> loadSendContext(String username, UUID slateId);

    List<SendContext> loadSendContexts(String username);

    // Insert or replace the context together with the outputs it changed, in one write.
    void saveSendContext(String username, SendContext context, Collection<OutputData> outputs);

    /**
     * Records the ids of a received slate and stores its receive output in one write.
     * Returns false, storing nothing, if any of the ids was recorded before.
     */
    boolean saveReceivedOutput(String username, Collection<UUID> slateIds, OutputData output);

    @Override
    void close();
}
