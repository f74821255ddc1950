package io.vellum.storage;

import io.vellum.fixtures.WalletFixtureClass;
import io.vellum.output.OutputData;
import io.vellum.output.OutputFeatures;
import io.vellum.output.OutputStatus;
import io.vellum.secret.KeyId;
import io.vellum.storage.exception.StorageException;
import io.vellum.wallet.SendContext;
import io.vellum.wallet.SendStatus;
import org.junit.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import static org.junit.Assert.*;

// Behaviour every WalletStorage implementation shares.
public abstract class WalletStorageContract extends WalletFixtureClass {

    protected abstract WalletStorage storage();

    @Test
    public void createWallet() {
        WalletStorage storage = storage();
        assertTrue(storage.createWallet("alice", getDummyEncryptedSeed()));
        assertFalse("Username must be unique.", storage.createWallet("alice", getDummyEncryptedSeed()));
        assertEquals(Optional.of(getDummyEncryptedSeed()), storage.loadEncryptedSeed("alice"));
    }

    @Test
    public void unknownUserReadsAsEmpty() {
        WalletStorage storage = storage();
        assertFalse(storage.loadEncryptedSeed("nobody").isPresent());
        assertTrue(storage.loadOutputs("nobody").isEmpty());
        assertTrue(storage.loadSendContexts("nobody").isEmpty());
        assertFalse(storage.loadSendContext("nobody", randomSlateId()).isPresent());
    }

    @Test
    public void unknownUserCantBeWritten() {
        WalletStorage storage = storage();
        assertThrows(StorageException.class, () -> storage.saveOutputs("nobody", List.of(getOutput(0, 5))));
        assertThrows(StorageException.class, () -> storage.nextChildIndex("nobody"));
        assertThrows(StorageException.class, () -> storage.saveReceivedOutput("nobody", List.of(randomSlateId()), getOutput(0, 5)));
    }

    @Test
    public void outputsAreUpsertedByKeyId() {
        WalletStorage storage = storage();
        storage.createWallet("alice", getDummyEncryptedSeed());
        OutputData first = getOutput(0, 5);
        OutputData second = getOutput(1, 7);
        storage.saveOutputs("alice", List.of(first, second));

        UUID slateId = randomSlateId();
        storage.saveOutputs("alice", List.of(first.withStatus(OutputStatus.LOCKED, slateId)));

        List<OutputData> outputs = storage.loadOutputs("alice");
        assertEquals(2, outputs.size());
        assertTrue(outputs.contains(first.withStatus(OutputStatus.LOCKED, slateId)));
        assertTrue(outputs.contains(second));
        assertFalse(outputs.contains(first));
    }

    @Test
    public void childIndexesAreNeverReused() {
        WalletStorage storage = storage();
        storage.createWallet("alice", getDummyEncryptedSeed());
        storage.createWallet("bob", getDummyEncryptedSeed());

        Set<Integer> seen = new HashSet<>();
        for (int i = 0; i < 20; i++)
            assertTrue("Index returned twice.", seen.add(storage.nextChildIndex("alice")));
        assertEquals("Users don't share a counter.", 0, storage.nextChildIndex("bob"));
    }

    @Test
    public void sendContextsAreReplaced() {
        WalletStorage storage = storage();
        storage.createWallet("alice", getDummyEncryptedSeed());
        UUID slateId = randomSlateId();
        SendContext context = new SendContext(slateId, List.of(KeyId.outputKey(0)), null, 10, 1,
                functions.generateSecretKey(), 42, SendStatus.PENDING, null);

        storage.saveSendContext("alice", context, List.of());
        storage.saveSendContext("alice", context.canceled(), List.of());

        assertEquals(1, storage.loadSendContexts("alice").size());
        SendContext stored = storage.loadSendContext("alice", slateId).get();
        assertEquals(SendStatus.CANCELED, stored.status());
        assertEquals(List.of(KeyId.outputKey(0)), stored.inputKeyIds());
        assertFalse(stored.changeKeyId().isPresent());
        assertArrayEquals(context.offset(), stored.offset());
        assertEquals(42, stored.createdAt());
    }

    @Test
    public void sendContextIsSavedWithItsOutputs() {
        WalletStorage storage = storage();
        storage.createWallet("alice", getDummyEncryptedSeed());
        UUID slateId = randomSlateId();
        OutputData input = getOutput(0, 10);
        OutputData change = getOutput(1, 4, OutputStatus.UNCONFIRMED, OutputFeatures.PLAIN, 0);
        storage.saveOutputs("alice", List.of(input));
        SendContext context = new SendContext(slateId, List.of(input.keyId()), change.keyId(), 5, 1,
                functions.generateSecretKey(), 42, SendStatus.PENDING, null);

        storage.saveSendContext("alice", context, List.of(input.withStatus(OutputStatus.LOCKED, slateId), change));

        List<OutputData> outputs = storage.loadOutputs("alice");
        assertEquals(2, outputs.size());
        assertTrue(outputs.contains(input.withStatus(OutputStatus.LOCKED, slateId)));
        assertTrue(outputs.contains(change));
        assertEquals(SendStatus.PENDING, storage.loadSendContext("alice", slateId).get().status());
    }

    @Test
    public void receivedSlatesAreRegisteredOnce() {
        WalletStorage storage = storage();
        storage.createWallet("alice", getDummyEncryptedSeed());
        storage.createWallet("bob", getDummyEncryptedSeed());
        UUID slateId = randomSlateId();
        UUID nonceId = randomSlateId();

        assertTrue(storage.saveReceivedOutput("alice", List.of(slateId, nonceId), getOutput(0, 5)));
        assertFalse("Same slate id.", storage.saveReceivedOutput("alice", List.of(slateId, randomSlateId()), getOutput(1, 6)));
        assertFalse("Same nonce.", storage.saveReceivedOutput("alice", List.of(randomSlateId(), nonceId), getOutput(2, 7)));
        assertTrue(storage.saveReceivedOutput("bob", List.of(slateId, nonceId), getOutput(0, 5)));

        assertEquals("Rejected slates store no output.", List.of(getOutput(0, 5)), storage.loadOutputs("alice"));
    }

    @Test
    public void closedStorageRejectsCalls() {
        WalletStorage storage = storage();
        storage.createWallet("alice", getDummyEncryptedSeed());
        storage.close();
        storage.close();

        assertThrows(StorageException.class, () -> storage.loadOutputs("alice"));
        assertThrows(StorageException.class, () -> storage.createWallet("bob", getDummyEncryptedSeed()));
    }
}
