package io.vellum.storage;

import io.vellum.output.OutputData;
import io.vellum.output.OutputFeatures;
import io.vellum.output.OutputStatus;
import io.vellum.storage.exception.StorageException;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.UUID;

import static org.junit.Assert.*;

public class JsonFileWalletStorageTest extends WalletStorageContract {

    @Rule
    public TemporaryFolder temporaryFolder = new TemporaryFolder();

    @Override
    protected WalletStorage storage() {
        try {
            return new JsonFileWalletStorage(temporaryFolder.newFolder().toPath());
        } catch (IOException e) {
            throw new IllegalStateException(e);
        }
    }

    @Test
    public void recordsSurviveReopening() throws IOException {
        Path directory = temporaryFolder.newFolder("wallets").toPath();
        OutputData coinbase = getOutput(3, 60, OutputStatus.IMMATURE, OutputFeatures.COINBASE, 90);
        UUID slateId = UUID.randomUUID();

        try (JsonFileWalletStorage storage = new JsonFileWalletStorage(directory)) {
            storage.createWallet("alice", getDummyEncryptedSeed());
            storage.saveOutputs("alice", List.of(getOutput(0, 5), coinbase));
            storage.nextChildIndex("alice");
            storage.nextChildIndex("alice");
            storage.saveReceivedOutput("alice", List.of(slateId), getOutput(1, 8));
        }

        assertTrue(Files.exists(directory.resolve("alice.json")));
        assertFalse("Temporary file must be moved into place.", Files.exists(directory.resolve("alice.json.tmp")));

        try (JsonFileWalletStorage storage = new JsonFileWalletStorage(directory)) {
            assertEquals(getDummyEncryptedSeed(), storage.loadEncryptedSeed("alice").get());
            List<OutputData> outputs = storage.loadOutputs("alice");
            assertEquals(3, outputs.size());
            assertTrue(outputs.contains(coinbase));
            assertTrue(outputs.contains(getOutput(1, 8)));
            assertEquals("Counter must continue after reopening.", 2, storage.nextChildIndex("alice"));
            assertFalse(storage.saveReceivedOutput("alice", List.of(slateId), getOutput(2, 8)));
        }
    }

    @Test
    public void usernamesMustBeFileNames() throws IOException {
        File directory = temporaryFolder.newFolder();
        WalletStorage storage = new JsonFileWalletStorage(directory.toPath());

        assertThrows(StorageException.class, () -> storage.createWallet("../alice", getDummyEncryptedSeed()));
        assertThrows(StorageException.class, () -> storage.createWallet("", getDummyEncryptedSeed()));
        assertFalse(storage.loadEncryptedSeed("../alice").isPresent());
        assertTrue(storage.loadOutputs("a/b").isEmpty());
        assertEquals(0, directory.listFiles().length);
    }

    @Test
    public void corruptedFileIsReported() throws IOException {
        Path directory = temporaryFolder.newFolder().toPath();
        Files.writeString(directory.resolve("alice.json"), "{ not json");
        WalletStorage storage = new JsonFileWalletStorage(directory);

        assertThrows(StorageException.class, () -> storage.loadOutputs("alice"));
    }
}
