package io.vellum.fixtures;

import io.vellum.output.OutputData;
import io.vellum.storage.InMemoryWalletStorage;
import io.vellum.storage.exception.StorageException;
import io.vellum.wallet.SendContext;

import java.util.Collection;
import java.util.UUID;

// In-memory storage whose next send context or received output write fails without storing anything.
public class FailingWalletStorage extends InMemoryWalletStorage {
    private boolean failSendContext;
    private boolean failReceivedOutput;

    public synchronized void failNextSendContext() {
        failSendContext = true;
    }

    public synchronized void failNextReceivedOutput() {
        failReceivedOutput = true;
    }

    @Override
    public synchronized void saveSendContext(String username, SendContext context, Collection<OutputData> outputs) {
        if (failSendContext) {
            failSendContext = false;
            throw new StorageException("Write of send context " + context.slateId() + " failed");
        }
        super.saveSendContext(username, context, outputs);
    }

    @Override
    public synchronized boolean saveReceivedOutput(String username, Collection<UUID> slateIds, OutputData output) {
        if (failReceivedOutput) {
            failReceivedOutput = false;
            throw new StorageException("Write of received output " + output.keyId() + " failed");
        }
        return super.saveReceivedOutput(username, slateIds, output);
    }
}
