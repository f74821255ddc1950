package io.vellum.storage;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.vellum.output.OutputData;
import io.vellum.secret.EncryptedSeed;
import io.vellum.wallet.SendContext;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

// Everything stored for one username. Not thread safe, guarded by the owning storage.
final class WalletRecord {
    private final EncryptedSeed encryptedSeed;
    private final List<OutputData> outputs;
    private final List<SendContext> sendContexts;
    private final Set<UUID> receivedSlates;
    private int nextChildIndex;

    WalletRecord(EncryptedSeed encryptedSeed) {
        this(encryptedSeed, new ArrayList<>(), new ArrayList<>(), new LinkedHashSet<>(), 0);
    }

    @JsonCreator
    WalletRecord(@JsonProperty("encryptedSeed") EncryptedSeed encryptedSeed,
                 @JsonProperty("outputs") List<OutputData> outputs,
                 @JsonProperty("sendContexts") List<SendContext> sendContexts,
                 @JsonProperty("receivedSlates") Set<UUID> receivedSlates,
                 @JsonProperty("nextChildIndex") int nextChildIndex) {
        this.encryptedSeed = Objects.requireNonNull(encryptedSeed, "encryptedSeed must be defined");
        this.outputs = outputs == null ? new ArrayList<>() : new ArrayList<>(outputs);
        this.sendContexts = sendContexts == null ? new ArrayList<>() : new ArrayList<>(sendContexts);
        this.receivedSlates = receivedSlates == null ? new LinkedHashSet<>() : new LinkedHashSet<>(receivedSlates);
        this.nextChildIndex = nextChildIndex;
    }

    @JsonProperty("encryptedSeed")
    EncryptedSeed encryptedSeed() {
        return encryptedSeed;
    }

    @JsonProperty("outputs")
    List<OutputData> outputs() {
        return new ArrayList<>(outputs);
    }

    @JsonProperty("sendContexts")
    List<SendContext> sendContexts() {
        return new ArrayList<>(sendContexts);
    }

    @JsonProperty("receivedSlates")
    Set<UUID> receivedSlates() {
        return new LinkedHashSet<>(receivedSlates);
    }

    @JsonProperty("nextChildIndex")
    int nextChildIndex() {
        return nextChildIndex;
    }

    void upsertOutputs(Collection<OutputData> updated) {
        for (OutputData output : updated) {
            boolean replaced = false;
            for (int i = 0; i < outputs.size(); i++) {
                if (outputs.get(i).keyId().equals(output.keyId())) {
                    outputs.set(i, output);
                    replaced = true;
                    break;
                }
            }
            if (!replaced)
                outputs.add(output);
        }
    }

    int allocateChildIndex() {
        if (nextChildIndex == Integer.MAX_VALUE)
            throw new IllegalStateException("Output key space exhausted");
        return nextChildIndex++;
    }

    Optional<SendContext> sendContext(UUID slateId) {
        return sendContexts.stream().filter(c -> c.slateId().equals(slateId)).findFirst();
    }

    void upsertSendContext(SendContext context) {
        for (int i = 0; i < sendContexts.size(); i++) {
            if (sendContexts.get(i).slateId().equals(context.slateId())) {
                sendContexts.set(i, context);
                return;
            }
        }
        sendContexts.add(context);
    }

    boolean receiveOutput(Collection<UUID> slateIds, OutputData output) {
        for (UUID slateId : slateIds) {
            if (receivedSlates.contains(slateId))
                return false;
        }
        receivedSlates.addAll(slateIds);
        upsertOutputs(List.of(output));
        return true;
    }
}
