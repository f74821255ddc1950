package io.vellum.slate;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * The document two wallets pass back and forth to build one transaction. It is the only state shared between
 * sender and receiver and arrives over an untrusted channel, so the fields are not validated on construction:
 * {@link SlateValidator} does that before any protocol step.
 */
public final class Slate {
    public static final int CURRENT_VERSION = 1;
    public static final int NUM_PARTICIPANTS = 2;
    public static final int SENDER_ID = 0;
    public static final int RECEIVER_ID = 1;

    private final int version;
    private final UUID id;
    private final int numParticipants;
    private final long amount;
    private final long fee;
    private final long height;
    private final long lockHeight;

    private SlateState state;
    private SlateTransaction transaction;
    private List<ParticipantData> participantData;

    @JsonCreator
    public Slate(@JsonProperty("version") int version,
                 @JsonProperty("id") UUID id,
                 @JsonProperty("numParticipants") int numParticipants,
                 @JsonProperty("amount") long amount,
                 @JsonProperty("fee") long fee,
                 @JsonProperty("height") long height,
                 @JsonProperty("lockHeight") long lockHeight,
                 @JsonProperty("state") SlateState state,
                 @JsonProperty("transaction") SlateTransaction transaction,
                 @JsonProperty("participantData") List<ParticipantData> participantData) {
        this.version = version;
        this.id = id;
        this.numParticipants = numParticipants;
        this.amount = amount;
        this.fee = fee;
        this.height = height;
        this.lockHeight = lockHeight;
        this.state = state;
        this.transaction = transaction;
        this.participantData = participantData == null ? null : Collections.unmodifiableList(new ArrayList<>(participantData));
    }

    @JsonProperty("version")
    public int version() {
        return version;
    }

    @JsonProperty("id")
    public UUID id() {
        return id;
    }

    @JsonProperty("numParticipants")
    public int numParticipants() {
        return numParticipants;
    }

    @JsonProperty("amount")
    public long amount() {
        return amount;
    }

    @JsonProperty("fee")
    public long fee() {
        return fee;
    }

    @JsonProperty("height")
    public long height() {
        return height;
    }

    @JsonProperty("lockHeight")
    public long lockHeight() {
        return lockHeight;
    }

    @JsonProperty("state")
    public synchronized SlateState state() {
        return state;
    }

    @JsonProperty("transaction")
    public synchronized SlateTransaction transaction() {
        return transaction;
    }

    @JsonProperty("participantData")
    public synchronized List<ParticipantData> participantData() {
        return participantData;
    }

    public Optional<ParticipantData> participant(int participantId) {
        List<ParticipantData> participants = participantData();
        if (participants == null)
            return Optional.empty();
        return participants.stream().filter(p -> p != null && p.id() == participantId).findFirst();
    }

    public Slate copy() {
        Slate copy;
        synchronized (this) {
            copy = new Slate(version, id, numParticipants, amount, fee, height, lockHeight, state, transaction, participantData);
        }
        return copy;
    }

    // Protocol steps work on a copy and publish the result here only once the step succeeded.
    synchronized void update(SlateState newState, SlateTransaction newTransaction, List<ParticipantData> newParticipantData) {
        this.state = newState;
        this.transaction = newTransaction;
        this.participantData = Collections.unmodifiableList(new ArrayList<>(newParticipantData));
    }

    @Override
    public String toString() {
        return String.format("Slate(id: %s, amount: %d, fee: %d, state: %s)", id, amount, fee, state());
    }
}
