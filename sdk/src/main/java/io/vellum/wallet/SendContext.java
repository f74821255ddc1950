package io.vellum.wallet;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.vellum.secret.KeyId;
import io.vellum.transaction.Transaction;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Sender-side record of one in-flight slate. Holds public data only: the sender excess and nonce are re-derived from
 * the seed, the key ids and the slate id when the slate comes back.
 */
public final class SendContext {
    private final UUID slateId;
    private final List<KeyId> inputKeyIds;
    private final KeyId changeKeyId;
    private final long amount;
    private final long fee;
    private final byte[] offset;
    private final long createdAt;
    private final SendStatus status;
    private final Transaction transaction;

    @JsonCreator
    public SendContext(@JsonProperty("slateId") UUID slateId,
                       @JsonProperty("inputKeyIds") List<KeyId> inputKeyIds,
                       @JsonProperty("changeKeyId") KeyId changeKeyId,
                       @JsonProperty("amount") long amount,
                       @JsonProperty("fee") long fee,
                       @JsonProperty("offset") byte[] offset,
                       @JsonProperty("createdAt") long createdAt,
                       @JsonProperty("status") SendStatus status,
                       @JsonProperty("transaction") Transaction transaction) {
        this.slateId = Objects.requireNonNull(slateId, "slateId must be defined");
        this.inputKeyIds = Collections.unmodifiableList(List.copyOf(Objects.requireNonNull(inputKeyIds, "inputKeyIds must be defined")));
        this.changeKeyId = changeKeyId;
        this.amount = amount;
        this.fee = fee;
        this.offset = Arrays.copyOf(Objects.requireNonNull(offset, "offset must be defined"), offset.length);
        this.createdAt = createdAt;
        this.status = Objects.requireNonNull(status, "status must be defined");
        this.transaction = transaction;
    }

    @JsonProperty("slateId")
    public UUID slateId() {
        return slateId;
    }

    @JsonProperty("inputKeyIds")
    public List<KeyId> inputKeyIds() {
        return inputKeyIds;
    }

    @JsonProperty("changeKeyId")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public KeyId changeKeyIdOrNull() {
        return changeKeyId;
    }

    public Optional<KeyId> changeKeyId() {
        return Optional.ofNullable(changeKeyId);
    }

    @JsonProperty("amount")
    public long amount() {
        return amount;
    }

    @JsonProperty("fee")
    public long fee() {
        return fee;
    }

    @JsonProperty("offset")
    public byte[] offset() {
        return Arrays.copyOf(offset, offset.length);
    }

    @JsonProperty("createdAt")
    public long createdAt() {
        return createdAt;
    }

    @JsonProperty("status")
    public SendStatus status() {
        return status;
    }

    @JsonProperty("transaction")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public Transaction transactionOrNull() {
        return transaction;
    }

    public Optional<Transaction> transaction() {
        return Optional.ofNullable(transaction);
    }

    public SendContext finalized(Transaction finalTransaction) {
        return new SendContext(slateId, inputKeyIds, changeKeyId, amount, fee, offset, createdAt, SendStatus.FINALIZED,
                Objects.requireNonNull(finalTransaction));
    }

    public SendContext canceled() {
        return new SendContext(slateId, inputKeyIds, changeKeyId, amount, fee, offset, createdAt, SendStatus.CANCELED, null);
    }

    @Override
    public String toString() {
        return String.format("SendContext(slateId: %s, amount: %d, fee: %d, inputs: %d, status: %s)",
                slateId, amount, fee, inputKeyIds.size(), status);
    }
}
