package io.vellum.output;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.vellum.crypto.Commitment;
import io.vellum.secret.KeyId;

import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * One output owned by the wallet. The amount is kept in cleartext next to the commitment; ownership is proven by
 * re-deriving the commitment from the seed and {@link #keyId()}.
 */
public final class OutputData {
    private final KeyId keyId;
    private final Commitment commitment;
    private final long amount;
    private final OutputStatus status;
    private final OutputFeatures features;
    private final long blockHeight;
    private final UUID slateId;
    private final long createdAt;

    @JsonCreator
    public OutputData(@JsonProperty("keyId") KeyId keyId,
                      @JsonProperty("commitment") Commitment commitment,
                      @JsonProperty("amount") long amount,
                      @JsonProperty("status") OutputStatus status,
                      @JsonProperty("features") OutputFeatures features,
                      @JsonProperty("blockHeight") long blockHeight,
                      @JsonProperty("slateId") UUID slateId,
                      @JsonProperty("createdAt") long createdAt) {
        Objects.requireNonNull(keyId, "keyId must be defined");
        Objects.requireNonNull(commitment, "commitment must be defined");
        Objects.requireNonNull(status, "status must be defined");
        Objects.requireNonNull(features, "features must be defined");
        if (amount < 0)
            throw new IllegalArgumentException("Output amount must be >= 0.");
        if (blockHeight < 0)
            throw new IllegalArgumentException("Block height must be >= 0.");

        this.keyId = keyId;
        this.commitment = commitment;
        this.amount = amount;
        this.status = status;
        this.features = features;
        this.blockHeight = blockHeight;
        this.slateId = slateId;
        this.createdAt = createdAt;
    }

    @JsonProperty("keyId")
    public KeyId keyId() {
        return keyId;
    }

    @JsonProperty("commitment")
    public Commitment commitment() {
        return commitment;
    }

    @JsonProperty("amount")
    public long amount() {
        return amount;
    }

    @JsonProperty("status")
    public OutputStatus status() {
        return status;
    }

    @JsonProperty("features")
    public OutputFeatures features() {
        return features;
    }

    // 0 while the output is not part of a block
    @JsonProperty("blockHeight")
    public long blockHeight() {
        return blockHeight;
    }

    @JsonProperty("slateId")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public UUID slateIdOrNull() {
        return slateId;
    }

    public Optional<UUID> slateId() {
        return Optional.ofNullable(slateId);
    }

    @JsonProperty("createdAt")
    public long createdAt() {
        return createdAt;
    }

    @JsonIgnore
    public boolean isCoinbase() {
        return features == OutputFeatures.COINBASE;
    }

    public long confirmations(long chainHeight) {
        if (blockHeight == 0 || chainHeight < blockHeight)
            return 0;
        return chainHeight - blockHeight + 1;
    }

    public OutputData withStatus(OutputStatus newStatus) {
        return new OutputData(keyId, commitment, amount, newStatus, features, blockHeight, slateId, createdAt);
    }

    public OutputData withStatus(OutputStatus newStatus, UUID newSlateId) {
        return new OutputData(keyId, commitment, amount, newStatus, features, blockHeight, newSlateId, createdAt);
    }

    public OutputData withBlockHeight(long newBlockHeight) {
        return new OutputData(keyId, commitment, amount, status, features, newBlockHeight, slateId, createdAt);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        OutputData that = (OutputData) o;
        return amount == that.amount &&
                blockHeight == that.blockHeight &&
                createdAt == that.createdAt &&
                keyId.equals(that.keyId) &&
                commitment.equals(that.commitment) &&
                status == that.status &&
                features == that.features &&
                Objects.equals(slateId, that.slateId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(keyId, commitment, amount, status, features, blockHeight, slateId, createdAt);
    }

    @Override
    public String toString() {
        return String.format("OutputData(keyId: %s, commitment: %s, amount: %d, status: %s, features: %s, height: %d)",
                keyId, commitment, amount, status, features, blockHeight);
    }
}
