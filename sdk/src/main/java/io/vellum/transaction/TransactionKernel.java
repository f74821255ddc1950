package io.vellum.transaction;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.hash.Hashing;
import com.google.common.primitives.Bytes;
import com.google.common.primitives.Longs;
import io.vellum.crypto.PublicKey;
import io.vellum.crypto.Signature;

import java.util.Objects;

public final class TransactionKernel {
    private final KernelFeatures features;
    private final long fee;
    private final long lockHeight;
    private final PublicKey excess;
    private final Signature excessSignature;

    @JsonCreator
    public TransactionKernel(@JsonProperty("features") KernelFeatures features,
                             @JsonProperty("fee") long fee,
                             @JsonProperty("lockHeight") long lockHeight,
                             @JsonProperty("excess") PublicKey excess,
                             @JsonProperty("excessSignature") Signature excessSignature) {
        this.features = Objects.requireNonNull(features, "features must be defined");
        this.excess = Objects.requireNonNull(excess, "excess must be defined");
        this.excessSignature = Objects.requireNonNull(excessSignature, "excessSignature must be defined");
        if (fee < 0)
            throw new IllegalArgumentException("Fee must be >= 0.");
        if (lockHeight < 0)
            throw new IllegalArgumentException("Lock height must be >= 0.");
        this.fee = fee;
        this.lockHeight = lockHeight;
    }

    // Message every participant signs: features, fee and lock height.
    public static byte[] signatureMessage(KernelFeatures features, long fee, long lockHeight) {
        return Hashing.sha256().hashBytes(Bytes.concat(
                new byte[] { features.id() },
                Longs.toByteArray(fee),
                Longs.toByteArray(lockHeight))).asBytes();
    }

    public byte[] signatureMessage() {
        return signatureMessage(features, fee, lockHeight);
    }

    @JsonProperty("features")
    public KernelFeatures features() {
        return features;
    }

    @JsonProperty("fee")
    public long fee() {
        return fee;
    }

    @JsonProperty("lockHeight")
    public long lockHeight() {
        return lockHeight;
    }

    @JsonProperty("excess")
    public PublicKey excess() {
        return excess;
    }

    @JsonProperty("excessSignature")
    public Signature excessSignature() {
        return excessSignature;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TransactionKernel that = (TransactionKernel) o;
        return fee == that.fee &&
                lockHeight == that.lockHeight &&
                features == that.features &&
                excess.equals(that.excess) &&
                excessSignature.equals(that.excessSignature);
    }

    @Override
    public int hashCode() {
        return Objects.hash(features, fee, lockHeight, excess, excessSignature);
    }
}
