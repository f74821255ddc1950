package io.vellum.slate;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.vellum.crypto.PublicKey;
import io.vellum.crypto.Signature;

import java.util.Objects;
import java.util.Optional;

/**
 * Public contribution of one participant: blinding excess, nonce, and once signed, its kernel partial signature.
 * The message signature proves knowledge of the secret behind {@link #publicBlindExcess()}.
 */
public final class ParticipantData {
    private final int id;
    private final PublicKey publicBlindExcess;
    private final PublicKey publicNonce;
    private final Signature partialSignature;
    private final String message;
    private final Signature messageSignature;

    @JsonCreator
    public ParticipantData(@JsonProperty("id") int id,
                           @JsonProperty("publicBlindExcess") PublicKey publicBlindExcess,
                           @JsonProperty("publicNonce") PublicKey publicNonce,
                           @JsonProperty("partialSignature") Signature partialSignature,
                           @JsonProperty("message") String message,
                           @JsonProperty("messageSignature") Signature messageSignature) {
        this.id = id;
        this.publicBlindExcess = publicBlindExcess;
        this.publicNonce = publicNonce;
        this.partialSignature = partialSignature;
        this.message = message;
        this.messageSignature = messageSignature;
    }

    @JsonProperty("id")
    public int id() {
        return id;
    }

    @JsonProperty("publicBlindExcess")
    public PublicKey publicBlindExcess() {
        return publicBlindExcess;
    }

    @JsonProperty("publicNonce")
    public PublicKey publicNonce() {
        return publicNonce;
    }

    @JsonProperty("partialSignature")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public Signature partialSignatureOrNull() {
        return partialSignature;
    }

    public Optional<Signature> partialSignature() {
        return Optional.ofNullable(partialSignature);
    }

    @JsonProperty("message")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public String messageOrNull() {
        return message;
    }

    public Optional<String> message() {
        return Optional.ofNullable(message);
    }

    @JsonProperty("messageSignature")
    public Signature messageSignature() {
        return messageSignature;
    }

    public ParticipantData withPartialSignature(Signature signature) {
        return new ParticipantData(id, publicBlindExcess, publicNonce, signature, message, messageSignature);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ParticipantData that = (ParticipantData) o;
        return id == that.id &&
                Objects.equals(publicBlindExcess, that.publicBlindExcess) &&
                Objects.equals(publicNonce, that.publicNonce) &&
                Objects.equals(partialSignature, that.partialSignature) &&
                Objects.equals(message, that.message) &&
                Objects.equals(messageSignature, that.messageSignature);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, publicBlindExcess, publicNonce, partialSignature, message, messageSignature);
    }

    @Override
    public String toString() {
        return String.format("ParticipantData(id: %d, excess: %s, nonce: %s, signed: %b)",
                id, publicBlindExcess, publicNonce, partialSignature != null);
    }
}
