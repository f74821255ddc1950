package io.vellum.secret;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Arrays;
import java.util.Objects;

/**
 * Passphrase-protected form of a {@link WalletSeed}: AES-256-GCM ciphertext plus the scrypt parameters needed to
 * re-derive the key. The only representation of the seed allowed to reach storage.
 */
public final class EncryptedSeed {
    public static final int CURRENT_VERSION = 1;

    private final int version;
    private final byte[] salt;
    private final byte[] nonce;
    private final byte[] encryptedSeedBytes;
    private final int scryptN;
    private final int scryptR;
    private final int scryptP;

    @JsonCreator
    public EncryptedSeed(@JsonProperty("version") int version,
                         @JsonProperty("salt") byte[] salt,
                         @JsonProperty("nonce") byte[] nonce,
                         @JsonProperty("encryptedSeed") byte[] encryptedSeedBytes,
                         @JsonProperty("scryptN") int scryptN,
                         @JsonProperty("scryptR") int scryptR,
                         @JsonProperty("scryptP") int scryptP) {
        Objects.requireNonNull(salt, "salt must be defined");
        Objects.requireNonNull(nonce, "nonce must be defined");
        Objects.requireNonNull(encryptedSeedBytes, "encrypted seed must be defined");

        this.version = version;
        this.salt = Arrays.copyOf(salt, salt.length);
        this.nonce = Arrays.copyOf(nonce, nonce.length);
        this.encryptedSeedBytes = Arrays.copyOf(encryptedSeedBytes, encryptedSeedBytes.length);
        this.scryptN = scryptN;
        this.scryptR = scryptR;
        this.scryptP = scryptP;
    }

    @JsonProperty("version")
    public int version() {
        return version;
    }

    @JsonProperty("salt")
    public byte[] salt() {
        return Arrays.copyOf(salt, salt.length);
    }

    @JsonProperty("nonce")
    public byte[] nonce() {
        return Arrays.copyOf(nonce, nonce.length);
    }

    @JsonProperty("encryptedSeed")
    public byte[] encryptedSeedBytes() {
        return Arrays.copyOf(encryptedSeedBytes, encryptedSeedBytes.length);
    }

    @JsonProperty("scryptN")
    public int scryptN() {
        return scryptN;
    }

    @JsonProperty("scryptR")
    public int scryptR() {
        return scryptR;
    }

    @JsonProperty("scryptP")
    public int scryptP() {
        return scryptP;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        EncryptedSeed that = (EncryptedSeed) o;
        return version == that.version &&
                scryptN == that.scryptN &&
                scryptR == that.scryptR &&
                scryptP == that.scryptP &&
                Arrays.equals(salt, that.salt) &&
                Arrays.equals(nonce, that.nonce) &&
                Arrays.equals(encryptedSeedBytes, that.encryptedSeedBytes);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(version, scryptN, scryptR, scryptP);
        result = 31 * result + Arrays.hashCode(salt);
        result = 31 * result + Arrays.hashCode(nonce);
        result = 31 * result + Arrays.hashCode(encryptedSeedBytes);
        return result;
    }
}
