package io.vellum.secret;

import java.security.MessageDigest;
import java.security.SecureRandom;
import java.util.Arrays;

/**
 * Master entropy of a wallet. Only ever held in memory; call {@link #close()} as soon as the owner is done with it.
 */
public final class WalletSeed implements AutoCloseable
{
    public static final int SEED_LENGTH = 32;

    private final byte[] seedBytes;
    private volatile boolean wiped = false;

    public WalletSeed(byte[] seedBytes)
    {
        if(seedBytes == null || seedBytes.length != SEED_LENGTH)
            throw new IllegalArgumentException(String.format("Incorrect seed length, %d expected", SEED_LENGTH));

        this.seedBytes = Arrays.copyOf(seedBytes, SEED_LENGTH);
    }

    public static WalletSeed generate(SecureRandom random) {
        byte[] entropy = new byte[SEED_LENGTH];
        random.nextBytes(entropy);
        try {
            return new WalletSeed(entropy);
        } finally {
            Arrays.fill(entropy, (byte) 0);
        }
    }

    public byte[] bytes() {
        if (wiped)
            throw new IllegalStateException("Wallet seed was already wiped");
        return Arrays.copyOf(seedBytes, SEED_LENGTH);
    }

    public WalletSeed copy() {
        return new WalletSeed(bytes());
    }

    public boolean isWiped() {
        return wiped;
    }

    @Override
    public void close() {
        Arrays.fill(seedBytes, (byte) 0);
        wiped = true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WalletSeed that = (WalletSeed) o;
        return MessageDigest.isEqual(seedBytes, that.seedBytes);
    }

    @Override
    public int hashCode() {
        // content based hash would leak seed bits
        return SEED_LENGTH;
    }

    @Override
    public String toString() {
        return "WalletSeed{***}";
    }
}
