package io.vellum.secret;

import java.util.Arrays;

/**
 * Secret scalar hiding an amount inside a commitment. Wiped by {@link #close()}.
 */
public final class BlindingFactor implements AutoCloseable
{
    private final byte[] blindBytes;

    public BlindingFactor(byte[] blindBytes)
    {
        this.blindBytes = Arrays.copyOf(blindBytes, blindBytes.length);
    }

    public byte[] bytes() {
        return Arrays.copyOf(blindBytes, blindBytes.length);
    }

    @Override
    public void close() {
        Arrays.fill(blindBytes, (byte) 0);
    }

    @Override
    public String toString() {
        return "BlindingFactor{***}";
    }
}
