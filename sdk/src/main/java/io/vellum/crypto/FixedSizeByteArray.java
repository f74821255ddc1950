package io.vellum.crypto;

import io.vellum.utils.BytesUtils;

import java.util.Arrays;

public class FixedSizeByteArray {
    private final int length;
    private final byte[] bytes;

    protected FixedSizeByteArray(int length, byte[] bytes) {
        if (bytes == null) {
            throw new IllegalArgumentException("bytes must be defined");
        }
        if (bytes.length != length) {
            throw new IllegalArgumentException(
                String.format("invalid length: want %d bytes got %d", length, bytes.length));
        }
        this.length = length;
        // create a copy to make sure there is no outside reference to these bytes
        this.bytes = Arrays.copyOf(bytes, length);
    }

    protected FixedSizeByteArray(int length, String hex) {
        this(length, BytesUtils.fromHexString(hex));
    }

    @Override
    public String toString() {
        return BytesUtils.toHexString(bytes);
    }

    public byte[] toBytes() {
        return Arrays.copyOf(bytes, length);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == null) return false;
        if (obj.getClass() != getClass()) return false;
        if (obj == this) return true;
        var other = (FixedSizeByteArray) obj;
        return Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }
}
