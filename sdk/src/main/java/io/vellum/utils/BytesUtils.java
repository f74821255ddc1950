package io.vellum.utils;

import com.google.common.io.BaseEncoding;
import com.google.common.primitives.Ints;

import java.util.Arrays;

public final class BytesUtils {
    private BytesUtils() {}

    // Get Int value from byte array starting from an offset position without copying an array
    public static int getInt(byte[] bytes, int offset) {
        if(offset < 0 || bytes.length < offset + 4)
            throw new IllegalArgumentException("Value is out of array bounds");

        return Ints.fromBytes(  bytes[offset],
                                bytes[offset + 1],
                                bytes[offset + 2],
                                bytes[offset + 3]);
    }

    // Get byte array from hex string;
    public static byte[] fromHexString(String hex) {
        return BaseEncoding.base16().lowerCase().decode(hex.toLowerCase());
    }

    // Get hex string representation of byte array
    public static String toHexString(byte[] bytes) {
        return BaseEncoding.base16().lowerCase().encode(bytes);
    }

    // Overwrite secret material in place. Null arrays are ignored.
    public static void wipe(byte[] bytes) {
        if (bytes != null)
            Arrays.fill(bytes, (byte) 0);
    }
}
