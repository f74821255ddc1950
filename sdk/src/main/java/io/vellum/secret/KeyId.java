package io.vellum.secret;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import io.vellum.utils.BytesUtils;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.Arrays;

/**
 * Derivation path of a key below the wallet master key: a depth (0..4) followed by four 32-bit indices.
 * Serialised as 17 bytes, depth first.
 */
@JsonSerialize(using = KeyId.Serializer.class)
@JsonDeserialize(using = KeyId.Deserializer.class)
public final class KeyId {
    public static final int MAX_DEPTH = 4;
    public static final int LENGTH = 1 + 4 * MAX_DEPTH;

    private final int[] path;

    public KeyId(int... path) {
        if (path.length > MAX_DEPTH)
            throw new IllegalArgumentException(String.format("Key path depth %d exceeds %d", path.length, MAX_DEPTH));
        this.path = Arrays.copyOf(path, path.length);
    }

    // Outputs live under m/0/0/<index>
    public static KeyId outputKey(int index) {
        if (index < 0)
            throw new IllegalArgumentException("Output key index must be >= 0.");
        return new KeyId(0, 0, index);
    }

    public static KeyId fromBytes(byte[] bytes) {
        if (bytes.length != LENGTH)
            throw new IllegalArgumentException(String.format("Incorrect key id length, %d expected, %d found", LENGTH, bytes.length));
        int depth = bytes[0];
        if (depth < 0 || depth > MAX_DEPTH)
            throw new IllegalArgumentException("Incorrect key id depth " + depth);
        int[] path = new int[depth];
        for (int i = 0; i < depth; i++)
            path[i] = BytesUtils.getInt(bytes, 1 + 4 * i);
        return new KeyId(path);
    }

    public int depth() {
        return path.length;
    }

    public int index(int level) {
        return path[level];
    }

    public byte[] bytes() {
        ByteBuffer buffer = ByteBuffer.allocate(LENGTH);
        buffer.put((byte) path.length);
        for (int index : path)
            buffer.putInt(index);
        return buffer.array();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Arrays.equals(path, ((KeyId) o).path);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(path);
    }

    @Override
    public String toString() {
        return BytesUtils.toHexString(bytes());
    }

    public static class Serializer extends JsonSerializer<KeyId> {
        @Override
        public void serialize(KeyId keyId, JsonGenerator jsonGenerator, SerializerProvider serializerProvider) throws IOException {
            jsonGenerator.writeString(keyId.toString());
        }
    }

    public static class Deserializer extends JsonDeserializer<KeyId> {
        @Override
        public KeyId deserialize(JsonParser jsonParser, DeserializationContext deserializationContext) throws IOException {
            try {
                return KeyId.fromBytes(BytesUtils.fromHexString(jsonParser.getText()));
            } catch (IllegalArgumentException e) {
                throw new IOException("invalid key id encoding", e);
            }
        }
    }
}
