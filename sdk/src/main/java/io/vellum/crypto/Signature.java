package io.vellum.crypto;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import java.io.IOException;

/**
 * Schnorr signature: compressed nonce point {@code R} (33 bytes) followed by the scalar {@code s} (32 bytes).
 * Partial signatures use the same layout with the aggregate nonce in the first part.
 */
@JsonSerialize(using = Signature.Serializer.class)
@JsonDeserialize(using = Signature.Deserializer.class)
public class Signature extends FixedSizeByteArray {
    public static final int LENGTH = 65;

    public Signature(byte[] bytes) {
        super(LENGTH, bytes);
    }

    public Signature(String hex) {
        super(LENGTH, hex);
    }

    public static class Serializer extends JsonSerializer<Signature> {
        @Override
        public void serialize(
            Signature value, JsonGenerator jsonGenerator, SerializerProvider serializerProvider
        ) throws IOException {
            jsonGenerator.writeString(value.toString());
        }
    }

    public static class Deserializer extends JsonDeserializer<Signature> {
        @Override
        public Signature deserialize(
            JsonParser jsonParser, DeserializationContext deserializationContext
        ) throws IOException {
            try {
                return new Signature(jsonParser.getText());
            } catch (IllegalArgumentException e) {
                throw new IOException("invalid signature encoding", e);
            }
        }
    }
}
