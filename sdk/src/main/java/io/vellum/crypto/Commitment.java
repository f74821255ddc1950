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
 * Pedersen commitment {@code r*G + v*H} in compressed SEC1 form.
 */
@JsonSerialize(using = Commitment.Serializer.class)
@JsonDeserialize(using = Commitment.Deserializer.class)
public class Commitment extends FixedSizeByteArray {
    public static final int LENGTH = 33;

    public Commitment(byte[] bytes) {
        super(LENGTH, bytes);
    }

    public Commitment(String hex) {
        super(LENGTH, hex);
    }

    public static class Serializer extends JsonSerializer<Commitment> {
        @Override
        public void serialize(
            Commitment value, JsonGenerator jsonGenerator, SerializerProvider serializerProvider
        ) throws IOException {
            jsonGenerator.writeString(value.toString());
        }
    }

    public static class Deserializer extends JsonDeserializer<Commitment> {
        @Override
        public Commitment deserialize(
            JsonParser jsonParser, DeserializationContext deserializationContext
        ) throws IOException {
            try {
                return new Commitment(jsonParser.getText());
            } catch (IllegalArgumentException e) {
                throw new IOException("invalid commitment encoding", e);
            }
        }
    }
}
