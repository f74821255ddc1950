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

@JsonSerialize(using = PublicKey.Serializer.class)
@JsonDeserialize(using = PublicKey.Deserializer.class)
public class PublicKey extends FixedSizeByteArray {
    public static final int LENGTH = 33;

    public PublicKey(byte[] bytes) {
        super(LENGTH, bytes);
    }

    public PublicKey(String hex) {
        super(LENGTH, hex);
    }

    public static class Serializer extends JsonSerializer<PublicKey> {
        @Override
        public void serialize(
            PublicKey value, JsonGenerator jsonGenerator, SerializerProvider serializerProvider
        ) throws IOException {
            jsonGenerator.writeString(value.toString());
        }
    }

    public static class Deserializer extends JsonDeserializer<PublicKey> {
        @Override
        public PublicKey deserialize(
            JsonParser jsonParser, DeserializationContext deserializationContext
        ) throws IOException {
            try {
                return new PublicKey(jsonParser.getText());
            } catch (IllegalArgumentException e) {
                throw new IOException("invalid public key encoding", e);
            }
        }
    }
}
