package io.vellum.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import io.vellum.utils.BytesUtils;

import java.io.IOException;

public class BytesDeserializer extends JsonDeserializer<byte[]> {

    @Override
    public byte[] deserialize(JsonParser jsonParser, DeserializationContext deserializationContext) throws IOException {
        String text = jsonParser.getText();
        try {
            return BytesUtils.fromHexString(text);
        } catch (IllegalArgumentException e) {
            throw new IOException("byte array must be hex encoded", e);
        }
    }
}
