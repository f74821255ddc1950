package io.vellum.slate;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.vellum.serialization.ApplicationJsonSerializer;
import io.vellum.slate.exception.InvalidSlateException;

import java.util.Objects;

// JSON form of a slate as it travels between wallets.
public class SlateSerializer {
    private final ApplicationJsonSerializer serializer;

    public SlateSerializer() {
        this(ApplicationJsonSerializer.getInstance());
    }

    public SlateSerializer(ApplicationJsonSerializer serializer) {
        this.serializer = Objects.requireNonNull(serializer, "serializer must be defined");
    }

    public String toJson(Slate slate) {
        try {
            return serializer.serialize(slate);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Slate " + slate.id() + " can't be serialized", e);
        }
    }

    public Slate fromJson(String json) throws InvalidSlateException {
        if (json == null)
            throw new InvalidSlateException("Slate json is missing");
        try {
            return serializer.deserialize(json, Slate.class);
        } catch (JsonProcessingException e) {
            throw new InvalidSlateException("Slate json is malformed: " + e.getOriginalMessage(), e);
        }
    }
}
