package io.vellum.serialization;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.module.SimpleModule;

public class ApplicationJsonSerializer {

    private final ObjectMapper objectMapper;
    private static ApplicationJsonSerializer instance;

    private ApplicationJsonSerializer() {
        objectMapper = new ObjectMapper();
    }

    public static synchronized ApplicationJsonSerializer getInstance() {
        if (instance == null) {
            instance = new ApplicationJsonSerializer();
            instance.setDefaultConfiguration();
        }

        return instance;
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    public void setDefaultConfiguration() {
        // slates are untrusted input: unknown fields are rejected
        objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);
        objectMapper.configure(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES, true);
        objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        objectMapper.setSerializationInclusion(JsonInclude.Include.NON_ABSENT);
        SimpleModule module = new SimpleModule();
        module.addSerializer(byte[].class, new BytesSerializer());
        module.addDeserializer(byte[].class, new BytesDeserializer());
        objectMapper.registerModule(module);
    }

    public String serialize(Object value) throws JsonProcessingException {
        return objectMapper.writeValueAsString(value);
    }

    public <T> T deserialize(String json, Class<T> type) throws JsonProcessingException {
        return objectMapper.readValue(json, type);
    }
}
