package com.defold.prefab.metadata;

import com.defold.prefab.InvalidMetadataException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads metadata files. Unknown properties and fractional numbers in integer properties are rejected.
 */
public final class JsonMetadataReader {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .disable(DeserializationFeature.ACCEPT_FLOAT_AS_INT)
            .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES);

    private JsonMetadataReader() {
    }

    public static <T> T read(Path file, Class<T> type) throws InvalidMetadataException {
        if (!Files.isRegularFile(file)) {
            throw new InvalidMetadataException(file, "file does not exist");
        }
        try {
            return OBJECT_MAPPER.readerFor(type).readValue(file.toFile());
        } catch (IOException e) {
            throw new InvalidMetadataException(file, e);
        }
    }

    public static JsonNode readTree(Path file) throws InvalidMetadataException {
        if (!Files.isRegularFile(file)) {
            throw new InvalidMetadataException(file, "file does not exist");
        }
        try {
            JsonNode root = OBJECT_MAPPER.readTree(file.toFile());
            return root != null ? root : MissingNode.getInstance();
        } catch (IOException e) {
            throw new InvalidMetadataException(file, e);
        }
    }
}
