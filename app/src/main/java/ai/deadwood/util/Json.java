package ai.deadwood.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/** Shared Jackson mapper for configuration and package manifests. */
public final class Json {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private Json() {}

    public static JsonNode readTree(Path file) throws IOException {
        return MAPPER.readTree(Files.readString(file));
    }

    public static JsonNode readTree(String json) throws IOException {
        return MAPPER.readTree(json);
    }
}
