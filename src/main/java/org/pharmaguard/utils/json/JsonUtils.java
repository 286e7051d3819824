package org.pharmaguard.utils.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.pharmaguard.exceptions.UserException;
import org.pharmaguard.utils.Utils;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Shared Jackson configuration for PharmaGuard's JSON output and JSON Lines input.
 * <p>
 * Output is indented with map entries sorted by key, so the same result always serializes to the same bytes.
 * </p>
 */
public final class JsonUtils {

    private static final JsonMapper OUTPUT_MAPPER = JsonMapper.builder()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();

    private static final JsonMapper INPUT_MAPPER = JsonMapper.builder()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
            .build();

    private JsonUtils() {}

    public static JsonMapper outputMapper() {
        return OUTPUT_MAPPER;
    }

    public static String toJson(final Object value) {
        try {
            return OUTPUT_MAPPER.writeValueAsString(value);
        } catch (final JsonProcessingException e) {
            throw new IllegalStateException("could not serialize " + value.getClass().getSimpleName(), e);
        }
    }

    public static void writeJson(final File output, final Object value) {
        Utils.nonNull(output, "output");
        try (Writer writer = Files.newBufferedWriter(output.toPath(), StandardCharsets.UTF_8)) {
            OUTPUT_MAPPER.writeValue(writer, value);
        } catch (final IOException e) {
            throw new UserException.CouldNotCreateOutputFile(output, "could not write JSON", e);
        }
    }

    public static JsonNode readTree(final Path input) {
        Utils.nonNull(input, "input");
        try {
            return INPUT_MAPPER.readTree(input.toFile());
        } catch (final JsonProcessingException e) {
            throw new UserException.MalformedFile(input.toString(), "not valid JSON", e);
        } catch (final IOException e) {
            throw new UserException.CouldNotReadInputFile(input, e);
        }
    }

    /**
     * Reads a JSON Lines file, one object per non-blank line.
     */
    public static List<JsonNode> readJsonLines(final Path input) {
        Utils.nonNull(input, "input");
        final List<JsonNode> nodes = new ArrayList<>();
        try (BufferedReader reader = Files.newBufferedReader(input, StandardCharsets.UTF_8)) {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                try {
                    nodes.add(INPUT_MAPPER.readTree(line));
                } catch (final JsonProcessingException e) {
                    throw new UserException.MalformedFile(input.toString(), "line " + lineNumber + " is not valid JSON", e);
                }
            }
        } catch (final IOException e) {
            throw new UserException.CouldNotReadInputFile(input, e);
        }
        return nodes;
    }
}
