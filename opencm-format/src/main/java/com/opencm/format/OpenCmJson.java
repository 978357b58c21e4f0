package com.opencm.format;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Shared Jackson mapper for reading and writing OpenCM documents as JSON trees.
 */
public final class OpenCmJson {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private OpenCmJson() {
    }

    /**
     * Parses JSON text into a tree.
     *
     * @param json   document text
     * @param source where the text came from, for the error message (e.g. a file path)
     * @throws OpenCmFormatException when the text is not valid JSON
     */
    public static JsonNode readTree(String json, String source) {
        try {
            JsonNode node = MAPPER.readTree(json);
            if (node == null || node.isMissingNode()) {
                throw new OpenCmFormatException("Empty OpenCM document: " + source);
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new OpenCmFormatException("Malformed JSON in " + source + ": " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Parses JSON bytes into a tree, detecting the encoding the way Jackson does (UTF-8 unless a BOM
     * or the leading bytes say otherwise). Undecodable bytes are malformed input, not an I/O failure.
     *
     * @throws OpenCmFormatException when the bytes are not valid JSON text
     */
    public static JsonNode readTree(byte[] json, String source) {
        try {
            JsonNode node = MAPPER.readTree(json);
            if (node == null || node.isMissingNode()) {
                throw new OpenCmFormatException("Empty OpenCM document: " + source);
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new OpenCmFormatException("Malformed JSON in " + source + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new OpenCmFormatException("Undecodable JSON text in " + source + ": " + e.getMessage(), e);
        }
    }

    public static ObjectNode newObject() {
        return JsonNodeFactory.instance.objectNode();
    }

    /**
     * Renders a tree as JSON text.
     *
     * @param pretty indented output when true
     */
    public static String write(JsonNode node, boolean pretty) {
        try {
            return pretty
                    ? MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(node)
                    : MAPPER.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(new IOException(e));
        }
    }
}
