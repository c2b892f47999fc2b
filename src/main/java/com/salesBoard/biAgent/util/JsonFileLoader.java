package com.salesBoard.biAgent.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * Utility class for reading JSON from the classpath.
 * Board exports are loaded as a {@link JsonNode} tree; embedded JSON strings found inside
 * column values can be parsed with the same mapper.
 */
public class JsonFileLoader {
    
    private static final ObjectMapper objectMapper = new ObjectMapper();

    private JsonFileLoader() {
    }
    
    /**
     * Loads a classpath resource as a UTF-8 String.
     * 
     * @param resourcePath The path to the resource (e.g., "boards/deals.json")
     * @return The content as a String
     * @throws IOException if the resource cannot be read or doesn't exist
     */
    public static String loadAsString(String resourcePath) throws IOException {
        try (InputStream inputStream = JsonFileLoader.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (inputStream == null) {
                throw new IOException("Resource not found: " + resourcePath);
            }
            return new String(inputStream.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
    
    /**
     * Loads a JSON resource from the classpath as a JsonNode.
     * 
     * @param resourcePath The path to the JSON resource
     * @return The JSON content as a JsonNode
     * @throws IOException if the resource cannot be read, doesn't exist, or is not valid JSON
     */
    public static JsonNode loadAsJsonNode(String resourcePath) throws IOException {
        return parse(loadAsString(resourcePath));
    }

    /**
     * Parses a JSON document held in a String.
     *
     * @throws IOException if the text is not valid JSON
     */
    public static JsonNode parse(String json) throws IOException {
        return objectMapper.readTree(json);
    }
}
