package com.zzf.cryptoagent.core.util;

import com.fasterxml.jackson.databind.JsonNode;

public final class JsonUtils {

    private JsonUtils() {}

    /**
     * Reads a number that may arrive as a JSON number or a numeric string. Missing or null yields
     * {@code null}; anything else unparseable is rejected.
     */
    public static Double numberOrNull(JsonNode args, String key) {
        if (args == null) {
            return null;
        }
        JsonNode node = args.path(key);
        if (node.isMissingNode() || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return node.asDouble();
        }
        if (node.isTextual()) {
            String text = node.asText().trim();
            try {
                return Double.parseDouble(text);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(key + " must be a number");
            }
        }
        throw new IllegalArgumentException(key + " must be a number");
    }

    public static int intOrDefault(JsonNode args, String key, int fallback) {
        Double value = numberOrNull(args, key);
        if (value == null) {
            return fallback;
        }
        if (value != Math.rint(value)) {
            throw new IllegalArgumentException(key + " must be an integer");
        }
        return (int) Math.max(Integer.MIN_VALUE, Math.min(Integer.MAX_VALUE, value));
    }

    /**
     * Reads a string argument. Missing or null yields {@code null}; numbers, booleans and
     * containers are rejected rather than coerced.
     */
    public static String stringOrNull(JsonNode args, String key) {
        if (args == null) {
            return null;
        }
        JsonNode node = args.path(key);
        if (node.isMissingNode() || node.isNull()) {
            return null;
        }
        if (!node.isTextual()) {
            throw new IllegalArgumentException(key + " must be a string");
        }
        return node.asText();
    }
}
