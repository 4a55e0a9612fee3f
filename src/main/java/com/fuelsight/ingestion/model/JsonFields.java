package com.fuelsight.ingestion.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Locale;

/**
 * Lenient readers for single fields of a vendor JSON object. Never throw; a value of
 * the wrong shape reads as {@code null}.
 */
public final class JsonFields {

    private JsonFields() {
    }

    /** Text of a scalar field (numbers and booleans as their literal), otherwise {@code null}. */
    public static String text(JsonNode record, String field) {
        JsonNode node = record.get(field);
        if (node == null || !node.isValueNode() || node.isNull()) {
            return null;
        }
        return node.asText();
    }

    /**
     * Boolean flag. Accepts JSON booleans, {@code 1}/{@code 0} and the strings
     * {@code "true"}/{@code "false"} in any case. Anything else is {@code null}.
     */
    public static Boolean flag(JsonNode record, String field) {
        JsonNode node = record.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isIntegralNumber() && (node.longValue() == 0 || node.longValue() == 1)) {
            return node.longValue() == 1;
        }
        if (node.isTextual()) {
            String text = node.textValue().trim().toLowerCase(Locale.ROOT);
            if (text.equals("true") || text.equals("false")) {
                return Boolean.valueOf(text);
            }
        }
        return null;
    }

    /** Integer field, truncating fractions. Non-numeric values are {@code null}. */
    public static Integer integer(JsonNode record, String field) {
        JsonNode node = record.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        double value;
        if (node.isNumber()) {
            value = node.doubleValue();
        } else if (node.isTextual()) {
            try {
                value = Double.parseDouble(node.textValue().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        } else {
            return null;
        }
        if (!Double.isFinite(value) || value > Integer.MAX_VALUE || value < Integer.MIN_VALUE) {
            return null;
        }
        return (int) value;
    }

    /**
     * Timestamp or epoch field: numbers as {@link Number}, strings as {@link String},
     * anything else {@code null}.
     */
    public static Object scalar(JsonNode record, String field) {
        JsonNode node = record.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return node.numberValue();
        }
        return node.isTextual() ? node.textValue() : null;
    }

    /** {@code true} when the field is present, not null, and {@link #flag} cannot read it. */
    public static boolean isMalformedFlag(JsonNode record, String field) {
        JsonNode node = record.get(field);
        return node != null && !node.isNull() && flag(record, field) == null;
    }
}
