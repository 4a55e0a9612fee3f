package com.fuelsight.ingestion.service;

/**
 * Lenient numeric parsing for vendor fields. Never throws; anything that is not a
 * finite number becomes {@code null}.
 */
public final class SafeNumbers {

    private SafeNumbers() {
    }

    public static Double parseDouble(Object value) {
        if (value == null) {
            return null;
        }
        double parsed;
        if (value instanceof Number) {
            parsed = ((Number) value).doubleValue();
        } else {
            String text = value.toString().trim();
            if (text.isEmpty()) {
                return null;
            }
            try {
                parsed = Double.parseDouble(text);
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return Double.isFinite(parsed) ? parsed : null;
    }

    /**
     * Parses an integer, truncating any fractional part toward zero.
     */
    public static Integer parseInteger(Object value) {
        Double parsed = parseDouble(value);
        if (parsed == null || parsed > Integer.MAX_VALUE || parsed < Integer.MIN_VALUE) {
            return null;
        }
        return parsed.intValue();
    }
}
