package com.surge.reo.io;

import com.surge.reo.api.Data;

/**
 * Payload literals accepted by {@code PUT}.
 *
 * A bare literal is hex octets ({@code 00-2A}, {@code --} for empty). A
 * typed literal has a prefix: {@code bytes/}, {@code int/}, {@code float/},
 * {@code bool/} or {@code string/}.
 */
public final class DataLiteral {

    private DataLiteral() {
    }

    /**
     * @throws IllegalArgumentException if the literal can't be decoded
     */
    public static byte[] parse(String literal) {
        int slash = literal.indexOf('/');
        if (slash < 0)
            return Hex.parse(literal);
        String type = literal.substring(0, slash);
        String value = literal.substring(slash + 1);
        return switch (type) {
            case "bytes" -> Hex.parse(value);
            case "string" -> Data.fromString(value);
            case "int" -> Data.fromLong(parseLong(value));
            case "float" -> Data.fromDouble(parseDouble(value));
            case "bool" -> switch (value.trim()) {
                case "true" -> Data.fromBool(true);
                case "false" -> Data.fromBool(false);
                default -> throw new IllegalArgumentException("Not a boolean: '" + value + "'");
            };
            default -> throw new IllegalArgumentException("Unknown data type '" + type + "'");
        };
    }

    private static long parseLong(String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Not an integer: '" + value + "'", e);
        }
    }

    private static double parseDouble(String value) {
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Not a float: '" + value + "'", e);
        }
    }
}
