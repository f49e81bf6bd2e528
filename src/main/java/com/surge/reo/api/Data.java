package com.surge.reo.api;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

/**
 * Byte encodings of the primitive values native functions operate on.
 *
 * Integers are 8-byte big-endian two's complement, floats are 8-byte
 * big-endian IEEE-754, booleans a single byte 01 or 00, strings UTF-8.
 */
public final class Data {
    public static final int INT_BYTES = Long.BYTES;

    private Data() {
    }

    public static byte[] fromLong(long value) {
        return ByteBuffer.allocate(INT_BYTES).putLong(value).array();
    }

    public static boolean isLong(byte[] bytes) {
        return bytes != null && bytes.length == INT_BYTES;
    }

    /**
     * @throws IllegalArgumentException if the array is not exactly 8 bytes
     */
    public static long toLong(byte[] bytes) {
        if (!isLong(bytes))
            throw new IllegalArgumentException(
                    "Expected " + INT_BYTES + " bytes, got " + (bytes == null ? 0 : bytes.length));
        return ByteBuffer.wrap(bytes).getLong();
    }

    public static byte[] fromDouble(double value) {
        return ByteBuffer.allocate(Double.BYTES).putDouble(value).array();
    }

    public static double toDouble(byte[] bytes) {
        if (bytes == null || bytes.length != Double.BYTES)
            throw new IllegalArgumentException("Expected 8 bytes for a float");
        return ByteBuffer.wrap(bytes).getDouble();
    }

    public static byte[] fromBool(boolean value) {
        return new byte[] { (byte) (value ? 1 : 0) };
    }

    public static byte[] fromString(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }

    public static String toString(byte[] bytes) {
        return new String(bytes, StandardCharsets.UTF_8);
    }
}
