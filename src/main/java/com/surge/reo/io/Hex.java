package com.surge.reo.io;

/**
 * Text form of byte payloads: two-digit hexadecimal octets separated by
 * hyphens, e.g. {@code 00-00-00-00-00-00-00-2A}. An empty payload is written
 * {@code --}.
 */
public final class Hex {
    private static final char[] DIGITS = "0123456789ABCDEF".toCharArray();

    private Hex() {
    }

    /**
     * Parses hyphen, space or tab separated octets.
     *
     * @throws IllegalArgumentException on an odd number of digits, a
     *                                  hyphen group that is not one octet or a
     *                                  non-hexadecimal character
     */
    public static byte[] parse(String text) {
        String t = text.trim();
        if (t.equals("--"))
            return new byte[0];
        if (t.indexOf('-') >= 0) {
            for (String group : t.split("-", -1)) {
                if (group.trim().length() != 2)
                    throw new IllegalArgumentException("Not an octet '" + group + "' in '" + text + "'");
            }
        }
        StringBuilder digits = new StringBuilder(t.length());
        for (int i = 0; i < t.length(); i++) {
            char c = t.charAt(i);
            if (c == '-' || c == ' ' || c == '\t')
                continue;
            if (Character.digit(c, 16) < 0)
                throw new IllegalArgumentException("Not a hex digit '" + c + "' in '" + text + "'");
            digits.append(c);
        }
        if (digits.length() == 0 || digits.length() % 2 != 0)
            throw new IllegalArgumentException("Can't parse '" + text + "' as hex octets");
        byte[] out = new byte[digits.length() / 2];
        for (int i = 0; i < out.length; i++) {
            int hi = Character.digit(digits.charAt(i * 2), 16);
            int lo = Character.digit(digits.charAt(i * 2 + 1), 16);
            out[i] = (byte) ((hi << 4) | lo);
        }
        return out;
    }

    public static String format(byte[] bytes) {
        if (bytes.length == 0)
            return "--";
        StringBuilder sb = new StringBuilder(bytes.length * 3 - 1);
        for (int i = 0; i < bytes.length; i++) {
            if (i > 0)
                sb.append('-');
            sb.append(DIGITS[(bytes[i] >> 4) & 0xF]).append(DIGITS[bytes[i] & 0xF]);
        }
        return sb.toString();
    }
}
