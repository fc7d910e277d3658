/*
 * Copyright pgspatial Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgspatial.util;

/**
 * Maps between byte arrays and their hex representation, as used by PostgreSQL for geometry and bytea values.
 *
 * @author pgspatial Authors
 */
public class HexConverter {

    private static final char[] HEX_CHARS = new char[]{ '0', '1', '2', '3', '4', '5', '6', '7', '8', '9', 'a', 'b', 'c', 'd', 'e', 'f' };

    // PostgreSQL bytea hex output marker
    private static final String BYTEA_HEX_PREFIX = "\\x";

    /**
     * Take the supplied byte array and convert it to a lower case hex encoded String.
     *
     * @param toBeConverted the bytes to be converted, must not be {@code null}
     * @return the hex encoded String
     */
    public static String convertToHexString(byte[] toBeConverted) {
        if (toBeConverted == null) {
            throw new NullPointerException("Parameter to be converted can not be null");
        }

        char[] converted = new char[toBeConverted.length * 2];
        for (int i = 0; i < toBeConverted.length; i++) {
            byte b = toBeConverted[i];
            converted[i * 2] = HEX_CHARS[b >> 4 & 0x0F];
            converted[i * 2 + 1] = HEX_CHARS[b & 0x0F];
        }

        return String.valueOf(converted);
    }

    /**
     * Take the incoming String of hex encoded data and convert to the raw byte values. Upper and lower case
     * digits are accepted, as is a leading {@code \x} bytea marker.
     *
     * @param toConvert the hex encoded String to convert
     * @return the raw byte array
     * @throws IllegalArgumentException if the String has an odd length or contains a non-hex character
     */
    public static byte[] convertFromHex(String toConvert) {
        final String hex = toConvert.startsWith(BYTEA_HEX_PREFIX) ? toConvert.substring(BYTEA_HEX_PREFIX.length()) : toConvert;
        if (hex.length() % 2 != 0) {
            throw new IllegalArgumentException("The supplied hex string must contain an even number of hex chars.");
        }

        byte[] response = new byte[hex.length() / 2];
        for (int i = 0; i < response.length; i++) {
            int posOne = i * 2;
            response[i] = (byte) (toDigit(hex, posOne) << 4 | toDigit(hex, posOne + 1));
        }

        return response;
    }

    private static int toDigit(String hex, int pos) {
        int response = Character.digit(hex.charAt(pos), 16);
        if (response < 0) {
            throw new IllegalArgumentException("Non-hex character '" + hex.charAt(pos) + "' at index=" + pos);
        }

        return response;
    }

    private HexConverter() {
    }
}
