package com.instagrab.common.util;

import java.math.BigInteger;

/**
 * Converts between post shortcodes and numeric media ids.
 * Shortcodes are base-64 numbers written with the provider's URL-safe alphabet.
 */
public final class Shortcodes {
    private static final String ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789-_";
    private static final BigInteger BASE = BigInteger.valueOf(ALPHABET.length());

    private Shortcodes() {
    }

    public static String toMediaId(String shortcode) {
        if (shortcode == null || shortcode.isEmpty()) {
            throw new IllegalArgumentException("Shortcode must not be empty");
        }
        BigInteger id = BigInteger.ZERO;
        for (char c : shortcode.toCharArray()) {
            int index = ALPHABET.indexOf(c);
            if (index < 0) {
                throw new IllegalArgumentException("Invalid shortcode character: " + c);
            }
            id = id.multiply(BASE).add(BigInteger.valueOf(index));
        }
        return id.toString();
    }

    public static String fromMediaId(String mediaId) {
        if (mediaId == null || mediaId.isEmpty()) {
            throw new IllegalArgumentException("Media id must not be empty");
        }
        // Story/feed ids come as "{mediaPk}_{ownerPk}"
        int underscore = mediaId.indexOf('_');
        String pk = underscore > 0 ? mediaId.substring(0, underscore) : mediaId;

        BigInteger num = new BigInteger(pk);
        if (num.signum() == 0) {
            return String.valueOf(ALPHABET.charAt(0));
        }
        StringBuilder sb = new StringBuilder();
        while (num.signum() > 0) {
            BigInteger[] qr = num.divideAndRemainder(BASE);
            sb.append(ALPHABET.charAt(qr[1].intValue()));
            num = qr[0];
        }
        return sb.reverse().toString();
    }

    /** Null-safe variant for metadata building: returns null for blank or non-numeric ids. */
    public static String fromMediaIdOrNull(String mediaId) {
        if (mediaId == null || mediaId.isBlank()) return null;
        try {
            return fromMediaId(mediaId);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
