package com.parcel.search.cache;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Locale;

public final class CacheKeys {
    private CacheKeys() {
    }

    /** Lowercased and trimmed form used for every cache key. */
    public static String normalize(String text) {
        if (text == null) {
            return "";
        }
        return text.trim().toLowerCase(Locale.ROOT);
    }

    public static String textKey(CacheNamespace namespace, String normalizedText) {
        return namespace.getPrefix() + sha256(normalizedText);
    }

    public static String resultKey(String normalizedText, int page, String canonicalPlanJson) {
        return CacheNamespace.RESULT.getPrefix() + sha256(normalizedText + "_" + page + "_" + canonicalPlanJson);
    }

    public static String sha256(String value) {
        if (value == null) {
            return null;
        }
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(value.getBytes(StandardCharsets.UTF_8));
            StringBuilder builder = new StringBuilder(hash.length * 2);
            for (byte b : hash) {
                builder.append(String.format("%02x", b));
            }
            return builder.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
