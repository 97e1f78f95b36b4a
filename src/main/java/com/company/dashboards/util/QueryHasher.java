package com.company.dashboards.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Stable digest of a SQL statement. Whitespace runs collapse to one space and case is
 * folded before hashing, so cosmetic edits keep the hash while any token change alters it.
 */
public final class QueryHasher {

    public static final int HASH_LENGTH = 16;

    private QueryHasher() {
    }

    public static String hash(String sql) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] bytes = digest.digest(normalize(sql).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(bytes).substring(0, HASH_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public static String normalize(String sql) {
        if (sql == null) {
            return "";
        }
        return sql.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }
}
