package com.example.sqlgate.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Canonical text and fingerprint of a statement. Comments are dropped, whitespace runs
 * collapse to one space, trailing semicolons go, and everything outside quotes is lower-cased.
 * Quoted literals and quoted identifiers are kept verbatim.
 */
public final class StatementNormalizer {

    private StatementNormalizer() {
    }

    public static String fingerprint(String sql) {
        String normalized = normalize(sql);
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(normalized.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    public static String normalize(String sql) {
        if (sql == null) {
            return "";
        }
        StringBuilder normalized = new StringBuilder();
        boolean inSingleQuote = false;
        boolean inDoubleQuote = false;
        boolean inLineComment = false;
        boolean inBlockComment = false;
        boolean pendingSpace = false;

        for (int i = 0; i < sql.length(); i++) {
            char c = sql.charAt(i);
            char next = i + 1 < sql.length() ? sql.charAt(i + 1) : '\0';

            if (inLineComment) {
                if (c == '\n') {
                    inLineComment = false;
                    pendingSpace = true;
                }
                continue;
            }

            if (inBlockComment) {
                if (c == '*' && next == '/') {
                    i++;
                    inBlockComment = false;
                    pendingSpace = true;
                }
                continue;
            }

            if (inSingleQuote) {
                normalized.append(c);
                if (c == '\'' && next == '\'') {
                    normalized.append(next);
                    i++;
                } else if (c == '\'') {
                    inSingleQuote = false;
                }
                continue;
            }

            if (inDoubleQuote) {
                normalized.append(c);
                if (c == '"' && next == '"') {
                    normalized.append(next);
                    i++;
                } else if (c == '"') {
                    inDoubleQuote = false;
                }
                continue;
            }

            if (c == '-' && next == '-') {
                i++;
                inLineComment = true;
                continue;
            }
            if (c == '/' && next == '*') {
                i++;
                inBlockComment = true;
                continue;
            }

            if (Character.isWhitespace(c)) {
                pendingSpace = true;
                continue;
            }

            if (pendingSpace && normalized.length() > 0) {
                normalized.append(' ');
            }
            pendingSpace = false;

            if (c == '\'') {
                normalized.append(c);
                inSingleQuote = true;
                continue;
            }
            if (c == '"') {
                normalized.append(c);
                inDoubleQuote = true;
                continue;
            }

            normalized.append(Character.toLowerCase(c));
        }

        return stripTrailingSemicolons(normalized.toString());
    }

    /**
     * Removes trailing semicolons and whitespace without touching the statement body.
     */
    public static String stripTrailingSemicolons(String sql) {
        int end = sql.length();
        while (end > 0) {
            char ch = sql.charAt(end - 1);
            if (ch == ';' || Character.isWhitespace(ch)) {
                end--;
            } else {
                break;
            }
        }
        return sql.substring(0, end).strip();
    }

    public static String normalizeIdentifier(String identifier) {
        if (identifier == null) {
            return null;
        }
        StringBuilder builder = new StringBuilder(identifier.length());
        for (int i = 0; i < identifier.length(); i++) {
            char ch = identifier.charAt(i);
            if (ch != '"' && ch != '`' && ch != '[' && ch != ']') {
                builder.append(ch);
            }
        }
        return builder.toString().trim().toLowerCase(Locale.ROOT);
    }
}
