package com.drautomation.api.util;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Checks that validation SQL is a single read-only SELECT.
 * String literals and comments are ignored while looking for write keywords.
 */
public final class ReadOnlyQueries {

    private static final Pattern STRING_LITERAL = Pattern.compile("'(?:[^']|'')*'");
    private static final Pattern COMMENT = Pattern.compile("--[^\\n]*|/\\*.*?\\*/", Pattern.DOTALL);
    private static final Pattern LEADING_KEYWORD = Pattern.compile("^\\s*\\(*\\s*(SELECT|WITH)\\b",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern WRITE_KEYWORD = Pattern.compile(
            "\\b(INSERT|UPDATE|DELETE|MERGE|UPSERT|DROP|ALTER|CREATE|TRUNCATE|GRANT|REVOKE|CALL|EXEC|EXECUTE"
                    + "|COPY|LOCK|SET|INTO|COMMENT|VACUUM|REINDEX|REFRESH|NEXTVAL|SETVAL|RUNSCRIPT|SCRIPT)\\b",
            Pattern.CASE_INSENSITIVE);

    private ReadOnlyQueries() {
    }

    public static boolean isReadOnlySelect(String sql) {
        return rejectionReason(sql) == null;
    }

    /**
     * @throws IllegalArgumentException when {@code sql} is not a single read-only SELECT
     */
    public static void requireReadOnlySelect(String sql) {
        String reason = rejectionReason(sql);
        if (reason != null) {
            throw new IllegalArgumentException("Only single SELECT statements are allowed (" + reason + "): " + sql);
        }
    }

    private static String rejectionReason(String sql) {
        if (sql == null || sql.isBlank()) {
            return "empty query";
        }
        String stripped = COMMENT.matcher(STRING_LITERAL.matcher(sql).replaceAll("''")).replaceAll(" ").trim();
        if (stripped.endsWith(";")) {
            stripped = stripped.substring(0, stripped.length() - 1);
        }
        if (stripped.contains(";")) {
            return "multiple statements";
        }
        Matcher writes = WRITE_KEYWORD.matcher(stripped);
        if (writes.find()) {
            return writes.group(1).toUpperCase(Locale.ROOT) + " is not allowed";
        }
        if (!LEADING_KEYWORD.matcher(stripped).find()) {
            return "not a SELECT";
        }
        return null;
    }
}
