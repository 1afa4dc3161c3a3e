package com.amblue.agent.sql;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decides whether a statement may reach the database.
 *
 * Comments, string literals and quoted identifiers are blanked out first, so
 * {@code SELECT 'drop me'} passes while a DELETE hidden behind a leading comment does not.
 * What is left must be one statement, start with SELECT or WITH, and contain
 * none of the data- or schema-modifying keywords as a whole word.
 *
 * Whether a backslash escapes a quote depends on the literal ({@code E'...'}) and on
 * server settings, so a statement is screened under both readings and must pass both.
 */
public final class ReadOnlySqlPolicy {

    private static final Set<String> FORBIDDEN_KEYWORDS = Set.of(
            "INSERT", "UPDATE", "DELETE", "DROP", "ALTER", "TRUNCATE", "CREATE",
            "GRANT", "REVOKE", "MERGE", "CALL", "EXEC", "EXECUTE", "COPY");

    private static final Set<String> ALLOWED_LEADING_KEYWORDS = Set.of("SELECT", "WITH");

    private static final Pattern WORD = Pattern.compile("[A-Za-z_][A-Za-z0-9_$]*");
    private static final Pattern DOLLAR_TAG = Pattern.compile("\\$[A-Za-z_]*\\$");

    private ReadOnlySqlPolicy() {
    }

    /**
     * @return the reason the statement is rejected, or empty when it is a plain read
     */
    public static Optional<String> findViolation(String sql) {
        if (sql == null) {
            return Optional.of("the statement is empty");
        }

        Optional<String> violation = check(blankOutCommentsAndLiterals(sql, false));
        return violation.isPresent() ? violation : check(blankOutCommentsAndLiterals(sql, true));
    }

    private static Optional<String> check(String blanked) {
        String stripped = blanked.trim();
        while (stripped.endsWith(";")) {
            stripped = stripped.substring(0, stripped.length() - 1).trim();
        }

        if (stripped.isEmpty()) {
            return Optional.of("the statement is empty");
        }
        if (stripped.contains(";")) {
            return Optional.of("only a single statement is allowed");
        }

        Matcher m = WORD.matcher(stripped);
        String leading = null;
        while (m.find()) {
            String word = m.group().toUpperCase(Locale.ROOT);
            if (leading == null) {
                leading = word;
            }
            if (FORBIDDEN_KEYWORDS.contains(word)) {
                return Optional.of("'" + word + "' would modify the database");
            }
        }

        if (!ALLOWED_LEADING_KEYWORDS.contains(leading)) {
            return Optional.of("only SELECT queries are allowed");
        }
        return Optional.empty();
    }

    static String blankOutCommentsAndLiterals(String sql) {
        return blankOutCommentsAndLiterals(sql, false);
    }

    /**
     * @param backslashEscapes whether a backslash escapes the next character in every
     *                         single-quoted literal; E-strings always use backslash escapes
     */
    static String blankOutCommentsAndLiterals(String sql, boolean backslashEscapes) {
        StringBuilder out = new StringBuilder(sql.length());
        int i = 0;
        int n = sql.length();

        while (i < n) {
            char c = sql.charAt(i);
            char next = i + 1 < n ? sql.charAt(i + 1) : '\0';

            if (c == '-' && next == '-') {
                int end = sql.indexOf('\n', i);
                i = end < 0 ? n : end;
                out.append(' ');
            } else if (c == '/' && next == '*') {
                int end = sql.indexOf("*/", i + 2);
                i = end < 0 ? n : end + 2;
                out.append(' ');
            } else if (c == '\'' || c == '"' || c == '`') {
                boolean escapes = c == '\'' && (backslashEscapes || isEscapeStringPrefix(sql, i));
                i = skipQuoted(sql, i, c, escapes);
                out.append(' ');
            } else if (c == '$') {
                Matcher tag = DOLLAR_TAG.matcher(sql).region(i, n);
                if (tag.lookingAt()) {
                    int end = sql.indexOf(tag.group(), tag.end());
                    i = end < 0 ? n : end + tag.group().length();
                    out.append(' ');
                } else {
                    out.append(c);
                    i++;
                }
            } else {
                out.append(c);
                i++;
            }
        }
        return out.toString();
    }

    /** True when the quote at {@code quoteIndex} opens an E'...' literal. */
    private static boolean isEscapeStringPrefix(String sql, int quoteIndex) {
        if (quoteIndex == 0) return false;
        char prefix = sql.charAt(quoteIndex - 1);
        if (prefix != 'E' && prefix != 'e') return false;
        return quoteIndex == 1 || !isIdentifierChar(sql.charAt(quoteIndex - 2));
    }

    private static boolean isIdentifierChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '$';
    }

    /** Returns the index just past the closing quote; doubled quotes are escapes. */
    private static int skipQuoted(String sql, int start, char quote, boolean backslashEscapes) {
        int i = start + 1;
        while (i < sql.length()) {
            char c = sql.charAt(i);
            if (backslashEscapes && c == '\\') {
                i += 2;
                continue;
            }
            if (c == quote) {
                if (i + 1 < sql.length() && sql.charAt(i + 1) == quote) {
                    i += 2;
                    continue;
                }
                return i + 1;
            }
            i++;
        }
        return sql.length();
    }
}
