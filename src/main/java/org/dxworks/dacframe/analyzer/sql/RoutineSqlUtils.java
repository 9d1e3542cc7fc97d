package org.dxworks.dacframe.analyzer.sql;

public final class RoutineSqlUtils {

    private RoutineSqlUtils() {
        // utility class
    }

    public static String stripQuotes(String id) {
        if (id == null) {
            return null;
        }
        String trimmed = id.trim();
        if (trimmed.length() >= 2) {
            char first = trimmed.charAt(0);
            char last = trimmed.charAt(trimmed.length() - 1);
            if (first == '[' && last == ']') {
                return trimmed.substring(1, trimmed.length() - 1).replace("]]", "]");
            }
            if (first == '"' && last == '"') {
                return trimmed.substring(1, trimmed.length() - 1).replace("\"\"", "\"");
            }
        }
        return trimmed;
    }

    /**
     * Splits {@code schema.name} (either part optionally bracketed) at the last dot outside
     * brackets. Returns {@code {null, name}} when there is no schema.
     */
    public static String[] splitSchemaAndName(String combined) {
        if (combined == null) {
            return new String[]{null, null};
        }
        String value = combined.trim();
        int dot = lastDotOutsideBrackets(value);
        if (dot >= 0) {
            return new String[]{stripQuotes(value.substring(0, dot)), stripQuotes(value.substring(dot + 1))};
        }
        return new String[]{null, stripQuotes(value)};
    }

    private static int lastDotOutsideBrackets(String value) {
        boolean inBracket = false;
        boolean inQuote = false;
        int last = -1;
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '[' && !inQuote) inBracket = true;
            else if (c == ']' && !inQuote) inBracket = false;
            else if (c == '"' && !inBracket) inQuote = !inQuote;
            else if (c == '.' && !inBracket && !inQuote) last = i;
        }
        return last;
    }

    /**
     * Normalizes SQL type formatting by removing extra spaces around parentheses and commas.
     * E.g., "DECIMAL ( 12 , 2 )" becomes "DECIMAL(12,2)"
     */
    public static String normalizeTypeFormat(String type) {
        if (type == null) return null;
        String s = type.trim();
        if (s.isEmpty()) return null;
        s = s.replaceAll("\\s+\\(", "(");
        s = s.replaceAll("\\(\\s+", "(");
        s = s.replaceAll("\\s+\\)", ")");
        s = s.replaceAll("\\s+,", ",");
        s = s.replaceAll(",\\s+", ",");
        return s;
    }
}
