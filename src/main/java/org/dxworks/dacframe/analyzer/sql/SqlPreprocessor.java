package org.dxworks.dacframe.analyzer.sql;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Splits T-SQL scripts into the batches a {@code GO} line separates, the unit both
 * JSqlParser and the header extractors work on.
 */
public final class SqlPreprocessor {

    private static final String NL = System.lineSeparator();
    private static final Pattern GO_LINE = Pattern.compile("GO(\\s+\\d+)?\\s*;?");

    private SqlPreprocessor() {}

    public static List<String> splitBatches(String sql) {
        List<String> batches = new ArrayList<>();
        if (sql == null) return batches;

        String[] lines = sql.split("\r?\n", -1);
        StringBuilder sb = new StringBuilder(sql.length());

        for (String line : lines) {
            String upper = line.trim().toUpperCase(Locale.ROOT);

            // T-SQL batch separator, optionally with a repeat count
            if (GO_LINE.matcher(upper).matches()) {
                addBatch(batches, sb);
                continue;
            }
            sb.append(line).append(NL);
        }
        addBatch(batches, sb);

        return batches;
    }

    private static void addBatch(List<String> batches, StringBuilder sb) {
        String batch = sb.toString();
        if (!batch.isBlank()) {
            batches.add(batch.strip());
        }
        sb.setLength(0);
    }
}
