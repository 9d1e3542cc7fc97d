package org.dxworks.dacframe.analyzer.sql;

import org.dxworks.dacframe.model.sql.ObjectKind;
import org.dxworks.dacframe.model.sql.RoutineDefinition;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Regex-based extraction of T-SQL triggers.
 * JSqlParser doesn't support CREATE TRIGGER, so the header is matched directly and
 * everything after its AS is kept as the body.
 */
final class TriggerRegexExtractor {

    private static final String NAME_PART = "(?:\\[(?:[^\\]]|\\]\\])*\\]|\"(?:[^\"]|\"\")*\"|[\\w@#$]+)";
    private static final String SQL_IDENTIFIER = NAME_PART + "(?:\\s*\\.\\s*" + NAME_PART + ")*";

    // CREATE [OR ALTER] TRIGGER name ON {table | DATABASE | ALL SERVER} [WITH ...]
    //   {FOR | AFTER | INSTEAD OF} events [NOT FOR REPLICATION] AS
    private static final Pattern TSQL_TRIGGER_PATTERN = Pattern.compile(
        "\\b(?:CREATE(?:\\s+OR\\s+ALTER)?|ALTER)\\s+TRIGGER\\s+(" + SQL_IDENTIFIER + ")\\s+" +
        "ON\\s+(ALL\\s+SERVER|DATABASE|" + SQL_IDENTIFIER + ")\\s+" +
        "(?:WITH\\s+[\\w\\s,'\\[\\]]+?\\s+)?" +
        "(FOR|AFTER|INSTEAD\\s+OF)\\s+" +
        "([\\w\\s,]+?)\\s+" +
        "(?:NOT\\s+FOR\\s+REPLICATION\\s+)?AS\\b",
        Pattern.CASE_INSENSITIVE | Pattern.DOTALL
    );

    private TriggerRegexExtractor() {
        // utility class
    }

    static RoutineDefinition extract(String batch) {
        if (batch == null || batch.isEmpty()) return null;

        Matcher matcher = TSQL_TRIGGER_PATTERN.matcher(batch);
        if (!matcher.find()) return null;

        RoutineDefinition trigger = new RoutineDefinition();
        trigger.kind = ObjectKind.TRIGGER;
        String[] name = RoutineSqlUtils.splitSchemaAndName(matcher.group(1));
        trigger.schema = name[0];
        trigger.name = name[1];

        String target = matcher.group(2);
        String upperTarget = target.toUpperCase(Locale.ROOT).replaceAll("\\s+", " ");
        // database and server triggers have no parent table
        if (!upperTarget.equals("DATABASE") && !upperTarget.equals("ALL SERVER")) {
            String[] parent = RoutineSqlUtils.splitSchemaAndName(target);
            trigger.parentSchema = parent[0];
            trigger.parentTable = parent[1];
        }

        trigger.timing = normalizeTiming(matcher.group(3));
        for (String event : matcher.group(4).split("[\\s,]+")) {
            if (!event.isBlank()) {
                trigger.events.add(event.toUpperCase(Locale.ROOT));
            }
        }
        trigger.body = batch.substring(matcher.end()).strip();
        return trigger;
    }

    private static String normalizeTiming(String timing) {
        String upper = timing.toUpperCase(Locale.ROOT).replaceAll("\\s+", " ");
        // FOR is the older spelling of AFTER
        return upper.equals("FOR") ? "AFTER" : upper;
    }
}
