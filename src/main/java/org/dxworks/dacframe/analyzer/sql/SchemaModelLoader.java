package org.dxworks.dacframe.analyzer.sql;

import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.schema.Table;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.Statements;
import net.sf.jsqlparser.statement.create.table.ColDataType;
import net.sf.jsqlparser.statement.create.table.CreateTable;
import org.dxworks.dacframe.analyzer.sql.body.IdentifierChain;
import org.dxworks.dacframe.analyzer.sql.body.Token;
import org.dxworks.dacframe.analyzer.sql.body.TokenKind;
import org.dxworks.dacframe.analyzer.sql.body.TokenScanner;
import org.dxworks.dacframe.model.sql.ColumnDefinition;
import org.dxworks.dacframe.model.sql.ObjectKind;
import org.dxworks.dacframe.model.sql.RoutineDefinition;
import org.dxworks.dacframe.model.sql.SchemaModel;
import org.dxworks.dacframe.model.sql.SchemaObject;
import org.dxworks.dacframe.model.sql.TableDefinition;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Builds a {@link SchemaModel} from the {@code .sql} files of a database project.
 * <p>
 * Each file is split into {@code GO} batches. A batch is classified by its first
 * {@code CREATE}/{@code ALTER} head: tables go through JSqlParser, views and routines through
 * {@link RoutineSignatureParser}, triggers through {@link TriggerRegexExtractor}. Synonyms and
 * sequences are only recorded by name. Anything else is ignored.
 */
public class SchemaModelLoader {

    private static final Set<String> TABLE_CONSTRAINT_WORDS = Set.of(
            "CONSTRAINT", "PRIMARY", "UNIQUE", "CHECK", "FOREIGN", "INDEX", "PERIOD");
    private static final Pattern NOT_NULL = Pattern.compile("(?i)\\bNOT\\s+NULL\\b");

    private enum BatchKind { TABLE, ROUTINE, TRIGGER, SYNONYM, SEQUENCE }

    /**
     * Loads every file of {@code sources} (path to text) into one model, in iteration order.
     */
    public SchemaModel load(Map<String, String> sources) {
        SchemaModel model = new SchemaModel();
        for (Map.Entry<String, String> source : sources.entrySet()) {
            loadFile(source.getKey(), source.getValue(), model);
        }
        return model;
    }

    public void loadFile(String filePath, String source, SchemaModel model) {
        if (source == null || source.isBlank()) {
            return;
        }
        // Remove BOM if present (common in SSDT projects)
        if (source.startsWith("\uFEFF")) {
            source = source.substring(1);
        }
        for (String batch : SqlPreprocessor.splitBatches(source)) {
            List<Token> tokens = new TokenScanner(batch).significantTokens();
            int head = findHead(tokens);
            if (head < 0) {
                continue;
            }
            BatchKind kind = batchKind(tokens.get(head));
            switch (kind) {
                case TABLE -> loadTables(filePath, batch, model);
                case ROUTINE -> addRoutine(filePath, RoutineSignatureParser.parse(batch), model);
                case TRIGGER -> {
                    RoutineDefinition trigger = TriggerRegexExtractor.extract(batch);
                    if (trigger == null) {
                        model.diagnostics.add(filePath + ": unrecognised trigger header, batch skipped");
                    }
                    addRoutine(filePath, trigger, model);
                }
                case SYNONYM -> addNamedObject(filePath, tokens, head, ObjectKind.SYNONYM, model);
                case SEQUENCE -> addNamedObject(filePath, tokens, head, ObjectKind.SEQUENCE, model);
            }
        }
    }

    /**
     * Index of the object-type word following the batch's first {@code CREATE [OR ALTER]} or
     * {@code ALTER} head, or -1.
     */
    private static int findHead(List<Token> tokens) {
        for (int i = 0; i + 1 < tokens.size(); i++) {
            Token t = tokens.get(i);
            int next;
            if (t.is("CREATE")) {
                next = i + 1;
                if (next + 1 < tokens.size() && tokens.get(next).is("OR") && tokens.get(next + 1).is("ALTER")) {
                    next += 2;
                }
            } else if (t.is("ALTER")) {
                next = i + 1;
                // ALTER TABLE changes an existing table, it does not define one
                if (tokens.get(next).is("TABLE")) {
                    continue;
                }
            } else {
                continue;
            }
            if (next < tokens.size() && batchKind(tokens.get(next)) != null) {
                return next;
            }
        }
        return -1;
    }

    private static BatchKind batchKind(Token token) {
        String word = token.getKind() == TokenKind.KEYWORD || token.getKind() == TokenKind.IDENTIFIER
                ? token.getText().toUpperCase(Locale.ROOT)
                : "";
        return switch (word) {
            case "TABLE" -> BatchKind.TABLE;
            case "VIEW", "PROC", "PROCEDURE", "FUNCTION" -> BatchKind.ROUTINE;
            case "TRIGGER" -> BatchKind.TRIGGER;
            case "SYNONYM" -> BatchKind.SYNONYM;
            case "SEQUENCE" -> BatchKind.SEQUENCE;
            default -> null;
        };
    }

    private void loadTables(String filePath, String batch, SchemaModel model) {
        Statements statements;
        try {
            statements = CCJSqlParserUtil.parseStatements(
                batch,
                p -> p.withAllowComplexParsing(true)
                      .withSquareBracketQuotation(true)
            );
        } catch (Exception e) {
            TableDefinition table = parseTableFallback(batch);
            if (table == null) {
                model.diagnostics.add(filePath + ": could not parse CREATE TABLE, batch skipped: " + firstLine(e.getMessage()));
                return;
            }
            model.diagnostics.add(filePath + ": JSqlParser could not parse CREATE TABLE " + table.name
                    + ", columns read from the column list: " + firstLine(e.getMessage()));
            addTable(filePath, table, model);
            return;
        }

        for (Statement st : statements.getStatements()) {
            if (st instanceof CreateTable) {
                addTable(filePath, toTableDefinition((CreateTable) st), model);
            }
        }
    }

    private static TableDefinition toTableDefinition(CreateTable ct) {
        TableDefinition table = new TableDefinition();
        Table t = ct.getTable();
        if (t != null) {
            table.name = RoutineSqlUtils.stripQuotes(t.getName());
            table.schema = RoutineSqlUtils.stripQuotes(t.getSchemaName());
        }
        List<net.sf.jsqlparser.statement.create.table.ColumnDefinition> cols = ct.getColumnDefinitions();
        if (cols != null) {
            for (net.sf.jsqlparser.statement.create.table.ColumnDefinition cd : cols) {
                ColumnDefinition column = new ColumnDefinition();
                column.name = RoutineSqlUtils.stripQuotes(cd.getColumnName());
                column.type = toTypeString(cd.getColDataType());
                List<String> specs = cd.getColumnSpecs();
                if (specs != null && containsNotNull(specs)) {
                    column.nullable = false;
                }
                table.columns.add(column);
            }
        }
        return table;
    }

    private static boolean containsNotNull(List<String> specs) {
        for (int i = 0; i < specs.size() - 1; i++) {
            if (specs.get(i).equalsIgnoreCase("not") && specs.get(i + 1).equalsIgnoreCase("null")) {
                return true;
            }
        }
        return false;
    }

    private static String toTypeString(ColDataType dt) {
        if (dt == null) return null;
        String base = dt.getDataType();
        List<String> args = dt.getArgumentsStringList();
        String result;
        if (args != null && !args.isEmpty()) {
            result = base + "(" + String.join(",", args) + ")";
        } else {
            result = base;
        }
        // Normalize to remove any extra spaces from JSqlParser output
        return RoutineSqlUtils.normalizeTypeFormat(RoutineSqlUtils.stripQuotes(result));
    }

    /**
     * Reads the name and column list of the batch's first {@code CREATE TABLE} straight from
     * its text, for table syntax JSqlParser rejects.
     */
    static TableDefinition parseTableFallback(String batch) {
        List<Token> tokens = new TokenScanner(batch).significantTokens();
        int head = findHead(tokens);
        if (head < 0 || head + 1 >= tokens.size() || !tokens.get(head).is("TABLE")) {
            return null;
        }
        Token nameStart = tokens.get(head + 1);
        if (!nameStart.isIdentifier() && nameStart.getKind() != TokenKind.KEYWORD) {
            return null;
        }
        IdentifierChain name = IdentifierChain.read(tokens, head + 1, tokens.size());
        int open = name.getEndIndex() + 1;
        if (open >= tokens.size() || !tokens.get(open).isPunct('(')) {
            return null;
        }
        int close = SqlRoutineTextUtils.findMatchingParen(batch, tokens.get(open).getStart());
        if (close < 0) {
            return null;
        }

        TableDefinition table = new TableDefinition();
        table.name = name.last();
        if (name.size() >= 2 && !name.part(name.size() - 2).isEmpty()) {
            table.schema = name.part(name.size() - 2);
        }
        String columnList = batch.substring(tokens.get(open).getStart() + 1, close);
        for (String item : SqlRoutineTextUtils.splitTopLevel(columnList, ',')) {
            ColumnDefinition column = parseColumnItem(item);
            if (column != null) {
                table.columns.add(column);
            }
        }
        return table;
    }

    private static ColumnDefinition parseColumnItem(String item) {
        List<Token> tokens = new TokenScanner(item).significantTokens();
        if (tokens.isEmpty()) {
            return null;
        }
        Token first = tokens.get(0);
        if (!first.isIdentifier() && first.getKind() != TokenKind.KEYWORD) {
            return null;
        }
        if (!first.isBracketed() && TABLE_CONSTRAINT_WORDS.contains(first.getText().toUpperCase(Locale.ROOT))) {
            return null;
        }
        ColumnDefinition column = new ColumnDefinition();
        column.name = first.value();
        // computed columns (name AS expr) have no declared type
        if (tokens.size() > 1 && !tokens.get(1).is("AS")) {
            Token typeStart = tokens.get(1);
            int typeEnd = typeStart.getEnd();
            if (tokens.size() > 2 && tokens.get(2).isPunct('(')) {
                int close = SqlRoutineTextUtils.findMatchingParen(item, tokens.get(2).getStart());
                if (close > 0) {
                    typeEnd = close + 1;
                }
            }
            column.type = RoutineSqlUtils.normalizeTypeFormat(
                    RoutineSqlUtils.stripQuotes(item.substring(typeStart.getStart(), typeEnd)));
        }
        column.nullable = !NOT_NULL.matcher(item).find();
        return column;
    }

    private static void addTable(String filePath, TableDefinition table, SchemaModel model) {
        // temp tables belong to the batch that creates them
        if (table.name == null || table.name.startsWith("#")) {
            return;
        }
        table.filePath = filePath;
        model.tables.add(table);
    }

    private static void addRoutine(String filePath, RoutineDefinition routine, SchemaModel model) {
        if (routine == null) {
            return;
        }
        routine.filePath = filePath;
        model.routines.add(routine);
    }

    private static void addNamedObject(String filePath, List<Token> tokens, int head, ObjectKind kind, SchemaModel model) {
        if (head + 1 >= tokens.size()) {
            return;
        }
        Token nameStart = tokens.get(head + 1);
        if (!nameStart.isIdentifier() && nameStart.getKind() != TokenKind.KEYWORD) {
            return;
        }
        IdentifierChain name = IdentifierChain.read(tokens, head + 1, tokens.size());
        SchemaObject object = new SchemaObject();
        object.kind = kind;
        object.name = name.last();
        if (name.size() >= 2 && !name.part(name.size() - 2).isEmpty()) {
            object.schema = name.part(name.size() - 2);
        }
        object.filePath = filePath;
        model.otherObjects.add(object);
    }

    private static String firstLine(String message) {
        if (message == null) {
            return "unknown error";
        }
        int nl = message.indexOf('\n');
        return (nl >= 0 ? message.substring(0, nl) : message).trim();
    }
}
