package org.dxworks.dacframe.analyzer.sql;

import org.dxworks.dacframe.analyzer.sql.body.IdentifierChain;
import org.dxworks.dacframe.analyzer.sql.body.Token;
import org.dxworks.dacframe.analyzer.sql.body.TokenKind;
import org.dxworks.dacframe.analyzer.sql.body.TokenScanner;
import org.dxworks.dacframe.model.sql.ObjectKind;
import org.dxworks.dacframe.model.sql.ParameterDefinition;
import org.dxworks.dacframe.model.sql.RoutineDefinition;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the header of a T-SQL {@code CREATE/ALTER PROCEDURE|FUNCTION|VIEW} batch: owner name,
 * parameters, return type, and where the body starts.
 */
final class RoutineSignatureParser {

    private static final Pattern OUTPUT_FLAG = Pattern.compile("(?i)\\b(OUTPUT|OUT)\\b");
    private static final Pattern READONLY_FLAG = Pattern.compile("(?i)\\bREADONLY\\b");
    private static final Pattern STRING_LITERAL = Pattern.compile("N?'(?:[^']|'')*'");

    private RoutineSignatureParser() {
        // utility class
    }

    /**
     * Returns {@code null} when the batch does not create or alter a view or routine.
     */
    static RoutineDefinition parse(String batch) {
        if (batch == null || batch.isBlank()) {
            return null;
        }
        List<Token> tokens = new TokenScanner(batch).significantTokens();
        int head = findHead(tokens);
        if (head < 0 || head + 1 >= tokens.size()) {
            return null;
        }
        ObjectKind kind = kindOf(tokens.get(head));
        Token nameStart = tokens.get(head + 1);
        if (!nameStart.isIdentifier() && nameStart.getKind() != TokenKind.KEYWORD) {
            return null;
        }

        RoutineDefinition routine = new RoutineDefinition();
        routine.kind = kind;
        IdentifierChain name = IdentifierChain.read(tokens, head + 1, tokens.size());
        routine.name = name.last();
        if (name.size() >= 2 && !name.part(name.size() - 2).isEmpty()) {
            routine.schema = name.part(name.size() - 2);
        }

        int i = name.getEndIndex() + 1;
        int returnsIndex = -1;
        if (kind == ObjectKind.FUNCTION) {
            returnsIndex = findAtDepthZero(tokens, i, "RETURNS");
        }
        int bodyAs = findBodyAs(tokens, returnsIndex >= 0 ? returnsIndex + 1 : i);
        if (bodyAs < 0) {
            return null;
        }

        if (kind != ObjectKind.VIEW) {
            int paramsEnd = returnsIndex >= 0 ? returnsIndex : optionsStart(tokens, i, bodyAs);
            readParameters(batch, tokens, i, paramsEnd, routine);
        }
        if (returnsIndex >= 0) {
            routine.returnType = readReturnType(batch, tokens, returnsIndex + 1, bodyAs);
        }
        routine.body = batch.substring(tokens.get(bodyAs).getEnd()).strip();
        return routine;
    }

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
            } else {
                continue;
            }
            if (next < tokens.size() && kindOf(tokens.get(next)) != null) {
                return next;
            }
        }
        return -1;
    }

    private static ObjectKind kindOf(Token token) {
        if (token.is("PROCEDURE") || token.is("PROC")) return ObjectKind.PROCEDURE;
        if (token.is("FUNCTION")) return ObjectKind.FUNCTION;
        if (token.is("VIEW")) return ObjectKind.VIEW;
        return null;
    }

    private static int findAtDepthZero(List<Token> tokens, int from, String word) {
        int depth = 0;
        for (int i = from; i < tokens.size(); i++) {
            Token t = tokens.get(i);
            if (t.isPunct('(')) depth++;
            else if (t.isPunct(')')) depth--;
            else if (depth == 0 && t.is(word)) return i;
        }
        return -1;
    }

    /**
     * The AS that opens the body: at depth zero and not part of {@code @p AS type} or
     * {@code EXECUTE AS}.
     */
    private static int findBodyAs(List<Token> tokens, int from) {
        int depth = 0;
        for (int i = from; i < tokens.size(); i++) {
            Token t = tokens.get(i);
            if (t.isPunct('(')) {
                depth++;
            } else if (t.isPunct(')')) {
                depth--;
            } else if (depth == 0 && t.is("AS")) {
                Token prev = i > 0 ? tokens.get(i - 1) : null;
                boolean parameterType = prev != null && prev.getKind() == TokenKind.AT_VARIABLE;
                boolean executeAs = prev != null && (prev.is("EXECUTE") || prev.is("EXEC"));
                if (!parameterType && !executeAs) {
                    return i;
                }
            }
        }
        return -1;
    }

    // WITH RECOMPILE / FOR REPLICATION close a procedure's parameter list
    private static int optionsStart(List<Token> tokens, int from, int bodyAs) {
        int depth = 0;
        for (int i = from; i < bodyAs; i++) {
            Token t = tokens.get(i);
            if (t.isPunct('(')) depth++;
            else if (t.isPunct(')')) depth--;
            else if (depth == 0 && (t.is("WITH") || (t.is("FOR") && i + 1 < bodyAs && tokens.get(i + 1).is("REPLICATION")))) {
                return i;
            }
        }
        return bodyAs;
    }

    private static void readParameters(String batch, List<Token> tokens, int from, int to, RoutineDefinition routine) {
        if (from >= to) {
            return;
        }
        String text;
        Token first = tokens.get(from);
        if (first.isPunct('(')) {
            int close = SqlRoutineTextUtils.findMatchingParen(batch, first.getStart());
            if (close < 0) {
                return;
            }
            text = batch.substring(first.getStart() + 1, close);
        } else {
            text = batch.substring(first.getStart(), tokens.get(to - 1).getEnd());
        }
        for (String raw : SqlRoutineTextUtils.splitTopLevel(stripComments(text), ',')) {
            ParameterDefinition parameter = parseParameter(raw);
            if (parameter != null) {
                routine.parameters.add(parameter);
            }
        }
    }

    private static ParameterDefinition parseParameter(String raw) {
        String trimmed = raw.trim();
        if (!trimmed.startsWith("@")) {
            return null;
        }
        String[] parts = trimmed.split("\\s+", 2);
        ParameterDefinition parameter = new ParameterDefinition();
        parameter.name = parts[0];
        String rest = parts.length > 1 ? parts[1].trim() : "";
        if (rest.toUpperCase(Locale.ROOT).startsWith("AS ")) {
            rest = rest.substring(3).trim();
        }

        String withoutStrings = STRING_LITERAL.matcher(rest).replaceAll("''");
        int eq = withoutStrings.indexOf('=');
        String type = eq >= 0 ? withoutStrings.substring(0, eq) : withoutStrings;
        String flags = eq >= 0 ? withoutStrings.substring(eq) : withoutStrings;

        Matcher output = OUTPUT_FLAG.matcher(flags);
        parameter.output = output.find();
        parameter.readOnly = READONLY_FLAG.matcher(flags).find();
        type = READONLY_FLAG.matcher(OUTPUT_FLAG.matcher(type).replaceAll("")).replaceAll("");
        parameter.type = RoutineSqlUtils.normalizeTypeFormat(type);
        return parameter;
    }

    private static String readReturnType(String batch, List<Token> tokens, int from, int bodyAs) {
        if (from >= bodyAs) {
            return null;
        }
        // RETURNS @result TABLE (...) declares a table variable
        if (tokens.get(from).getKind() == TokenKind.AT_VARIABLE) {
            return "TABLE";
        }
        int end = bodyAs;
        int depth = 0;
        for (int i = from; i < bodyAs; i++) {
            Token t = tokens.get(i);
            if (t.isPunct('(')) depth++;
            else if (t.isPunct(')')) depth--;
            else if (depth == 0 && t.is("WITH")) {
                end = i;
                break;
            }
        }
        if (end <= from) {
            return null;
        }
        return RoutineSqlUtils.normalizeTypeFormat(
                batch.substring(tokens.get(from).getStart(), tokens.get(end - 1).getEnd()));
    }

    private static String stripComments(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        for (Token token : new TokenScanner(text)) {
            sb.append(token.getKind() == TokenKind.COMMENT ? " " : token.getText());
        }
        return sb.toString();
    }
}
