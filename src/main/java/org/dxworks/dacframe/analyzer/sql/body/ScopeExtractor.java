package org.dxworks.dacframe.analyzer.sql.body;

import org.dxworks.dacframe.analyzer.sql.body.ScopeTree.ObjectRole;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Structural scan of one body that builds its {@link ScopeTree}.
 * <p>
 * The body is cut into statements first; each statement gets its own scope so aliases never
 * leak from one statement into the next. Inside a statement, a leading {@code WITH} list is
 * discovered before anything else (CTE names are bound in the statement scope), then the
 * query is walked level by level: every parenthesized subquery becomes a child scope,
 * FROM/JOIN/APPLY/USING sources and their aliases are bound in the scope whose FROM clause
 * introduces them, and DML targets, hints and local table declarations are recorded on the tree.
 * <p>
 * Unbalanced parentheses stop the scan at the point of failure; scopes found until then stay.
 */
final class ScopeExtractor {

    private static final Set<String> STATEMENT_STARTERS = Set.of(
            "SELECT", "INSERT", "UPDATE", "DELETE", "MERGE", "WITH", "DECLARE", "SET", "IF", "ELSE", "WHILE",
            "BEGIN", "END", "RETURN", "EXEC", "EXECUTE", "PRINT", "RAISERROR", "THROW", "OPEN", "FETCH", "CLOSE",
            "DEALLOCATE", "TRUNCATE", "COMMIT", "ROLLBACK", "SAVE", "CREATE", "DROP", "ALTER", "GOTO", "BREAK",
            "CONTINUE", "WAITFOR", "USE", "GRANT", "DENY", "REVOKE"
    );

    private static final Set<String> DML_HEADS = Set.of("SELECT", "INSERT", "UPDATE", "DELETE", "MERGE");

    private static final Set<String> DDL_HEADS = Set.of("CREATE", "DROP", "ALTER", "GRANT", "DENY", "REVOKE", "USE");

    private static final Set<String> CURSOR_HEADS = Set.of("OPEN", "FETCH", "CLOSE", "DEALLOCATE");

    private static final int MAX_PAREN_NESTING = 512;

    private enum Clause {
        NONE,
        SELECT_LIST,
        FROM,
        SET_LIST,
        OUTPUT,
        OTHER
    }

    private enum DmlKind {
        INSERT,
        UPDATE,
        DELETE,
        MERGE
    }

    private static final class Dml {
        final DmlKind kind;
        int targetIndex = -1;
        boolean targetAfterFrom;
        ResolvedTarget mergeTarget;
        final List<Integer> qualifierOffsets = new ArrayList<>();
        boolean output;

        Dml(DmlKind kind) {
            this.kind = kind;
        }
    }

    private static final class Level {
        final int lo;
        final int hi;
        final Scope scope;
        final int depth;
        final int nesting;
        final boolean tableSources;
        Clause clause = Clause.NONE;
        int itemStart;
        int caseDepth;
        Dml dml;
        ResolvedTarget lastTarget;

        Level(int lo, int hi, Scope scope, int depth, int nesting, boolean tableSources) {
            this.lo = lo;
            this.hi = hi;
            this.scope = scope;
            this.depth = depth;
            this.nesting = nesting;
            this.tableSources = tableSources;
            this.itemStart = lo;
        }
    }

    private final List<Token> tokens;
    private final int textLength;
    private final String defaultSchema;
    private final int maxScopeDepth;
    private final boolean cteFirstTable;
    private final ScopeTree tree = new ScopeTree();
    private int[] match;
    private int limit;

    ScopeExtractor(List<Token> significantTokens, int textLength, String defaultSchema,
                   int maxScopeDepth, boolean cteFirstTable) {
        this.tokens = significantTokens;
        this.textLength = textLength;
        this.defaultSchema = defaultSchema;
        this.maxScopeDepth = maxScopeDepth;
        this.cteFirstTable = cteFirstTable;
    }

    /**
     * @param triggerParent table a trigger is defined on, bound to {@code inserted} and
     *                      {@code deleted} for the whole body; null for other bodies
     */
    ScopeTree extract(ResolvedTarget triggerParent) {
        Scope top = tree.addScope(ScopeKind.TOP_LEVEL, 0, textLength, -1);
        if (triggerParent != null) {
            top.bindAlias("inserted", triggerParent);
            top.bindAlias("deleted", triggerParent);
        }
        computeParenMatches();

        int i = 0;
        while (i < limit) {
            if (tokens.get(i).isPunct(';')) {
                i++;
                continue;
            }
            int end = statementEnd(i);
            processStatement(i, end, top);
            i = end;
        }
        return tree;
    }

    // ---- parentheses and statements ----

    private void computeParenMatches() {
        match = new int[tokens.size()];
        Arrays.fill(match, -1);
        limit = tokens.size();
        Deque<Integer> open = new ArrayDeque<>();
        for (int i = 0; i < tokens.size(); i++) {
            Token t = tokens.get(i);
            if (t.isPunct('(')) {
                open.push(i);
            } else if (t.isPunct(')')) {
                if (open.isEmpty()) {
                    tree.addDiagnostic("Unmatched ')' at offset " + t.getStart() + "; scope discovery stopped there");
                    limit = i;
                    return;
                }
                int o = open.pop();
                match[o] = i;
                match[i] = o;
            }
        }
        if (!open.isEmpty()) {
            int earliest = open.peekLast();
            tree.addDiagnostic("Unclosed '(' at offset " + tokens.get(earliest).getStart()
                    + "; scope discovery stopped there");
            limit = earliest;
        }
    }

    private int statementEnd(int start) {
        String kind = upper(tokens.get(start));
        boolean cteList = kind.equals("WITH");
        boolean insertSourceSeen = false;
        boolean updateSetSeen = false;
        int caseDepth = 0;

        int i = start;
        while (i < limit) {
            Token t = tokens.get(i);
            if (i > start) {
                if (t.isPunct(';')) {
                    return i;
                }
                if (caseDepth == 0 && isStarter(i)) {
                    String word = upper(t);
                    Token prev = tokens.get(i - 1);
                    if (kind.equals("MERGE")) {
                        // MERGE runs up to its mandatory terminator
                    } else if (cteList && DML_HEADS.contains(word)) {
                        kind = word;
                        cteList = false;
                    } else if (word.equals("SELECT") && (prev.is("UNION") || prev.is("ALL") || prev.is("EXCEPT")
                            || prev.is("INTERSECT") || prev.is("FOR") || prev.is("RETURN"))) {
                        // set operation branch, cursor query or inline function result
                    } else if (kind.equals("INSERT") && !insertSourceSeen
                            && (word.equals("SELECT") || word.equals("EXEC") || word.equals("EXECUTE"))) {
                        insertSourceSeen = true;
                    } else if (word.equals("UPDATE") && prev.is("FOR")) {
                        // FOR UPDATE cursor option
                    } else if (kind.equals("UPDATE") && !updateSetSeen && word.equals("SET")) {
                        updateSetSeen = true;
                    } else {
                        return i;
                    }
                }
            }
            if (t.isPunct('(') && match[i] > i) {
                i = match[i] + 1;
                continue;
            }
            if (t.is("CASE")) {
                caseDepth++;
            } else if (t.is("END") && caseDepth > 0) {
                caseDepth--;
            }
            i++;
        }
        return limit;
    }

    private boolean isStarter(int i) {
        Token t = tokens.get(i);
        if (t.getKind() != TokenKind.KEYWORD && !t.is("THROW")) {
            return false;
        }
        String word = upper(t);
        if (word.equals("WITH")) {
            return isCteHead(i + 1, limit);
        }
        return STATEMENT_STARTERS.contains(word);
    }

    /**
     * Whether {@code name [(cols)] AS (} starts at {@code i}.
     */
    private boolean isCteHead(int i, int hi) {
        if (i >= hi || !tokens.get(i).isIdentifier()) {
            return false;
        }
        int j = i + 1;
        if (punct(j, hi, '(') && match[j] > j) {
            j = match[j] + 1;
        }
        return at(j, hi, "AS") && punct(j + 1, hi, '(');
    }

    private void processStatement(int start, int end, Scope top) {
        Token head = tokens.get(start);
        int endOffset = tokens.get(end - 1).getEnd();
        Scope scope = tree.addScope(ScopeKind.STATEMENT, head.getStart(), endOffset, top.getId());
        String word = upper(head);

        if (word.equals("SET") && start + 1 < end && tokens.get(start + 1).getKind() != TokenKind.AT_VARIABLE) {
            // session options
            tree.addIgnoredRange(head.getStart(), endOffset);
            return;
        }
        if (CURSOR_HEADS.contains(word)) {
            tree.addIgnoredRange(head.getStart(), endOffset);
            return;
        }
        if (word.equals("CREATE") && at(start + 1, end, "TABLE") && start + 2 < end
                && tokens.get(start + 2).getText().startsWith("#")) {
            declareTempTable(start + 2, end);
            tree.addIgnoredRange(head.getStart(), endOffset);
            return;
        }
        if (DDL_HEADS.contains(word)) {
            tree.addIgnoredRange(head.getStart(), endOffset);
            return;
        }
        if (word.equals("TRUNCATE")) {
            int j = at(start + 1, end, "TABLE") ? start + 2 : start + 1;
            if (j < end && tokens.get(j).isIdentifier()) {
                tree.addObjectPosition(tokens.get(j).getStart(), ObjectRole.TABLE);
            }
            return;
        }
        if (word.equals("DECLARE")) {
            handleDeclare(start, end);
        }
        processQuery(start, end, scope, 0, 0);
    }

    // ---- locals ----

    private void handleDeclare(int start, int end) {
        int i = start + 1;
        while (i < end) {
            Token t = tokens.get(i);
            if (t.is("FOR")) {
                return;
            }
            if (t.isPunct('(') && match[i] > i) {
                i = match[i] + 1;
                continue;
            }
            Token prev = tokens.get(i - 1);
            boolean declared = prev.is("DECLARE") || prev.isPunct(',');
            if (declared && t.getKind() == TokenKind.AT_VARIABLE) {
                int j = at(i + 1, end, "AS") ? i + 2 : i + 1;
                if (at(j, end, "TABLE") && punct(j + 1, end, '(') && match[j + 1] > j) {
                    int close = match[j + 1];
                    tree.declareLocalTable(t.getText(), columnNames(j + 1, close));
                    tree.addIgnoredRange(tokens.get(j + 1).getStart(), tokens.get(close).getEnd());
                    i = close + 1;
                    continue;
                }
                if (j < end && tokens.get(j).getKind() == TokenKind.IDENTIFIER
                        && SqlKeywords.isBuiltInType(tokens.get(j).getText())) {
                    tree.addDeclaredType(tokens.get(j).getText());
                }
            } else if (declared && t.isIdentifier() && at(i + 1, end, "CURSOR")) {
                tree.addCursorName(t.value());
            }
            i++;
        }
    }

    private void declareTempTable(int nameIndex, int end) {
        Token name = tokens.get(nameIndex);
        int open = nameIndex + 1;
        if (punct(open, end, '(') && match[open] > open) {
            tree.declareLocalTable(name.getText(), columnNames(open, match[open]));
        } else {
            tree.declareLocalTable(name.getText(), Set.of());
        }
    }

    /**
     * Case-folded names leading each top-level item of a column declaration list.
     */
    private Set<String> columnNames(int open, int close) {
        Set<String> names = new LinkedHashSet<>();
        int k = open + 1;
        while (k < close) {
            Token t = tokens.get(k);
            if (t.isPunct('(') && match[k] > k) {
                k = match[k] + 1;
                continue;
            }
            Token prev = tokens.get(k - 1);
            if (t.isIdentifier() && (prev.isPunct('(') || prev.isPunct(','))) {
                names.add(t.value().toLowerCase(Locale.ROOT));
            }
            k++;
        }
        return names;
    }

    private void markColumnList(int open, int close) {
        for (int k = open + 1; k < close; k++) {
            Token t = tokens.get(k);
            Token prev = tokens.get(k - 1);
            if (t.isIdentifier() && (prev.isPunct('(') || prev.isPunct(','))) {
                tree.addAliasDefinition(t.getStart());
            }
        }
    }

    // ---- queries ----

    private void processQuery(int lo, int hi, Scope scope, int depth, int nesting) {
        int i = lo;
        if (at(i, hi, "WITH") && isCteHead(i + 1, hi)) {
            i = parseCtes(i + 1, hi, scope, depth, nesting);
        }

        List<Integer> operators = new ArrayList<>();
        int caseDepth = 0;
        int k = i;
        while (k < hi) {
            Token t = tokens.get(k);
            if (t.isPunct('(') && match[k] > k) {
                k = match[k] + 1;
                continue;
            }
            if (t.is("CASE")) {
                caseDepth++;
            } else if (t.is("END") && caseDepth > 0) {
                caseDepth--;
            } else if (caseDepth == 0 && (t.is("UNION") || t.is("EXCEPT") || t.is("INTERSECT"))) {
                operators.add(k);
            }
            k++;
        }

        if (operators.isEmpty()) {
            processLevel(new Level(i, hi, scope, depth, nesting, true), false);
            return;
        }
        operators.add(hi);
        int branchStart = i;
        for (int operator : operators) {
            if (operator > branchStart) {
                Scope branch = tree.addScope(ScopeKind.UNION_BRANCH, tokens.get(branchStart).getStart(),
                        tokens.get(operator - 1).getEnd(), scope.getId());
                processLevel(new Level(branchStart, operator, branch, depth, nesting, true), false);
            }
            branchStart = at(operator + 1, hi, "ALL") ? operator + 2 : operator + 1;
        }
    }

    private int parseCtes(int start, int hi, Scope scope, int depth, int nesting) {
        int i = start;
        while (i < hi && tokens.get(i).isIdentifier()) {
            Token nameToken = tokens.get(i);
            String name = nameToken.value();
            tree.addAliasDefinition(nameToken.getStart());
            int j = i + 1;
            if (punct(j, hi, '(') && match[j] > j) {
                markColumnList(j, match[j]);
                j = match[j] + 1;
            }
            if (!at(j, hi, "AS") || !punct(j + 1, hi, '(') || match[j + 1] < 0) {
                return j;
            }
            int open = j + 1;
            int close = match[open];
            // visible inside its own body, for recursive CTEs
            scope.bindAlias(name, ResolvedTarget.cte(name, null));
            Scope cteScope = tree.addScope(ScopeKind.CTE, tokens.get(open).getStart(), tokens.get(close).getEnd(),
                    scope.getId());
            if (depth + 1 > maxScopeDepth) {
                depthExceeded(tokens.get(open));
            } else {
                processQuery(open + 1, close, cteScope, depth + 1, nesting + 1);
            }
            ResolvedTarget underlying = cteFirstTable ? firstTable(cteScope) : null;
            scope.bindAlias(name, ResolvedTarget.cte(name, underlying));

            i = close + 1;
            if (!punct(i, hi, ',')) {
                break;
            }
            i++;
        }
        return i;
    }

    /**
     * First table read by the FROM clause of {@code scope}, looking through derived tables,
     * earlier CTEs and set-operation branches.
     */
    private ResolvedTarget firstTable(Scope scope) {
        for (ResolvedTarget source : scope.getSources()) {
            if (source.getKind() == ResolvedTarget.Kind.TABLE) {
                return source;
            }
            if (source.getKind() == ResolvedTarget.Kind.CTE && source.concreteTable() != null) {
                return source.concreteTable();
            }
            if (source.getKind() == ResolvedTarget.Kind.DERIVED_TABLE) {
                ResolvedTarget inner = firstTable(tree.scope(source.getScopeId()));
                if (inner != null) {
                    return inner;
                }
            }
        }
        for (Scope child : tree.children(scope)) {
            if (child.getKind() == ScopeKind.UNION_BRANCH) {
                ResolvedTarget inner = firstTable(child);
                if (inner != null) {
                    return inner;
                }
            }
        }
        return null;
    }

    private void processLevel(Level level, boolean startsWithTableSource) {
        int i = level.lo;
        if (startsWithTableSource) {
            level.clause = Clause.FROM;
            i = parseTableSource(level, i);
        }
        while (i < level.hi) {
            Token t = tokens.get(i);
            if (t.isPunct('(')) {
                i = paren(level, i);
                continue;
            }
            if (t.isPunct(',')) {
                level.itemStart = i + 1;
                if (level.clause == Clause.FROM && level.tableSources) {
                    i = parseTableSource(level, i + 1);
                } else {
                    i++;
                }
                continue;
            }
            if (t.isPunct('*') && level.clause == Clause.SELECT_LIST && i == level.itemStart) {
                tree.addSelectStar(t.getStart());
                i++;
                continue;
            }
            if (t.getKind() == TokenKind.KEYWORD || t.getKind() == TokenKind.IDENTIFIER) {
                int next = keyword(level, i);
                if (next > i) {
                    i = next;
                    continue;
                }
            }
            if (t.isIdentifier()) {
                if (columnAlias(level, i)) {
                    i++;
                    continue;
                }
                if (level.clause == Clause.SET_LIST && i == level.itemStart && level.dml != null) {
                    IdentifierChain chain = IdentifierChain.read(tokens, i, level.hi);
                    if (chain.size() == 1 && isAssignment(chain.getEndIndex() + 1, level.hi)) {
                        level.dml.qualifierOffsets.add(t.getStart());
                    }
                }
            }
            i++;
        }
        finishDml(level);
    }

    /**
     * Handles the keyword at {@code i}; returns the index to continue from, or {@code i} when
     * the token needs no special treatment.
     */
    private int keyword(Level level, int i) {
        Token t = tokens.get(i);
        int hi = level.hi;
        switch (upper(t)) {
            case "SELECT": {
                level.clause = Clause.SELECT_LIST;
                int j = i + 1;
                if (at(j, hi, "DISTINCT") || at(j, hi, "ALL")) j++;
                if (at(j, hi, "TOP")) {
                    j++;
                    if (punct(j, hi, '(') && match[j] > j) {
                        processLevel(new Level(j + 1, match[j], level.scope, level.depth, level.nesting + 1, false), false);
                        j = match[j] + 1;
                    } else if (j < hi) {
                        j++;
                    }
                    if (at(j, hi, "PERCENT")) j++;
                    if (at(j, hi, "WITH") && at(j + 1, hi, "TIES")) j += 2;
                }
                level.itemStart = j;
                return j;
            }
            case "FROM": {
                level.clause = Clause.FROM;
                if (level.dml != null && level.dml.targetAfterFrom && level.dml.targetIndex < 0) {
                    level.dml.targetIndex = i + 1;
                }
                return level.tableSources ? parseTableSource(level, i + 1) : i + 1;
            }
            case "JOIN":
            case "APPLY":
            case "USING": {
                level.clause = Clause.FROM;
                return level.tableSources ? parseTableSource(level, i + 1) : i + 1;
            }
            case "WHERE":
            case "GROUP":
            case "HAVING":
            case "ORDER":
            case "WINDOW":
                level.clause = Clause.OTHER;
                return i + 1;
            case "WHEN":
                if (level.caseDepth == 0 && level.dml != null && level.dml.kind == DmlKind.MERGE) {
                    level.clause = Clause.OTHER;
                }
                return i + 1;
            case "CASE":
                level.caseDepth++;
                return i + 1;
            case "END":
                if (level.caseDepth > 0) level.caseDepth--;
                return i + 1;
            case "INTO":
                if (level.clause == Clause.SELECT_LIST || level.clause == Clause.OUTPUT) {
                    level.clause = Clause.OTHER;
                    return objectTarget(i + 1, hi, true);
                }
                return i + 1;
            case "UPDATE":
                return update(level, i);
            case "DELETE":
                return delete(level, i);
            case "INSERT":
                return insert(level, i);
            case "MERGE": {
                level.dml = new Dml(DmlKind.MERGE);
                int j = at(i + 1, hi, "INTO") ? i + 2 : i + 1;
                j = skipTop(j, hi);
                level.clause = Clause.FROM;
                level.lastTarget = null;
                int next = parseTableSource(level, j);
                level.dml.mergeTarget = level.lastTarget;
                return next;
            }
            case "SET":
                if (level.dml != null && (level.dml.kind == DmlKind.UPDATE || level.dml.kind == DmlKind.MERGE)) {
                    level.clause = Clause.SET_LIST;
                    level.itemStart = i + 1;
                }
                return i + 1;
            case "OUTPUT":
                if (level.dml != null) {
                    level.dml.output = true;
                    level.clause = Clause.OUTPUT;
                    level.itemStart = i + 1;
                }
                return i + 1;
            case "EXEC":
            case "EXECUTE":
                return exec(i, hi);
            case "WITH":
            case "OPTION":
            case "TABLESAMPLE": {
                int j = i + 1;
                if (t.is("WITH") && j < hi && tokens.get(j).getKind() == TokenKind.IDENTIFIER && punct(j + 1, hi, '(')) {
                    j++;  // WITH XMLNAMESPACES (...)
                }
                if (punct(j, hi, '(') && match[j] > j) {
                    tree.addIgnoredRange(t.getStart(), tokens.get(match[j]).getEnd());
                    return match[j] + 1;
                }
                return i + 1;
            }
            case "FOR":
                if (at(i + 1, hi, "XML") || at(i + 1, hi, "JSON") || at(i + 1, hi, "BROWSE")) {
                    tree.addIgnoredRange(t.getStart(), tokens.get(hi - 1).getEnd());
                    return hi;
                }
                return i + 1;
            case "PIVOT":
            case "UNPIVOT": {
                int j = i + 1;
                if (punct(j, hi, '(') && match[j] > j) {
                    tree.addIgnoredRange(t.getStart(), tokens.get(match[j]).getEnd());
                    j = match[j] + 1;
                    if (at(j, hi, "AS")) j++;
                    if (j < hi && SqlKeywords.canBeAlias(tokens.get(j))) {
                        tree.addAliasDefinition(tokens.get(j).getStart());
                        level.scope.bindAlias(tokens.get(j).value(), ResolvedTarget.unknown());
                        level.scope.addSource(ResolvedTarget.unknown());
                        j++;
                    }
                    return j;
                }
                return i + 1;
            }
            case "AS":
                if ((level.clause == Clause.SELECT_LIST || level.clause == Clause.OUTPUT) && i + 1 < hi
                        && (tokens.get(i + 1).isIdentifier() || tokens.get(i + 1).getKind() == TokenKind.LITERAL)) {
                    Token alias = tokens.get(i + 1);
                    tree.addAliasDefinition(alias.getStart());
                    level.scope.addColumnAlias(alias.value());
                    return i + 2;
                }
                return i + 1;
            default:
                return i;
        }
    }

    private int update(Level level, int i) {
        int hi = level.hi;
        if (i > level.lo && tokens.get(i - 1).is("FOR")) {
            return i + 1;
        }
        if (level.dml != null && level.dml.kind == DmlKind.MERGE) {
            return i + 1;
        }
        level.dml = new Dml(DmlKind.UPDATE);
        int j = skipTop(i + 1, hi);
        level.dml.targetIndex = j;
        return objectTarget(j, hi, false);
    }

    private int delete(Level level, int i) {
        int hi = level.hi;
        if (level.dml != null && level.dml.kind == DmlKind.MERGE) {
            return i + 1;
        }
        level.dml = new Dml(DmlKind.DELETE);
        int j = skipTop(i + 1, hi);
        if (at(j, hi, "FROM")) {
            level.dml.targetAfterFrom = true;
            return j;
        }
        level.dml.targetIndex = j;
        return objectTarget(j, hi, false);
    }

    private int insert(Level level, int i) {
        int hi = level.hi;
        if (level.dml != null && level.dml.kind == DmlKind.MERGE) {
            int j = i + 1;
            if (punct(j, hi, '(') && match[j] > j) {
                addQualifiers(level.dml, j, match[j]);
                return match[j] + 1;
            }
            return j;
        }
        level.dml = new Dml(DmlKind.INSERT);
        int j = at(i + 1, hi, "INTO") ? i + 2 : i + 1;
        j = skipTop(j, hi);
        level.dml.targetIndex = j;
        j = objectTarget(j, hi, false);
        if (at(j, hi, "WITH") && punct(j + 1, hi, '(') && match[j + 1] > j) {
            tree.addIgnoredRange(tokens.get(j).getStart(), tokens.get(match[j + 1]).getEnd());
            j = match[j + 1] + 1;
        }
        if (punct(j, hi, '(') && match[j] > j && !at(j + 1, hi, "SELECT") && !at(j + 1, hi, "WITH")) {
            addQualifiers(level.dml, j, match[j]);
            return match[j] + 1;
        }
        return j;
    }

    private void addQualifiers(Dml dml, int open, int close) {
        for (int k = open + 1; k < close; k++) {
            Token t = tokens.get(k);
            Token prev = tokens.get(k - 1);
            if (t.isIdentifier() && (prev.isPunct('(') || prev.isPunct(',')) && !tokens.get(k + 1).isPunct('.')) {
                dml.qualifierOffsets.add(t.getStart());
            }
        }
    }

    private int exec(int i, int hi) {
        int j = i + 1;
        if (j < hi && tokens.get(j).getKind() == TokenKind.AT_VARIABLE && punct(j + 1, hi, '=')) {
            j += 2;
        }
        if (punct(j, hi, '(') && match[j] > j) {
            // dynamic SQL
            return match[j] + 1;
        }
        if (j < hi && tokens.get(j).isIdentifier()) {
            IdentifierChain chain = IdentifierChain.read(tokens, j, hi);
            tree.addObjectPosition(chain.getStartOffset(), ObjectRole.PROCEDURE);
            return chain.getEndIndex() + 1;
        }
        return j;
    }

    /**
     * Records the object name at {@code i} (INTO, UPDATE, DELETE and INSERT targets) and
     * returns the index after it. A column list after an INTO target is never resolved.
     */
    private int objectTarget(int i, int hi, boolean skipColumnList) {
        if (i >= hi) {
            return i;
        }
        Token t = tokens.get(i);
        if (t.getKind() == TokenKind.AT_VARIABLE) {
            return i + 1;
        }
        if (!t.isIdentifier()) {
            return i;
        }
        IdentifierChain chain = IdentifierChain.read(tokens, i, hi);
        tree.addObjectPosition(chain.getStartOffset(), ObjectRole.TABLE);
        int j = chain.getEndIndex() + 1;
        if (skipColumnList && punct(j, hi, '(') && match[j] > j) {
            tree.addIgnoredRange(tokens.get(j).getStart(), tokens.get(match[j]).getEnd());
            j = match[j] + 1;
        }
        return j;
    }

    private int skipTop(int j, int hi) {
        if (!at(j, hi, "TOP")) {
            return j;
        }
        j++;
        if (punct(j, hi, '(') && match[j] > j) {
            j = match[j] + 1;
        } else if (j < hi) {
            j++;
        }
        return at(j, hi, "PERCENT") ? j + 1 : j;
    }

    private boolean isAssignment(int j, int hi) {
        if (punct(j, hi, '=')) {
            return true;
        }
        if (j + 1 >= hi || !punct(j + 1, hi, '=')) {
            return false;
        }
        String op = tokens.get(j).getText();
        return tokens.get(j).getKind() == TokenKind.PUNCTUATION && "+-*/%&|^".contains(op);
    }

    private boolean columnAlias(Level level, int i) {
        if (level.clause == Clause.SELECT_LIST && i == level.itemStart && punct(i + 1, level.hi, '=')
                && !punct(i + 2, level.hi, '=')) {
            Token t = tokens.get(i);
            tree.addAliasDefinition(t.getStart());
            level.scope.addColumnAlias(t.value());
            return true;
        }
        if ((level.clause != Clause.SELECT_LIST && level.clause != Clause.OUTPUT) || i == level.itemStart
                || i == level.lo) {
            return false;
        }
        Token t = tokens.get(i);
        if (!t.isBracketed() && !SqlKeywords.canBeAlias(t)) {
            return false;
        }
        Token prev = tokens.get(i - 1);
        boolean prevEndsExpression = prev.isIdentifier() || prev.getKind() == TokenKind.LITERAL
                || prev.getKind() == TokenKind.AT_VARIABLE || prev.isPunct(')') || prev.is("END");
        if (!prevEndsExpression || punct(i + 1, level.hi, '.')) {
            return false;
        }
        int n = i + 1;
        boolean nextEndsItem = n >= level.hi || tokens.get(n).isPunct(',') || tokens.get(n).isPunct(';')
                || tokens.get(n).getKind() == TokenKind.KEYWORD;
        if (!nextEndsItem) {
            return false;
        }
        tree.addAliasDefinition(t.getStart());
        level.scope.addColumnAlias(t.value());
        return true;
    }

    private int paren(Level level, int i) {
        int close = match[i];
        if (close < 0 || close >= level.hi) {
            return level.hi;
        }
        Token open = tokens.get(i);
        Token prev = i > level.lo ? tokens.get(i - 1) : null;
        boolean sourcePosition = prev != null && level.tableSources
                && (prev.is("FROM") || prev.is("JOIN") || prev.is("USING") || prev.is("APPLY")
                || (prev.isPunct(',') && level.clause == Clause.FROM));
        boolean subquery = at(i + 1, close, "SELECT")
                || (at(i + 1, close, "WITH") && isCteHead(i + 2, close))
                || (sourcePosition && at(i + 1, close, "VALUES"));

        if (subquery) {
            ScopeKind kind = !sourcePosition ? ScopeKind.CORRELATED_SUBQUERY
                    : prev.is("APPLY") ? ScopeKind.APPLY : ScopeKind.DERIVED_TABLE;
            if (level.depth + 1 > maxScopeDepth) {
                depthExceeded(open);
                return kind == ScopeKind.CORRELATED_SUBQUERY
                        ? close + 1
                        : bindDerivedAlias(level, close + 1, ResolvedTarget.unknown());
            }
            Scope child = tree.addScope(kind, open.getStart(), tokens.get(close).getEnd(), level.scope.getId());
            processQuery(i + 1, close, child, level.depth + 1, level.nesting + 1);
            return kind == ScopeKind.CORRELATED_SUBQUERY
                    ? close + 1
                    : bindDerivedAlias(level, close + 1, ResolvedTarget.derivedTable(child.getId()));
        }

        if (level.nesting + 1 > MAX_PAREN_NESTING) {
            tree.addDiagnostic("Parentheses nested deeper than " + MAX_PAREN_NESTING + " at offset "
                    + open.getStart() + "; their content is not scanned");
            return close + 1;
        }
        boolean tableGroup = sourcePosition && !prev.is("APPLY");
        processLevel(new Level(i + 1, close, level.scope, level.depth, level.nesting + 1, tableGroup), tableGroup);
        return close + 1;
    }

    private void depthExceeded(Token open) {
        tree.addDiagnostic("Scope nesting deeper than " + maxScopeDepth + " at offset " + open.getStart()
                + "; deeper scopes are not discovered");
    }

    // ---- table sources ----

    private int parseTableSource(Level level, int i) {
        int hi = level.hi;
        if (i >= hi) {
            return i;
        }
        Token t = tokens.get(i);
        if (t.isPunct('(')) {
            return i;
        }
        if (t.getKind() == TokenKind.AT_VARIABLE) {
            ResolvedTarget target = ResolvedTarget.local(t.getText(), tree.localColumns(t.getText()));
            level.scope.addSource(target);
            level.lastTarget = target;
            return bindTableAlias(level, i + 1, target, null);
        }
        if (!t.isIdentifier() && t.getKind() != TokenKind.KEYWORD) {
            return i;
        }
        IdentifierChain chain = IdentifierChain.read(tokens, i, hi);
        int next = chain.getEndIndex() + 1;
        if (punct(next, hi, '(') && match[next] > next && !isHintList(next)) {
            // table-valued function
            tree.addObjectPosition(chain.getStartOffset(), ObjectRole.FUNCTION);
            int close = match[next];
            processLevel(new Level(next + 1, close, level.scope, level.depth, level.nesting + 1, false), false);
            ResolvedTarget target = ResolvedTarget.unknown();
            level.scope.addSource(target);
            level.lastTarget = target;
            return bindTableAlias(level, close + 1, target, null);
        }
        if (t.getKind() == TokenKind.KEYWORD) {
            return i;
        }
        tree.addObjectPosition(chain.getStartOffset(), ObjectRole.TABLE);
        ResolvedTarget target = tableTarget(chain, level.scope);
        level.scope.addSource(target);
        level.lastTarget = target;
        return bindTableAlias(level, next, target, chain);
    }

    private ResolvedTarget tableTarget(IdentifierChain chain, Scope scope) {
        if (chain.size() == 1) {
            String name = chain.part(0);
            if (name.startsWith("#")) {
                return ResolvedTarget.local(name, tree.localColumns(name));
            }
            ResolvedTarget visible = tree.lookup(scope, name);
            if (visible != null && (visible.getKind() == ResolvedTarget.Kind.CTE
                    || name.equalsIgnoreCase("inserted") || name.equalsIgnoreCase("deleted"))) {
                return visible;
            }
            return ResolvedTarget.table(defaultSchema, name);
        }
        if (chain.size() == 2) {
            String schema = chain.part(0).isEmpty() ? defaultSchema : chain.part(0);
            return ResolvedTarget.table(schema, chain.part(1));
        }
        return ResolvedTarget.unknown();
    }

    private int bindTableAlias(Level level, int i, ResolvedTarget target, IdentifierChain chain) {
        int hi = level.hi;
        i = skipHints(i, hi);
        boolean explicit = at(i, hi, "AS");
        if (explicit) i++;
        if (i < hi && (SqlKeywords.canBeAlias(tokens.get(i)) || (explicit && tokens.get(i).isIdentifier()))
                && !punct(i + 1, hi, '.')) {
            Token alias = tokens.get(i);
            tree.addAliasDefinition(alias.getStart());
            level.scope.bindAlias(alias.value(), target);
            i++;
            if (punct(i, hi, '(') && match[i] > i) {
                markColumnList(i, match[i]);
                i = match[i] + 1;
            }
            i = skipHints(i, hi);
        }
        if (chain != null && chain.size() <= 2) {
            level.scope.bindSelfAlias(chain.last(), target);
        }
        return i;
    }

    private int bindDerivedAlias(Level level, int i, ResolvedTarget target) {
        int hi = level.hi;
        boolean explicit = at(i, hi, "AS");
        if (explicit) i++;
        if (i < hi && (SqlKeywords.canBeAlias(tokens.get(i)) || (explicit && tokens.get(i).isIdentifier()))) {
            Token alias = tokens.get(i);
            tree.addAliasDefinition(alias.getStart());
            level.scope.bindAlias(alias.value(), target);
            i++;
            if (punct(i, hi, '(') && match[i] > i) {
                markColumnList(i, match[i]);
                i = match[i] + 1;
            }
        }
        level.scope.addSource(target);
        return i;
    }

    private int skipHints(int i, int hi) {
        while (i < hi) {
            if (at(i, hi, "WITH") && punct(i + 1, hi, '(') && match[i + 1] > i) {
                tree.addIgnoredRange(tokens.get(i).getStart(), tokens.get(match[i + 1]).getEnd());
                i = match[i + 1] + 1;
            } else if (punct(i, hi, '(') && match[i] > i && isHintList(i)) {
                tree.addIgnoredRange(tokens.get(i).getStart(), tokens.get(match[i]).getEnd());
                i = match[i] + 1;
            } else if (at(i, hi, "TABLESAMPLE") && punct(i + 1, hi, '(') && match[i + 1] > i) {
                tree.addIgnoredRange(tokens.get(i).getStart(), tokens.get(match[i + 1]).getEnd());
                i = match[i + 1] + 1;
            } else {
                break;
            }
        }
        return i;
    }

    private boolean isHintList(int open) {
        int first = open + 1;
        return first < match[open] && SqlKeywords.isTableHint(tokens.get(first).getText());
    }

    private void finishDml(Level level) {
        Dml dml = level.dml;
        if (dml == null) {
            return;
        }
        ResolvedTarget target = dml.mergeTarget;
        if (target == null && dml.targetIndex >= 0 && dml.targetIndex < level.hi) {
            target = dmlTarget(level, dml);
        }
        if (target == null) {
            return;
        }
        for (int offset : dml.qualifierOffsets) {
            tree.setColumnQualifier(offset, target);
        }
        if (dml.output) {
            level.scope.bindIfAbsent("inserted", target);
            level.scope.bindIfAbsent("deleted", target);
        }
    }

    private ResolvedTarget dmlTarget(Level level, Dml dml) {
        Token t = tokens.get(dml.targetIndex);
        if (t.getKind() == TokenKind.AT_VARIABLE) {
            return ResolvedTarget.local(t.getText(), tree.localColumns(t.getText()));
        }
        if (!t.isIdentifier()) {
            return null;
        }
        IdentifierChain chain = IdentifierChain.read(tokens, dml.targetIndex, level.hi);
        if (chain.size() == 1) {
            ResolvedTarget bound = tree.lookup(level.scope, chain.part(0));
            if (bound != null) {
                return bound;
            }
        }
        ResolvedTarget target = tableTarget(chain, level.scope);
        if (dml.kind != DmlKind.INSERT && chain.size() <= 2) {
            level.scope.bindSelfAlias(chain.last(), target);
            level.scope.addSource(target);
        }
        return target;
    }

    // ---- token helpers ----

    private boolean at(int i, int hi, String word) {
        return i >= 0 && i < hi && i < limit && tokens.get(i).is(word);
    }

    private boolean punct(int i, int hi, char c) {
        return i >= 0 && i < hi && i < limit && tokens.get(i).isPunct(c);
    }

    private static String upper(Token token) {
        return token.getText().toUpperCase(Locale.ROOT);
    }
}
