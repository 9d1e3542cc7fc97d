package org.dxworks.dacframe.analyzer.sql.body;

import org.dxworks.dacframe.DacframeConfig;
import org.dxworks.dacframe.analyzer.sql.body.ScopeTree.ObjectRole;
import org.dxworks.dacframe.model.sql.ObjectKind;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Single walk over the significant tokens of a body that turns every identifier chain into a
 * dependency or drops it.
 * <p>
 * Qualified chains go through the alias maps of the scope chain at their position, innermost
 * scope first. Unqualified names are probed against the column registry one scope level at a
 * time: a single declaring table wins, several make the name ambiguous and it is dropped.
 */
final class ReferenceResolver extends DependencyCollector {

    private final List<Token> tokens;
    private final ScopeTree tree;
    private final ColumnRegistry registry;
    private final String defaultSchema;
    private final String ownerSchema;
    private final String ownerName;
    private final Map<String, String> parameters = new HashMap<>();
    private final boolean unqualifiedColumnFallback;
    private final boolean emitUnqualifiedTableReferences;

    ReferenceResolver(List<Token> tokens, ScopeTree tree, ColumnRegistry registry,
                      BodyContext context, String defaultSchema, DacframeConfig config) {
        this.tokens = tokens;
        this.tree = tree;
        this.registry = registry;
        this.defaultSchema = defaultSchema;
        this.ownerSchema = context.getSchema() == null ? defaultSchema : context.getSchema();
        this.ownerName = context.getName();
        for (String parameter : context.getParameters()) {
            parameters.putIfAbsent(parameter.toLowerCase(Locale.ROOT), parameter);
        }
        this.unqualifiedColumnFallback = config.isUnqualifiedColumnFallback();
        this.emitUnqualifiedTableReferences = config.isEmitUnqualifiedTableReferences();
    }

    void resolve() {
        for (String type : tree.getDeclaredTypes()) {
            addBuiltInType(type);
        }

        int i = 0;
        while (i < tokens.size()) {
            Token t = tokens.get(i);
            if (tree.isIgnored(t.getStart())) {
                i++;
                continue;
            }
            if (t.getKind() == TokenKind.AT_VARIABLE) {
                String declared = parameters.get(t.getText().toLowerCase(Locale.ROOT));
                if (declared != null) {
                    addParameter(ownerSchema, ownerName, declared);
                }
                i++;
                continue;
            }
            if (t.isPunct('*') && tree.isSelectStar(t.getStart())) {
                star(tree.scopeAt(t.getStart()));
                i++;
                continue;
            }
            if (!t.isIdentifier() || (i > 0 && tokens.get(i - 1).isPunct('.'))) {
                i++;
                continue;
            }
            IdentifierChain chain = IdentifierChain.read(tokens, i, tokens.size());
            resolveChain(chain);
            i = chain.getEndIndex() + 1;
        }
    }

    private void resolveChain(IdentifierChain chain) {
        int index = chain.getStartIndex();
        int offset = chain.getStartOffset();
        if (tree.isAliasDefinition(offset)) {
            return;
        }
        int after = chain.getEndIndex() + 1;
        if (punct(after, ':') || punct(index - 1, ':')) {
            // label, or the member of a static type method such as geography::Point
            return;
        }
        Scope scope = tree.scopeAt(offset);

        ObjectRole role = tree.objectRole(offset);
        if (role != null) {
            objectName(chain, role, scope);
            return;
        }
        if (!chain.isStar() && punct(after, '(')) {
            call(chain, scope);
            return;
        }
        free(chain, scope);
    }

    // ---- object names ----

    private void objectName(IdentifierChain chain, ObjectRole role, Scope scope) {
        if (chain.size() == 1) {
            String name = chain.part(0);
            if (name.startsWith("#")) {
                return;
            }
            if (role == ObjectRole.TABLE) {
                if (!emitUnqualifiedTableReferences || isTriggerTable(name)) {
                    return;
                }
                ResolvedTarget visible = tree.lookup(scope, name);
                if (visible != null && visible.getKind() == ResolvedTarget.Kind.CTE) {
                    return;
                }
            }
            TableKey key = TableKey.of(defaultSchema, name);
            if (registry.containsObject(key)) {
                addKnownObject(defaultSchema, name, registry.objectKind(key));
            }
            return;
        }
        if (chain.size() == 2) {
            String schema = schemaOrDefault(chain.part(0));
            String name = chain.part(1);
            ObjectKind kind = registry.objectKind(TableKey.of(schema, name));
            if (kind != null) {
                addKnownObject(schema, name, kind);
            } else if (registry.isKnownSchema(schema)) {
                addKnownObject(schema, name, fallbackKind(role));
            }
            return;
        }
        external(chain);
    }

    private static ObjectKind fallbackKind(ObjectRole role) {
        return switch (role) {
            case TABLE -> ObjectKind.UNKNOWN;
            case FUNCTION -> ObjectKind.FUNCTION;
            case PROCEDURE -> ObjectKind.PROCEDURE;
        };
    }

    private void call(IdentifierChain chain, Scope scope) {
        if (chain.size() >= 2 && SqlKeywords.isValueMethod(chain.last())) {
            // column.value(...), alias.column.nodes(...)
            free(chain.dropLast(), scope);
            return;
        }
        if (chain.size() == 1) {
            return;
        }
        if (chain.size() == 2) {
            if (tree.lookup(scope, chain.part(0)) != null) {
                return;
            }
            String schema = schemaOrDefault(chain.part(0));
            String name = chain.part(1);
            ObjectKind kind = registry.objectKind(TableKey.of(schema, name));
            if (kind != null) {
                addKnownObject(schema, name, kind);
            } else if (registry.isKnownSchema(schema)) {
                addKnownObject(schema, name, ObjectKind.FUNCTION);
            }
            return;
        }
        if (tree.lookup(scope, chain.part(0)) != null) {
            free(chain.dropLast(), scope);
            return;
        }
        external(chain);
    }

    // ---- free chains ----

    private void free(IdentifierChain chain, Scope scope) {
        if (chain.isStar()) {
            qualifiedStar(chain, scope);
            return;
        }
        switch (chain.size()) {
            case 1:
                unqualified(chain, scope);
                break;
            case 2:
                twoPart(chain.part(0), chain.part(1), scope);
                break;
            case 3:
                threePart(chain, scope);
                break;
            default:
                external(chain);
                break;
        }
    }

    private void qualifiedStar(IdentifierChain chain, Scope scope) {
        if (chain.size() == 1) {
            ResolvedTarget target = tree.lookup(scope, chain.part(0));
            ResolvedTarget table = target == null ? null : target.concreteTable();
            if (table != null) {
                emitColumn(table, "*");
            }
        } else if (chain.size() == 2) {
            String schema = schemaOrDefault(chain.part(0));
            if (registry.hasTable(TableKey.of(schema, chain.part(1)))) {
                emitColumn(ResolvedTarget.table(schema, chain.part(1)), "*");
            }
        }
    }

    private void twoPart(String qualifier, String member, Scope scope) {
        ResolvedTarget target = tree.lookup(scope, qualifier);
        if (target != null) {
            ResolvedTarget table = target.concreteTable();
            if (table != null) {
                emitColumn(table, member);
            }
            return;
        }
        String schema = schemaOrDefault(qualifier);
        if (registry.isKnownSchema(schema)) {
            ObjectKind kind = registry.objectKind(TableKey.of(schema, member));
            if (kind != null) {
                addKnownObject(schema, member, kind);
            }
        }
    }

    private void threePart(IdentifierChain chain, Scope scope) {
        String schema = schemaOrDefault(chain.part(0));
        String table = chain.part(1);
        if (!table.isEmpty() && registry.containsObject(TableKey.of(schema, table))) {
            emitColumn(ResolvedTarget.table(schema, table), chain.part(2));
            return;
        }
        if (tree.lookup(scope, chain.part(0)) != null) {
            twoPart(chain.part(0), chain.part(1), scope);
            return;
        }
        external(chain);
    }

    private void external(IdentifierChain chain) {
        int n = chain.size();
        if (n < 3) {
            return;
        }
        String database = chain.part(n - 3);
        String schema = schemaOrDefault(chain.part(n - 2));
        addExternalObject(database, schema, chain.part(n - 1));
    }

    private void unqualified(IdentifierChain chain, Scope scope) {
        Token token = chain.first();
        String name = chain.part(0);
        int index = chain.getStartIndex();
        Token prev = index > 0 ? tokens.get(index - 1) : null;

        if (name.startsWith("#") || tree.isCursorName(name)) {
            return;
        }
        if (prev != null && (prev.is("AS") || prev.is("COLLATE") || prev.is("GOTO")
                || prev.getKind() == TokenKind.AT_VARIABLE)) {
            // type, collation or label
            return;
        }
        if (prev != null && prev.is("BY") && (name.equalsIgnoreCase("TARGET") || name.equalsIgnoreCase("SOURCE"))) {
            return;
        }
        if (isFirstArgumentOfKeywordFunction(index)) {
            return;
        }
        boolean filtered = SqlKeywords.isNeverColumn(name);
        if (filtered && !token.isBracketed()) {
            return;
        }

        ResolvedTarget qualifier = tree.columnQualifier(token.getStart());
        if (qualifier != null) {
            ResolvedTarget table = qualifier.concreteTable();
            if (table != null && (!filtered || registry.hasColumn(table.tableKey(), name))) {
                emitColumn(table, name);
            }
            return;
        }
        if (tree.lookup(scope, name) != null) {
            // alias, table or CTE name
            return;
        }

        List<Scope> chainScopes = tree.chain(scope);
        for (Scope level : chainScopes) {
            List<ResolvedTarget> candidates = new ArrayList<>();
            List<TableKey> keys = new ArrayList<>();
            for (ResolvedTarget source : level.getSources()) {
                if (source.getKind() == ResolvedTarget.Kind.LOCAL) {
                    if (source.hasLocalColumn(name)) {
                        return;
                    }
                    continue;
                }
                if (source.getKind() == ResolvedTarget.Kind.DERIVED_TABLE && derivedColumn(source, name)) {
                    return;
                }
                ResolvedTarget table = source.concreteTable();
                if (table != null) {
                    candidates.add(table);
                    keys.add(table.tableKey());
                }
            }
            List<TableKey> matches = registry.tablesWithColumn(keys, name);
            if (matches.size() == 1) {
                emitColumn(candidates.get(keys.indexOf(matches.get(0))), name);
                return;
            }
            if (matches.size() > 1) {
                // ambiguous
                return;
            }
        }

        if (!unqualifiedColumnFallback || filtered) {
            return;
        }
        for (Scope level : chainScopes) {
            if (level.hasColumnAlias(name)) {
                return;
            }
        }
        for (Scope level : chainScopes) {
            if (level.getSources().isEmpty()) {
                continue;
            }
            ResolvedTarget first = level.getSources().get(0).concreteTable();
            if (first != null) {
                emitColumn(first, name);
            }
            return;
        }
    }

    /**
     * Whether the select list of a derived table names {@code column} as one of its aliases.
     */
    private boolean derivedColumn(ResolvedTarget derived, String column) {
        Scope inner = tree.scope(derived.getScopeId());
        if (inner.hasColumnAlias(column)) {
            return true;
        }
        for (Scope child : tree.children(inner)) {
            if (child.getKind() == ScopeKind.UNION_BRANCH && child.hasColumnAlias(column)) {
                return true;
            }
        }
        return false;
    }

    private boolean isFirstArgumentOfKeywordFunction(int index) {
        if (index < 2 || !tokens.get(index - 1).isPunct('(')) {
            return false;
        }
        Token function = tokens.get(index - 2);
        return (function.isIdentifier() || function.getKind() == TokenKind.KEYWORD)
                && SqlKeywords.takesKeywordFirstArgument(function.value());
    }

    private void star(Scope scope) {
        for (Scope level : tree.chain(scope)) {
            if (level.getSources().isEmpty()) {
                continue;
            }
            ResolvedTarget first = level.getSources().get(0).concreteTable();
            if (first != null) {
                emitColumn(first, "*");
            }
            return;
        }
    }

    // ---- emission ----

    private void emitColumn(ResolvedTarget table, String column) {
        TableKey key = table.tableKey();
        String schema = registry.canonicalSchema(table.getSchema());
        String name = registry.canonicalName(key, table.getName());
        String canonicalColumn = "*".equals(column) ? column : registry.canonicalColumn(key, column);
        addColumn(schema, name, canonicalColumn);
    }

    private void addKnownObject(String schema, String name, ObjectKind kind) {
        TableKey key = TableKey.of(schema, name);
        addObject(registry.canonicalSchema(schema), registry.canonicalName(key, name), kind);
    }

    private String schemaOrDefault(String schema) {
        return schema == null || schema.isEmpty() ? defaultSchema : schema;
    }

    private boolean isTriggerTable(String name) {
        return name.equalsIgnoreCase("inserted") || name.equalsIgnoreCase("deleted");
    }

    private boolean punct(int i, char c) {
        return i >= 0 && i < tokens.size() && tokens.get(i).isPunct(c);
    }
}
