package org.dxworks.dacframe.analyzer.sql.body;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Scopes of one body kept in an arena and addressed by id, together with the
 * position-keyed facts the structural scan found: where aliases are defined, where
 * syntax guarantees an object name, which ranges are never resolved.
 */
public final class ScopeTree {

    public enum ObjectRole {
        TABLE,
        FUNCTION,
        PROCEDURE
    }

    private final List<Scope> scopes = new ArrayList<>();
    private final Map<Integer, List<Scope>> childrenByParent = new HashMap<>();
    private int[] innermostByOffset;
    private final Set<Integer> aliasDefinitions = new HashSet<>();
    private final Map<Integer, ObjectRole> objectPositions = new HashMap<>();
    private final Map<Integer, ResolvedTarget> columnQualifiers = new HashMap<>();
    private final Set<Integer> selectStars = new HashSet<>();
    private final BitSet ignored = new BitSet();
    private final Map<String, Set<String>> localTables = new HashMap<>();
    private final Set<String> cursorNames = new HashSet<>();
    private final Set<String> declaredTypes = new LinkedHashSet<>();
    private final List<String> diagnostics = new ArrayList<>();

    Scope addScope(ScopeKind kind, int start, int end, int parentId) {
        Scope scope = new Scope(scopes.size(), kind, start, end, parentId);
        scopes.add(scope);
        childrenByParent.computeIfAbsent(parentId, id -> new ArrayList<>()).add(scope);
        innermostByOffset = null;
        return scope;
    }

    public List<Scope> getScopes() {
        return Collections.unmodifiableList(scopes);
    }

    public Scope scope(int id) {
        return scopes.get(id);
    }

    public Scope root() {
        return scopes.get(0);
    }

    /**
     * The innermost scope whose range contains {@code offset}.
     */
    public Scope scopeAt(int offset) {
        int[] index = innermostIndex();
        if (offset < 0 || offset >= index.length) {
            return root();
        }
        return scopes.get(index[offset]);
    }

    /**
     * Scope id per offset, built by painting scopes widest first so that the narrowest one
     * (the later one on equal width) ends up on top.
     */
    private int[] innermostIndex() {
        if (innermostByOffset == null) {
            int length = Math.max(0, root().getEnd());
            int[] index = new int[length];
            List<Scope> byWidth = new ArrayList<>(scopes);
            byWidth.sort(Comparator.comparingInt((Scope s) -> s.getEnd() - s.getStart()).reversed()
                    .thenComparingInt(Scope::getId));
            for (Scope scope : byWidth) {
                int from = Math.max(0, scope.getStart());
                int to = Math.min(length, scope.getEnd());
                for (int i = from; i < to; i++) {
                    index[i] = scope.getId();
                }
            }
            innermostByOffset = index;
        }
        return innermostByOffset;
    }

    /**
     * {@code scope} followed by its ancestors, innermost first.
     */
    public List<Scope> chain(Scope scope) {
        List<Scope> out = new ArrayList<>();
        Scope current = scope;
        while (current != null) {
            out.add(current);
            current = current.getParentId() < 0 ? null : scopes.get(current.getParentId());
        }
        return out;
    }

    public List<Scope> children(Scope parent) {
        return childrenByParent.getOrDefault(parent.getId(), List.of());
    }

    /**
     * Looks {@code alias} up from {@code scope} outwards; the first binding wins.
     */
    public ResolvedTarget lookup(Scope scope, String alias) {
        for (Scope s : chain(scope)) {
            ResolvedTarget target = s.alias(alias);
            if (target != null) {
                return target;
            }
        }
        return null;
    }

    void addAliasDefinition(int offset) {
        aliasDefinitions.add(offset);
    }

    public boolean isAliasDefinition(int offset) {
        return aliasDefinitions.contains(offset);
    }

    void addObjectPosition(int offset, ObjectRole role) {
        objectPositions.putIfAbsent(offset, role);
    }

    public ObjectRole objectRole(int offset) {
        return objectPositions.get(offset);
    }

    void setColumnQualifier(int offset, ResolvedTarget target) {
        columnQualifiers.put(offset, target);
    }

    /**
     * Table an unqualified column at {@code offset} belongs to by syntax (UPDATE SET and INSERT
     * column lists), or null.
     */
    public ResolvedTarget columnQualifier(int offset) {
        return columnQualifiers.get(offset);
    }

    void addSelectStar(int offset) {
        selectStars.add(offset);
    }

    public boolean isSelectStar(int offset) {
        return selectStars.contains(offset);
    }

    void addIgnoredRange(int start, int end) {
        if (end > start) {
            ignored.set(Math.max(0, start), end);
        }
    }

    public boolean isIgnored(int offset) {
        return offset >= 0 && ignored.get(offset);
    }

    void declareLocalTable(String name, Set<String> columns) {
        localTables.put(name.toLowerCase(Locale.ROOT), columns);
    }

    /**
     * Case-folded columns declared for a table variable or temp table; empty when unknown.
     */
    public Set<String> localColumns(String name) {
        return localTables.getOrDefault(name.toLowerCase(Locale.ROOT), Set.of());
    }

    void addCursorName(String name) {
        cursorNames.add(name.toLowerCase(Locale.ROOT));
    }

    public boolean isCursorName(String name) {
        return cursorNames.contains(name.toLowerCase(Locale.ROOT));
    }

    void addDeclaredType(String typeName) {
        declaredTypes.add(typeName.toLowerCase(Locale.ROOT));
    }

    public Set<String> getDeclaredTypes() {
        return Collections.unmodifiableSet(declaredTypes);
    }

    void addDiagnostic(String message) {
        diagnostics.add(message);
    }

    public List<String> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }
}
