package org.dxworks.dacframe.analyzer.sql.body;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * One lexical scope of a body: a character range, the aliases bound in it and the
 * table sources of its FROM clause, in order.
 */
public final class Scope {

    private final int id;
    private final ScopeKind kind;
    private final int start;
    private final int end;
    private final int parentId;
    private final Map<String, ResolvedTarget> aliases = new LinkedHashMap<>();
    private final Set<String> selfAliases = new HashSet<>();
    private final List<ResolvedTarget> sources = new ArrayList<>();
    private final Set<String> columnAliases = new HashSet<>();

    Scope(int id, ScopeKind kind, int start, int end, int parentId) {
        this.id = id;
        this.kind = kind;
        this.start = start;
        this.end = end;
        this.parentId = parentId;
    }

    public int getId() {
        return id;
    }

    public ScopeKind getKind() {
        return kind;
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    /**
     * Id of the enclosing scope, -1 for the top level.
     */
    public int getParentId() {
        return parentId;
    }

    public boolean contains(int offset) {
        return start <= offset && offset < end;
    }

    public ResolvedTarget alias(String name) {
        return aliases.get(fold(name));
    }

    public Map<String, ResolvedTarget> getAliases() {
        return Collections.unmodifiableMap(aliases);
    }

    public List<ResolvedTarget> getSources() {
        return Collections.unmodifiableList(sources);
    }

    public boolean hasColumnAlias(String name) {
        return columnAliases.contains(fold(name));
    }

    void bindAlias(String name, ResolvedTarget target) {
        String key = fold(name);
        aliases.put(key, target);
        selfAliases.remove(key);
    }

    /**
     * Binds the bare name of a table source. An explicit alias of the same name wins; two
     * different tables sharing a bare name make it ambiguous.
     */
    void bindSelfAlias(String name, ResolvedTarget target) {
        String key = fold(name);
        ResolvedTarget existing = aliases.get(key);
        if (existing == null) {
            aliases.put(key, target);
            selfAliases.add(key);
        } else if (selfAliases.contains(key) && !existing.sameAs(target)) {
            aliases.put(key, ResolvedTarget.unknown());
        }
    }

    void bindIfAbsent(String name, ResolvedTarget target) {
        aliases.putIfAbsent(fold(name), target);
    }

    void addSource(ResolvedTarget target) {
        sources.add(target);
    }

    void addColumnAlias(String name) {
        columnAliases.add(fold(name));
    }

    private static String fold(String name) {
        return name.toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return kind + "#" + id + "[" + start + "," + end + ")";
    }
}
