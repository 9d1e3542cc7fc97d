package org.dxworks.dacframe.analyzer.sql.body;

import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * What an alias or a table source stands for.
 */
public final class ResolvedTarget {

    public enum Kind {
        TABLE,
        CTE,
        DERIVED_TABLE,
        LOCAL,  // table variable or temp table
        UNKNOWN
    }

    private static final ResolvedTarget UNKNOWN = new ResolvedTarget(Kind.UNKNOWN, null, null, null, -1, Set.of());

    private final Kind kind;
    private final String schema;
    private final String name;
    private final ResolvedTarget underlying;
    private final int scopeId;
    private final Set<String> localColumns;

    private ResolvedTarget(Kind kind, String schema, String name, ResolvedTarget underlying,
                           int scopeId, Set<String> localColumns) {
        this.kind = kind;
        this.schema = schema;
        this.name = name;
        this.underlying = underlying;
        this.scopeId = scopeId;
        this.localColumns = localColumns;
    }

    public static ResolvedTarget table(String schema, String name) {
        return new ResolvedTarget(Kind.TABLE, schema, name, null, -1, Set.of());
    }

    /**
     * @param underlying first table of the CTE's own FROM clause, or null when none is known
     */
    public static ResolvedTarget cte(String name, ResolvedTarget underlying) {
        return new ResolvedTarget(Kind.CTE, null, name, underlying, -1, Set.of());
    }

    public static ResolvedTarget derivedTable(int scopeId) {
        return new ResolvedTarget(Kind.DERIVED_TABLE, null, null, null, scopeId, Set.of());
    }

    /**
     * @param columns case-folded names of the declared columns
     */
    public static ResolvedTarget local(String name, Set<String> columns) {
        return new ResolvedTarget(Kind.LOCAL, null, name, null, -1, columns == null ? Set.of() : Set.copyOf(columns));
    }

    public static ResolvedTarget unknown() {
        return UNKNOWN;
    }

    public Kind getKind() {
        return kind;
    }

    public String getSchema() {
        return schema;
    }

    public String getName() {
        return name;
    }

    public ResolvedTarget getUnderlying() {
        return underlying;
    }

    public int getScopeId() {
        return scopeId;
    }

    public boolean hasLocalColumn(String column) {
        return column != null && localColumns.contains(column.toLowerCase(Locale.ROOT));
    }

    /**
     * The schema table this target reads from: itself for a table, the underlying table for a
     * CTE, null for everything else.
     */
    public ResolvedTarget concreteTable() {
        if (kind == Kind.TABLE) {
            return this;
        }
        if (kind == Kind.CTE && underlying != null) {
            return underlying.concreteTable();
        }
        return null;
    }

    public TableKey tableKey() {
        ResolvedTarget table = concreteTable();
        return table == null ? null : TableKey.of(table.schema, table.name);
    }

    public boolean sameAs(ResolvedTarget other) {
        if (other == null || kind != other.kind) return false;
        return switch (kind) {
            case TABLE -> schema.equalsIgnoreCase(other.schema) && name.equalsIgnoreCase(other.name);
            case CTE, LOCAL -> name.equalsIgnoreCase(other.name);
            case DERIVED_TABLE -> scopeId == other.scopeId;
            case UNKNOWN -> true;
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ResolvedTarget)) return false;
        return sameAs((ResolvedTarget) o);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, name == null ? null : name.toLowerCase(Locale.ROOT), scopeId);
    }

    @Override
    public String toString() {
        return switch (kind) {
            case TABLE -> "TABLE[" + schema + "].[" + name + "]";
            case CTE -> "CTE " + name + " -> " + underlying;
            case DERIVED_TABLE -> "DERIVED #" + scopeId;
            case LOCAL -> "LOCAL " + name;
            case UNKNOWN -> "UNKNOWN";
        };
    }
}
