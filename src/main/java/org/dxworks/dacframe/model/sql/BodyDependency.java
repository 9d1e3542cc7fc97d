package org.dxworks.dacframe.model.sql;

import java.util.Comparator;
import java.util.Locale;
import java.util.Objects;

/**
 * One thing a body depends on: a schema object, a column of a table, one of the routine's own
 * parameters, or a built-in type used in a DECLARE.
 * <p>
 * Identity is structural and case-insensitive, matching the default SQL Server collation;
 * the object kind is descriptive and does not take part in it.
 */
public final class BodyDependency implements Comparable<BodyDependency> {

    public enum Kind {
        OBJECT,
        COLUMN,
        PARAMETER,
        BUILT_IN_TYPE
    }

    private static final Comparator<String> PART_ORDER =
            Comparator.nullsFirst(String.CASE_INSENSITIVE_ORDER);

    public final Kind kind;
    public final String database;  // cross-database references only
    public final String schema;
    public final String name;
    public final String column;
    public final String parameter;
    public final ObjectKind objectKind;

    private BodyDependency(Kind kind, String database, String schema, String name,
                           String column, String parameter, ObjectKind objectKind) {
        this.kind = kind;
        this.database = database;
        this.schema = schema;
        this.name = name;
        this.column = column;
        this.parameter = parameter;
        this.objectKind = objectKind;
    }

    public static BodyDependency objectRef(String schema, String name, ObjectKind objectKind) {
        return new BodyDependency(Kind.OBJECT, null, schema, name, null, null, objectKind);
    }

    public static BodyDependency externalObjectRef(String database, String schema, String name) {
        return new BodyDependency(Kind.OBJECT, database, schema, name, null, null, ObjectKind.EXTERNAL);
    }

    public static BodyDependency columnRef(String schema, String table, String column) {
        return new BodyDependency(Kind.COLUMN, null, schema, table, column, null, null);
    }

    public static BodyDependency parameterRef(String schema, String routine, String parameter) {
        return new BodyDependency(Kind.PARAMETER, null, schema, routine, null, parameter, null);
    }

    public static BodyDependency builtInType(String typeName) {
        return new BodyDependency(Kind.BUILT_IN_TYPE, null, null, typeName, null, null, null);
    }

    /**
     * Renders the dependency the way relationship entries name it,
     * e.g. {@code [dbo].[Account].[Id]} or {@code [int]}.
     */
    public String toReference() {
        StringBuilder sb = new StringBuilder();
        if (database != null) {
            appendPart(sb, database);
        }
        if (schema != null) {
            appendPart(sb, schema);
        }
        appendPart(sb, name);
        if (column != null) {
            appendPart(sb, column);
        }
        if (parameter != null) {
            appendPart(sb, parameter);
        }
        return sb.toString();
    }

    private static void appendPart(StringBuilder sb, String part) {
        if (sb.length() > 0) sb.append('.');
        sb.append('[').append(part).append(']');
    }

    private String member() {
        return column != null ? column : parameter;
    }

    @Override
    public int compareTo(BodyDependency other) {
        int c = kind.compareTo(other.kind);
        if (c != 0) return c;
        c = PART_ORDER.compare(schema, other.schema);
        if (c != 0) return c;
        c = PART_ORDER.compare(name, other.name);
        if (c != 0) return c;
        c = PART_ORDER.compare(member(), other.member());
        if (c != 0) return c;
        return PART_ORDER.compare(database, other.database);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BodyDependency)) return false;
        BodyDependency that = (BodyDependency) o;
        return kind == that.kind
                && Objects.equals(fold(database), fold(that.database))
                && Objects.equals(fold(schema), fold(that.schema))
                && Objects.equals(fold(name), fold(that.name))
                && Objects.equals(fold(column), fold(that.column))
                && Objects.equals(fold(parameter), fold(that.parameter));
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, fold(database), fold(schema), fold(name), fold(column), fold(parameter));
    }

    private static String fold(String s) {
        return s == null ? null : s.toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return kind + " " + toReference();
    }
}
