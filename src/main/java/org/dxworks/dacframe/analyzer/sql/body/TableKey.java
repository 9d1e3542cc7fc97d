package org.dxworks.dacframe.analyzer.sql.body;

import java.util.Locale;
import java.util.Objects;

/**
 * Case-folded {@code schema.name} key of a schema object.
 */
public final class TableKey {

    private final String schema;
    private final String name;

    private TableKey(String schema, String name) {
        this.schema = schema;
        this.name = name;
    }

    public static TableKey of(String schema, String name) {
        Objects.requireNonNull(schema, "schema");
        Objects.requireNonNull(name, "name");
        return new TableKey(schema.toLowerCase(Locale.ROOT), name.toLowerCase(Locale.ROOT));
    }

    public String getSchema() {
        return schema;
    }

    public String getName() {
        return name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TableKey)) return false;
        TableKey that = (TableKey) o;
        return schema.equals(that.schema) && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(schema, name);
    }

    @Override
    public String toString() {
        return "[" + schema + "].[" + name + "]";
    }
}
