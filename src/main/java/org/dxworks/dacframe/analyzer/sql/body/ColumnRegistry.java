package org.dxworks.dacframe.analyzer.sql.body;

import org.dxworks.dacframe.model.sql.ColumnDefinition;
import org.dxworks.dacframe.model.sql.ObjectKind;
import org.dxworks.dacframe.model.sql.SchemaModel;
import org.dxworks.dacframe.model.sql.SchemaObject;
import org.dxworks.dacframe.model.sql.TableDefinition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Case-insensitive index of the columns of every table in a schema model, plus the names
 * and kinds of all other objects bodies can reference.
 * <p>
 * Built once, before any body is resolved, and never changed afterwards, so one instance
 * can be shared by any number of concurrent resolutions.
 */
public final class ColumnRegistry {

    private static final String DEFAULT_SCHEMA = "dbo";

    private final Map<TableKey, Map<String, String>> columnsByTable;
    private final Map<TableKey, SchemaObject> objects;
    private final Map<String, String> schemas;

    private ColumnRegistry(Map<TableKey, Map<String, String>> columnsByTable,
                           Map<TableKey, SchemaObject> objects,
                           Map<String, String> schemas) {
        this.columnsByTable = columnsByTable;
        this.objects = objects;
        this.schemas = schemas;
    }

    public static ColumnRegistry empty() {
        return new ColumnRegistry(Map.of(), Map.of(), Map.of(DEFAULT_SCHEMA, DEFAULT_SCHEMA));
    }

    public static ColumnRegistry build(SchemaModel model) {
        return build(model, DEFAULT_SCHEMA);
    }

    /**
     * Indexes {@code model}; objects declared without a schema land in {@code defaultSchema}.
     * A table declared twice keeps its last declaration.
     */
    public static ColumnRegistry build(SchemaModel model, String defaultSchema) {
        Map<TableKey, Map<String, String>> columnsByTable = new HashMap<>();
        Map<TableKey, SchemaObject> objects = new HashMap<>();
        Map<String, String> schemas = new HashMap<>();
        schemas.put(defaultSchema.toLowerCase(Locale.ROOT), defaultSchema);

        if (model != null) {
            for (TableDefinition table : model.tables) {
                SchemaObject entry = register(table, defaultSchema, objects, schemas);
                if (entry == null) continue;
                Map<String, String> columns = new LinkedHashMap<>();
                for (ColumnDefinition column : table.columns) {
                    if (column.name != null && !column.name.isEmpty()) {
                        columns.put(column.name.toLowerCase(Locale.ROOT), column.name);
                    }
                }
                columnsByTable.put(TableKey.of(entry.schema, entry.name), Collections.unmodifiableMap(columns));
            }
            for (SchemaObject routine : model.routines) {
                register(routine, defaultSchema, objects, schemas);
            }
            for (SchemaObject other : model.otherObjects) {
                register(other, defaultSchema, objects, schemas);
            }
        }

        return new ColumnRegistry(Collections.unmodifiableMap(columnsByTable),
                Collections.unmodifiableMap(objects),
                Collections.unmodifiableMap(schemas));
    }

    private static SchemaObject register(SchemaObject object, String defaultSchema,
                                         Map<TableKey, SchemaObject> objects, Map<String, String> schemas) {
        if (object == null || object.name == null || object.name.isEmpty()) {
            return null;
        }
        SchemaObject entry = new SchemaObject();
        entry.schema = (object.schema == null || object.schema.isEmpty()) ? defaultSchema : object.schema;
        entry.name = object.name;
        entry.kind = object.kind == null ? ObjectKind.UNKNOWN : object.kind;
        entry.filePath = object.filePath;
        objects.put(TableKey.of(entry.schema, entry.name), entry);
        schemas.putIfAbsent(entry.schema.toLowerCase(Locale.ROOT), entry.schema);
        return entry;
    }

    public boolean hasColumn(TableKey table, String column) {
        if (table == null || column == null) return false;
        Map<String, String> columns = columnsByTable.get(table);
        return columns != null && columns.containsKey(column.toLowerCase(Locale.ROOT));
    }

    /**
     * The candidates declaring {@code column}, in candidate order and without repeats.
     */
    public List<TableKey> tablesWithColumn(List<TableKey> candidates, String column) {
        Set<TableKey> matches = new LinkedHashSet<>();
        for (TableKey candidate : candidates) {
            if (hasColumn(candidate, column)) {
                matches.add(candidate);
            }
        }
        return new ArrayList<>(matches);
    }

    public boolean hasTable(TableKey table) {
        return columnsByTable.containsKey(table);
    }

    public boolean containsObject(TableKey key) {
        return objects.containsKey(key);
    }

    /**
     * Kind of the object registered under {@code key}, or null when there is none.
     */
    public ObjectKind objectKind(TableKey key) {
        SchemaObject entry = objects.get(key);
        return entry == null ? null : entry.kind;
    }

    public boolean isKnownSchema(String schema) {
        return schema != null && schemas.containsKey(schema.toLowerCase(Locale.ROOT));
    }

    public String canonicalSchema(String schema) {
        if (schema == null) return null;
        return schemas.getOrDefault(schema.toLowerCase(Locale.ROOT), schema);
    }

    /**
     * Declared spelling of the object name, or {@code fallback} when the object is unknown.
     */
    public String canonicalName(TableKey key, String fallback) {
        SchemaObject entry = objects.get(key);
        return entry == null ? fallback : entry.name;
    }

    public String canonicalColumn(TableKey table, String column) {
        Map<String, String> columns = columnsByTable.get(table);
        if (columns == null || column == null) return column;
        return columns.getOrDefault(column.toLowerCase(Locale.ROOT), column);
    }

    public Set<String> tableColumns(TableKey table) {
        Map<String, String> columns = columnsByTable.get(table);
        return columns == null ? Set.of() : new HashSet<>(columns.values());
    }

    public int tableCount() {
        return columnsByTable.size();
    }
}
