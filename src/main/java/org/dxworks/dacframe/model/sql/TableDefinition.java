package org.dxworks.dacframe.model.sql;

import java.util.ArrayList;
import java.util.List;

public class TableDefinition extends SchemaObject {
    public List<ColumnDefinition> columns = new ArrayList<>();

    public TableDefinition() {
        this.kind = ObjectKind.TABLE;
    }

    public TableDefinition(String schema, String name, String... columnNames) {
        this();
        this.schema = schema;
        this.name = name;
        for (String columnName : columnNames) {
            columns.add(new ColumnDefinition(columnName, null));
        }
    }
}
