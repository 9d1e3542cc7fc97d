package org.dxworks.dacframe.model.sql;

public class SchemaObject {
    public String schema;  // optional, default schema applies when missing
    public String name;
    public ObjectKind kind;
    public String filePath;
}
