package org.dxworks.dacframe.model.sql;

public class ColumnDefinition {
    public String name;
    public String type;
    public boolean nullable = true;

    public ColumnDefinition() {
    }

    public ColumnDefinition(String name, String type) {
        this.name = name;
        this.type = type;
    }
}
