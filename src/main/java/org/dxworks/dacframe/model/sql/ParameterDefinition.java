package org.dxworks.dacframe.model.sql;

public class ParameterDefinition {
    public String name;  // including the leading @
    public String type;
    public boolean output;
    public boolean readOnly;
}
