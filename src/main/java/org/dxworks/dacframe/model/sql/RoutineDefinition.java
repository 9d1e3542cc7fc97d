package org.dxworks.dacframe.model.sql;

import java.util.ArrayList;
import java.util.List;

/**
 * A view, procedure, function or trigger together with the raw text of its body.
 */
public class RoutineDefinition extends SchemaObject {
    public List<ParameterDefinition> parameters = new ArrayList<>();
    public String returnType;  // functions only
    public String body;

    // Triggers only
    public String parentSchema;
    public String parentTable;
    public String timing;  // AFTER, INSTEAD OF
    public List<String> events = new ArrayList<>();  // INSERT, UPDATE, DELETE
}
