package org.dxworks.dacframe.model.sql;

import java.util.ArrayList;
import java.util.List;

/**
 * Everything the loader found in a project: tables with their columns, bodies to resolve,
 * and other named objects (synonyms, sequences) that bodies may reference.
 */
public class SchemaModel {
    public List<TableDefinition> tables = new ArrayList<>();
    public List<RoutineDefinition> routines = new ArrayList<>();
    public List<SchemaObject> otherObjects = new ArrayList<>();
    public List<String> diagnostics = new ArrayList<>();
}
