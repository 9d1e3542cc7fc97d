package org.dxworks.dacframe.analyzer.sql.body;

import org.dxworks.dacframe.model.sql.BodyDependency;
import org.dxworks.dacframe.model.sql.ObjectKind;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Collects the dependencies found while walking a body, in discovery order and without repeats.
 */
public class DependencyCollector {

    protected final Set<BodyDependency> dependencies = new LinkedHashSet<>();

    public List<BodyDependency> getDependencies() {
        return new ArrayList<>(dependencies);
    }

    /**
     * Adds an object reference if schema and name are non-empty.
     */
    protected void addObject(String schema, String name, ObjectKind kind) {
        if (isPresent(schema) && isPresent(name)) {
            dependencies.add(BodyDependency.objectRef(schema.trim(), name.trim(), kind));
        }
    }

    protected void addExternalObject(String database, String schema, String name) {
        if (isPresent(name)) {
            dependencies.add(BodyDependency.externalObjectRef(
                    isPresent(database) ? database.trim() : null,
                    isPresent(schema) ? schema.trim() : null,
                    name.trim()));
        }
    }

    /**
     * Adds a column reference if all three parts are non-empty.
     */
    protected void addColumn(String schema, String table, String column) {
        if (isPresent(schema) && isPresent(table) && isPresent(column)) {
            dependencies.add(BodyDependency.columnRef(schema.trim(), table.trim(), column.trim()));
        }
    }

    protected void addParameter(String schema, String routine, String parameter) {
        if (isPresent(routine) && isPresent(parameter)) {
            dependencies.add(BodyDependency.parameterRef(schema, routine.trim(), parameter.trim()));
        }
    }

    protected void addBuiltInType(String typeName) {
        if (isPresent(typeName)) {
            dependencies.add(BodyDependency.builtInType(typeName.trim()));
        }
    }

    private static boolean isPresent(String s) {
        return s != null && !s.trim().isEmpty();
    }
}
