package org.dxworks.dacframe.analyzer.sql.body;

import org.dxworks.dacframe.model.sql.ObjectKind;
import org.dxworks.dacframe.model.sql.ParameterDefinition;
import org.dxworks.dacframe.model.sql.RoutineDefinition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A body to resolve together with what is known about the object that owns it.
 */
public final class BodyContext {

    private String schema;
    private String name;
    private ObjectKind kind = ObjectKind.UNKNOWN;
    private String body = "";
    private String defaultSchema;
    private final List<String> parameters = new ArrayList<>();
    private String parentSchema;
    private String parentTable;

    public static BodyContext of(String body) {
        return new BodyContext().withBody(body);
    }

    public static BodyContext from(RoutineDefinition routine) {
        BodyContext context = new BodyContext()
                .withOwner(routine.schema, routine.name, routine.kind)
                .withBody(routine.body);
        for (ParameterDefinition parameter : routine.parameters) {
            context.withParameter(parameter.name);
        }
        if (routine.parentTable != null) {
            context.withTriggerParent(routine.parentSchema, routine.parentTable);
        }
        return context;
    }

    public BodyContext withOwner(String schema, String name, ObjectKind kind) {
        this.schema = schema;
        this.name = name;
        this.kind = kind == null ? ObjectKind.UNKNOWN : kind;
        return this;
    }

    public BodyContext withBody(String body) {
        this.body = body == null ? "" : body;
        return this;
    }

    /**
     * Overrides the configured default schema for this body only.
     */
    public BodyContext withDefaultSchema(String defaultSchema) {
        this.defaultSchema = defaultSchema;
        return this;
    }

    public BodyContext withParameter(String parameter) {
        if (parameter != null && !parameter.isBlank()) {
            String trimmed = parameter.trim();
            parameters.add(trimmed.startsWith("@") ? trimmed : "@" + trimmed);
        }
        return this;
    }

    public BodyContext withTriggerParent(String parentSchema, String parentTable) {
        this.parentSchema = parentSchema;
        this.parentTable = parentTable;
        return this;
    }

    public String getSchema() {
        return schema;
    }

    public String getName() {
        return name;
    }

    public ObjectKind getKind() {
        return kind;
    }

    public String getBody() {
        return body;
    }

    public String getDefaultSchema() {
        return defaultSchema;
    }

    public List<String> getParameters() {
        return Collections.unmodifiableList(parameters);
    }

    public String getParentSchema() {
        return parentSchema;
    }

    public String getParentTable() {
        return parentTable;
    }
}
