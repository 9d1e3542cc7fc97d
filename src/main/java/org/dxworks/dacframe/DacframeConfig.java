package org.dxworks.dacframe;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

public class DacframeConfig {

    private static final int DEFAULT_MAX_FILE_LINES = 20000;
    private static final String CONFIG_FILE_NAME = "dacframe-config.yml";
    private static final String DEFAULT_SCHEMA = "dbo";
    private static final int DEFAULT_MAX_SCOPE_DEPTH = 64;
    private static final boolean DEFAULT_CTE_FIRST_TABLE_APPROXIMATION = true;
    private static final boolean DEFAULT_UNQUALIFIED_COLUMN_FALLBACK = true;
    private static final boolean DEFAULT_EMIT_UNQUALIFIED_TABLE_REFERENCES = false;

    private final int maxFileLines;
    private final String defaultSchema;
    private final int maxScopeDepth;
    private final boolean cteFirstTableApproximation;
    private final boolean unqualifiedColumnFallback;
    private final boolean emitUnqualifiedTableReferences;

    private DacframeConfig(int maxFileLines, String defaultSchema, int maxScopeDepth,
                           boolean cteFirstTableApproximation, boolean unqualifiedColumnFallback,
                           boolean emitUnqualifiedTableReferences) {
        this.maxFileLines = maxFileLines;
        this.defaultSchema = defaultSchema;
        this.maxScopeDepth = maxScopeDepth;
        this.cteFirstTableApproximation = cteFirstTableApproximation;
        this.unqualifiedColumnFallback = unqualifiedColumnFallback;
        this.emitUnqualifiedTableReferences = emitUnqualifiedTableReferences;
    }

    public int getMaxFileLines() {
        return maxFileLines;
    }

    /**
     * Schema applied to every unqualified object name in a body, regardless of the schema
     * of the object that owns the body.
     */
    public String getDefaultSchema() {
        return defaultSchema;
    }

    public int getMaxScopeDepth() {
        return maxScopeDepth;
    }

    /**
     * When set, {@code cte.column} resolves to the first table of the CTE's own FROM clause.
     */
    public boolean isCteFirstTableApproximation() {
        return cteFirstTableApproximation;
    }

    /**
     * When set, an unqualified column no in-scope table declares is attributed to the first
     * table of the innermost scope that has one.
     */
    public boolean isUnqualifiedColumnFallback() {
        return unqualifiedColumnFallback;
    }

    /**
     * When set, unqualified table names in FROM/JOIN positions that the registry knows are
     * emitted as object references too.
     */
    public boolean isEmitUnqualifiedTableReferences() {
        return emitUnqualifiedTableReferences;
    }

    public static DacframeConfig defaults() {
        return new DacframeConfig(DEFAULT_MAX_FILE_LINES, DEFAULT_SCHEMA, DEFAULT_MAX_SCOPE_DEPTH,
                DEFAULT_CTE_FIRST_TABLE_APPROXIMATION, DEFAULT_UNQUALIFIED_COLUMN_FALLBACK,
                DEFAULT_EMIT_UNQUALIFIED_TABLE_REFERENCES);
    }

    public static DacframeConfig load() {
        return load(Paths.get(CONFIG_FILE_NAME));
    }

    public static DacframeConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            return defaults();
        }

        try {
            ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
            YamlConfig yamlConfig = yamlMapper.readValue(configPath.toFile(), YamlConfig.class);
            if (yamlConfig != null) {
                int effectiveMaxFileLines = (yamlConfig.maxFileLines != null && yamlConfig.maxFileLines > 0)
                        ? yamlConfig.maxFileLines
                        : DEFAULT_MAX_FILE_LINES;
                String effectiveDefaultSchema = (yamlConfig.defaultSchema != null && !yamlConfig.defaultSchema.isBlank())
                        ? yamlConfig.defaultSchema.trim()
                        : DEFAULT_SCHEMA;
                int effectiveMaxScopeDepth = (yamlConfig.maxScopeDepth != null && yamlConfig.maxScopeDepth > 0)
                        ? yamlConfig.maxScopeDepth
                        : DEFAULT_MAX_SCOPE_DEPTH;
                boolean effectiveCteApproximation = (yamlConfig.cteFirstTableApproximation != null)
                        ? yamlConfig.cteFirstTableApproximation
                        : DEFAULT_CTE_FIRST_TABLE_APPROXIMATION;
                boolean effectiveFallback = (yamlConfig.unqualifiedColumnFallback != null)
                        ? yamlConfig.unqualifiedColumnFallback
                        : DEFAULT_UNQUALIFIED_COLUMN_FALLBACK;
                boolean effectiveTableReferences = (yamlConfig.emitUnqualifiedTableReferences != null)
                        ? yamlConfig.emitUnqualifiedTableReferences
                        : DEFAULT_EMIT_UNQUALIFIED_TABLE_REFERENCES;

                return new DacframeConfig(effectiveMaxFileLines, effectiveDefaultSchema, effectiveMaxScopeDepth,
                        effectiveCteApproximation, effectiveFallback, effectiveTableReferences);
            }
        } catch (IOException e) {
            System.err.println("Could not read " + configPath + ", using defaults: " + e.getMessage());
        }

        return defaults();
    }

    public static DacframeConfig with(String defaultSchema, int maxScopeDepth,
                                      boolean cteFirstTableApproximation, boolean unqualifiedColumnFallback) {
        return with(defaultSchema, maxScopeDepth, cteFirstTableApproximation, unqualifiedColumnFallback,
                DEFAULT_EMIT_UNQUALIFIED_TABLE_REFERENCES);
    }

    public static DacframeConfig with(String defaultSchema, int maxScopeDepth,
                                      boolean cteFirstTableApproximation, boolean unqualifiedColumnFallback,
                                      boolean emitUnqualifiedTableReferences) {
        String effectiveDefaultSchema = (defaultSchema != null && !defaultSchema.isBlank()) ? defaultSchema : DEFAULT_SCHEMA;
        int effectiveMaxScopeDepth = maxScopeDepth > 0 ? maxScopeDepth : DEFAULT_MAX_SCOPE_DEPTH;
        return new DacframeConfig(DEFAULT_MAX_FILE_LINES, effectiveDefaultSchema, effectiveMaxScopeDepth,
                cteFirstTableApproximation, unqualifiedColumnFallback, emitUnqualifiedTableReferences);
    }

    private static class YamlConfig {
        public Integer maxFileLines;
        public String defaultSchema;
        public Integer maxScopeDepth;
        public Boolean cteFirstTableApproximation;
        public Boolean unqualifiedColumnFallback;
        public Boolean emitUnqualifiedTableReferences;
    }
}
