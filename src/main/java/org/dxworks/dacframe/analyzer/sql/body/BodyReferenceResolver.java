package org.dxworks.dacframe.analyzer.sql.body;

import org.dxworks.dacframe.DacframeConfig;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Resolves the dependencies of one body against a {@link ColumnRegistry}.
 * <p>
 * Instances hold no per-body state and can be shared by concurrent callers. The registry has
 * to be complete before the first body is resolved: a body resolved against a partial registry
 * falls back to guesses for the columns it could not find.
 */
public class BodyReferenceResolver implements RoutineBodyAnalyzer {

    private final ColumnRegistry registry;
    private final DacframeConfig config;

    public BodyReferenceResolver(ColumnRegistry registry) {
        this(registry, DacframeConfig.defaults());
    }

    public BodyReferenceResolver(ColumnRegistry registry, DacframeConfig config) {
        this.registry = Objects.requireNonNull(registry, "column registry must be built before resolving bodies");
        this.config = config == null ? DacframeConfig.defaults() : config;
    }

    @Override
    public Result analyze(BodyContext context) {
        Result result = new Result();
        if (context == null) {
            return result;
        }
        String defaultSchema = (context.getDefaultSchema() != null && !context.getDefaultSchema().isBlank())
                ? context.getDefaultSchema()
                : config.getDefaultSchema();

        TokenScanner scanner = new TokenScanner(context.getBody());
        List<Token> significant = new ArrayList<>();
        for (Token token : scanner) {
            if (token.isUnterminated()) {
                result.diagnostics.add((token.getKind() == TokenKind.COMMENT ? "Unterminated comment" : "Unterminated literal")
                        + " at offset " + token.getStart() + "; the rest of the body was not resolved");
            }
            if (token.isSignificant()) {
                significant.add(token);
            }
        }

        ResolvedTarget triggerParent = null;
        if (context.getParentTable() != null && !context.getParentTable().isBlank()) {
            String parentSchema = context.getParentSchema() == null || context.getParentSchema().isBlank()
                    ? defaultSchema
                    : context.getParentSchema();
            triggerParent = ResolvedTarget.table(parentSchema, context.getParentTable());
        }

        ScopeTree tree = new ScopeExtractor(significant, scanner.getText().length(), defaultSchema,
                config.getMaxScopeDepth(), config.isCteFirstTableApproximation()).extract(triggerParent);
        ReferenceResolver resolver = new ReferenceResolver(significant, tree, registry, context, defaultSchema, config);
        resolver.resolve();

        result.dependencies.addAll(DependencySetBuilder.build(resolver.getDependencies()));
        result.diagnostics.addAll(tree.getDiagnostics());
        return result;
    }
}
