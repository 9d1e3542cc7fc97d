package org.dxworks.dacframe.analyzer.sql.body;

import org.dxworks.dacframe.model.sql.BodyDependency;

import java.util.ArrayList;
import java.util.List;

public interface RoutineBodyAnalyzer {
    class Result {
        public final List<BodyDependency> dependencies = new ArrayList<>();
        public final List<String> diagnostics = new ArrayList<>();
    }

    /**
     * Analyze a view, procedure, function or trigger body and list what it depends on.
     *
     * @param context the body text and the object that owns it
     * @return Result with an ordered, duplicate-free dependency list; lists possibly empty
     */
    Result analyze(BodyContext context);
}
