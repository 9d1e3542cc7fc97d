package org.dxworks.dacframe.analyzer.sql.body;

import org.dxworks.dacframe.model.sql.BodyDependency;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public final class DependencySetBuilder {

    private DependencySetBuilder() {
        // utility class
    }

    /**
     * Deduplicates {@code raw} (the first spelling of a dependency wins) and sorts it by kind,
     * schema, name, member and database. Equal input always gives an equal sequence.
     */
    public static List<BodyDependency> build(List<BodyDependency> raw) {
        if (raw == null || raw.isEmpty()) {
            return new ArrayList<>();
        }
        Set<BodyDependency> unique = new LinkedHashSet<>();
        for (BodyDependency dependency : raw) {
            if (dependency != null) {
                unique.add(dependency);
            }
        }
        List<BodyDependency> sorted = new ArrayList<>(unique);
        Collections.sort(sorted);
        return sorted;
    }
}
