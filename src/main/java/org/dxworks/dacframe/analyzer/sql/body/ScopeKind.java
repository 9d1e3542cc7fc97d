package org.dxworks.dacframe.analyzer.sql.body;

public enum ScopeKind {
    TOP_LEVEL,
    STATEMENT,
    CTE,
    DERIVED_TABLE,
    APPLY,
    CORRELATED_SUBQUERY,
    UNION_BRANCH
}
