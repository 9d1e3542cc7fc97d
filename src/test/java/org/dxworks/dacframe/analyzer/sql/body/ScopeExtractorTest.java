package org.dxworks.dacframe.analyzer.sql.body;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ScopeExtractorTest {

    private static ScopeTree extract(String sql) {
        return extract(sql, 64, true);
    }

    private static ScopeTree extract(String sql, int maxDepth, boolean cteFirstTable) {
        return new ScopeExtractor(new TokenScanner(sql).significantTokens(), sql.length(), "dbo", maxDepth, cteFirstTable)
                .extract(null);
    }

    private static long count(ScopeTree tree, ScopeKind kind) {
        return tree.getScopes().stream().filter(s -> s.getKind() == kind).count();
    }

    @Test
    void eachStatementBindsItsOwnAliases() {
        String sql = "SELECT a.Id FROM Account a; SELECT a.Id FROM Orders a";
        ScopeTree tree = extract(sql);

        assertEquals(2, count(tree, ScopeKind.STATEMENT));
        Scope first = tree.scopeAt(sql.indexOf("a.Id"));
        Scope second = tree.scopeAt(sql.lastIndexOf("a.Id"));
        assertEquals("Account", tree.lookup(first, "a").getName());
        assertEquals("Orders", tree.lookup(second, "A").getName());
    }

    @Test
    void tableAliasAndBareTableNameAreBound() {
        String sql = "SELECT A.Id FROM Account A";
        ScopeTree tree = extract(sql);
        Scope scope = tree.scopeAt(0);

        assertEquals(ResolvedTarget.table("dbo", "Account"), tree.lookup(scope, "a"));
        assertEquals(ResolvedTarget.table("dbo", "Account"), tree.lookup(scope, "account"));
        assertTrue(tree.isAliasDefinition(sql.lastIndexOf("A")));
        assertEquals(ScopeTree.ObjectRole.TABLE, tree.objectRole(sql.indexOf("Account")));
    }

    @Test
    void derivedTableGetsAChildScope() {
        String sql = "SELECT T.Id FROM (SELECT Id FROM Tag) T";
        ScopeTree tree = extract(sql);

        assertEquals(1, count(tree, ScopeKind.DERIVED_TABLE));
        ResolvedTarget t = tree.lookup(tree.scopeAt(0), "T");
        assertEquals(ResolvedTarget.Kind.DERIVED_TABLE, t.getKind());
        Scope inner = tree.scope(t.getScopeId());
        assertEquals(inner, tree.scopeAt(sql.indexOf("Tag")));
        assertEquals(ResolvedTarget.table("dbo", "Tag"), inner.getSources().get(0));
    }

    @Test
    void cteResolvesToItsFirstTable() {
        String sql = "WITH c AS (SELECT Id FROM Account) SELECT c.Id FROM c";
        ScopeTree tree = extract(sql);

        assertEquals(1, count(tree, ScopeKind.CTE));
        ResolvedTarget c = tree.lookup(tree.scopeAt(sql.indexOf("c.Id")), "c");
        assertEquals(ResolvedTarget.Kind.CTE, c.getKind());
        assertEquals(ResolvedTarget.table("dbo", "Account"), c.concreteTable());
    }

    @Test
    void cteStaysOpaqueWithoutFirstTableApproximation() {
        String sql = "WITH c AS (SELECT Id FROM Account) SELECT c.Id FROM c";
        ScopeTree tree = extract(sql, 64, false);

        ResolvedTarget c = tree.lookup(tree.scopeAt(sql.indexOf("c.Id")), "c");
        assertEquals(ResolvedTarget.Kind.CTE, c.getKind());
        assertNull(c.concreteTable());
    }

    @Test
    void applyAndCorrelatedSubqueriesAreScopes() {
        String sql = "SELECT a.Id FROM Account a CROSS APPLY (SELECT TOP 1 o.Id FROM Orders o WHERE o.AccountId = a.Id) x "
                + "WHERE EXISTS (SELECT 1 FROM Tag WHERE Tag.AccountId = a.Id)";
        ScopeTree tree = extract(sql);

        assertEquals(1, count(tree, ScopeKind.APPLY));
        assertEquals(1, count(tree, ScopeKind.CORRELATED_SUBQUERY));
        Scope apply = tree.scopeAt(sql.indexOf("o.AccountId"));
        assertEquals(ScopeKind.APPLY, apply.getKind());
        assertEquals("Account", tree.lookup(apply, "a").getName());
    }

    @Test
    void unionBranchesAreSeparateScopes() {
        String sql = "SELECT Id FROM A UNION ALL SELECT Id FROM B";
        ScopeTree tree = extract(sql);

        assertEquals(2, count(tree, ScopeKind.UNION_BRANCH));
        assertEquals("A", tree.scopeAt(sql.indexOf("Id")).getSources().get(0).getName());
        assertEquals("B", tree.scopeAt(sql.lastIndexOf("Id")).getSources().get(0).getName());
    }

    @Test
    void updateSetColumnsAreQualifiedByTheTarget() {
        String sql = "UPDATE dbo.Account SET Balance = 0 WHERE Id = 1";
        ScopeTree tree = extract(sql);

        assertEquals(ResolvedTarget.table("dbo", "Account"), tree.columnQualifier(sql.indexOf("Balance")));
        assertNull(tree.columnQualifier(sql.indexOf("Id")));
    }

    @Test
    void tableVariableColumnsAreDeclared() {
        ScopeTree tree = extract("DECLARE @t TABLE (Id INT, Label NVARCHAR(10)), @n INT");

        assertEquals(java.util.Set.of("id", "label"), tree.localColumns("@T"));
        assertTrue(tree.getDeclaredTypes().contains("int"));
    }

    @Test
    void depthCapStopsScopeDiscovery() {
        String sql = "SELECT x.Id FROM (SELECT Id FROM (SELECT Id FROM Deep) d) x";
        ScopeTree tree = extract(sql, 1, true);

        assertEquals(1, count(tree, ScopeKind.DERIVED_TABLE));
        assertTrue(tree.getDiagnostics().get(0).startsWith("Scope nesting deeper than 1"));
    }

    @Test
    void unclosedParenthesisIsReported() {
        String sql = "SELECT Id FROM Account WHERE (Id = 1";
        ScopeTree tree = extract(sql);

        assertEquals(1, tree.getDiagnostics().size());
        assertTrue(tree.getDiagnostics().get(0).contains("offset " + sql.indexOf('(')));
    }

    @Test
    void manyStatementsKeepTheirOwnScopes() {
        StringBuilder sql = new StringBuilder();
        for (int i = 0; i < 500; i++) {
            sql.append("SELECT t").append(i).append(".Id FROM T").append(i).append(" t").append(i)
                    .append(" WITH (NOLOCK);\n");
        }
        String text = sql.toString();
        ScopeTree tree = extract(text);

        assertEquals(500, tree.children(tree.root()).size());
        Scope last = tree.scopeAt(text.lastIndexOf("t499.Id"));
        assertEquals(ScopeKind.STATEMENT, last.getKind());
        assertEquals("T499", tree.lookup(last, "t499").getName());
        assertNull(tree.lookup(last, "t0"));
        assertTrue(tree.isIgnored(text.lastIndexOf("NOLOCK")));
        assertFalse(tree.isIgnored(text.lastIndexOf("T499")));
        assertEquals(tree.root(), tree.scopeAt(text.length() + 10));
    }

    @Test
    void sessionOptionsAreIgnored() {
        String sql = "SET NOCOUNT ON; SELECT 1";
        ScopeTree tree = extract(sql);

        assertTrue(tree.isIgnored(sql.indexOf("NOCOUNT")));
        assertFalse(tree.isIgnored(sql.indexOf("SELECT")));
    }
}
