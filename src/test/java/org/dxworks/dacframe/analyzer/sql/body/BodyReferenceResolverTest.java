package org.dxworks.dacframe.analyzer.sql.body;

import org.dxworks.dacframe.DacframeConfig;
import org.dxworks.dacframe.model.sql.BodyDependency;
import org.dxworks.dacframe.model.sql.ObjectKind;
import org.dxworks.dacframe.model.sql.RoutineDefinition;
import org.dxworks.dacframe.model.sql.SchemaModel;
import org.dxworks.dacframe.model.sql.TableDefinition;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class BodyReferenceResolverTest {

    private static ColumnRegistry registry(TableDefinition... tables) {
        SchemaModel model = new SchemaModel();
        model.tables.addAll(Arrays.asList(tables));
        return ColumnRegistry.build(model);
    }

    private static List<String> resolve(ColumnRegistry registry, String body) {
        return resolve(registry, DacframeConfig.defaults(), BodyContext.of(body));
    }

    private static List<String> resolve(ColumnRegistry registry, DacframeConfig config, BodyContext context) {
        return render(new BodyReferenceResolver(registry, config).analyze(context));
    }

    private static List<String> render(RoutineBodyAnalyzer.Result result) {
        List<String> out = new ArrayList<>();
        for (BodyDependency dependency : result.dependencies) {
            out.add(dependency.toString());
        }
        return out;
    }

    @Test
    void aliasQualifiedColumnResolvesToTheTable() {
        ColumnRegistry registry = registry(new TableDefinition("dbo", "Account", "Id", "Name"));

        assertEquals(List.of("COLUMN [dbo].[Account].[Id]"),
                resolve(registry, "SELECT A.Id FROM Account A"));
    }

    @Test
    void derivedTableAliasIsNotADependency() {
        ColumnRegistry registry = registry(new TableDefinition("dbo", "Tag", "Id"));

        assertEquals(List.of("COLUMN [dbo].[Tag].[Id]"),
                resolve(registry, "SELECT T.Id FROM (SELECT Id FROM Tag) T"));
    }

    @Test
    void mergeClauseWordsNeverBecomeColumns() {
        ColumnRegistry registry = registry(new TableDefinition("dbo", "X", "Id"));

        List<String> refs = resolve(registry,
                "MERGE INTO X AS TARGET USING (SELECT 1) AS SOURCE ON TARGET.Id = SOURCE.Id");

        assertEquals(List.of("COLUMN [dbo].[X].[Id]"), refs);
    }

    @Test
    void repeatedColumnsAreReportedOnce() {
        ColumnRegistry registry = registry(new TableDefinition("dbo", "T", "a", "b"));

        assertEquals(List.of("COLUMN [dbo].[T].[a]", "COLUMN [dbo].[T].[b]"),
                resolve(registry, "SELECT a, b FROM T GROUP BY a, a, b"));
    }

    @Test
    void unqualifiedColumnGoesToTheOnlyTableDeclaringIt() {
        ColumnRegistry registry = registry(
                new TableDefinition("dbo", "EntityTypeDefaults", "Id", "UserId"),
                new TableDefinition("dbo", "Users", "Id", "Name"));

        assertEquals(List.of(
                        "COLUMN [dbo].[EntityTypeDefaults].[UserId]",
                        "COLUMN [dbo].[Users].[Id]",
                        "COLUMN [dbo].[Users].[Name]"),
                resolve(registry, "SELECT Name FROM EntityTypeDefaults e JOIN Users u ON u.Id = e.UserId"));
    }

    @Test
    void reservedWordIsAColumnOnlyWhenBracketedAndDeclared() {
        ColumnRegistry registry = registry(new TableDefinition("dbo", "Orders", "Id", "Order"));

        assertEquals(List.of("COLUMN [dbo].[Orders].[Order]"), resolve(registry, "SELECT [Order] FROM Orders"));
        assertEquals(List.of(), resolve(registry, "SELECT [Merge] FROM Orders"));
        assertEquals(List.of(), resolve(registry, "SELECT Order FROM Orders"));
    }

    @Test
    void largeBodyResolvesInLinearTime() {
        ColumnRegistry registry = registry(new TableDefinition("dbo", "Users", "Id", "Name"));
        StringBuilder body = new StringBuilder();
        for (int i = 0; i < 20000; i++) {
            body.append("SELECT u.Name FROM Users u WHERE u.Id = (SELECT MAX(Id) FROM Users);\n");
        }

        List<String> refs = assertTimeout(Duration.ofSeconds(10), () -> resolve(registry, body.toString()));

        assertEquals(List.of("COLUMN [dbo].[Users].[Id]", "COLUMN [dbo].[Users].[Name]"), refs);
    }

    @Test
    void ambiguousColumnIsDropped() {
        ColumnRegistry registry = registry(
                new TableDefinition("dbo", "A", "Id", "Name"),
                new TableDefinition("dbo", "B", "Id", "AId", "Name"));

        assertEquals(List.of("COLUMN [dbo].[A].[Id]", "COLUMN [dbo].[B].[AId]"),
                resolve(registry, "SELECT Name FROM A JOIN B ON A.Id = B.AId"));
    }

    @Test
    void bareTableNameAndAliasAreNotColumns() {
        ColumnRegistry registry = registry(new TableDefinition("dbo", "Account", "Id"));

        assertEquals(List.of(), resolve(registry, "SELECT A, Account FROM Account A"));
    }

    @Test
    void resolvingTwiceGivesTheSameOutput() {
        ColumnRegistry registry = registry(
                new TableDefinition("dbo", "Account", "Id", "Name"),
                new TableDefinition("dbo", "Orders", "Id", "AccountId", "Total"));
        String body = "WITH totals AS (SELECT AccountId, SUM(Total) AS Total FROM Orders GROUP BY AccountId) "
                + "SELECT a.Name, t.Total FROM Account a JOIN totals t ON t.AccountId = a.Id";

        assertEquals(resolve(registry, body), resolve(registry, body));
    }

    @Test
    void cteNameIsNeverAnObject() {
        ColumnRegistry registry = registry(new TableDefinition("dbo", "Account", "Id"));
        DacframeConfig emitTables = DacframeConfig.with("dbo", 64, true, true, true);

        assertEquals(List.of("OBJECT [dbo].[Account]", "COLUMN [dbo].[Account].[Id]"),
                resolve(registry, emitTables, BodyContext.of("WITH c AS (SELECT Id FROM Account) SELECT c.Id FROM c")));
    }

    @Test
    void cteColumnFollowsTheFirstTableOnlyWhenEnabled() {
        ColumnRegistry registry = registry(new TableDefinition("dbo", "Account", "Id", "Balance"));
        BodyContext context = BodyContext.of("WITH c AS (SELECT * FROM Account) SELECT c.Balance FROM c");

        assertEquals(List.of("COLUMN [dbo].[Account].[*]", "COLUMN [dbo].[Account].[Balance]"),
                resolve(registry, DacframeConfig.with("dbo", 64, true, true), context));
        assertEquals(List.of("COLUMN [dbo].[Account].[*]"),
                resolve(registry, DacframeConfig.with("dbo", 64, false, true), context));
    }

    @Test
    void unknownColumnFallsBackToFirstTableOnlyWhenEnabled() {
        ColumnRegistry registry = registry(new TableDefinition("dbo", "Account", "Id"));
        BodyContext context = BodyContext.of("SELECT Foo FROM Account");

        assertEquals(List.of("COLUMN [dbo].[Account].[Foo]"),
                resolve(registry, DacframeConfig.with("dbo", 64, true, true), context));
        assertEquals(List.of(),
                resolve(registry, DacframeConfig.with("dbo", 64, true, false), context));
    }

    @Test
    void configuredDefaultSchemaAppliesToUnqualifiedNames() {
        ColumnRegistry registry = ColumnRegistry.build(new SchemaModel(), "sales");

        assertEquals(List.of("COLUMN [sales].[Invoice].[Total]"),
                resolve(registry, DacframeConfig.with("sales", 64, true, true),
                        BodyContext.of("SELECT i.Total FROM Invoice i")));
    }

    @Test
    void depthCapIsReportedAndDeeperScopesAreSkipped() {
        RoutineBodyAnalyzer.Result result = new BodyReferenceResolver(ColumnRegistry.empty(),
                DacframeConfig.with("dbo", 1, true, true))
                .analyze(BodyContext.of("SELECT x.Id FROM (SELECT Id FROM (SELECT Id FROM Deep) d) x"));

        assertTrue(result.dependencies.isEmpty());
        assertEquals(1, result.diagnostics.size());
        assertTrue(result.diagnostics.get(0).startsWith("Scope nesting deeper than 1"));
    }

    @Test
    void unterminatedLiteralIsReportedAndResolutionContinues() {
        ColumnRegistry registry = registry(new TableDefinition("dbo", "Account", "Id", "Name"));
        String body = "SELECT Id FROM Account WHERE Name = 'abc";

        RoutineBodyAnalyzer.Result result = new BodyReferenceResolver(registry).analyze(BodyContext.of(body));

        assertEquals(List.of("COLUMN [dbo].[Account].[Id]", "COLUMN [dbo].[Account].[Name]"), render(result));
        assertEquals(List.of("Unterminated literal at offset " + body.indexOf('\'')
                + "; the rest of the body was not resolved"), result.diagnostics);
    }

    @Test
    void missingRegistryIsRejected() {
        assertThrows(NullPointerException.class, () -> new BodyReferenceResolver(null));
    }

    @Test
    void emptyBodyHasNoDependencies() {
        RoutineBodyAnalyzer.Result result = new BodyReferenceResolver(ColumnRegistry.empty()).analyze(BodyContext.of(""));

        assertTrue(result.dependencies.isEmpty());
        assertTrue(result.diagnostics.isEmpty());
    }

    @Test
    void triggerPseudoTablesResolveToTheParentTable() {
        ColumnRegistry registry = registry(new TableDefinition("dbo", "Orders", "Id", "Total"));

        assertEquals(List.of("COLUMN [dbo].[Orders].[Total]"),
                resolve(registry, DacframeConfig.defaults(),
                        BodyContext.of("SELECT i.Total FROM inserted i").withTriggerParent("dbo", "Orders")));
        assertEquals(List.of("COLUMN [dbo].[Orders].[Total]"),
                resolve(registry, DacframeConfig.defaults(),
                        BodyContext.of("SELECT Total FROM deleted").withTriggerParent(null, "Orders")));
    }

    @Test
    void updateAndParametersOfTheOwningProcedure() {
        ColumnRegistry registry = registry(new TableDefinition("dbo", "Account", "Id", "Balance"));
        BodyContext context = BodyContext.of("UPDATE dbo.Account SET Balance = Balance + @amount WHERE Id = @id")
                .withOwner("dbo", "Deposit", ObjectKind.PROCEDURE)
                .withParameter("@amount")
                .withParameter("id");

        assertEquals(List.of(
                        "OBJECT [dbo].[Account]",
                        "COLUMN [dbo].[Account].[Balance]",
                        "COLUMN [dbo].[Account].[Id]",
                        "PARAMETER [dbo].[Deposit].[@amount]",
                        "PARAMETER [dbo].[Deposit].[@id]"),
                resolve(registry, DacframeConfig.defaults(), context));
    }

    @Test
    void insertColumnListBelongsToTheTarget() {
        ColumnRegistry registry = registry(
                new TableDefinition("dbo", "AuditLog", "Id", "AccountId", "Note"),
                new TableDefinition("dbo", "Account", "Id", "Name"));

        assertEquals(List.of(
                        "OBJECT [dbo].[Account]",
                        "OBJECT [dbo].[AuditLog]",
                        "COLUMN [dbo].[Account].[Id]",
                        "COLUMN [dbo].[Account].[Name]",
                        "COLUMN [dbo].[AuditLog].[AccountId]",
                        "COLUMN [dbo].[AuditLog].[Note]"),
                resolve(registry, "INSERT INTO dbo.AuditLog (AccountId, Note) SELECT Id, Name FROM dbo.Account"));
    }

    @Test
    void mergeResolvesTargetAndSourceColumns() {
        ColumnRegistry registry = registry(
                new TableDefinition("dbo", "Account", "Id", "Balance"),
                new TableDefinition("dbo", "Staging", "Id", "Balance"));
        String body = "MERGE dbo.Account AS t\n"
                + "USING dbo.Staging AS s ON t.Id = s.Id\n"
                + "WHEN MATCHED THEN UPDATE SET Balance = s.Balance\n"
                + "WHEN NOT MATCHED THEN INSERT (Id, Balance) VALUES (s.Id, s.Balance);";

        assertEquals(List.of(
                        "OBJECT [dbo].[Account]",
                        "OBJECT [dbo].[Staging]",
                        "COLUMN [dbo].[Account].[Balance]",
                        "COLUMN [dbo].[Account].[Id]",
                        "COLUMN [dbo].[Staging].[Balance]",
                        "COLUMN [dbo].[Staging].[Id]"),
                resolve(registry, body));
    }

    @Test
    void applyAndCorrelatedSubqueriesSeeOuterAliases() {
        ColumnRegistry registry = registry(
                new TableDefinition("dbo", "Account", "Id"),
                new TableDefinition("dbo", "Orders", "AccountId", "Amount"));

        assertEquals(List.of(
                        "COLUMN [dbo].[Account].[Id]",
                        "COLUMN [dbo].[Orders].[AccountId]",
                        "COLUMN [dbo].[Orders].[Amount]"),
                resolve(registry, "SELECT a.Id, x.Total FROM Account a CROSS APPLY "
                        + "(SELECT SUM(Amount) AS Total FROM Orders o WHERE o.AccountId = a.Id) x"));

        ColumnRegistry users = registry(
                new TableDefinition("dbo", "Users", "Id", "Name"),
                new TableDefinition("dbo", "Orders", "UserId"));
        assertEquals(List.of(
                        "COLUMN [dbo].[Orders].[UserId]",
                        "COLUMN [dbo].[Users].[Id]",
                        "COLUMN [dbo].[Users].[Name]"),
                resolve(users, "SELECT Name FROM Users u WHERE EXISTS (SELECT 1 FROM Orders WHERE UserId = u.Id)"));
    }

    @Test
    void unionBranchesResolveIndependently() {
        ColumnRegistry registry = registry(new TableDefinition("dbo", "A", "Id"), new TableDefinition("dbo", "B", "Id"));

        assertEquals(List.of("COLUMN [dbo].[A].[Id]", "COLUMN [dbo].[B].[Id]"),
                resolve(registry, "SELECT Id FROM A UNION ALL SELECT Id FROM B"));
    }

    @Test
    void windowFunctionClausesResolveColumns() {
        ColumnRegistry registry = registry(new TableDefinition("dbo", "Orders", "Id", "AccountId", "CreatedAt"));

        assertEquals(List.of("COLUMN [dbo].[Orders].[AccountId]", "COLUMN [dbo].[Orders].[CreatedAt]"),
                resolve(registry, "SELECT ROW_NUMBER() OVER (PARTITION BY AccountId ORDER BY CreatedAt) AS rn FROM Orders"));
    }

    @Test
    void crossDatabaseNameIsCapturedAsExternal() {
        RoutineBodyAnalyzer.Result result = new BodyReferenceResolver(ColumnRegistry.empty())
                .analyze(BodyContext.of("SELECT x.Id FROM OtherDb.dbo.Customer x"));

        assertEquals(List.of("OBJECT [OtherDb].[dbo].[Customer]"), render(result));
        assertEquals(ObjectKind.EXTERNAL, result.dependencies.get(0).objectKind);
        assertEquals("OtherDb", result.dependencies.get(0).database);
    }

    @Test
    void executedProcedureAndCalledFunctionAreObjects() {
        SchemaModel model = new SchemaModel();
        model.tables.add(new TableDefinition("dbo", "Account", "Id"));
        RoutineDefinition log = new RoutineDefinition();
        log.schema = "dbo";
        log.name = "usp_Log";
        log.kind = ObjectKind.PROCEDURE;
        model.routines.add(log);
        BodyReferenceResolver resolver = new BodyReferenceResolver(ColumnRegistry.build(model));

        RoutineBodyAnalyzer.Result exec = resolver.analyze(BodyContext.of("EXEC dbo.usp_Log @msg = 'x'"));
        assertEquals(List.of("OBJECT [dbo].[usp_Log]"), render(exec));
        assertEquals(ObjectKind.PROCEDURE, exec.dependencies.get(0).objectKind);

        RoutineBodyAnalyzer.Result call = resolver.analyze(BodyContext.of("SELECT dbo.fn_Total(Id) FROM Account"));
        assertEquals(List.of("OBJECT [dbo].[fn_Total]", "COLUMN [dbo].[Account].[Id]"), render(call));
        assertEquals(ObjectKind.FUNCTION, call.dependencies.get(0).objectKind);
    }

    @Test
    void tableVariableColumnsAreLocal() {
        ColumnRegistry registry = registry(new TableDefinition("dbo", "Account", "Label"));

        assertEquals(List.of(),
                resolve(registry, "DECLARE @t TABLE (Id INT, Label NVARCHAR(10)); SELECT Label FROM @t"));
        assertEquals(List.of(),
                resolve(registry, "CREATE TABLE #tmp (Id INT); SELECT Id FROM #tmp"));
    }

    @Test
    void declaredBuiltInTypesAreDependencies() {
        ColumnRegistry registry = registry(new TableDefinition("dbo", "Account", "Id"));

        assertEquals(List.of("BUILT_IN_TYPE [int]"),
                resolve(registry, "DECLARE @count INT; SELECT @count = COUNT(*) FROM Account"));
    }
}
