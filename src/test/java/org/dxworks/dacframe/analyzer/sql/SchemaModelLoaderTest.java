package org.dxworks.dacframe.analyzer.sql;

import org.dxworks.dacframe.model.sql.ColumnDefinition;
import org.dxworks.dacframe.model.sql.ObjectKind;
import org.dxworks.dacframe.model.sql.ParameterDefinition;
import org.dxworks.dacframe.model.sql.RoutineDefinition;
import org.dxworks.dacframe.model.sql.SchemaModel;
import org.dxworks.dacframe.model.sql.TableDefinition;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class SchemaModelLoaderTest {

    private static SchemaModel load(String sql) {
        return new SchemaModelLoader().load(Map.of("schema.sql", sql));
    }

    @Test
    void readsTableColumnsAndNullability() {
        SchemaModel model = load("\uFEFFCREATE TABLE [dbo].[Account] (\n"
                + "    [Id] INT NOT NULL,\n"
                + "    [Name] NVARCHAR(100) NULL\n"
                + ");\nGO\n");

        assertEquals(1, model.tables.size());
        TableDefinition table = model.tables.get(0);
        assertEquals("dbo", table.schema);
        assertEquals("Account", table.name);
        assertEquals("schema.sql", table.filePath);
        assertEquals(2, table.columns.size());
        assertEquals("Id", table.columns.get(0).name);
        assertFalse(table.columns.get(0).nullable);
        assertEquals("Name", table.columns.get(1).name);
        assertTrue(table.columns.get(1).nullable);
    }

    @Test
    void fallbackReadsColumnListJSqlParserMayReject() {
        TableDefinition table = SchemaModelLoader.parseTableFallback(
                "CREATE TABLE dbo.Weird ([Id] INT IDENTITY(1,1) NOT NULL, [Total] AS ([Qty] * [Price]), "
                        + "CONSTRAINT PK_Weird PRIMARY KEY ([Id]))");

        assertNotNull(table);
        assertEquals("dbo", table.schema);
        assertEquals("Weird", table.name);
        assertEquals(2, table.columns.size());
        ColumnDefinition id = table.columns.get(0);
        assertEquals("Id", id.name);
        assertEquals("INT", id.type);
        assertFalse(id.nullable);
        ColumnDefinition total = table.columns.get(1);
        assertEquals("Total", total.name);
        assertNull(total.type);
    }

    @Test
    void fallbackIgnoresBatchesWithoutATable() {
        assertNull(SchemaModelLoader.parseTableFallback("CREATE VIEW v AS SELECT 1"));
    }

    @Test
    void tempTablesAreNotRegistered() {
        assertTrue(load("CREATE TABLE #work (Id INT)").tables.isEmpty());
    }

    @Test
    void readsProcedureParameters() {
        SchemaModel model = load("CREATE PROCEDURE [dbo].[GetBalance]\n"
                + "    @id INT,\n"
                + "    @balance DECIMAL(18, 2) OUTPUT\n"
                + "AS\n"
                + "SELECT @balance = Balance FROM dbo.Account WHERE Id = @id\n");

        assertEquals(1, model.routines.size());
        RoutineDefinition procedure = model.routines.get(0);
        assertEquals(ObjectKind.PROCEDURE, procedure.kind);
        assertEquals("dbo", procedure.schema);
        assertEquals("GetBalance", procedure.name);
        assertEquals(2, procedure.parameters.size());
        ParameterDefinition id = procedure.parameters.get(0);
        assertEquals("@id", id.name);
        assertEquals("INT", id.type);
        assertFalse(id.output);
        ParameterDefinition balance = procedure.parameters.get(1);
        assertEquals("@balance", balance.name);
        assertEquals("DECIMAL(18,2)", balance.type);
        assertTrue(balance.output);
        assertTrue(procedure.body.startsWith("SELECT @balance"));
    }

    @Test
    void readsFunctionReturnTypes() {
        SchemaModel model = load("CREATE FUNCTION dbo.fn_Total(@accountId INT)\n"
                + "RETURNS DECIMAL(18, 2)\n"
                + "AS\n"
                + "BEGIN\n"
                + "    RETURN (SELECT SUM(Total) FROM dbo.Orders WHERE AccountId = @accountId)\n"
                + "END\n"
                + "GO\n"
                + "CREATE FUNCTION dbo.fn_Open()\n"
                + "RETURNS TABLE\n"
                + "AS\n"
                + "RETURN SELECT Id FROM dbo.Account\n");

        assertEquals(2, model.routines.size());
        RoutineDefinition scalar = model.routines.get(0);
        assertEquals(ObjectKind.FUNCTION, scalar.kind);
        assertEquals("DECIMAL(18,2)", scalar.returnType);
        assertEquals(List.of("@accountId"), scalar.parameters.stream().map(p -> p.name).toList());
        assertTrue(scalar.body.startsWith("BEGIN"));

        RoutineDefinition inline = model.routines.get(1);
        assertEquals("TABLE", inline.returnType);
        assertTrue(inline.parameters.isEmpty());
        assertTrue(inline.body.startsWith("RETURN SELECT"));
    }

    @Test
    void viewWithoutSchemaKeepsSchemaUnset() {
        RoutineDefinition view = load("CREATE OR ALTER VIEW v_Accounts AS SELECT Id FROM Account").routines.get(0);

        assertEquals(ObjectKind.VIEW, view.kind);
        assertNull(view.schema);
        assertEquals("v_Accounts", view.name);
        assertEquals("SELECT Id FROM Account", view.body);
    }

    @Test
    void readsTriggerHeaders() {
        SchemaModel model = load("CREATE TRIGGER [dbo].[trg_Audit] ON [dbo].[Account]\n"
                + "AFTER INSERT, UPDATE\n"
                + "AS\n"
                + "SELECT 1\n"
                + "GO\n"
                + "CREATE TRIGGER trg_Purge ON dbo.Orders FOR DELETE AS SELECT 2\n"
                + "GO\n"
                + "CREATE TRIGGER trg_Ddl ON DATABASE FOR CREATE_TABLE AS SELECT 3\n");

        assertEquals(3, model.routines.size());
        RoutineDefinition audit = model.routines.get(0);
        assertEquals(ObjectKind.TRIGGER, audit.kind);
        assertEquals("trg_Audit", audit.name);
        assertEquals("dbo", audit.parentSchema);
        assertEquals("Account", audit.parentTable);
        assertEquals("AFTER", audit.timing);
        assertEquals(List.of("INSERT", "UPDATE"), audit.events);
        assertEquals("SELECT 1", audit.body);

        RoutineDefinition purge = model.routines.get(1);
        assertEquals("AFTER", purge.timing);
        assertEquals(List.of("DELETE"), purge.events);

        RoutineDefinition ddl = model.routines.get(2);
        assertNull(ddl.parentTable);
        assertEquals(List.of("CREATE_TABLE"), ddl.events);
    }

    @Test
    void recordsSynonymsAndSequences() {
        SchemaModel model = load("CREATE SYNONYM dbo.Customer FOR OtherDb.dbo.Customer\n"
                + "GO\n"
                + "CREATE SEQUENCE dbo.OrderNumbers START WITH 1\n");

        assertEquals(2, model.otherObjects.size());
        assertEquals(ObjectKind.SYNONYM, model.otherObjects.get(0).kind);
        assertEquals("Customer", model.otherObjects.get(0).name);
        assertEquals(ObjectKind.SEQUENCE, model.otherObjects.get(1).kind);
        assertEquals("OrderNumbers", model.otherObjects.get(1).name);
    }

    @Test
    void ignoresStatementsThatDefineNothing() {
        SchemaModel model = load("INSERT INTO dbo.Account (Id) VALUES (1)\nGO\nALTER TABLE dbo.Account ADD Extra INT\n");

        assertTrue(model.tables.isEmpty());
        assertTrue(model.routines.isEmpty());
        assertTrue(model.otherObjects.isEmpty());
        assertTrue(model.diagnostics.isEmpty());
    }

    @Test
    void keepsFileOrderAcrossSources() {
        Map<String, String> sources = new LinkedHashMap<>();
        sources.put("b.sql", "CREATE VIEW dbo.B AS SELECT 1");
        sources.put("a.sql", "CREATE VIEW dbo.A AS SELECT 1");

        SchemaModel model = new SchemaModelLoader().load(sources);

        assertEquals("B", model.routines.get(0).name);
        assertEquals("b.sql", model.routines.get(0).filePath);
        assertEquals("A", model.routines.get(1).name);
        assertEquals("a.sql", model.routines.get(1).filePath);
    }
}
