package org.dxworks.dacframe.analyzer.sql;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class SqlPreprocessorTest {

    @Test
    void splitsOnGoLines() {
        List<String> batches = SqlPreprocessor.splitBatches("CREATE TABLE A (Id INT)\nGO\nCREATE TABLE B (Id INT)\ngo\n");

        assertEquals(List.of("CREATE TABLE A (Id INT)", "CREATE TABLE B (Id INT)"), batches);
    }

    @Test
    void goWithRepeatCountIsASeparator() {
        List<String> batches = SqlPreprocessor.splitBatches("SELECT 1\r\n  GO 5 \r\nSELECT 2");

        assertEquals(List.of("SELECT 1", "SELECT 2"), batches);
    }

    @Test
    void gotoLineIsNotASeparator() {
        List<String> batches = SqlPreprocessor.splitBatches("BEGIN\nGOTO done\ndone:\nEND");

        assertEquals(1, batches.size());
        assertTrue(batches.get(0).contains("GOTO done"));
    }

    @Test
    void blankBatchesAreDropped() {
        assertTrue(SqlPreprocessor.splitBatches("GO\n\nGO\n").isEmpty());
        assertTrue(SqlPreprocessor.splitBatches(null).isEmpty());
    }
}
