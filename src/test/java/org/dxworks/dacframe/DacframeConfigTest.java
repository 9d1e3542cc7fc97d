package org.dxworks.dacframe;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class DacframeConfigTest {

    @TempDir
    Path tempDir;

    @Test
    void missingFileGivesDefaults() {
        DacframeConfig config = DacframeConfig.load(tempDir.resolve("absent.yml"));

        assertEquals(20000, config.getMaxFileLines());
        assertEquals("dbo", config.getDefaultSchema());
        assertEquals(64, config.getMaxScopeDepth());
        assertTrue(config.isCteFirstTableApproximation());
        assertTrue(config.isUnqualifiedColumnFallback());
        assertFalse(config.isEmitUnqualifiedTableReferences());
    }

    @Test
    void readsValuesFromYaml() throws Exception {
        Path file = tempDir.resolve("dacframe-config.yml");
        Files.writeString(file, "maxFileLines: 500\n"
                + "defaultSchema: sales\n"
                + "maxScopeDepth: 8\n"
                + "cteFirstTableApproximation: false\n"
                + "unqualifiedColumnFallback: false\n"
                + "emitUnqualifiedTableReferences: true\n");

        DacframeConfig config = DacframeConfig.load(file);

        assertEquals(500, config.getMaxFileLines());
        assertEquals("sales", config.getDefaultSchema());
        assertEquals(8, config.getMaxScopeDepth());
        assertFalse(config.isCteFirstTableApproximation());
        assertFalse(config.isUnqualifiedColumnFallback());
        assertTrue(config.isEmitUnqualifiedTableReferences());
    }

    @Test
    void invalidValuesFallBackToDefaults() throws Exception {
        Path file = tempDir.resolve("dacframe-config.yml");
        Files.writeString(file, "maxFileLines: -3\ndefaultSchema: '  '\nmaxScopeDepth: 0\n");

        DacframeConfig config = DacframeConfig.load(file);

        assertEquals(20000, config.getMaxFileLines());
        assertEquals("dbo", config.getDefaultSchema());
        assertEquals(64, config.getMaxScopeDepth());
    }

    @Test
    void unreadableFileGivesDefaults() throws Exception {
        Path file = tempDir.resolve("dacframe-config.yml");
        Files.writeString(file, "unknownKey: 1\n");

        assertEquals("dbo", DacframeConfig.load(file).getDefaultSchema());
    }

    @Test
    void programmaticConfigReplacesBlankValues() {
        DacframeConfig config = DacframeConfig.with(null, 0, false, true);

        assertEquals("dbo", config.getDefaultSchema());
        assertEquals(64, config.getMaxScopeDepth());
        assertFalse(config.isCteFirstTableApproximation());
    }
}
