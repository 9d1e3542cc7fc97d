package org.dxworks.dacframe;

import org.approvaltests.Approvals;
import org.dxworks.dacframe.model.sql.BodyAnalysis;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import static org.dxworks.dacframe.TestUtils.APPROVAL_MAPPER;

public class AppAnalyzeProjectApprovalTest {

    @Test
    void analyze_SQL_Project() throws IOException {
        verify(Paths.get("src/test/resources/samples/sql/project"));
    }

    private static void verify(Path input) throws IOException {
        List<BodyAnalysis> analyses = App.analyzeProject(input, DacframeConfig.defaults());
        Approvals.verify(APPROVAL_MAPPER.writeValueAsString(analyses));
    }
}
