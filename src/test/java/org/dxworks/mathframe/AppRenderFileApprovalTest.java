package org.dxworks.mathframe;

import org.approvaltests.Approvals;
import org.dxworks.mathframe.model.FileRendering;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.dxworks.mathframe.TestUtils.APPROVAL_MAPPER;

public class AppRenderFileApprovalTest {

    @Test
    void render_Html_InlineFormulas() throws IOException {
        verify(Paths.get("src/test/resources/samples/documents/inline-formulas.html"));
    }

    @Test
    void render_Markdown_Radicals() throws IOException {
        verify(Paths.get("src/test/resources/samples/documents/radicals.md"));
    }

    @Test
    void render_Text_WithoutFormulas() throws IOException {
        verify(Paths.get("src/test/resources/samples/documents/plain.txt"));
    }

    private static void verify(Path file) throws IOException {
        FileRendering rendering = App.renderFile(file, MathframeConfig.defaults());
        Approvals.verify(APPROVAL_MAPPER.writeValueAsString(rendering) + "\n");
    }
}
