package org.iconoglott.tools;

import org.iconoglott.compiler.Compiler;
import org.iconoglott.compiler.api.ICompiler;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@Tag("unit")
public class RenderToolTest {

    @Test
    void testRenderReturnsDocument() {
        // Act
        String output = new RenderTool(new Compiler()).render("circle 10\n  fill #0a0");

        // Assert
        assertThat(output).startsWith("<svg").contains("<circle cx=\"0\" cy=\"0\" r=\"10\" fill=\"#0a0\"/>");
    }

    @Test
    void testFailureBecomesInlineErrorText() {
        // Arrange
        ICompiler failing = mock(ICompiler.class);
        when(failing.render(anyString())).thenThrow(new IllegalStateException("out of ink"));

        // Act
        String output = new RenderTool(failing).render("rect");

        // Assert
        assertThat(output).isEqualTo(RenderTool.ERROR_PREFIX + "out of ink");
    }
}
