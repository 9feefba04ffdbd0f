package org.iconoglott.tools;

import org.iconoglott.compiler.api.ICompiler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The rendering entry point offered to AI tool integrations. Failures are reported inline
 * in the returned text instead of being thrown.
 */
public class RenderTool {

    private static final Logger LOG = LoggerFactory.getLogger(RenderTool.class);
    static final String ERROR_PREFIX = "Error rendering iconoglott: ";

    private final ICompiler compiler;

    public RenderTool(ICompiler compiler) {
        this.compiler = compiler;
    }

    /**
     * @param code The DSL source text.
     * @return The SVG document, or a line starting with {@value #ERROR_PREFIX}.
     */
    public String render(String code) {
        try {
            return compiler.render(code);
        } catch (RuntimeException e) {
            LOG.warn("Tool render failed: {}", e.getMessage(), e);
            return ERROR_PREFIX + e.getMessage();
        }
    }
}
