package org.iconoglott.compiler.backend.emit;

import org.iconoglott.compiler.frontend.lexer.NumberText;

/**
 * Escaping and attribute helpers for the emitted markup.
 */
public final class Markup {

    private Markup() {
        // Utility class
    }

    /**
     * Escapes the three reserved markup characters of element content.
     * @param text The raw text.
     * @return The escaped text.
     */
    public static String escapeText(String text) {
        return text.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;");
    }

    /**
     * Escapes a value for use inside a double-quoted attribute.
     * @param value The raw value.
     * @return The escaped value.
     */
    public static String escapeAttribute(String value) {
        return escapeText(value).replace("\"", "&quot;");
    }

    /**
     * @return <code> name="value"</code> with the value escaped.
     */
    public static String attr(String name, String value) {
        return " " + name + "=\"" + escapeAttribute(value) + "\"";
    }

    /**
     * @return <code> name="value"</code> with the number formatted by {@link NumberText}.
     */
    public static String attr(String name, double value) {
        return " " + name + "=\"" + NumberText.format(value) + "\"";
    }
}
