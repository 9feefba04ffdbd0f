package org.iconoglott.compiler.frontend.parser.features.layout;

import org.iconoglott.compiler.api.CompilerErrorCode;
import org.iconoglott.compiler.diagnostics.RecoveryAction;
import org.iconoglott.compiler.frontend.lexer.Token;
import org.iconoglott.compiler.frontend.lexer.TokenType;
import org.iconoglott.compiler.frontend.parser.Literals;
import org.iconoglott.compiler.frontend.parser.ParsingContext;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Parses the options of a layout, on its header line or in its block:
 * <code>gap &lt;n&gt;</code>, <code>at &lt;x,y&gt;</code>, <code>size &lt;w&gt;x&lt;h&gt;</code>,
 * <code>justify &lt;start|end|center|space-between|space-around|space-evenly&gt;</code>,
 * <code>align &lt;start|center|end&gt;</code>, <code>padding &lt;n&gt; [n [n [n]]]</code>,
 * <code>wrap</code> and <code>center</code>, which centers on both axes.
 * <p>
 * An unknown justify or align value is reported and the default is kept. A missing value
 * is reported and the option is left unchanged.
 */
public final class LayoutPropertyParser {

    private static final Set<String> KEYS = Set.of("gap", "at", "size", "justify", "align", "padding", "wrap", "center");

    private LayoutPropertyParser() {
        // Utility class
    }

    /**
     * @param key An identifier.
     * @return {@code true} if the identifier starts a layout option.
     */
    public static boolean handles(String key) {
        return KEYS.contains(key);
    }

    /**
     * Parses one option. The current token is its name.
     * @param context The parsing context.
     * @param options The options to update.
     */
    public static void parse(ParsingContext context, LayoutOptions options) {
        Token key = context.advance();
        switch (key.text()) {
            case "gap":
                if (expect(context, key, TokenType.NUMBER, CompilerErrorCode.EXPECTED_NUMBER)) {
                    options.gap = Literals.number(context.advance());
                }
                break;
            case "at":
                if (expect(context, key, TokenType.PAIR, CompilerErrorCode.EXPECTED_PAIR)) {
                    options.at = Literals.point(context.advance());
                }
                break;
            case "size":
                if (expect(context, key, TokenType.PAIR, CompilerErrorCode.EXPECTED_PAIR)) {
                    options.size = Literals.size(context.advance());
                }
                break;
            case "justify":
                if (expect(context, key, TokenType.IDENTIFIER, CompilerErrorCode.EXPECTED_VALUE)) {
                    Token value = context.advance();
                    Optional<Justify> justify = Justify.fromName(value.text());
                    if (justify.isPresent()) {
                        options.justify = justify.get();
                    } else {
                        invalid(context, key, value, "Valid values: start, end, center, space-between, space-around, space-evenly");
                    }
                }
                break;
            case "align":
                if (expect(context, key, TokenType.IDENTIFIER, CompilerErrorCode.EXPECTED_VALUE)) {
                    Token value = context.advance();
                    Optional<Alignment> align = Alignment.fromName(value.text());
                    if (align.isPresent()) {
                        options.align = align.get();
                    } else {
                        invalid(context, key, value, "Valid values: start, center, end");
                    }
                }
                break;
            case "padding":
                padding(context, key, options);
                break;
            case "wrap":
                options.wrap = true;
                break;
            case "center":
                options.justify = Justify.CENTER;
                options.align = Alignment.CENTER;
                break;
            default:
                throw new IllegalArgumentException("Not a layout option: " + key.text());
        }
    }

    private static void padding(ParsingContext context, Token key, LayoutOptions options) {
        List<Double> values = new ArrayList<>(4);
        while (values.size() < 4 && context.check(TokenType.NUMBER)) {
            values.add(Literals.number(context.advance()));
        }
        if (values.isEmpty()) {
            report(context, key, CompilerErrorCode.EXPECTED_NUMBER);
            return;
        }
        options.padding = Padding.of(values);
    }

    private static boolean expect(ParsingContext context, Token key, TokenType type, CompilerErrorCode code) {
        if (context.check(type)) {
            return true;
        }
        report(context, key, code);
        return false;
    }

    private static void report(ParsingContext context, Token key, CompilerErrorCode code) {
        Token at = context.peek();
        context.getDiagnostics().reportError(code, "Missing value after '" + key.text() + "'.",
                at.line(), at.column(), RecoveryAction.RESUME_AT_NEXT_TOKEN);
    }

    private static void invalid(ParsingContext context, Token key, Token value, String hint) {
        context.getDiagnostics().reportError(CompilerErrorCode.INVALID_PROPERTY,
                "Invalid " + key.text() + " '" + value.text() + "'. " + hint,
                value.line(), value.column(), RecoveryAction.USE_DEFAULT);
    }
}
