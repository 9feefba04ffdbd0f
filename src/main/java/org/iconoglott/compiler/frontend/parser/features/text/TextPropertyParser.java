package org.iconoglott.compiler.frontend.parser.features.text;

import org.iconoglott.compiler.frontend.lexer.Token;
import org.iconoglott.compiler.frontend.lexer.TokenType;
import org.iconoglott.compiler.frontend.parser.Literals;
import org.iconoglott.compiler.frontend.parser.ParsingContext;
import org.iconoglott.compiler.frontend.parser.features.style.Style;

import java.util.Set;

/**
 * Parses the text properties of a block. None of them report errors; a missing font
 * name or size keeps the current value.
 */
public final class TextPropertyParser {

    private static final Set<String> KEYS = Set.of("font", "bold", "italic", "center", "middle", "end");

    private TextPropertyParser() {
        // Utility class
    }

    public static boolean handles(String key) {
        return KEYS.contains(key);
    }

    /**
     * Parses one text property. The current token is the property key.
     * @param context The parsing context.
     * @param style The style being built.
     */
    public static void parse(ParsingContext context, Style.Builder style) {
        Token key = context.advance();
        switch (key.text()) {
            case "font":
                if (context.check(TokenType.STRING)) {
                    style.fontFamily(Literals.string(context.advance()));
                }
                if (context.check(TokenType.NUMBER)) {
                    style.fontSize(Literals.number(context.advance()));
                }
                break;
            case "bold":
                style.fontWeight("bold");
                break;
            case "italic":
                style.fontWeight("italic");
                break;
            case "center":
            case "middle":
                style.textAnchor("middle");
                break;
            case "end":
                style.textAnchor("end");
                break;
            default:
                break;
        }
    }
}
