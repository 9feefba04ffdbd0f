package org.iconoglott.compiler.frontend.parser.features.style;

import org.iconoglott.compiler.api.CompilerErrorCode;
import org.iconoglott.compiler.diagnostics.RecoveryAction;
import org.iconoglott.compiler.frontend.lexer.Token;
import org.iconoglott.compiler.frontend.lexer.TokenType;
import org.iconoglott.compiler.frontend.parser.Literals;
import org.iconoglott.compiler.frontend.parser.ParsingContext;
import org.iconoglott.compiler.frontend.parser.ast.Point;

import java.util.Set;

/**
 * Parses the style properties of a block: <code>fill</code>, <code>stroke</code>,
 * <code>opacity</code>, <code>corner</code>, <code>shadow</code>, <code>gradient</code>
 * and <code>blur</code>.
 */
public final class StylePropertyParser {

    private static final Set<String> KEYS = Set.of("fill", "stroke", "opacity", "corner", "shadow", "gradient", "blur");

    private StylePropertyParser() {
        // Utility class
    }

    /**
     * @param key A block key.
     * @return {@code true} if the key is a style property.
     */
    public static boolean handles(String key) {
        return KEYS.contains(key);
    }

    /**
     * Parses one style property. The current token is the property key.
     * @param context The parsing context.
     * @param style The style being built.
     */
    public static void parse(ParsingContext context, Style.Builder style) {
        Token key = context.advance();
        switch (key.text()) {
            case "fill":
                if (context.check(TokenType.COLOR) || context.check(TokenType.VARIABLE) || context.check(TokenType.IDENTIFIER)) {
                    style.fill(context.resolveText(context.advance()));
                } else {
                    expected(context, key, CompilerErrorCode.EXPECTED_COLOR, "colour");
                }
                break;
            case "stroke":
                if (context.check(TokenType.COLOR) || context.check(TokenType.VARIABLE)) {
                    style.stroke(context.resolveText(context.advance()));
                } else {
                    expected(context, key, CompilerErrorCode.EXPECTED_COLOR, "colour");
                }
                if (context.check(TokenType.NUMBER)) {
                    style.strokeWidth(Literals.number(context.advance()));
                }
                if (context.checkKeyword("width")) {
                    context.advance();
                    if (context.check(TokenType.NUMBER)) {
                        style.strokeWidth(Literals.number(context.advance()));
                    }
                }
                break;
            case "opacity":
                if (context.check(TokenType.NUMBER)) {
                    style.opacity(Literals.number(context.advance()));
                } else {
                    expected(context, key, CompilerErrorCode.EXPECTED_NUMBER, "number");
                }
                break;
            case "corner":
                if (context.check(TokenType.NUMBER)) {
                    style.corner(Literals.number(context.advance()));
                } else {
                    expected(context, key, CompilerErrorCode.EXPECTED_NUMBER, "number");
                }
                break;
            case "blur":
                if (context.check(TokenType.NUMBER)) {
                    style.blur(Literals.number(context.advance()));
                } else {
                    expected(context, key, CompilerErrorCode.EXPECTED_NUMBER, "number");
                }
                break;
            case "shadow":
                style.shadow(shadow(context));
                break;
            case "gradient":
                style.gradient(gradient(context));
                break;
            default:
                break;
        }
    }

    /**
     * Parses <code>[offset-pair] [blur] [colour]</code>; omitted parts keep their defaults.
     */
    static ShadowDef shadow(ParsingContext context) {
        ShadowDef defaults = ShadowDef.DEFAULT;
        double x = defaults.x();
        double y = defaults.y();
        double blur = defaults.blur();
        String color = defaults.color();
        if (context.check(TokenType.PAIR)) {
            Point offset = Literals.point(context.advance());
            x = offset.x();
            y = offset.y();
        }
        if (context.check(TokenType.NUMBER)) {
            blur = Literals.number(context.advance());
        }
        if (context.check(TokenType.COLOR)) {
            color = context.advance().text();
        }
        return new ShadowDef(x, y, blur, color);
    }

    /**
     * Parses a run of identifiers, colours and numbers. The first two colours are the
     * start and end colour unless labelled with <code>from</code> or <code>to</code>.
     */
    static GradientDef gradient(ParsingContext context) {
        GradientDef defaults = GradientDef.DEFAULT;
        GradientKind kind = defaults.kind();
        String from = defaults.from();
        String to = defaults.to();
        double angle = defaults.angle();
        int colors = 0;

        while (context.check(TokenType.IDENTIFIER) || context.check(TokenType.COLOR) || context.check(TokenType.NUMBER)) {
            Token token = context.advance();
            if (token.type() == TokenType.NUMBER) {
                angle = Literals.number(token);
            } else if (token.type() == TokenType.COLOR) {
                if (colors == 0) {
                    from = token.text();
                } else {
                    to = token.text();
                }
                colors++;
            } else if ("linear".equals(token.text())) {
                kind = GradientKind.LINEAR;
            } else if ("radial".equals(token.text())) {
                kind = GradientKind.RADIAL;
            } else if ("from".equals(token.text()) && context.check(TokenType.COLOR)) {
                from = context.advance().text();
                colors = Math.max(colors, 1);
            } else if ("to".equals(token.text()) && context.check(TokenType.COLOR)) {
                to = context.advance().text();
                colors = Math.max(colors, 2);
            }
        }
        return new GradientDef(kind, from, to, angle);
    }

    private static void expected(ParsingContext context, Token key, CompilerErrorCode code, String what) {
        Token at = context.peek();
        context.getDiagnostics().reportError(code, "Expected " + what + " after '" + key.text() + "'.",
                at.line(), at.column(), RecoveryAction.RESUME_AT_NEXT_TOKEN);
    }
}
