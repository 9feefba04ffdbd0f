package org.iconoglott.compiler.frontend.parser.features.transform;

import org.iconoglott.compiler.api.CompilerErrorCode;
import org.iconoglott.compiler.diagnostics.RecoveryAction;
import org.iconoglott.compiler.frontend.lexer.Token;
import org.iconoglott.compiler.frontend.lexer.TokenType;
import org.iconoglott.compiler.frontend.parser.Literals;
import org.iconoglott.compiler.frontend.parser.ParsingContext;
import org.iconoglott.compiler.frontend.parser.ast.Size;

import java.util.Set;

/**
 * Parses <code>translate</code>, <code>rotate</code>, <code>scale</code> and <code>origin</code>.
 */
public final class TransformPropertyParser {

    private static final Set<String> KEYS = Set.of("translate", "rotate", "scale", "origin");

    private TransformPropertyParser() {
        // Utility class
    }

    public static boolean handles(String key) {
        return KEYS.contains(key);
    }

    /**
     * Parses one transform property. The current token is the property key.
     * @param context The parsing context.
     * @param transform The transform being built.
     */
    public static void parse(ParsingContext context, Transform.Builder transform) {
        Token key = context.advance();
        switch (key.text()) {
            case "translate":
                if (context.check(TokenType.PAIR)) {
                    transform.translate(Literals.point(context.advance()));
                } else {
                    expected(context, key, CompilerErrorCode.EXPECTED_PAIR, "a pair (x,y)");
                }
                break;
            case "origin":
                if (context.check(TokenType.PAIR)) {
                    transform.origin(Literals.point(context.advance()));
                } else {
                    expected(context, key, CompilerErrorCode.EXPECTED_PAIR, "a pair (x,y)");
                }
                break;
            case "rotate":
                if (context.check(TokenType.NUMBER)) {
                    transform.rotate(Literals.number(context.advance()));
                } else {
                    expected(context, key, CompilerErrorCode.EXPECTED_NUMBER, "a number");
                }
                break;
            case "scale":
                if (context.check(TokenType.PAIR)) {
                    transform.scale(Literals.size(context.advance()));
                } else if (context.check(TokenType.NUMBER)) {
                    double factor = Literals.number(context.advance());
                    transform.scale(new Size(factor, factor));
                } else {
                    expected(context, key, CompilerErrorCode.EXPECTED_VALUE, "a number or pair");
                }
                break;
            default:
                break;
        }
    }

    private static void expected(ParsingContext context, Token key, CompilerErrorCode code, String what) {
        Token at = context.peek();
        context.getDiagnostics().reportError(code, "Expected " + what + " after '" + key.text() + "'.",
                at.line(), at.column(), RecoveryAction.RESUME_AT_NEXT_TOKEN);
    }
}
