package org.iconoglott.compiler.frontend.parser;

import org.iconoglott.compiler.frontend.lexer.Token;
import org.iconoglott.compiler.frontend.lexer.TokenValue;
import org.iconoglott.compiler.frontend.parser.ast.Point;
import org.iconoglott.compiler.frontend.parser.ast.Size;

/**
 * Typed access to the payload of literal tokens. Callers check the token type first.
 */
public final class Literals {

    private Literals() {
        // Utility class
    }

    public static double number(Token token) {
        return ((TokenValue.Num) token.value()).value();
    }

    public static String string(Token token) {
        return ((TokenValue.Str) token.value()).value();
    }

    public static Point point(Token token) {
        TokenValue.Pair pair = (TokenValue.Pair) token.value();
        return new Point(pair.x(), pair.y());
    }

    public static Size size(Token token) {
        TokenValue.Pair pair = (TokenValue.Pair) token.value();
        return new Size(pair.x(), pair.y());
    }
}
