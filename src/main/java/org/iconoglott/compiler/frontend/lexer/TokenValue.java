package org.iconoglott.compiler.frontend.lexer;

/**
 * The literal payload carried by a value token. Structural tokens carry no payload.
 */
public sealed interface TokenValue {

    /**
     * @return The value as it is substituted into text properties such as a fill.
     */
    String asText();

    record Num(double value) implements TokenValue {
        @Override
        public String asText() {
            return NumberText.format(value);
        }
    }

    record Str(String value) implements TokenValue {
        @Override
        public String asText() {
            return value;
        }
    }

    record Pair(double x, double y) implements TokenValue {
        @Override
        public String asText() {
            return NumberText.format(x) + "," + NumberText.format(y);
        }
    }

    record Color(String value) implements TokenValue {
        @Override
        public String asText() {
            return value;
        }
    }

    record Ident(String value) implements TokenValue {
        @Override
        public String asText() {
            return value;
        }
    }

    /**
     * A reference to a variable.
     * @param name The variable name without its leading '$'.
     */
    record VarRef(String name) implements TokenValue {
        @Override
        public String asText() {
            return "$" + name;
        }
    }
}
