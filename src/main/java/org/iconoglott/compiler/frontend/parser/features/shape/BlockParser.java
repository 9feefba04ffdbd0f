package org.iconoglott.compiler.frontend.parser.features.shape;

import org.iconoglott.compiler.api.CompilerErrorCode;
import org.iconoglott.compiler.diagnostics.RecoveryAction;
import org.iconoglott.compiler.frontend.lexer.Token;
import org.iconoglott.compiler.frontend.lexer.TokenType;
import org.iconoglott.compiler.frontend.parser.Literals;
import org.iconoglott.compiler.frontend.parser.ParsingContext;
import org.iconoglott.compiler.frontend.parser.ast.AstNode;
import org.iconoglott.compiler.frontend.parser.ast.Point;
import org.iconoglott.compiler.frontend.parser.features.layout.LayoutPropertyParser;
import org.iconoglott.compiler.frontend.parser.features.style.StylePropertyParser;
import org.iconoglott.compiler.frontend.parser.features.text.TextPropertyParser;
import org.iconoglott.compiler.frontend.parser.features.transform.TransformPropertyParser;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Parses the indented block that may follow a shape, group or layout statement.
 * <p>
 * Each identifier in the block is one of: a nested statement, a style, text or transform
 * property, <code>width &lt;n&gt;</code> (stroke width), <code>d "..."</code> or
 * <code>points [...]</code>. Layout blocks also accept the layout options, which take
 * precedence over the text property <code>center</code>; curve blocks accept
 * <code>smooth</code>, <code>sharp</code> and <code>closed</code>. Anything else is skipped
 * without an error.
 */
public final class BlockParser {

    static final Set<String> CURVE_MODIFIERS = Set.of("smooth", "sharp", "closed");

    private BlockParser() {
        // Utility class
    }

    /**
     * Parses the block following the current line, if there is one.
     * @param context The parsing context, positioned at the end of the statement line.
     * @param shape The shape the block belongs to.
     */
    public static void parseOptionalBlock(ParsingContext context, ShapeBuilder shape) {
        context.skipNewlines();
        if (!context.match(TokenType.INDENT)) {
            return;
        }
        // Over-indented lines inside the block open anonymous levels that are folded into it.
        int depth = 0;
        while (!context.isAtEnd()) {
            if (context.match(TokenType.NEWLINE)) {
                continue;
            }
            if (context.match(TokenType.DEDENT)) {
                if (depth == 0) {
                    return;
                }
                depth--;
                continue;
            }
            if (context.match(TokenType.INDENT)) {
                depth++;
                continue;
            }
            if (!context.check(TokenType.IDENTIFIER)) {
                context.advance();
                continue;
            }
            blockEntry(context, shape);
        }
    }

    private static void blockEntry(ParsingContext context, ShapeBuilder shape) {
        String key = context.peek().text();
        if (context.checkNestedStatement()) {
            AstNode child = context.statement();
            if (child instanceof ShapeNode node) {
                shape.addChild(node);
            }
        } else if (shape.layout() != null && LayoutPropertyParser.handles(key)) {
            LayoutPropertyParser.parse(context, shape.layout());
        } else if (StylePropertyParser.handles(key)) {
            StylePropertyParser.parse(context, shape.style());
        } else if (TextPropertyParser.handles(key)) {
            TextPropertyParser.parse(context, shape.style());
        } else if (TransformPropertyParser.handles(key)) {
            TransformPropertyParser.parse(context, shape.transform());
        } else if (shape.kind() == ShapeKind.CURVE && CURVE_MODIFIERS.contains(key)) {
            shape.properties().curveModifier(context.advance().text());
        } else if ("width".equals(key) && context.checkNext(TokenType.NUMBER)) {
            context.advance();
            shape.style().strokeWidth(Literals.number(context.advance()));
        } else if ("d".equals(key) && context.checkNext(TokenType.STRING)) {
            context.advance();
            shape.properties().d = Literals.string(context.advance());
        } else if ("points".equals(key) && context.checkNext(TokenType.LEFT_BRACKET)) {
            context.advance();
            shape.properties().points = points(context);
        } else {
            context.advance();
        }
    }

    /**
     * Parses <code>[x,y x,y ...]</code>. The current token is the opening bracket. Tokens other
     * than pairs are ignored. A list that is not closed before the end of its line is reported,
     * and the points collected so far are kept.
     * @param context The parsing context.
     * @return The collected points.
     */
    static List<Point> points(ParsingContext context) {
        Token open = context.advance();
        List<Point> points = new ArrayList<>();
        while (!context.check(TokenType.RIGHT_BRACKET) && !context.isAtLineEnd()) {
            Token token = context.advance();
            if (token.type() == TokenType.PAIR) {
                points.add(Literals.point(token));
            }
        }
        if (!context.match(TokenType.RIGHT_BRACKET)) {
            Token at = context.peek();
            context.getDiagnostics().reportError(CompilerErrorCode.MISSING_BRACKET,
                    "Expected ']' to close the point list opened at column " + open.column() + ".",
                    at.line(), at.column(), RecoveryAction.RESUME_AT_NEXT_TOKEN);
        }
        return points;
    }
}
