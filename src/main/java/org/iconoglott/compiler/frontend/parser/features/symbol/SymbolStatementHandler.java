package org.iconoglott.compiler.frontend.parser.features.symbol;

import org.iconoglott.compiler.api.CompilerErrorCode;
import org.iconoglott.compiler.diagnostics.RecoveryAction;
import org.iconoglott.compiler.frontend.lexer.Token;
import org.iconoglott.compiler.frontend.lexer.TokenType;
import org.iconoglott.compiler.frontend.parser.IStatementHandler;
import org.iconoglott.compiler.frontend.parser.Literals;
import org.iconoglott.compiler.frontend.parser.ParsingContext;
import org.iconoglott.compiler.frontend.parser.ast.AstNode;
import org.iconoglott.compiler.frontend.parser.ast.Point;
import org.iconoglott.compiler.frontend.parser.features.shape.ShapeNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Handles the parsing of the <code>symbol</code> statement.
 * The syntax is <code>symbol "id" [viewbox &lt;x,y&gt; &lt;w,h&gt; | viewbox &lt;w,h&gt;]</code>
 * followed by an indented block of shape statements:
 * <pre>
 * symbol "dot" viewbox 24,24
 *   circle 12,12 10
 * </pre>
 * Only shape statements may appear in the block; anything else is reported and its line
 * skipped. Symbols are defined at the top level only.
 */
public class SymbolStatementHandler implements IStatementHandler {

    @Override
    public AstNode parse(ParsingContext context) {
        Token keyword = context.advance();
        String id = "";
        if (context.check(TokenType.STRING)) {
            id = Literals.string(context.advance());
        } else {
            Token at = context.peek();
            context.getDiagnostics().reportError(CompilerErrorCode.EXPECTED_STRING,
                    "Expected a quoted symbol id, e.g. symbol \"my-icon\".",
                    at.line(), at.column(), RecoveryAction.RESUME_AT_NEXT_TOKEN);
        }

        ViewBox viewBox = null;
        while (!context.isAtLineEnd()) {
            Token token = context.advance();
            if (token.type() == TokenType.IDENTIFIER && "viewbox".equals(token.text())
                    && context.check(TokenType.PAIR)) {
                Point first = Literals.point(context.advance());
                if (context.check(TokenType.PAIR)) {
                    Point second = Literals.point(context.advance());
                    viewBox = new ViewBox(first.x(), first.y(), second.x(), second.y());
                } else {
                    viewBox = new ViewBox(0, 0, first.x(), first.y());
                }
            }
        }

        return new SymbolNode(id, viewBox, block(context), keyword.line());
    }

    @Override
    public boolean isNestable() {
        return false;
    }

    private List<ShapeNode> block(ParsingContext context) {
        List<ShapeNode> children = new ArrayList<>();
        context.skipNewlines();
        if (!context.match(TokenType.INDENT)) {
            return children;
        }
        int depth = 0;
        while (!context.isAtEnd()) {
            if (context.match(TokenType.NEWLINE)) {
                continue;
            }
            if (context.match(TokenType.DEDENT)) {
                if (depth == 0) {
                    break;
                }
                depth--;
                continue;
            }
            if (context.match(TokenType.INDENT)) {
                depth++;
                continue;
            }
            if (context.checkNestedStatement()) {
                AstNode child = context.statement();
                if (child instanceof ShapeNode shape) {
                    children.add(shape);
                }
            } else {
                Token unexpected = context.peek();
                context.getDiagnostics().reportError(CompilerErrorCode.INVALID_PROPERTY,
                        "Only shapes are allowed in a symbol block, found '" + unexpected.text() + "'.",
                        unexpected.line(), unexpected.column(), RecoveryAction.SKIP);
                context.skipRestOfLine();
            }
        }
        return children;
    }
}
