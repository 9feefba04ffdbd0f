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
import org.iconoglott.compiler.frontend.parser.ast.Size;
import org.iconoglott.compiler.frontend.parser.features.shape.BlockParser;
import org.iconoglott.compiler.frontend.parser.features.shape.ShapeBuilder;
import org.iconoglott.compiler.frontend.parser.features.shape.ShapeKind;
import org.iconoglott.compiler.frontend.parser.features.shape.ShapeProps;

/**
 * Handles the parsing of the <code>use</code> statement, which places a symbol.
 * The syntax is <code>use "id" [at &lt;x,y&gt;] [size &lt;w&gt;x&lt;h&gt;] [colour]</code>;
 * as with shapes, an unlabeled first pair is the position and a second one the size.
 * The optional block takes style and transform properties.
 */
public class UseStatementHandler implements IStatementHandler {

    @Override
    public AstNode parse(ParsingContext context) {
        Token keyword = context.advance();
        String href = "";
        if (context.check(TokenType.STRING)) {
            href = Literals.string(context.advance());
        } else {
            Token at = context.peek();
            context.getDiagnostics().reportError(CompilerErrorCode.EXPECTED_STRING,
                    "Expected a quoted symbol reference, e.g. use \"my-icon\".",
                    at.line(), at.column(), RecoveryAction.RESUME_AT_NEXT_TOKEN);
        }

        ShapeBuilder use = new ShapeBuilder(ShapeKind.USE, keyword.line());
        Point at = null;
        Size size = null;
        while (!context.isAtLineEnd()) {
            Token token = context.advance();
            switch (token.type()) {
                case PAIR:
                    if (at == null) {
                        at = Literals.point(token);
                    } else if (size == null) {
                        size = Literals.size(token);
                    }
                    break;
                case IDENTIFIER:
                    if ("at".equals(token.text()) && context.check(TokenType.PAIR)) {
                        at = Literals.point(context.advance());
                    } else if ("size".equals(token.text()) && context.check(TokenType.PAIR)) {
                        size = Literals.size(context.advance());
                    }
                    break;
                case COLOR:
                case VARIABLE:
                    use.style().fill(context.resolveText(token));
                    break;
                default:
                    break;
            }
        }

        BlockParser.parseOptionalBlock(context, use);
        return use.build(new ShapeProps.UseProps(href, at != null ? at : Point.ORIGIN, size));
    }
}
