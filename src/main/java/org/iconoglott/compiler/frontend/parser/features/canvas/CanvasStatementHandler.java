package org.iconoglott.compiler.frontend.parser.features.canvas;

import org.iconoglott.compiler.api.CompilerErrorCode;
import org.iconoglott.compiler.diagnostics.RecoveryAction;
import org.iconoglott.compiler.frontend.lexer.Token;
import org.iconoglott.compiler.frontend.lexer.TokenType;
import org.iconoglott.compiler.frontend.parser.IStatementHandler;
import org.iconoglott.compiler.frontend.parser.ParsingContext;
import org.iconoglott.compiler.frontend.parser.ast.AstNode;

import java.util.Optional;

/**
 * Handles the parsing of the <code>canvas</code> statement.
 * The syntax is <code>canvas [tier] [fill &lt;colour&gt;]</code>.
 */
public class CanvasStatementHandler implements IStatementHandler {

    /**
     * Parses a <code>canvas</code> statement.
     * @param context The parsing context.
     * @return A {@link CanvasNode} representing the statement.
     */
    @Override
    public AstNode parse(ParsingContext context) {
        context.advance(); // consume 'canvas'
        CanvasTier tier = null;
        String fill = null;

        if (context.check(TokenType.IDENTIFIER)) {
            Optional<CanvasTier> named = CanvasTier.fromName(context.peek().text());
            if (named.isPresent()) {
                tier = named.get();
                context.advance();
            }
        }

        while (context.check(TokenType.IDENTIFIER)) {
            Token property = context.advance();
            if ("fill".equals(property.text())) {
                if (context.checkValue()) {
                    fill = context.resolveText(context.advance());
                }
            } else {
                context.getDiagnostics().reportWarning(CompilerErrorCode.INVALID_PROPERTY,
                        "Unknown canvas property: " + property.text(),
                        property.line(), property.column(), RecoveryAction.SKIP);
            }
        }
        return new CanvasNode(tier, fill);
    }

    @Override
    public boolean isNestable() {
        return false;
    }
}
