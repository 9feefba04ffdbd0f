package org.iconoglott.compiler.frontend.parser.features.layout;

import org.iconoglott.compiler.api.CompilerErrorCode;
import org.iconoglott.compiler.diagnostics.RecoveryAction;
import org.iconoglott.compiler.frontend.lexer.Token;
import org.iconoglott.compiler.frontend.lexer.TokenType;
import org.iconoglott.compiler.frontend.parser.IStatementHandler;
import org.iconoglott.compiler.frontend.parser.ParsingContext;
import org.iconoglott.compiler.frontend.parser.ast.AstNode;
import org.iconoglott.compiler.frontend.parser.features.shape.BlockParser;
import org.iconoglott.compiler.frontend.parser.features.shape.ShapeBuilder;
import org.iconoglott.compiler.frontend.parser.features.shape.ShapeKind;
import org.iconoglott.compiler.frontend.parser.features.shape.ShapeProps;

import java.util.Optional;

/**
 * Handles the parsing of the <code>stack</code> (vertical) and <code>row</code> (horizontal)
 * layout statements. The syntax is
 * <code>stack|row [vertical|horizontal] [option ...]</code>
 * followed by an indented block of children. The options are those of
 * {@link LayoutPropertyParser}; they may also appear in the block.
 * <pre>
 * row size 200x40 justify space-between align center padding 4
 *   circle 8
 *   circle 8
 * </pre>
 */
public class LayoutStatementHandler implements IStatementHandler {

    @Override
    public AstNode parse(ParsingContext context) {
        Token keyword = context.advance();
        LayoutOptions options = new LayoutOptions(
                "row".equals(keyword.text()) ? LayoutDirection.HORIZONTAL : LayoutDirection.VERTICAL);
        ShapeBuilder layout = new ShapeBuilder(ShapeKind.LAYOUT, keyword.line(), options);

        while (context.check(TokenType.IDENTIFIER)) {
            Token modifier = context.peek();
            Optional<LayoutDirection> override = LayoutDirection.fromName(modifier.text());
            if (override.isPresent()) {
                context.advance();
                options.direction = override.get();
            } else if (LayoutPropertyParser.handles(modifier.text())) {
                LayoutPropertyParser.parse(context, options);
            } else {
                context.advance();
                context.getDiagnostics().reportWarning(CompilerErrorCode.INVALID_PROPERTY,
                        "Unknown " + keyword.text() + " option: " + modifier.text(),
                        modifier.line(), modifier.column(), RecoveryAction.SKIP);
            }
        }
        context.skipRestOfLine();

        BlockParser.parseOptionalBlock(context, layout);
        return layout.build(new ShapeProps.LayoutProps(options.direction, options.gap, options.at,
                options.size, options.justify, options.align, options.padding, options.wrap));
    }
}
