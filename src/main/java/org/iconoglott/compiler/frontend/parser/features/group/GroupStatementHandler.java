package org.iconoglott.compiler.frontend.parser.features.group;

import org.iconoglott.compiler.frontend.lexer.Token;
import org.iconoglott.compiler.frontend.lexer.TokenType;
import org.iconoglott.compiler.frontend.parser.IStatementHandler;
import org.iconoglott.compiler.frontend.parser.Literals;
import org.iconoglott.compiler.frontend.parser.ParsingContext;
import org.iconoglott.compiler.frontend.parser.ast.AstNode;
import org.iconoglott.compiler.frontend.parser.features.shape.BlockParser;
import org.iconoglott.compiler.frontend.parser.features.shape.ShapeBuilder;
import org.iconoglott.compiler.frontend.parser.features.shape.ShapeKind;
import org.iconoglott.compiler.frontend.parser.features.shape.ShapeProps;

/**
 * Handles the parsing of the <code>group</code> statement.
 * The syntax is <code>group ["name"]</code> followed by an indented block of children.
 */
public class GroupStatementHandler implements IStatementHandler {

    @Override
    public AstNode parse(ParsingContext context) {
        Token keyword = context.advance();
        String name = null;
        if (context.check(TokenType.STRING)) {
            name = Literals.string(context.advance());
        }
        context.skipRestOfLine();

        ShapeBuilder group = new ShapeBuilder(ShapeKind.GROUP, keyword.line());
        BlockParser.parseOptionalBlock(context, group);
        return group.build(new ShapeProps.GroupProps(name));
    }
}
