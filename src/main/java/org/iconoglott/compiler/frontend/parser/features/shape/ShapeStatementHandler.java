package org.iconoglott.compiler.frontend.parser.features.shape;

import org.iconoglott.compiler.frontend.lexer.Token;
import org.iconoglott.compiler.frontend.lexer.TokenType;
import org.iconoglott.compiler.frontend.parser.IStatementHandler;
import org.iconoglott.compiler.frontend.parser.Literals;
import org.iconoglott.compiler.frontend.parser.ParsingContext;
import org.iconoglott.compiler.frontend.parser.ast.AstNode;
import org.iconoglott.compiler.frontend.parser.ast.Point;

/**
 * Handles the statements of the primitive shapes (<code>rect</code>, <code>circle</code>,
 * <code>ellipse</code>, <code>line</code>, <code>path</code>, <code>polygon</code>,
 * <code>curve</code>, <code>text</code> and <code>image</code>).
 * <p>
 * Unlabeled values are assigned by position: the first pair is the position and the second
 * the size, a number is the radius of a circle, a string is the content, and a colour or
 * variable is the fill. Labeled values (<code>at</code>, <code>size</code>, <code>radius</code>,
 * <code>from</code>, <code>to</code>, <code>d</code>, <code>points</code>, <code>href</code>)
 * are only taken when the expected token follows; otherwise the label is ignored. A curve
 * also takes the flags <code>smooth</code> (the default), <code>sharp</code> and <code>closed</code>.
 */
public class ShapeStatementHandler implements IStatementHandler {

    private final ShapeKind kind;

    public ShapeStatementHandler(ShapeKind kind) {
        this.kind = kind;
    }

    @Override
    public AstNode parse(ParsingContext context) {
        Token keyword = context.advance();
        ShapeBuilder shape = new ShapeBuilder(kind, keyword.line());
        PropertySet props = shape.properties();

        while (!context.isAtLineEnd()) {
            Token token = context.peek();
            switch (token.type()) {
                case PAIR:
                    Point pair = Literals.point(context.advance());
                    props.positionalPair(pair.x(), pair.y());
                    break;
                case NUMBER:
                    props.positionalNumber(kind, Literals.number(context.advance()));
                    break;
                case STRING:
                    props.content = Literals.string(context.advance());
                    break;
                case LEFT_BRACKET:
                    if (kind == ShapeKind.POLYGON || kind == ShapeKind.CURVE) {
                        props.points = BlockParser.points(context);
                    } else {
                        context.advance();
                    }
                    break;
                case COLOR:
                case VARIABLE:
                    String fill = context.resolveText(context.advance());
                    if (!shape.style().hasFill()) {
                        shape.style().fill(fill);
                    }
                    break;
                case IDENTIFIER:
                    labeled(context, props);
                    break;
                default:
                    context.advance();
                    break;
            }
        }

        BlockParser.parseOptionalBlock(context, shape);
        return shape.build();
    }

    private void labeled(ParsingContext context, PropertySet props) {
        String key = context.advance().text();
        switch (key) {
            case "at":
                if (context.check(TokenType.PAIR)) props.at = Literals.point(context.advance());
                break;
            case "size":
                if (context.check(TokenType.PAIR)) props.size = Literals.size(context.advance());
                break;
            case "radius":
                if (context.check(TokenType.PAIR)) {
                    props.radiusPair = Literals.size(context.advance());
                } else if (context.check(TokenType.NUMBER)) {
                    props.radius = Literals.number(context.advance());
                }
                break;
            case "from":
                if (context.check(TokenType.PAIR)) props.from = Literals.point(context.advance());
                break;
            case "to":
                if (context.check(TokenType.PAIR)) props.to = Literals.point(context.advance());
                break;
            case "d":
                if (context.check(TokenType.STRING)) props.d = Literals.string(context.advance());
                break;
            case "points":
                if (context.check(TokenType.LEFT_BRACKET)) props.points = BlockParser.points(context);
                break;
            case "href":
                if (context.check(TokenType.STRING)) props.href = Literals.string(context.advance());
                break;
            case "smooth":
            case "sharp":
            case "closed":
                if (kind == ShapeKind.CURVE) props.curveModifier(key);
                break;
            default:
                break;
        }
    }
}
