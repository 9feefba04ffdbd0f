package org.iconoglott.compiler.frontend.parser;

import org.iconoglott.compiler.api.CompilerErrorCode;
import org.iconoglott.compiler.diagnostics.DiagnosticsEngine;
import org.iconoglott.compiler.diagnostics.RecoveryAction;
import org.iconoglott.compiler.frontend.lexer.Token;
import org.iconoglott.compiler.frontend.lexer.TokenType;
import org.iconoglott.compiler.frontend.lexer.TokenValue;
import org.iconoglott.compiler.frontend.parser.ast.AstNode;
import org.iconoglott.compiler.frontend.parser.ast.SceneNode;
import org.iconoglott.compiler.frontend.parser.features.variable.VariableNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The recursive-descent parser for the DSL. It consumes a list of tokens
 * from the {@link org.iconoglott.compiler.frontend.lexer.Lexer} and produces a {@link SceneNode}.
 * <p>
 * Parsing never fails. Every error is reported to the {@link DiagnosticsEngine} together with
 * the recovery action that was applied, and parsing continues. Variables are bound in document
 * order and are only visible to statements after their binding.
 */
public class Parser implements ParsingContext {

    private final List<Token> tokens;
    private final DiagnosticsEngine diagnostics;
    private final StatementHandlerRegistry statementRegistry;
    private final Map<String, TokenValue> variables = new LinkedHashMap<>();
    private int current = 0;

    /**
     * Constructs a new Parser.
     * @param tokens The list of tokens to parse. A missing end token is tolerated.
     * @param diagnostics The engine for reporting errors and warnings.
     */
    public Parser(List<Token> tokens, DiagnosticsEngine diagnostics) {
        this.tokens = withEndToken(tokens);
        this.diagnostics = diagnostics;
        this.statementRegistry = StatementHandlerRegistry.initialize();
    }

    /**
     * Parses the entire token stream.
     * @return The scene; never {@code null}.
     */
    public SceneNode parse() {
        List<AstNode> statements = new ArrayList<>();
        while (!isAtEnd()) {
            if (match(TokenType.NEWLINE)) {
                continue;
            }
            AstNode statement = statement();
            if (statement != null) {
                statements.add(statement);
            }
        }
        return new SceneNode(statements);
    }

    /**
     * Returns the variables bound so far, in binding order.
     * @return An unmodifiable view of the bindings.
     */
    public Map<String, TokenValue> getVariables() {
        return Collections.unmodifiableMap(variables);
    }

    @Override
    public AstNode statement() {
        skipNewlines();
        if (isAtEnd()) return null;

        if (check(TokenType.VARIABLE)) {
            return variableStatement();
        }
        if (!check(TokenType.IDENTIFIER)) {
            Token unexpected = advance();
            diagnostics.reportError(CompilerErrorCode.UNEXPECTED_TOKEN,
                    "Expected a command, but got " + describe(unexpected) + ".",
                    unexpected.line(), unexpected.column(), RecoveryAction.RESUME_AT_NEXT_TOKEN);
            return null;
        }

        Token keyword = peek();
        Optional<IStatementHandler> handler = statementRegistry.get(keyword.text());
        if (handler.isPresent()) {
            return handler.get().parse(this);
        }

        advance();
        diagnostics.reportError(CompilerErrorCode.UNKNOWN_COMMAND, "Unknown command: " + keyword.text(),
                keyword.line(), keyword.column(), RecoveryAction.SKIP);
        skipRestOfLine();
        skipBlock();
        return null;
    }

    private AstNode variableStatement() {
        Token nameToken = advance();
        String name = ((TokenValue.VarRef) nameToken.value()).name();
        if (!match(TokenType.EQUALS)) {
            diagnostics.reportError(CompilerErrorCode.MISSING_EQUALS,
                    "Expected '=' in assignment to $" + name + ".",
                    nameToken.line(), nameToken.column(), RecoveryAction.RESUME_AT_NEXT_TOKEN);
            return new VariableNode(name, null);
        }
        if (!checkValue()) {
            diagnostics.reportError(CompilerErrorCode.EMPTY_VALUE,
                    "Expected a value after '=' in assignment to $" + name + ".",
                    nameToken.line(), nameToken.column(), RecoveryAction.RESUME_AT_NEXT_TOKEN);
            return new VariableNode(name, null);
        }
        TokenValue value = resolve(advance());
        variables.put(name, value);
        return new VariableNode(name, value);
    }

    @Override
    public TokenValue resolve(Token token) {
        if (token.value() instanceof TokenValue.VarRef ref) {
            TokenValue bound = variables.get(ref.name());
            if (bound != null) {
                return bound;
            }
            diagnostics.reportError(CompilerErrorCode.UNDEFINED_VAR, "Undefined variable: $" + ref.name(),
                    token.line(), token.column(), RecoveryAction.PASS_THROUGH_LITERAL);
            return ref;
        }
        return token.value();
    }

    @Override
    public boolean checkNestedStatement() {
        if (!check(TokenType.IDENTIFIER)) {
            return false;
        }
        return statementRegistry.get(peek().text()).map(IStatementHandler::isNestable).orElse(false);
    }

    /**
     * Skips an indented block that follows the current line, including nested blocks.
     */
    private void skipBlock() {
        skipNewlines();
        if (!match(TokenType.INDENT)) {
            return;
        }
        int depth = 1;
        while (depth > 0 && !isAtEnd()) {
            Token token = advance();
            if (token.type() == TokenType.INDENT) depth++;
            else if (token.type() == TokenType.DEDENT) depth--;
        }
    }

    private static String describe(Token token) {
        if (token.text() == null || token.text().isEmpty()) {
            return token.type().name();
        }
        return token.type().name() + " '" + token.text() + "'";
    }

    private static List<Token> withEndToken(List<Token> tokens) {
        List<Token> copy = new ArrayList<>(tokens);
        if (copy.isEmpty() || copy.get(copy.size() - 1).type() != TokenType.END_OF_INPUT) {
            Token last = copy.isEmpty() ? null : copy.get(copy.size() - 1);
            int line = last == null ? 1 : last.line();
            copy.add(new Token(TokenType.END_OF_INPUT, "", null, line, 1));
        }
        return copy;
    }

    // region Token stream

    @Override
    public boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean check(TokenType type) {
        if (isAtEnd()) return type == TokenType.END_OF_INPUT;
        return peek().type() == type;
    }

    @Override
    public boolean checkNext(TokenType type) {
        if (current + 1 >= tokens.size()) return false;
        return tokens.get(current + 1).type() == type;
    }

    @Override
    public boolean checkValue() {
        return peek().value() != null;
    }

    @Override
    public boolean checkKeyword(String keyword) {
        return check(TokenType.IDENTIFIER) && keyword.equals(peek().text());
    }

    @Override
    public Token advance() {
        Token token = peek();
        if (!isAtEnd()) current++;
        return token;
    }

    @Override
    public Token peek() {
        return tokens.get(current);
    }

    @Override
    public boolean isAtEnd() {
        return peek().type() == TokenType.END_OF_INPUT;
    }

    @Override
    public boolean isAtLineEnd() {
        return check(TokenType.NEWLINE) || isAtEnd();
    }

    @Override
    public void skipNewlines() {
        while (check(TokenType.NEWLINE)) {
            advance();
        }
    }

    @Override
    public void skipRestOfLine() {
        while (!isAtLineEnd()) {
            advance();
        }
    }

    @Override
    public DiagnosticsEngine getDiagnostics() {
        return diagnostics;
    }

    // endregion
}
