package org.iconoglott.compiler.frontend.lexer;

import org.iconoglott.compiler.api.CompilerErrorCode;
import org.iconoglott.compiler.api.Severity;
import org.iconoglott.compiler.diagnostics.Diagnostic;
import org.iconoglott.compiler.diagnostics.RecoveryAction;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * The Lexer (also known as Tokenizer or Scanner) is responsible for converting
 * a sequence of characters (source code) into a sequence of tokens.
 * <p>
 * Input is processed line by line. Leading whitespace is compared against a stack of
 * indentation widths and turned into {@link TokenType#INDENT} and {@link TokenType#DEDENT}
 * tokens. The lexer never fails: characters that start no token are dropped and noted in
 * {@link #getRecoveries()}.
 */
public class Lexer {

    private static final String COMMENT_MARKER = "//";

    private final String source;
    private final List<Token> tokens = new ArrayList<>();
    private final List<Diagnostic> recoveries = new ArrayList<>();
    private final Deque<Integer> indents = new ArrayDeque<>();

    private String lineText;
    private int line;
    private int start;
    private int current;

    /**
     * Creates a new Lexer.
     * @param source The source code as a single string. {@code null} is treated as empty input.
     */
    public Lexer(String source) {
        this.source = source == null ? "" : source;
    }

    /**
     * Performs the tokenization of the entire source code.
     * @return A list of the recognized tokens, always ending with {@link TokenType#END_OF_INPUT}.
     */
    public List<Token> scanTokens() {
        tokens.clear();
        recoveries.clear();
        indents.clear();
        indents.push(0);

        String[] lines = source.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            line = i + 1;
            lineText = stripCarriageReturn(lines[i]);
            String trimmed = lineText.strip();
            if (trimmed.isEmpty() || trimmed.startsWith(COMMENT_MARKER)) {
                continue;
            }
            int width = indentationWidth(lineText);
            handleIndentation(width);
            current = width;
            while (current < lineText.length()) {
                start = current;
                if (!scanToken()) {
                    break;
                }
            }
            addStructural(TokenType.NEWLINE, lineText.length() + 1);
        }

        int endLine = Math.max(1, lines.length);
        while (indents.size() > 1) {
            indents.pop();
            tokens.add(new Token(TokenType.DEDENT, "", null, endLine, 1));
        }
        tokens.add(new Token(TokenType.END_OF_INPUT, "", null, endLine, 1));
        return tokens;
    }

    /**
     * Returns the characters that were dropped during the last scan, each recorded with
     * the {@link RecoveryAction#SKIP} action. These are informational, not errors.
     * @return An unmodifiable list of recoveries.
     */
    public List<Diagnostic> getRecoveries() {
        return Collections.unmodifiableList(recoveries);
    }

    private void handleIndentation(int width) {
        if (width > indents.peek()) {
            indents.push(width);
            tokens.add(new Token(TokenType.INDENT, "", null, line, 1));
            return;
        }
        // Widths between two stack levels stop at the lower level without complaint.
        while (width < indents.peek()) {
            indents.pop();
            tokens.add(new Token(TokenType.DEDENT, "", null, line, 1));
        }
    }

    /**
     * Scans one token starting at {@link #current}.
     * @return {@code false} if the rest of the line is a comment.
     */
    private boolean scanToken() {
        char c = peek();
        if (c == ' ' || c == '\t') {
            current++;
            return true;
        }
        if (lineText.startsWith(COMMENT_MARKER, current)) {
            return false;
        }
        if (c == '$' && isAlpha(peekAt(current + 1))) {
            variable();
        } else if (c == '#' && color()) {
            return true;
        } else if (pair()) {
            return true;
        } else if ((c == '"' || c == '\'') && string(c)) {
            return true;
        } else if (number()) {
            return true;
        } else if (c == '-' && peekAt(current + 1) == '>') {
            current += 2;
            addToken(TokenType.ARROW, null);
        } else if (c == ':') {
            current++;
            addToken(TokenType.COLON, null);
        } else if (c == '=') {
            current++;
            addToken(TokenType.EQUALS, null);
        } else if (c == '[') {
            current++;
            addToken(TokenType.LEFT_BRACKET, null);
        } else if (c == ']') {
            current++;
            addToken(TokenType.RIGHT_BRACKET, null);
        } else if (isAlpha(c)) {
            identifier();
        } else {
            current++;
            recoveries.add(new Diagnostic(CompilerErrorCode.LEXER_UNKNOWN_CHARACTER,
                    "Unexpected character: " + c, line, start + 1, Severity.INFO,
                    String.valueOf(c), RecoveryAction.SKIP));
        }
        return true;
    }

    private void variable() {
        current++;
        while (isAlphaNumeric(peek())) current++;
        addToken(TokenType.VARIABLE, new TokenValue.VarRef(lineText.substring(start + 1, current)));
    }

    private boolean color() {
        int end = current + 1;
        while (end < lineText.length() && isHexDigit(lineText.charAt(end))) end++;
        int digits = end - current - 1;
        boolean validLength = digits == 3 || digits == 4 || digits == 6 || digits == 8;
        if (!validLength || isWordChar(peekAt(end))) {
            return false;
        }
        current = end;
        String text = lineText.substring(start, current);
        addToken(TokenType.COLOR, new TokenValue.Color(text));
        return true;
    }

    private boolean pair() {
        int firstEnd = numberEnd(current);
        if (firstEnd < 0) {
            return false;
        }
        char separator = peekAt(firstEnd);
        if (separator != ',' && separator != 'x') {
            return false;
        }
        int secondEnd = numberEnd(firstEnd + 1);
        if (secondEnd < 0) {
            return false;
        }
        double x = Double.parseDouble(lineText.substring(current, firstEnd));
        double y = Double.parseDouble(lineText.substring(firstEnd + 1, secondEnd));
        current = secondEnd;
        addToken(TokenType.PAIR, new TokenValue.Pair(x, y));
        return true;
    }

    private boolean string(char quote) {
        int close = lineText.indexOf(quote, current + 1);
        if (close < 0) {
            return false;
        }
        String content = lineText.substring(current + 1, close);
        current = close + 1;
        addToken(TokenType.STRING, new TokenValue.Str(content));
        return true;
    }

    private boolean number() {
        int end = numberEnd(current);
        if (end < 0) {
            return false;
        }
        double value = Double.parseDouble(lineText.substring(current, end));
        current = end;
        addToken(TokenType.NUMBER, new TokenValue.Num(value));
        return true;
    }

    private void identifier() {
        while (isAlphaNumeric(peek()) || peek() == '-') current++;
        String text = lineText.substring(start, current);
        addToken(TokenType.IDENTIFIER, new TokenValue.Ident(text));
    }

    /**
     * Matches an optionally signed decimal ({@code -?\d+\.?\d*}) at the given index.
     * @return The index after the number, or -1 if none starts there.
     */
    private int numberEnd(int from) {
        int i = from;
        if (peekAt(i) == '-') i++;
        if (!isDigit(peekAt(i))) {
            return -1;
        }
        while (isDigit(peekAt(i))) i++;
        if (peekAt(i) == '.') {
            i++;
            while (isDigit(peekAt(i))) i++;
        }
        return i;
    }

    private void addToken(TokenType type, TokenValue value) {
        tokens.add(new Token(type, lineText.substring(start, current), value, line, start + 1));
    }

    private void addStructural(TokenType type, int column) {
        tokens.add(new Token(type, "", null, line, column));
    }

    private static int indentationWidth(String text) {
        int width = 0;
        while (width < text.length() && (text.charAt(width) == ' ' || text.charAt(width) == '\t')) {
            width++;
        }
        return width;
    }

    private static String stripCarriageReturn(String text) {
        return text.endsWith("\r") ? text.substring(0, text.length() - 1) : text;
    }

    private char peek() {
        return peekAt(current);
    }

    private char peekAt(int index) {
        if (index >= lineText.length()) return '\0';
        return lineText.charAt(index);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isHexDigit(char c) {
        return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    private static boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }

    private static boolean isWordChar(char c) {
        return isAlphaNumeric(c);
    }
}
