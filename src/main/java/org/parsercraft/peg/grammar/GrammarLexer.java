package org.parsercraft.peg.grammar;

import org.parsercraft.peg.tree.SourceLocation;
import org.parsercraft.peg.tree.SourceSpan;

import java.util.ArrayList;
import java.util.List;

/**
 * Lexer for the pattern part of one logical rule line.
 *
 * <p>Literal escapes ({@code \n \r \t \\ \' \" \0 \x}HH and backslash-u followed by four hex digits) are decoded here.
 * Character-class bodies are kept raw and later used as a regular expression.
 */
public final class GrammarLexer {
    private static final int MAX_INPUT_SIZE = 1_000_000;
    private static final int DEFAULT_TOKEN_CAPACITY = 32;

    private final String input;
    private int pos;
    private int line;
    private int column;

    private GrammarLexer(String input, int line, int column) {
        this.input = input;
        this.pos = 0;
        this.line = line;
        this.column = column;
    }

    /**
     * Tokenize a pattern that starts at the given position of the grammar text.
     * Continuation lines are separated by {@code '\n'} so that {@code #} comments end
     * with their physical line.
     */
    public static List<GrammarToken> tokenize(String pattern, int line, int column) {
        if (pattern.length() > MAX_INPUT_SIZE) {
            throw new IllegalArgumentException(
            "Grammar input exceeds maximum size of " + MAX_INPUT_SIZE + " characters");
        }
        return new GrammarLexer(pattern, line, column).tokenizeAll();
    }

    public static List<GrammarToken> tokenize(String pattern) {
        return tokenize(pattern, 1, 1);
    }

    private List<GrammarToken> tokenizeAll() {
        var tokens = new ArrayList<GrammarToken>();
        while (true) {
            skipWhitespaceAndComments();
            if (isAtEnd()) {
                break;
            }
            var token = nextToken();
            tokens.add(token);
            if (token instanceof GrammarToken.Error) {
                break;
            }
        }
        tokens.add(new GrammarToken.Eof(SourceSpan.at(currentLocation())));
        return tokens;
    }

    private GrammarToken nextToken() {
        var start = currentLocation();
        char c = peek();
        if (isIdentifierStart(c)) {
            return scanIdentifier(start);
        }
        if (c == '\'' || c == '"') {
            return scanStringLiteral(start);
        }
        if (c == '[') {
            return scanCharClass(start);
        }
        if (c == '@') {
            return scanLabel(start);
        }
        return scanOperator(start);
    }

    private GrammarToken scanIdentifier(SourceLocation start) {
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd() && isIdentifierPart(peek())) {
            sb.append(advance());
        }
        return new GrammarToken.Identifier(span(start), sb.toString());
    }

    private GrammarToken scanStringLiteral(SourceLocation start) {
        char quote = advance();
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd() && peek() != quote) {
            if (peek() == '\\' && pos + 1 < input.length()) {
                advance();
                sb.append(scanEscapeSequence());
            } else {
                sb.append(advance());
            }
        }
        if (isAtEnd()) {
            return new GrammarToken.Error(span(start), "Unterminated string literal");
        }
        advance();
        return new GrammarToken.StringLiteral(span(start), sb.toString());
    }

    private GrammarToken scanCharClass(SourceLocation start) {
        advance();
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd() && peek() != ']') {
            if (peek() == '\\' && pos + 1 < input.length()) {
                sb.append(advance());
            }
            sb.append(advance());
        }
        if (isAtEnd()) {
            return new GrammarToken.Error(span(start), "Unterminated character class");
        }
        advance();
        if (sb.length() == 0) {
            return new GrammarToken.Error(span(start), "Empty character class");
        }
        return new GrammarToken.CharClassLiteral(span(start), sb.toString());
    }

    private GrammarToken scanLabel(SourceLocation start) {
        advance();
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd() && isIdentifierPart(peek())) {
            sb.append(advance());
        }
        if (sb.length() == 0 || isAtEnd() || peek() != ':') {
            return new GrammarToken.Error(span(start), "Expected '@label:'");
        }
        advance();
        return new GrammarToken.Label(span(start), sb.toString());
    }

    private GrammarToken scanOperator(SourceLocation start) {
        char c = advance();
        return switch (c) {
            case '/' -> new GrammarToken.Slash(span(start));
            case '|' -> new GrammarToken.Pipe(span(start));
            case '&' -> new GrammarToken.Ampersand(span(start));
            case '!' -> new GrammarToken.Exclamation(span(start));
            case '?' -> new GrammarToken.Question(span(start));
            case '*' -> new GrammarToken.Star(span(start));
            case '+' -> new GrammarToken.Plus(span(start));
            case '.' -> new GrammarToken.Dot(span(start));
            case '(' -> new GrammarToken.LParen(span(start));
            case ')' -> new GrammarToken.RParen(span(start));
            default -> new GrammarToken.Error(span(start), "Unexpected character: " + c);
        };
    }

    private char scanEscapeSequence() {
        char c = advance();
        return switch (c) {
            case 'n' -> '\n';
            case 'r' -> '\r';
            case 't' -> '\t';
            case '0' -> '\0';
            case 'x' -> scanHexEscape(2, c);
            case 'u' -> scanHexEscape(4, c);
            default -> c;
        };
    }

    private char scanHexEscape(int digits, char marker) {
        if (pos + digits > input.length()) {
            return marker;
        }
        var hex = input.substring(pos, pos + digits);
        try {
            var value = Integer.parseInt(hex, 16);
            pos += digits;
            column += digits;
            return (char) value;
        } catch (NumberFormatException e) {
            return marker;
        }
    }

    private void skipWhitespaceAndComments() {
        while (!isAtEnd()) {
            char c = peek();
            if (c == ' ' || c == '\t' || c == '\r' || c == '\n') {
                advance();
            } else if (c == '#') {
                while (!isAtEnd() && peek() != '\n') {
                    advance();
                }
            } else {
                break;
            }
        }
    }

    private boolean isAtEnd() {
        return pos >= input.length();
    }

    private char peek() {
        return input.charAt(pos);
    }

    private char advance() {
        char c = input.charAt(pos++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private SourceLocation currentLocation() {
        return SourceLocation.at(line, column, pos);
    }

    private SourceSpan span(SourceLocation start) {
        return SourceSpan.of(start, currentLocation());
    }

    private static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || (c >= '0' && c <= '9');
    }
}
