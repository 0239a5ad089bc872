package org.parsercraft.peg.parser;

import org.parsercraft.peg.grammar.TokenKind;
import org.parsercraft.peg.tree.SourceAst;

import java.math.BigInteger;

import static org.parsercraft.peg.parser.ParsingContext.END;

/**
 * Recognizers for the built-in token kinds. Each one starts at the given offset and leaves
 * the cursor alone; the caller moves it on success.
 */
final class BuiltinTokens {
    private BuiltinTokens() {}

    static ParseResult match(TokenKind kind, ParsingContext ctx, int start) {
        return switch (kind) {
            case NUMBER -> number(ctx, start);
            case STRING -> string(ctx, start);
            case IDENT -> identifier(ctx, start);
            case NEWLINE -> newline(ctx, start);
            case EOF -> endOfInput(ctx, start);
            case INDENT, DEDENT -> ParseResult.FAILURE;
        };
    }

    /**
     * {@code [0-9]+(\.[0-9]+)?([eE][+-]?[0-9]+)?}
     */
    private static ParseResult number(ParsingContext ctx, int start) {
        int i = start;
        if (!isDigit(ctx.peekAt(i))) {
            return ParseResult.FAILURE;
        }
        while (isDigit(ctx.peekAt(i))) {
            i++;
        }
        boolean decimal = false;
        if (ctx.peekAt(i) == '.' && isDigit(ctx.peekAt(i + 1))) {
            i++;
            while (isDigit(ctx.peekAt(i))) {
                i++;
            }
            decimal = true;
        }
        int e = ctx.peekAt(i);
        if (e == 'e' || e == 'E') {
            int j = i + 1;
            int sign = ctx.peekAt(j);
            if (sign == '+' || sign == '-') {
                j++;
            }
            if (isDigit(ctx.peekAt(j))) {
                while (isDigit(ctx.peekAt(j))) {
                    j++;
                }
                i = j;
                decimal = true;
            }
        }
        var text = ctx.substring(start, i);
        var node = SourceAst.leaf(SourceAst.NUMBER, numberValue(text, decimal), ctx.span(start, i), text);
        return ParseResult.Success.of(i, new ParseResult.NodePiece(node));
    }

    private static Object numberValue(String text, boolean decimal) {
        if (decimal) {
            return Double.parseDouble(text);
        }
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            return new BigInteger(text);
        }
    }

    /**
     * Single- or double-quoted; a backslash escapes the next character. The value is the
     * raw text between the quotes.
     */
    private static ParseResult string(ParsingContext ctx, int start) {
        int quote = ctx.peekAt(start);
        if (quote != '"' && quote != '\'') {
            return ParseResult.FAILURE;
        }
        int i = start + 1;
        while (true) {
            int c = ctx.peekAt(i);
            if (c == END) {
                return ParseResult.FAILURE;
            }
            if (c == '\\' && ctx.peekAt(i + 1) != END) {
                i += 2;
            } else if (c == quote) {
                break;
            } else {
                i++;
            }
        }
        int end = i + 1;
        var node = SourceAst.leaf(SourceAst.STRING, ctx.substring(start + 1, i), ctx.span(start, end),
                                  ctx.substring(start, end));
        return ParseResult.Success.of(end, new ParseResult.NodePiece(node));
    }

    /**
     * {@code [A-Za-z_][A-Za-z0-9_]*}
     */
    private static ParseResult identifier(ParsingContext ctx, int start) {
        if (!isIdentifierStart(ctx.peekAt(start))) {
            return ParseResult.FAILURE;
        }
        int i = start + 1;
        while (isIdentifierPart(ctx.peekAt(i))) {
            i++;
        }
        var text = ctx.substring(start, i);
        var node = SourceAst.leaf(SourceAst.IDENTIFIER, text, ctx.span(start, i), text);
        return ParseResult.Success.of(i, new ParseResult.NodePiece(node));
    }

    private static ParseResult newline(ParsingContext ctx, int start) {
        int c = ctx.peekAt(start);
        if (c == '\n') {
            return ParseResult.Success.empty(start + 1);
        }
        if (c == '\r' && ctx.peekAt(start + 1) == '\n') {
            return ParseResult.Success.empty(start + 2);
        }
        return ParseResult.FAILURE;
    }

    /**
     * Succeeds without consuming when only whitespace remains.
     */
    private static ParseResult endOfInput(ParsingContext ctx, int start) {
        int i = start;
        int c;
        while ((c = ctx.peekAt(i)) != END && Character.isWhitespace(c)) {
            i++;
        }
        return c == END ? ParseResult.Success.empty(start) : ParseResult.FAILURE;
    }

    private static boolean isDigit(int c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isIdentifierStart(int c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isIdentifierPart(int c) {
        return isIdentifierStart(c) || isDigit(c);
    }
}
