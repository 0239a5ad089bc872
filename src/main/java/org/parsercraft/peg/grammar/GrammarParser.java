package org.parsercraft.peg.grammar;

import org.parsercraft.peg.error.Diagnostic;
import org.parsercraft.peg.error.GrammarException;
import org.parsercraft.peg.parser.ParserConfig;
import org.parsercraft.peg.tree.SourceLocation;
import org.parsercraft.peg.tree.SourceSpan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Compiles PEG notation into a {@link Grammar}.
 *
 * <p>One rule per logical line ({@code name <- pattern}). A physical line continues the
 * previous rule when it starts with whitespace or {@code |} and has no {@code <-}.
 * Blank lines and lines starting with {@code #} are ignored.
 *
 * <p>Malformed input is skipped with a warning unless
 * {@link ParserConfig#strictGrammarText()} is set, in which case a
 * {@link GrammarException} is thrown.
 */
public final class GrammarParser {
    private static final Logger LOG = LoggerFactory.getLogger(GrammarParser.class);
    private static final Pattern RULE_LINE = Pattern.compile("(\\w+)\\s*<-\\s*(.*)", Pattern.DOTALL);
    private static final String DEFAULT_NAME = "custom";

    private final List<GrammarToken> tokens;
    private final List<String> problems = new ArrayList<>();
    private int pos;

    private GrammarParser(List<GrammarToken> tokens) {
        this.tokens = tokens;
        this.pos = 0;
    }

    /**
     * Compile grammar text with default settings.
     */
    public static Grammar parse(String grammarText) {
        return parse(grammarText, DEFAULT_NAME);
    }

    public static Grammar parse(String grammarText, String grammarName) {
        return parse(grammarText, grammarName, ParserConfig.DEFAULT);
    }

    public static Grammar parse(String grammarText, String grammarName, ParserConfig config) {
        return compile(grammarText, grammarName, config).build();
    }

    /**
     * Compile into a builder so callers can override directives before building.
     */
    static GrammarBuilder compile(String grammarText, String grammarName, ParserConfig config) {
        var builder = GrammarBuilder.named(grammarName);
        for (var logical : logicalLines(grammarText)) {
            compileRule(logical, grammarName, config, builder);
        }
        LOG.debug("Compiled grammar '{}'", grammarName);
        return builder;
    }

    /**
     * Compile a single pattern, as used on the right of {@code <-}.
     */
    public static Expression parsePattern(String pattern) {
        var parser = new GrammarParser(GrammarLexer.tokenize(pattern));
        var expression = parser.parseComplete();
        if (!parser.problems.isEmpty()) {
            throw new GrammarException(parser.problems);
        }
        return expression;
    }

    private static void compileRule(LogicalLine logical, String grammarName, ParserConfig config,
                                    GrammarBuilder builder) {
        var matcher = RULE_LINE.matcher(logical.text());
        if (!matcher.lookingAt()) {
            report(grammarName, config, logical.line(), 1,
                   "skipped malformed rule line '" + firstLine(logical.text()) + "'");
            return;
        }
        var ruleName = matcher.group(1);
        var tokens = GrammarLexer.tokenize(matcher.group(2), logical.line(), matcher.start(2) + 1);
        var parser = new GrammarParser(tokens);
        var expression = parser.parseComplete();
        for (var problem : parser.problems) {
            report(grammarName, config, logical.line(), 1, "rule '" + ruleName + "': " + problem);
        }
        builder.addRule(ruleName, expression);
    }

    private static void report(String grammarName, ParserConfig config, int line, int column, String message) {
        var location = SourceLocation.at(line, column, 0);
        if (config.strictGrammarText()) {
            throw GrammarException.of(grammarName + ":" + location + ": " + message);
        }
        LOG.warn(Diagnostic.warning(message, SourceSpan.at(location)).formatSimple(grammarName));
    }

    private static String firstLine(String text) {
        int newline = text.indexOf('\n');
        return newline < 0 ? text : text.substring(0, newline);
    }

    // === Logical lines ===

    private record LogicalLine(int line, String text) {}

    private static List<LogicalLine> logicalLines(String grammarText) {
        var result = new ArrayList<LogicalLine>();
        var lines = grammarText.split("\r?\n", -1);
        StringBuilder current = null;
        int currentLine = 0;
        int lastLine = 0;
        for (int i = 0; i < lines.length; i++) {
            var raw = lines[i];
            var stripped = raw.strip();
            if (stripped.isEmpty() || stripped.startsWith("#")) {
                continue;
            }
            boolean continuation = current != null
                                   && (Character.isWhitespace(raw.charAt(0)) || raw.charAt(0) == '|')
                                   && !stripped.contains("<-");
            if (continuation) {
                // Keep physical line numbers for diagnostics.
                current.append("\n".repeat(i + 1 - lastLine)).append(stripped);
            } else {
                if (current != null) {
                    result.add(new LogicalLine(currentLine, current.toString()));
                }
                current = new StringBuilder(stripped);
                currentLine = i + 1;
            }
            lastLine = i + 1;
        }
        if (current != null) {
            result.add(new LogicalLine(currentLine, current.toString()));
        }
        return result;
    }

    // === Pattern parsing ===

    private Expression parseComplete() {
        var expression = parseChoice();
        if (!isAtEnd()) {
            var token = peek();
            problems.add("dropped pattern text from column " + token.span().start().column()
                         + " (" + describe(token) + ")");
        }
        return expression;
    }

    private Expression parseChoice() {
        var alternatives = new ArrayList<Expression>();
        alternatives.add(parseSequence());
        while (peek() instanceof GrammarToken.Slash || peek() instanceof GrammarToken.Pipe) {
            advance();
            alternatives.add(parseSequence());
        }
        if (alternatives.size() == 1) {
            return alternatives.get(0);
        }
        return new Expression.Choice(alternatives);
    }

    private Expression parseSequence() {
        var elements = new ArrayList<Expression>();
        while (isSequenceElement()) {
            var element = parsePrefix();
            if (element == null) {
                break;
            }
            elements.add(element);
        }
        if (elements.isEmpty()) {
            return new Expression.Literal("");
        }
        if (elements.size() == 1) {
            return elements.get(0);
        }
        return new Expression.Sequence(elements);
    }

    private boolean isSequenceElement() {
        var token = peek();
        return token instanceof GrammarToken.Identifier
               || token instanceof GrammarToken.StringLiteral
               || token instanceof GrammarToken.CharClassLiteral
               || token instanceof GrammarToken.Dot
               || token instanceof GrammarToken.LParen
               || token instanceof GrammarToken.Ampersand
               || token instanceof GrammarToken.Exclamation
               || token instanceof GrammarToken.Label;
    }

    private Expression parsePrefix() {
        var token = peek();
        if (token instanceof GrammarToken.Ampersand) {
            advance();
            var inner = parsePrefix();
            return inner == null ? null : new Expression.And(inner);
        }
        if (token instanceof GrammarToken.Exclamation) {
            advance();
            var inner = parsePrefix();
            return inner == null ? null : new Expression.Not(inner);
        }
        if (token instanceof GrammarToken.Label label) {
            advance();
            var inner = parsePrefix();
            return inner == null ? null : new Expression.Capture(label.name(), inner);
        }
        return parseSuffix();
    }

    private Expression parseSuffix() {
        var expr = parsePrimary();
        if (expr == null) {
            return null;
        }
        while (true) {
            if (peek() instanceof GrammarToken.Star) {
                advance();
                expr = new Expression.ZeroOrMore(expr);
            } else if (peek() instanceof GrammarToken.Plus) {
                advance();
                expr = new Expression.OneOrMore(expr);
            } else if (peek() instanceof GrammarToken.Question) {
                advance();
                expr = new Expression.Optional(expr);
            } else {
                break;
            }
        }
        return expr;
    }

    private Expression parsePrimary() {
        var token = peek();
        if (token instanceof GrammarToken.Identifier id) {
            advance();
            return TokenKind.byName(id.name())
                            .<Expression>map(Expression.Token::new)
                            .orElseGet(() -> new Expression.Reference(id.name()));
        }
        if (token instanceof GrammarToken.StringLiteral str) {
            advance();
            return new Expression.Literal(str.value());
        }
        if (token instanceof GrammarToken.CharClassLiteral cc) {
            advance();
            return new Expression.CharClass(cc.pattern());
        }
        if (token instanceof GrammarToken.Dot) {
            advance();
            return new Expression.Any();
        }
        if (token instanceof GrammarToken.LParen) {
            advance();
            var inner = parseChoice();
            if (peek() instanceof GrammarToken.RParen) {
                advance();
            } else if (isAtEnd()) {
                problems.add("unclosed '(' at column " + token.span().start().column());
            }
            return inner;
        }
        return null;
    }

    private boolean isAtEnd() {
        return peek() instanceof GrammarToken.Eof;
    }

    private GrammarToken peek() {
        return tokens.get(pos);
    }

    private void advance() {
        if (!isAtEnd()) {
            pos++;
        }
    }

    private static String describe(GrammarToken token) {
        if (token instanceof GrammarToken.Error error) {
            return error.message();
        }
        if (token instanceof GrammarToken.Identifier id) {
            return "identifier '" + id.name() + "'";
        }
        if (token instanceof GrammarToken.RParen) {
            return "unbalanced ')'";
        }
        if (token instanceof GrammarToken.Star
            || token instanceof GrammarToken.Plus
            || token instanceof GrammarToken.Question) {
            return "suffix operator without operand";
        }
        return "unexpected " + token.getClass().getSimpleName();
    }
}
