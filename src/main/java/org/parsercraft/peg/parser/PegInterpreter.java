package org.parsercraft.peg.parser;

import org.parsercraft.peg.error.GrammarException;
import org.parsercraft.peg.error.ParseError;
import org.parsercraft.peg.error.ParseException;
import org.parsercraft.peg.grammar.Expression;
import org.parsercraft.peg.grammar.Grammar;
import org.parsercraft.peg.grammar.Rule;
import org.parsercraft.peg.grammar.TokenKind;
import org.parsercraft.peg.parser.ParseResult.NodePiece;
import org.parsercraft.peg.parser.ParseResult.Piece;
import org.parsercraft.peg.parser.ParseResult.Success;
import org.parsercraft.peg.parser.ParseResult.TextPiece;
import org.parsercraft.peg.tree.SourceAst;
import org.parsercraft.peg.tree.SourceLocation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import static org.parsercraft.peg.parser.ParsingContext.END;

/**
 * Packrat PEG interpreter - executes a {@link Grammar} against source text.
 *
 * <p>Each call works on a fresh {@link ParsingContext}, so one interpreter may serve any
 * number of parses, also concurrently.
 */
public final class PegInterpreter {
    private static final Logger LOG = LoggerFactory.getLogger(PegInterpreter.class);

    private final Grammar grammar;
    private final ParserConfig config;
    private final List<Pattern> commentPatterns;
    private final Map<String, Pattern> classPatterns = new ConcurrentHashMap<>();

    private PegInterpreter(Grammar grammar, ParserConfig config, List<Pattern> commentPatterns) {
        this.grammar = grammar;
        this.config = config;
        this.commentPatterns = commentPatterns;
    }

    public static PegInterpreter create(Grammar grammar) {
        return create(grammar, ParserConfig.DEFAULT);
    }

    /**
     * @throws GrammarException if a comment pattern is not a valid regular expression
     */
    public static PegInterpreter create(Grammar grammar, ParserConfig config) {
        var patterns = new ArrayList<Pattern>();
        for (var comment : grammar.commentPatterns()) {
            try {
                patterns.add(Pattern.compile(comment));
            } catch (PatternSyntaxException e) {
                throw new GrammarException("Invalid comment pattern '" + comment + "'", e);
            }
        }
        return new PegInterpreter(grammar, config, List.copyOf(patterns));
    }

    public Grammar grammar() {
        return grammar;
    }

    public ParserConfig config() {
        return config;
    }

    /**
     * Parse the whole source with the start rule.
     *
     * @throws ParseException if the source does not match or input remains
     */
    public SourceAst parse(String source) {
        return parseRule(grammar.startRule(), source);
    }

    /**
     * Parse the whole source starting from the named rule.
     *
     * @throws ParseException if the rule is unknown, the source does not match or input remains
     */
    public SourceAst parseRule(String ruleName, String source) {
        var rule = requireRule(ruleName);
        long started = System.nanoTime();
        var ctx = ParsingContext.create(source, grammar, config, commentPatterns, false);
        var result = new Evaluation(ctx).invoke(rule);
        var tree = complete(ctx, result);
        LOG.debug("Parsed {} chars with rule '{}' of grammar '{}' ({} rules) in {} us",
                  source.length(), ruleName, grammar.name(), grammar.rules().size(),
                  (System.nanoTime() - started) / 1000);
        return tree;
    }

    /**
     * Parse like {@link #parse(String)}, also recording a {@link RuleTrace} for every rule node.
     */
    public TracedParse trace(String source) {
        var rule = requireRule(grammar.startRule());
        var ctx = ParsingContext.create(source, grammar, config, commentPatterns, true);
        var result = new Evaluation(ctx).invoke(rule);
        var tree = complete(ctx, result);
        int end = ((Success) result).end();
        return new TracedParse(tree, end, ctx.reach(), ctx.traces());
    }

    /**
     * Match one rule at {@code origin} inside the full source, without requiring the rest of
     * the input to be consumed.
     *
     * @return the traced match, empty when the rule fails or produces no node
     * @throws ParseException if the rule is unknown or the nesting depth is exceeded
     */
    public Optional<TracedParse> traceRule(String ruleName, String source, int origin) {
        var rule = requireRule(ruleName);
        if (origin < 0 || origin > source.length()) {
            throw new IllegalArgumentException("Origin " + origin + " outside [0, " + source.length() + "]");
        }
        var ctx = ParsingContext.create(source, grammar, config, commentPatterns, true);
        ctx.setPos(origin);
        var result = new Evaluation(ctx).invoke(rule);
        if (!(result instanceof Success success)) {
            return Optional.empty();
        }
        return success.value()
                      .filter(NodePiece.class::isInstance)
                      .map(piece -> new TracedParse(((NodePiece) piece).node(), success.end(),
                                                    ctx.reach(), ctx.traces()));
    }

    private Rule requireRule(String ruleName) {
        return grammar.rule(ruleName)
                      .orElseThrow(() -> new ParseException(new ParseError.UnknownRule(SourceLocation.START, ruleName)));
    }

    private SourceAst complete(ParsingContext ctx, ParseResult result) {
        if (!(result instanceof Success success)) {
            int at = ctx.furthestPos();
            throw new ParseException(new ParseError.UnexpectedInput(ctx.location(at), ctx.furthestRule(),
                                                                    ctx.snippetAt(at)));
        }
        ctx.setPos(success.end());
        ctx.skipTrailing();
        if (ctx.pos() < ctx.length()) {
            throw new ParseException(new ParseError.TrailingInput(ctx.location(ctx.pos()), ctx.snippetAt(ctx.pos())));
        }
        if (success.value().isPresent() && success.value().get() instanceof NodePiece root) {
            return root.node();
        }
        // Fragment start rule: wrap whatever it matched.
        return synthesize(ctx, SourceAst.PROGRAM, 0, success);
    }

    /**
     * Build the node of a non-fragment rule from its match.
     */
    private static SourceAst synthesize(ParsingContext ctx, String kind, int start, Success success) {
        var span = ctx.span(start, success.end());
        var text = ctx.substring(start, success.end());
        if (success.value().isPresent()) {
            var value = success.value().get();
            if (value instanceof NodePiece piece) {
                return SourceAst.branch(kind, List.of(piece.node()), span, text);
            }
            var matched = ((TextPiece) value).text();
            if (!matched.isEmpty()) {
                return SourceAst.leaf(kind, matched, span, text);
            }
        }
        var children = new ArrayList<SourceAst>();
        for (var part : success.parts()) {
            if (part instanceof NodePiece piece) {
                children.add(piece.node());
            } else {
                var textPiece = (TextPiece) part;
                if (!textPiece.text().isBlank()) {
                    children.add(SourceAst.leaf(SourceAst.OPERATOR, textPiece.text(),
                                                ctx.span(textPiece.start(), textPiece.end()), textPiece.text()));
                }
            }
        }
        return SourceAst.branch(kind, children, span, text);
    }

    private Pattern classPattern(Expression.CharClass charClass) {
        return classPatterns.computeIfAbsent(charClass.pattern(), key -> {
            try {
                return Pattern.compile(charClass.regex());
            } catch (PatternSyntaxException e) {
                throw new GrammarException("Invalid character class '" + charClass.regex() + "'", e);
            }
        });
    }

    private static boolean isWordChar(int c) {
        return c != END && (Character.isLetterOrDigit(c) || c == '_');
    }

    /**
     * One evaluation over one context. Every visit leaves the cursor after the match on
     * success and at its starting offset on failure.
     */
    private final class Evaluation implements Expression.Visitor<ParseResult> {
        private final ParsingContext ctx;

        private Evaluation(ParsingContext ctx) {
            this.ctx = ctx;
        }

        ParseResult invoke(Rule rule) {
            int origin = ctx.pos();
            var cached = ctx.cachedAt(rule.id(), origin);
            if (cached.isPresent()) {
                return reuse(cached.get(), origin);
            }
            var previous = ctx.enterRule(rule.name());
            int firstSeq = ctx.seq();
            int reachBefore = ctx.reach();
            ParseResult result;
            try {
                ctx.touch(origin);
                ctx.skipIgnored();
                int start = ctx.pos();
                ctx.noteAttempt(start);
                result = rule.expression().accept(this);
                if (result instanceof Success success && !rule.fragment()) {
                    var node = synthesize(ctx, rule.kind(), start, success);
                    ctx.register(node, rule.name(), origin, reachBefore);
                    result = Success.of(success.end(), new NodePiece(node));
                }
            } finally {
                ctx.exitRule(previous);
            }
            ctx.cacheAt(rule.id(), origin, result, firstSeq);
            return settle(result, origin);
        }

        private ParseResult token(TokenKind kind) {
            int origin = ctx.pos();
            int id = grammar.tokenId(kind);
            var cached = ctx.cachedAt(id, origin);
            if (cached.isPresent()) {
                return reuse(cached.get(), origin);
            }
            int firstSeq = ctx.seq();
            ctx.touch(origin);
            // NEWLINE must see the line break itself.
            if (kind != TokenKind.NEWLINE) {
                ctx.skipIgnored();
            }
            int start = ctx.pos();
            var result = BuiltinTokens.match(kind, ctx, start);
            if (result.isFailure()) {
                ctx.noteAttempt(start);
            }
            ctx.cacheAt(id, origin, result, firstSeq);
            return settle(result, origin);
        }

        private ParseResult reuse(ParsingContext.MemoEntry entry, int origin) {
            ctx.replay(entry, origin);
            return settle(entry.result(), origin);
        }

        private ParseResult settle(ParseResult result, int origin) {
            ctx.setPos(result instanceof Success success ? success.end() : origin);
            return result;
        }

        private ParseResult descend(Expression expression) {
            ctx.enterExpression();
            try {
                return expression.accept(this);
            } finally {
                ctx.exitExpression();
            }
        }

        private ParseResult fail(int origin, int attempted) {
            ctx.noteAttempt(attempted);
            ctx.setPos(origin);
            return ParseResult.FAILURE;
        }

        // === Combinators ===

        @Override
        public ParseResult visitSequence(Expression.Sequence sequence) {
            int origin = ctx.pos();
            var parts = new ArrayList<Piece>();
            for (var element : sequence.elements()) {
                var result = descend(element);
                if (!(result instanceof Success success)) {
                    ctx.setPos(origin);
                    return ParseResult.FAILURE;
                }
                collect(success, parts);
            }
            return Success.ofParts(ctx.pos(), parts);
        }

        @Override
        public ParseResult visitChoice(Expression.Choice choice) {
            int origin = ctx.pos();
            for (var alternative : choice.alternatives()) {
                var result = descend(alternative);
                if (result.isSuccess()) {
                    return result;
                }
                ctx.setPos(origin);
            }
            return ParseResult.FAILURE;
        }

        // === Repetition ===

        @Override
        public ParseResult visitZeroOrMore(Expression.ZeroOrMore zeroOrMore) {
            return repeat(zeroOrMore.expression(), 0);
        }

        @Override
        public ParseResult visitOneOrMore(Expression.OneOrMore oneOrMore) {
            return repeat(oneOrMore.expression(), 1);
        }

        private ParseResult repeat(Expression expression, int minimum) {
            int origin = ctx.pos();
            var parts = new ArrayList<Piece>();
            int count = 0;
            while (true) {
                int before = ctx.pos();
                var result = descend(expression);
                // A match without progress would repeat forever.
                if (!(result instanceof Success success) || success.end() == before) {
                    ctx.setPos(before);
                    break;
                }
                collect(success, parts);
                count++;
            }
            if (count < minimum) {
                ctx.setPos(origin);
                return ParseResult.FAILURE;
            }
            return Success.ofParts(ctx.pos(), parts);
        }

        @Override
        public ParseResult visitOptional(Expression.Optional optional) {
            int origin = ctx.pos();
            var result = descend(optional.expression());
            if (result.isSuccess()) {
                return result;
            }
            ctx.setPos(origin);
            return Success.empty(origin);
        }

        private void collect(Success success, List<Piece> parts) {
            success.value().ifPresent(parts::add);
            parts.addAll(success.parts());
        }

        // === Predicates ===

        @Override
        public ParseResult visitAnd(Expression.And and) {
            int origin = ctx.pos();
            var result = descend(and.expression());
            ctx.setPos(origin);
            return result.isSuccess() ? Success.empty(origin) : ParseResult.FAILURE;
        }

        @Override
        public ParseResult visitNot(Expression.Not not) {
            int origin = ctx.pos();
            var result = descend(not.expression());
            ctx.setPos(origin);
            return result.isSuccess() ? ParseResult.FAILURE : Success.empty(origin);
        }

        // === Terminals ===

        @Override
        public ParseResult visitLiteral(Expression.Literal literal) {
            int origin = ctx.pos();
            ctx.skipIgnored();
            int start = ctx.pos();
            var text = literal.text();
            for (int i = 0; i < text.length(); i++) {
                if (ctx.peekAt(start + i) != text.charAt(i)) {
                    return fail(origin, start);
                }
            }
            int end = start + text.length();
            // Keywords must not run into a longer word: 'END' does not match "ENDIF".
            if (literal.isKeyword() && isWordChar(ctx.peekAt(end))) {
                return fail(origin, start);
            }
            ctx.setPos(end);
            return Success.of(end, new TextPiece(text, start, end));
        }

        @Override
        public ParseResult visitCharClass(Expression.CharClass charClass) {
            int start = ctx.pos();
            int c = ctx.peekAt(start);
            if (c == END || !classPattern(charClass).matcher(String.valueOf((char) c)).matches()) {
                return fail(start, start);
            }
            ctx.setPos(start + 1);
            return Success.of(start + 1, new TextPiece(String.valueOf((char) c), start, start + 1));
        }

        @Override
        public ParseResult visitAny(Expression.Any any) {
            int start = ctx.pos();
            int c = ctx.peekAt(start);
            if (c == END) {
                return fail(start, start);
            }
            ctx.setPos(start + 1);
            return Success.of(start + 1, new TextPiece(String.valueOf((char) c), start, start + 1));
        }

        @Override
        public ParseResult visitReference(Expression.Reference reference) {
            var name = reference.ruleName();
            if (TokenKind.resolvesReference(name)) {
                return token(TokenKind.valueOf(name));
            }
            var rule = grammar.rules().get(name);
            if (rule == null) {
                return fail(ctx.pos(), ctx.pos());
            }
            return invoke(rule);
        }

        @Override
        public ParseResult visitToken(Expression.Token token) {
            return token(token.kind());
        }

        @Override
        public ParseResult visitCapture(Expression.Capture capture) {
            return descend(capture.expression());
        }
    }
}
