package org.parsercraft.peg.grammar;

import org.parsercraft.peg.error.GrammarException;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Programmatic grammar construction.
 *
 * <pre>{@code
 * import static org.parsercraft.peg.grammar.GrammarBuilder.*;
 *
 * var grammar = GrammarBuilder.named("calc")
 *     .addRule("program", star(ref("statement")))
 *     .addRule("statement", seq(ident(), lit("="), ref("expr"), lit(";")))
 *     .addRule("expr", seq(ref("term"), star(seq(choice(lit("+"), lit("-")), ref("term")))))
 *     .addRule("term", choice(number(), ident()))
 *     .build();
 * }</pre>
 */
public final class GrammarBuilder {
    private final String name;
    private final Map<String, Rule> rules = new LinkedHashMap<>();
    private String startRule;
    private boolean skipWhitespace = true;
    private List<String> commentPatterns = Grammar.DEFAULT_COMMENT_PATTERNS;

    private GrammarBuilder(String name) {
        this.name = name;
    }

    public static GrammarBuilder named(String name) {
        return new GrammarBuilder(name);
    }

    public static GrammarBuilder create() {
        return new GrammarBuilder("custom");
    }

    /**
     * Register a rule, replacing any earlier rule with the same name.
     */
    public GrammarBuilder addRule(String ruleName, Expression expression) {
        return addRule(ruleName, expression, ruleName, false);
    }

    public GrammarBuilder addRule(String ruleName, Expression expression, String kind, boolean fragment) {
        rules.put(ruleName, new Rule(-1, ruleName, expression, kind, fragment));
        return this;
    }

    public GrammarBuilder addFragment(String ruleName, Expression expression) {
        return addRule(ruleName, expression, ruleName, true);
    }

    public GrammarBuilder start(String ruleName) {
        this.startRule = ruleName;
        return this;
    }

    public GrammarBuilder skipWhitespace(boolean skip) {
        this.skipWhitespace = skip;
        return this;
    }

    public GrammarBuilder commentPatterns(List<String> patterns) {
        this.commentPatterns = List.copyOf(patterns);
        return this;
    }

    public boolean hasRule(String ruleName) {
        return rules.containsKey(ruleName);
    }

    /**
     * Build the grammar without validating it. The start rule defaults to {@code program}
     * when declared (or when nothing is declared), otherwise to the first rule.
     */
    public Grammar build() {
        return new Grammar(name, rules, effectiveStart(), skipWhitespace, commentPatterns);
    }

    /**
     * Build and validate.
     *
     * @throws GrammarException if validation reports any diagnostic
     */
    public Grammar buildValidated() {
        var grammar = build();
        var diagnostics = grammar.validate();
        if (!diagnostics.isEmpty()) {
            throw new GrammarException(diagnostics);
        }
        return grammar;
    }

    private String effectiveStart() {
        if (startRule != null) {
            return startRule;
        }
        if (rules.isEmpty() || rules.containsKey(Grammar.DEFAULT_START_RULE)) {
            return Grammar.DEFAULT_START_RULE;
        }
        return rules.keySet().iterator().next();
    }

    // === Expression factories ===

    public static Expression seq(Expression... items) {
        return items.length == 1 ? items[0] : new Expression.Sequence(Arrays.asList(items));
    }

    public static Expression choice(Expression... items) {
        return items.length == 1 ? items[0] : new Expression.Choice(Arrays.asList(items));
    }

    public static Expression star(Expression item) {
        return new Expression.ZeroOrMore(item);
    }

    public static Expression plus(Expression item) {
        return new Expression.OneOrMore(item);
    }

    public static Expression opt(Expression item) {
        return new Expression.Optional(item);
    }

    public static Expression lit(String text) {
        return new Expression.Literal(text);
    }

    public static Expression ref(String ruleName) {
        return TokenKind.byName(ruleName)
                        .<Expression>map(Expression.Token::new)
                        .orElseGet(() -> new Expression.Reference(ruleName));
    }

    public static Expression token(TokenKind kind) {
        return new Expression.Token(kind);
    }

    public static Expression ident() {
        return token(TokenKind.IDENT);
    }

    public static Expression number() {
        return token(TokenKind.NUMBER);
    }

    public static Expression string() {
        return token(TokenKind.STRING);
    }

    public static Expression newline() {
        return token(TokenKind.NEWLINE);
    }

    public static Expression eof() {
        return token(TokenKind.EOF);
    }

    public static Expression charClass(String pattern) {
        return new Expression.CharClass(pattern);
    }

    public static Expression anyChar() {
        return new Expression.Any();
    }

    public static Expression and(Expression item) {
        return new Expression.And(item);
    }

    public static Expression not(Expression item) {
        return new Expression.Not(item);
    }

    public static Expression capture(String label, Expression item) {
        return new Expression.Capture(label, item);
    }
}
