package org.parsercraft.peg.grammar;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A complete PEG grammar: ordered rule table plus skipping directives.
 *
 * <p>Instances are immutable and may be shared by any number of interpreters. Rule ids
 * are renumbered in declaration order on construction.
 * Build them with {@link GrammarBuilder} or {@link GrammarParser}.
 */
public record Grammar(
    String name,
    Map<String, Rule> rules,
    String startRule,
    boolean skipWhitespace,
    List<String> commentPatterns) {

    public static final String DEFAULT_START_RULE = "program";
    public static final List<String> DEFAULT_COMMENT_PATTERNS = List.of("//.*", "/\\*[\\s\\S]*?\\*/");

    public Grammar {
        var numbered = new LinkedHashMap<String, Rule>();
        int id = 0;
        for (var rule : rules.values()) {
            numbered.put(rule.name(), rule.id() == id ? rule : rule.withId(id));
            id++;
        }
        rules = Collections.unmodifiableMap(numbered);
        commentPatterns = List.copyOf(commentPatterns);
    }

    public Optional<Rule> rule(String ruleName) {
        return Optional.ofNullable(rules.get(ruleName));
    }

    public boolean hasRule(String ruleName) {
        return rules.containsKey(ruleName);
    }

    List<Rule> ruleList() {
        return List.copyOf(rules.values());
    }

    /**
     * Memo identifier of a built-in token; tokens are numbered after the rules.
     */
    public int tokenId(TokenKind kind) {
        return rules.size() + kind.ordinal();
    }

    /**
     * Check undefined references, the start rule, left recursion and regular expressions.
     *
     * @return human-readable diagnostics, empty when the grammar is usable
     */
    public List<String> validate() {
        return GrammarValidator.validate(this);
    }

    public GrammarBuilder toBuilder() {
        var builder = GrammarBuilder.named(name)
                                    .start(startRule)
                                    .skipWhitespace(skipWhitespace)
                                    .commentPatterns(commentPatterns);
        rules.values()
             .forEach(r -> builder.addRule(r.name(), r.expression(), r.kind(), r.fragment()));
        return builder;
    }
}
