package org.parsercraft.peg.grammar;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Static checks run before a grammar is executed.
 */
final class GrammarValidator {
    private final Grammar grammar;
    private final Map<String, Boolean> nullable = new HashMap<>();

    private GrammarValidator(Grammar grammar) {
        this.grammar = grammar;
    }

    static List<String> validate(Grammar grammar) {
        return new GrammarValidator(grammar).run();
    }

    private List<String> run() {
        var errors = new ArrayList<String>();
        for (var rule : grammar.rules().values()) {
            for (var target : collectReferences(rule.expression())) {
                if (!grammar.hasRule(target) && !TokenKind.resolvesReference(target)) {
                    errors.add("Rule '" + rule.name() + "' references undefined rule '" + target + "'");
                }
            }
        }
        if (!grammar.hasRule(grammar.startRule())) {
            errors.add("Start rule '" + grammar.startRule() + "' is not defined");
        }
        computeNullable();
        var leftEdges = new HashMap<String, Set<String>>();
        for (var rule : grammar.rules().values()) {
            leftEdges.put(rule.name(), rule.expression().accept(new LeftReferences()));
        }
        for (var rule : grammar.rules().values()) {
            if (reachesItself(rule.name(), leftEdges)) {
                errors.add("Rule '" + rule.name() + "' is left-recursive (not allowed in PEG)");
            }
        }
        for (var rule : grammar.rules().values()) {
            for (var regex : collectCharClasses(rule.expression())) {
                if (!compiles(regex)) {
                    errors.add("Rule '" + rule.name() + "' has invalid character class '" + regex + "'");
                }
            }
        }
        for (var comment : grammar.commentPatterns()) {
            if (!compiles(comment)) {
                errors.add("Invalid comment pattern '" + comment + "'");
            }
        }
        return errors;
    }

    private static boolean compiles(String regex) {
        try {
            Pattern.compile(regex);
            return true;
        } catch (PatternSyntaxException e) {
            return false;
        }
    }

    private static boolean reachesItself(String start, Map<String, Set<String>> edges) {
        var visited = new HashSet<String>();
        var pending = new ArrayList<>(edges.getOrDefault(start, Set.of()));
        while (!pending.isEmpty()) {
            var next = pending.remove(pending.size() - 1);
            if (next.equals(start)) {
                return true;
            }
            if (visited.add(next)) {
                pending.addAll(edges.getOrDefault(next, Set.of()));
            }
        }
        return false;
    }

    // Least fixed point: a rule is nullable once its body can match without input.
    private void computeNullable() {
        grammar.rules().keySet().forEach(name -> nullable.put(name, false));
        boolean changed = true;
        while (changed) {
            changed = false;
            for (var rule : grammar.rules().values()) {
                if (!nullable.get(rule.name()) && rule.expression().accept(new Nullable())) {
                    nullable.put(rule.name(), true);
                    changed = true;
                }
            }
        }
    }

    private static Set<String> collectReferences(Expression expression) {
        var refs = new LinkedHashSet<String>();
        expression.accept(new Walker() {
            @Override
            public Void visitReference(Expression.Reference reference) {
                refs.add(reference.ruleName());
                return null;
            }
        });
        return refs;
    }

    private static Set<String> collectCharClasses(Expression expression) {
        var classes = new LinkedHashSet<String>();
        expression.accept(new Walker() {
            @Override
            public Void visitCharClass(Expression.CharClass charClass) {
                classes.add(charClass.regex());
                return null;
            }
        });
        return classes;
    }

    /**
     * Whether an expression can succeed without consuming input.
     */
    private final class Nullable implements Expression.Visitor<Boolean> {
        @Override
        public Boolean visitSequence(Expression.Sequence sequence) {
            return sequence.elements().stream().allMatch(e -> e.accept(this));
        }

        @Override
        public Boolean visitChoice(Expression.Choice choice) {
            return choice.alternatives().stream().anyMatch(e -> e.accept(this));
        }

        @Override
        public Boolean visitZeroOrMore(Expression.ZeroOrMore zeroOrMore) {
            return true;
        }

        @Override
        public Boolean visitOneOrMore(Expression.OneOrMore oneOrMore) {
            return oneOrMore.expression().accept(this);
        }

        @Override
        public Boolean visitOptional(Expression.Optional optional) {
            return true;
        }

        @Override
        public Boolean visitAnd(Expression.And and) {
            return true;
        }

        @Override
        public Boolean visitNot(Expression.Not not) {
            return true;
        }

        @Override
        public Boolean visitLiteral(Expression.Literal literal) {
            return literal.text().isEmpty();
        }

        @Override
        public Boolean visitCharClass(Expression.CharClass charClass) {
            return false;
        }

        @Override
        public Boolean visitAny(Expression.Any any) {
            return false;
        }

        @Override
        public Boolean visitReference(Expression.Reference reference) {
            if (grammar.hasRule(reference.ruleName())) {
                return nullable.getOrDefault(reference.ruleName(), false);
            }
            return "EOF".equals(reference.ruleName());
        }

        @Override
        public Boolean visitToken(Expression.Token token) {
            return token.kind() == TokenKind.EOF;
        }

        @Override
        public Boolean visitCapture(Expression.Capture capture) {
            return capture.expression().accept(this);
        }
    }

    /**
     * Rules that may be invoked at the position where an expression starts.
     */
    private final class LeftReferences implements Expression.Visitor<Set<String>> {
        @Override
        public Set<String> visitSequence(Expression.Sequence sequence) {
            var result = new HashSet<String>();
            for (var element : sequence.elements()) {
                result.addAll(element.accept(this));
                if (!element.accept(new Nullable())) {
                    break;
                }
            }
            return result;
        }

        @Override
        public Set<String> visitChoice(Expression.Choice choice) {
            var result = new HashSet<String>();
            choice.alternatives().forEach(alt -> result.addAll(alt.accept(this)));
            return result;
        }

        @Override
        public Set<String> visitZeroOrMore(Expression.ZeroOrMore zeroOrMore) {
            return zeroOrMore.expression().accept(this);
        }

        @Override
        public Set<String> visitOneOrMore(Expression.OneOrMore oneOrMore) {
            return oneOrMore.expression().accept(this);
        }

        @Override
        public Set<String> visitOptional(Expression.Optional optional) {
            return optional.expression().accept(this);
        }

        @Override
        public Set<String> visitAnd(Expression.And and) {
            return and.expression().accept(this);
        }

        @Override
        public Set<String> visitNot(Expression.Not not) {
            return not.expression().accept(this);
        }

        @Override
        public Set<String> visitLiteral(Expression.Literal literal) {
            return Set.of();
        }

        @Override
        public Set<String> visitCharClass(Expression.CharClass charClass) {
            return Set.of();
        }

        @Override
        public Set<String> visitAny(Expression.Any any) {
            return Set.of();
        }

        @Override
        public Set<String> visitReference(Expression.Reference reference) {
            return Set.of(reference.ruleName());
        }

        @Override
        public Set<String> visitToken(Expression.Token token) {
            return Set.of();
        }

        @Override
        public Set<String> visitCapture(Expression.Capture capture) {
            return capture.expression().accept(this);
        }
    }

    /**
     * Visits every sub-expression; override the leaves of interest.
     */
    private abstract static class Walker implements Expression.Visitor<Void> {
        @Override
        public Void visitSequence(Expression.Sequence sequence) {
            sequence.elements().forEach(e -> e.accept(this));
            return null;
        }

        @Override
        public Void visitChoice(Expression.Choice choice) {
            choice.alternatives().forEach(e -> e.accept(this));
            return null;
        }

        @Override
        public Void visitZeroOrMore(Expression.ZeroOrMore zeroOrMore) {
            return zeroOrMore.expression().accept(this);
        }

        @Override
        public Void visitOneOrMore(Expression.OneOrMore oneOrMore) {
            return oneOrMore.expression().accept(this);
        }

        @Override
        public Void visitOptional(Expression.Optional optional) {
            return optional.expression().accept(this);
        }

        @Override
        public Void visitAnd(Expression.And and) {
            return and.expression().accept(this);
        }

        @Override
        public Void visitNot(Expression.Not not) {
            return not.expression().accept(this);
        }

        @Override
        public Void visitLiteral(Expression.Literal literal) {
            return null;
        }

        @Override
        public Void visitCharClass(Expression.CharClass charClass) {
            return null;
        }

        @Override
        public Void visitAny(Expression.Any any) {
            return null;
        }

        @Override
        public Void visitReference(Expression.Reference reference) {
            return null;
        }

        @Override
        public Void visitToken(Expression.Token token) {
            return null;
        }

        @Override
        public Void visitCapture(Expression.Capture capture) {
            return capture.expression().accept(this);
        }
    }
}
