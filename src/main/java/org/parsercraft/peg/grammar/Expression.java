package org.parsercraft.peg.grammar;

import java.util.List;
import java.util.Objects;

/**
 * PEG expression types - the building blocks of grammar rules.
 *
 * <p>Every traversal goes through {@link Visitor}, so adding a kind forces every
 * traversal site to handle it.
 */
public sealed interface Expression {

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R visitSequence(Sequence sequence);

        R visitChoice(Choice choice);

        R visitZeroOrMore(ZeroOrMore zeroOrMore);

        R visitOneOrMore(OneOrMore oneOrMore);

        R visitOptional(Optional optional);

        R visitAnd(And and);

        R visitNot(Not not);

        R visitLiteral(Literal literal);

        R visitCharClass(CharClass charClass);

        R visitAny(Any any);

        R visitReference(Reference reference);

        R visitToken(Token token);

        R visitCapture(Capture capture);
    }

    // === Combinators ===

    /**
     * Sequence: e1 e2 e3
     */
    record Sequence(List<Expression> elements) implements Expression {
        public Sequence {
            elements = List.copyOf(elements);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitSequence(this);
        }
    }

    /**
     * Ordered choice: e1 / e2 / e3
     */
    record Choice(List<Expression> alternatives) implements Expression {
        public Choice {
            alternatives = List.copyOf(alternatives);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitChoice(this);
        }
    }

    // === Repetition ===

    /**
     * Zero or more: e*
     */
    record ZeroOrMore(Expression expression) implements Expression {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitZeroOrMore(this);
        }
    }

    /**
     * One or more: e+
     */
    record OneOrMore(Expression expression) implements Expression {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitOneOrMore(this);
        }
    }

    /**
     * Optional: e?
     */
    record Optional(Expression expression) implements Expression {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitOptional(this);
        }
    }

    // === Predicates ===

    /**
     * Positive lookahead: &e
     */
    record And(Expression expression) implements Expression {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAnd(this);
        }
    }

    /**
     * Negative lookahead: !e
     */
    record Not(Expression expression) implements Expression {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitNot(this);
        }
    }

    // === Terminals ===

    /**
     * Literal string match: 'text' or "text"
     */
    record Literal(String text) implements Expression {
        public Literal {
            Objects.requireNonNull(text, "text");
        }

        /**
         * Keyword-like literals must not be followed by a word character.
         */
        public boolean isKeyword() {
            if (text.isEmpty()) {
                return false;
            }
            for (int i = 0; i < text.length(); i++) {
                if (!Character.isLetter(text.charAt(i))) {
                    return false;
                }
            }
            return true;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitLiteral(this);
        }
    }

    /**
     * Character class: [a-z]. The pattern is the raw class body without brackets.
     */
    record CharClass(String pattern) implements Expression {
        public String regex() {
            return "[" + pattern + "]";
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitCharClass(this);
        }
    }

    /**
     * Any character: .
     */
    record Any() implements Expression {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAny(this);
        }
    }

    /**
     * Rule reference: name
     */
    record Reference(String ruleName) implements Expression {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitReference(this);
        }
    }

    /**
     * Built-in token reference: NUMBER, STRING, IDENT, NEWLINE, EOF, INDENT, DEDENT
     */
    record Token(TokenKind kind) implements Expression {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitToken(this);
        }
    }

    /**
     * Named capture: @label:e. The label is kept for tooling; matching ignores it.
     */
    record Capture(String label, Expression expression) implements Expression {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitCapture(this);
        }
    }
}
