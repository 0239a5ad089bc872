package org.parsercraft.peg.error;

import org.parsercraft.peg.tree.SourceLocation;

/**
 * Syntax error with location and context information.
 */
public sealed interface ParseError {
    SourceLocation location();

    String message();

    /**
     * The start rule failed; reported at the furthest position any rule reached.
     */
    record UnexpectedInput(
        SourceLocation location,
        String rule,
        String snippet) implements ParseError {
        @Override
        public String message() {
            return "Parse error at line " + location.line() + ", column " + location.column()
                   + " (in rule '" + rule + "'): unexpected '" + snippet + "'";
        }
    }

    /**
     * The start rule matched but left non-ignorable input behind.
     */
    record TrailingInput(
        SourceLocation location,
        String snippet) implements ParseError {
        @Override
        public String message() {
            return "Unexpected input at line " + location.line() + ", column " + location.column()
                   + ": '" + snippet + "'";
        }
    }

    /**
     * Nested rule invocations exceeded the configured budget.
     */
    record DepthExceeded(
        SourceLocation location,
        String rule,
        int limit) implements ParseError {
        @Override
        public String message() {
            return "Maximum rule nesting depth " + limit + " exceeded at line " + location.line()
                   + ", column " + location.column() + " (in rule '" + rule + "')";
        }
    }

    /**
     * The requested entry rule is not declared by the grammar.
     */
    record UnknownRule(
        SourceLocation location,
        String rule) implements ParseError {
        @Override
        public String message() {
            return "Unknown rule: '" + rule + "'";
        }
    }
}
