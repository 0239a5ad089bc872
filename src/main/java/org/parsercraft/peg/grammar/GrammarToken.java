package org.parsercraft.peg.grammar;

import org.parsercraft.peg.tree.SourceSpan;

/**
 * Token types for the rule-pattern lexer.
 */
public sealed interface GrammarToken {
    SourceSpan span();

    // Identifiers and literals
    record Identifier(SourceSpan span, String name) implements GrammarToken {}

    record StringLiteral(SourceSpan span, String value) implements GrammarToken {}

    record CharClassLiteral(SourceSpan span, String pattern) implements GrammarToken {}

    // @name:
    record Label(SourceSpan span, String name) implements GrammarToken {}

    // Operators
    record Slash(SourceSpan span) implements GrammarToken {}

    // | at the start of a continuation line
    record Pipe(SourceSpan span) implements GrammarToken {}

    record Ampersand(SourceSpan span) implements GrammarToken {}

    record Exclamation(SourceSpan span) implements GrammarToken {}

    record Question(SourceSpan span) implements GrammarToken {}

    record Star(SourceSpan span) implements GrammarToken {}

    record Plus(SourceSpan span) implements GrammarToken {}

    record Dot(SourceSpan span) implements GrammarToken {}

    // Delimiters
    record LParen(SourceSpan span) implements GrammarToken {}

    record RParen(SourceSpan span) implements GrammarToken {}

    // Special
    record Eof(SourceSpan span) implements GrammarToken {}

    record Error(SourceSpan span, String message) implements GrammarToken {}
}
