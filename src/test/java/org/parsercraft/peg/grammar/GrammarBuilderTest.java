package org.parsercraft.peg.grammar;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.parsercraft.peg.grammar.GrammarBuilder.*;

class GrammarBuilderTest {

    @Test
    void build_assignsRuleIdsInDeclarationOrder() {
        var grammar = GrammarBuilder.named("calc")
                                    .addRule("program", star(ref("statement")))
                                    .addRule("statement", seq(ident(), lit("="), number(), lit(";")))
                                    .build();

        assertEquals("calc", grammar.name());
        assertEquals(0, grammar.rule("program").orElseThrow().id());
        assertEquals(1, grammar.rule("statement").orElseThrow().id());
    }

    @Test
    void build_tokenIds_followRuleIds() {
        var grammar = GrammarBuilder.create()
                                    .addRule("program", number())
                                    .build();

        assertEquals(1, grammar.tokenId(TokenKind.NUMBER));
        assertNotEquals(grammar.tokenId(TokenKind.NUMBER), grammar.tokenId(TokenKind.IDENT));
    }

    @Test
    void ref_builtinName_producesToken() {
        assertEquals(new Expression.Token(TokenKind.IDENT), ref("IDENT"));
        assertEquals(new Expression.Reference("expr"), ref("expr"));
    }

    @Test
    void seq_singleItem_isNotWrapped() {
        assertEquals(lit("a"), seq(lit("a")));
        assertEquals(lit("a"), choice(lit("a")));
    }

    @Test
    void build_defaults_skipWhitespaceAndComments() {
        var grammar = GrammarBuilder.create()
                                    .addRule("program", lit("x"))
                                    .build();

        assertTrue(grammar.skipWhitespace());
        assertEquals(Grammar.DEFAULT_COMMENT_PATTERNS, grammar.commentPatterns());
    }

    @Test
    void addRule_withKindAndFragment_keepsBoth() {
        var grammar = GrammarBuilder.create()
                                    .addRule("program", ref("sum"))
                                    .addRule("sum", seq(number(), lit("+"), number()), "Sum", false)
                                    .addFragment("digits", plus(charClass("0-9")))
                                    .build();

        assertEquals("Sum", grammar.rule("sum").orElseThrow().kind());
        assertTrue(grammar.rule("digits").orElseThrow().fragment());
        assertEquals("program", grammar.rule("program").orElseThrow().kind());
    }

    @Test
    void toBuilder_roundTripsSettings() {
        var original = GrammarBuilder.named("g")
                                     .addRule("first", lit("a"))
                                     .addRule("second", ref("first"))
                                     .start("second")
                                     .skipWhitespace(false)
                                     .commentPatterns(List.of("#.*"))
                                     .build();

        var copy = original.toBuilder()
                           .addRule("third", lit("c"))
                           .build();

        assertEquals("second", copy.startRule());
        assertFalse(copy.skipWhitespace());
        assertEquals(List.of("#.*"), copy.commentPatterns());
        assertEquals(3, copy.rules().size());
        assertEquals(original.rules().get("first"), copy.rules().get("first"));
    }
}
