package org.parsercraft.peg.parser;

import org.junit.jupiter.api.Test;
import org.parsercraft.peg.error.ParseError;
import org.parsercraft.peg.error.ParseException;
import org.parsercraft.peg.grammar.Grammar;
import org.parsercraft.peg.grammar.GrammarBuilder;

import java.util.List;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.*;
import static org.parsercraft.peg.grammar.GrammarBuilder.lit;

class ParsingContextTest {

    private static final List<Pattern> COMMENTS = List.of(Pattern.compile("//.*"),
                                                          Pattern.compile("/\\*[\\s\\S]*?\\*/"));

    private static final Grammar GRAMMAR = GrammarBuilder.create()
                                                         .addRule("program", lit("x"))
                                                         .build();

    private static ParsingContext context(String input, boolean tracing) {
        return ParsingContext.create(input, GRAMMAR, ParserConfig.DEFAULT, COMMENTS, tracing);
    }

    @Test
    void skipIgnored_skipsWhitespaceAndLineComments() {
        var ctx = context("  // c\n  x", false);

        ctx.skipIgnored();

        assertEquals(9, ctx.pos());
    }

    @Test
    void skipIgnored_skipsBlockCommentsSpanningLines() {
        var ctx = context("/* a\n b */x", false);

        ctx.skipIgnored();

        assertEquals(10, ctx.pos());
    }

    @Test
    void skipIgnored_disabledByGrammar_keepsPosition() {
        var grammar = GRAMMAR.toBuilder().skipWhitespace(false).build();
        var ctx = ParsingContext.create("   x", grammar, ParserConfig.DEFAULT, COMMENTS, false);

        ctx.skipIgnored();

        assertEquals(0, ctx.pos());
    }

    @Test
    void peekAt_pastEnd_returnsEnd() {
        var ctx = context("ab", false);

        assertEquals('b', ctx.peekAt(1));
        assertEquals(ParsingContext.END, ctx.peekAt(2));
    }

    @Test
    void location_isOneBased() {
        var ctx = context("ab\ncd", false);

        var location = ctx.location(4);
        assertEquals(2, location.line());
        assertEquals(2, location.column());
        assertEquals(4, location.offset());
    }

    @Test
    void snippetAt_isCutAtLineEndAndThirtyCharacters() {
        var ctx = context("abc\ndef " + "y".repeat(40), false);

        assertEquals("abc", ctx.snippetAt(0));
        assertEquals(30, ctx.snippetAt(4).length());
    }

    @Test
    void noteAttempt_keepsFirstRuleAtFurthestOffset() {
        var ctx = context("abcdef", false);

        assertEquals(0, ctx.furthestPos());
        ctx.enterRule("outer");
        ctx.noteAttempt(3);
        ctx.enterRule("inner");
        ctx.noteAttempt(3);
        assertEquals("outer", ctx.furthestRule());
        ctx.noteAttempt(5);
        assertEquals(5, ctx.furthestPos());
        assertEquals("inner", ctx.furthestRule());
    }

    @Test
    void enterRule_beyondMaxDepth_throws() {
        var ctx = ParsingContext.create("x", GRAMMAR, ParserConfig.DEFAULT.withMaxDepth(2), COMMENTS, false);

        ctx.enterRule("a");
        var previous = ctx.enterRule("b");
        assertEquals("a", previous);

        var e = assertThrows(ParseException.class, () -> ctx.enterRule("c"));
        var depth = assertInstanceOf(ParseError.DepthExceeded.class, e.error());
        assertEquals("c", depth.rule());

        ctx.exitRule(previous);
        assertEquals("a", ctx.currentRule());
        assertDoesNotThrow(() -> ctx.enterRule("c"));
    }

    @Test
    void enterExpression_sharesBudgetWithRules() {
        var ctx = ParsingContext.create("x", GRAMMAR, ParserConfig.DEFAULT.withMaxDepth(2), COMMENTS, false);
        ctx.enterRule("outer");
        ctx.enterExpression();

        var e = assertThrows(ParseException.class, ctx::enterExpression);
        var depth = assertInstanceOf(ParseError.DepthExceeded.class, e.error());
        assertEquals("outer", depth.rule());
        assertThrows(ParseException.class, () -> ctx.enterRule("inner"));

        ctx.exitExpression();
        assertDoesNotThrow(() -> ctx.enterRule("inner"));
    }

    @Test
    void packratKey_separatesRulesAndPositions() {
        assertNotEquals(ParsingContext.packratKey(1, 0), ParsingContext.packratKey(0, 1));
        assertEquals(ParsingContext.packratKey(3, 7), ParsingContext.packratKey(3, 7));
    }

    @Test
    void cacheAt_withoutPackrat_cachesNothing() {
        var ctx = ParsingContext.create("x", GRAMMAR, ParserConfig.DEFAULT.withPackrat(false), COMMENTS, false);

        ctx.cacheAt(0, 0, ParseResult.FAILURE, 0);

        assertTrue(ctx.cachedAt(0, 0).isEmpty());
    }

    @Test
    void cacheAt_withPackrat_returnsStoredResult() {
        var ctx = context("x", false);

        ctx.cacheAt(0, 0, ParseResult.FAILURE, 0);

        assertSame(ParseResult.FAILURE, ctx.cachedAt(0, 0).orElseThrow().result());
        assertTrue(ctx.cachedAt(0, 1).isEmpty());
    }

    @Test
    void touch_whenTracing_advancesReach() {
        var ctx = context("abcdef", true);

        ctx.touch(3);
        ctx.read(1, 2);

        assertEquals(4, ctx.reach());
    }

    @Test
    void touch_withoutTracing_recordsNothing() {
        var ctx = context("abcdef", false);

        ctx.touch(3);

        assertEquals(0, ctx.reach());
    }

    @Test
    void skipIgnored_whenTracing_examinesOnlyNearbyText() {
        var ctx = context("x = 1;" + " ".repeat(200), true);

        ctx.skipIgnored();

        assertEquals(0, ctx.pos());
        assertTrue(ctx.reach() <= 2, "reach " + ctx.reach());
    }

    @Test
    void skipIgnored_whenTracing_readsWholeComment() {
        var source = "// a comment\nx";
        var ctx = context(source, true);

        ctx.skipIgnored();

        assertEquals(source.length() - 1, ctx.pos());
        assertTrue(ctx.reach() >= source.length());
    }

    @Test
    void skipIgnored_lookbehindSeesTextBeforeCursor() {
        var afterSemicolon = List.of(Pattern.compile("(?<=;)#.*"));
        var ctx = ParsingContext.create("x;# note", GRAMMAR, ParserConfig.DEFAULT, afterSemicolon, false);

        ctx.setPos(2);
        ctx.skipIgnored();

        assertEquals(8, ctx.pos());
    }

    @Test
    void matchAt_lookaroundPattern_examinesWholeInput() {
        var source = "x # y" + " ".repeat(50);
        var guarded = List.of(Pattern.compile("#(?= y)"));
        var ctx = ParsingContext.create(source, GRAMMAR, ParserConfig.DEFAULT, guarded, true);

        assertEquals(3, ctx.matchAt(guarded.get(0), 2));
        assertEquals(source.length() + 1, ctx.reach());
    }
}
