package org.parsercraft.peg.incremental;

import org.junit.jupiter.api.Test;
import org.parsercraft.peg.error.ParseException;
import org.parsercraft.peg.grammar.Grammar;
import org.parsercraft.peg.grammar.GrammarParser;
import org.parsercraft.peg.parser.ParserConfig;
import org.parsercraft.peg.parser.PegInterpreter;
import org.parsercraft.peg.tree.SourceAst;

import java.util.List;
import java.util.Optional;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class IncrementalParserTest {

    private static final Grammar ASSIGNMENTS = GrammarParser.parse("""
        program   <- statement*
        statement <- IDENT '=' expr ';'
        expr      <- term (('+' / '-') term)*
        term      <- NUMBER / IDENT
        """);

    private static final Grammar LET_STATEMENTS = GrammarParser.parse("""
        program   <- statement*
        statement <- 'let' IDENT '=' expr ';' / IDENT '=' expr ';'
        expr      <- term (('+' / '-') term)*
        term      <- NUMBER / IDENT / '(' expr ')'
        """);

    private static SourceAst fresh(Grammar grammar, String source) {
        return PegInterpreter.create(grammar).parse(source);
    }

    private static Optional<SourceAst> tryFresh(Grammar grammar, String source) {
        try {
            return Optional.of(fresh(grammar, source));
        } catch (ParseException e) {
            return Optional.empty();
        }
    }

    @Test
    void parse_initialDocument_countsFullParse() {
        var parser = IncrementalParser.create(ASSIGNMENTS);

        var tree = parser.parse("x = 10;");

        assertEquals(fresh(ASSIGNMENTS, "x = 10;"), tree);
        assertEquals(1, parser.stats().fullParses());
        assertEquals(0, parser.stats().incrementalParses());
        assertEquals("x = 10;", parser.source());
        assertSame(tree, parser.tree().orElseThrow());
    }

    @Test
    void regions_coverRuleNodesBelowTheRoot() {
        var parser = IncrementalParser.create(ASSIGNMENTS);
        parser.parse("x = 10;");

        var rules = parser.regions().stream().map(Region::ruleName).toList();

        assertEquals(List.of("statement", "expr", "term"), rules);
        var statement = parser.regions().get(0);
        assertEquals(0, statement.start());
        assertEquals(7, statement.end());
        assertTrue(statement.stable());
    }

    @Test
    void applyEdit_insertAfterNumber_reparsesStatementOnly() {
        var parser = IncrementalParser.create(ASSIGNMENTS);
        parser.parse("x = 10;");

        var tree = parser.applyEdit(6, 0, " + 5");

        assertEquals("x = 10 + 5;", parser.source());
        assertEquals(fresh(ASSIGNMENTS, "x = 10 + 5;"), tree);
        assertEquals(1, parser.stats().incrementalParses());
        assertEquals(1, parser.stats().fullParses());
    }

    @Test
    void applyEdit_insertInsideNumber_matchesFullParse() {
        var parser = IncrementalParser.create(ASSIGNMENTS);
        parser.parse("x = 10;");

        var tree = parser.applyEdit(5, 0, " + 5");

        assertEquals("x = 1 + 50;", parser.source());
        assertEquals(fresh(ASSIGNMENTS, "x = 1 + 50;"), tree);
        assertEquals(1, parser.stats().incrementalParses());
    }

    @Test
    void applyEdit_laterStatementsAreShifted() {
        var parser = IncrementalParser.create(ASSIGNMENTS);
        parser.parse("a = 1;\nb = 2;\nc = b;");

        var tree = parser.applyEdit(4, 1, "100");

        assertEquals(fresh(ASSIGNMENTS, "a = 100;\nb = 2;\nc = b;"), tree);
        var last = tree.children().get(2);
        assertEquals(3, last.line());
        assertEquals(16, last.startOffset());
        assertEquals("c = b;", last.text());
    }

    @Test
    void applyEdit_successiveEdits_keepMatchingFullParse() {
        var parser = IncrementalParser.create(ASSIGNMENTS);
        parser.parse("x = 1;\ny = 2;");

        parser.applyEdit(4, 1, "3 + 4");
        parser.applyEdit(parser.source().length() - 1, 0, " - x");
        var tree = parser.applyEdit(0, 1, "z");

        assertEquals("z = 3 + 4;\ny = 2 - x;", parser.source());
        assertEquals(fresh(ASSIGNMENTS, parser.source()), tree);
    }

    @Test
    void applyEdit_syntaxError_keepsPreviousTree() {
        var parser = IncrementalParser.create(ASSIGNMENTS);
        var before = parser.parse("x = 10;");

        var after = parser.applyEdit(4, 2, "");

        assertSame(before, after);
        assertEquals("x = ;", parser.source());
        assertTrue(parser.regions().isEmpty());
        assertEquals(2, parser.stats().fullParses());
    }

    @Test
    void applyEdit_afterSyntaxError_recoversWithFullParse() {
        var parser = IncrementalParser.create(ASSIGNMENTS);
        parser.parse("x = 10;");
        parser.applyEdit(4, 2, "");

        var tree = parser.applyEdit(4, 0, "7");

        assertEquals(fresh(ASSIGNMENTS, "x = 7;"), tree);
        assertEquals(3, parser.stats().fullParses());
        assertFalse(parser.regions().isEmpty());
    }

    @Test
    void applyEdit_withoutTree_parsesWholeDocument() {
        var parser = IncrementalParser.create(ASSIGNMENTS);

        var tree = parser.applyEdit(0, 0, "x = 1;");

        assertEquals(fresh(ASSIGNMENTS, "x = 1;"), tree);
    }

    @Test
    void applyEdit_withoutTreeAndInvalidText_throws() {
        var parser = IncrementalParser.create(ASSIGNMENTS);

        assertThrows(ParseException.class, () -> parser.applyEdit(0, 0, "x = "));
        assertTrue(parser.tree().isEmpty());
    }

    @Test
    void applyEdit_outsideDocument_throws() {
        var parser = IncrementalParser.create(ASSIGNMENTS);
        parser.parse("x = 1;");

        assertThrows(IllegalArgumentException.class, () -> parser.applyEdit(10, 0, "a"));
        assertThrows(IllegalArgumentException.class, () -> parser.applyEdit(4, 5, ""));
        assertThrows(IllegalArgumentException.class, () -> parser.applyEdit(-1, 0, "a"));
        assertEquals("x = 1;", parser.source());
    }

    @Test
    void applyEdit_keywordBoundaryChange_matchesFullParse() {
        var parser = IncrementalParser.create(LET_STATEMENTS);
        parser.parse("let x = 1;");

        var tree = parser.applyEdit(3, 1, "");

        assertEquals("letx = 1;", parser.source());
        assertEquals(fresh(LET_STATEMENTS, "letx = 1;"), tree);
        assertEquals("letx", tree.findAll(SourceAst.IDENTIFIER).get(0).value());
    }

    @Test
    void applyEdit_insideComment_matchesFullParse() {
        var parser = IncrementalParser.create(ASSIGNMENTS);
        parser.parse("x = 1; // one\ny = 2;");

        var tree = parser.applyEdit(10, 3, "first");

        assertEquals(fresh(ASSIGNMENTS, "x = 1; // first\ny = 2;"), tree);
    }

    @Test
    void applyEdit_nestingBeyondBudget_keepsPreviousTree() {
        var body = "p?";
        for (int i = 0; i < 12; i++) {
            body = "(&'(' " + body + ")?";
        }
        var parser = IncrementalParser.create(GrammarParser.parse("p <- '(' " + body + " ')'"));
        var before = parser.parse("()");

        var after = parser.applyEdit(1, 0, "(".repeat(990) + ")".repeat(990));

        assertSame(before, after);
        assertEquals(1982, parser.source().length());
        assertEquals(2, parser.stats().fullParses());
    }

    @Test
    void applyEdits_appliesHighestOffsetFirst() {
        var parser = IncrementalParser.create(ASSIGNMENTS);
        parser.parse("a = 1;\nb = 2;");

        var tree = parser.applyEdits(List.of(SourceEdit.insert(5, "0"), SourceEdit.insert(12, "0")));

        assertEquals("a = 10;\nb = 20;", parser.source());
        assertEquals(fresh(ASSIGNMENTS, "a = 10;\nb = 20;"), tree);
    }

    @Test
    void invalidate_forcesFullParseOnNextEdit() {
        var parser = IncrementalParser.create(ASSIGNMENTS);
        parser.parse("x = 10;");

        parser.invalidate();
        assertTrue(parser.regions().isEmpty());
        var tree = parser.applyEdit(6, 0, " + 5");

        assertEquals(fresh(ASSIGNMENTS, "x = 10 + 5;"), tree);
        assertEquals(0, parser.stats().incrementalParses());
        assertEquals(2, parser.stats().fullParses());
    }

    @Test
    void reset_forgetsDocumentAndStatistics() {
        var parser = IncrementalParser.create(ASSIGNMENTS);
        parser.parse("x = 10;");
        parser.applyEdit(6, 0, " + 5");

        parser.reset();

        assertEquals("", parser.source());
        assertTrue(parser.tree().isEmpty());
        assertTrue(parser.regions().isEmpty());
        assertEquals(0, parser.stats().totalParses());
    }

    @Test
    void parse_invalidDocument_throwsAndKeepsPreviousTree() {
        var parser = IncrementalParser.create(ASSIGNMENTS);
        var before = parser.parse("x = 1;");

        assertThrows(ParseException.class, () -> parser.parse("x = ;"));

        assertSame(before, parser.tree().orElseThrow());
        assertTrue(parser.regions().isEmpty());
    }

    @Test
    void stats_recordDurationOfLastParse() {
        var parser = IncrementalParser.create(ASSIGNMENTS);

        parser.parse("x = 1;");

        assertFalse(parser.stats().lastParse().isNegative());
        assertEquals(1, parser.stats().totalParses());
    }

    @Test
    void randomEdits_alwaysMatchFullParse() {
        checkRandomEdits(IncrementalParser.create(LET_STATEMENTS), 11L);
    }

    @Test
    void randomEdits_withoutPackrat_alwaysMatchFullParse() {
        checkRandomEdits(IncrementalParser.create(LET_STATEMENTS, ParserConfig.DEFAULT.withPackrat(false)), 29L);
    }

    private static final List<String> FRAGMENTS = List.of("1", "42", "a", "b", " ", "+", "- ", ";", "(", ")",
                                                          "let ", "x = 2;", "\n", "// c\n", " + y");

    private static void checkRandomEdits(IncrementalParser parser, long seed) {
        var random = new Random(seed);
        var previous = parser.parse("let a = 1 + (b - 2);\nx = a + 3;\ny = (x);\n");

        for (int step = 0; step < 300; step++) {
            var source = parser.source();
            int offset = random.nextInt(source.length() + 1);
            int oldLength = offset < source.length() && random.nextInt(3) == 0
                            ? 1 + random.nextInt(Math.min(3, source.length() - offset))
                            : 0;
            var newText = oldLength > 0 && random.nextBoolean()
                          ? ""
                          : FRAGMENTS.get(random.nextInt(FRAGMENTS.size()));
            var edit = new SourceEdit(offset, oldLength, newText);
            var expected = tryFresh(LET_STATEMENTS, edit.applyTo(source));

            var actual = parser.applyEdit(edit);

            if (expected.isPresent()) {
                assertEquals(expected.get(), actual, "after step " + step + ": " + edit + " on " + source);
            } else {
                assertSame(previous, actual, "after step " + step + ": " + edit + " on " + source);
            }
            previous = actual;
        }
        assertTrue(parser.stats().incrementalParses() > 0);
    }
}
