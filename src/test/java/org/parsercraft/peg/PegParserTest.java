package org.parsercraft.peg;

import org.junit.jupiter.api.Test;
import org.parsercraft.peg.error.GrammarException;
import org.parsercraft.peg.error.ParseError;
import org.parsercraft.peg.error.ParseException;
import org.parsercraft.peg.grammar.GrammarBuilder;
import org.parsercraft.peg.grammar.GrammarConfig;
import org.parsercraft.peg.tree.SourceAst;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.parsercraft.peg.grammar.GrammarBuilder.*;

class PegParserTest {

    private static final String CALCULATOR = """
        # assignments of sums
        program   <- statement*
        statement <- IDENT '=' expr ';'
        expr      <- term (('+' / '-') term)*
        term      <- NUMBER / IDENT / '(' expr ')'
        """;

    @Test
    void fromGrammar_validText_parsesSource() {
        var parser = PegParser.fromGrammar(CALCULATOR);

        var tree = parser.parse("total = (a + 2) - 1;");

        assertEquals(1, tree.findAll("statement").size());
        assertEquals(2, tree.findAll("expr").size());
        assertEquals("total", tree.findAll(SourceAst.IDENTIFIER).get(0).value());
    }

    @Test
    void fromGrammar_undefinedReference_throwsWithDiagnostics() {
        var e = assertThrows(GrammarException.class, () -> PegParser.fromGrammar("program <- missing"));

        assertEquals(java.util.List.of("Rule 'program' references undefined rule 'missing'"), e.diagnostics());
    }

    @Test
    void fromGrammar_leftRecursion_throws() {
        assertThrows(GrammarException.class, () -> PegParser.fromGrammar("program <- program 'x' / 'y'"));
    }

    @Test
    void fromGrammar_builtGrammar_isValidatedToo() {
        var grammar = GrammarBuilder.create()
                                    .addRule("statement", ident())
                                    .start("program")
                                    .build();

        assertThrows(GrammarException.class, () -> PegParser.fromGrammar(grammar));
    }

    @Test
    void fromConfig_compilesRecord() {
        var parser = PegParser.fromConfig(GrammarConfig.of(Map.of("program", "NUMBER+")));

        assertEquals(3, parser.parse("1 2 3").children().size());
    }

    @Test
    void builder_appliesParserOptions() {
        var parser = PegParser.builder("program <- '(' program ')' / NUMBER")
                              .maxDepth(10)
                              .packrat(false)
                              .build();

        var e = assertThrows(ParseException.class, () -> parser.parse("((((((((((((1))))))))))))"));
        assertInstanceOf(ParseError.DepthExceeded.class, e.error());
        assertFalse(parser.config().packratEnabled());
    }

    @Test
    void builder_strictGrammarText_rejectsMalformedLines() {
        var builder = PegParser.builder("program <- NUMBER\nnot a rule").strictGrammarText(true);

        assertThrows(GrammarException.class, builder::build);
    }

    @Test
    void incremental_fromText_tracksEdits() {
        var parser = PegParser.incremental(CALCULATOR);
        parser.parse("x = 10;");

        var tree = parser.applyEdit(6, 0, " + 5");

        assertEquals(PegParser.fromGrammar(CALCULATOR).parse("x = 10 + 5;"), tree);
    }

    @Test
    void buildIncremental_sharesConfiguration() {
        var parser = PegParser.builder(CALCULATOR)
                              .packrat(false)
                              .buildIncremental();

        assertEquals(1, parser.parse("x = 1;").children().size());
    }
}
