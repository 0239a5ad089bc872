package org.parsercraft.peg.grammar;

import org.junit.jupiter.api.Test;
import org.parsercraft.peg.parser.PegInterpreter;
import org.parsercraft.peg.tree.SourceAst;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GrammarsTest {

    @Test
    void defaultGrammar_isValid() {
        assertEquals(List.of(), Grammars.defaultGrammar().validate());
        assertEquals("program", Grammars.defaultGrammar().startRule());
    }

    @Test
    void defaultGrammar_isCached() {
        assertSame(Grammars.defaultGrammar(), Grammars.defaultGrammar());
    }

    @Test
    void defaultGrammar_parsesAssignmentsAndFunctions() {
        var interpreter = PegInterpreter.create(Grammars.defaultGrammar());

        var tree = interpreter.parse("""
            x = 1 + 2 * 3
            def add(a, b): return a + b
            print(add(x, [1, 2]))
            """);

        assertEquals(1, tree.findAll("assignment").size());
        assertEquals(1, tree.findAll("function_def").size());
        assertEquals(1, tree.findAll("list_literal").size());
        var params = tree.findAll("param_list").get(0);
        assertEquals(List.of("a", "b"),
                     params.findAll(SourceAst.IDENTIFIER).stream().map(SourceAst::value).toList());
    }
}
