package org.parsercraft.peg;

import org.parsercraft.peg.error.GrammarException;
import org.parsercraft.peg.grammar.Grammar;
import org.parsercraft.peg.grammar.GrammarConfig;
import org.parsercraft.peg.grammar.GrammarParser;
import org.parsercraft.peg.incremental.IncrementalParser;
import org.parsercraft.peg.parser.ParserConfig;
import org.parsercraft.peg.parser.PegInterpreter;

/**
 * Entry point for creating PEG parsers.
 *
 * <p>Example usage:
 * <pre>{@code
 * var parser = PegParser.fromGrammar("""
 *     program   <- statement*
 *     statement <- IDENT '=' NUMBER ';'
 *     """);
 *
 * var tree = parser.parse("x = 5;");
 * }</pre>
 *
 * <p>Every factory validates the grammar and throws {@link GrammarException} with all
 * diagnostics when it is not usable.
 */
public final class PegParser {
    private PegParser() {}

    /**
     * Create a parser from grammar text.
     */
    public static PegInterpreter fromGrammar(String grammarText) {
        return fromGrammar(grammarText, ParserConfig.DEFAULT);
    }

    /**
     * Create a parser from grammar text with custom configuration.
     */
    public static PegInterpreter fromGrammar(String grammarText, ParserConfig config) {
        return fromGrammar(GrammarParser.parse(grammarText, "custom", config), config);
    }

    /**
     * Create a parser from a pre-built grammar.
     */
    public static PegInterpreter fromGrammar(Grammar grammar) {
        return fromGrammar(grammar, ParserConfig.DEFAULT);
    }

    public static PegInterpreter fromGrammar(Grammar grammar, ParserConfig config) {
        return PegInterpreter.create(validated(grammar), config);
    }

    /**
     * Create a parser from a grammar configuration record.
     */
    public static PegInterpreter fromConfig(GrammarConfig grammarConfig) {
        return fromConfig(grammarConfig, ParserConfig.DEFAULT);
    }

    public static PegInterpreter fromConfig(GrammarConfig grammarConfig, ParserConfig config) {
        return fromGrammar(grammarConfig.toGrammar(config), config);
    }

    /**
     * Create an incremental parser from grammar text.
     */
    public static IncrementalParser incremental(String grammarText) {
        return IncrementalParser.create(fromGrammar(grammarText));
    }

    public static IncrementalParser incremental(Grammar grammar) {
        return IncrementalParser.create(fromGrammar(grammar));
    }

    public static IncrementalParser incremental(Grammar grammar, ParserConfig config) {
        return IncrementalParser.create(fromGrammar(grammar, config));
    }

    /**
     * Create a builder for more complex parser configuration.
     */
    public static Builder builder(String grammarText) {
        return new Builder(grammarText);
    }

    private static Grammar validated(Grammar grammar) {
        var problems = grammar.validate();
        if (!problems.isEmpty()) {
            throw new GrammarException(problems);
        }
        return grammar;
    }

    public static final class Builder {
        private final String grammarText;
        private ParserConfig config = ParserConfig.DEFAULT;

        private Builder(String grammarText) {
            this.grammarText = grammarText;
        }

        public Builder packrat(boolean enabled) {
            this.config = config.withPackrat(enabled);
            return this;
        }

        public Builder maxDepth(int depth) {
            this.config = config.withMaxDepth(depth);
            return this;
        }

        public Builder strictGrammarText(boolean strict) {
            this.config = config.withStrictGrammarText(strict);
            return this;
        }

        public Builder config(ParserConfig parserConfig) {
            this.config = parserConfig;
            return this;
        }

        public PegInterpreter build() {
            return fromGrammar(grammarText, config);
        }

        public IncrementalParser buildIncremental() {
            return IncrementalParser.create(build());
        }
    }
}
