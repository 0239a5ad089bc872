package org.parsercraft.peg.parser;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Parser configuration options.
 *
 * @param packratEnabled    memoize rule results per position
 * @param maxDepth          maximum number of nested rule invocations
 * @param strictGrammarText reject malformed grammar lines instead of skipping them
 */
public record ParserConfig(
    boolean packratEnabled,
    int maxDepth,
    boolean strictGrammarText
) {
    public static final int DEFAULT_MAX_DEPTH = 1000;

    public static final ParserConfig DEFAULT = new ParserConfig(
        true,
        DEFAULT_MAX_DEPTH,
        false
    );

    public ParserConfig {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive, got " + maxDepth);
        }
    }

    /**
     * Load from {@code application.conf} with {@code reference.conf} defaults.
     */
    public static ParserConfig load() {
        return fromConfig(ConfigFactory.load());
    }

    /**
     * Read the {@code parsercraft} section of the given configuration, falling back to
     * the bundled {@code reference.conf} for missing keys.
     */
    public static ParserConfig fromConfig(Config config) {
        var resolved = config.withFallback(ConfigFactory.parseResources("reference.conf"))
                             .resolve();
        return new ParserConfig(
            resolved.getBoolean("parsercraft.parser.packrat"),
            resolved.getInt("parsercraft.parser.max-depth"),
            resolved.getBoolean("parsercraft.grammar.strict-text")
        );
    }

    public ParserConfig withMaxDepth(int depth) {
        return new ParserConfig(packratEnabled, depth, strictGrammarText);
    }

    public ParserConfig withPackrat(boolean enabled) {
        return new ParserConfig(enabled, maxDepth, strictGrammarText);
    }

    public ParserConfig withStrictGrammarText(boolean strict) {
        return new ParserConfig(packratEnabled, maxDepth, strict);
    }
}
