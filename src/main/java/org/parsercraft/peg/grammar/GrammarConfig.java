package org.parsercraft.peg.grammar;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.typesafe.config.Config;
import org.parsercraft.peg.error.GrammarException;
import org.parsercraft.peg.parser.ParserConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Configuration-record form of a grammar.
 *
 * <p>Example JSON:
 * <pre>
 * {
 *   "start": "program",
 *   "skip_whitespace": true,
 *   "comments": ["//.*"],
 *   "rules": {
 *     "program": "statement*",
 *     "statement": "IDENT '=' expr ';'",
 *     "expr": "NUMBER / IDENT"
 *   }
 * }
 * </pre>
 *
 * @param name           grammar name, {@code custom} when absent
 * @param start          start rule, {@code program} when absent
 * @param skipWhitespace skip whitespace and comments between tokens, {@code true} when absent
 * @param comments       comment regular expressions, {@code ["//.*"]} when absent
 * @param rules          rule name to pattern text, in declaration order
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GrammarConfig(
    @JsonProperty("name") String name,
    @JsonProperty("start") String start,
    @JsonProperty("skip_whitespace") Boolean skipWhitespace,
    @JsonProperty("comments") List<String> comments,
    @JsonProperty("rules") Map<String, String> rules
) {
    private static final Logger LOG = LoggerFactory.getLogger(GrammarConfig.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static final List<String> DEFAULT_COMMENTS = List.of("//.*");

    public GrammarConfig {
        name = name == null ? "custom" : name;
        start = start == null ? Grammar.DEFAULT_START_RULE : start;
        skipWhitespace = skipWhitespace == null ? Boolean.TRUE : skipWhitespace;
        comments = comments == null ? DEFAULT_COMMENTS : List.copyOf(comments);
        rules = rules == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(rules));
    }

    public static GrammarConfig of(Map<String, String> rules) {
        return new GrammarConfig(null, null, null, null, rules);
    }

    /**
     * Read a grammar record from JSON. A top-level {@code grammar} member is unwrapped.
     *
     * @throws GrammarException if the JSON is malformed
     */
    public static GrammarConfig fromJson(String json) {
        try {
            var node = MAPPER.readTree(json);
            if (node != null && node.has("grammar")) {
                node = node.get("grammar");
            }
            return MAPPER.treeToValue(node, GrammarConfig.class);
        } catch (JsonProcessingException e) {
            throw new GrammarException("Invalid grammar configuration JSON: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Read a grammar record from a HOCON object with the same keys as the JSON form.
     */
    public static GrammarConfig fromConfig(Config config) {
        var rules = new LinkedHashMap<String, String>();
        if (config.hasPath("rules")) {
            var ruleObject = config.getObject("rules");
            // HOCON objects are unordered; sort for a stable rule numbering.
            ruleObject.keySet()
                      .stream()
                      .sorted()
                      .forEach(key -> rules.put(key, String.valueOf(ruleObject.get(key).unwrapped())));
        }
        return new GrammarConfig(
            config.hasPath("name") ? config.getString("name") : null,
            config.hasPath("start") ? config.getString("start") : null,
            config.hasPath("skip_whitespace") ? config.getBoolean("skip_whitespace") : null,
            config.hasPath("comments") ? config.getStringList("comments") : null,
            rules
        );
    }

    /**
     * Render the rules as grammar text, one {@code name <- pattern} line each.
     */
    public String toGrammarText() {
        return rules.entrySet()
                    .stream()
                    .map(e -> e.getKey() + " <- " + e.getValue())
                    .collect(Collectors.joining("\n"));
    }

    public Grammar toGrammar() {
        return toGrammar(ParserConfig.DEFAULT);
    }

    /**
     * Compile the record. Without rules the default grammar preset is returned.
     */
    public Grammar toGrammar(ParserConfig config) {
        if (rules.isEmpty()) {
            LOG.debug("Grammar config '{}' declares no rules, using the default grammar", name);
            return Grammars.defaultGrammar();
        }
        return GrammarParser.compile(toGrammarText(), name, config)
                            .start(start)
                            .skipWhitespace(skipWhitespace)
                            .commentPatterns(comments)
                            .build();
    }
}
