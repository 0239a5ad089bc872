package org.parsercraft.peg.parser;

import org.parsercraft.peg.tree.SourceAst;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * A parse together with the per-node bookkeeping needed to re-parse parts of it.
 *
 * @param tree   produced tree
 * @param end    cursor offset after the matched rule
 * @param reach  one past the furthest offset examined during the parse
 * @param traces rule traces keyed by node identity
 */
public record TracedParse(SourceAst tree, int end, int reach, Map<SourceAst, RuleTrace> traces) {

    public TracedParse {
        traces = Collections.unmodifiableMap(new IdentityHashMap<>(traces));
    }

    public Optional<RuleTrace> traceOf(SourceAst node) {
        return Optional.ofNullable(traces.get(node));
    }
}
