package org.parsercraft.peg.incremental;

import org.parsercraft.peg.error.ParseException;
import org.parsercraft.peg.grammar.Grammar;
import org.parsercraft.peg.parser.ParserConfig;
import org.parsercraft.peg.parser.PegInterpreter;
import org.parsercraft.peg.parser.RuleTrace;
import org.parsercraft.peg.parser.TracedParse;
import org.parsercraft.peg.tree.SourceAst;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Keeps the tree of one document current while it is edited.
 *
 * <p>An edit is handled by re-parsing the smallest region that covers it and splicing the
 * result into the tree. A region qualifies only when nothing parsed before it looked at the
 * edited text and nothing parsed after it looked back into it, so the spliced tree is the
 * tree a full parse of the new text would produce. Otherwise the whole document is parsed
 * again.
 *
 * <p>Not thread-safe: one instance serves one document edited by one writer.
 */
public final class IncrementalParser {
    private static final Logger LOG = LoggerFactory.getLogger(IncrementalParser.class);

    private final PegInterpreter interpreter;

    private String source = "";
    private SourceAst tree;
    private Map<SourceAst, RuleTrace> traces = new IdentityHashMap<>();
    private List<Region> regions = List.of();
    private int incrementalParses;
    private int fullParses;
    private Duration lastParse = Duration.ZERO;

    private IncrementalParser(PegInterpreter interpreter) {
        this.interpreter = interpreter;
    }

    public static IncrementalParser create(Grammar grammar) {
        return create(PegInterpreter.create(grammar));
    }

    public static IncrementalParser create(Grammar grammar, ParserConfig config) {
        return create(PegInterpreter.create(grammar, config));
    }

    public static IncrementalParser create(PegInterpreter interpreter) {
        return new IncrementalParser(interpreter);
    }

    /**
     * Parse a whole document, replacing any previous one.
     *
     * @throws ParseException if the document does not parse; the previous tree is kept
     */
    public SourceAst parse(String text) {
        Objects.requireNonNull(text, "text");
        long started = System.nanoTime();
        source = text;
        try {
            adopt(interpreter.trace(text));
            return tree;
        } catch (ParseException e) {
            clearRegions();
            throw e;
        } finally {
            fullParses++;
            lastParse = Duration.ofNanos(System.nanoTime() - started);
        }
    }

    /**
     * Replace {@code oldLength} characters at {@code offset} with {@code newText} and
     * update the tree.
     *
     * <p>When the new text does not parse the previous tree is returned unchanged and the
     * next edit parses the whole document.
     *
     * @throws IllegalArgumentException if the edited range lies outside the document
     * @throws ParseException           if no tree exists yet and the new text does not parse
     */
    public SourceAst applyEdit(int offset, int oldLength, String newText) {
        return applyEdit(new SourceEdit(offset, oldLength, newText));
    }

    public SourceAst applyEdit(SourceEdit edit) {
        var newSource = edit.applyTo(source);
        long started = System.nanoTime();
        source = newSource;
        try {
            if (reparseRegion(edit)) {
                incrementalParses++;
            } else {
                fullParses++;
                reparseDocument();
            }
        } finally {
            lastParse = Duration.ofNanos(System.nanoTime() - started);
        }
        return tree;
    }

    /**
     * Apply several edits, highest offset first, so that offsets of the remaining edits
     * stay valid.
     */
    public SourceAst applyEdits(List<SourceEdit> edits) {
        var ordered = new ArrayList<>(edits);
        ordered.sort(Comparator.comparingInt(SourceEdit::offset).reversed());
        for (var edit : ordered) {
            applyEdit(edit);
        }
        return tree;
    }

    /**
     * Drop all regions; the next edit parses the whole document.
     */
    public void invalidate() {
        clearRegions();
    }

    public void reset() {
        source = "";
        tree = null;
        clearRegions();
        incrementalParses = 0;
        fullParses = 0;
        lastParse = Duration.ZERO;
    }

    public String source() {
        return source;
    }

    public Optional<SourceAst> tree() {
        return Optional.ofNullable(tree);
    }

    public List<Region> regions() {
        return regions;
    }

    public ParseStats stats() {
        return new ParseStats(incrementalParses, fullParses, lastParse);
    }

    private boolean reparseRegion(SourceEdit edit) {
        if (tree == null || regions.isEmpty()) {
            return false;
        }
        var candidates = regions.stream()
                                .filter(region -> region.reusableFor(edit))
                                .sorted(Comparator.comparingInt(Region::length))
                                .toList();
        for (var region : candidates) {
            int newEnd = region.end() + edit.delta();
            if (newEnd < region.start() || newEnd > source.length()) {
                continue;
            }
            Optional<TracedParse> reparsed;
            try {
                reparsed = interpreter.traceRule(region.ruleName(), source, region.origin());
            } catch (ParseException e) {
                LOG.debug("Region re-parse of rule '{}' failed: {}", region.ruleName(), e.getMessage());
                continue;
            }
            if (reparsed.isEmpty() || reparsed.get().end() != newEnd) {
                continue;
            }
            var spliced = TreeSplicer.splice(tree, region.node(), reparsed.get().tree(), source, edit.delta());
            if (spliced.isPresent()) {
                LOG.debug("Edit at {} re-parsed rule '{}' over [{}, {})",
                          edit.offset(), region.ruleName(), region.start(), newEnd);
                adopt(spliced.get(), region, reparsed.get(), edit.delta());
                return true;
            }
        }
        LOG.debug("No reusable region for edit at {}, parsing the whole document", edit.offset());
        return false;
    }

    private void reparseDocument() {
        try {
            adopt(interpreter.trace(source));
        } catch (ParseException e) {
            if (tree == null) {
                throw e;
            }
            LOG.debug("Document does not parse after edit, keeping the previous tree: {}", e.getMessage());
            clearRegions();
        }
    }

    private void adopt(TracedParse parsed) {
        tree = parsed.tree();
        traces = new IdentityHashMap<>(parsed.traces());
        rebuildRegions();
    }

    /**
     * Carry traces over to the spliced tree: ancestors keep theirs, later nodes are shifted
     * and also looked past the re-parsed region, re-parsed nodes also looked at whatever
     * preceded the region.
     */
    private void adopt(TreeSplicer.Spliced spliced, Region region, TracedParse reparsed, int delta) {
        var merged = new IdentityHashMap<SourceAst, RuleTrace>();
        carryTraces(spliced.root(), spliced, region, reparsed, delta, merged);
        tree = spliced.root();
        traces = merged;
        rebuildRegions();
    }

    private void carryTraces(SourceAst node, TreeSplicer.Spliced spliced, Region region, TracedParse reparsed,
                             int delta, Map<SourceAst, RuleTrace> merged) {
        var trace = carriedTrace(node, spliced, region, reparsed, delta);
        if (trace != null) {
            merged.put(node, trace);
        }
        for (var child : node.children()) {
            carryTraces(child, spliced, region, reparsed, delta, merged);
        }
    }

    private RuleTrace carriedTrace(SourceAst node, TreeSplicer.Spliced spliced, Region region,
                                   TracedParse reparsed, int delta) {
        var ancestor = spliced.ancestors().get(node);
        if (ancestor != null) {
            return traces.get(ancestor);
        }
        var original = spliced.shifted().get(node);
        if (original != null) {
            var old = traces.get(original);
            return old == null
                   ? null
                   : old.shifted(delta).withReachBefore(Math.max(old.reachBefore() + delta, reparsed.reach()));
        }
        var fresh = reparsed.traces().get(node);
        if (fresh != null) {
            return fresh.withReachBefore(Math.max(fresh.reachBefore(), region.reachBefore()));
        }
        var unchanged = traces.get(node);
        if (unchanged == null) {
            return null;
        }
        // The re-parsed rule reads from its origin on.
        return node.endOffset() > region.origin() ? unchanged.unstable() : unchanged;
    }

    private void rebuildRegions() {
        var result = new ArrayList<Region>();
        for (var child : tree.children()) {
            collectRegions(child, result);
        }
        regions = List.copyOf(result);
    }

    private void collectRegions(SourceAst node, List<Region> result) {
        var trace = traces.get(node);
        if (trace != null) {
            result.add(new Region(node.startOffset(), node.endOffset(), node, trace.rule(), trace.origin(),
                                  trace.reachBefore(), trace.stable()));
        }
        for (var child : node.children()) {
            collectRegions(child, result);
        }
    }

    private void clearRegions() {
        regions = List.of();
        traces = new IdentityHashMap<>();
    }
}
