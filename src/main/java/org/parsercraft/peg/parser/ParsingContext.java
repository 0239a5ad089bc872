package org.parsercraft.peg.parser;

import org.parsercraft.peg.error.ParseError;
import org.parsercraft.peg.error.ParseException;
import org.parsercraft.peg.grammar.Grammar;
import org.parsercraft.peg.tree.LineIndex;
import org.parsercraft.peg.tree.SourceAst;
import org.parsercraft.peg.tree.SourceLocation;
import org.parsercraft.peg.tree.SourceSpan;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * Mutable parsing context that tracks state during one parse.
 *
 * <p>All character reads go through {@link #peekAt(int)} or {@link #read(int, int)} so a
 * traced parse knows how far each evaluation looked and which finished nodes were
 * examined again afterwards.
 */
public final class ParsingContext {
    static final int END = -1;
    private static final int SNIPPET_LENGTH = 30;

    private final String input;
    private final Grammar grammar;
    private final ParserConfig config;
    private final List<Pattern> commentPatterns;
    private final Set<Pattern> lookaroundPatterns;
    private final LineIndex lineIndex;
    private final Map<Long, MemoEntry> packratCache;
    private final boolean tracing;

    private int pos;
    private int depth;
    private String currentRule;
    private int furthestPos;
    private String furthestRule;

    // Tracing state
    private int reach;
    private int seq;
    private final TreeMap<Integer, List<NodeTrace>> pending = new TreeMap<>();
    private final Map<SourceAst, NodeTrace> traces = new IdentityHashMap<>();

    private ParsingContext(String input, Grammar grammar, ParserConfig config,
                           List<Pattern> commentPatterns, boolean tracing) {
        this.input = input;
        this.grammar = grammar;
        this.config = config;
        this.commentPatterns = commentPatterns;
        this.lookaroundPatterns = Set.copyOf(commentPatterns.stream()
                                                           .filter(ParsingContext::looksAround)
                                                           .toList());
        this.lineIndex = LineIndex.of(input);
        this.packratCache = config.packratEnabled() ? new HashMap<>() : null;
        this.tracing = tracing;
        this.pos = 0;
        this.depth = 0;
        this.currentRule = "";
        this.furthestPos = -1;
        this.furthestRule = "";
    }

    public static ParsingContext create(String input, Grammar grammar, ParserConfig config,
                                        List<Pattern> commentPatterns, boolean tracing) {
        return new ParsingContext(input, grammar, config, commentPatterns, tracing);
    }

    // === Position Management ===

    public int pos() {
        return pos;
    }

    public void setPos(int pos) {
        this.pos = pos;
    }

    public int length() {
        return input.length();
    }

    public String input() {
        return input;
    }

    public Grammar grammar() {
        return grammar;
    }

    // === Character Access ===

    /**
     * Character at {@code offset}, or {@link #END} past the end of input.
     */
    public int peekAt(int offset) {
        touch(offset);
        return offset < input.length() ? input.charAt(offset) : END;
    }

    public String substring(int start, int end) {
        return input.substring(start, end);
    }

    /**
     * Skip whitespace and comment patterns until neither matches, when the grammar asks for it.
     */
    public void skipIgnored() {
        if (!grammar.skipWhitespace()) {
            return;
        }
        boolean changed = true;
        while (changed) {
            changed = false;
            while (isIgnorableSpace(peekAt(pos))) {
                pos++;
                changed = true;
            }
            for (var pattern : commentPatterns) {
                int end = matchAt(pattern, pos);
                if (end > pos) {
                    pos = end;
                    changed = true;
                }
            }
        }
    }

    /**
     * Skip ignored text, then any remaining whitespace even when the grammar does not skip it.
     */
    public void skipTrailing() {
        skipIgnored();
        int c;
        while ((c = peekAt(pos)) != END && Character.isWhitespace(c)) {
            pos++;
        }
    }

    private static boolean isIgnorableSpace(int c) {
        return c == ' ' || c == '\t' || c == '\r' || c == '\n';
    }

    /**
     * Match {@code pattern} anchored at {@code from}, seeing the whole input around it. The
     * window starts at one character and doubles while the matcher runs into its end, so
     * only text the pattern needed counts as examined. Lookaround can look past the window
     * on either side, so such patterns count the whole input as examined.
     *
     * @return end offset of the match, or -1 when the pattern does not match
     */
    int matchAt(Pattern pattern, int from) {
        var matcher = pattern.matcher(input)
                             .useAnchoringBounds(false)
                             .useTransparentBounds(true);
        if (lookaroundPatterns.contains(pattern)) {
            matcher.region(from, input.length());
            boolean found = matcher.lookingAt();
            read(0, input.length());
            return found ? matcher.end() : -1;
        }
        int limit = Math.min(input.length(), from + 1);
        while (true) {
            matcher.region(from, limit);
            boolean found = matcher.lookingAt();
            if (matcher.hitEnd() && limit < input.length()) {
                limit = (int) Math.min(input.length(), from + 2L * (limit - from));
                continue;
            }
            read(from, matcher.hitEnd() ? limit : limit - 1);
            return found ? matcher.end() : -1;
        }
    }

    private static boolean looksAround(Pattern pattern) {
        var regex = pattern.pattern();
        return regex.contains("(?=") || regex.contains("(?!") || regex.contains("(?<")
               || regex.contains("\\b") || regex.contains("\\B");
    }

    // === Locations ===

    public SourceLocation location(int offset) {
        return lineIndex.locate(offset);
    }

    public SourceSpan span(int start, int end) {
        return lineIndex.span(start, end);
    }

    /**
     * Up to thirty characters of the line starting at {@code offset}.
     */
    public String snippetAt(int offset) {
        var text = input.substring(offset, Math.min(input.length(), offset + SNIPPET_LENGTH));
        int newline = text.indexOf('\n');
        return newline < 0 ? text : text.substring(0, newline);
    }

    // === Error Tracking ===

    /**
     * Record an attempt at {@code offset}; the first rule to reach the furthest offset is kept.
     */
    public void noteAttempt(int offset) {
        if (offset > furthestPos) {
            furthestPos = offset;
            furthestRule = currentRule;
        }
    }

    public int furthestPos() {
        return Math.max(furthestPos, 0);
    }

    public String furthestRule() {
        return furthestRule;
    }

    // === Rule Nesting ===

    /**
     * Enter a rule invocation.
     *
     * @return the previously active rule, to be passed to {@link #exitRule(String)}
     * @throws ParseException if the configured nesting depth is exceeded
     */
    public String enterRule(String ruleName) {
        if (depth >= config.maxDepth()) {
            throw new ParseException(new ParseError.DepthExceeded(location(pos), ruleName, config.maxDepth()));
        }
        depth++;
        var previous = currentRule;
        currentRule = ruleName;
        return previous;
    }

    public void exitRule(String previous) {
        depth--;
        currentRule = previous;
    }

    /**
     * Enter a sub-expression of the active rule. Composite nesting shares the rule budget.
     *
     * @throws ParseException if the configured nesting depth is exceeded
     */
    void enterExpression() {
        if (depth >= config.maxDepth()) {
            throw new ParseException(new ParseError.DepthExceeded(location(pos), currentRule, config.maxDepth()));
        }
        depth++;
    }

    void exitExpression() {
        depth--;
    }

    public String currentRule() {
        return currentRule;
    }

    // === Packrat Cache ===

    /**
     * Memoized result with the range of trace sequence numbers registered while computing it.
     */
    record MemoEntry(ParseResult result, int firstSeq, int lastSeq) {}

    static long packratKey(int ruleId, int position) {
        return ((long) ruleId << 32) | (position & 0xFFFFFFFFL);
    }

    Optional<MemoEntry> cachedAt(int ruleId, int position) {
        if (packratCache == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(packratCache.get(packratKey(ruleId, position)));
    }

    void cacheAt(int ruleId, int position, ParseResult result, int firstSeq) {
        if (packratCache != null) {
            packratCache.put(packratKey(ruleId, position), new MemoEntry(result, firstSeq, seq));
        }
    }

    /**
     * Account for reusing a memoized result at {@code position}: nodes it did not produce
     * itself count as examined from that position on.
     */
    void replay(MemoEntry entry, int position) {
        mark(position, entry.firstSeq(), entry.lastSeq());
    }

    // === Tracing ===

    public int reach() {
        return reach;
    }

    int seq() {
        return seq;
    }

    /**
     * Record that the character at {@code offset} was examined ({@code offset == length}
     * means the end of input was seen).
     */
    public void touch(int offset) {
        if (!tracing) {
            return;
        }
        if (offset + 1 > reach) {
            reach = offset + 1;
        }
        mark(offset, 0, 0);
    }

    /**
     * Record that all characters from {@code from} to {@code to} inclusive were examined.
     */
    public void read(int from, int to) {
        if (!tracing) {
            return;
        }
        if (to + 1 > reach) {
            reach = to + 1;
        }
        mark(from, 0, 0);
    }

    private void mark(int offset, int skipFrom, int skipTo) {
        if (!tracing || pending.isEmpty() || pending.lastKey() <= offset) {
            return;
        }
        var affected = pending.tailMap(offset, false)
                              .values()
                              .iterator();
        while (affected.hasNext()) {
            var nodes = affected.next();
            nodes.removeIf(trace -> {
                if (trace.seq >= skipFrom && trace.seq < skipTo) {
                    return false;
                }
                trace.stable = false;
                return true;
            });
            if (nodes.isEmpty()) {
                affected.remove();
            }
        }
    }

    /**
     * Register a node produced by {@code ruleName}, invoked at {@code origin}.
     */
    void register(SourceAst node, String ruleName, int origin, int reachBefore) {
        if (!tracing) {
            return;
        }
        var trace = new NodeTrace(ruleName, origin, reachBefore, seq++);
        traces.put(node, trace);
        pending.computeIfAbsent(node.endOffset(), k -> new ArrayList<>())
               .add(trace);
    }

    Map<SourceAst, RuleTrace> traces() {
        var result = new IdentityHashMap<SourceAst, RuleTrace>(traces.size());
        traces.forEach((node, trace) -> result.put(node, trace.toRuleTrace()));
        return result;
    }

    private static final class NodeTrace {
        private final String rule;
        private final int origin;
        private final int reachBefore;
        private final int seq;
        private boolean stable = true;

        private NodeTrace(String rule, int origin, int reachBefore, int seq) {
            this.rule = rule;
            this.origin = origin;
            this.reachBefore = reachBefore;
            this.seq = seq;
        }

        private RuleTrace toRuleTrace() {
            return new RuleTrace(rule, origin, reachBefore, stable);
        }
    }
}
