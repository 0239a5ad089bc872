package org.parsercraft.peg.incremental;

import org.parsercraft.peg.tree.LineIndex;
import org.parsercraft.peg.tree.SourceAst;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Replaces one subtree of an immutable tree by path copying.
 *
 * <p>Nodes before the replaced subtree are shared with the old tree. Its ancestors are
 * copied with their end moved by the edit delta, and nodes after it are copied with
 * shifted offsets and line/column recomputed against the new text.
 */
final class TreeSplicer {
    private final String source;
    private final LineIndex lineIndex;
    private final int delta;
    private final Map<SourceAst, SourceAst> ancestors = new IdentityHashMap<>();
    private final Map<SourceAst, SourceAst> shifted = new IdentityHashMap<>();
    private final Map<SourceAst, SourceAst> shiftedByOld = new IdentityHashMap<>();

    private TreeSplicer(String source, int delta) {
        this.source = source;
        this.lineIndex = LineIndex.of(source);
        this.delta = delta;
    }

    /**
     * Outcome of a splice.
     *
     * @param root      the new root
     * @param ancestors copied ancestors, new node to old node
     * @param shifted   copied nodes after the replaced subtree, new node to old node
     */
    record Spliced(SourceAst root, Map<SourceAst, SourceAst> ancestors, Map<SourceAst, SourceAst> shifted) {}

    /**
     * Replace {@code target}, found by identity under {@code root}, with {@code replacement}.
     *
     * @param source new document text
     * @param delta  change in document length
     * @return empty when {@code target} is not part of the tree
     */
    static Optional<Spliced> splice(SourceAst root, SourceAst target, SourceAst replacement,
                                    String source, int delta) {
        var path = new ArrayList<SourceAst>();
        if (!findPath(root, target, path)) {
            return Optional.empty();
        }
        return Optional.of(new TreeSplicer(source, delta).rebuild(path, replacement));
    }

    private static boolean findPath(SourceAst node, SourceAst target, List<SourceAst> path) {
        path.add(node);
        if (node == target) {
            return true;
        }
        for (var child : node.children()) {
            if (child.startOffset() <= target.startOffset()
                && target.endOffset() <= child.endOffset()
                && findPath(child, target, path)) {
                return true;
            }
        }
        path.remove(path.size() - 1);
        return false;
    }

    private Spliced rebuild(List<SourceAst> path, SourceAst replacement) {
        var current = replacement;
        for (int i = path.size() - 2; i >= 0; i--) {
            var parent = path.get(i);
            var replaced = path.get(i + 1);
            var children = new ArrayList<SourceAst>(parent.children().size());
            boolean after = false;
            for (var child : parent.children()) {
                if (after) {
                    children.add(shift(child));
                } else if (child == replaced) {
                    children.add(current);
                    after = true;
                } else {
                    children.add(child);
                }
            }
            var span = lineIndex.span(parent.startOffset(), parent.endOffset() + delta);
            var copy = new SourceAst(parent.type(), parent.value(), children, span, span.extract(source));
            ancestors.put(copy, parent);
            current = copy;
        }
        return new Spliced(current, ancestors, shifted);
    }

    private SourceAst shift(SourceAst node) {
        var known = shiftedByOld.get(node);
        if (known != null) {
            return known;
        }
        var children = new ArrayList<SourceAst>(node.children().size());
        for (var child : node.children()) {
            children.add(shift(child));
        }
        var span = lineIndex.span(node.startOffset() + delta, node.endOffset() + delta);
        var copy = new SourceAst(node.type(), node.value(), children, span, node.text());
        shiftedByOld.put(node, copy);
        shifted.put(copy, node);
        return copy;
    }
}
