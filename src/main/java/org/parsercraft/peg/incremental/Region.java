package org.parsercraft.peg.incremental;

import org.parsercraft.peg.tree.SourceAst;

/**
 * Source range covered by one rule node of the current tree. Derived from the tree and
 * rebuilt after every successful parse.
 *
 * @param start       start offset of the node
 * @param end         end offset of the node (exclusive)
 * @param node        the node
 * @param ruleName    rule that produced the node
 * @param origin      offset the rule was invoked at
 * @param reachBefore one past the furthest offset examined before the rule was invoked
 * @param stable      nothing evaluated after the node examined text inside it
 */
public record Region(
    int start,
    int end,
    SourceAst node,
    String ruleName,
    int origin,
    int reachBefore,
    boolean stable
) {
    public int length() {
        return end - start;
    }

    /**
     * The edit lies entirely inside this region.
     */
    public boolean covers(SourceEdit edit) {
        return start <= edit.offset() && edit.oldEnd() <= end && edit.offset() < end;
    }

    /**
     * Re-parsing only this region's rule gives the same tree as a full parse, provided the
     * rule ends at the shifted end offset.
     */
    public boolean reusableFor(SourceEdit edit) {
        return stable && reachBefore <= edit.offset() && covers(edit);
    }
}
