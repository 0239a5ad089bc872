package org.parsercraft.peg.grammar;

/**
 * A named grammar rule: {@code name <- expression}.
 *
 * @param id         interned identifier assigned when the grammar is built, used for memo keys
 * @param name       rule name
 * @param expression rule body
 * @param kind       node kind produced on a match, defaults to the name
 * @param fragment   a fragment matches without producing its own node
 */
public record Rule(
    int id,
    String name,
    Expression expression,
    String kind,
    boolean fragment) {
    public Rule {
        if (kind == null || kind.isEmpty()) {
            kind = name;
        }
    }

    Rule withId(int newId) {
        return new Rule(newId, name, expression, kind, fragment);
    }
}
