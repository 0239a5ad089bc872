package org.parsercraft.peg.parser;

/**
 * How a rule node was produced during a traced parse.
 *
 * @param rule        name of the rule that produced the node
 * @param origin      cursor offset the rule was invoked at, before ignored text was skipped
 * @param reachBefore one past the furthest offset examined by anything evaluated before the invocation
 * @param stable      no later evaluation examined text inside the node's span
 */
public record RuleTrace(String rule, int origin, int reachBefore, boolean stable) {

    public RuleTrace shifted(int delta) {
        return new RuleTrace(rule, origin + delta, reachBefore + delta, stable);
    }

    public RuleTrace withReachBefore(int reach) {
        return new RuleTrace(rule, origin, reach, stable);
    }

    public RuleTrace unstable() {
        return stable ? new RuleTrace(rule, origin, reachBefore, false) : this;
    }
}
