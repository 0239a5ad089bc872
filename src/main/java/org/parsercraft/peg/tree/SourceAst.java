package org.parsercraft.peg.tree;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Generic parse tree node produced by the interpreter.
 *
 * <p>{@code type} is the produced node kind (a rule's kind, or one of the built-in kinds
 * {@code Number}, {@code String}, {@code Identifier}, {@code Operator}, {@code Program}).
 * {@code value} is a scalar for leaves and {@code null} otherwise. The span records exact
 * start and end offsets; {@code text} is the raw source slice covered by the span.
 */
public record SourceAst(
    String type,
    Object value,
    List<SourceAst> children,
    SourceSpan span,
    String text
) {
    public static final String NUMBER = "Number";
    public static final String STRING = "String";
    public static final String IDENTIFIER = "Identifier";
    public static final String OPERATOR = "Operator";
    public static final String PROGRAM = "Program";

    public SourceAst {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(span, "span");
        children = List.copyOf(children);
        text = text == null ? "" : text;
    }

    public static SourceAst leaf(String type, Object value, SourceSpan span, String text) {
        return new SourceAst(type, value, List.of(), span, text);
    }

    public static SourceAst branch(String type, List<SourceAst> children, SourceSpan span, String text) {
        return new SourceAst(type, null, children, span, text);
    }

    public int line() {
        return span.start().line();
    }

    public int column() {
        return span.start().column();
    }

    public int startOffset() {
        return span.start().offset();
    }

    public int endOffset() {
        return span.end().offset();
    }

    public boolean isLeaf() {
        return children.isEmpty();
    }

    /**
     * First child of the given kind, searching direct children only.
     */
    public Optional<SourceAst> child(String kind) {
        return children.stream()
                       .filter(c -> c.type.equals(kind))
                       .findFirst();
    }

    /**
     * All nodes of the given kind in this subtree, in pre-order.
     */
    public List<SourceAst> findAll(String kind) {
        var result = new ArrayList<SourceAst>();
        collect(kind, result);
        return result;
    }

    private void collect(String kind, List<SourceAst> out) {
        if (type.equals(kind)) {
            out.add(this);
        }
        for (var child : children) {
            child.collect(kind, out);
        }
    }

    /**
     * Public encoding: {@code {type, value, children, line, column}}.
     */
    public Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("type", type);
        map.put("value", value);
        var encoded = new ArrayList<Map<String, Object>>(children.size());
        for (var child : children) {
            encoded.add(child.toMap());
        }
        map.put("children", encoded);
        map.put("line", line());
        map.put("column", column());
        return map;
    }

    public String pretty() {
        var sb = new StringBuilder();
        pretty(sb, 0);
        return sb.toString();
    }

    private void pretty(StringBuilder sb, int indent) {
        sb.append("  ".repeat(indent)).append(type);
        if (value != null) {
            sb.append('(').append(value).append(')');
        }
        sb.append(" @").append(span.start()).append('\n');
        for (var child : children) {
            child.pretty(sb, indent + 1);
        }
    }

    @Override
    public String toString() {
        return value != null
               ? "SourceAst(" + type + ", " + value + ")"
               : "SourceAst(" + type + ", children=" + children.size() + ")";
    }
}
