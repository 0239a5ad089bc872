package org.parsercraft.peg.error;

import org.parsercraft.peg.tree.SourceSpan;

/**
 * Raised by the interpreter when source text does not match the grammar.
 */
public final class ParseException extends RuntimeException {
    private final transient ParseError error;

    public ParseException(ParseError error) {
        super(error.message());
        this.error = error;
    }

    public ParseError error() {
        return error;
    }

    public int line() {
        return error.location().line();
    }

    public int column() {
        return error.location().column();
    }

    /**
     * Render this error against its source text in Rust style.
     */
    public String render(String source, String fileName) {
        return toDiagnostic().format(source, fileName);
    }

    public Diagnostic toDiagnostic() {
        var span = SourceSpan.at(error.location());
        if (error instanceof ParseError.UnexpectedInput unexpected) {
            return Diagnostic.error("E0001", "unexpected input", span)
                             .withLabel("found '" + unexpected.snippet() + "'")
                             .withHelp("while matching rule '" + unexpected.rule() + "'");
        }
        if (error instanceof ParseError.TrailingInput) {
            return Diagnostic.error("E0002", "trailing input", span)
                             .withLabel("not consumed by the start rule");
        }
        if (error instanceof ParseError.DepthExceeded depth) {
            return Diagnostic.error("E0003", "nesting too deep", span)
                             .withLabel("limit of " + depth.limit() + " nested rules reached");
        }
        return Diagnostic.error("E0004", error.message(), span);
    }
}
