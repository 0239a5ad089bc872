package org.parsercraft.peg.error;

import java.util.List;

/**
 * Raised when a grammar cannot be used: failed validation, malformed text in strict
 * mode, or a pattern that does not compile.
 */
public final class GrammarException extends RuntimeException {
    private final List<String> diagnostics;

    public GrammarException(List<String> diagnostics) {
        super(String.join("; ", diagnostics));
        this.diagnostics = List.copyOf(diagnostics);
    }

    public GrammarException(String diagnostic, Throwable cause) {
        super(diagnostic, cause);
        this.diagnostics = List.of(diagnostic);
    }

    public static GrammarException of(String diagnostic) {
        return new GrammarException(List.of(diagnostic));
    }

    public List<String> diagnostics() {
        return diagnostics;
    }
}
