package org.parsercraft.peg.grammar;

import java.util.Optional;

/**
 * Built-in token kinds usable from any grammar without declaring a rule.
 */
public enum TokenKind {
    NUMBER(true),
    STRING(true),
    IDENT(true),
    NEWLINE(true),
    EOF(true),
    // Reserved for indentation-sensitive grammars; never match.
    INDENT(false),
    DEDENT(false);

    private final boolean implemented;

    TokenKind(boolean implemented) {
        this.implemented = implemented;
    }

    public boolean implemented() {
        return implemented;
    }

    public static Optional<TokenKind> byName(String name) {
        for (var kind : values()) {
            if (kind.name().equals(name)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }

    /**
     * Whether a bare {@link Expression.Reference} to this name resolves without a rule.
     */
    public static boolean resolvesReference(String name) {
        return byName(name).map(TokenKind::implemented).orElse(false);
    }
}
