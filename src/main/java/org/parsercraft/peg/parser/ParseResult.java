package org.parsercraft.peg.parser;

import org.parsercraft.peg.tree.SourceAst;

import java.util.List;
import java.util.Optional;

/**
 * Result of matching an expression - either success with the cursor after the match,
 * or failure. Only used while a rule assembles its node.
 */
public sealed interface ParseResult {

    boolean isSuccess();

    default boolean isFailure() {
        return !isSuccess();
    }

    /**
     * Successful match.
     *
     * @param end   cursor offset after the match
     * @param value synthesized value of the match: a node or a matched text, if any
     * @param parts flattened intermediate pieces collected by sequences and repetitions
     */
    record Success(int end, Optional<Piece> value, List<Piece> parts) implements ParseResult {
        public Success {
            parts = List.copyOf(parts);
        }

        public static Success empty(int end) {
            return new Success(end, Optional.empty(), List.of());
        }

        public static Success of(int end, Piece value) {
            return new Success(end, Optional.of(value), List.of());
        }

        public static Success ofParts(int end, List<Piece> parts) {
            return new Success(end, Optional.empty(), parts);
        }

        @Override
        public boolean isSuccess() {
            return true;
        }
    }

    /**
     * No match at the attempted position.
     */
    record Failure() implements ParseResult {
        @Override
        public boolean isSuccess() {
            return false;
        }
    }

    Failure FAILURE = new Failure();

    /**
     * Intermediate piece of a match.
     */
    sealed interface Piece {}

    /**
     * A node produced by a rule or a built-in token.
     */
    record NodePiece(SourceAst node) implements Piece {}

    /**
     * Text matched by a literal, character class or any-character, with its exact span.
     */
    record TextPiece(String text, int start, int end) implements Piece {}
}
