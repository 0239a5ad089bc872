package org.parsercraft.peg.tree;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.UncheckedIOException;

/**
 * JSON encoding of parse trees for downstream consumers.
 */
public final class SourceAstJson {
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final ObjectMapper PRETTY_MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private SourceAstJson() {}

    public static String toJson(SourceAst tree) {
        return write(MAPPER, tree);
    }

    public static String toPrettyJson(SourceAst tree) {
        return write(PRETTY_MAPPER, tree);
    }

    private static String write(ObjectMapper mapper, SourceAst tree) {
        try {
            return mapper.writeValueAsString(tree.toMap());
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to encode tree of type " + tree.type(), e);
        }
    }
}
