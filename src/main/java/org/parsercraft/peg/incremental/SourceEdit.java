package org.parsercraft.peg.incremental;

import java.util.Objects;

/**
 * One text splice: replace {@code oldLength} characters at {@code offset} with {@code newText}.
 */
public record SourceEdit(int offset, int oldLength, String newText) {

    public SourceEdit {
        if (offset < 0) {
            throw new IllegalArgumentException("Edit offset must not be negative, got " + offset);
        }
        if (oldLength < 0) {
            throw new IllegalArgumentException("Edit length must not be negative, got " + oldLength);
        }
        Objects.requireNonNull(newText, "newText");
    }

    public static SourceEdit insert(int offset, String text) {
        return new SourceEdit(offset, 0, text);
    }

    public static SourceEdit delete(int offset, int length) {
        return new SourceEdit(offset, length, "");
    }

    public int newLength() {
        return newText.length();
    }

    /**
     * Change in document length.
     */
    public int delta() {
        return newText.length() - oldLength;
    }

    /**
     * Offset one past the replaced text, in the old document.
     */
    public int oldEnd() {
        return offset + oldLength;
    }

    /**
     * @throws IllegalArgumentException if the replaced range lies outside {@code source}
     */
    public String applyTo(String source) {
        if (oldEnd() > source.length()) {
            throw new IllegalArgumentException("Edit [" + offset + ", " + oldEnd() + ") outside document of length "
                                               + source.length());
        }
        return source.substring(0, offset) + newText + source.substring(oldEnd());
    }
}
