package com.codesentinel.core.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Structural facts for one physical line.
 *
 * @param lineNumber 1-based line number
 * @param rawText line exactly as written, without the line terminator
 * @param codeText {@code rawText} with string contents blanked and comments removed
 * @param indent indentation width in columns (tabs count as four)
 * @param constructs syntactic tags detected on this line, empty for blank lines
 */
public record LineContext(
    int lineNumber,
    String rawText,
    String codeText,
    int indent,
    Set<Construct> constructs
) {
    public LineContext {
        if (lineNumber < 1) {
            throw new IllegalArgumentException("lineNumber must be >= 1, was " + lineNumber);
        }
        Objects.requireNonNull(rawText, "rawText must not be null");
        if (codeText == null) {
            codeText = rawText;
        }
        constructs = constructs == null || constructs.isEmpty()
            ? Collections.emptySet()
            : Collections.unmodifiableSet(EnumSet.copyOf(constructs));
    }

    /**
     * Creates a line context whose code text equals its raw text.
     *
     * @param lineNumber 1-based line number
     * @param rawText line text
     * @param constructs tags
     * @return new line context
     */
    public static LineContext of(int lineNumber, String rawText, Set<Construct> constructs) {
        return new LineContext(lineNumber, rawText, rawText, 0, constructs);
    }

    /**
     * Returns true if the line carries the given tag.
     *
     * @param construct tag to test
     * @return true if present
     */
    public boolean has(Construct construct) {
        return constructs.contains(construct);
    }

    /**
     * Returns true if the line contains only whitespace.
     *
     * @return true for blank lines
     */
    public boolean isBlank() {
        return rawText.isBlank();
    }

    /**
     * Returns the raw text without surrounding whitespace.
     *
     * @return trimmed text
     */
    public String trimmed() {
        return rawText.strip();
    }
}
