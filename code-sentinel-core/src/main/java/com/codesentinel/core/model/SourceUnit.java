package com.codesentinel.core.model;

import com.codesentinel.core.exception.InvalidSourceException;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * A unit of source text submitted for analysis.
 *
 * <p>Construction never validates content; an empty unit is representable so that the
 * analyzer can report it as a failed analysis instead of throwing.
 *
 * @param text source text, {@code null} is normalized to the empty string
 * @param fileName optional file name for reference in reports
 */
public record SourceUnit(String text, String fileName) {

    public SourceUnit {
        if (text == null) {
            text = "";
        }
    }

    /**
     * Creates a unit without a file name.
     *
     * @param text source text
     * @return new unit
     */
    public static SourceUnit of(String text) {
        return new SourceUnit(text, null);
    }

    /**
     * Creates a unit with a file name.
     *
     * @param text source text
     * @param fileName file name
     * @return new unit
     */
    public static SourceUnit of(String text, String fileName) {
        return new SourceUnit(text, fileName);
    }

    /**
     * Decodes raw bytes as strict UTF-8.
     *
     * @param content raw file content
     * @param fileName file name for reference, may be null
     * @return decoded unit
     * @throws InvalidSourceException if the bytes are not valid UTF-8 text
     */
    public static SourceUnit decode(byte[] content, String fileName) {
        if (content == null) {
            throw new InvalidSourceException("Source content is missing");
        }
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            String text = decoder.decode(ByteBuffer.wrap(content)).toString();
            if (!text.isEmpty() && text.charAt(0) == '\uFEFF') {
                text = text.substring(1);
            }
            return new SourceUnit(text, fileName);
        } catch (CharacterCodingException e) {
            throw new InvalidSourceException("Source is not decodable as UTF-8 text", e);
        }
    }

    /**
     * Returns the file name, or the given fallback when none was supplied.
     *
     * @param fallback fallback name
     * @return file name or fallback
     */
    public String fileNameOr(String fallback) {
        return fileName != null ? fileName : fallback;
    }
}
