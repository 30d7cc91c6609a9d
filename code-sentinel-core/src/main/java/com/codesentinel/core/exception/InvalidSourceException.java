package com.codesentinel.core.exception;

/**
 * Thrown when a source unit cannot be analyzed: empty, blank, binary, or not decodable
 * as text.
 *
 * <p>The analyzer converts this exception into a report with {@code success=false};
 * it never escapes {@code CodeAnalyzer.analyze}.
 */
public class InvalidSourceException extends RuntimeException {

    public InvalidSourceException(String message) {
        super(message);
    }

    public InvalidSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
