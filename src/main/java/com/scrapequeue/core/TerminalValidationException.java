package com.scrapequeue.core;

/**
 * Failure that will not go away by trying again: malformed input, a URL that
 * does not parse, a page that does not exist, access denied.
 * Tasks failing this way are reported after a single attempt.
 */
public class TerminalValidationException extends RuntimeException {

    public TerminalValidationException(String message) {
        super(message);
    }

    public TerminalValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
