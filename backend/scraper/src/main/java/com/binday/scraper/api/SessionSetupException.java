package com.binday.scraper.api;

/**
 * The address handshake could not be verified: no session cookie was seen.
 */
public class SessionSetupException extends ScrapeException {
    private final int status;

    public SessionSetupException(String message, int status) {
        super(message);
        this.status = status;
    }

    public SessionSetupException(String message, Throwable cause) {
        super(message, cause);
        this.status = 0;
    }

    /**
     * HTTP status of the handshake response, or 0 when no response was received.
     */
    public int status() {
        return status;
    }
}
