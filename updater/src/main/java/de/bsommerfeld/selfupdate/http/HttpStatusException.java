package de.bsommerfeld.selfupdate.http;

import java.io.IOException;

/**
 * Thrown when a server answers with a status outside the 2xx range.
 */
public class HttpStatusException extends IOException {

    private final int statusCode;

    public HttpStatusException(int statusCode, String url) {
        super("HTTP " + statusCode + " for " + url);
        this.statusCode = statusCode;
    }

    public int statusCode() {
        return statusCode;
    }
}
