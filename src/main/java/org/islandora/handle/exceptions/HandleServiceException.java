package org.islandora.handle.exceptions;

import java.io.IOException;

/**
 * An exception thrown when the Handle service cannot be reached or answers a query with a
 * response code that has no meaning for the request.
 */
public class HandleServiceException extends IOException {
    private final int responseCode;

    public HandleServiceException(String message) {
        super(message);
        this.responseCode = -1;
    }

    public HandleServiceException(String message, int responseCode) {
        super(message);
        this.responseCode = responseCode;
    }

    public HandleServiceException(String message, Throwable cause) {
        super(message, cause);
        this.responseCode = -1;
    }

    /**
     * @return HTTP response code reported by the service, or -1 when no response was received
     */
    public int getResponseCode() {
        return responseCode;
    }
}
