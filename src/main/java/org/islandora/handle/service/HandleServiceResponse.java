package org.islandora.handle.service;

/**
 * HandleServiceResponse is a record of the answer the Handle service gave to a create or delete
 * request.
 *
 * @param code  Response code reported by the service
 * @param error Error text reported by the service, null when none was given
 */
public record HandleServiceResponse(int code, String error) {

    /**
     * @return The reported error, or the response code when the service gave no error text
     */
    public String describe() {
        if (error == null || error.trim().isEmpty()) {
            return "Handle service responded with code " + code;
        }
        return error.trim();
    }
}
