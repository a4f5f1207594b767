package org.islandora.handle.service;

import java.io.IOException;

/**
 * HandleService is the client side of a Handle.net-compatible resolver service. A Handle is
 * identified by the pid of the object that owns it.
 */
public interface HandleService {
    /**
     * Fixed base of every canonical Handle URL.
     */
    String HANDLE_RESOLVER_URL = "http://hdl.handle.net";

    /**
     * Response code of a successful `create`.
     */
    int CREATED = 201;

    /**
     * Response code of a successful `delete`.
     */
    int DELETED = 204;

    /**
     * Response code the service answers `delete` with when the Handle is already gone, which is
     * accepted as a successful retraction.
     */
    int ALREADY_ABSENT = 500;

    /**
     * @param pid Persistent identifier of the owning object
     * @return True if a Handle exists for the pid
     * @throws IOException When the service cannot answer the query
     */
    boolean exists(String pid) throws IOException;

    /**
     * Ask the service to mint a Handle for the pid. Success is signaled by {@link #CREATED}.
     *
     * @param pid Persistent identifier of the owning object
     * @return Code and error text reported by the service
     * @throws IOException When the request cannot be sent
     */
    HandleServiceResponse create(String pid) throws IOException;

    /**
     * Ask the service to delete the Handle of the pid. Success is signaled by {@link #DELETED}
     * or {@link #ALREADY_ABSENT}.
     *
     * @param pid Persistent identifier of the owning object
     * @return Code and error text reported by the service
     * @throws IOException When the request cannot be sent
     */
    HandleServiceResponse delete(String pid) throws IOException;

    /**
     * Build the canonical resolvable URL of the pid's Handle. No request is made.
     *
     * @param pid Persistent identifier of the owning object
     * @return `http://hdl.handle.net/<prefix>/<pid>`
     */
    String canonicalUrl(String pid);
}
