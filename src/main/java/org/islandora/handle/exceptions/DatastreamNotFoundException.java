package org.islandora.handle.exceptions;

import java.io.FileNotFoundException;

/**
 * An exception thrown when a repository object has no datastream with the requested id.
 */
public class DatastreamNotFoundException extends FileNotFoundException {
    public DatastreamNotFoundException(String message) {
        super(message);
    }

}
