package org.islandora.handle.exceptions;

import java.io.FileNotFoundException;

/**
 * An exception thrown when a repository object is not found for a given pid.
 */
public class RepositoryObjectNotFoundException extends FileNotFoundException {
    public RepositoryObjectNotFoundException(String message) {
        super(message);
    }

}
