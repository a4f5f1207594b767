package org.islandora.handle.exceptions;

import java.io.IOException;

/**
 * Custom exception class for HandleServiceFactory when it's unable to initialize
 * (like when properties are unavailable or the class cannot be instantiated).
 */
public class HandleServiceFactoryException extends IOException {
    public HandleServiceFactoryException(String message) {
        super(message);
    }

}
