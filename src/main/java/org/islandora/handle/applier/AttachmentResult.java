package org.islandora.handle.applier;

import org.islandora.handle.Message;

/**
 * Outcome of embedding a Handle into a datastream.
 *
 * @param success True if the Handle is now part of the datastream
 * @param message Report of what happened
 */
public record AttachmentResult(boolean success, Message message) {

}
