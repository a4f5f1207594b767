package org.islandora.handle.applier;

import org.islandora.handle.repository.RepositoryObject;

/**
 * The attachment step: embeds the Handle of an object into one of its datastreams.
 */
public interface HandleApplier {
    /**
     * Apply a transform to a datastream so that it references the object's Handle. Failures are
     * reported in the returned result rather than thrown.
     *
     * @param object    Object owning the datastream
     * @param dsid      Datastream to rewrite
     * @param transform Transform configured for the datastream
     * @return Success flag and the message to surface
     */
    AttachmentResult applyHandleToDatastream(RepositoryObject object, String dsid, String transform);
}
