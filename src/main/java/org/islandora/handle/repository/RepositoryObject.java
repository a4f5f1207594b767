package org.islandora.handle.repository;

import java.io.IOException;
import java.util.Set;

import org.islandora.handle.exceptions.DatastreamNotFoundException;

/**
 * RepositoryObject is the view of a digital object that Handle reconciliation works through. The
 * object is owned by the repository; callers only read its identity and read or write the content
 * of its datastreams.
 */
public interface RepositoryObject {
    /**
     * @return Persistent identifier of the object
     */
    String getId();

    /**
     * @return Content models of the object, in the order they were declared
     */
    Set<String> getContentModels();

    /**
     * @param dsid Datastream id
     * @return True if the object currently has the datastream
     */
    boolean hasDatastream(String dsid);

    /**
     * @param dsid Datastream id
     * @return Content of the datastream
     * @throws DatastreamNotFoundException When the object has no such datastream
     * @throws IOException                 When the content cannot be read
     */
    byte[] getDatastreamContent(String dsid) throws DatastreamNotFoundException, IOException;

    /**
     * Replace (or create) the content of a datastream.
     *
     * @param dsid    Datastream id
     * @param content New content
     * @throws IOException When the content cannot be written
     */
    void setDatastreamContent(String dsid, byte[] content) throws IOException;
}
