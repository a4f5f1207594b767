package org.islandora.handle.filerepository;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.islandora.handle.exceptions.DatastreamNotFoundException;
import org.islandora.handle.repository.RepositoryObject;

/**
 * A repository object stored by {@link FileRepository}. Each datastream is a file named after its
 * id in the object's `datastreams` directory.
 */
public class FileRepositoryObject implements RepositoryObject {
    private static final Log logRepositoryObject = LogFactory.getLog(FileRepositoryObject.class);
    private final FileRepository repository;
    private final String pid;
    private final Set<String> contentModels;
    private final Path datastreamDirectory;

    protected FileRepositoryObject(
        FileRepository repository, String pid, Collection<String> contentModels,
        Path objectDirectory) {
        this.repository = repository;
        this.pid = pid;
        this.contentModels = Collections.unmodifiableSet(new LinkedHashSet<>(contentModels));
        this.datastreamDirectory = objectDirectory.resolve(FileRepository.DATASTREAM_DIRECTORY);
    }

    @Override
    public String getId() {
        return pid;
    }

    @Override
    public Set<String> getContentModels() {
        return contentModels;
    }

    @Override
    public boolean hasDatastream(String dsid) {
        FileRepositoryUtility.ensureNotNull(dsid, "dsid", "hasDatastream");
        if (!FileRepositoryUtility.isStorableDatastreamId(dsid)) {
            // Ids that cannot be file names are never stored
            logRepositoryObject.debug("Datastream id cannot be stored: " + dsid);
            return false;
        }
        return Files.isRegularFile(datastreamDirectory.resolve(dsid));
    }

    @Override
    public byte[] getDatastreamContent(String dsid) throws DatastreamNotFoundException,
        IOException {
        FileRepositoryUtility.checkDatastreamId(dsid, "getDatastreamContent");
        Path datastreamPath = datastreamDirectory.resolve(dsid);
        if (!Files.isRegularFile(datastreamPath)) {
            String errMsg = "Datastream: " + dsid + " does not exist for pid: " + pid;
            logRepositoryObject.warn(errMsg);
            throw new DatastreamNotFoundException(errMsg);
        }
        return Files.readAllBytes(datastreamPath);
    }

    @Override
    public void setDatastreamContent(String dsid, byte[] content) throws IOException {
        FileRepositoryUtility.checkDatastreamId(dsid, "setDatastreamContent");
        FileRepositoryUtility.ensureNotNull(content, "content", "setDatastreamContent");
        repository.writeFile(datastreamDirectory.resolve(dsid), content, "datastream " + dsid);
        logRepositoryObject.info("Datastream: " + dsid + " written for pid: " + pid);
    }

    /**
     * Remove a datastream from the object. The file is renamed before it is deleted so that
     * readers never see a partial removal.
     *
     * @param dsid Datastream id
     * @throws DatastreamNotFoundException When the object has no such datastream
     * @throws IOException                 When the datastream cannot be removed
     */
    public void purgeDatastream(String dsid) throws DatastreamNotFoundException, IOException {
        FileRepositoryUtility.checkDatastreamId(dsid, "purgeDatastream");
        Path datastreamPath = datastreamDirectory.resolve(dsid);
        if (!Files.isRegularFile(datastreamPath)) {
            String errMsg = "Cannot purge datastream: " + dsid + ", it does not exist for pid: "
                + pid;
            logRepositoryObject.warn(errMsg);
            throw new DatastreamNotFoundException(errMsg);
        }
        Path renamed = FileRepositoryUtility.renamePathForDeletion(datastreamPath);
        FileRepositoryUtility.deleteListItems(List.of(renamed));
        logRepositoryObject.info("Datastream: " + dsid + " purged for pid: " + pid);
    }

    /**
     * @return Ids of the datastreams the object currently has, sorted
     * @throws IOException When the datastream directory cannot be listed
     */
    public List<String> listDatastreams() throws IOException {
        List<String> dsids = new ArrayList<>();
        for (Path datastream : FileRepositoryUtility.getFilesFromDir(datastreamDirectory)) {
            String fileName = datastream.getFileName().toString();
            if (!fileName.endsWith("_delete")) {
                dsids.add(fileName);
            }
        }
        return dsids;
    }
}
