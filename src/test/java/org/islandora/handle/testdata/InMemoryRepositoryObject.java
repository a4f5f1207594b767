package org.islandora.handle.testdata;

import java.io.IOException;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import org.islandora.handle.exceptions.DatastreamNotFoundException;
import org.islandora.handle.repository.RepositoryObject;

/**
 * RepositoryObject kept in memory, counting writes per datastream.
 */
public class InMemoryRepositoryObject implements RepositoryObject {
    private final String pid;
    private final Set<String> contentModels;
    private final Map<String, byte[]> datastreams = new HashMap<>();
    private final Map<String, Integer> writes = new HashMap<>();

    public InMemoryRepositoryObject(String pid, Collection<String> contentModels) {
        this.pid = pid;
        this.contentModels = new LinkedHashSet<>(contentModels);
    }

    public InMemoryRepositoryObject(String pid, String... contentModels) {
        this(pid, Arrays.asList(contentModels));
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
        return datastreams.containsKey(dsid);
    }

    @Override
    public byte[] getDatastreamContent(String dsid) throws DatastreamNotFoundException {
        byte[] content = datastreams.get(dsid);
        if (content == null) {
            throw new DatastreamNotFoundException("No datastream: " + dsid + " on: " + pid);
        }
        return content.clone();
    }

    @Override
    public void setDatastreamContent(String dsid, byte[] content) throws IOException {
        datastreams.put(dsid, content.clone());
        writes.merge(dsid, 1, Integer::sum);
    }

    /**
     * Seed a datastream without counting it as a write
     */
    public void putDatastream(String dsid, byte[] content) {
        datastreams.put(dsid, content.clone());
    }

    public void removeDatastream(String dsid) {
        datastreams.remove(dsid);
    }

    public int getWriteCount(String dsid) {
        return writes.getOrDefault(dsid, 0);
    }
}
