package org.islandora.handle.testdata;

import java.io.IOException;
import java.util.HashSet;
import java.util.Set;

import org.islandora.handle.exceptions.HandleServiceException;
import org.islandora.handle.service.HandleService;
import org.islandora.handle.service.HandleServiceResponse;

/**
 * In memory HandleService whose answers can be scripted per test. Successful creates and deletes
 * update the set of existing Handles.
 */
public class StubHandleService implements HandleService {
    private final Set<String> handles = new HashSet<>();
    public HandleServiceResponse createResponse =
        new HandleServiceResponse(HandleService.CREATED, null);
    public HandleServiceResponse deleteResponse =
        new HandleServiceResponse(HandleService.DELETED, null);
    public boolean failLookup = false;
    public int existsCalls = 0;
    public int createCalls = 0;
    public int deleteCalls = 0;

    public void addHandle(String pid) {
        handles.add(pid);
    }

    public boolean hasHandle(String pid) {
        return handles.contains(pid);
    }

    @Override
    public synchronized boolean exists(String pid) throws IOException {
        existsCalls++;
        if (failLookup) {
            throw new HandleServiceException("Unexpected response code 503", 503);
        }
        return handles.contains(pid);
    }

    @Override
    public synchronized HandleServiceResponse create(String pid) {
        createCalls++;
        if (createResponse.code() == HandleService.CREATED) {
            handles.add(pid);
        }
        return createResponse;
    }

    @Override
    public synchronized HandleServiceResponse delete(String pid) {
        deleteCalls++;
        if (deleteResponse.code() == HandleService.DELETED
            || deleteResponse.code() == HandleService.ALREADY_ABSENT) {
            handles.remove(pid);
        }
        return deleteResponse;
    }

    @Override
    public String canonicalUrl(String pid) {
        return HANDLE_RESOLVER_URL + "/" + TestDataHarness.HANDLE_PREFIX + "/" + pid;
    }
}
