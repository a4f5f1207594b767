package org.islandora.handle.testdata;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.islandora.handle.Message;
import org.islandora.handle.applier.AttachmentResult;
import org.islandora.handle.applier.HandleApplier;
import org.islandora.handle.repository.RepositoryObject;

/**
 * HandleApplier that records the datastreams it was asked to attach to.
 */
public class RecordingHandleApplier implements HandleApplier {
    public final List<String> appliedTo = new ArrayList<>();
    public boolean succeed = true;

    @Override
    public AttachmentResult applyHandleToDatastream(
        RepositoryObject object, String dsid, String transform) {
        appliedTo.add(dsid + ":" + transform);
        Map<String, String> substitutions = Map.of("dsid", dsid, "pid", object.getId());
        if (succeed) {
            return new AttachmentResult(
                true, Message.notice("Appended the Handle to {dsid} of {pid}.", substitutions));
        }
        return new AttachmentResult(
            false, Message.logError("Unable to append the Handle to {dsid} of {pid}.",
                                    substitutions));
    }
}
