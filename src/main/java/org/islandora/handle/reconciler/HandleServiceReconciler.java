package org.islandora.handle.reconciler;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.islandora.handle.DerivativeHook;
import org.islandora.handle.HandleReconciler;
import org.islandora.handle.Message;
import org.islandora.handle.MessageChannel;
import org.islandora.handle.ReconcileResult;
import org.islandora.handle.applier.AttachmentResult;
import org.islandora.handle.applier.HandleApplier;
import org.islandora.handle.config.Association;
import org.islandora.handle.config.ConfigurationStore;
import org.islandora.handle.dublincore.DublinCoreUtility;
import org.islandora.handle.filerepository.FileRepositoryUtility;
import org.islandora.handle.repository.RepositoryObject;
import org.islandora.handle.service.HandleService;
import org.islandora.handle.service.HandleServiceResponse;
import org.w3c.dom.Document;

/**
 * HandleServiceReconciler is a HandleReconciler that keeps objects in step with a remote Handle
 * service. Its collaborators are handed to the constructor. Operations on the same pid are
 * serialized within the JVM; every collaborator failure is turned into a failed
 * {@link ReconcileResult}.
 */
public class HandleServiceReconciler implements HandleReconciler {
    private static final Log logReconciler = LogFactory.getLog(HandleServiceReconciler.class);
    private static final int TIME_OUT_MILLISEC = 1000;
    private static final Collection<String> reconcilingPids = new ArrayList<>(100);
    private final HandleService handleService;
    private final ConfigurationStore configurationStore;
    private final HandleApplier handleApplier;

    public static final String DC_DATASTREAM = "DC";

    /**
     * @param handleService      Client of the Handle service
     * @param configurationStore Source of the per content model associations
     * @param handleApplier      Attachment step used by `ensureHandleAndAttach`
     */
    public HandleServiceReconciler(
        HandleService handleService, ConfigurationStore configurationStore,
        HandleApplier handleApplier) {
        FileRepositoryUtility.ensureNotNull(
            handleService, "handleService", "HandleServiceReconciler - constructor");
        FileRepositoryUtility.ensureNotNull(
            configurationStore, "configurationStore", "HandleServiceReconciler - constructor");
        FileRepositoryUtility.ensureNotNull(
            handleApplier, "handleApplier", "HandleServiceReconciler - constructor");
        this.handleService = handleService;
        this.configurationStore = configurationStore;
        this.handleApplier = handleApplier;
    }

    @Override
    public ReconcileResult ensureHandleAndAttach(RepositoryObject object, DerivativeHook hook)
        throws IllegalArgumentException {
        FileRepositoryUtility.ensureNotNull(object, "object", "ensureHandleAndAttach");
        FileRepositoryUtility.ensureNotNull(hook, "hook", "ensureHandleAndAttach");
        FileRepositoryUtility.ensureNotNull(
            hook.destinationDsid(), "hook.destinationDsid", "ensureHandleAndAttach");
        String pid = object.getId();
        logReconciler.debug(
            "Ensuring Handle for pid: " + pid + " triggered by: " + hook.destinationDsid());

        try {
            synchronizeReconcilingPids(pid);
        } catch (InterruptedException ie) {
            return interrupted(pid);
        }
        try {
            return report(syncEnsureHandleAndAttach(object, hook));
        } finally {
            releaseReconcilingPids(pid);
        }
    }

    private ReconcileResult syncEnsureHandleAndAttach(RepositoryObject object, DerivativeHook hook) {
        String pid = object.getId();
        List<Message> messages = new ArrayList<>();

        try {
            if (!handleService.exists(pid)) {
                HandleServiceResponse response = handleService.create(pid);
                if (response.code() != HandleService.CREATED) {
                    return ReconcileResult.failed(Message.logError(
                        "Unable to create a Handle for {pid}. Error: {error}",
                        Map.of("pid", pid, "error", response.describe())));
                }
                messages.add(Message.notice(
                    "Created the Handle {handle} for {pid}.",
                    Map.of("handle", handleService.canonicalUrl(pid), "pid", pid)));
            }

        } catch (IOException ioe) {
            return ReconcileResult.failed(Message.logError(
                "Unable to create a Handle for {pid}. Error: {error}",
                Map.of("pid", pid, "error", String.valueOf(ioe.getMessage()))));
        }

        boolean success = true;
        for (Association association : configurationStore.associationsFor(
            object.getContentModels())) {
            String dsid = association.datastreamId();
            if (dsid.equals(hook.destinationDsid()) && object.hasDatastream(dsid)) {
                AttachmentResult attachment = handleApplier.applyHandleToDatastream(
                    object, dsid, association.transform());
                success = attachment.success();
                messages.add(attachment.message());
                // One attachment per event, other content models are ignored
                break;
            }
        }
        return new ReconcileResult(success, messages);
    }

    @Override
    public ReconcileResult syncDublinCore(RepositoryObject object)
        throws IllegalArgumentException {
        FileRepositoryUtility.ensureNotNull(object, "object", "syncDublinCore");
        String pid = object.getId();
        logReconciler.debug("Synchronizing Dublin Core Handle for pid: " + pid);

        try {
            synchronizeReconcilingPids(pid);
        } catch (InterruptedException ie) {
            return interrupted(pid);
        }
        try {
            return report(syncDublinCoreHandle(object));
        } finally {
            releaseReconcilingPids(pid);
        }
    }

    private ReconcileResult syncDublinCoreHandle(RepositoryObject object) {
        String pid = object.getId();
        List<Message> failures = new ArrayList<>();
        try {
            if (!handleService.exists(pid)) {
                failures.add(Message.logError(
                    "Unable to update the Dublin Core of {pid}: no Handle exists for it.",
                    Map.of("pid", pid)));
            }

        } catch (IOException ioe) {
            failures.add(Message.logError(
                "Unable to update the Dublin Core of {pid}: the Handle could not be looked up."
                    + " Error: {error}",
                Map.of("pid", pid, "error", String.valueOf(ioe.getMessage()))));
        }
        if (!object.hasDatastream(DC_DATASTREAM)) {
            failures.add(Message.logError(
                "Unable to update the Dublin Core of {pid}: the object has no {dsid} datastream.",
                Map.of("pid", pid, "dsid", DC_DATASTREAM)));
        }
        if (!failures.isEmpty()) {
            return new ReconcileResult(false, failures);
        }

        String handleUrl = handleService.canonicalUrl(pid);
        try {
            Document dublinCore = DublinCoreUtility.parse(
                object.getDatastreamContent(DC_DATASTREAM));
            if (!DublinCoreUtility.syncHandleIdentifier(dublinCore, handleUrl)) {
                return ReconcileResult.succeeded();
            }
            object.setDatastreamContent(DC_DATASTREAM, DublinCoreUtility.serialize(dublinCore));
            logReconciler.info("Dublin Core updated with Handle: " + handleUrl + " for: " + pid);
            return ReconcileResult.succeeded(Message.notice(
                "Updated the Dublin Core of {pid} with the Handle {handle}.",
                Map.of("pid", pid, "handle", handleUrl)));

        } catch (IOException ioe) {
            return ReconcileResult.failed(Message.logError(
                "Unable to update the Dublin Core of {pid} with the Handle {handle}. Error: {error}",
                Map.of("pid", pid, "handle", handleUrl, "error", String.valueOf(ioe.getMessage()))));
        }
    }

    @Override
    public ReconcileResult retractIfOrphaned(RepositoryObject object)
        throws IllegalArgumentException {
        FileRepositoryUtility.ensureNotNull(object, "object", "retractIfOrphaned");
        String pid = object.getId();
        logReconciler.debug("Checking whether the Handle of pid: " + pid + " is still in use");

        try {
            synchronizeReconcilingPids(pid);
        } catch (InterruptedException ie) {
            return interrupted(pid);
        }
        try {
            return report(syncRetractIfOrphaned(object));
        } finally {
            releaseReconcilingPids(pid);
        }
    }

    private ReconcileResult syncRetractIfOrphaned(RepositoryObject object) {
        String pid = object.getId();
        try {
            if (!handleService.exists(pid)) {
                return ReconcileResult.succeeded();
            }

        } catch (IOException ioe) {
            return ReconcileResult.failed(Message.logError(
                "Unable to delete the Handle for {pid}. Error: {error}",
                Map.of("pid", pid, "error", String.valueOf(ioe.getMessage()))));
        }

        for (Association association : configurationStore.associationsFor(
            object.getContentModels())) {
            if (object.hasDatastream(association.datastreamId())) {
                logReconciler.debug(
                    "Handle of pid: " + pid + " still used by: " + association.datastreamId());
                return ReconcileResult.succeeded();
            }
        }

        String handleUrl = handleService.canonicalUrl(pid);
        try {
            if (object.hasDatastream(DC_DATASTREAM)) {
                Document dublinCore = DublinCoreUtility.parse(
                    object.getDatastreamContent(DC_DATASTREAM));
                if (DublinCoreUtility.removeHandleIdentifier(dublinCore, handleUrl) > 0) {
                    object.setDatastreamContent(
                        DC_DATASTREAM, DublinCoreUtility.serialize(dublinCore));
                    logReconciler.info("Handle: " + handleUrl + " removed from DC of: " + pid);
                }
            }

        } catch (IOException ioe) {
            return ReconcileResult.failed(Message.logError(
                "Unable to remove the Handle {handle} from the Dublin Core of {pid}. Error: {error}",
                Map.of("pid", pid, "handle", handleUrl, "error", String.valueOf(ioe.getMessage()))));
        }

        List<Message> messages = new ArrayList<>();
        try {
            HandleServiceResponse response = handleService.delete(pid);
            if (response.code() == HandleService.ALREADY_ABSENT) {
                messages.add(Message.logWarning(
                    "The Handle service answered {code} when deleting the Handle for {pid},"
                        + " treating it as deleted. Error: {error}",
                    Map.of("code", String.valueOf(response.code()), "pid", pid, "error",
                           response.describe())));
            } else if (response.code() != HandleService.DELETED) {
                return ReconcileResult.failed(Message.logError(
                    "Unable to delete the Handle for {pid}. Error: {error}",
                    Map.of("pid", pid, "error", response.describe())));
            }

        } catch (IOException ioe) {
            return ReconcileResult.failed(Message.logError(
                "Unable to delete the Handle for {pid}. Error: {error}",
                Map.of("pid", pid, "error", String.valueOf(ioe.getMessage()))));
        }
        logReconciler.info("Handle: " + handleUrl + " deleted for: " + pid);
        messages.add(Message.notice(
            "Deleted the Handle {handle} for {pid}.", Map.of("handle", handleUrl, "pid", pid)));
        return new ReconcileResult(true, messages);
    }

    /**
     * Write the operational-log messages of a result to the log before handing it back.
     */
    private static ReconcileResult report(ReconcileResult result) {
        for (Message message : result.messagesOn(MessageChannel.OPERATIONAL_LOG)) {
            switch (message.severity()) {
                case ERROR:
                    logReconciler.error(message.render());
                    break;
                case WARNING:
                    logReconciler.warn(message.render());
                    break;
                default:
                    logReconciler.info(message.render());
            }
        }
        return result;
    }

    private static ReconcileResult interrupted(String pid) {
        Thread.currentThread().interrupt();
        return report(ReconcileResult.failed(Message.logError(
            "Interrupted while waiting to reconcile the Handle of {pid}.", Map.of("pid", pid))));
    }

    /**
     * Operations on the same pid are executed serially. A caller waits for the pid to be released
     * before proceeding.
     *
     * @param pid Persistent identifier
     * @throws InterruptedException When the wait is interrupted
     */
    private static void synchronizeReconcilingPids(String pid) throws InterruptedException {
        synchronized (reconcilingPids) {
            while (reconcilingPids.contains(pid)) {
                try {
                    reconcilingPids.wait(TIME_OUT_MILLISEC);

                } catch (InterruptedException ie) {
                    String errMsg =
                        "Synchronization has been interrupted while trying to sync pid: " + pid;
                    logReconciler.warn(errMsg);
                    throw new InterruptedException(errMsg);
                }
            }
            logReconciler.debug("Synchronizing reconcilingPids for pid: " + pid);
            reconcilingPids.add(pid);
        }
    }

    /**
     * Remove the given pid from 'reconcilingPids' and notify other threads
     *
     * @param pid Persistent identifier
     */
    private static void releaseReconcilingPids(String pid) {
        synchronized (reconcilingPids) {
            logReconciler.debug("Releasing reconcilingPids for pid: " + pid);
            reconcilingPids.remove(pid);
            reconcilingPids.notifyAll();
        }
    }
}
