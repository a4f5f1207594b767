package org.islandora.handle;

import org.islandora.handle.repository.RepositoryObject;

/**
 * HandleReconciler keeps a repository object's persistent Handle, and the Dublin Core identifier
 * that advertises it, in step with the datastreams the configuration says should carry one. It is
 * driven by a derivative-generation pipeline: each call reconciles a single object and returns a
 * {@link ReconcileResult} instead of throwing, so a failure for one object never prevents the
 * pipeline from processing the next.
 */
public interface HandleReconciler {
    /**
     * The `ensureHandleAndAttach` method creates a Handle for the object's pid if the Handle
     * service does not know it yet, and then attaches the Handle to the datastream that triggered
     * the event.
     *
     * Creation succeeds only when the service answers `201`; on any other answer the result fails
     * with an operational-log message that carries the reported error and no attachment is tried.
     * The associations for the object's content models are scanned in order and the first one
     * whose datastream equals `hook.destinationDsid()` and is present on the object is applied.
     * Only one attachment happens per call. When no association matches the call is a no-op that
     * still succeeds.
     *
     * @param object Repository object that was just updated
     * @param hook   Event carrying the id of the datastream that changed
     * @return Result aggregating the creation and attachment messages
     * @throws IllegalArgumentException When object or hook is null
     */
    ReconcileResult ensureHandleAndAttach(RepositoryObject object, DerivativeHook hook)
        throws IllegalArgumentException;

    /**
     * The `syncDublinCore` method reflects the canonical Handle URL into the object's `DC`
     * datastream. Two preconditions are checked independently and each failure is reported with
     * its own operational-log message: the Handle must exist and the object must have a `DC`
     * datastream.
     *
     * The first `dc:identifier` that starts with `http://hdl.handle.net` is replaced in place when
     * it is stale, or a new identifier is appended when there is none. The datastream is written
     * only when one of those two edits happened; an identifier that already matches yields a
     * successful result with no messages and no write.
     *
     * @param object Repository object to synchronize
     * @return Result of the synchronization
     * @throws IllegalArgumentException When object is null
     */
    ReconcileResult syncDublinCore(RepositoryObject object) throws IllegalArgumentException;

    /**
     * The `retractIfOrphaned` method deletes the object's Handle, and the matching `DC` identifier,
     * once none of the datastreams associated with the object's content models remain. If the
     * Handle does not exist, or a qualifying datastream is still present, nothing happens.
     *
     * The Handle service answering `204` or `500` to the delete request is a success; any other
     * answer fails the result with the reported error.
     *
     * @param object Repository object to inspect
     * @return Result of the retraction
     * @throws IllegalArgumentException When object is null
     */
    ReconcileResult retractIfOrphaned(RepositoryObject object) throws IllegalArgumentException;
}
