package com.eainde.bidding.namespace;

import com.eainde.bidding.error.BiddingPipelineException;
import com.eainde.bidding.error.StoreUnavailableException;
import com.eainde.bidding.model.IsolationMode;
import com.eainde.bidding.model.NamespaceHandle;
import com.eainde.bidding.provider.RetryingCaller;
import com.eainde.bidding.provider.VectorStore;
import lombok.extern.log4j.Log4j2;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Hands out retrieval namespaces and guards them.
 *
 * <p>{@link IsolationMode#ISOLATED} runs get one namespace per session, emptied under its
 * write lock before {@link #acquire} returns, so no chunk of an earlier document is visible
 * to the new run. {@link IsolationMode#CUMULATIVE} runs of every session share
 * {@link #SHARED_NAMESPACE}, which is never cleared. Indexing and retrieval run through
 * {@link #readAccess}, which takes the shared lock and therefore never overlaps a clear.</p>
 */
@Log4j2
public class NamespaceManager {

    private static final String NAMESPACE_PREFIX = "bid-";
    public static final String SHARED_NAMESPACE = NAMESPACE_PREFIX + "shared";

    private final VectorStore store;
    private final RetryingCaller retryingCaller;
    private final Map<String, ReentrantReadWriteLock> locks = new ConcurrentHashMap<>();

    public NamespaceManager(VectorStore store, RetryingCaller retryingCaller) {
        this.store = store;
        this.retryingCaller = retryingCaller;
    }

    public static String namespaceFor(String sessionId, IsolationMode mode) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("sessionId must not be blank");
        }
        return mode == IsolationMode.CUMULATIVE ? SHARED_NAMESPACE : NAMESPACE_PREFIX + sessionId.trim();
    }

    /**
     * @throws StoreUnavailableException when the store cannot be reached or cleared
     */
    public NamespaceHandle acquire(String sessionId, IsolationMode mode) {
        String namespaceId = namespaceFor(sessionId, mode);
        NamespaceHandle handle = new NamespaceHandle(namespaceId, sessionId, mode);
        Lock writeLock = lockFor(namespaceId).writeLock();
        writeLock.lock();
        try {
            if (mode == IsolationMode.ISOLATED) {
                storeCall("clear " + namespaceId, () -> store.clear(namespaceId));
                log.info("Cleared namespace {} for isolated session {}", namespaceId, sessionId);
            } else {
                storeCall("probe " + namespaceId, () -> store.checkAvailable(namespaceId));
                log.info("Reusing cumulative namespace {} for session {}", namespaceId, sessionId);
            }
        } finally {
            writeLock.unlock();
        }
        return handle;
    }

    /**
     * Ends a run's use of the namespace. Isolated data stays in place until the next
     * {@link #acquire} clears it; cumulative data is kept by definition.
     */
    public void release(NamespaceHandle handle) {
        log.debug("Released namespace {} ({})", handle.namespaceId(), handle.mode());
    }

    /** Runs {@code action} under the namespace's shared lock. */
    public <T> T readAccess(NamespaceHandle handle, Supplier<T> action) {
        Lock readLock = lockFor(handle.namespaceId()).readLock();
        readLock.lock();
        try {
            return action.get();
        } finally {
            readLock.unlock();
        }
    }

    private void storeCall(String operation, Runnable call) {
        try {
            retryingCaller.run(operation, call);
        } catch (StoreUnavailableException e) {
            throw e;
        } catch (BiddingPipelineException e) {
            throw new StoreUnavailableException("Vector store failed during " + operation, e);
        }
    }

    private ReentrantReadWriteLock lockFor(String namespaceId) {
        return locks.computeIfAbsent(namespaceId, id -> new ReentrantReadWriteLock());
    }
}
