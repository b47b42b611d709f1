package com.fbo.reconciliation.sync;

import com.fbo.reconciliation.cache.RemoteFetchCache;
import com.fbo.reconciliation.core.model.FacilityRecord;
import com.fbo.reconciliation.lock.LocationLock;
import com.fbo.reconciliation.logging.LogContext;
import com.fbo.reconciliation.metrics.MetricsService;
import com.fbo.reconciliation.remote.RemoteRecordStore;
import com.fbo.reconciliation.rules.NormalizationEngine;
import com.fbo.reconciliation.store.LocalStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Best-effort upload of locally created or edited records.
 *
 * <p>Pushes run on their own executor after the local write has committed and never block or
 * undo it. A successful push stamps the returned remote identifier onto the stored record and
 * clears its pending flag; a failed push leaves the record pending so the next sync queues it
 * again. A record is never pushed twice concurrently.</p>
 *
 * <p>When the remote store accepted a record but the local acknowledgement failed, the assigned
 * identifier is remembered so the retry updates that remote record instead of creating a
 * second one.</p>
 *
 * <p>Deleted names are tombstoned per location until every known remote copy is confirmed
 * deleted. Incoming records under a tombstone are dropped by the sync, and an acknowledgement
 * that arrives after its record was deleted removes the remote copy it just created.
 * Tombstones live in memory only.</p>
 */
public class PushOutbox implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(PushOutbox.class);

    private final RemoteRecordStore remoteStore;
    private final LocalStore store;
    private final LocationLock locationLock;
    private final NormalizationEngine normalizer;
    private final RemoteFetchCache fetchCache;
    private final MetricsService metricsService;
    private final ExecutorService executor;
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();
    private final ConcurrentMap<String, String> unacknowledged = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Set<String>> tombstones = new ConcurrentHashMap<>();

    public PushOutbox(RemoteRecordStore remoteStore, LocalStore store, LocationLock locationLock,
                      NormalizationEngine normalizer, RemoteFetchCache fetchCache,
                      MetricsService metricsService, int threads) {
        this.remoteStore = remoteStore;
        this.store = store;
        this.locationLock = locationLock;
        this.normalizer = normalizer;
        this.fetchCache = fetchCache;
        this.metricsService = metricsService;
        this.executor = Executors.newFixedThreadPool(threads, namedDaemonThreads("fbo-push-"));
    }

    /**
     * Queues every pending record of a location for upload.
     *
     * @return a future completing with the number of records the remote store accepted
     */
    public CompletableFuture<Integer> enqueuePending(String locationCode, List<FacilityRecord> records) {
        List<CompletableFuture<Boolean>> pushes = new ArrayList<>();
        for (FacilityRecord record : records) {
            if (!record.isPendingUpload()) {
                continue;
            }
            String key = recordKey(record.getLocationCode(), record.getName());
            if (tombstones.containsKey(key)) {
                log.debug("push.skipped-deleted locationCode={} name='{}'", locationCode, record.getName());
                continue;
            }
            if (!inFlight.add(key)) {
                log.debug("push.already-queued locationCode={} name='{}'", locationCode, record.getName());
                continue;
            }
            pushes.add(CompletableFuture.supplyAsync(() -> push(record, key), executor));
        }
        if (pushes.isEmpty()) {
            return CompletableFuture.completedFuture(0);
        }
        log.debug("push.queued locationCode={} count={}", locationCode, pushes.size());
        return CompletableFuture.allOf(pushes.toArray(new CompletableFuture[0]))
                .thenApply(v -> (int) pushes.stream().filter(CompletableFuture::join).count());
    }

    /**
     * Deletes a record on the remote side, best effort.
     *
     * @return a future completing with true if the remote store confirmed the delete
     */
    public CompletableFuture<Boolean> deleteRemote(String remoteIdentifier) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                remoteStore.delete(remoteIdentifier);
                log.info("push.deleted remoteIdentifier={}", remoteIdentifier);
                return true;
            } catch (RuntimeException e) {
                log.warn("push.delete-failed remoteIdentifier={} error={}", remoteIdentifier, e.getMessage());
                metricsService.incrementPushFailure();
                return false;
            }
        }, executor);
    }

    /**
     * Tombstones a name deleted locally and deletes its remote copies. Call while holding the
     * location lock, right after the local delete, so acknowledgements and syncs see it.
     */
    public void recordDeletion(String locationCode, String name, Collection<String> remoteIdentifiers) {
        String key = recordKey(locationCode, name);
        Set<String> pendingDeletes = tombstones.compute(key, (k, existing) -> {
            Set<String> ids = existing != null ? existing : ConcurrentHashMap.newKeySet();
            ids.addAll(remoteIdentifiers);
            String accepted = unacknowledged.remove(k);
            if (accepted != null) {
                ids.add(accepted);
            }
            return ids;
        });
        log.debug("push.tombstoned locationCode={} name='{}' remoteCopies={}", locationCode, name, pendingDeletes.size());
        List.copyOf(pendingDeletes).forEach(id -> deleteTombstoned(key, id));
        releaseTombstoneIfSettled(key);
    }

    /**
     * True while a locally deleted name still has remote copies that are not confirmed gone.
     */
    public boolean isDeleted(String locationCode, String name) {
        return tombstones.containsKey(recordKey(locationCode, name));
    }

    /**
     * Lifts the tombstone of a name that was created again locally. Remote deletes already
     * queued for the old copies still run.
     */
    public void clearDeletion(String locationCode, String name) {
        String key = recordKey(locationCode, name);
        Set<String> pendingDeletes = tombstones.remove(key);
        if (pendingDeletes != null) {
            List.copyOf(pendingDeletes).forEach(this::deleteRemote);
        }
    }

    /**
     * Re-sends the remote deletes of a location that have not been confirmed yet.
     */
    public void retryDeletes(String locationCode) {
        String prefix = recordKeyPrefix(locationCode);
        tombstones.forEach((key, pendingDeletes) -> {
            if (key.startsWith(prefix)) {
                List.copyOf(pendingDeletes).forEach(id -> deleteTombstoned(key, id));
            }
        });
    }

    public int inFlightCount() {
        return inFlight.size();
    }

    public int tombstoneCount() {
        return tombstones.size();
    }

    private boolean push(FacilityRecord record, String key) {
        try (LogContext ctx = LogContext.forPush(record.getLocationCode(), record.getName())) {
            String remoteIdentifier;
            try {
                remoteIdentifier = remoteStore.save(outgoing(record, key));
            } catch (RuntimeException e) {
                metricsService.incrementPushFailure();
                log.warn("push.failed locationCode={} name='{}' error={} (kept pending for next sync)",
                        record.getLocationCode(), record.getName(), e.getMessage());
                return false;
            }
            unacknowledged.put(key, remoteIdentifier);
            metricsService.incrementPushSuccess();

            try {
                acknowledge(record, key, remoteIdentifier);
                unacknowledged.remove(key, remoteIdentifier);
                log.info("push.acknowledged locationCode={} name='{}' remoteIdentifier={}",
                        record.getLocationCode(), record.getName(), remoteIdentifier);
            } catch (RuntimeException e) {
                log.warn("push.ack-failed locationCode={} name='{}' remoteIdentifier={} error={} (retry reuses the id)",
                        record.getLocationCode(), record.getName(), remoteIdentifier, e.getMessage());
            }
            return true;
        } finally {
            inFlight.remove(key);
            releaseTombstoneIfSettled(key);
        }
    }

    /**
     * The copy sent to the remote store: never flagged pending, and carrying the identifier
     * the remote store already assigned when an earlier acknowledgement was lost.
     */
    private FacilityRecord outgoing(FacilityRecord record, String key) {
        String remoteIdentifier = record.getRemoteIdentifier() != null
                ? record.getRemoteIdentifier() : unacknowledged.get(key);
        return FacilityRecord.builder(record)
                .remoteIdentifier(remoteIdentifier)
                .pendingUpload(false)
                .build();
    }

    private void acknowledge(FacilityRecord pushed, String recordKey, String remoteIdentifier) {
        String locationCode = pushed.getLocationCode();
        String key = normalizer.normalize(pushed.getName());

        locationLock.tryLock(locationCode);
        try {
            if (tombstones.containsKey(recordKey)) {
                orphaned(recordKey, pushed, remoteIdentifier);
                return;
            }
            List<FacilityRecord> current = store.get(locationCode);
            List<FacilityRecord> updated = new ArrayList<>(current.size());
            boolean found = false;
            for (FacilityRecord record : current) {
                if (!found && normalizer.normalize(record.getName()).equals(key)) {
                    // An edit made while the push was in flight still needs its own upload
                    boolean editedSincePush = record.getLastUpdated().isAfter(pushed.getLastUpdated());
                    updated.add(FacilityRecord.builder(record)
                            .remoteIdentifier(remoteIdentifier)
                            .pendingUpload(editedSincePush)
                            .build());
                    found = true;
                } else {
                    updated.add(record);
                }
            }
            if (found) {
                store.replace(locationCode, updated);
            } else {
                orphaned(recordKey, pushed, remoteIdentifier);
            }
        } finally {
            locationLock.unlock(locationCode);
        }
        fetchCache.invalidate(locationCode);
    }

    // Caller holds the location lock
    private void orphaned(String recordKey, FacilityRecord pushed, String remoteIdentifier) {
        log.info("push.ack-orphaned locationCode={} name='{}' remoteIdentifier={} (deleting remote copy)",
                pushed.getLocationCode(), pushed.getName(), remoteIdentifier);
        unacknowledged.remove(recordKey, remoteIdentifier);
        tombstones.compute(recordKey, (k, existing) -> {
            Set<String> ids = existing != null ? existing : ConcurrentHashMap.newKeySet();
            ids.add(remoteIdentifier);
            return ids;
        });
        deleteTombstoned(recordKey, remoteIdentifier);
    }

    private void deleteTombstoned(String recordKey, String remoteIdentifier) {
        deleteRemote(remoteIdentifier).thenAccept(deleted -> {
            if (deleted) {
                Set<String> pendingDeletes = tombstones.get(recordKey);
                if (pendingDeletes != null) {
                    pendingDeletes.remove(remoteIdentifier);
                }
                releaseTombstoneIfSettled(recordKey);
            }
        });
    }

    private void releaseTombstoneIfSettled(String recordKey) {
        tombstones.computeIfPresent(recordKey,
                (k, pendingDeletes) -> pendingDeletes.isEmpty() && !inFlight.contains(k) ? null : pendingDeletes);
    }

    private String recordKey(String locationCode, String name) {
        return recordKeyPrefix(locationCode) + normalizer.normalize(name);
    }

    private static String recordKeyPrefix(String locationCode) {
        return locationCode.trim().toUpperCase(Locale.ROOT) + ":";
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    static ThreadFactory namedDaemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
