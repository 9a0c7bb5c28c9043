package com.tomeqa.index.lifecycle;

import com.fasterxml.jackson.core.type.TypeReference;
import com.tomeqa.index.chunk.ChunkingStrategy;
import com.tomeqa.index.chunk.RecursiveTextSplitter;
import com.tomeqa.index.config.IndexContext;
import com.tomeqa.index.exception.IndexServiceException;
import com.tomeqa.index.exception.IndexWriteException;
import com.tomeqa.index.exception.MalformedDocumentException;
import com.tomeqa.index.exception.RebuildCancelledException;
import com.tomeqa.index.exception.RebuildInProgressException;
import com.tomeqa.index.exception.RollbackCleanupException;
import com.tomeqa.index.exception.StagingValidationException;
import com.tomeqa.index.exception.SwapAtomicityUnknownException;
import com.tomeqa.index.exception.TransientStoreException;
import com.tomeqa.index.ingest.CacheBehavior;
import com.tomeqa.index.ingest.DocumentIngestor;
import com.tomeqa.index.ingest.IngestionSource;
import com.tomeqa.index.ingest.ProcessingHistoryStore;
import com.tomeqa.index.json.Json;
import com.tomeqa.index.metrics.IndexMetrics;
import com.tomeqa.index.model.SourceDocument;
import com.tomeqa.index.search.HybridIndex;
import com.tomeqa.index.search.LiveIndexRegistry;
import com.tomeqa.index.status.StatusSink;
import com.tomeqa.index.store.AliasOperation;
import com.tomeqa.index.store.CollectionNames;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.regex.Pattern;

/**
 * Rebuilds base collections out of place and cuts the live aliases over in one atomic batch.
 * <p>
 * A run stages a fresh collection {@code {base}_temp_{runId}} per target, ingests every source
 * document into it and validates the point counts. The alias batch then deletes the current
 * {@code {base}_live} aliases and recreates them on the staged collections:
 * <ul>
 *   <li>success: the run commits, the staged indexes go live and the old collections are deleted;</li>
 *   <li>timeout: the outcome is unknown, nothing is deleted and the bases stay blocked
 *       until {@link #clearReconciliation(String)};</li>
 *   <li>rejection: when the aliases still point at the old collections the staged ones are
 *       dropped, otherwise the run is escalated as for a timeout.</li>
 * </ul>
 * Any failure before the batch, cancellation included, deletes the staged collections and leaves
 * the live aliases untouched. Each base has at most one active run.
 */
@Slf4j
public class IndexLifecycleManager {

    public static final String RECONCILIATION_KEY = "lifecycle/reconciliation.json";

    private static final Pattern BASE_NAME = Pattern.compile("[A-Za-z0-9][A-Za-z0-9_-]*");
    private static final TypeReference<List<ReconciliationEntry>> RECONCILIATION_TYPE = new TypeReference<>() {};

    private final IndexContext context;
    private final IngestionSource source;
    private final LiveIndexRegistry registry;
    private final StatusSink status;
    private final IndexMetrics metrics;
    private final Executor rebuildExecutor;
    private final Executor embedExecutor;
    private final LifecycleSettings settings;

    private final Object lock = new Object();
    private final Map<String, RebuildRun> activeByBase = new HashMap<>();
    private final Map<String, ReconciliationEntry> reconciliation = new LinkedHashMap<>();
    private final Map<String, RebuildRun> runs = new LinkedHashMap<>();

    public IndexLifecycleManager(IndexContext context,
                                 IngestionSource source,
                                 LiveIndexRegistry registry,
                                 StatusSink status,
                                 IndexMetrics metrics,
                                 Executor rebuildExecutor,
                                 Executor embedExecutor,
                                 LifecycleSettings settings) {
        this.context = context;
        this.source = source;
        this.registry = registry;
        this.status = status;
        this.metrics = metrics;
        this.rebuildExecutor = rebuildExecutor;
        this.embedExecutor = embedExecutor;
        this.settings = settings;
    }

    /**
     * Runs a rebuild on the calling thread.
     *
     * @throws RebuildInProgressException when a target is being rebuilt or awaits reconciliation
     */
    public RunResult rebuild(List<String> targets, CacheBehavior cacheBehavior) {
        RebuildRun run = reserve(targets, cacheBehavior);
        return execute(run);
    }

    /**
     * Reserves the targets and runs the rebuild on the rebuild executor.
     *
     * @throws RebuildInProgressException when a target is being rebuilt or awaits reconciliation
     */
    public RebuildRun startRebuild(List<String> targets, CacheBehavior cacheBehavior) {
        RebuildRun run = reserve(targets, cacheBehavior);
        try {
            rebuildExecutor.execute(() -> execute(run));
        } catch (RejectedExecutionException e) {
            run.setError("Rebuild executor rejected the run");
            run.setStatus(RunStatus.ROLLED_BACK);
            release(run);
            throw e;
        }
        return run;
    }

    public Optional<RebuildRun> getRun(String runId) {
        synchronized (lock) {
            return Optional.ofNullable(runs.get(runId));
        }
    }

    /**
     * Requests cancellation of a staging run. The run stops at the next document boundary and rolls back.
     *
     * @return false when the run is unknown or already past staging
     */
    public boolean cancel(String runId) {
        RebuildRun run = getRun(runId).orElse(null);
        if (run == null || !run.requestCancel()) {
            return false;
        }
        log.info("[REBUILD] Cancellation requested for run {}", runId);
        return true;
    }

    public Map<String, ReconciliationEntry> basesAwaitingReconciliation() {
        synchronized (lock) {
            return Map.copyOf(reconciliation);
        }
    }

    /**
     * Operator action after checking the aliases of {@code base} by hand.
     *
     * @return false when the base was not blocked
     */
    public boolean clearReconciliation(String base) {
        ReconciliationEntry removed;
        synchronized (lock) {
            removed = reconciliation.remove(base);
            if (removed != null) {
                persistReconciliation();
            }
        }
        if (removed == null) {
            return false;
        }
        log.warn("[REBUILD] Reconciliation of {} cleared (blocked by run {})", base, removed.runId());
        status.emit("reconciliation_cleared", Map.of("base", base, "runId", removed.runId()));
        return true;
    }

    /**
     * Reloads the blocked bases persisted by an earlier process. Unreadable state is logged and ignored.
     */
    public void loadReconciliationState() {
        try {
            Optional<byte[]> content = context.blobStore().get(RECONCILIATION_KEY);
            if (content.isEmpty()) {
                return;
            }
            List<ReconciliationEntry> entries = Json.MAPPER.readValue(content.get(), RECONCILIATION_TYPE);
            synchronized (lock) {
                reconciliation.clear();
                entries.forEach(e -> reconciliation.put(e.base(), e));
            }
            if (!entries.isEmpty()) {
                log.warn("[REBUILD] {} bases await manual reconciliation: {}", entries.size(),
                        entries.stream().map(ReconciliationEntry::base).toList());
            }
        } catch (IOException | RuntimeException e) {
            log.error("[REBUILD] Could not load reconciliation state: {}", e.getMessage(), e);
        }
    }

    private RebuildRun reserve(List<String> targets, CacheBehavior cacheBehavior) {
        if (targets == null || targets.isEmpty()) {
            throw new IllegalArgumentException("At least one target collection is required");
        }
        List<String> distinct = new ArrayList<>(new LinkedHashSet<>(targets));
        for (String base : distinct) {
            if (base == null || !BASE_NAME.matcher(base).matches()) {
                throw new IllegalArgumentException("Invalid collection name: " + base);
            }
        }

        synchronized (lock) {
            Set<String> conflicts = new LinkedHashSet<>();
            for (String base : distinct) {
                if (activeByBase.containsKey(base) || reconciliation.containsKey(base)) {
                    conflicts.add(base);
                }
            }
            if (!conflicts.isEmpty()) {
                throw new RebuildInProgressException("Rebuild already running or awaiting reconciliation for "
                        + conflicts, conflicts);
            }
            RebuildRun run = new RebuildRun(newRunId(), distinct,
                    cacheBehavior == null ? CacheBehavior.USE : cacheBehavior);
            distinct.forEach(base -> activeByBase.put(base, run));
            runs.put(run.getRunId(), run);
            return run;
        }
    }

    private void release(RebuildRun run) {
        synchronized (lock) {
            run.getTargets().forEach(base -> activeByBase.remove(base, run));
            evictFinishedRuns();
        }
    }

    /**
     * Drops the oldest finished runs beyond the retained number. Caller holds {@code lock}.
     */
    private void evictFinishedRuns() {
        long finished = runs.values().stream().filter(r -> r.getStatus().isTerminal()).count();
        Iterator<RebuildRun> it = runs.values().iterator();
        while (finished > settings.retainedRuns() && it.hasNext()) {
            if (it.next().getStatus().isTerminal()) {
                it.remove();
                finished--;
            }
        }
    }

    RunResult execute(RebuildRun run) {
        long startTime = System.currentTimeMillis();
        try {
            Staged staged;
            try {
                staged = stage(run);
            } catch (RuntimeException e) {
                rollback(run, e);
                return run.toResult();
            }
            swap(run, staged);
            return run.toResult();
        } finally {
            release(run);
            metrics.recordRebuild(run.getStatus().name(), System.currentTimeMillis() - startTime);
            log.info("[REBUILD] Run {} finished as {} in {}ms", run.getRunId(), run.getStatus(),
                    System.currentTimeMillis() - startTime);
        }
    }

    /**
     * Staged indexes plus the collections the live aliases pointed at before the swap.
     */
    private record Staged(Map<String, HybridIndex> indexes, Map<String, Optional<String>> previous,
                          ProcessingHistoryStore history) {}

    private Staged stage(RebuildRun run) {
        run.setStatus(RunStatus.STAGING);
        status.emit("rebuild_started", Map.of(
                "runId", run.getRunId(),
                "targets", run.getTargets(),
                "cacheBehavior", run.getCacheBehavior().name()));

        ProcessingHistoryStore history = new ProcessingHistoryStore(context.blobStore());
        if (run.getCacheBehavior() == CacheBehavior.RESET) {
            history.clear();
        } else {
            history.load();
        }

        Map<String, HybridIndex> indexes = new LinkedHashMap<>();
        for (String base : run.getTargets()) {
            checkCancelled(run);
            String temp = CollectionNames.stagedCollection(base, run.getRunId());
            run.addStagedCollection(base, temp);
            context.indexService().createCollection(temp, context.vectorSize());
            indexes.put(base, new HybridIndex(context, temp));
        }

        Map<String, ChunkingStrategy> strategies = new HashMap<>();
        run.getTargets().forEach(base -> strategies.put(base, settings.strategyFor(base)));
        DocumentIngestor ingestor = new DocumentIngestor(context, embedExecutor, settings.embedBatchSize(),
                new RecursiveTextSplitter(settings.chunkSize(), settings.chunkOverlap()));
        boolean useHistory = run.getCacheBehavior() == CacheBehavior.USE;

        List<String> documentIds = source.listDocumentIds();
        run.setDocumentsTotal(documentIds.size());
        log.info("[REBUILD] Run {} staging {} documents into {}", run.getRunId(), documentIds.size(),
                run.getStagedCollections().values());

        for (String documentId : documentIds) {
            checkCancelled(run);
            try {
                SourceDocument document = source.load(documentId);
                DocumentIngestor.Result result = ingestor.ingest(document, indexes, strategies,
                        history.get(document.documentId()), useHistory);
                run.recordDocument(result.pointsByBase(), result.unchanged());
                history.record(document.documentId(), document.contentHash(), result.pageImageUrls());
                metrics.recordDocumentIngested(result.totalPoints());
                status.emit("rebuild_progress", Map.of(
                        "runId", run.getRunId(),
                        "documentId", documentId,
                        "processed", run.getDocumentsProcessed(),
                        "total", documentIds.size()));
            } catch (MalformedDocumentException e) {
                run.recordSkipped(documentId);
                metrics.recordDocumentSkipped();
                log.warn("[REBUILD] Skipping malformed document {}: {}", documentId, e.getMessage());
                status.emit("document_skipped", Map.of(
                        "runId", run.getRunId(),
                        "documentId", documentId,
                        "reason", String.valueOf(e.getMessage())));
            }
        }

        checkCancelled(run);
        validate(run);

        Map<String, Optional<String>> previous = new LinkedHashMap<>();
        for (String base : run.getTargets()) {
            previous.put(base, context.indexService().resolveAlias(CollectionNames.liveAlias(base)));
        }
        if (!run.beginSwap()) {
            throw new RebuildCancelledException(run.getRunId());
        }
        status.emit("staging_complete", Map.of("runId", run.getRunId(), "points", run.toResult().pointsByBase()));
        return new Staged(indexes, previous, history);
    }

    private void validate(RebuildRun run) {
        for (Map.Entry<String, String> staged : run.getStagedCollections().entrySet()) {
            long stored = context.indexService().count(staged.getValue());
            int committed = run.committedPoints(staged.getKey());
            if (stored != committed) {
                throw new StagingValidationException("Staged collection " + staged.getValue() + " holds "
                        + stored + " points, run committed " + committed);
            }
            if (stored == 0 && !settings.allowEmpty()) {
                throw new StagingValidationException("Staged collection " + staged.getValue() + " is empty");
            }
        }
    }

    private void swap(RebuildRun run, Staged staged) {
        Map<String, String> temps = run.getStagedCollections();

        List<AliasOperation> operations = new ArrayList<>();
        staged.previous().forEach((base, old) ->
                old.ifPresent(o -> operations.add(AliasOperation.delete(CollectionNames.liveAlias(base)))));
        temps.forEach((base, temp) -> operations.add(AliasOperation.create(CollectionNames.liveAlias(base), temp)));
        status.emit("swap_started", Map.of("runId", run.getRunId(), "aliases", temps));

        try {
            context.indexService().updateAliases(operations);
        } catch (TransientStoreException e) {
            if (e.isTimeout()) {
                escalate(run, "Alias batch timed out; outcome unknown", e);
                return;
            }
            handleRejectedSwap(run, staged, e);
            return;
        } catch (RuntimeException e) {
            handleRejectedSwap(run, staged, e);
            return;
        }

        commit(run, staged);
    }

    private void handleRejectedSwap(RebuildRun run, Staged staged, RuntimeException cause) {
        log.warn("[REBUILD] Alias batch of run {} rejected: {}", run.getRunId(), cause.getMessage());
        Map<String, Optional<String>> now = new LinkedHashMap<>();
        try {
            for (String base : run.getTargets()) {
                now.put(base, context.indexService().resolveAlias(CollectionNames.liveAlias(base)));
            }
        } catch (RuntimeException verifyFailure) {
            cause.addSuppressed(verifyFailure);
            escalate(run, "Alias batch rejected and aliases could not be verified", cause);
            return;
        }

        if (now.equals(staged.previous())) {
            rollback(run, cause);
        } else {
            escalate(run, "Alias batch rejected but aliases changed: expected " + staged.previous() + ", found " + now,
                    cause);
        }
    }

    private void commit(RebuildRun run, Staged staged) {
        run.setStatus(RunStatus.COMMITTED);
        staged.indexes().forEach(registry::publish);

        Map<String, String> temps = run.getStagedCollections();
        staged.previous().forEach((base, old) -> old
                .filter(o -> !Objects.equals(o, temps.get(base)))
                .ifPresent(o -> deleteOldGeneration(base, o)));

        staged.history().save();
        log.info("[REBUILD] Run {} committed: {}", run.getRunId(), temps);
        status.emit("rebuild_committed", Map.of(
                "runId", run.getRunId(),
                "collections", temps,
                "points", run.toResult().pointsByBase(),
                "skipped", run.toResult().documentsSkipped()));
    }

    private void deleteOldGeneration(String base, String collection) {
        try {
            context.indexService().deleteCollection(collection);
            log.info("[REBUILD] Deleted previous generation {} of {}", collection, base);
        } catch (RuntimeException e) {
            log.warn("[REBUILD] Could not delete previous generation {} of {}: {}", collection, base, e.getMessage());
        }
    }

    private void rollback(RebuildRun run, RuntimeException cause) {
        String reason = describe(cause);
        if (cause instanceof RebuildCancelledException) {
            log.info("[REBUILD] Run {} cancelled, rolling back", run.getRunId());
        } else if (cause instanceof IndexWriteException w) {
            log.error("[REBUILD] Run {} failed after {} committed points in the failing upsert, rolling back",
                    run.getRunId(), w.getCommittedCount(), cause);
        } else {
            log.error("[REBUILD] Run {} failed, rolling back: {}", run.getRunId(), reason, cause);
        }

        for (String temp : run.getStagedCollections().values()) {
            try {
                context.indexService().deleteCollection(temp);
            } catch (IndexServiceException e) {
                if (e.getStatusCode() == 404) {
                    log.debug("[REBUILD] Staged collection {} was never created", temp);
                } else {
                    log.error("[REBUILD] {}", new RollbackCleanupException(temp, e).getMessage(), e);
                }
            } catch (RuntimeException e) {
                log.error("[REBUILD] {}", new RollbackCleanupException(temp, e).getMessage(), e);
            }
        }

        run.setError(reason);
        run.setStatus(RunStatus.ROLLED_BACK);
        status.emit("rebuild_failed", Map.of(
                "runId", run.getRunId(),
                "reason", reason,
                "cancelled", cause instanceof RebuildCancelledException));
    }

    private void escalate(RebuildRun run, String message, RuntimeException cause) {
        SwapAtomicityUnknownException escalation = new SwapAtomicityUnknownException(
                "Run " + run.getRunId() + ": " + message, cause);
        log.error("[REBUILD] {}. Bases {} blocked until reconciled; staged collections kept: {}",
                escalation.getMessage(), run.getTargets(), run.getStagedCollections().values(), escalation);

        String since = Instant.now().toString();
        synchronized (lock) {
            run.getTargets().forEach(base ->
                    reconciliation.put(base, new ReconciliationEntry(base, run.getRunId(), message, since)));
            persistReconciliation();
        }

        run.setError(escalation.getMessage());
        run.setStatus(RunStatus.NEEDS_RECONCILIATION);
        status.emit("rebuild_needs_reconciliation", Map.of(
                "runId", run.getRunId(),
                "bases", run.getTargets(),
                "stagedCollections", run.getStagedCollections(),
                "reason", message));
    }

    private void persistReconciliation() {
        try {
            context.blobStore().put(RECONCILIATION_KEY,
                    Json.MAPPER.writeValueAsBytes(new ArrayList<>(reconciliation.values())));
        } catch (IOException | RuntimeException e) {
            log.error("[REBUILD] Could not persist reconciliation state: {}", e.getMessage(), e);
        }
    }

    private static void checkCancelled(RebuildRun run) {
        if (run.isCancelRequested()) {
            throw new RebuildCancelledException(run.getRunId());
        }
    }

    private static String describe(Throwable e) {
        return e.getClass().getSimpleName() + ": " + e.getMessage();
    }

    static String newRunId() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, 12);
    }
}
