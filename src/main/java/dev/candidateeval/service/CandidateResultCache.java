package dev.candidateeval.service;

import dev.candidateeval.model.PipelineStage;
import dev.candidateeval.model.RunStatus;
import dev.candidateeval.model.StageResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Store of stage results for the pipeline runs in flight, keyed by run id so that overlapping
 * runs of one candidate never share an entry. Each stage is written at most once per run, so a
 * retried write keeps the first result. A cancelled run accepts no further writes.
 * Entries live until {@link #evict(String)} is called for the run.
 */
@Slf4j
@Component
public class CandidateResultCache {

    private final ConcurrentHashMap<String, Entry> entries = new ConcurrentHashMap<>();

    private static final class Entry {
        private final String candidateId;
        private final ConcurrentHashMap<PipelineStage, StageResult<?>> stages = new ConcurrentHashMap<>();
        private final AtomicReference<RunStatus> status = new AtomicReference<>();

        private Entry(String candidateId) {
            this.candidateId = candidateId;
        }
    }

    public void begin(String runId, String candidateId) {
        entries.put(runId, new Entry(candidateId));
    }

    /**
     * Record a stage result.
     *
     * @return true if stored, false if the stage was already written or the run is finished
     */
    public boolean record(String runId, StageResult<?> result) {
        Entry entry = entries.get(runId);
        if (entry == null || entry.status.get() != null) {
            log.debug("Dropping {} result of run {}: no active run", result.stage(), runId);
            return false;
        }
        boolean stored = entry.stages.putIfAbsent(result.stage(), result) == null;
        if (!stored) {
            log.debug("{} already recorded for '{}' (run {}), keeping the first result",
                    result.stage(), entry.candidateId, runId);
        }
        return stored;
    }

    public Optional<StageResult<?>> get(String runId, PipelineStage stage) {
        Entry entry = entries.get(runId);
        return entry == null ? Optional.empty() : Optional.ofNullable(entry.stages.get(stage));
    }

    /**
     * Snapshot of the recorded stages, in pipeline order.
     */
    public Map<PipelineStage, StageResult<?>> stages(String runId) {
        Entry entry = entries.get(runId);
        if (entry == null) {
            return Map.of();
        }
        Map<PipelineStage, StageResult<?>> snapshot = new EnumMap<>(PipelineStage.class);
        snapshot.putAll(entry.stages);
        return Collections.unmodifiableMap(snapshot);
    }

    /**
     * Set the final status of the run. Only the first call wins.
     *
     * @return true if this call set the status
     */
    public boolean finish(String runId, RunStatus status) {
        Entry entry = entries.get(runId);
        return entry != null && entry.status.compareAndSet(null, status);
    }

    public boolean markCancelled(String runId) {
        Entry entry = entries.get(runId);
        if (entry == null || !entry.status.compareAndSet(null, RunStatus.CANCELLED)) {
            return false;
        }
        log.info("Run {} of candidate '{}' cancelled", runId, entry.candidateId);
        return true;
    }

    /**
     * Drop the entry of a run whose result has been assembled.
     */
    public void evict(String runId) {
        entries.remove(runId);
    }

    public int size() {
        return entries.size();
    }
}
