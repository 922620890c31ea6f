package org.companyllm.rag.pipeline;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

import org.companyllm.rag.pipeline.ir.IngestionSummary;
import org.companyllm.rag.pipeline.ir.UpsertOutcome;

import lombok.extern.slf4j.Slf4j;

/**
 * Counter state of one pipeline execution. Shared by every source ingested in the
 * run, so all mutation goes through atomics. Never persisted.
 */
@Slf4j
public class IngestionRun {
    private final AtomicLong newCount = new AtomicLong();
    private final AtomicLong updated = new AtomicLong();
    private final AtomicLong skipped = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicBoolean stopRequested = new AtomicBoolean();
    private final Map<String, String> claimedHashes = new ConcurrentHashMap<>();

    public void record(UpsertOutcome outcome) {
        switch (outcome) {
            case NEW:
                newCount.incrementAndGet();
                break;
            case UPDATED:
                updated.incrementAndGet();
                break;
            case SKIPPED:
                skipped.incrementAndGet();
                break;
            case FAILED:
                failed.incrementAndGet();
                break;
            default:
                throw new IllegalArgumentException("Unexpected outcome " + outcome);
        }
    }

    /**
     * Ask the run to stop pulling new records. Work already handed to the embedding
     * provider is finished and written first.
     */
    public void requestStop() {
        if (stopRequested.compareAndSet(false, true)) {
            log.info("Stop requested, finishing in-flight chunks");
        }
    }

    public boolean isStopRequested() {
        return stopRequested.get();
    }

    /**
     * Claim {@code (chunkId, contentHash)} for this run.
     *
     * @return false when the same content was already claimed earlier in the run
     */
    public boolean claim(String chunkId, String contentHash) {
        var previous = claimedHashes.put(chunkId, contentHash);
        return !contentHash.equals(previous);
    }

    /** Forget a claim whose embedding failed so a later sighting can retry it. */
    public void release(String chunkId, String contentHash) {
        claimedHashes.remove(chunkId, contentHash);
    }

    public IngestionSummary summary() {
        return new IngestionSummary(newCount.get(), updated.get(), skipped.get(), failed.get());
    }
}
