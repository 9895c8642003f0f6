package com.syncbridge.api.executor;

import com.syncbridge.api.config.SyncBridgeProperties;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Claims due jobs and runs them on a bounded worker pool.
 *
 * Each tick first releases stale claims, then claims at most as many jobs as there are
 * free workers. On shutdown no new claims are made and in-flight jobs get a grace period.
 */
@Service
public class SyncExecutor {

    private static final Logger log = LoggerFactory.getLogger(SyncExecutor.class);

    private final SyncBridgeProperties.Executor settings;
    private final SyncJobQueue jobQueue;
    private final JobRunner jobRunner;
    private final Clock clock;
    private final ThreadPoolExecutor workers;
    private final AtomicInteger inFlight = new AtomicInteger();
    private volatile boolean accepting = true;

    public SyncExecutor(SyncBridgeProperties properties, SyncJobQueue jobQueue, JobRunner jobRunner, Clock clock) {
        this.settings = properties.getExecutor();
        this.jobQueue = jobQueue;
        this.jobRunner = jobRunner;
        this.clock = clock;
        int concurrency = Math.max(1, settings.getConcurrency());
        AtomicInteger counter = new AtomicInteger();
        this.workers = new ThreadPoolExecutor(concurrency, concurrency, 60, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(), runnable -> {
                    Thread thread = new Thread(runnable, "sync-worker-" + counter.incrementAndGet());
                    thread.setDaemon(true);
                    return thread;
                });
    }

    @Scheduled(fixedDelayString = "${syncbridge.executor.tick-interval:5s}")
    public void scheduledTick() {
        if (!settings.isEnabled()) {
            return;
        }
        tick();
    }

    /**
     * Sweeps stale claims and hands newly claimed jobs to the worker pool.
     *
     * @return number of jobs claimed
     */
    public int tick() {
        if (!accepting) {
            return 0;
        }
        releaseStaleClaims();
        int free = workers.getMaximumPoolSize() - inFlight.get();
        int capacity = Math.min(settings.getClaimBatch(), free);
        if (capacity <= 0) {
            log.debug("Executor tick: all {} workers busy", workers.getMaximumPoolSize());
            return 0;
        }
        List<ClaimedJob> claimed = jobQueue.claim(capacity);
        for (ClaimedJob job : claimed) {
            inFlight.incrementAndGet();
            workers.execute(() -> {
                try {
                    jobRunner.run(job);
                } catch (RuntimeException e) {
                    log.error("Job {} crashed; it stays RUNNING until the stale sweep", job.id(), e);
                } finally {
                    inFlight.decrementAndGet();
                }
            });
        }
        if (!claimed.isEmpty()) {
            log.info("Executor tick: claimed {} jobs ({} in flight)", claimed.size(), inFlight.get());
        }
        return claimed.size();
    }

    /**
     * Claims one batch and runs it on the calling thread.
     */
    public List<JobOutcome> runOnce() {
        releaseStaleClaims();
        List<JobOutcome> outcomes = new ArrayList<>();
        for (ClaimedJob job : jobQueue.claim(settings.getClaimBatch())) {
            outcomes.add(jobRunner.run(job));
        }
        return outcomes;
    }

    public int releaseStaleClaims() {
        Instant threshold = clock.instant().minus(settings.getStaleAfter());
        int released = jobQueue.releaseStale(threshold);
        if (released > 0) {
            log.warn("Released {} jobs stuck in RUNNING since before {}", released, threshold);
        }
        return released;
    }

    public int inFlight() {
        return inFlight.get();
    }

    @PreDestroy
    public void shutdown() {
        accepting = false;
        workers.shutdown();
        try {
            if (!workers.awaitTermination(settings.getShutdownGrace().toMillis(), TimeUnit.MILLISECONDS)) {
                List<Runnable> dropped = workers.shutdownNow();
                log.warn("Executor grace period expired with {} jobs in flight, {} not started",
                        inFlight.get(), dropped.size());
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
