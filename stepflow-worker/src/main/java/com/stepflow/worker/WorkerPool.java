package com.stepflow.worker;

import com.stepflow.core.model.Execution;
import com.stepflow.core.repository.ExecutionStore;
import com.stepflow.engine.config.StepflowProperties;
import com.stepflow.engine.execution.ExecutionEngine;
import com.stepflow.engine.logging.LoggingContext;
import com.stepflow.engine.metrics.ExecutionMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed set of worker loops that claim eligible executions and step them.
 *
 * Workers hold no state besides their id: everything an execution needs is
 * in the store, so a crashed worker's executions are picked up by any other
 * worker once its leases expire.
 *
 * Usage:
 * <pre>
 * WorkerPool pool = new WorkerPool(store, engine, metrics, properties);
 * pool.start();
 * ...
 * pool.stop();
 * </pre>
 */
public class WorkerPool {

    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);

    private final String poolId;
    private final ExecutionStore store;
    private final ExecutionEngine engine;
    private final ExecutionMetrics metrics;
    private final int size;
    private final Duration leaseDuration;
    private final Duration pollInterval;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicInteger activeWorkers = new AtomicInteger();
    private ExecutorService executorService;

    public WorkerPool(ExecutionStore store, ExecutionEngine engine, ExecutionMetrics metrics,
                      StepflowProperties properties) {
        this(UUID.randomUUID().toString().substring(0, 8), store, engine, metrics, properties);
    }

    public WorkerPool(String poolId, ExecutionStore store, ExecutionEngine engine, ExecutionMetrics metrics,
                      StepflowProperties properties) {
        this.poolId = poolId;
        this.store = store;
        this.engine = engine;
        this.metrics = metrics;
        this.size = properties.workerPoolSize();
        this.leaseDuration = properties.leaseDuration();
        this.pollInterval = properties.workerPollInterval();
    }

    public String workerId(int index) {
        return poolId + "-" + index;
    }

    /**
     * Start the worker loops.
     */
    public synchronized void start() {
        if (running.compareAndSet(false, true)) {
            log.info("Starting worker pool {} with {} workers", poolId, size);
            AtomicInteger threads = new AtomicInteger();
            executorService = Executors.newFixedThreadPool(size,
                r -> new Thread(r, "stepflow-worker-" + poolId + "-" + threads.getAndIncrement()));
            for (int i = 0; i < size; i++) {
                String workerId = workerId(i);
                executorService.submit(() -> workLoop(workerId));
            }
        }
    }

    /**
     * Stop the loops and wait for in-flight ticks to finish.
     * Executions still leased when a worker is interrupted are recovered after lease expiry.
     */
    public synchronized void stop() {
        if (running.compareAndSet(true, false)) {
            log.info("Stopping worker pool {}", poolId);
            executorService.shutdown();
            try {
                if (!executorService.awaitTermination(30, TimeUnit.SECONDS)) {
                    executorService.shutdownNow();
                }
            } catch (InterruptedException e) {
                executorService.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    public int activeWorkers() {
        return activeWorkers.get();
    }

    /**
     * Claim one eligible execution and run it for one time budget.
     *
     * @return the execution as left by the engine, or empty if nothing was eligible
     */
    public Optional<Execution> pollOnce(String workerId) {
        Optional<Execution> claimed = store.claim(workerId, leaseDuration);
        if (claimed.isEmpty()) {
            return Optional.empty();
        }
        metrics.executionClaimed();
        log.debug("Worker {} claimed execution {}", workerId, claimed.get().executionId());
        return Optional.of(engine.run(claimed.get(), workerId));
    }

    private void workLoop(String workerId) {
        activeWorkers.incrementAndGet();
        try (LoggingContext ctx = LoggingContext.forWorker(workerId)) {
            while (running.get() && !Thread.currentThread().isInterrupted()) {
                try {
                    if (pollOnce(workerId).isEmpty()) {
                        Thread.sleep(pollInterval.toMillis());
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } catch (Exception e) {
                    log.error("Worker {} failed, backing off", workerId, e);
                    try {
                        Thread.sleep(pollInterval.toMillis() * 2);
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                    }
                }
            }
        } finally {
            activeWorkers.decrementAndGet();
        }
    }
}
