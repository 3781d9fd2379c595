package com.warehousesentinel.job;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.FutureTask;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs independent units of work (one entity, report or monitor each) on a
 * bounded worker pool.
 *
 * <h3>Isolation</h3>
 * <p>
 * A failing unit is logged and recorded; it never stops the other units of
 * the stage. A unit still running {@code unitTimeout} after it started is
 * interrupted and recorded as {@link BatchSummary.Status#TIMED_OUT}.
 * </p>
 *
 * <p>
 * The runner owns its threads; {@link #close()} shuts them down.
 * </p>
 *
 * @since 1.0.0
 */
public final class BatchRunner implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(BatchRunner.class);

    /**
     * One unit of a stage.
     *
     * @param id     definition id, used in logs and the summary
     * @param action work to run; returns a short outcome for the summary
     */
    public record Unit(String id, Callable<String> action) {

        public Unit {
            Objects.requireNonNull(id, "Unit id must not be null");
            Objects.requireNonNull(action, "Unit action must not be null");
        }
    }

    private final ExecutorService workers;
    private final ScheduledExecutorService watchdog;
    private final Duration unitTimeout;

    public BatchRunner(int workerThreads, Duration unitTimeout) {
        if (workerThreads < 1) {
            throw new IllegalArgumentException("workerThreads must be >= 1, got: " + workerThreads);
        }
        this.unitTimeout = Objects.requireNonNull(unitTimeout, "Unit timeout must not be null");
        this.workers = Executors.newFixedThreadPool(workerThreads, namedThreads("sentinel-worker"));
        this.watchdog = Executors.newSingleThreadScheduledExecutor(namedThreads("sentinel-watchdog"));
    }

    /**
     * Run every unit and wait for all of them.
     *
     * @param stage stage name for logs and the summary
     * @param units units to run; may be empty
     * @return one result per unit, in submission order
     */
    public BatchSummary run(String stage, List<Unit> units) {
        Objects.requireNonNull(stage, "Stage must not be null");
        Objects.requireNonNull(units, "Units must not be null");
        LOG.info("Stage [{}]: running {} unit(s)", stage, units.size());
        long stageStart = System.nanoTime();

        List<FutureTask<String>> tasks = new ArrayList<>();
        for (Unit unit : units) {
            FutureTask<String> task = new FutureTask<>(unit.action());
            tasks.add(task);
            workers.execute(() -> runGuarded(task));
        }

        List<BatchSummary.UnitResult> results = new ArrayList<>();
        for (int i = 0; i < units.size(); i++) {
            results.add(await(stage, units.get(i), tasks.get(i), stageStart));
        }
        BatchSummary summary = new BatchSummary(stage, results);
        LOG.info("Stage [{}] finished: {}", stage, summary);
        return summary;
    }

    @Override
    public void close() {
        workers.shutdownNow();
        watchdog.shutdownNow();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                LOG.warn("Worker pool did not terminate within 5s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while shutting down the worker pool");
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private void runGuarded(FutureTask<String> task) {
        ScheduledFuture<?> timeout = watchdog.schedule(() -> task.cancel(true),
                unitTimeout.toMillis(), TimeUnit.MILLISECONDS);
        try {
            task.run();
        } finally {
            timeout.cancel(false);
        }
    }

    private static BatchSummary.UnitResult await(String stage, Unit unit, FutureTask<String> task, long stageStart) {
        try {
            String detail = task.get();
            LOG.info("Stage [{}] unit [{}] succeeded: {}", stage, unit.id(), detail);
            return new BatchSummary.UnitResult(unit.id(), BatchSummary.Status.SUCCEEDED, detail, since(stageStart));
        } catch (CancellationException e) {
            LOG.error("Stage [{}] unit [{}] timed out and was cancelled", stage, unit.id());
            return new BatchSummary.UnitResult(unit.id(), BatchSummary.Status.TIMED_OUT,
                    "timed out", since(stageStart));
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            LOG.error("Stage [{}] unit [{}] failed, continuing with the next unit", stage, unit.id(), cause);
            return new BatchSummary.UnitResult(unit.id(), BatchSummary.Status.FAILED,
                    String.valueOf(cause.getMessage()), since(stageStart));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            task.cancel(true);
            LOG.error("Interrupted while waiting for stage [{}] unit [{}]", stage, unit.id());
            return new BatchSummary.UnitResult(unit.id(), BatchSummary.Status.FAILED,
                    "interrupted", since(stageStart));
        }
    }

    private static Duration since(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
