package cadence.util;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Bounded worker pool whose tasks are cancelled (with interrupt) once they have been
 * <em>running</em> longer than a fixed limit. Time spent waiting in the queue does not count.
 *
 * <p>A cancelled task's {@link Future#get()} throws
 * {@link java.util.concurrent.CancellationException}.
 *
 * <p>This class is thread-safe.
 */
public final class TimeLimitedExecutor implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(TimeLimitedExecutor.class.getName());

    private final ExecutorService workers;
    private final ScheduledExecutorService watchdog;
    private final long timeoutMs;
    private final String name;

    /**
     * @param name        thread name prefix, e.g. {@code "cadence-schedule-"}
     * @param workerCount number of worker threads, must be &gt; 0
     * @param timeout     maximum running time per task, must be positive
     */
    public TimeLimitedExecutor(String name, int workerCount, Duration timeout) {
        this.name = Objects.requireNonNull(name, "name");
        Objects.requireNonNull(timeout, "timeout");
        if (workerCount <= 0) {
            throw new IllegalArgumentException("workerCount must be > 0");
        }
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        this.timeoutMs = timeout.toMillis();
        this.workers = Executors.newFixedThreadPool(workerCount, new DaemonThreadFactory(name));
        this.watchdog = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory(name + "watchdog-"));
    }

    /**
     * Submits a task whose running time is bounded by the configured timeout.
     *
     * @throws RejectedExecutionException if the executor has been closed
     */
    public <T> Future<T> submit(Callable<T> callable) {
        return submit(callable, null);
    }

    /**
     * Like {@link #submit(Callable)}, additionally running {@code onTimeout} on the watchdog
     * thread when the task is cancelled for exceeding the limit.
     */
    public <T> Future<T> submit(Callable<T> callable, Runnable onTimeout) {
        FutureTask<T> task = new FutureTask<>(callable);
        workers.execute(() -> {
            if (task.isDone()) {
                return;
            }
            ScheduledFuture<?> timer = watchdog.schedule(() -> {
                if (task.cancel(true) && onTimeout != null) {
                    onTimeout.run();
                }
            }, timeoutMs, TimeUnit.MILLISECONDS);
            try {
                task.run();
            } finally {
                timer.cancel(false);
            }
        });
        return task;
    }

    public Future<?> submit(Runnable runnable) {
        return submit(Executors.callable(runnable));
    }

    public long timeoutMs() {
        return timeoutMs;
    }

    /**
     * Stops accepting tasks and waits up to {@code drainTimeoutMs} for running ones.
     */
    public void close(long drainTimeoutMs) {
        workers.shutdown();
        try {
            if (!workers.awaitTermination(drainTimeoutMs, TimeUnit.MILLISECONDS)) {
                logger.log(Level.WARNING, "Drain timeout exceeded for " + name + "; forcing shutdown");
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        } finally {
            watchdog.shutdownNow();
        }
    }

    @Override
    public void close() {
        close(5000);
    }
}
