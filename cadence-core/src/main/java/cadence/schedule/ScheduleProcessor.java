package cadence.schedule;

import cadence.model.GeneratedEvent;
import cadence.model.RecurringDefinition;
import cadence.model.ScheduleAdvance;
import cadence.recurrence.RecurrenceCalculator;
import cadence.spi.DefinitionStore;
import cadence.spi.MetricsExporter;
import cadence.util.DaemonThreadFactory;
import cadence.util.TimeLimitedExecutor;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Turns due recurring definitions into generated events.
 *
 * <p>Each {@link #tick(Instant)} pages through the definitions due at {@code now}, keyed by
 * ({@code nextDueAt}, {@code id}) so definitions left due by a failure do not hide the
 * ones behind them. For every
 * definition it claims the current due date through
 * {@link DefinitionStore#tryClaim}, which advances the schedule and records the event in one
 * atomic step, and repeats while the definition is still due (catch-up after missed ticks).
 * A lost claim is a skip, not an error. A definition that fails or runs past the
 * per-definition timeout is reported in {@link TickReport#failed()}, stays due, and is
 * retried on the next tick; other definitions are unaffected.
 *
 * <p>The next due date is computed from the due date just generated, never from the tick
 * time, so late ticks neither drift nor skip occurrences.
 *
 * <p>{@link #start()} runs ticks at a fixed delay on a daemon thread. With
 * {@code workerCount(0)} definitions are processed inline on the ticking thread and the
 * timeout is not enforced.
 *
 * <p>Create instances via {@link #builder()}. This class is thread-safe; overlapping ticks
 * are safe and never generate an occurrence twice.
 *
 * @see ScheduleProcessor.Builder
 */
public final class ScheduleProcessor implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(ScheduleProcessor.class.getName());

    private final DefinitionStore definitionStore;
    private final RecurrenceCalculator calculator;
    private final Clock clock;
    private final int batchSize;
    private final Duration tickInterval;
    private final Duration initialDelay;
    private final MetricsExporter metrics;
    private final InFlightTracker inFlightTracker;
    private final Supplier<String> idGenerator;
    private final List<GeneratedEventListener> listeners;
    private final List<TickListener> tickListeners;
    private final TimeLimitedExecutor workers;
    private final ExecutorService listenerExecutor;
    private final long drainTimeoutMs;

    private ScheduledExecutorService scheduler;
    private volatile ScheduledFuture<?> tickTask;
    private volatile boolean closed;

    private ScheduleProcessor(Builder builder) {
        this.definitionStore = Objects.requireNonNull(builder.definitionStore, "definitionStore");
        this.calculator = builder.calculator != null ? builder.calculator : RecurrenceCalculator.UTC;
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        Objects.requireNonNull(builder.inFlightLease, "inFlightLease");
        this.inFlightTracker = builder.inFlightTracker != null
                ? builder.inFlightTracker : new DefaultInFlightTracker(builder.inFlightLease, clock);
        this.idGenerator = builder.idGenerator != null
                ? builder.idGenerator : () -> UUID.randomUUID().toString();
        this.listeners = Collections.unmodifiableList(new ArrayList<>(builder.listeners));
        this.tickListeners = Collections.unmodifiableList(new ArrayList<>(builder.tickListeners));
        this.drainTimeoutMs = builder.drainTimeoutMs;

        Objects.requireNonNull(builder.tickInterval, "tickInterval");
        Objects.requireNonNull(builder.initialDelay, "initialDelay");
        Objects.requireNonNull(builder.definitionTimeout, "definitionTimeout");
        if (builder.batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be > 0");
        }
        if (builder.tickInterval.isNegative() || builder.tickInterval.isZero()) {
            throw new IllegalArgumentException("tickInterval must be positive");
        }
        if (builder.initialDelay.isNegative()) {
            throw new IllegalArgumentException("initialDelay must be >= 0");
        }
        if (builder.definitionTimeout.isNegative() || builder.definitionTimeout.isZero()) {
            throw new IllegalArgumentException("definitionTimeout must be positive");
        }
        if (builder.workerCount < 0) {
            throw new IllegalArgumentException("workerCount must be >= 0");
        }
        if (builder.listenerWorkerCount < 0) {
            throw new IllegalArgumentException("listenerWorkerCount must be >= 0");
        }
        this.batchSize = builder.batchSize;
        this.tickInterval = builder.tickInterval;
        this.initialDelay = builder.initialDelay;

        this.workers = builder.workerCount > 0
                ? new TimeLimitedExecutor("cadence-schedule-", builder.workerCount, builder.definitionTimeout)
                : null;
        this.listenerExecutor = builder.listenerWorkerCount > 0
                ? Executors.newFixedThreadPool(builder.listenerWorkerCount,
                        new DaemonThreadFactory("cadence-schedule-listener-"))
                : null;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Starts ticking every {@code tickInterval}. Subsequent calls are no-ops if already started.
     */
    public synchronized void start() {
        if (closed) {
            throw new IllegalStateException("ScheduleProcessor has been closed");
        }
        if (tickTask != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("cadence-scheduler-"));
        tickTask = scheduler.scheduleWithFixedDelay(this::runScheduledTick,
                initialDelay.toMillis(), tickInterval.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Runs one tick at the clock's current instant. Errors are logged; the schedule keeps running.
     */
    public void runScheduledTick() {
        if (closed) {
            return;
        }
        try {
            tick(clock.instant());
        } catch (SchedulerFatalException e) {
            logger.log(Level.SEVERE, "Tick aborted: " + e.getMessage(), e.getCause());
        } catch (Throwable t) {
            logger.log(Level.SEVERE, "Tick failed", t);
        }
    }

    /**
     * Generates every occurrence due at {@code now}.
     *
     * @return counts of generated and skipped occurrences plus the ids of failed definitions
     * @throws SchedulerFatalException if due definitions cannot be listed
     */
    public TickReport tick(Instant now) {
        Objects.requireNonNull(now, "now");
        if (closed) {
            return TickReport.EMPTY;
        }
        long startNanos = System.nanoTime();
        metrics.incrementTicks();
        Tally tally = new Tally();
        Set<String> seen = new HashSet<>();
        Instant afterDue = null;
        String afterId = null;
        while (true) {
            List<RecurringDefinition> page;
            try {
                page = definitionStore.listDue(now, afterDue, afterId, batchSize);
            } catch (RuntimeException e) {
                metrics.incrementTickFatal();
                throw new SchedulerFatalException("Failed to list due definitions at " + now, e);
            }
            if (page.isEmpty()) {
                break;
            }
            List<RecurringDefinition> fresh = new ArrayList<>(page.size());
            for (RecurringDefinition definition : page) {
                if (seen.add(definition.id())) {
                    fresh.add(definition);
                }
            }
            processPage(fresh, now, tally);
            // failed definitions keep their position; the cursor moves past them
            RecurringDefinition last = page.get(page.size() - 1);
            afterDue = last.nextDueAt();
            afterId = last.id();
            if (page.size() < batchSize) {
                break;
            }
        }

        TickReport report = tally.toReport();
        long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
        metrics.recordTickDurationMs(durationMs);
        if (report.generated() > 0 || report.hasFailures()) {
            logger.log(Level.INFO, "Tick at " + now + ": generated=" + report.generated()
                    + ", skipped=" + report.skipped() + ", failed=" + report.failed().size()
                    + " in " + durationMs + " ms");
        }
        for (TickListener listener : tickListeners) {
            try {
                listener.onTick(now, report);
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, "Tick listener failed", e);
            }
        }
        return report;
    }

    private void processPage(List<RecurringDefinition> page, Instant now, Tally tally) {
        if (workers == null) {
            for (RecurringDefinition definition : page) {
                try {
                    process(definition, now, tally);
                } catch (RuntimeException e) {
                    recordFailure(definition.id(), e, tally);
                }
            }
            return;
        }
        List<Future<?>> futures = new ArrayList<>(page.size());
        for (RecurringDefinition definition : page) {
            try {
                futures.add(workers.submit(() -> process(definition, now, tally)));
            } catch (RejectedExecutionException e) {
                futures.add(null);
                recordFailure(definition.id(), e, tally);
            }
        }
        for (int i = 0; i < page.size(); i++) {
            Future<?> future = futures.get(i);
            if (future == null) {
                continue;
            }
            String definitionId = page.get(i).id();
            try {
                future.get();
            } catch (CancellationException e) {
                tally.failed.add(definitionId);
                metrics.incrementDefinitionsFailed();
                logger.log(Level.WARNING, "Definition " + definitionId + " exceeded "
                        + workers.timeoutMs() + " ms; retrying next tick");
            } catch (ExecutionException e) {
                recordFailure(definitionId, e.getCause(), tally);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                future.cancel(true);
                tally.failed.add(definitionId);
            }
        }
    }

    private void process(RecurringDefinition definition, Instant now, Tally tally) {
        String definitionId = definition.id();
        if (!inFlightTracker.tryAcquire(definitionId)) {
            tally.skipped.incrementAndGet();
            metrics.incrementClaimsSkipped();
            logger.log(Level.FINE, "Definition " + definitionId + " already in flight; skipping");
            return;
        }
        try {
            int anchorDay = calculator.anchorDayOf(definition.startDate());
            RecurringDefinition current = definition;
            while (current.isDueAt(now)) {
                if (Thread.currentThread().isInterrupted()) {
                    return;
                }
                Instant due = current.nextDueAt();
                Instant next = calculator.next(due, current.interval(), anchorDay);
                boolean active = current.endDate() == null || !next.isAfter(current.endDate());
                ScheduleAdvance advance = new ScheduleAdvance(due, next, active);
                GeneratedEvent event = GeneratedEvent.occurrenceOf(current, idGenerator.get(), due,
                        clock.instant());
                if (!definitionStore.tryClaim(definitionId, due, advance, event)) {
                    tally.skipped.incrementAndGet();
                    metrics.incrementClaimsSkipped();
                    logger.log(Level.FINE, "Lost claim on " + definitionId + " due " + due);
                    return;
                }
                tally.generated.incrementAndGet();
                metrics.incrementEventsGenerated();
                current = current.advancedBy(advance, event.createdAt());
                announce(current, event);
            }
        } finally {
            inFlightTracker.release(definitionId);
        }
    }

    private void announce(RecurringDefinition definition, GeneratedEvent event) {
        if (listeners.isEmpty()) {
            return;
        }
        Runnable task = () -> {
            for (GeneratedEventListener listener : listeners) {
                try {
                    listener.onGenerated(definition, event);
                } catch (Exception e) {
                    logger.log(Level.WARNING, "Listener failed for event " + event.id()
                            + " of definition " + definition.id(), e);
                }
            }
        };
        if (listenerExecutor == null) {
            task.run();
            return;
        }
        try {
            listenerExecutor.execute(task);
        } catch (RejectedExecutionException e) {
            logger.log(Level.WARNING, "Listener executor closed; event " + event.id() + " not announced");
        }
    }

    private void recordFailure(String definitionId, Throwable cause, Tally tally) {
        tally.failed.add(definitionId);
        metrics.incrementDefinitionsFailed();
        logger.log(Level.WARNING, "Failed to process definition " + definitionId
                + "; retrying next tick", cause);
    }

    /**
     * Stops the tick schedule, then waits up to the drain timeout for running definitions
     * and pending listener calls.
     */
    @Override
    public synchronized void close() {
        closed = true;
        if (tickTask != null) {
            tickTask.cancel(false);
            tickTask = null;
        }
        if (scheduler != null) {
            scheduler.shutdownNow();
            try {
                scheduler.awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        if (workers != null) {
            workers.close(drainTimeoutMs);
        }
        if (listenerExecutor != null) {
            listenerExecutor.shutdown();
            try {
                if (!listenerExecutor.awaitTermination(drainTimeoutMs, TimeUnit.MILLISECONDS)) {
                    logger.log(Level.WARNING, "Drain timeout exceeded for event listeners; forcing shutdown");
                    listenerExecutor.shutdownNow();
                }
            } catch (InterruptedException e) {
                listenerExecutor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }

    private static final class Tally {
        private final AtomicInteger generated = new AtomicInteger();
        private final AtomicInteger skipped = new AtomicInteger();
        private final List<String> failed = Collections.synchronizedList(new ArrayList<>());

        TickReport toReport() {
            synchronized (failed) {
                return new TickReport(generated.get(), skipped.get(), new ArrayList<>(failed));
            }
        }
    }

    /**
     * Builder for {@link ScheduleProcessor}.
     */
    public static final class Builder {
        private DefinitionStore definitionStore;
        private RecurrenceCalculator calculator;
        private Clock clock;
        private int batchSize = 100;
        private int workerCount = 4;
        private int listenerWorkerCount = 1;
        private Duration definitionTimeout = Duration.ofSeconds(30);
        private Duration tickInterval = Duration.ofHours(1);
        private Duration initialDelay = Duration.ZERO;
        private MetricsExporter metrics;
        private InFlightTracker inFlightTracker;
        private Duration inFlightLease = Duration.ZERO;
        private Supplier<String> idGenerator;
        private final List<GeneratedEventListener> listeners = new ArrayList<>();
        private final List<TickListener> tickListeners = new ArrayList<>();
        private long drainTimeoutMs = 5000;

        private Builder() {
        }

        /**
         * Sets the store holding definitions and generated events.
         *
         * <p><b>Required.</b>
         */
        public Builder definitionStore(DefinitionStore definitionStore) {
            this.definitionStore = definitionStore;
            return this;
        }

        /**
         * Sets the calendar rules. Optional; defaults to {@link RecurrenceCalculator#UTC}.
         */
        public Builder calculator(RecurrenceCalculator calculator) {
            this.calculator = calculator;
            return this;
        }

        /**
         * Clock used for scheduled ticks and event timestamps. Defaults to the UTC system clock.
         */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Sets the page size used when listing due definitions.
         *
         * <p>Optional. Defaults to {@code 100}. Must be &gt; 0.
         */
        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        /**
         * Sets the number of threads processing definitions.
         *
         * <p>Optional. Defaults to {@code 4}. Must be &ge; 0; {@code 0} processes inline on the
         * ticking thread without enforcing the per-definition timeout.
         */
        public Builder workerCount(int workerCount) {
            this.workerCount = workerCount;
            return this;
        }

        /**
         * Sets the number of threads invoking {@link GeneratedEventListener}s.
         *
         * <p>Optional. Defaults to {@code 1}. {@code 0} invokes listeners inline right after
         * each claim.
         */
        public Builder listenerWorkerCount(int listenerWorkerCount) {
            this.listenerWorkerCount = listenerWorkerCount;
            return this;
        }

        /**
         * Maximum running time for one definition in one tick. Defaults to 30 seconds.
         */
        public Builder definitionTimeout(Duration definitionTimeout) {
            this.definitionTimeout = definitionTimeout;
            return this;
        }

        /**
         * Delay between the end of one scheduled tick and the start of the next.
         * Defaults to 1 hour.
         */
        public Builder tickInterval(Duration tickInterval) {
            this.tickInterval = tickInterval;
            return this;
        }

        /** Delay before the first scheduled tick. Defaults to zero. */
        public Builder initialDelay(Duration initialDelay) {
            this.initialDelay = initialDelay;
            return this;
        }

        public Builder metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * Optional. Defaults to a {@link DefaultInFlightTracker} using {@link #inFlightLease}.
         */
        public Builder inFlightTracker(InFlightTracker inFlightTracker) {
            this.inFlightTracker = inFlightTracker;
            return this;
        }

        /**
         * How long the default tracker honours an acquisition before another tick may take
         * the definition over, measured on {@link #clock}. Defaults to {@link Duration#ZERO},
         * which never expires. Ignored when {@link #inFlightTracker} is set.
         *
         * <p>Set it above {@code definitionTimeout} so a worker that ignores cancellation
         * does not hold its definition forever.
         */
        public Builder inFlightLease(Duration inFlightLease) {
            this.inFlightLease = inFlightLease;
            return this;
        }

        /** Supplies generated event ids. Defaults to random UUIDs. */
        public Builder idGenerator(Supplier<String> idGenerator) {
            this.idGenerator = idGenerator;
            return this;
        }

        public Builder listener(GeneratedEventListener listener) {
            this.listeners.add(Objects.requireNonNull(listener, "listener"));
            return this;
        }

        public Builder tickListener(TickListener tickListener) {
            this.tickListeners.add(Objects.requireNonNull(tickListener, "tickListener"));
            return this;
        }

        public Builder drainTimeoutMs(long drainTimeoutMs) {
            this.drainTimeoutMs = drainTimeoutMs;
            return this;
        }

        /**
         * Builds the processor. Call {@link ScheduleProcessor#start()} to begin ticking.
         *
         * @throws NullPointerException     if {@code definitionStore} is null
         * @throws IllegalArgumentException if a size is out of range or a duration is not positive
         */
        public ScheduleProcessor build() {
            return new ScheduleProcessor(this);
        }
    }
}
