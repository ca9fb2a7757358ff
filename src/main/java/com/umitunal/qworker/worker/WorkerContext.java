package com.umitunal.qworker.worker;

import com.umitunal.qworker.config.WorkerConfig;
import com.umitunal.qworker.core.QueueClientFactory;
import com.umitunal.qworker.quarantine.ErrorQuarantine;
import com.umitunal.qworker.registry.WorkerRegistry;

import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Process-scoped collaborators handed to every worker.
 *
 * Created at startup; {@link #close()} tears down the timer thread if this
 * context created it.
 */
public class WorkerContext implements AutoCloseable {
    private final WorkerRegistry registry;
    private final WorkerConfig config;
    private final ErrorQuarantine quarantine;
    private final QueueClientFactory clientFactory;
    private final Sleeper sleeper;
    private final ScheduledExecutorService providedScheduler;

    private ScheduledExecutorService ownedScheduler;

    private WorkerContext(Builder builder) {
        this.registry = builder.registry;
        this.config = builder.config;
        this.quarantine = builder.quarantine != null
                ? builder.quarantine
                : new ErrorQuarantine(builder.config.getQuarantineDirectory());
        this.clientFactory = builder.clientFactory;
        this.sleeper = builder.sleeper;
        this.providedScheduler = builder.timerScheduler;
    }

    public WorkerRegistry getRegistry() { return registry; }
    public WorkerConfig getConfig() { return config; }
    public ErrorQuarantine getQuarantine() { return quarantine; }
    public QueueClientFactory getClientFactory() { return clientFactory; }
    public Sleeper getSleeper() { return sleeper; }

    /**
     * Scheduler running aggregation timers. Without one supplied, a single
     * daemon thread is started on first use.
     */
    public synchronized ScheduledExecutorService getTimerScheduler() {
        if (providedScheduler != null) {
            return providedScheduler;
        }
        if (ownedScheduler == null) {
            AtomicInteger counter = new AtomicInteger(1);
            ownedScheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
                Thread thread = new Thread(runnable, "qworker-timer-" + counter.getAndIncrement());
                thread.setDaemon(true);
                return thread;
            });
        }
        return ownedScheduler;
    }

    @Override
    public synchronized void close() {
        if (ownedScheduler != null) {
            ownedScheduler.shutdownNow();
            try {
                ownedScheduler.awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            ownedScheduler = null;
        }
    }

    public static Builder newBuilder(WorkerRegistry registry) {
        return new Builder(registry);
    }

    public static class Builder {
        private final WorkerRegistry registry;
        private WorkerConfig config = WorkerConfig.newBuilder().build();
        private ErrorQuarantine quarantine;
        private QueueClientFactory clientFactory;
        private Sleeper sleeper = Sleeper.THREAD_SLEEP;
        private ScheduledExecutorService timerScheduler;

        private Builder(WorkerRegistry registry) {
            this.registry = Objects.requireNonNull(registry, "registry");
        }

        public Builder withConfig(WorkerConfig config) {
            this.config = Objects.requireNonNull(config, "config");
            return this;
        }

        /**
         * Default: a quarantine writing to the configured quarantine directory.
         */
        public Builder withQuarantine(ErrorQuarantine quarantine) {
            this.quarantine = quarantine;
            return this;
        }

        public Builder withClientFactory(QueueClientFactory clientFactory) {
            this.clientFactory = clientFactory;
            return this;
        }

        public Builder withSleeper(Sleeper sleeper) {
            this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
            return this;
        }

        public Builder withTimerScheduler(ScheduledExecutorService scheduler) {
            this.timerScheduler = scheduler;
            return this;
        }

        public WorkerContext build() {
            return new WorkerContext(this);
        }
    }
}
