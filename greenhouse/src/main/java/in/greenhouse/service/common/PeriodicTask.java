package in.greenhouse.service.common;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Background worker running one tick at a fixed rate on its own daemon thread.
 *
 * Ticks never overlap. A tick that overruns the interval delays the next one, which then
 * starts immediately, so the cadence does not drift by the cost of each tick.
 *
 * A tick that throws is logged and reported to the failure listener; the next tick
 * still runs. {@link #stop()} cancels future ticks and waits briefly for a running
 * tick to finish. The task can be started again after a stop.
 */
public final class PeriodicTask {
    private static final Logger log = LoggerFactory.getLogger(PeriodicTask.class);

    private final String name;
    private final Duration interval;
    private final Duration initialDelay;
    private final Runnable tick;
    private final Consumer<Exception> failureListener;

    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> future;
    private volatile boolean running = false;
    private volatile long ticks = 0;
    private volatile long failures = 0;

    public PeriodicTask(String name, Duration interval, Runnable tick) {
        this(name, interval, Duration.ZERO, tick, e -> {});
    }

    public PeriodicTask(String name, Duration interval, Duration initialDelay,
                        Runnable tick, Consumer<Exception> failureListener) {
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("Interval must be positive");
        }
        this.name = name;
        this.interval = interval;
        this.initialDelay = initialDelay;
        this.tick = tick;
        this.failureListener = failureListener;
    }

    /**
     * @return false when already running
     */
    public synchronized boolean start() {
        if (running) {
            log.warn("[{}] Already running", name);
            return false;
        }
        running = true;
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, name);
            t.setDaemon(true);
            return t;
        });
        future = scheduler.scheduleAtFixedRate(this::runTick,
            initialDelay.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("[{}] Started: interval={}s", name, interval.toSeconds());
        return true;
    }

    /**
     * @return false when it was not running
     */
    public synchronized boolean stop() {
        if (!running) {
            return false;
        }
        running = false;
        if (future != null) {
            future.cancel(false);
            future = null;
        }
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("[{}] Stopped after {} ticks ({} failed)", name, ticks, failures);
        return true;
    }

    private void runTick() {
        if (!running) {
            return;
        }
        ticks++;
        try {
            tick.run();
        } catch (Exception e) {
            failures++;
            log.error("[{}] Tick failed: {}", name, e.getMessage(), e);
            failureListener.accept(e);
        }
    }

    public boolean isRunning() {
        return running;
    }

    public long getTicks() {
        return ticks;
    }

    public long getFailures() {
        return failures;
    }

    public String getName() {
        return name;
    }
}
