package qamonitor.monitor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Owns the timers of one monitoring session.
 *
 * <p>Acquired by {@link SessionLifecycle#start()} and closed by
 * {@link SessionLifecycle#stop()}; closing cancels every task scheduled through it.
 * Tasks run with fixed delay, so a task never overlaps itself, and a task that
 * throws is logged instead of being silently unscheduled by the executor.
 *
 * <p>A task already running when the scheduler closes is allowed to finish; its
 * late results are dropped by the monitoring state's epoch check.
 */
public class SessionScheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SessionScheduler.class);

    private final ScheduledExecutorService executor;
    private final List<ScheduledFuture<?>> tasks = new ArrayList<>();
    private boolean closed = false;

    public SessionScheduler(ScheduledExecutorService executor) {
        this.executor = executor;
    }

    /** Two daemon threads so a slow backend call never holds up the playback clock. */
    public static SessionScheduler create(String name) {
        AtomicInteger n = new AtomicInteger();
        ScheduledExecutorService executor = Executors.newScheduledThreadPool(2, r -> {
            Thread t = new Thread(r, name + "-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        return new SessionScheduler(executor);
    }

    /**
     * Runs {@code task} repeatedly until cancelled or until this scheduler closes.
     *
     * @throws MonitoringException if the scheduler was already closed
     */
    public synchronized ScheduledFuture<?> repeat(String taskName, Runnable task,
                                                  long initialDelayMs, long periodMs) {
        if (closed) {
            throw new MonitoringException("SessionScheduler closed — cannot schedule '" + taskName + "'");
        }
        ScheduledFuture<?> future = executor.scheduleWithFixedDelay(() -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                log.error("Scheduled task '{}' failed", taskName, e);
            }
        }, initialDelayMs, periodMs, TimeUnit.MILLISECONDS);
        tasks.add(future);
        log.debug("Scheduled '{}' every {} ms", taskName, periodMs);
        return future;
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    /** Cancels all tasks and shuts the executor down. Idempotent. */
    @Override
    public synchronized void close() {
        if (closed) return;
        closed = true;
        for (ScheduledFuture<?> f : tasks) {
            f.cancel(false);
        }
        tasks.clear();
        executor.shutdown();
        log.debug("SessionScheduler closed");
    }
}
