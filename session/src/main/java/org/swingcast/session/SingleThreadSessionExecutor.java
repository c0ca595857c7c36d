package org.swingcast.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/** {@link SessionExecutor} on one named daemon thread. Task failures are logged, never rethrown. */
public final class SingleThreadSessionExecutor implements SessionExecutor {

    private static final Logger log = LoggerFactory.getLogger(SingleThreadSessionExecutor.class);
    private static final ScheduledTask NOT_SCHEDULED = () -> { };

    private final ScheduledExecutorService exec;

    public SingleThreadSessionExecutor(String threadName) {
        this.exec = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, threadName);
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public void execute(Runnable task) {
        try {
            exec.execute(guarded(task));
        } catch (RejectedExecutionException e) {
            log.debug("executor shut down, task dropped");
        }
    }

    @Override
    public ScheduledTask schedule(Runnable task, Duration delay) {
        try {
            ScheduledFuture<?> f = exec.schedule(guarded(task), delay.toMillis(), TimeUnit.MILLISECONDS);
            return () -> f.cancel(false);
        } catch (RejectedExecutionException e) {
            log.debug("executor shut down, delayed task dropped");
            return NOT_SCHEDULED;
        }
    }

    @Override
    public ScheduledTask scheduleAtFixedRate(Runnable task, Duration initialDelay, Duration period) {
        try {
            ScheduledFuture<?> f = exec.scheduleAtFixedRate(guarded(task),
                    initialDelay.toMillis(), period.toMillis(), TimeUnit.MILLISECONDS);
            return () -> f.cancel(false);
        } catch (RejectedExecutionException e) {
            log.debug("executor shut down, periodic task dropped");
            return NOT_SCHEDULED;
        }
    }

    @Override
    public void shutdown() {
        exec.shutdown();
        try {
            if (!exec.awaitTermination(2, TimeUnit.SECONDS)) exec.shutdownNow();
        } catch (InterruptedException e) {
            exec.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static Runnable guarded(Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                log.error("session task failed", e);
            }
        };
    }
}
