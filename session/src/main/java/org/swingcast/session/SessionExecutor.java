package org.swingcast.session;

import java.time.Duration;

/**
 * The single serialization point for negotiation state. Tasks run one at a time in
 * submission order; delayed tasks run after their delay, relative to the same queue.
 */
public interface SessionExecutor {

    interface ScheduledTask {
        void cancel();
    }

    void execute(Runnable task);

    ScheduledTask schedule(Runnable task, Duration delay);

    ScheduledTask scheduleAtFixedRate(Runnable task, Duration initialDelay, Duration period);

    void shutdown();
}
