package fun.fengwk.snow.core.service.pipeline;

import java.time.Duration;

/**
 * Fixed pause between rate limited phases.
 *
 * @author fengwk
 */
@FunctionalInterface
public interface PacingSleeper {

    void sleep(Duration duration);

    /**
     * Sleeper blocking the calling thread. An interrupt restores the flag and aborts with
     * {@link IllegalStateException}.
     */
    static PacingSleeper threadSleep() {
        return duration -> {
            if (duration == null || duration.isZero() || duration.isNegative()) {
                return;
            }
            try {
                Thread.sleep(duration.toMillis());
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("pacing interrupted", ex);
            }
        };
    }

}
