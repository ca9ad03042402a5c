package fun.fengwk.snow.core.service.browser.runtime;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A fixed set of browser workers that lives for one unit of work.
 *
 * <p>Tasks are spread round-robin, so up to {@link #size()} tasks run in parallel. Closing the
 * session closes every worker even if some of them failed.
 *
 * @author fengwk
 */
public class BrowserSession implements AutoCloseable {

    private final List<BrowserWorker> workers;
    private final AtomicInteger cursor = new AtomicInteger();

    public BrowserSession(List<BrowserWorker> workers) {
        if (workers == null || workers.isEmpty()) {
            throw new IllegalArgumentException("browser session needs at least one worker");
        }
        this.workers = List.copyOf(workers);
    }

    public int size() {
        return workers.size();
    }

    public <T> CompletableFuture<T> submit(BrowserTask<T> task) {
        BrowserWorker worker = workers.get(Math.floorMod(cursor.getAndIncrement(), workers.size()));
        return worker.submit(task);
    }

    @Override
    public void close() {
        for (BrowserWorker worker : workers) {
            worker.close();
        }
    }

}
