package fun.fengwk.snow.core.service.browser.runtime;

import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.Page;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Browser worker bound to one dedicated thread.
 *
 * <p>The engine is launched lazily on the worker thread by the first task and every later playwright
 * call, close included, runs on that same thread. Tasks of one worker execute sequentially, each
 * in a fresh browser context. Close is idempotent.
 *
 * @author fengwk
 */
@Slf4j
public class BrowserWorker implements AutoCloseable {

    private final int workerId;
    private final BrowserEngineFactory engineFactory;
    private final long closeTimeoutMs;
    private final ExecutorService executor;
    private BrowserEngine engine;
    private volatile boolean closed = false;

    public BrowserWorker(int workerId, BrowserEngineFactory engineFactory, long closeTimeoutMs) {
        this.workerId = workerId;
        this.engineFactory = engineFactory;
        this.closeTimeoutMs = closeTimeoutMs;
        this.executor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "snow-browser-worker-" + workerId);
            thread.setDaemon(true);
            return thread;
        });
    }

    public int getWorkerId() {
        return workerId;
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Queue a task on the worker thread, failures complete the future exceptionally.
     */
    public <T> CompletableFuture<T> submit(BrowserTask<T> task) {
        CompletableFuture<T> future = new CompletableFuture<>();
        if (closed) {
            future.completeExceptionally(new IllegalStateException("worker is closed"));
            return future;
        }
        try {
            executor.execute(() -> {
                try {
                    future.complete(runTask(task));
                } catch (Throwable ex) {
                    future.completeExceptionally(ex);
                }
            });
        } catch (RejectedExecutionException ex) {
            future.completeExceptionally(new IllegalStateException("worker is closed", ex));
        }
        return future;
    }

    private <T> T runTask(BrowserTask<T> task) throws Exception {
        if (closed) {
            throw new IllegalStateException("worker is closed");
        }
        if (engine == null) {
            engine = engineFactory.create();
            log.debug("browser engine launched, workerId={}", workerId);
        }

        BrowserContext browserContext = engine.newContext();
        try {
            Page page = browserContext.newPage();
            BrowserRuntimeContext runtimeContext = BrowserRuntimeContext.builder()
                .workerId(workerId)
                .page(page)
                .build();
            return task.execute(runtimeContext);
        } finally {
            closeContext(browserContext);
        }
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;

        try {
            Future<?> closing = executor.submit(this::closeEngine);
            closing.get(closeTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException ex) {
            log.debug("worker executor already shut down, workerId={}", workerId);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            log.warn("interrupted while closing browser worker, workerId={}", workerId);
        } catch (TimeoutException ex) {
            log.warn("timed out closing browser worker, workerId={}, timeoutMs={}", workerId, closeTimeoutMs);
        } catch (Exception ex) {
            log.warn("failed to close browser worker, workerId={}", workerId, ex);
        } finally {
            executor.shutdownNow();
        }
    }

    private void closeEngine() {
        if (engine == null) {
            return;
        }
        try {
            engine.close();
        } catch (Exception ex) {
            if (isExpectedCloseException(ex)) {
                log.debug("browser already closed, workerId={}, skip close", workerId);
            } else {
                log.warn("failed to close browser engine, workerId={}", workerId, ex);
            }
        } finally {
            engine = null;
        }
    }

    private void closeContext(BrowserContext browserContext) {
        try {
            browserContext.close();
        } catch (Exception ex) {
            if (isExpectedCloseException(ex)) {
                log.debug("browser context already closed, workerId={}, skip close", workerId);
            } else {
                log.warn("failed to close browser context, workerId={}", workerId, ex);
            }
        }
    }

    private boolean isExpectedCloseException(Exception ex) {
        String message = ex.getMessage() == null ? "" : ex.getMessage().toLowerCase();
        String exceptionName = ex.getClass().getSimpleName();
        return "TargetClosedError".equals(exceptionName)
            || message.contains("target page, context or browser has been closed")
            || message.contains("channel has been closed")
            || message.contains("connection closed");
    }

}
