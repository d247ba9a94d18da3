package dev.univer.feedback.album;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiConsumer;

/**
 * Runs named fire-and-forget jobs on a pool of worker threads.
 * <p>
 * {@link #spawn} never waits for the job. Failures escaping a job go to the error handler
 * instead of the caller. {@link #close} stops accepting jobs and waits for the running ones.
 */
@Slf4j
public class JobScheduler {

    @FunctionalInterface
    public interface Job {
        void run() throws Exception;
    }

    private final String name;
    private final ExecutorService executor;
    private final BiConsumer<String, Throwable> errorHandler;
    private final AtomicInteger active = new AtomicInteger();

    public JobScheduler(String name, BiConsumer<String, Throwable> errorHandler) {
        this.name = name;
        this.errorHandler = errorHandler;
        AtomicInteger threadNo = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, name + "-" + threadNo.incrementAndGet());
            t.setDaemon(false);
            return t;
        });
    }

    public void spawn(String jobName, Job job) {
        active.incrementAndGet();
        try {
            executor.execute(() -> run(jobName, job));
        } catch (RejectedExecutionException e) {
            active.decrementAndGet();
            throw new IllegalStateException("Scheduler " + name + " is closed", e);
        }
    }

    private void run(String jobName, Job job) {
        try {
            job.run();
        } catch (Throwable e) {
            errorHandler.accept(jobName, e);
        } finally {
            active.decrementAndGet();
        }
    }

    public int activeCount() {
        return active.get();
    }

    public boolean isClosed() {
        return executor.isShutdown();
    }

    /**
     * Blocks until every spawned job has finished. If the waiting thread is interrupted the
     * jobs are interrupted too and the interrupt flag is restored.
     */
    public void close() {
        executor.shutdown();
        try {
            while (!executor.awaitTermination(1, TimeUnit.MINUTES)) {
                log.info("Scheduler {} still waits for {} jobs", name, active.get());
            }
        } catch (InterruptedException e) {
            log.warn("Scheduler {} interrupted while closing, cancelling {} jobs", name, active.get());
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
