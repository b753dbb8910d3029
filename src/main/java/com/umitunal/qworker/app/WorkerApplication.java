package com.umitunal.qworker.app;

import com.umitunal.qworker.core.QueueStore;
import com.umitunal.qworker.core.QueueStoreException;
import com.umitunal.qworker.registry.JobRegistry;
import com.umitunal.qworker.serialization.JobCodec;
import com.umitunal.qworker.storage.RocksQueueStore;
import com.umitunal.qworker.worker.Worker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Worker process entry point.
 *
 * <p>Job types are contributed by {@link com.umitunal.qworker.registry.JobModule}
 * service providers on the classpath. A termination signal stops the loop
 * after the current job; the process then exits with status 0.
 */
public final class WorkerApplication {
    private static final Logger log = LoggerFactory.getLogger(WorkerApplication.class);

    static final int EXIT_OK = 0;
    static final int EXIT_ERROR = 1;
    static final int EXIT_USAGE = 2;

    private WorkerApplication() {}

    public static void main(String[] args) {
        int status = run(args);
        if (status != EXIT_OK) {
            System.exit(status);
        }
    }

    static int run(String... args) {
        WorkerOptions options;
        try {
            options = WorkerOptions.parse(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println(WorkerOptions.usage());
            return EXIT_USAGE;
        }
        if (options.isHelp()) {
            System.out.println(WorkerOptions.usage());
            return EXIT_OK;
        }

        JobRegistry registry = JobRegistry.fromModules(WorkerApplication.class.getClassLoader());
        if (registry.names().isEmpty()) {
            log.warn("No job modules registered, every popped record will fail to deserialize");
        } else {
            log.info("Registered job types: {}", registry.names());
        }

        try {
            Files.createDirectories(Paths.get(options.getDataDirectory()));
        } catch (IOException e) {
            log.error("Cannot create data directory {}: {}", options.getDataDirectory(), e.getMessage());
            return EXIT_ERROR;
        }

        CountDownLatch storeClosed = new CountDownLatch(1);
        try (QueueStore store = new RocksQueueStore(options.toStorageConfig())) {
            return runWorker(store, registry, options, storeClosed);
        } catch (QueueStoreException e) {
            log.error("Queue store failure: {}", e.getMessage(), e);
            return EXIT_ERROR;
        } finally {
            storeClosed.countDown();
        }
    }

    /**
     * Run the worker loop against an open store.
     *
     * @param storeClosed released by the caller once the store is closed; the
     *                    shutdown hook holds the JVM until then
     */
    static int runWorker(QueueStore store, JobRegistry registry, WorkerOptions options, CountDownLatch storeClosed) {
        if (options.getRecoverAfterSeconds() > 0) {
            long recovered = store.recoverAbandoned(options.getRecoverAfterSeconds());
            log.info("Recovered abandoned jobs: count={}, older_than={}s", recovered, options.getRecoverAfterSeconds());
        }

        Worker worker = new Worker(store, new JobCodec(registry), options.toWorkerConfig());
        Duration grace = Duration.ofSeconds(options.getShutdownGraceSeconds());

        Thread shutdownHook = shutdownHook(worker, storeClosed, grace);
        Runtime.getRuntime().addShutdownHook(shutdownHook);

        try {
            worker.run();
        } finally {
            removeShutdownHook(shutdownHook);
        }
        return EXIT_OK;
    }

    /**
     * Hook that stops the worker and waits, up to the grace period in total,
     * for the loop to finish and the store to be closed.
     */
    static Thread shutdownHook(Worker worker, CountDownLatch storeClosed, Duration grace) {
        return new Thread(() -> {
            long deadline = System.nanoTime() + grace.toNanos();
            worker.shutdown();
            try {
                if (!worker.awaitTermination(grace)) {
                    log.warn("Worker did not stop within {}s", grace.toSeconds());
                    return;
                }
                long remaining = deadline - System.nanoTime();
                if (!storeClosed.await(Math.max(0, remaining), TimeUnit.NANOSECONDS)) {
                    log.warn("Queue store was not closed within {}s", grace.toSeconds());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "qworker-shutdown");
    }

    private static void removeShutdownHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            log.debug("JVM is shutting down, hook stays registered");
        }
    }
}
