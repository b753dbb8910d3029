package com.umitunal.qworker.worker;

import com.umitunal.qworker.config.WorkerConfig;
import com.umitunal.qworker.core.Job;
import com.umitunal.qworker.core.JobDeserializationException;
import com.umitunal.qworker.core.JobExecutionException;
import com.umitunal.qworker.core.JobResult;
import com.umitunal.qworker.core.QueueStore;
import com.umitunal.qworker.core.QueueStoreException;
import com.umitunal.qworker.core.QueuedJob;
import com.umitunal.qworker.serialization.JobCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A worker that polls the queue store and drives each job to completion,
 * a delayed retry, or permanent failure.
 *
 * <p>The loop is single-threaded and sequential. Scale out by running more
 * workers against the same store; exclusivity comes from {@link QueueStore#pop}.
 * Shutdown is cooperative: {@link #shutdown()} lets the job in progress finish.
 */
public class Worker implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(Worker.class);

    private final QueueStore store;
    private final JobCodec codec;
    private final WorkerConfig config;
    private final Clock clock;

    private final AtomicBoolean shouldQuit = new AtomicBoolean(false);
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final CountDownLatch quitSignal = new CountDownLatch(1);
    private final CountDownLatch stopped = new CountDownLatch(1);
    private final AtomicLong processedCount = new AtomicLong(0);
    private final AtomicLong retriedCount = new AtomicLong(0);
    private final AtomicLong failedCount = new AtomicLong(0);

    private volatile long startTime;

    public Worker(QueueStore store, JobCodec codec, WorkerConfig config) {
        this(store, codec, config, Clock.systemUTC());
    }

    public Worker(QueueStore store, JobCodec codec, WorkerConfig config, Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.config = Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.startTime = clock.millis();
    }

    /**
     * Run the polling loop on the calling thread until a stop condition is met
     * or {@link #shutdown()} is called.
     */
    @Override
    public void run() {
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("Worker " + config.getWorkerId() + " is already running");
        }
        startTime = clock.millis();

        MDC.put("workerId", config.getWorkerId());
        try {
            log.info("Queue worker started: worker_id={}, max_jobs={}, max_time={}, sleep={}ms",
                    config.getWorkerId(),
                    config.getMaxJobs() == 0 ? "unlimited" : config.getMaxJobs(),
                    config.getMaxTime().isZero() ? "unlimited" : config.getMaxTime().toSeconds() + "s",
                    config.getSleep().toMillis());

            while (!shouldQuit.get()) {
                if (shouldStop()) {
                    break;
                }

                boolean found;
                try {
                    found = runOnce();
                } catch (QueueStoreException e) {
                    log.error("Queue store error, backing off: {}", e.getMessage(), e);
                    found = false;
                }

                if (!found && !shouldQuit.get()) {
                    idle();
                }
            }

            log.info("Queue worker stopped: worker_id={}, processed_jobs={}, retried_jobs={}, failed_jobs={}, runtime={}s",
                    config.getWorkerId(), processedCount.get(), retriedCount.get(), failedCount.get(),
                    String.format("%.2f", elapsedMillis() / 1000.0));
        } finally {
            MDC.remove("workerId");
            running.set(false);
            stopped.countDown();
        }
    }

    /**
     * Pop and resolve at most one job.
     *
     * @return true if a record was found, whatever its outcome
     * @throws QueueStoreException if the store fails
     */
    public boolean runOnce() {
        Optional<QueuedJob> record = store.pop(popTimeoutSeconds());
        if (record.isEmpty()) {
            return false;
        }

        MDC.put("jobId", record.get().getId());
        try {
            process(record.get());
        } finally {
            MDC.remove("jobId");
        }
        return true;
    }

    /**
     * Ask the loop to stop after the current iteration. Safe to call from any thread.
     */
    public void shutdown() {
        if (shouldQuit.compareAndSet(false, true)) {
            log.info("Shutdown signal received: worker_id={}", config.getWorkerId());
            quitSignal.countDown();
        }
    }

    /**
     * Wait for {@link #run()} to return.
     *
     * @return true if the loop stopped within the timeout
     */
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        return stopped.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void process(QueuedJob record) {
        String id = record.getId();
        log.debug("Processing job: job_id={}", id);

        Job job;
        try {
            job = codec.decode(record.getSerializedJob());
        } catch (JobDeserializationException e) {
            // A corrupt record never becomes valid, so it is not retried
            log.error("Failed to deserialize job: job_id={}, error={}", id, e.getMessage());
            store.fail(id, record.getSerializedJob(), "Deserialization failed: " + e.getMessage());
            failedCount.incrementAndGet();
            return;
        }

        int attempt = job.getAttempts() + 1;
        job.setAttempts(attempt);

        log.info("Executing job: job_id={}, job={}, attempt={}/{}", id, job.getName(), attempt, job.getMaxAttempts());

        JobResult result;
        try {
            result = job.handle();
            if (result == null) {
                result = JobResult.retryable("Job returned no result");
            }
        } catch (VirtualMachineError e) {
            throw e;
        } catch (RuntimeException | Error e) {
            result = JobResult.retryable(e);
        }

        if (result.isSuccess()) {
            store.complete(id);
            processedCount.incrementAndGet();
            log.info("Job completed successfully: job_id={}, job={}", id, job.getName());
        } else {
            handleFailure(id, job, JobExecutionException.from(job, result));
        }
    }

    private void handleFailure(String id, Job job, JobExecutionException error) {
        log.warn("Job execution failed: job_id={}, job={}, attempt={}, error={}",
                id, job.getName(), job.getAttempts(), error.getMessage(), error.getCause());

        int attempts = job.getAttempts();
        int maxAttempts = job.getMaxAttempts();

        // retry() and fail() both take the record out of the processing state
        if (!error.isTerminal() && attempts < maxAttempts) {
            long delay = job.getRetryDelay();
            log.info("Retrying job: job_id={}, job={}, attempt={}, max_attempts={}, retry_delay={}s",
                    id, job.getName(), attempts, maxAttempts, delay);

            store.retry(id, codec.encode(job), delay);
            retriedCount.incrementAndGet();
            return;
        }

        if (error.isTerminal()) {
            log.error("Job failed with a non-retryable error: job_id={}, job={}, attempts={}",
                    id, job.getName(), attempts);
        } else {
            log.error("Job failed after max retries: job_id={}, job={}, attempts={}", id, job.getName(), attempts);
        }

        invokeFailedHook(id, job, error);
        store.fail(id, codec.encode(job), error.getMessage());
        failedCount.incrementAndGet();
    }

    private void invokeFailedHook(String id, Job job, JobExecutionException error) {
        try {
            job.failed(error);
        } catch (VirtualMachineError e) {
            throw e;
        } catch (RuntimeException | Error e) {
            log.error("Failure hook threw, record is still marked failed: job_id={}, job={}, error={}",
                    id, job.getName(), e.getMessage(), e);
        }
    }

    private boolean shouldStop() {
        if (config.getMaxJobs() > 0 && processedCount.get() >= config.getMaxJobs()) {
            log.info("Max jobs reached, stopping worker");
            return true;
        }

        if (!config.getMaxTime().isZero() && elapsedMillis() >= config.getMaxTime().toMillis()) {
            log.info("Max time reached, stopping worker");
            return true;
        }

        return false;
    }

    /**
     * Sleep for the idle interval, cut short by shutdown or by the max-time deadline.
     */
    private void idle() {
        long sleepMs = config.getSleep().toMillis();
        if (!config.getMaxTime().isZero()) {
            sleepMs = Math.min(sleepMs, config.getMaxTime().toMillis() - elapsedMillis());
        }
        if (sleepMs <= 0) {
            return;
        }

        try {
            quitSignal.await(sleepMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            shutdown();
        }
    }

    private long popTimeoutSeconds() {
        long timeout = config.getPopTimeoutSeconds();
        if (!config.getMaxTime().isZero()) {
            long remainingMs = config.getMaxTime().toMillis() - elapsedMillis();
            timeout = Math.max(0, Math.min(timeout, TimeUnit.MILLISECONDS.toSeconds(remainingMs)));
        }
        return timeout;
    }

    private long elapsedMillis() {
        return clock.millis() - startTime;
    }

    public String getWorkerId() { return config.getWorkerId(); }
    public long getProcessedCount() { return processedCount.get(); }
    public long getRetriedCount() { return retriedCount.get(); }
    public long getFailedCount() { return failedCount.get(); }
    public boolean isRunning() { return running.get(); }
}
