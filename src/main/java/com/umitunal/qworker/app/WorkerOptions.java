package com.umitunal.qworker.app;

import com.umitunal.qworker.config.StorageConfig;
import com.umitunal.qworker.config.WorkerConfig;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.Properties;

/**
 * Command-line and file configuration for the worker process.
 *
 * <p>Defaults come from {@code qworker.properties} on the classpath; each
 * {@code --key=value} flag overrides the property of the same key.
 */
public class WorkerOptions {
    static final String DEFAULTS_RESOURCE = "/qworker.properties";

    static final String MAX_JOBS = "max-jobs";
    static final String MAX_TIME = "max-time";
    static final String SLEEP = "sleep";
    static final String POP_TIMEOUT = "pop-timeout";
    static final String DATA_DIR = "data-dir";
    static final String WORKER_ID = "worker-id";
    static final String RECOVER_AFTER = "recover-after";
    static final String SHUTDOWN_GRACE = "shutdown-grace";
    static final String DURABLE_WRITES = "durable-writes";

    private static final String[] KEYS = {
        MAX_JOBS, MAX_TIME, SLEEP, POP_TIMEOUT, DATA_DIR, WORKER_ID, RECOVER_AFTER, SHUTDOWN_GRACE, DURABLE_WRITES
    };

    private final int maxJobs;
    private final long maxTimeSeconds;
    private final long sleepSeconds;
    private final long popTimeoutSeconds;
    private final String dataDirectory;
    private final String workerId;
    private final long recoverAfterSeconds;
    private final long shutdownGraceSeconds;
    private final boolean durableWrites;
    private final boolean help;

    private WorkerOptions(Properties props, boolean help) {
        this.maxJobs = (int) nonNegative(props, MAX_JOBS, 0);
        this.maxTimeSeconds = nonNegative(props, MAX_TIME, 0);
        this.sleepSeconds = nonNegative(props, SLEEP, 3);
        this.popTimeoutSeconds = nonNegative(props, POP_TIMEOUT, 1);
        this.recoverAfterSeconds = nonNegative(props, RECOVER_AFTER, 0);
        this.shutdownGraceSeconds = nonNegative(props, SHUTDOWN_GRACE, 300);
        this.dataDirectory = props.getProperty(DATA_DIR, "data/queue");
        this.durableWrites = Boolean.parseBoolean(props.getProperty(DURABLE_WRITES, "true"));
        String id = props.getProperty(WORKER_ID, "");
        this.workerId = id.isBlank() ? "worker-" + ProcessHandle.current().pid() : id;
        this.help = help;
    }

    /**
     * Parse command-line flags on top of the classpath defaults.
     *
     * @throws IllegalArgumentException on an unknown flag or an invalid value
     */
    public static WorkerOptions parse(String... args) {
        return parse(loadDefaults(), args);
    }

    static WorkerOptions parse(Properties defaults, String... args) {
        Properties props = new Properties();
        props.putAll(defaults);
        boolean help = false;

        for (String arg : args) {
            if (arg.equals("--help") || arg.equals("-h")) {
                help = true;
                continue;
            }
            if (!arg.startsWith("--") || !arg.contains("=")) {
                throw new IllegalArgumentException("Expected --key=value, got: " + arg);
            }
            String key = arg.substring(2, arg.indexOf('='));
            String value = arg.substring(arg.indexOf('=') + 1);
            if (!isKnown(key)) {
                throw new IllegalArgumentException("Unknown option: --" + key);
            }
            props.setProperty(key, value);
        }

        return new WorkerOptions(props, help);
    }

    static Properties loadDefaults() {
        Properties props = new Properties();
        try (InputStream in = WorkerOptions.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in != null) {
                props.load(in);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + DEFAULTS_RESOURCE, e);
        }
        return props;
    }

    public static String usage() {
        return String.join(System.lineSeparator(),
                "Usage: qworker [options]",
                "  --max-jobs=N        stop after N completed jobs (0 = unlimited)",
                "  --max-time=S        stop after S seconds (0 = unlimited)",
                "  --sleep=S           seconds to sleep when the queue is empty",
                "  --pop-timeout=S     seconds a pop waits for a job",
                "  --data-dir=PATH     queue store directory",
                "  --worker-id=ID      worker name used in logs",
                "  --recover-after=S   requeue jobs claimed more than S seconds ago at startup (0 = off)",
                "  --shutdown-grace=S  seconds to wait for the current job on shutdown",
                "  --durable-writes=B  sync every store write (true/false)");
    }

    public WorkerConfig toWorkerConfig() {
        return WorkerConfig.newBuilder(workerId)
                .withMaxJobs(maxJobs)
                .withMaxTime(Duration.ofSeconds(maxTimeSeconds))
                .withSleep(Duration.ofSeconds(sleepSeconds))
                .withPopTimeout(popTimeoutSeconds)
                .build();
    }

    public StorageConfig toStorageConfig() {
        return StorageConfig.newBuilder(dataDirectory)
                .withDurableWrites(durableWrites)
                .build();
    }

    public int getMaxJobs() { return maxJobs; }
    public long getMaxTimeSeconds() { return maxTimeSeconds; }
    public long getSleepSeconds() { return sleepSeconds; }
    public long getPopTimeoutSeconds() { return popTimeoutSeconds; }
    public String getDataDirectory() { return dataDirectory; }
    public String getWorkerId() { return workerId; }
    public long getRecoverAfterSeconds() { return recoverAfterSeconds; }
    public long getShutdownGraceSeconds() { return shutdownGraceSeconds; }
    public boolean isDurableWrites() { return durableWrites; }
    public boolean isHelp() { return help; }

    private static boolean isKnown(String key) {
        for (String known : KEYS) {
            if (known.equals(key)) {
                return true;
            }
        }
        return false;
    }

    private static long nonNegative(Properties props, String key, long defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        long value;
        try {
            value = Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--" + key + " must be a whole number, got: " + raw);
        }
        if (value < 0 || (key.equals(MAX_JOBS) && value > Integer.MAX_VALUE)) {
            throw new IllegalArgumentException("--" + key + " out of range: " + raw);
        }
        return value;
    }
}
