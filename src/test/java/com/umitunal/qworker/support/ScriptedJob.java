package com.umitunal.qworker.support;

import com.umitunal.qworker.core.AbstractJob;
import com.umitunal.qworker.core.JobExecutionException;
import com.umitunal.qworker.core.JobResult;
import com.umitunal.qworker.registry.JobFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Test job whose outcome per attempt is decided by a script.
 *
 * <p>Every instance built by the same factory shares one {@link Recorder}, so a
 * test can see attempts across deserializations.
 */
public class ScriptedJob extends AbstractJob {
    public static final String NAME = "scripted";
    public static final String LABEL = "label";

    @FunctionalInterface
    public interface Script {
        JobResult run(int attempt);
    }

    /**
     * Attempts seen by {@link #handle()} and errors passed to {@link #failed}.
     */
    public static class Recorder {
        public final List<Integer> attempts = new CopyOnWriteArrayList<>();
        public final List<JobExecutionException> failures = new CopyOnWriteArrayList<>();
        volatile Consumer<JobExecutionException> failedHook = error -> {};

        public Recorder onFailed(Consumer<JobExecutionException> hook) {
            this.failedHook = hook;
            return this;
        }
    }

    private final Script script;
    private final Recorder recorder;

    public ScriptedJob(Map<String, Object> payload, int maxAttempts, long retryDelay,
                       Script script, Recorder recorder) {
        super(payload, maxAttempts, retryDelay, LABEL);
        this.script = script;
        this.recorder = recorder;
    }

    public static JobFactory factory(int maxAttempts, long retryDelay, Script script, Recorder recorder) {
        return payload -> new ScriptedJob(payload, maxAttempts, retryDelay, script, recorder);
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public JobResult handle() {
        recorder.attempts.add(getAttempts());
        return script.run(getAttempts());
    }

    @Override
    public void failed(JobExecutionException error) {
        recorder.failures.add(error);
        recorder.failedHook.accept(error);
    }
}
