package queuectl.worker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import queuectl.Job;
import queuectl.JobState;
import queuectl.JobStore;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Single-threaded poll, claim, execute loop.
 *
 * <p>The shutdown signal is only looked at between polls. A command that has started always runs to
 * completion or to its timeout. No job failure or store error ends the loop.
 */
public class JobWorker implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(JobWorker.class);

    static final int MAX_ERROR_LENGTH = 4000;

    private final String id;
    private final JobStore store;
    private final CommandExecutor executor;
    private final RetryPolicy retryPolicy;
    private final ShutdownSignal shutdown;
    private final Duration jobTimeout;
    private final Duration pollInterval;
    private final Clock clock;

    public JobWorker(int ordinal,
                     JobStore store,
                     CommandExecutor executor,
                     RetryPolicy retryPolicy,
                     ShutdownSignal shutdown,
                     Duration jobTimeout,
                     Duration pollInterval,
                     Clock clock) {
        this.id = "worker-" + ordinal;
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy must not be null");
        this.shutdown = Objects.requireNonNull(shutdown, "shutdown must not be null");
        this.jobTimeout = Objects.requireNonNull(jobTimeout, "jobTimeout must not be null");
        this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public String id() {
        return id;
    }

    @Override
    public void run() {
        log.info("Worker {} starting.", id);

        while (!shutdown.isRequested()) {
            if (runOnce()) {
                continue;
            }
            try {
                shutdown.await(pollInterval);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                shutdown.request();
            }
        }
        log.info("Worker {} shutting down.", id);
    }

    /**
     * Claims and processes at most one job.
     *
     * @return whether a job was claimed
     */
    public boolean runOnce() {
        Job job;
        try {
            job = store.claimNext();
        } catch (RuntimeException e) {
            log.error("Worker {} could not claim a job", id, e);
            return false;
        }
        if (job == null) {
            return false;
        }
        log.info("Worker {} processing job: {} (attempt {} of {})", id, job.id(), job.attempts() + 1, job.retryLimit());
        executeJob(job);
        return true;
    }

    private void executeJob(Job job) {
        CommandResult result;
        try {
            result = executor.execute(job.command(), jobTimeout);
        } catch (CommandExecutionException | RuntimeException e) {
            log.warn("Job {} failed with an unexpected error: {}", job.id(), e.getMessage());
            handleFailedJob(job, "Worker exception: " + e.getMessage());
            return;
        }

        if (result.succeeded()) {
            if (!result.stdout().isEmpty()) {
                log.debug("Job {} output: {}", job.id(), result.stdout());
            }
            try {
                store.updateStatus(job.id(), JobState.COMPLETED);
                log.info("Worker {} completed job: {} in {} ms", id, job.id(), result.elapsed().toMillis());
            } catch (RuntimeException e) {
                log.error("Job {} succeeded but could not be marked completed; it stays in processing", job.id(), e);
            }
        } else if (result.timedOut()) {
            log.warn("Job {} timed out.", job.id());
            handleFailedJob(job, "Timed out after " + jobTimeout.toSeconds() + "s");
        } else {
            log.warn("Job {} failed with exit code {}.", job.id(), result.exitCode());
            String error = "Exit code: " + result.exitCode();
            if (!result.stderr().isEmpty()) {
                error += "\nStderr: " + result.stderr();
            }
            handleFailedJob(job, error);
        }
    }

    private void handleFailedJob(Job job, String error) {
        int newAttempts = job.attempts() + 1;
        String lastError = truncate(error);
        try {
            RetryDecision decision = retryPolicy.decide(newAttempts, job.retryLimit());
            if (decision.isExhausted()) {
                store.updateStatus(job.id(), JobState.DEAD, newAttempts, null, lastError);
                log.warn("Worker {} moved job to DLQ: {} after {} attempts", id, job.id(), newAttempts);
            } else {
                Instant nextRunAt = clock.instant().plus(decision.delay());
                store.updateStatus(job.id(), JobState.PENDING, newAttempts, nextRunAt, lastError);
                log.info("Worker {} failed job: {}. Retrying in {}s (attempt {}).",
                    id, job.id(), decision.delay().toSeconds(), newAttempts);
            }
        } catch (RuntimeException e) {
            log.error("Could not record failure of job {}; it stays in processing", job.id(), e);
        }
    }

    private static String truncate(String s) {
        return s.length() <= MAX_ERROR_LENGTH ? s : s.substring(0, MAX_ERROR_LENGTH);
    }
}
