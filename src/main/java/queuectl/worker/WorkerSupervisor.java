package queuectl.worker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Starts worker processes and stops them through the liveness registry.
 *
 * <p>Stopping is cooperative: each live worker gets a termination request, then the registry is
 * polled until it is empty or the wait window closes. Nothing is force-killed.
 */
public class WorkerSupervisor {

    private static final Logger log = LoggerFactory.getLogger(WorkerSupervisor.class);

    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(500);
    public static final int DEFAULT_START_POLL_ATTEMPTS = 30;
    public static final int DEFAULT_STOP_POLL_ATTEMPTS = 10;

    private final WorkerLauncher launcher;
    private final LivenessRegistry registry;
    private final ProcessControl processControl;
    private final Duration pollInterval;
    private final int startPollAttempts;
    private final int stopPollAttempts;

    public WorkerSupervisor(WorkerLauncher launcher,
                            LivenessRegistry registry,
                            ProcessControl processControl,
                            Duration pollInterval,
                            int startPollAttempts,
                            int stopPollAttempts) {
        this.launcher = Objects.requireNonNull(launcher, "launcher must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.processControl = Objects.requireNonNull(processControl, "processControl must not be null");
        this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval must not be null");
        this.startPollAttempts = startPollAttempts;
        this.stopPollAttempts = stopPollAttempts;
    }

    public WorkerSupervisor(WorkerLauncher launcher, LivenessRegistry registry, ProcessControl processControl) {
        this(launcher, registry, processControl, DEFAULT_POLL_INTERVAL, DEFAULT_START_POLL_ATTEMPTS, DEFAULT_STOP_POLL_ATTEMPTS);
    }

    /**
     * Launches {@code count} workers with ordinals 1..count, stopping at the first launch failure,
     * then waits until each launched process has registered itself or exited. A process still
     * unregistered when the wait window closes is asked to terminate so it cannot outlive a later stop.
     *
     * @return ids of the workers that registered, in launch order
     */
    public List<Long> start(int count) {
        if (count < 1) {
            throw new IllegalArgumentException("count must be at least 1, got " + count);
        }
        Map<Long, Integer> launched = new LinkedHashMap<>();
        for (int ordinal = 1; ordinal <= count; ordinal++) {
            try {
                launched.put(launcher.launch(ordinal), ordinal);
            } catch (IOException e) {
                log.error("Failed to launch worker {} of {}", ordinal, count, e);
                break;
            }
        }

        Set<Long> registered = awaitRegistration(launched);
        List<Long> started = new ArrayList<>(registered.size());
        for (long pid : launched.keySet()) {
            if (registered.contains(pid)) {
                started.add(pid);
            }
        }
        log.info("Started {} of {} worker(s): {}", started.size(), count, started);
        return Collections.unmodifiableList(started);
    }

    private Set<Long> awaitRegistration(Map<Long, Integer> launched) {
        Set<Long> registered = new HashSet<>();
        Map<Long, Integer> waiting = new LinkedHashMap<>(launched);
        for (int i = 0; !waiting.isEmpty(); i++) {
            Set<Long> alive = registry.listAlive();
            for (Iterator<Map.Entry<Long, Integer>> it = waiting.entrySet().iterator(); it.hasNext(); ) {
                Map.Entry<Long, Integer> entry = it.next();
                if (alive.contains(entry.getKey())) {
                    registered.add(entry.getKey());
                    it.remove();
                } else if (!processControl.isAlive(entry.getKey())) {
                    log.error("Worker {} (PID: {}) exited before registering", entry.getValue(), entry.getKey());
                    it.remove();
                }
            }
            if (waiting.isEmpty() || i >= startPollAttempts) {
                break;
            }
            try {
                Thread.sleep(pollInterval.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }

        waiting.forEach((pid, ordinal) -> {
            log.warn("Worker {} (PID: {}) did not register in time, asking it to terminate", ordinal, pid);
            processControl.requestTermination(pid);
        });
        return registered;
    }

    public Set<Long> activeWorkers() {
        return registry.listAlive();
    }

    public StopResult stop() {
        Set<Long> active = activeWorkers();
        if (active.isEmpty()) {
            return new StopResult(StopResult.Outcome.NOTHING_TO_STOP, Set.of(), Set.of());
        }

        log.info("Stopping {} active worker(s)...", active.size());
        for (long pid : active) {
            if (!processControl.requestTermination(pid)) {
                log.debug("Termination request to worker {} was not delivered", pid);
            }
        }

        Set<Long> remaining = activeWorkers();
        for (int i = 0; i < stopPollAttempts && !remaining.isEmpty(); i++) {
            try {
                Thread.sleep(pollInterval.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            remaining = activeWorkers();
        }

        if (remaining.isEmpty()) {
            log.info("All workers stopped gracefully.");
            return new StopResult(StopResult.Outcome.ALL_STOPPED, Set.copyOf(active), Set.of());
        }
        log.warn("Workers {} did not stop in time.", remaining);
        return new StopResult(StopResult.Outcome.TIMED_OUT, Set.copyOf(active), Set.copyOf(remaining));
    }
}
