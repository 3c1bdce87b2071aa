package queuectl.worker;

import java.time.Instant;
import java.util.Optional;

/**
 * Probing and signalling of worker processes by id.
 */
public interface ProcessControl {

    boolean isAlive(long pid);

    /**
     * When the process with this id started, if it exists and the platform reports it.
     * Tells a worker apart from an unrelated process that was later given the same id.
     */
    Optional<Instant> startInstant(long pid);

    /**
     * Asks the process to shut down gracefully. Never force-kills.
     *
     * @return false if the process was already gone or the request could not be delivered
     */
    boolean requestTermination(long pid);
}
