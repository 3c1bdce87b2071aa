package queuectl.worker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Optional;

/**
 * {@link ProcessControl} over {@link ProcessHandle}. On POSIX systems {@link ProcessHandle#destroy()}
 * delivers SIGTERM, which runs the worker JVM's shutdown hook.
 */
public class OsProcessControl implements ProcessControl {

    private static final Logger log = LoggerFactory.getLogger(OsProcessControl.class);

    @Override
    public boolean isAlive(long pid) {
        return ProcessHandle.of(pid).map(ProcessHandle::isAlive).orElse(false);
    }

    @Override
    public Optional<Instant> startInstant(long pid) {
        return ProcessHandle.of(pid).flatMap(handle -> handle.info().startInstant());
    }

    @Override
    public boolean requestTermination(long pid) {
        return ProcessHandle.of(pid)
            .map(handle -> {
                try {
                    return handle.destroy();
                } catch (IllegalStateException | SecurityException e) {
                    log.warn("Cannot signal worker process {}: {}", pid, e.getMessage());
                    return false;
                }
            })
            .orElse(false);
    }
}
