package queuectl.worker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * One {@code worker.<pid>.pid} marker file per live worker. The first line holds the worker's ordinal,
 * the second the process start instant. A marker only counts while a process with that id is alive
 * and started at the recorded instant, so a recycled pid never passes for a worker.
 */
public class FileLivenessRegistry implements LivenessRegistry {

    private static final Logger log = LoggerFactory.getLogger(FileLivenessRegistry.class);

    private static final String PREFIX = "worker.";
    private static final String SUFFIX = ".pid";

    private final Path dir;
    private final ProcessControl processControl;

    public FileLivenessRegistry(Path dir, ProcessControl processControl) {
        this.dir = Objects.requireNonNull(dir, "dir must not be null");
        this.processControl = Objects.requireNonNull(processControl, "processControl must not be null");
    }

    @Override
    public void register(long pid, int ordinal) {
        String content = ordinal + processControl.startInstant(pid).map(start -> "\n" + start).orElse("");
        Path tmp = null;
        try {
            Files.createDirectories(dir);
            tmp = Files.createTempFile(dir, "register-", ".tmp");
            Files.writeString(tmp, content, StandardCharsets.UTF_8);
            moveIntoPlace(tmp, markerFile(pid));
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new UncheckedIOException("Cannot register worker " + pid, e);
        }
    }

    @Override
    public void deregister(long pid) {
        try {
            Files.deleteIfExists(markerFile(pid));
        } catch (IOException e) {
            log.warn("Cannot remove liveness marker for worker {}: {}", pid, e.getMessage());
        }
    }

    @Override
    public Set<Long> listAlive() {
        Set<Long> alive = new TreeSet<>();
        scan(alive, new TreeSet<>());
        return Collections.unmodifiableSet(alive);
    }

    @Override
    public Set<Long> pruneStale() {
        Set<Long> pruned = new TreeSet<>();
        scan(new TreeSet<>(), pruned);
        return Collections.unmodifiableSet(pruned);
    }

    private void scan(Set<Long> alive, Set<Long> pruned) {
        if (!Files.isDirectory(dir)) {
            return;
        }
        try (DirectoryStream<Path> markers = Files.newDirectoryStream(dir, PREFIX + "*" + SUFFIX)) {
            for (Path marker : markers) {
                Long pid = parsePid(marker);
                if (pid != null && isLiveWorker(pid, marker)) {
                    alive.add(pid);
                    continue;
                }
                Files.deleteIfExists(marker);
                if (pid != null) {
                    pruned.add(pid);
                    log.debug("Pruned stale liveness marker for worker {}", pid);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot scan liveness registry " + dir, e);
        }
    }

    private boolean isLiveWorker(long pid, Path marker) throws IOException {
        if (!processControl.isAlive(pid)) {
            return false;
        }
        List<String> lines;
        try {
            lines = Files.readAllLines(marker, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            return false;
        }
        Optional<Instant> actual = processControl.startInstant(pid);
        if (lines.size() < 2 || lines.get(1).isBlank()) {
            // Written where start instants are not reported; the pid is all there is to go on.
            return actual.isEmpty();
        }
        try {
            Instant recorded = Instant.parse(lines.get(1).trim());
            return actual.map(recorded::equals).orElse(false);
        } catch (DateTimeParseException e) {
            log.debug("Ignoring liveness marker {} with unreadable start instant", marker.getFileName());
            return false;
        }
    }

    private Path markerFile(long pid) {
        return dir.resolve(PREFIX + pid + SUFFIX);
    }

    private static void moveIntoPlace(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.debug("Cannot remove temporary file {}", file, e);
        }
    }

    private static Long parsePid(Path marker) {
        String name = marker.getFileName().toString();
        String digits = name.substring(PREFIX.length(), name.length() - SUFFIX.length());
        try {
            return Long.parseLong(digits);
        } catch (NumberFormatException e) {
            log.debug("Ignoring malformed liveness marker {}", name);
            return null;
        }
    }
}
